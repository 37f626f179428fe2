package com.stmtobfuscator.interfaces.api.dto;

public record ErrorResponse(String code, String message) {}
