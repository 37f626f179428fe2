package com.stmtobfuscator.interfaces.api.dto;

public record ReviewEntityAddedResponse(String id) {}
