package com.stmtobfuscator.interfaces.api.dto;

/**
 * Null fields keep their current value.
 */
public record ReviewEntityUpdateRequest(String type, String text) {}
