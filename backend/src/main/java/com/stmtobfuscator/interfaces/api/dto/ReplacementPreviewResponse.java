package com.stmtobfuscator.interfaces.api.dto;

import java.util.Map;

public record ReplacementPreviewResponse(Map<String, String> replacements, int entityCount) {}
