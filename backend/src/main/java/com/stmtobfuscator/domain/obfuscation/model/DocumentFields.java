package com.stmtobfuscator.domain.obfuscation.model;

/**
 * JSON field names of the statement document exchanged with the parser and the renderer.
 */
public final class DocumentFields {

    public static final String FULL_TEXT = "full_text";
    public static final String METADATA = "metadata";
    public static final String TEXT_BLOCKS = "text_blocks";
    public static final String TABLES = "tables";
    public static final String TEXT = "text";
    public static final String HEADERS = "headers";
    public static final String ROWS = "rows";

    // metadata keys written by the obfuscator
    public static final String OBFUSCATED = "obfuscated";
    public static final String OBFUSCATION_TIMESTAMP = "obfuscation_timestamp";
    public static final String ENTITIES_OBFUSCATED = "entities_obfuscated";
    public static final String FINANCIAL_INTEGRITY_VERIFIED = "financial_integrity_verified";
    public static final String ERROR = "error";

    private DocumentFields() {
    }
}
