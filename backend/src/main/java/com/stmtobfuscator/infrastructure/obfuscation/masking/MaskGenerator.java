package com.stmtobfuscator.infrastructure.obfuscation.masking;

/**
 * Produces a format-preserving replacement for one entity's text.
 * Implementations are pure and total: any input, including empty, yields a mask.
 */
@FunctionalInterface
public interface MaskGenerator {

    String mask(String text);
}
