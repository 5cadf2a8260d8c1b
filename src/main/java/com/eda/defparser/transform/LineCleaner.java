package com.eda.defparser.transform;

/**
 * Normalizes one logical DEF line before tokenizing.
 */
public interface LineCleaner {

    String STATEMENT_TERMINATOR = ";";

    String clean(String line);
}
