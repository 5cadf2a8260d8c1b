package com.eda.defparser.transform;

/**
 * Trims a single-line statement and drops one trailing ";".
 */
public class TerminatorLineCleaner implements LineCleaner {

    @Override
    public String clean(String line) {
        String cleaned = line.strip();
        if (cleaned.endsWith(STATEMENT_TERMINATOR)) {
            cleaned = cleaned.substring(0, cleaned.length() - STATEMENT_TERMINATOR.length()).strip();
        }
        return cleaned;
    }
}
