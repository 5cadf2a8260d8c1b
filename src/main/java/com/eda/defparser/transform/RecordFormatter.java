package com.eda.defparser.transform;

import java.util.List;

import com.eda.defparser.diagnostics.ParseDiagnostics;

/**
 * Turns the tokens of one DEF entry into a structured record.
 *
 * One implementation is chosen per keyword block when its transformer is built.
 * Implementations must not fail on malformed input: they return a sentinel or
 * partial record and report a warning instead.
 */
public interface RecordFormatter<R> {

    R format(List<String> tokens, ParseDiagnostics diagnostics);

    /**
     * Returns the record with the entry's original file lines attached. Records
     * that do not carry raw lines are returned unchanged.
     */
    default R attachRawLines(R record, List<String> rawLines) {
        return record;
    }
}
