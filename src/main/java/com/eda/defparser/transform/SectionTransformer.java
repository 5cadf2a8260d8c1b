package com.eda.defparser.transform;

import java.util.List;

import com.eda.defparser.diagnostics.ParseDiagnostics;
import com.eda.defparser.model.RawSection;

/**
 * Clean, tokenize and format one raw section.
 *
 * Holds no mutable state, so one instance can serve several workers.
 */
public class SectionTransformer<R> {

    private final LineCleaner lineCleaner;
    private final RecordFormatter<R> formatter;
    private final boolean attachRawLines;

    public SectionTransformer(LineCleaner lineCleaner, RecordFormatter<R> formatter, boolean attachRawLines) {
        this.lineCleaner = lineCleaner;
        this.formatter = formatter;
        this.attachRawLines = attachRawLines;
    }

    public R transform(RawSection section, ParseDiagnostics diagnostics) {
        String cleaned = lineCleaner.clean(section.getHeadText());
        List<String> tokens = DefLineTokenizer.split(cleaned);
        R record = formatter.format(tokens, diagnostics);

        if (attachRawLines && section.hasRawContent()) {
            record = formatter.attachRawLines(record, section.getRawContent());
        }
        return record;
    }
}
