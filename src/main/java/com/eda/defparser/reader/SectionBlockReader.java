package com.eda.defparser.reader;

import java.io.IOException;
import java.util.List;

import com.eda.defparser.diagnostics.ParseDiagnostics;
import com.eda.defparser.model.RawSection;

/**
 * Reads a block that runs from its keyword line to a matching END marker and
 * cuts it into one raw section per "-" entry.
 */
public interface SectionBlockReader {

    /**
     * @param reader positioned just after {@code firstLine}
     * @param firstLine the block's opening line, e.g. "COMPONENTS 12 ;"
     * @param prefix the block keyword
     * @return entries in file order; the END marker line is consumed
     */
    List<RawSection> read(DefLineReader reader, String firstLine, String prefix, ParseDiagnostics diagnostics)
            throws IOException;
}
