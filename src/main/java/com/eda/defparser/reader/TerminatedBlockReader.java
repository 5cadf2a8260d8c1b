package com.eda.defparser.reader;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.eda.defparser.diagnostics.ParseDiagnostics;
import com.eda.defparser.model.RawSection;

/**
 * Block reader for entries whose head fits on one line. The "-" line becomes the
 * head text; the lines after it, up to the entry's ";", are its property lines.
 */
public class TerminatedBlockReader implements SectionBlockReader {
    private static final Logger log = LoggerFactory.getLogger(TerminatedBlockReader.class);

    @Override
    public List<RawSection> read(DefLineReader reader, String firstLine, String prefix, ParseDiagnostics diagnostics)
            throws IOException {
        List<RawSection> sections = new ArrayList<>();
        RawSection.RawSectionBuilder current = null;
        List<String> rawLines = null;

        String line;
        boolean ended = false;
        while ((line = reader.readLine()) != null) {
            if (Statements.isEndMarker(line, prefix)) {
                ended = true;
                break;
            }
            if (Statements.isSkippable(line)) {
                continue;
            }

            String trimmed = line.strip();
            if (Statements.startsEntry(trimmed)) {
                if (current != null) {
                    log.debug("{} entry at line {} starts before the previous one was terminated",
                            prefix, reader.getLineNumber());
                    sections.add(current.rawContent(rawLines).build());
                }
                rawLines = new ArrayList<>();
                rawLines.add(line);
                current = RawSection.builder().headText(trimmed);
            } else if (current != null) {
                rawLines.add(line);
                current.propertyLine(trimmed);
            } else {
                continue;
            }

            if (Statements.hasTerminator(trimmed)) {
                sections.add(current.rawContent(rawLines).build());
                current = null;
                rawLines = null;
            }
        }

        if (current != null) {
            diagnostics.warn("Unterminated entry kept at end of " + prefix + " block");
            sections.add(current.rawContent(rawLines).build());
        }
        if (!ended) {
            log.warn("{} block has no END marker", prefix);
            diagnostics.warn(prefix + " block has no END marker");
        }
        return sections;
    }
}
