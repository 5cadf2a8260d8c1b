package com.eda.defparser.reader;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.eda.defparser.diagnostics.ParseDiagnostics;
import com.eda.defparser.model.RawSection;

/**
 * Block reader for entries that span several lines, as COMPONENTS and NETS
 * usually do:
 *
 * <pre>
 * - n1 ( U1 A ) ( U2 Y )
 *   + USE SIGNAL ;
 * </pre>
 *
 * Statements end at a ";" outside quotes, so one line may close one entry and
 * open the next. Each entry's lines are joined with single spaces into the head
 * text, without the terminator; the original lines are kept as raw content.
 */
public class MultiLineTerminatedBlockReader implements SectionBlockReader {
    private static final Logger log = LoggerFactory.getLogger(MultiLineTerminatedBlockReader.class);

    @Override
    public List<RawSection> read(DefLineReader reader, String firstLine, String prefix, ParseDiagnostics diagnostics)
            throws IOException {
        List<RawSection> sections = new ArrayList<>();
        PendingStatement pending = new PendingStatement();

        String line;
        boolean ended = false;
        while ((line = reader.readLine()) != null) {
            if (pending.isEmpty() && Statements.isEndMarker(line, prefix)) {
                ended = true;
                break;
            }
            if (!pending.isEmpty() && Statements.isEndMarker(line, prefix)) {
                log.warn("{} entry not terminated before END marker at line {}", prefix, reader.getLineNumber());
                diagnostics.warn("Unterminated entry kept at end of " + prefix + " block");
                pending.flushInto(sections);
                ended = true;
                break;
            }
            if (Statements.isSkippable(line)) {
                continue;
            }
            readStatements(line, pending, sections);
        }

        if (!pending.isEmpty()) {
            diagnostics.warn("Unterminated entry kept at end of " + prefix + " block");
            pending.flushInto(sections);
        }
        if (!ended) {
            log.warn("{} block has no END marker", prefix);
            diagnostics.warn(prefix + " block has no END marker");
        }
        log.debug("Read {} entries from {} block", sections.size(), prefix);
        return sections;
    }

    private void readStatements(String line, PendingStatement pending, List<RawSection> sections) {
        int pos = 0;
        while (pos < line.length()) {
            int end = Statements.indexOfTerminator(line, pos);
            String segment = (end >= 0 ? line.substring(pos, end) : line.substring(pos)).strip();

            if (!segment.isEmpty() || !pending.isEmpty()) {
                pending.append(segment, line);
            }
            if (end < 0) {
                return;
            }
            pending.flushInto(sections);
            pos = end + 1;
        }
    }

    /**
     * Text and source lines of the statement being assembled.
     */
    private static final class PendingStatement {
        private final StringBuilder text = new StringBuilder();
        private final List<String> rawLines = new ArrayList<>();
        private boolean entry;

        boolean isEmpty() {
            return text.length() == 0 && rawLines.isEmpty();
        }

        void append(String segment, String sourceLine) {
            if (isEmpty()) {
                entry = Statements.startsEntry(segment);
            }
            if (!segment.isEmpty()) {
                if (text.length() > 0) {
                    text.append(' ');
                }
                text.append(segment);
            }
            // a line holding several statements is recorded once per statement;
            // reference comparison so identical text on separate lines is kept twice
            if (rawLines.isEmpty() || rawLines.get(rawLines.size() - 1) != sourceLine) {
                rawLines.add(sourceLine);
            }
        }

        void flushInto(List<RawSection> sections) {
            if (entry && text.length() > 0) {
                sections.add(RawSection.builder()
                        .headText(text.toString())
                        .rawContent(List.copyOf(rawLines))
                        .build());
            }
            text.setLength(0);
            rawLines.clear();
            entry = false;
        }
    }
}
