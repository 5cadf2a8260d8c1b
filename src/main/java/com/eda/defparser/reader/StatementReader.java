package com.eda.defparser.reader;

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.eda.defparser.diagnostics.ParseDiagnostics;

/**
 * Reads one self-terminating statement, such as "UNITS DISTANCE MICRONS 2000 ;"
 * or "DIEAREA ( 0 0 ) ( 1000 1000 ) ;". Used for header statements and for
 * blocks without an END marker.
 *
 * The statement normally sits on its first line; when that line has no ";"
 * following lines are appended, joined by one space, until one does.
 */
public class StatementReader {
    private static final Logger log = LoggerFactory.getLogger(StatementReader.class);

    public String read(DefLineReader reader, String firstLine, String prefix, ParseDiagnostics diagnostics)
            throws IOException {
        StringBuilder statement = new StringBuilder(firstLine.strip());

        if (!Statements.hasTerminator(firstLine)) {
            String line;
            boolean terminated = false;
            while ((line = reader.readLine()) != null) {
                if (Statements.isSkippable(line)) {
                    continue;
                }
                statement.append(' ').append(line.strip());
                if (Statements.hasTerminator(line)) {
                    terminated = true;
                    break;
                }
            }
            if (!terminated) {
                log.warn("{} statement is not terminated before end of file", prefix);
                diagnostics.warn(prefix + " statement is not terminated before end of file");
            }
        }

        return statement.toString();
    }
}
