package com.eda.defparser.transform;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.eda.defparser.diagnostics.ParseDiagnostics;
import com.eda.defparser.model.NetRecord;

/**
 * Formats a single-line NETS entry "- netName ( comp pin ) ( comp pin ) ...".
 * Every group is a connection; properties are not read.
 */
public class SimpleNetRecordFormatter implements RecordFormatter<NetRecord> {
    private static final Logger log = LoggerFactory.getLogger(SimpleNetRecordFormatter.class);

    @Override
    public NetRecord format(List<String> tokens, ParseDiagnostics diagnostics) {
        if (tokens.size() < 2) {
            log.warn("Invalid net format: {}", tokens);
            diagnostics.warn("Invalid net format: " + tokens);
            return NetRecord.unknown();
        }

        String netName = tokens.get(1);
        NetRecord.NetRecordBuilder builder = NetRecord.builder().netName(netName);
        for (String token : tokens.subList(2, tokens.size())) {
            if (token.startsWith("(")) {
                ConnectionParser.parse(netName, token, diagnostics).ifPresent(builder::connection);
            }
        }
        return builder.build();
    }
}
