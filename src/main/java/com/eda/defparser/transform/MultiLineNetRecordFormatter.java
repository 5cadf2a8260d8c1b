package com.eda.defparser.transform;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.eda.defparser.diagnostics.ParseDiagnostics;
import com.eda.defparser.model.NetProperty;
import com.eda.defparser.model.NetRecord;

/**
 * Formats a NETS entry that may have spanned several lines.
 *
 * <pre>
 * - netName ( compName pinName ) ( PIN pinName ) ...
 *     + USE SIGNAL
 *     + ROUTED metal1 ( 0 0 ) ( 10 0 ) ...
 * </pre>
 *
 * Connections are only read before the first "+" property. Groups after that
 * point belong to the property (routing points, shapes) and are never
 * connections.
 */
public class MultiLineNetRecordFormatter implements RecordFormatter<NetRecord> {
    private static final Logger log = LoggerFactory.getLogger(MultiLineNetRecordFormatter.class);

    @Override
    public NetRecord format(List<String> tokens, ParseDiagnostics diagnostics) {
        if (tokens.size() < 2) {
            log.warn("Invalid net format: {}", tokens);
            diagnostics.warn("Invalid net format: " + tokens);
            return NetRecord.unknown();
        }

        String netName = tokens.get(1);
        NetRecord.NetRecordBuilder builder = NetRecord.builder().netName(netName);

        boolean propertyStart = false;
        int i = 2;
        while (i < tokens.size()) {
            String token = tokens.get(i);

            if (!propertyStart && Tokens.isGroup(token)) {
                ConnectionParser.parse(netName, token, diagnostics).ifPresent(builder::connection);
                i++;
            } else if (Tokens.isKeyword(token)) {
                propertyStart = true;
                String value = null;
                if (i + 1 < tokens.size() && isPropertyValue(tokens.get(i + 1))) {
                    value = tokens.get(i + 1);
                    i += 2;
                } else {
                    i++;
                }
                builder.property(new NetProperty(Tokens.keywordName(token), value));
            } else {
                i++;
            }
        }

        return builder.build();
    }

    @Override
    public NetRecord attachRawLines(NetRecord record, List<String> rawLines) {
        return record.withRawLines(rawLines);
    }

    private static boolean isPropertyValue(String token) {
        return !token.startsWith("+") && !token.startsWith("(");
    }
}
