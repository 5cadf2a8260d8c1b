package com.eda.defparser.transform;

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.eda.defparser.diagnostics.ParseDiagnostics;
import com.eda.defparser.model.NetConnection;

/**
 * Reads "( instName pinName )" groups of a net. Extra words inside the group,
 * such as "+ SYNTHESIZED", are ignored.
 */
final class ConnectionParser {
    private static final Logger log = LoggerFactory.getLogger(ConnectionParser.class);

    private ConnectionParser() {
    }

    static Optional<NetConnection> parse(String netName, String group, ParseDiagnostics diagnostics) {
        String[] parts = Tokens.groupWords(group);
        if (parts.length < 2) {
            log.warn("Invalid connection format {} in net {}", group, netName);
            diagnostics.warn("Invalid connection format " + group + " in net " + netName);
            return Optional.empty();
        }
        return Optional.of(new NetConnection(parts[0], parts[1]));
    }
}
