package com.eda.defparser.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * One entry of the NETS block.
 */
@Value
@Builder(toBuilder = true)
public class NetRecord {

    public static final String UNKNOWN = "UNKNOWN";

    @NonNull
    String netName;

    @Singular
    List<NetConnection> connections;

    @Singular
    List<NetProperty> properties;

    List<String> rawLines;

    /**
     * True for the stand-in produced from a malformed entry.
     */
    boolean placeholder;

    public static NetRecord unknown() {
        return NetRecord.builder().netName(UNKNOWN).placeholder(true).build();
    }

    public NetRecord withRawLines(List<String> lines) {
        return toBuilder().rawLines(lines).build();
    }
}
