package com.eda.defparser.model;

import java.util.List;

import lombok.NonNull;
import lombok.Value;

/**
 * Per-id view of a net in the final dataset. External-pin connections are
 * already filtered out.
 */
@Value
public class NetInfo {
    @NonNull
    String netName;
    @NonNull
    List<NetConnection> connections;
}
