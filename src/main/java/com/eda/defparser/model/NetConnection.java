package com.eda.defparser.model;

import lombok.NonNull;
import lombok.Value;

/**
 * A "( instName pinName )" pair inside a net. The instance name is the literal
 * {@link #EXTERNAL_PIN} for connections to top-level I/O pins.
 */
@Value
public class NetConnection {

    public static final String EXTERNAL_PIN = "PIN";

    @NonNull
    String instanceName;

    @NonNull
    String pinName;

    public boolean isExternalPin() {
        return EXTERNAL_PIN.equals(instanceName);
    }
}
