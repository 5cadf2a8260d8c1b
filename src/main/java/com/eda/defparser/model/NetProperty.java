package com.eda.defparser.model;

import java.util.Optional;

import lombok.NonNull;
import lombok.Value;

/**
 * A "+ NAME [value]" property of a net, e.g. "+ USE SIGNAL" or "+ SOURCE TEST".
 */
@Value
public class NetProperty {

    @NonNull
    String name;

    String value;

    public Optional<String> findValue() {
        return Optional.ofNullable(value);
    }
}
