package com.eda.defparser.model;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One entry of the COMPONENTS block: "- instName cellName + FEATURE values ...".
 */
@Value
@Builder(toBuilder = true)
public class ComponentRecord {

    public static final String UNKNOWN = "UNKNOWN";

    @NonNull
    String instanceName;

    @NonNull
    String cellName;

    /**
     * Features in the order they appear in the entry.
     */
    @NonNull
    Map<String, FeatureValue> features;

    /**
     * Null when the entry carries no usable PLACED/FIXED/COVER feature.
     */
    Placement placement;

    List<String> rawLines;

    /**
     * True for the stand-in produced from a malformed entry.
     */
    boolean placeholder;

    public static ComponentRecord unknown() {
        return ComponentRecord.builder()
                .instanceName(UNKNOWN)
                .cellName(UNKNOWN)
                .features(Collections.emptyMap())
                .placeholder(true)
                .build();
    }

    public Optional<Placement> findPlacement() {
        return Optional.ofNullable(placement);
    }

    public boolean hasPlacement() {
        return placement != null;
    }

    public Optional<FeatureValue> getFeature(String name) {
        return Optional.ofNullable(features.get(name));
    }

    public ComponentRecord withRawLines(List<String> lines) {
        return toBuilder().rawLines(lines).build();
    }
}
