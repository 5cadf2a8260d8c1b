package com.eda.defparser.model;

import java.util.Optional;

import lombok.NonNull;
import lombok.Value;

/**
 * Per-id view of a component in the final dataset.
 */
@Value
public class InstanceInfo {
    @NonNull
    String instanceName;
    @NonNull
    String cellName;
    Placement placement;

    public static InstanceInfo from(ComponentRecord component) {
        return new InstanceInfo(component.getInstanceName(), component.getCellName(), component.getPlacement());
    }

    public Optional<Placement> findPlacement() {
        return Optional.ofNullable(placement);
    }
}
