package com.eda.defparser.model;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.eda.defparser.diagnostics.ParseDiagnostics;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Final id-indexed view of a DEF file, handed to downstream tools.
 *
 * Maps are unmodifiable and iterate in id order.
 */
@Value
@Builder
public class DefDataset {
    @NonNull
    Map<String, Integer> instanceToId;
    @NonNull
    Map<Integer, InstanceInfo> idToInstanceInfo;
    @NonNull
    Map<String, Integer> netToId;
    @NonNull
    Map<Integer, NetInfo> idToNetInfo;
    @NonNull
    HeaderInfo header;
    @NonNull
    Map<String, List<String>> rawBlocks;
    @NonNull
    ParseDiagnostics diagnostics;

    public Optional<InstanceInfo> findInstance(String instanceName) {
        return Optional.ofNullable(instanceToId.get(instanceName)).map(idToInstanceInfo::get);
    }

    public Optional<NetInfo> findNet(String netName) {
        return Optional.ofNullable(netToId.get(netName)).map(idToNetInfo::get);
    }

    public long countPlacedInstances() {
        return idToInstanceInfo.values().stream().filter(info -> info.getPlacement() != null).count();
    }
}
