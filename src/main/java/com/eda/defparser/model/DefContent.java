package com.eda.defparser.model;

import java.util.List;
import java.util.Map;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Transformed content of one DEF file, before id assignment.
 */
@Value
@Builder
public class DefContent {
    @NonNull
    List<ComponentRecord> components;
    @NonNull
    List<NetRecord> nets;
    @NonNull
    HeaderInfo header;

    /**
     * Raw statement text of blocks that are read but not transformed, keyed by keyword.
     */
    @NonNull
    Map<String, List<String>> rawBlocks;
}
