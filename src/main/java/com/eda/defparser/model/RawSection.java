package com.eda.defparser.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * One raw entry of a DEF block, as cut out of the file by a block reader.
 *
 * Pure structure only: no tokenizing, no formatting.
 */
@Value
@Builder
public class RawSection {

    /**
     * Statement text the transformers parse. For multi-line entries this is the
     * whitespace-joined entry with its terminator already removed.
     */
    @NonNull
    String headText;

    /**
     * Continuation lines ("+ ...") that follow a single-line head.
     */
    @Singular
    List<String> propertyLines;

    /**
     * Original file lines of the entry. Kept for diagnostics only, may be null.
     */
    List<String> rawContent;

    public boolean hasRawContent() {
        return rawContent != null && !rawContent.isEmpty();
    }
}
