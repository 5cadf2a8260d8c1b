package com.eda.defparser.config;

/**
 * What to do when a COMPONENTS or NETS block names the same instance or net twice.
 */
public enum DuplicateNamePolicy {
    /**
     * Keep only the last occurrence; ids stay contiguous and every id is reachable by name.
     */
    KEEP_LAST,

    /**
     * Fail the parse with a {@link com.eda.defparser.parser.DuplicateNameException}.
     */
    REJECT
}
