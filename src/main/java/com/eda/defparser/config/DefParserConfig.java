package com.eda.defparser.config;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;

import com.eda.defparser.progress.ParseProgressListener;
import com.eda.defparser.transform.BlockTransformer;

import lombok.Builder;
import lombok.Value;

/**
 * Configuration for one {@link com.eda.defparser.parser.DefFileParser}.
 */
@Value
@Builder(toBuilder = true)
public class DefParserConfig {

    public static final String COMPONENTS = "COMPONENTS";
    public static final String NETS = "NETS";

    public static final Set<String> DEFAULT_HEADER_KEYWORDS = Set.of(
            "VERSION",
            "NAMESCASESENSITIVE",
            "DIVIDERCHAR",
            "BUSBITCHARS",
            "DESIGN",
            "TECHNOLOGY",
            "UNITS");

    public static final Set<String> DEFAULT_STATEMENT_KEYWORDS = Set.of(
            "DIEAREA",
            "ROW",
            "TRACKS",
            "GCELLGRID");

    public static final Set<String> DEFAULT_BLOCK_KEYWORDS = Set.of(
            "PROPERTYDEFINITIONS",
            "VIAS",
            "STYLES",
            "NONDEFAULTRULES",
            "REGIONS",
            COMPONENTS,
            "PINS",
            "PINPROPERTIES",
            "BLOCKAGES",
            "SPECIALNETS",
            NETS,
            "SCANCHAINS",
            "GROUPS",
            "SLOTS",
            "FILLS",
            "BEGINEXT");

    /**
     * Single-line statements stored per keyword, the last one wins.
     */
    @Builder.Default
    Set<String> headerKeywords = DEFAULT_HEADER_KEYWORDS;

    /**
     * Self-terminating statements that may repeat, such as ROW and TRACKS.
     */
    @Builder.Default
    Set<String> statementKeywords = DEFAULT_STATEMENT_KEYWORDS;

    /**
     * Blocks closed by an END marker.
     */
    @Builder.Default
    Set<String> blockKeywords = DEFAULT_BLOCK_KEYWORDS;

    /**
     * Blocks transformed into records. Only COMPONENTS and NETS are understood.
     */
    @Builder.Default
    List<String> requiredKeywords = List.of(COMPONENTS, NETS);

    /**
     * Read NETS entries that span several lines. When false, each NETS entry is
     * expected on one line and every group on it is a connection.
     */
    @Builder.Default
    boolean multiLineNets = true;

    @Builder.Default
    DuplicateNamePolicy duplicateNamePolicy = DuplicateNamePolicy.KEEP_LAST;

    /**
     * Optional workers for block transformation, owned by the caller.
     */
    ExecutorService executor;

    @Builder.Default
    int batchSize = BlockTransformer.DEFAULT_BATCH_SIZE;

    @Builder.Default
    ParseProgressListener progressListener = ParseProgressListener.NONE;

    public static DefParserConfig defaults() {
        return DefParserConfig.builder().build();
    }

    public boolean isRequired(String keyword) {
        return requiredKeywords.contains(keyword);
    }
}
