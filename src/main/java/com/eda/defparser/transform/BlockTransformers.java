package com.eda.defparser.transform;

import java.util.concurrent.ExecutorService;

import com.eda.defparser.model.ComponentRecord;
import com.eda.defparser.model.NetRecord;

/**
 * Factory for the block transformers used by the DEF parser.
 */
public final class BlockTransformers {

    private BlockTransformers() {
    }

    /**
     * COMPONENTS entries joined by the multi-line block reader.
     */
    public static BlockTransformer<ComponentRecord> components(ExecutorService executor, int batchSize) {
        return new BlockTransformer<>(
                new SectionTransformer<>(new PassThroughLineCleaner(), new ComponentRecordFormatter(), true),
                executor, batchSize);
    }

    /**
     * NETS entries joined by the multi-line block reader.
     */
    public static BlockTransformer<NetRecord> nets(ExecutorService executor, int batchSize) {
        return new BlockTransformer<>(
                new SectionTransformer<>(new PassThroughLineCleaner(), new MultiLineNetRecordFormatter(), true),
                executor, batchSize);
    }

    /**
     * NETS entries that each sit on one line with their terminator.
     */
    public static BlockTransformer<NetRecord> simpleNets(ExecutorService executor, int batchSize) {
        return new BlockTransformer<>(
                new SectionTransformer<>(new TerminatorLineCleaner(), new SimpleNetRecordFormatter(), false),
                executor, batchSize);
    }

    public static BlockTransformer<ComponentRecord> components() {
        return components(null, BlockTransformer.DEFAULT_BATCH_SIZE);
    }

    public static BlockTransformer<NetRecord> nets() {
        return nets(null, BlockTransformer.DEFAULT_BATCH_SIZE);
    }

    public static BlockTransformer<NetRecord> simpleNets() {
        return simpleNets(null, BlockTransformer.DEFAULT_BATCH_SIZE);
    }
}
