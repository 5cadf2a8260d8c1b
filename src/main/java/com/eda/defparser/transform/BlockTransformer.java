package com.eda.defparser.transform;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.eda.defparser.diagnostics.ParseDiagnostics;
import com.eda.defparser.model.RawSection;

/**
 * Applies a {@link SectionTransformer} to every raw section of one keyword block.
 *
 * With an executor, sections are submitted in batches and the batch results are
 * collected in submission order, so the output always lines up with the input.
 * The executor belongs to the caller and is never shut down here.
 */
public class BlockTransformer<R> {
    private static final Logger log = LoggerFactory.getLogger(BlockTransformer.class);

    public static final int DEFAULT_BATCH_SIZE = 1024;

    private final SectionTransformer<R> sectionTransformer;
    private final ExecutorService executor;
    private final int batchSize;

    public BlockTransformer(SectionTransformer<R> sectionTransformer) {
        this(sectionTransformer, null, DEFAULT_BATCH_SIZE);
    }

    public BlockTransformer(SectionTransformer<R> sectionTransformer, ExecutorService executor, int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("Batch size must be > 0. Got: " + batchSize);
        }
        this.sectionTransformer = sectionTransformer;
        this.executor = executor;
        this.batchSize = batchSize;
    }

    public List<R> transform(List<RawSection> sections, ParseDiagnostics diagnostics) {
        if (executor == null || sections.size() <= batchSize) {
            return transformBatch(sections, diagnostics);
        }

        List<Future<List<R>>> futures = new ArrayList<>();
        for (int start = 0; start < sections.size(); start += batchSize) {
            List<RawSection> batch = sections.subList(start, Math.min(start + batchSize, sections.size()));
            futures.add(executor.submit(() -> transformBatch(batch, diagnostics)));
        }
        log.debug("Transforming {} sections in {} batches", sections.size(), futures.size());

        List<R> records = new ArrayList<>(sections.size());
        for (Future<List<R>> future : futures) {
            try {
                records.addAll(future.get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.forEach(f -> f.cancel(true));
                throw new DefTransformException("Interrupted while transforming sections", e);
            } catch (ExecutionException e) {
                futures.forEach(f -> f.cancel(true));
                throw new DefTransformException("Failed to transform sections", e.getCause());
            }
        }
        return records;
    }

    private List<R> transformBatch(List<RawSection> batch, ParseDiagnostics diagnostics) {
        List<R> records = new ArrayList<>(batch.size());
        for (RawSection section : batch) {
            records.add(sectionTransformer.transform(section, diagnostics));
        }
        return records;
    }
}
