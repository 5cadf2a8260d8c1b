package com.eda.defparser.transform;

import com.eda.defparser.diagnostics.ParseDiagnostics;
import com.eda.defparser.model.ComponentRecord;
import com.eda.defparser.model.RawSection;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for BlockTransformer, sequential and batched.
 */
class BlockTransformerTest {

    private ExecutorService executor;

    @AfterEach
    void tearDown() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    @Test
    void testSequentialTransformKeepsOrder() {
        List<RawSection> sections = componentSections(10);

        List<ComponentRecord> records = BlockTransformers.components()
                .transform(sections, new ParseDiagnostics());

        assertThat(records).extracting(ComponentRecord::getInstanceName)
                .containsExactlyElementsOf(expectedNames(10));
    }

    @Test
    void testBatchedTransformKeepsOrder() {
        executor = Executors.newFixedThreadPool(4);
        List<RawSection> sections = componentSections(50);

        List<ComponentRecord> records = BlockTransformers.components(executor, 3)
                .transform(sections, new ParseDiagnostics());

        assertThat(records).hasSize(50);
        assertThat(records).extracting(ComponentRecord::getInstanceName)
                .containsExactlyElementsOf(expectedNames(50));
        assertThat(records.get(7).getPlacement().getX()).isEqualTo(70);
    }

    @Test
    void testRawLinesAttachedForMultiLineEntries() {
        RawSection section = RawSection.builder()
                .headText("- U1 INVX1 + PLACED ( 0 0 ) N")
                .rawContent(List.of("- U1 INVX1", "  + PLACED ( 0 0 ) N ;"))
                .build();

        List<ComponentRecord> records = BlockTransformers.components()
                .transform(List.of(section), new ParseDiagnostics());

        assertThat(records.get(0).getRawLines()).containsExactly("- U1 INVX1", "  + PLACED ( 0 0 ) N ;");
    }

    @Test
    void testWorkerFailureIsWrapped() {
        executor = Executors.newFixedThreadPool(2);
        RecordFormatter<String> formatter = (tokens, diagnostics) -> {
            throw new IllegalStateException("boom");
        };
        SectionTransformer<String> failing = new SectionTransformer<>(new PassThroughLineCleaner(), formatter, false);
        BlockTransformer<String> transformer = new BlockTransformer<>(failing, executor, 1);

        assertThatThrownBy(() -> transformer.transform(componentSections(3), new ParseDiagnostics()))
                .isInstanceOf(DefTransformException.class)
                .hasRootCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void testBatchSizeMustBePositive() {
        SectionTransformer<ComponentRecord> transformer =
                new SectionTransformer<>(new PassThroughLineCleaner(), new ComponentRecordFormatter(), false);

        assertThatThrownBy(() -> new BlockTransformer<>(transformer, null, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static List<RawSection> componentSections(int count) {
        List<RawSection> sections = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            sections.add(RawSection.builder()
                    .headText("- C" + i + " INVX1 + PLACED ( " + (i * 10) + " 0 ) N")
                    .build());
        }
        return sections;
    }

    private static List<String> expectedNames(int count) {
        List<String> names = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            names.add("C" + i);
        }
        return names;
    }
}
