package com.eda.defparser.transform;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class LineCleanerTest {

    @Test
    void testTerminatorCleanerStripsOneTerminator() {
        LineCleaner cleaner = new TerminatorLineCleaner();

        assertThat(cleaner.clean("  - n1 ( U1 A ) ;  ")).isEqualTo("- n1 ( U1 A )");
        assertThat(cleaner.clean("x;;")).isEqualTo("x;");
        assertThat(cleaner.clean("- n1 ( U1 A )")).isEqualTo("- n1 ( U1 A )");
    }

    @Test
    void testPassThroughCleanerKeepsText() {
        LineCleaner cleaner = new PassThroughLineCleaner();

        assertThat(cleaner.clean("- U1 INVX1 ;")).isEqualTo("- U1 INVX1 ;");
    }
}
