package com.eda.defparser.transform;

import com.eda.defparser.diagnostics.ParseDiagnostics;
import com.eda.defparser.model.ComponentRecord;
import com.eda.defparser.model.FeatureValue;
import com.eda.defparser.model.Placement;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ComponentRecordFormatter.
 */
class ComponentRecordFormatterTest {

    private final ComponentRecordFormatter formatter = new ComponentRecordFormatter();
    private ParseDiagnostics diagnostics;

    @BeforeEach
    void setUp() {
        diagnostics = new ParseDiagnostics();
    }

    @Test
    void testPlacedComponent() {
        ComponentRecord record = format("- U1 INVX1 + PLACED ( 100 200 ) N");

        assertThat(record.getInstanceName()).isEqualTo("U1");
        assertThat(record.getCellName()).isEqualTo("INVX1");

        FeatureValue placed = record.getFeature("PLACED").orElseThrow();
        assertThat(placed.isScalar()).isFalse();
        assertThat(placed.tokens()).containsExactly("( 100 200 )", "N");

        Placement placement = record.getPlacement();
        assertThat(placement.isNumeric()).isTrue();
        assertThat(placement.getX()).isEqualTo(100);
        assertThat(placement.getY()).isEqualTo(200);
        assertThat(placement.getOrientation()).isEqualTo("N");
        assertThat(diagnostics.hasWarnings()).isFalse();
    }

    @Test
    void testSingleValueFeatureIsScalar() {
        ComponentRecord record = format("- U1 INVX1 + SOURCE DIST + WEIGHT 1 2");

        FeatureValue source = record.getFeature("SOURCE").orElseThrow();
        assertThat(source).isInstanceOf(FeatureValue.Scalar.class);
        assertThat(((FeatureValue.Scalar) source).getValue()).isEqualTo("DIST");

        FeatureValue weight = record.getFeature("WEIGHT").orElseThrow();
        assertThat(weight).isInstanceOf(FeatureValue.Multi.class);
        assertThat(weight.tokens()).containsExactly("1", "2");

        assertThat(record.hasPlacement()).isFalse();
    }

    @Test
    void testFeaturesKeepEntryOrder() {
        ComponentRecord record = format("- U1 INVX1 + SOURCE DIST + FIXED ( 1 2 ) S + WEIGHT 3");

        assertThat(record.getFeatures().keySet()).containsExactly("SOURCE", "FIXED", "WEIGHT");
    }

    @Test
    void testFeatureWithoutValuesIsEmptyMulti() {
        ComponentRecord record = format("- U3 BUFX2 + UNPLACED");

        FeatureValue unplaced = record.getFeature("UNPLACED").orElseThrow();
        assertThat(unplaced).isInstanceOf(FeatureValue.Multi.class);
        assertThat(unplaced.tokens()).isEmpty();
        assertThat(record.hasPlacement()).isFalse();
    }

    @Test
    void testBareCoordinatesDefaultToNorth() {
        ComponentRecord record = format("- U2 NAND2 + FIXED ( 5 6 )");

        assertThat(record.getFeature("FIXED").orElseThrow().isScalar()).isTrue();
        assertThat(record.getPlacement()).isEqualTo(Placement.numeric(5, 6, "N"));
    }

    @Test
    void testPlacedTakesPriorityOverFixedAndCover() {
        ComponentRecord record = format("- U1 INVX1 + COVER ( 7 8 ) S + FIXED ( 3 4 ) E + PLACED ( 1 2 ) W");

        assertThat(record.getPlacement()).isEqualTo(Placement.numeric(1, 2, "W"));
    }

    @Test
    void testFixedUsedWhenPlacedIsUnusable() {
        ComponentRecord record = format("- U1 INVX1 + PLACED N + COVER ( 7 8 ) S + FIXED ( 3 4 ) E");

        assertThat(record.getPlacement()).isEqualTo(Placement.numeric(3, 4, "E"));
    }

    @Test
    void testTabPaddedCoordinates() {
        ComponentRecord record = format("- U1 INV + PLACED (\t100 200\t) N");

        assertThat(record.getPlacement()).isEqualTo(Placement.numeric(100, 200, "N"));
        assertThat(diagnostics.hasWarnings()).isFalse();
    }

    @Test
    void testNonIntegerCoordinatesKeepRawValues() {
        ComponentRecord record = format("- U1 INVX1 + PLACED ( 10.5 abc ) FN");

        Placement placement = record.getPlacement();
        assertThat(placement.isNumeric()).isFalse();
        assertThat(placement.getRawX()).isEqualTo("10.5");
        assertThat(placement.getRawY()).isEqualTo("abc");
        assertThat(placement.getOrientation()).isEqualTo("FN");
        assertThat(placement.toString()).isEqualTo("(10.5, abc, FN)");
        assertThat(diagnostics.getWarnings()).hasSize(1);
    }

    @Test
    void testTooFewTokensYieldsSentinel() {
        ComponentRecord record = formatter.format(List.of("-", "U1"), diagnostics);

        assertThat(record.getInstanceName()).isEqualTo(ComponentRecord.UNKNOWN);
        assertThat(record.getCellName()).isEqualTo(ComponentRecord.UNKNOWN);
        assertThat(record.getFeatures()).isEmpty();
        assertThat(diagnostics.getWarnings()).hasSize(1);
    }

    @Test
    void testSentinelIsMarkedAsPlaceholder() {
        ComponentRecord record = formatter.format(List.of("-"), diagnostics);

        assertThat(record.isPlaceholder()).isTrue();
        assertThat(record.withRawLines(List.of("- ;")).isPlaceholder()).isTrue();
        assertThat(format("- U1 INVX1").isPlaceholder()).isFalse();
    }

    @Test
    void testAttachRawLines() {
        ComponentRecord record = format("- U1 INVX1");

        ComponentRecord withLines = formatter.attachRawLines(record, List.of("- U1 INVX1", "  ;"));

        assertThat(withLines.getRawLines()).containsExactly("- U1 INVX1", "  ;");
        assertThat(withLines.getInstanceName()).isEqualTo("U1");
        assertThat(record.getRawLines()).isNull();
    }

    private ComponentRecord format(String statement) {
        return formatter.format(DefLineTokenizer.split(statement), diagnostics);
    }
}
