package com.eda.defparser.transform;

import com.eda.defparser.diagnostics.ParseDiagnostics;
import com.eda.defparser.model.NetConnection;
import com.eda.defparser.model.NetProperty;
import com.eda.defparser.model.NetRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for MultiLineNetRecordFormatter.
 */
class MultiLineNetRecordFormatterTest {

    private final MultiLineNetRecordFormatter formatter = new MultiLineNetRecordFormatter();
    private ParseDiagnostics diagnostics;

    @BeforeEach
    void setUp() {
        diagnostics = new ParseDiagnostics();
    }

    @Test
    void testConnectionsAndProperty() {
        NetRecord net = format("- n1 ( U1 A ) ( U2 B ) + USE SIGNAL");

        assertThat(net.getNetName()).isEqualTo("n1");
        assertThat(net.getConnections()).containsExactly(
                new NetConnection("U1", "A"),
                new NetConnection("U2", "B"));
        assertThat(net.getProperties()).containsExactly(new NetProperty("USE", "SIGNAL"));
    }

    @Test
    void testGroupsAfterPropertyAreNotConnections() {
        NetRecord net = format("- n1 ( U1 A ) + ROUTED M1 ( 0 0 ) ( 10 0 ) + USE CLOCK");

        assertThat(net.getConnections()).containsExactly(new NetConnection("U1", "A"));
        assertThat(net.getProperties()).containsExactly(
                new NetProperty("ROUTED", "M1"),
                new NetProperty("USE", "CLOCK"));
    }

    @Test
    void testPropertyWithoutValue() {
        NetRecord net = format("- n1 ( U1 A ) + SHAPE ( 1 2 ) + FIXEDBUMP + SOURCE TEST");

        assertThat(net.getProperties()).extracting(NetProperty::getName)
                .containsExactly("SHAPE", "FIXEDBUMP", "SOURCE");
        assertThat(net.getProperties().get(0).findValue()).isEmpty();
        assertThat(net.getProperties().get(1).findValue()).isEmpty();
        assertThat(net.getProperties().get(2).findValue()).contains("TEST");
    }

    @Test
    void testExternalPinConnectionIsKept() {
        NetRecord net = format("- clk ( PIN clk ) ( U1 CK )");

        assertThat(net.getConnections()).hasSize(2);
        assertThat(net.getConnections().get(0).isExternalPin()).isTrue();
    }

    @Test
    void testExtraWordsInsideGroupAreIgnored() {
        NetRecord net = format("- n1 ( U1 A + SYNTHESIZED ) ( U2 B )");

        assertThat(net.getConnections()).containsExactly(
                new NetConnection("U1", "A"),
                new NetConnection("U2", "B"));
    }

    @Test
    void testTabPaddedGroup() {
        NetRecord net = format("- n1 (\tU1 A ) ( U2\tB\t)");

        assertThat(net.getConnections()).containsExactly(
                new NetConnection("U1", "A"),
                new NetConnection("U2", "B"));
        assertThat(diagnostics.hasWarnings()).isFalse();
    }

    @Test
    void testMalformedConnectionIsSkipped() {
        NetRecord net = format("- n1 ( U1 ) ( U2 B )");

        assertThat(net.getConnections()).containsExactly(new NetConnection("U2", "B"));
        assertThat(diagnostics.getWarnings()).hasSize(1);
    }

    @Test
    void testTooFewTokensYieldsSentinel() {
        NetRecord net = formatter.format(List.of("-"), diagnostics);

        assertThat(net.getNetName()).isEqualTo(NetRecord.UNKNOWN);
        assertThat(net.getConnections()).isEmpty();
        assertThat(diagnostics.hasWarnings()).isTrue();
    }

    private NetRecord format(String statement) {
        return formatter.format(DefLineTokenizer.split(statement), diagnostics);
    }
}
