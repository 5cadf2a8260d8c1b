package com.eda.defparser.parser;

import com.eda.defparser.config.DuplicateNamePolicy;
import com.eda.defparser.diagnostics.ParseDiagnostics;
import com.eda.defparser.model.ComponentRecord;
import com.eda.defparser.model.DefContent;
import com.eda.defparser.model.DefDataset;
import com.eda.defparser.model.HeaderInfo;
import com.eda.defparser.model.NetConnection;
import com.eda.defparser.model.NetRecord;
import com.eda.defparser.model.Placement;
import com.eda.defparser.model.Units;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for DefDatasetAssembler.
 */
class DefDatasetAssemblerTest {

    private final DefDatasetAssembler assembler = new DefDatasetAssembler(DuplicateNamePolicy.KEEP_LAST);

    @Test
    void testIdsFollowFileOrder() {
        DefDataset dataset = assemble(
                List.of(component("U1", "INVX1", Placement.numeric(0, 0, "N")), component("U2", "NAND2", null)),
                List.of(net("n1", conn("U1", "Y"), conn("U2", "A"))));

        assertThat(dataset.getInstanceToId()).containsExactly(entry("U1", 0), entry("U2", 1));
        assertThat(dataset.getIdToInstanceInfo().get(0).getCellName()).isEqualTo("INVX1");
        assertThat(dataset.getIdToInstanceInfo().get(0).getPlacement()).isEqualTo(Placement.numeric(0, 0, "N"));
        assertThat(dataset.getIdToInstanceInfo().get(1).findPlacement()).isEmpty();
        assertThat(dataset.countPlacedInstances()).isEqualTo(1);
        assertThat(dataset.getNetToId()).containsExactly(entry("n1", 0));
    }

    @Test
    void testDanglingNetsArePruned() {
        DefDataset dataset = assemble(List.of(), List.of(
                net("single", conn("U1", "Y")),
                net("empty"),
                net("kept", conn("U1", "Y"), conn("U2", "A")),
                net("alsoSingle", conn("U3", "Y"))));

        assertThat(dataset.getIdToNetInfo()).containsOnlyKeys(2);
        assertThat(dataset.getNetToId()).containsOnly(entry("kept", 2));
        assertThat(dataset.findNet("single")).isEmpty();
        assertThat(dataset.getDiagnostics().getInfos()).anyMatch(i -> i.contains("3 dangling"));
    }

    @Test
    void testConsecutiveDanglingNetsAreAllPruned() {
        DefDataset dataset = assemble(List.of(), List.of(
                net("a", conn("U1", "Y")),
                net("b", conn("U2", "Y")),
                net("c", conn("U3", "Y"))));

        assertThat(dataset.getIdToNetInfo()).isEmpty();
        assertThat(dataset.getNetToId()).isEmpty();
    }

    @Test
    void testExternalPinsCountButAreFiltered() {
        DefDataset dataset = assemble(List.of(), List.of(
                net("in", conn(NetConnection.EXTERNAL_PIN, "in"), conn("U1", "A")),
                net("pinOnly", conn(NetConnection.EXTERNAL_PIN, "x"))));

        assertThat(dataset.getNetToId()).containsOnlyKeys("in");
        assertThat(dataset.findNet("in").orElseThrow().getConnections())
                .containsExactly(new NetConnection("U1", "A"));
    }

    @Test
    void testDuplicateNamesKeepLastOccurrence() {
        DefDataset dataset = assemble(
                List.of(component("U1", "INVX1", null), component("U2", "BUF", null), component("U1", "NAND2", null)),
                List.of());

        assertThat(dataset.getInstanceToId()).containsExactly(entry("U2", 0), entry("U1", 1));
        assertThat(dataset.findInstance("U1").orElseThrow().getCellName()).isEqualTo("NAND2");
        assertThat(dataset.getIdToInstanceInfo()).hasSize(2);
        assertThat(dataset.getDiagnostics().getWarnings()).hasSize(1);
    }

    @Test
    void testDuplicateNamesRejected() {
        DefDatasetAssembler rejecting = new DefDatasetAssembler(DuplicateNamePolicy.REJECT);
        DefContent content = content(List.of(), List.of(
                net("n1", conn("U1", "Y"), conn("U2", "A")),
                net("n1", conn("U3", "Y"), conn("U4", "A"))));

        assertThatThrownBy(() -> rejecting.assemble(content, new ParseDiagnostics()))
                .isInstanceOf(DuplicateNameException.class)
                .hasMessageContaining("n1");
    }

    @Test
    void testMalformedEntriesAreSkippedBeforeDuplicateCheck() {
        DefDatasetAssembler rejecting = new DefDatasetAssembler(DuplicateNamePolicy.REJECT);
        DefContent content = content(
                List.of(ComponentRecord.unknown(), ComponentRecord.unknown(), component("U3", "INV", null)),
                List.of(NetRecord.unknown(), NetRecord.unknown(), net("n1", conn("U3", "Y"), conn("U4", "A"))));

        DefDataset dataset = rejecting.assemble(content, new ParseDiagnostics());

        assertThat(dataset.getInstanceToId()).containsExactly(entry("U3", 0));
        assertThat(dataset.getNetToId()).containsExactly(entry("n1", 0));
        assertThat(dataset.getDiagnostics().getInfos())
                .anyMatch(i -> i.contains("2 malformed component"))
                .anyMatch(i -> i.contains("2 malformed net"));
    }

    @Test
    void testMalformedEntriesAreNotReportedAsDuplicates() {
        DefDataset dataset = assemble(
                List.of(ComponentRecord.unknown(), component("U1", "INV", null), ComponentRecord.unknown()),
                List.of());

        assertThat(dataset.getInstanceToId()).containsOnlyKeys("U1");
        assertThat(dataset.findInstance(ComponentRecord.UNKNOWN)).isEmpty();
        assertThat(dataset.getDiagnostics().getWarnings()).isEmpty();
    }

    @Test
    void testPlacementOnlyContent() {
        DefDataset dataset = assemble(List.of(component("U1", "INVX1", null)), List.of());

        assertThat(dataset.getInstanceToId()).hasSize(1);
        assertThat(dataset.getNetToId()).isEmpty();
        assertThat(dataset.getIdToNetInfo()).isEmpty();
    }

    private DefDataset assemble(List<ComponentRecord> components, List<NetRecord> nets) {
        return assembler.assemble(content(components, nets), new ParseDiagnostics());
    }

    private static DefContent content(List<ComponentRecord> components, List<NetRecord> nets) {
        return DefContent.builder()
                .components(components)
                .nets(nets)
                .header(HeaderInfo.builder().units(Units.defaults()).build())
                .rawBlocks(Map.of())
                .build();
    }

    private static ComponentRecord component(String name, String cell, Placement placement) {
        return ComponentRecord.builder()
                .instanceName(name)
                .cellName(cell)
                .features(Map.of())
                .placement(placement)
                .build();
    }

    private static NetRecord net(String name, NetConnection... connections) {
        return NetRecord.builder().netName(name).connections(List.of(connections)).build();
    }

    private static NetConnection conn(String instance, String pin) {
        return new NetConnection(instance, pin);
    }
}
