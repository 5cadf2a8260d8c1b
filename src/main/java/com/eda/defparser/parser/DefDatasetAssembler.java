package com.eda.defparser.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.eda.defparser.config.DuplicateNamePolicy;
import com.eda.defparser.diagnostics.ParseDiagnostics;
import com.eda.defparser.model.ComponentRecord;
import com.eda.defparser.model.DefContent;
import com.eda.defparser.model.DefDataset;
import com.eda.defparser.model.InstanceInfo;
import com.eda.defparser.model.NetConnection;
import com.eda.defparser.model.NetInfo;
import com.eda.defparser.model.NetRecord;

/**
 * Assigns ids to the transformed records and builds the final dataset.
 *
 * Ids follow file order. Placeholder records left by malformed entries are skipped
 * before ids are assigned. A net with fewer than two connections is dangling and is
 * dropped; the count is taken before connections to external pins ("PIN") are
 * filtered out, so a net from one pin to one instance survives with a single
 * remaining connection.
 */
public class DefDatasetAssembler {
    private static final Logger log = LoggerFactory.getLogger(DefDatasetAssembler.class);

    static final int MIN_NET_CONNECTIONS = 2;

    private final DuplicateNamePolicy duplicateNamePolicy;

    public DefDatasetAssembler(DuplicateNamePolicy duplicateNamePolicy) {
        this.duplicateNamePolicy = duplicateNamePolicy;
    }

    public DefDataset assemble(DefContent content, ParseDiagnostics diagnostics) {
        List<ComponentRecord> components = resolveDuplicates(
                dropPlaceholders(content.getComponents(), ComponentRecord::isPlaceholder, "component", diagnostics),
                ComponentRecord::getInstanceName, "instance", diagnostics);

        Map<String, Integer> instanceToId = new LinkedHashMap<>();
        Map<Integer, InstanceInfo> idToInstanceInfo = new LinkedHashMap<>();
        int withPlacement = 0;
        for (int id = 0; id < components.size(); id++) {
            ComponentRecord component = components.get(id);
            instanceToId.put(component.getInstanceName(), id);
            idToInstanceInfo.put(id, InstanceInfo.from(component));
            if (component.hasPlacement()) {
                withPlacement++;
            }
        }
        log.info("Components with placement: {}", withPlacement);
        log.info("Components without placement: {}", components.size() - withPlacement);

        Map<String, Integer> netToId = new LinkedHashMap<>();
        Map<Integer, NetInfo> idToNetInfo = new LinkedHashMap<>();
        if (content.getNets().isEmpty()) {
            log.info("No NETS information in DEF file (placement-only DEF)");
        } else {
            buildNets(content.getNets(), netToId, idToNetInfo, diagnostics);
        }

        return DefDataset.builder()
                .instanceToId(Collections.unmodifiableMap(instanceToId))
                .idToInstanceInfo(Collections.unmodifiableMap(idToInstanceInfo))
                .netToId(Collections.unmodifiableMap(netToId))
                .idToNetInfo(Collections.unmodifiableMap(idToNetInfo))
                .header(content.getHeader())
                .rawBlocks(content.getRawBlocks())
                .diagnostics(diagnostics)
                .build();
    }

    private void buildNets(List<NetRecord> records, Map<String, Integer> netToId,
                           Map<Integer, NetInfo> idToNetInfo, ParseDiagnostics diagnostics) {
        List<NetRecord> nets = resolveDuplicates(
                dropPlaceholders(records, NetRecord::isPlaceholder, "net", diagnostics),
                NetRecord::getNetName, "net", diagnostics);
        log.info("Processing {} nets", nets.size());

        Map<Integer, Integer> unfilteredCounts = new HashMap<>();
        for (int id = 0; id < nets.size(); id++) {
            NetRecord net = nets.get(id);
            netToId.put(net.getNetName(), id);
            unfilteredCounts.put(id, net.getConnections().size());

            List<NetConnection> connections = new ArrayList<>();
            for (NetConnection connection : net.getConnections()) {
                if (!connection.isExternalPin()) {
                    connections.add(connection);
                }
            }
            idToNetInfo.put(id, new NetInfo(net.getNetName(), List.copyOf(connections)));
        }

        // iterate a snapshot, delete from the maps only
        List<Integer> ids = List.copyOf(idToNetInfo.keySet());
        int pruned = 0;
        for (Integer id : ids) {
            if (unfilteredCounts.get(id) < MIN_NET_CONNECTIONS) {
                NetInfo removed = idToNetInfo.remove(id);
                netToId.remove(removed.getNetName());
                log.debug("Pruned dangling net {}", removed.getNetName());
                pruned++;
            }
        }

        if (pruned > 0) {
            diagnostics.info("Pruned " + pruned + " dangling nets");
        }
        log.info("After filtering dangling nets, {} nets remain", idToNetInfo.size());
    }

    /**
     * Malformed entries carry no usable name and never get an id.
     */
    private <R> List<R> dropPlaceholders(List<R> records, Predicate<R> isPlaceholder, String kind,
                                         ParseDiagnostics diagnostics) {
        List<R> kept = new ArrayList<>(records.size());
        for (R candidate : records) {
            if (!isPlaceholder.test(candidate)) {
                kept.add(candidate);
            }
        }
        int skipped = records.size() - kept.size();
        if (skipped > 0) {
            log.warn("Skipped {} malformed {} entries", skipped, kind);
            diagnostics.info("Skipped " + skipped + " malformed " + kind + " entries");
        }
        return kept;
    }

    private <R> List<R> resolveDuplicates(List<R> records, Function<R, String> nameOf, String kind,
                                          ParseDiagnostics diagnostics) {
        Map<String, Integer> lastIndex = new HashMap<>();
        for (int i = 0; i < records.size(); i++) {
            Integer previous = lastIndex.put(nameOf.apply(records.get(i)), i);
            if (previous != null && duplicateNamePolicy == DuplicateNamePolicy.REJECT) {
                throw new DuplicateNameException(kind, nameOf.apply(records.get(i)));
            }
        }
        if (lastIndex.size() == records.size()) {
            return records;
        }

        List<R> kept = new ArrayList<>(lastIndex.size());
        for (int i = 0; i < records.size(); i++) {
            String name = nameOf.apply(records.get(i));
            if (lastIndex.get(name) == i) {
                kept.add(records.get(i));
            } else {
                log.warn("Duplicate {} name {}, keeping the last occurrence", kind, name);
                diagnostics.warn("Duplicate " + kind + " name " + name + " replaced by a later entry");
            }
        }
        return kept;
    }
}
