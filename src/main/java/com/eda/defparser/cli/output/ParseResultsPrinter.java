package com.eda.defparser.cli.output;

import java.nio.file.Path;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.eda.defparser.cli.model.ParseOptions;
import com.eda.defparser.cli.model.ValidatedParseOptions;
import com.eda.defparser.model.DefDataset;
import com.eda.defparser.model.HeaderInfo;
import com.eda.defparser.model.InstanceInfo;

/**
 * Responsible only for printing CLI output for the "parse-def" command.
 * No validation, no parsing.
 */
public class ParseResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(ParseResultsPrinter.class);

    private static final int DEBUG_SAMPLE_SIZE = 3;

    public void printBanner(ParseOptions o, ValidatedParseOptions v) {
        log.info("=================================================");
        log.info("DEF Netlist Parser");
        log.info("=================================================");
        log.info("Input file: {}", v.getDefFile());
        log.info("Output directory: {}", o.isNoReport() ? "None (--no-report)" : v.getNormalizedOutputDir());
        log.info("Sections: {}", v.getRequiredSections());
        log.info("Threads: {}", o.getThreads());
        log.info("Duplicate names: {}", o.getDuplicatePolicy());
        log.info("=================================================");
    }

    public void printHeader(HeaderInfo header) {
        log.info("=== DEF Header Information ===");
        log.info("version: {}", header.findVersion().orElse("-"));
        log.info("design: {}", header.findDesign().orElse("-"));
        log.info("technology: {}", header.findTechnology().orElse("-"));
        log.info("units: {} {} per micron{}", header.getUnits().getDistance(),
                header.getDatabaseUnitsPerMicron(), header.getUnits().isDefaultUsed() ? " (default)" : "");
        if (header.getDividerChar() != null) {
            log.info("dividerchar: {}", header.getDividerChar());
        }
        if (header.getBusBitChars() != null) {
            log.info("busbitchars: {}", header.getBusBitChars());
        }
        log.info("=".repeat(50));
    }

    public void printDebugSample(DefDataset dataset) {
        log.info("=== DEBUG: First {} components ===", DEBUG_SAMPLE_SIZE);
        dataset.getIdToInstanceInfo().entrySet().stream()
                .limit(DEBUG_SAMPLE_SIZE)
                .forEach(this::printComponent);
        log.info("=== END DEBUG ===");
    }

    private void printComponent(Map.Entry<Integer, InstanceInfo> entry) {
        InstanceInfo info = entry.getValue();
        log.info("Component {}: {} ({})", entry.getKey(), info.getInstanceName(), info.getCellName());
        if (info.getPlacement() != null) {
            log.info("  Has placementInfo: {}", info.getPlacement());
        } else {
            log.info("  NO placementInfo!");
        }
    }

    public void printSummary(DefDataset dataset, Path reportFile) {
        log.info("");
        log.info("=================================================");
        log.info("PARSE SUCCESSFUL");
        log.info("=================================================");
        if (reportFile != null) {
            log.info("Report: {}", reportFile);
        }
        log.info("Summary:");
        log.info("  - Components: {}", dataset.getInstanceToId().size());
        log.info("  - Placed components: {}", dataset.countPlacedInstances());
        log.info("  - Nets: {}", dataset.getIdToNetInfo().size());
        log.info("  - Database units per micron: {}", dataset.getHeader().getDatabaseUnitsPerMicron());
        if (dataset.getDiagnostics().hasWarnings()) {
            log.info("  - Warnings: {}", dataset.getDiagnostics().getWarnings().size());
        }
        log.info("=================================================");
    }

    public void printFailure(String message, Throwable cause) {
        log.error("Parse failed: {}", message);
        if (cause != null) {
            log.debug("Failure detail", cause);
        }
    }
}
