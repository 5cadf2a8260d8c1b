package com.eda.defparser.report;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.eda.defparser.model.DefDataset;
import com.eda.defparser.model.HeaderInfo;
import com.eda.defparser.model.InstanceInfo;
import com.eda.defparser.model.NetInfo;
import com.eda.defparser.model.Placement;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Writes a parsed dataset to a plain-text report using the
 * {@value #TEMPLATE_NAME} FreeMarker template.
 */
public class DatasetReportWriter {
    private static final Logger log = LoggerFactory.getLogger(DatasetReportWriter.class);

    public static final String TEMPLATE_NAME = "def-outputs.ftl";
    public static final String REPORT_FILE_NAME = "def_outputs.txt";

    private final Configuration freemarkerConfig;

    public DatasetReportWriter() {
        this.freemarkerConfig = createFreemarkerConfig();
    }

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), "/templates");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    /**
     * Renders the report into {@code outputDir}, creating it if needed.
     *
     * @return the written report file
     */
    public Path write(DefDataset dataset, Path outputDir) throws IOException {
        Files.createDirectories(outputDir);
        Path reportFile = outputDir.resolve(REPORT_FILE_NAME);

        Template template = freemarkerConfig.getTemplate(TEMPLATE_NAME);
        try (Writer writer = Files.newBufferedWriter(reportFile, StandardCharsets.UTF_8)) {
            template.process(buildModel(dataset), writer);
        } catch (TemplateException e) {
            throw new IOException("Failed to render " + TEMPLATE_NAME + ": " + e.getMessage(), e);
        }

        log.info("Successfully saved DEF data to {}", reportFile);
        return reportFile;
    }

    Map<String, Object> buildModel(DefDataset dataset) {
        Map<String, Object> model = new HashMap<>();
        model.put("header", headerModel(dataset.getHeader()));
        model.put("instanceCount", dataset.getInstanceToId().size());
        model.put("placedCount", dataset.countPlacedInstances());
        model.put("netCount", dataset.getIdToNetInfo().size());
        model.put("warningCount", dataset.getDiagnostics().getWarnings().size());

        List<Map<String, Object>> instances = new ArrayList<>();
        for (Map.Entry<Integer, InstanceInfo> entry : dataset.getIdToInstanceInfo().entrySet()) {
            InstanceInfo info = entry.getValue();
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("id", entry.getKey());
            row.put("name", info.getInstanceName());
            row.put("cell", info.getCellName());
            info.findPlacement().map(Placement::toString).ifPresent(p -> row.put("placement", p));
            instances.add(row);
        }
        model.put("instances", instances);

        List<Map<String, Object>> nets = new ArrayList<>();
        for (Map.Entry<Integer, NetInfo> entry : dataset.getIdToNetInfo().entrySet()) {
            NetInfo info = entry.getValue();
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("id", entry.getKey());
            row.put("name", info.getNetName());
            row.put("connections", info.getConnections().stream()
                    .map(c -> c.getInstanceName() + "/" + c.getPinName())
                    .collect(Collectors.joining(" ")));
            nets.add(row);
        }
        model.put("nets", nets);
        return model;
    }

    private Map<String, Object> headerModel(HeaderInfo header) {
        Map<String, Object> model = new HashMap<>();
        header.findVersion().ifPresent(v -> model.put("version", v));
        header.findDesign().ifPresent(v -> model.put("design", v));
        header.findTechnology().ifPresent(v -> model.put("technology", v));
        model.put("distance", header.getUnits().getDistance());
        model.put("databaseUnitsPerMicron", header.getUnits().getDatabaseUnitsPerMicron());
        model.put("defaultUnits", header.getUnits().isDefaultUsed());
        if (header.getDividerChar() != null) {
            model.put("dividerChar", header.getDividerChar());
        }
        if (header.getBusBitChars() != null) {
            model.put("busBitChars", header.getBusBitChars());
        }
        return model;
    }
}
