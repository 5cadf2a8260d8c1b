package com.eda.defparser.parser;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.eda.defparser.config.DefParserConfig;
import com.eda.defparser.diagnostics.ParseDiagnostics;
import com.eda.defparser.model.ComponentRecord;
import com.eda.defparser.model.DefContent;
import com.eda.defparser.model.DefDataset;
import com.eda.defparser.model.HeaderInfo;
import com.eda.defparser.model.NetRecord;
import com.eda.defparser.model.RawSection;
import com.eda.defparser.reader.DefLineReader;
import com.eda.defparser.reader.MultiLineTerminatedBlockReader;
import com.eda.defparser.reader.SectionBlockReader;
import com.eda.defparser.reader.StatementReader;
import com.eda.defparser.reader.TerminatedBlockReader;
import com.eda.defparser.transform.BlockTransformer;
import com.eda.defparser.transform.BlockTransformers;

/**
 * Parser for DEF files.
 *
 * Reads the file once, routing each line by its first word:
 * - header keywords (VERSION, UNITS, ...) are kept as raw statements
 * - repeatable statements (ROW, TRACKS, ...) are collected per keyword
 * - END-terminated blocks (COMPONENTS, NETS, PINS, ...) are cut into entries
 * Unknown lines are skipped. After the scan the required blocks are transformed
 * into records and assembled into an id-indexed {@link DefDataset}.
 */
public class DefFileParser {
    private static final Logger log = LoggerFactory.getLogger(DefFileParser.class);

    private final DefParserConfig config;
    private final StatementReader statementReader = new StatementReader();
    private final SectionBlockReader blockReader = new TerminatedBlockReader();
    private final SectionBlockReader multiLineBlockReader = new MultiLineTerminatedBlockReader();
    private final HeaderInfoExtractor headerExtractor = new HeaderInfoExtractor();
    private final DefDatasetAssembler assembler;

    public DefFileParser(DefParserConfig config) {
        this.config = config;
        this.assembler = new DefDatasetAssembler(config.getDuplicateNamePolicy());
    }

    public DefFileParser() {
        this(DefParserConfig.defaults());
    }

    public DefDataset parse(Path defFile) throws IOException {
        ParseDiagnostics diagnostics = new ParseDiagnostics();
        DefContent content = readContent(defFile, diagnostics);
        return assembler.assemble(content, diagnostics);
    }

    public DefDataset parse(BufferedReader source) throws IOException {
        ParseDiagnostics diagnostics = new ParseDiagnostics();
        DefContent content = readContent(source, diagnostics);
        return assembler.assemble(content, diagnostics);
    }

    /**
     * Reads and transforms the file without assigning ids.
     */
    public DefContent readContent(Path defFile, ParseDiagnostics diagnostics) throws IOException {
        log.info("Parsing DEF file: {}", defFile);
        config.getProgressListener().onStart(Files.size(defFile));
        // undecodable bytes are replaced rather than failing the parse
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);
        try (BufferedReader source = new BufferedReader(
                new InputStreamReader(Files.newInputStream(defFile), decoder))) {
            return readContent(source, diagnostics);
        } finally {
            config.getProgressListener().onFinish();
        }
    }

    public DefContent readContent(BufferedReader source, ParseDiagnostics diagnostics) throws IOException {
        Map<String, String> headerStatements = new LinkedHashMap<>();
        Map<String, List<String>> statements = new LinkedHashMap<>();
        Map<String, List<RawSection>> blocks = new LinkedHashMap<>();

        DefLineReader reader = new DefLineReader(source, config.getProgressListener());
        String line;
        while ((line = reader.readLine()) != null) {
            String[] words = line.strip().split("\\s+", 3);
            String prefix = words[0];
            if (prefix.isEmpty() || prefix.startsWith("#")) {
                continue;
            }

            if (config.getHeaderKeywords().contains(prefix)) {
                headerStatements.put(prefix, statementReader.read(reader, line, prefix, diagnostics));
            } else if (config.getStatementKeywords().contains(prefix)) {
                statements.computeIfAbsent(prefix, k -> new ArrayList<>())
                        .add(statementReader.read(reader, line, prefix, diagnostics));
            } else if (config.getBlockKeywords().contains(prefix)) {
                blocks.put(prefix, blockReaderFor(prefix).read(reader, line, prefix, diagnostics));
            } else if ("END".equals(prefix) && words.length > 1 && "DESIGN".equals(words[1])) {
                log.debug("END DESIGN at line {}", reader.getLineNumber());
                break;
            } else {
                log.debug("Unknown prefix: {} at line {}", prefix, reader.getLineNumber());
            }
        }

        HeaderInfo header = headerExtractor.extract(headerStatements, diagnostics);

        List<String> found = new ArrayList<>(headerStatements.keySet());
        found.addAll(statements.keySet());
        found.addAll(blocks.keySet());
        log.info("Found DEF sections: {}", found);
        log.info("Required sections: {}", config.getRequiredKeywords());

        for (String keyword : config.getRequiredKeywords()) {
            if (!DefParserConfig.COMPONENTS.equals(keyword) && !DefParserConfig.NETS.equals(keyword)) {
                log.warn("No transformer for required section {}, keeping it raw", keyword);
                diagnostics.warn("Section " + keyword + " has no transformer and is kept raw");
            } else if (blocks.containsKey(keyword)) {
                log.info("Successfully loaded {} section with {} entries", keyword, blocks.get(keyword).size());
            } else {
                log.warn("{} section not found in DEF file", keyword);
                diagnostics.warn(keyword + " section not found");
            }
        }

        List<ComponentRecord> components = List.of();
        if (config.isRequired(DefParserConfig.COMPONENTS) && blocks.containsKey(DefParserConfig.COMPONENTS)) {
            components = componentTransformer().transform(blocks.get(DefParserConfig.COMPONENTS), diagnostics);
            log.info("Successfully parsed {} components", components.size());
        }

        List<NetRecord> nets = List.of();
        if (config.isRequired(DefParserConfig.NETS) && blocks.containsKey(DefParserConfig.NETS)) {
            nets = netTransformer().transform(blocks.get(DefParserConfig.NETS), diagnostics);
            log.info("Successfully parsed {} nets", nets.size());
        }

        return DefContent.builder()
                .components(List.copyOf(components))
                .nets(List.copyOf(nets))
                .header(header)
                .rawBlocks(collectRawBlocks(statements, blocks))
                .build();
    }

    private SectionBlockReader blockReaderFor(String prefix) {
        if (DefParserConfig.COMPONENTS.equals(prefix)) {
            return multiLineBlockReader;
        }
        if (DefParserConfig.NETS.equals(prefix) && config.isMultiLineNets()) {
            return multiLineBlockReader;
        }
        return blockReader;
    }

    private BlockTransformer<ComponentRecord> componentTransformer() {
        return BlockTransformers.components(config.getExecutor(), config.getBatchSize());
    }

    private BlockTransformer<NetRecord> netTransformer() {
        if (config.isMultiLineNets()) {
            return BlockTransformers.nets(config.getExecutor(), config.getBatchSize());
        }
        return BlockTransformers.simpleNets(config.getExecutor(), config.getBatchSize());
    }

    private Map<String, List<String>> collectRawBlocks(Map<String, List<String>> statements,
                                                      Map<String, List<RawSection>> blocks) {
        Map<String, List<String>> raw = new LinkedHashMap<>();
        statements.forEach((keyword, texts) -> raw.put(keyword, List.copyOf(texts)));
        blocks.forEach((keyword, sections) -> {
            if (!isTransformed(keyword)) {
                raw.put(keyword, sections.stream().map(RawSection::getHeadText).toList());
            }
        });
        return Collections.unmodifiableMap(raw);
    }

    private boolean isTransformed(String keyword) {
        return config.isRequired(keyword)
                && (DefParserConfig.COMPONENTS.equals(keyword) || DefParserConfig.NETS.equals(keyword));
    }
}
