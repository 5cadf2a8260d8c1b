package com.eda.defparser.cli.model;

import java.nio.file.Path;
import java.util.List;

import com.eda.defparser.config.DuplicateNamePolicy;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "parse-def" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class ParseOptions {

	@Option(names = { "--def-path", "-d" }, required = true, description = "Path to the DEF file")
	private Path defPath;

	@Option(names = { "--output-dir", "-o" }, defaultValue = "temp", description = "Directory for the parse report (default: temp)")
	private Path outputDir;

	@Option(names = { "--sections" }, split = ",", defaultValue = "COMPONENTS,NETS",
			description = "Sections to transform, comma-separated (default: COMPONENTS,NETS)")
	private List<String> sections;

	@Option(names = { "--threads" }, defaultValue = "1", description = "Workers for transforming COMPONENTS/NETS entries")
	private int threads;

	@Option(names = { "--batch-size" }, defaultValue = "1024", description = "Entries per worker task")
	private int batchSize;

	@Option(names = { "--duplicates" }, defaultValue = "KEEP_LAST",
			description = "Duplicate instance/net names: KEEP_LAST or REJECT")
	private DuplicateNamePolicy duplicatePolicy;

	@Option(names = { "--single-line-nets" }, description = "Treat every NETS entry as a single line")
	private boolean singleLineNets;

	@Option(names = { "--no-report" }, description = "Do not write the parse report")
	private boolean noReport;

	@Option(names = { "--debug" }, description = "Enable debug output")
	private boolean debug;

}
