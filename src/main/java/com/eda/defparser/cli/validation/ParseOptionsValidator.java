package com.eda.defparser.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import com.eda.defparser.cli.exception.OptionsValidationException;
import com.eda.defparser.cli.model.ParseOptions;
import com.eda.defparser.cli.model.ValidatedParseOptions;
import com.eda.defparser.config.DefParserConfig;

public class ParseOptionsValidator {

	private static final Set<String> SUPPORTED_SECTIONS = Set.of(DefParserConfig.COMPONENTS, DefParserConfig.NETS);

	public ValidatedParseOptions validate(ParseOptions o) {
		List<String> errors = new ArrayList<>();

		Path defFile = o.getDefPath();
		if (defFile == null) {
			errors.add("DEF file is required (--def-path / -d).");
		} else if (!Files.isRegularFile(defFile)) {
			errors.add("DEF file does not exist or is not a regular file: " + defFile);
		} else if (!Files.isReadable(defFile)) {
			errors.add("DEF file is not readable: " + defFile);
		}

		List<String> sections = normalizeSections(o.getSections(), errors);

		if (o.getThreads() < 1) {
			errors.add("Thread count must be >= 1. Got: " + o.getThreads());
		}
		if (o.getBatchSize() < 1) {
			errors.add("Batch size must be >= 1. Got: " + o.getBatchSize());
		}

		Path normalizedOutputDir = (o.getOutputDir() == null ? Path.of("temp") : o.getOutputDir()).toAbsolutePath()
				.normalize();
		if (!o.isNoReport() && Files.exists(normalizedOutputDir) && !Files.isDirectory(normalizedOutputDir)) {
			errors.add("Output path exists and is not a directory: " + normalizedOutputDir);
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		return new ValidatedParseOptions(defFile.toAbsolutePath().normalize(), normalizedOutputDir, sections);
	}

	private static List<String> normalizeSections(List<String> raw, List<String> errors) {
		if (raw == null || raw.isEmpty()) {
			errors.add("At least one section is required (--sections).");
			return List.of();
		}

		List<String> sections = new ArrayList<>();
		for (String s : raw) {
			String section = s.trim().toUpperCase(Locale.ROOT);
			if (section.isEmpty()) {
				continue;
			}
			if (!SUPPORTED_SECTIONS.contains(section)) {
				errors.add("Unsupported section: " + s + ". Supported: COMPONENTS, NETS.");
			} else if (!sections.contains(section)) {
				sections.add(section);
			}
		}
		if (sections.isEmpty() && errors.isEmpty()) {
			errors.add("At least one section is required (--sections).");
		}
		return sections;
	}
}
