package com.eda.defparser.cli.model;

import java.nio.file.Path;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps ParseCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedParseOptions {
    Path defFile;
    Path normalizedOutputDir;
    List<String> requiredSections;
}
