package com.eda.defparser.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lombok.Getter;

/**
 * Errors, warnings and infos accumulated while parsing one DEF file.
 *
 * Pure structure only: no logging, no formatting, no IO. Lists are synchronized
 * because block transformation may run on several workers.
 */
@Getter
public class ParseDiagnostics {
  private final List<String> errors = Collections.synchronizedList(new ArrayList<>());
  private final List<String> warnings = Collections.synchronizedList(new ArrayList<>());
  private final List<String> infos = Collections.synchronizedList(new ArrayList<>());

  public void error(String message) {
    errors.add(message);
  }

  public void warn(String message) {
    warnings.add(message);
  }

  public void info(String message) {
    infos.add(message);
  }

  public boolean hasErrors() {
    return !errors.isEmpty();
  }

  public boolean hasWarnings() {
    return !warnings.isEmpty();
  }
}
