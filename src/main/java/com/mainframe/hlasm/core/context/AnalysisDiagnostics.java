package com.mainframe.hlasm.core.context;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;

/**
 * Non-fatal problems (errors/warnings) accumulated during one analysis call.
 *
 * Pure structure only: no logging, no formatting, no IO.
 */
@Getter
public class AnalysisDiagnostics {
  private final List<String> errors = new ArrayList<>();
  private final List<String> warnings = new ArrayList<>();

  public void error(String message) {
      errors.add(message);
  }

  public void warning(String message) {
      warnings.add(message);
  }

  public boolean hasErrors() {
	  return !errors.isEmpty();
  }

  public boolean hasWarnings() {
      return !warnings.isEmpty();
  }

}
