package com.apidocs.porter.core.context;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import lombok.Getter;

/**
 * Errors, warnings and infos collected while loading, porting and saving xml files.
 * Files left out of the run are tracked separately from the messages that explain them.
 *
 * Pure structure only: no logging, no formatting, no IO.
 */
@Getter
public class ToolDiagnostics {
  private final List<String> errors = new ArrayList<>();
  private final List<String> warnings = new ArrayList<>();
  private final List<String> infos = new ArrayList<>();
  private final Set<Path> skippedFiles = new LinkedHashSet<>();

  /**
   * Records a file that was not loaded, with the error explaining why.
   */
  public void skipFile(Path file, String message) {
	  skippedFiles.add(file);
	  errors.add(message);
  }

  public boolean hasErrors() {
	  return !errors.isEmpty();
  }

  public boolean hasWarnings() {
	  return !warnings.isEmpty();
  }

  public String summary() {
	  return errors.size() + " error(s), " + warnings.size() + " warning(s), "
			  + skippedFiles.size() + " skipped file(s)";
  }
}
