package com.apidocs.porter.cli.model;

import java.nio.file.Path;
import java.util.List;

import com.apidocs.porter.config.ApiFilter;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps PortCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedPortOptions {
    Path normalizedDocsDir;
    List<Path> normalizedIntelliSenseDirs;
    ApiFilter filter;
}
