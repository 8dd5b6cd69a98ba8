package com.apidocs.porter.service;

import java.nio.file.Path;
import java.util.List;

import com.apidocs.porter.config.MergePolicy;

import lombok.Builder;
import lombok.Data;

/**
 * Configuration for one porting run.
 */
@Data
@Builder
public class PortConfig {
    private Path docsDir;
    private List<Path> intelliSenseDirs;

    @Builder.Default
    private MergePolicy policy = MergePolicy.defaults();

    /** Changed Docs files are only written when set; otherwise the run is a dry run. */
    private boolean save;

    /** Takes a census of the fields still undocumented after the port. */
    private boolean printUndoc;

    /** Markdown report destination, or null for none. */
    private Path reportFile;
}
