package com.apidocs.porter.service;

import com.apidocs.porter.core.context.ToolDiagnostics;
import com.apidocs.porter.porting.PortingReport;
import com.apidocs.porter.report.UndocumentedApiCensus;

import lombok.Builder;
import lombok.Data;

/**
 * Result of a porting run.
 */
@Data
@Builder
public class PortResult {
    private boolean success;
    private String errorMessage;
    private boolean aborted;

    private PortingReport report;
    private ToolDiagnostics diagnostics;
    private UndocumentedApiCensus census;

    private int intelliSenseFilesLoaded;
    private int intelliSenseMembersLoaded;
    private int docsFilesLoaded;
    private int docsTypesLoaded;
    private int docsMembersLoaded;
    private int filesSaved;

    public static PortResult failure(String errorMessage, ToolDiagnostics diagnostics) {
        return PortResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .diagnostics(diagnostics)
                .build();
    }

    public static PortResult aborted(String errorMessage, ToolDiagnostics diagnostics) {
        return PortResult.builder()
                .success(false)
                .aborted(true)
                .errorMessage(errorMessage)
                .diagnostics(diagnostics)
                .build();
    }
}
