package com.apidocs.porter.cli.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.apidocs.porter.cli.model.PortOptions;
import com.apidocs.porter.cli.model.ValidatedPortOptions;
import com.apidocs.porter.core.context.ToolDiagnostics;
import com.apidocs.porter.porting.ModifiedElement;
import com.apidocs.porter.porting.PortingReport;
import com.apidocs.porter.report.UndocumentedApiCensus;
import com.apidocs.porter.service.PortResult;

/**
 * Responsible only for printing CLI output for the "port" command.
 * No validation, no execution, no prompting.
 */
public class PortResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(PortResultsPrinter.class);

    public void printBanner(PortOptions o, ValidatedPortOptions v) {
        log.info("=================================================");
        log.info("API Docs Porter");
        log.info("=================================================");
        log.info("Docs Directory: {}", v.getNormalizedDocsDir());
        v.getNormalizedIntelliSenseDirs().forEach(dir -> log.info("IntelliSense Directory: {}", dir));
        log.info("Save: {}", o.isSave() ? "yes" : "no (dry run)");
        log.info("Remarks Format: {}", o.isMarkdownRemarks() ? "markdown" : "xml");
        log.info("Preserve inheritdoc: {}", o.isPreserveInheritDocTag());
        log.info("Interface Implementations: {}", o.isSkipInterfaceImplementations() ? "skipped" : "ported");
        log.info("Prompts: {}", o.isDisablePrompts() ? "disabled" : "enabled");
        if (!v.getFilter().getIncludedAssemblies().isEmpty()) {
            log.info("Included Assemblies: {}", v.getFilter().getIncludedAssemblies());
        }
        if (!v.getFilter().getExcludedAssemblies().isEmpty()) {
            log.info("Excluded Assemblies: {}", v.getFilter().getExcludedAssemblies());
        }
        if (!v.getFilter().getIncludedNamespaces().isEmpty()) {
            log.info("Included Namespaces: {}", v.getFilter().getIncludedNamespaces());
        }
        if (!v.getFilter().getExcludedNamespaces().isEmpty()) {
            log.info("Excluded Namespaces: {}", v.getFilter().getExcludedNamespaces());
        }
        if (!v.getFilter().getIncludedTypes().isEmpty()) {
            log.info("Included Types: {}", v.getFilter().getIncludedTypes());
        }
        if (!v.getFilter().getExcludedTypes().isEmpty()) {
            log.info("Excluded Types: {}", v.getFilter().getExcludedTypes());
        }
        log.info("=================================================");
    }

    public void printSuccess(PortOptions o, PortResult result) {
        PortingReport report = result.getReport();

        log.info("");
        log.info("=================================================");
        log.info("PORTING COMPLETE");
        log.info("=================================================");
        log.info("IntelliSense Members Loaded: {}", result.getIntelliSenseMembersLoaded());
        log.info("Docs Types Loaded: {}", result.getDocsTypesLoaded());
        log.info("Docs Members Loaded: {}", result.getDocsMembersLoaded());
        log.info("Modified Files: {}", report.getModifiedFiles().size());
        log.info("Modified Types: {}", report.getModifiedTypes().size());
        log.info("Modified APIs: {}", report.getModifiedApis().size());
        log.info("Modified Elements: {}", report.getTotalModifiedIndividualElements());
        log.info("Added Exceptions: {}", report.getAddedExceptions().size());
        if (o.isSave()) {
            log.info("Files Saved: {}", result.getFilesSaved());
        } else {
            log.info("Dry run: no files were saved. Use --save to write the changes.");
        }

        if (!report.getAddedExceptions().isEmpty()) {
            log.info("");
            log.info("Added Exceptions:");
            report.getAddedExceptions().forEach(e -> log.info("  {}", e));
        }

        if (!report.getProblematicApis().isEmpty()) {
            log.info("");
            log.warn("Problems ({}):", report.getProblematicApis().size());
            report.getProblematicApis().forEach(p -> log.warn("  {}", p));
        }

        if (o.isPrintSummaryDetails()) {
            printSummaryDetails(report);
        }
        if (result.getCensus() != null) {
            printUndocumented(result.getCensus());
        }
        printDiagnostics(result.getDiagnostics());

        log.info("=================================================");
    }

    public void printFailure(PortResult result) {
        if (result.isAborted()) {
            log.error("Porting aborted: {}", result.getErrorMessage());
        } else {
            log.error("Porting failed: {}", result.getErrorMessage());
        }
        printDiagnostics(result.getDiagnostics());
    }

    private void printSummaryDetails(PortingReport report) {
        log.info("");
        log.info("Modified Elements:");
        for (ModifiedElement element : report.getModifiedElements()) {
            log.info("  {}{} {} ({})", element.isEii() ? "[EII] " : "", element.getDocId(), element.getElement(),
                    element.getFilePath());
        }
    }

    private void printUndocumented(UndocumentedApiCensus census) {
        log.info("");
        log.info("Undocumented APIs:");
        census.getEntries().forEach(e -> log.info("  {}", e));
        log.info("");
        log.info("Undocumented Summary:");
        log.info("  Type summaries: {}", census.getTypeSummaries());
        log.info("  Member summaries: {}", census.getMemberSummaries());
        log.info("  Method returns: {}", census.getMemberReturns());
        log.info("  Property values: {}", census.getMemberProperties());
        log.info("  Params: {}", census.getParams());
        log.info("  Type params: {}", census.getTypeParams());
        log.info("  Exceptions: {}", census.getExceptions());
        log.info("  Total: {}", census.getTotal());
    }

    private void printDiagnostics(ToolDiagnostics diagnostics) {
        if (diagnostics == null) {
            return;
        }
        log.info("Diagnostics: {}", diagnostics.summary());
        diagnostics.getSkippedFiles().forEach(f -> log.warn("  Skipped: {}", f));
        if (diagnostics.hasErrors()) {
            log.info("");
            log.error("Errors ({}):", diagnostics.getErrors().size());
            diagnostics.getErrors().forEach(e -> log.error("  {}", e));
        }
        if (diagnostics.hasWarnings()) {
            log.info("");
            log.warn("Warnings ({}):", diagnostics.getWarnings().size());
            diagnostics.getWarnings().forEach(w -> log.warn("  {}", w));
        }
    }
}
