package com.apidocs.porter.service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xml.sax.SAXException;

import com.apidocs.porter.config.MergePolicy;
import com.apidocs.porter.core.context.ToolDiagnostics;
import com.apidocs.porter.docs.DocsCommentsContainer;
import com.apidocs.porter.intellisense.IntelliSenseCommentsContainer;
import com.apidocs.porter.io.DocsXmlWriter;
import com.apidocs.porter.io.LoadedXmlDocument;
import com.apidocs.porter.io.XmlDocumentLoader;
import com.apidocs.porter.io.XmlFileDiscoveryService;
import com.apidocs.porter.porting.DocsPorter;
import com.apidocs.porter.porting.NameMismatchResolver;
import com.apidocs.porter.porting.PortAbortedException;
import com.apidocs.porter.porting.PortingReport;
import com.apidocs.porter.report.PortReportRenderer;
import com.apidocs.porter.report.UndocumentedApiCensus;

/**
 * Runs a complete port: discover and load both corpora, port, save the changed
 * Docs files and write the optional report.
 */
public class PortingService {

    private static final Logger log = LoggerFactory.getLogger(PortingService.class);

    private final XmlFileDiscoveryService discoveryService;
    private final XmlDocumentLoader loader;
    private final DocsXmlWriter writer;
    private final PortReportRenderer reportRenderer;

    public PortingService() {
        this(new XmlFileDiscoveryService(), new XmlDocumentLoader(), new DocsXmlWriter(), new PortReportRenderer());
    }

    public PortingService(XmlFileDiscoveryService discoveryService, XmlDocumentLoader loader, DocsXmlWriter writer,
            PortReportRenderer reportRenderer) {
        this.discoveryService = discoveryService;
        this.loader = loader;
        this.writer = writer;
        this.reportRenderer = reportRenderer;
    }

    public PortResult port(PortConfig config, NameMismatchResolver mismatchResolver) {
        ToolDiagnostics diagnostics = new ToolDiagnostics();
        MergePolicy policy = config.getPolicy();
        try {
            log.info("Step 1: Loading IntelliSense xml files...");
            IntelliSenseCommentsContainer intelliSense = new IntelliSenseCommentsContainer(policy.getFilter(), diagnostics);
            List<Path> intelliSenseFiles = discoveryService.discoverIntelliSenseFiles(config.getIntelliSenseDirs());
            int intelliSenseFilesLoaded = 0;
            for (Path file : intelliSenseFiles) {
                try {
                    LoadedXmlDocument loaded = loader.load(file);
                    intelliSense.load(loaded.getDocument(), file);
                    intelliSenseFilesLoaded++;
                } catch (IOException | SAXException e) {
                    skipUnreadable(file, e, diagnostics);
                }
            }
            log.info("  Loaded {} IntelliSense members from {} files", intelliSense.size(), intelliSenseFilesLoaded);

            log.info("Step 2: Loading Docs xml files...");
            DocsCommentsContainer docs = new DocsCommentsContainer(policy.getFilter(), diagnostics);
            int docsFilesLoaded = 0;
            for (Path file : discoveryService.discoverDocsFiles(config.getDocsDir())) {
                try {
                    if (docs.load(loader.load(file)).isPresent()) {
                        docsFilesLoaded++;
                    }
                } catch (IOException | SAXException e) {
                    skipUnreadable(file, e, diagnostics);
                }
            }
            log.info("  Loaded {} Docs types with {} members", docs.getTypes().size(), docs.getMembers().size());

            log.info("Step 3: Porting...");
            PortingReport report = new DocsPorter(policy, intelliSense, docs, mismatchResolver).port();
            if (!report.isCompleted()) {
                PortResult failed = PortResult.failure(report.getFailureReason(), diagnostics);
                failed.setReport(report);
                return failed;
            }

            PortResult result = PortResult.builder()
                    .success(true)
                    .report(report)
                    .diagnostics(diagnostics)
                    .intelliSenseFilesLoaded(intelliSenseFilesLoaded)
                    .intelliSenseMembersLoaded(intelliSense.size())
                    .docsFilesLoaded(docsFilesLoaded)
                    .docsTypesLoaded(docs.getTypes().size())
                    .docsMembersLoaded(docs.getMembers().size())
                    .build();

            if (config.isPrintUndoc()) {
                result.setCensus(UndocumentedApiCensus.take(docs));
            }

            if (config.isSave()) {
                log.info("Step 4: Saving changed Docs files...");
                int changed = docs.getChangedFiles().size();
                int saved = docs.save(writer);
                result.setFilesSaved(saved);
                if (saved < changed) {
                    result.setSuccess(false);
                    result.setErrorMessage("Failed to save " + (changed - saved) + " of " + changed + " changed files");
                }
            } else {
                log.info("Step 4: Dry run, {} changed files not saved", docs.getChangedFiles().size());
            }

            if (config.getReportFile() != null) {
                writeReport(result, config.getReportFile(), diagnostics);
            }
            return result;

        } catch (PortAbortedException e) {
            log.warn("Porting aborted: {}", e.getMessage());
            return PortResult.aborted(e.getMessage(), diagnostics);
        } catch (IOException e) {
            log.error("Porting failed", e);
            return PortResult.failure("Porting failed: " + e.getMessage(), diagnostics);
        } catch (UncheckedIOException e) {
            String message = "Porting failed reading the console: " + e.getCause().getMessage();
            log.error(message, e);
            diagnostics.getErrors().add(message);
            return PortResult.failure(message, diagnostics);
        }
    }

    private void writeReport(PortResult result, Path reportFile, ToolDiagnostics diagnostics) {
        try {
            reportRenderer.write(result, reportFile);
            log.info("Report written to {}", reportFile.toAbsolutePath());
        } catch (IOException e) {
            String message = "Failed to write report " + reportFile + ": " + e.getMessage();
            log.error(message, e);
            diagnostics.getErrors().add(message);
        }
    }

    private static void skipUnreadable(Path file, Exception e, ToolDiagnostics diagnostics) {
        String message = "Skipping unreadable xml file " + file + ": " + e.getMessage();
        log.error(message);
        diagnostics.skipFile(file, message);
    }
}
