package com.apidocs.porter.report;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.apidocs.porter.porting.ModifiedElement;
import com.apidocs.porter.porting.PortingReport;
import com.apidocs.porter.service.PortResult;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Renders a markdown summary of a porting run from {@code templates/port-report.ftl}.
 */
public class PortReportRenderer {

    private static final Logger log = LoggerFactory.getLogger(PortReportRenderer.class);

    static final String TEMPLATE_NAME = "port-report.ftl";

    private final Configuration freemarkerConfig;

    public PortReportRenderer() {
        this.freemarkerConfig = createFreemarkerConfig();
    }

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), "/templates");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    public String render(PortResult result) throws IOException {
        Template template = freemarkerConfig.getTemplate(TEMPLATE_NAME);
        StringWriter out = new StringWriter();
        try {
            template.process(buildModel(result), out);
        } catch (TemplateException e) {
            throw new IOException("Failed to render " + TEMPLATE_NAME + ": " + e.getMessage(), e);
        }
        return out.toString();
    }

    public void write(PortResult result, Path reportFile) throws IOException {
        Path parent = reportFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(reportFile, render(result), StandardCharsets.UTF_8);
        log.debug("Rendered report to {}", reportFile);
    }

    private Map<String, Object> buildModel(PortResult result) {
        Map<String, Object> model = new HashMap<>();
        model.put("success", result.isSuccess());
        model.put("errorMessage", result.getErrorMessage() == null ? "" : result.getErrorMessage());
        model.put("intelliSenseMembersLoaded", result.getIntelliSenseMembersLoaded());
        model.put("docsTypesLoaded", result.getDocsTypesLoaded());
        model.put("docsMembersLoaded", result.getDocsMembersLoaded());
        model.put("filesSaved", result.getFilesSaved());

        PortingReport report = result.getReport();
        model.put("hasReport", report != null);
        if (report != null) {
            model.put("modifiedFiles", report.getModifiedFiles().stream().map(Path::toString).collect(Collectors.toList()));
            model.put("modifiedTypes", List.copyOf(report.getModifiedTypes()));
            model.put("modifiedApis", List.copyOf(report.getModifiedApis()));
            model.put("problems", report.getProblematicApis());
            model.put("addedExceptions", report.getAddedExceptions());
            model.put("modifiedElements", report.getModifiedElements().stream()
                    .map(PortReportRenderer::describe)
                    .collect(Collectors.toList()));
        }

        model.put("errors", result.getDiagnostics() == null ? List.of() : result.getDiagnostics().getErrors());
        model.put("warnings", result.getDiagnostics() == null ? List.of() : result.getDiagnostics().getWarnings());

        UndocumentedApiCensus census = result.getCensus();
        model.put("hasCensus", census != null);
        if (census != null) {
            model.put("census", census);
        }
        return model;
    }

    private static String describe(ModifiedElement element) {
        return (element.isEii() ? "[EII] " : "") + element.getElement() + " in `" + element.getDocId() + "` ("
                + element.getFilePath() + ")";
    }
}
