package com.apidocs.porter.report;

import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.apidocs.porter.core.context.ToolDiagnostics;
import com.apidocs.porter.porting.PortingReport;
import com.apidocs.porter.service.PortResult;

import static org.assertj.core.api.Assertions.*;

class PortReportRendererTest {

    @TempDir
    Path tempDir;

    private final PortReportRenderer renderer = new PortReportRenderer();

    @Test
    void testRenderSuccessWithoutChanges() throws Exception {
        ToolDiagnostics diagnostics = new ToolDiagnostics();
        diagnostics.getWarnings().add("Duplicate Docs member M:MyNamespace.MyType.MyMethod in MyType.xml");
        PortResult result = PortResult.builder()
                .success(true)
                .report(new PortingReport())
                .diagnostics(diagnostics)
                .intelliSenseMembersLoaded(1200)
                .docsTypesLoaded(3)
                .docsMembersLoaded(17)
                .build();

        String markdown = renderer.render(result);

        assertThat(markdown)
                .startsWith("# API docs port report")
                .contains("Status: **completed**")
                .contains("| IntelliSense members loaded | 1200 |")
                .contains("| Docs members loaded | 17 |")
                .contains("| Modified elements | 0 |")
                .contains("## Modified files\nNone.")
                .contains("## Warnings\n- Duplicate Docs member M:MyNamespace.MyType.MyMethod in MyType.xml")
                .doesNotContain("## Errors")
                .doesNotContain("## Undocumented APIs");
    }

    @Test
    void testRenderFailure() throws Exception {
        ToolDiagnostics diagnostics = new ToolDiagnostics();
        diagnostics.getErrors().add("Skipping unreadable xml file broken.xml: boom");

        String markdown = renderer.render(PortResult.failure("No IntelliSense xml comments found.", diagnostics));

        assertThat(markdown)
                .contains("Status: **failed** No IntelliSense xml comments found.")
                .contains("## Errors\n- Skipping unreadable xml file broken.xml: boom")
                .doesNotContain("## Modified files");
    }

    @Test
    void testWriteCreatesParentDirectories() throws Exception {
        Path reportFile = tempDir.resolve("reports").resolve("port.md");

        renderer.write(PortResult.failure("Aborted.", new ToolDiagnostics()), reportFile);

        assertThat(Files.readString(reportFile)).contains("Status: **failed** Aborted.");
    }
}
