package com.apidocs.porter.service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.apidocs.porter.config.MergePolicy;
import com.apidocs.porter.porting.MismatchDecision;
import com.apidocs.porter.porting.NameMismatchResolver;

import static org.assertj.core.api.Assertions.*;

/**
 * Full runs over Docs and IntelliSense directories on disk.
 */
class PortingServiceTest {

    private static final String INTELLISENSE = """
            <?xml version="1.0" encoding="utf-8"?>
            <doc>
              <assembly>
                <name>MyAssembly</name>
              </assembly>
              <members>
                <member name="T:MyNamespace.MyType">
                  <summary>This is the MyType class summary.</summary>
                </member>
                <member name="M:MyNamespace.MyType.Add(System.Int32)">
                  <summary>Adds a value.</summary>
                  <param name="amount">The amount to add.</param>
                </member>
              </members>
            </doc>
            """;

    private static final String DOCS = """
            <Type Name="MyType" FullName="MyNamespace.MyType">
              <TypeSignature Language="DocId" Value="T:MyNamespace.MyType" />
              <AssemblyInfo>
                <AssemblyName>MyAssembly</AssemblyName>
              </AssemblyInfo>
              <Docs>
                <summary>To be added.</summary>
                <remarks>To be added.</remarks>
              </Docs>
              <Members>
                <Member MemberName="Add">
                  <MemberSignature Language="DocId" Value="M:MyNamespace.MyType.Add(System.Int32)" />
                  <MemberType>Method</MemberType>
                  <ReturnValue>
                    <ReturnType>System.Void</ReturnType>
                  </ReturnValue>
                  <Parameters>
                    <Parameter Name="value" Type="System.Int32" />
                  </Parameters>
                  <Docs>
                    <param name="value">To be added.</param>
                    <summary>To be added.</summary>
                    <remarks>To be added.</remarks>
                  </Docs>
                </Member>
              </Members>
            </Type>
            """;

    @TempDir
    Path tempDir;

    private Path docsDir;
    private Path intelliSenseDir;
    private Path docsFile;

    private final PortingService service = new PortingService();

    @BeforeEach
    void setUp() throws Exception {
        docsDir = Files.createDirectories(tempDir.resolve("docs"));
        intelliSenseDir = Files.createDirectories(tempDir.resolve("intellisense"));
        Files.writeString(intelliSenseDir.resolve("MyAssembly.xml"), INTELLISENSE);
        Path namespaceDir = Files.createDirectories(docsDir.resolve("MyNamespace"));
        docsFile = namespaceDir.resolve("MyType.xml");
        Files.writeString(docsFile, DOCS);
        Files.writeString(docsDir.resolve("ns-MyNamespace.xml"), "<Namespace Name=\"MyNamespace\" />");
    }

    @Test
    void testDryRunLeavesFilesUntouched() throws Exception {
        PortResult result = service.port(config().build(), NameMismatchResolver.alwaysSkip());

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getIntelliSenseFilesLoaded()).isEqualTo(1);
        assertThat(result.getIntelliSenseMembersLoaded()).isEqualTo(2);
        assertThat(result.getDocsFilesLoaded()).isEqualTo(1);
        assertThat(result.getDocsTypesLoaded()).isEqualTo(1);
        assertThat(result.getDocsMembersLoaded()).isEqualTo(1);
        assertThat(result.getFilesSaved()).isZero();
        assertThat(result.getReport().getModifiedFiles()).containsExactly(docsFile);
        assertThat(result.getCensus()).isNull();
        assertThat(Files.readString(docsFile)).isEqualTo(DOCS);
    }

    @Test
    void testSaveWritesChangesAndReport() throws Exception {
        Path reportFile = tempDir.resolve("out").resolve("report.md");

        PortResult result = service.port(config().save(true).printUndoc(true).reportFile(reportFile).build(),
                NameMismatchResolver.alwaysSkip());

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getFilesSaved()).isEqualTo(1);
        String saved = Files.readString(docsFile);
        assertThat(saved)
                .contains("<summary>This is the MyType class summary.</summary>")
                .contains("<summary>Adds a value.</summary>")
                .contains("<param name=\"value\">To be added.</param>");
        assertThat(result.getReport().getProblematicApis()).containsExactly(
                "The param value was not found in IntelliSense xml for M:MyNamespace.MyType.Add(System.Int32)");

        // the renamed param stays undocumented
        assertThat(result.getCensus().getParams()).isEqualTo(1);
        assertThat(result.getCensus().getTotal()).isEqualTo(1);

        assertThat(Files.readString(reportFile))
                .contains("Status: **completed**")
                .contains("| Files saved | 1 |")
                .contains("- " + docsFile)
                .contains("| Params | 1 |");
    }

    @Test
    void testMismatchSelectedByResolver() throws Exception {
        MergePolicy policy = MergePolicy.builder().disablePrompts(false).build();

        PortResult result = service.port(config().policy(policy).save(true).build(),
                mismatch -> MismatchDecision.select("amount"));

        assertThat(result.isSuccess()).isTrue();
        assertThat(Files.readString(docsFile)).contains("<param name=\"value\">The amount to add.</param>");
    }

    @Test
    void testAbortSavesNothing() throws Exception {
        MergePolicy policy = MergePolicy.builder().disablePrompts(false).build();

        PortResult result = service.port(config().policy(policy).save(true).build(),
                mismatch -> MismatchDecision.abort());

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.isAborted()).isTrue();
        assertThat(result.getErrorMessage()).contains("'value'");
        assertThat(Files.readString(docsFile)).isEqualTo(DOCS);
    }

    @Test
    void testConsoleFailureIsReportedAsFailure() throws Exception {
        MergePolicy policy = MergePolicy.builder().disablePrompts(false).build();

        PortResult result = service.port(config().policy(policy).save(true).build(), mismatch -> {
            throw new UncheckedIOException(new IOException("stream closed"));
        });

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.isAborted()).isFalse();
        assertThat(result.getErrorMessage()).isEqualTo("Porting failed reading the console: stream closed");
        assertThat(result.getDiagnostics().getErrors()).containsExactly(result.getErrorMessage());
        assertThat(Files.readString(docsFile)).isEqualTo(DOCS);
    }

    @Test
    void testUnreadableFilesAreSkipped() throws Exception {
        Files.writeString(intelliSenseDir.resolve("Broken.xml"), "<doc><members>");

        PortResult result = service.port(config().build(), NameMismatchResolver.alwaysSkip());

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getIntelliSenseFilesLoaded()).isEqualTo(1);
        assertThat(result.getDiagnostics().getErrors())
                .singleElement()
                .asString()
                .startsWith("Skipping unreadable xml file " + intelliSenseDir.resolve("Broken.xml"));
        assertThat(result.getDiagnostics().getSkippedFiles()).containsExactly(intelliSenseDir.resolve("Broken.xml"));
    }

    @Test
    void testEmptyIntelliSenseDirectoryFails() throws Exception {
        Path empty = Files.createDirectories(tempDir.resolve("empty"));

        PortResult result = service.port(config().intelliSenseDirs(List.of(empty)).build(),
                NameMismatchResolver.alwaysSkip());

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.isAborted()).isFalse();
        assertThat(result.getErrorMessage()).isEqualTo("No IntelliSense xml comments found.");
    }

    private PortConfig.PortConfigBuilder config() {
        return PortConfig.builder()
                .docsDir(docsDir)
                .intelliSenseDirs(List.of(intelliSenseDir));
    }
}
