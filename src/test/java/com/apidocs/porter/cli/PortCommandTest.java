package com.apidocs.porter.cli;

import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import picocli.CommandLine;

import static org.assertj.core.api.Assertions.*;

class PortCommandTest {

    @TempDir
    Path tempDir;

    @Test
    void testInvalidOptionsExitCode() {
        int exitCode = new CommandLine(new PortCommand()).execute("--docs", tempDir.resolve("missing").toString());

        assertThat(exitCode).isEqualTo(PortCommand.EXIT_INVALID_OPTIONS);
    }

    @Test
    void testFailedRunExitCode() throws Exception {
        Path docs = Files.createDirectories(tempDir.resolve("docs"));
        Path intelliSense = Files.createDirectories(tempDir.resolve("intellisense"));

        int exitCode = new CommandLine(new PortCommand()).execute("-d", docs.toString(), "-i", intelliSense.toString());

        assertThat(exitCode).isEqualTo(PortCommand.EXIT_FAILURE);
    }

    @Test
    void testSuccessfulSaveExitCode() throws Exception {
        Path docs = Files.createDirectories(tempDir.resolve("docs"));
        Path intelliSense = Files.createDirectories(tempDir.resolve("intellisense"));
        Files.writeString(intelliSense.resolve("MyAssembly.xml"), """
                <doc>
                  <assembly>
                    <name>MyAssembly</name>
                  </assembly>
                  <members>
                    <member name="T:MyNamespace.MyType">
                      <summary>Ported summary.</summary>
                    </member>
                  </members>
                </doc>
                """);
        Path docsFile = docs.resolve("MyType.xml");
        Files.writeString(docsFile, """
                <Type Name="MyType" FullName="MyNamespace.MyType">
                  <TypeSignature Language="DocId" Value="T:MyNamespace.MyType" />
                  <Docs>
                    <summary>To be added.</summary>
                  </Docs>
                </Type>
                """);
        Path reportFile = tempDir.resolve("report.md");

        int exitCode = new CommandLine(new PortCommand()).execute(
                "-d", docs.toString(), "-i", intelliSense.toString(), "--save", "--print-undoc",
                "--print-summary-details", "-r", reportFile.toString());

        assertThat(exitCode).isEqualTo(PortCommand.EXIT_OK);
        assertThat(Files.readString(docsFile)).contains("<summary>Ported summary.</summary>");
        assertThat(reportFile).exists();
    }

    @Test
    void testHelpAndVersion() {
        assertThat(new CommandLine(new PortCommand()).execute("--version")).isZero();
        assertThat(new CommandLine(new PortCommand()).execute("--help")).isZero();
    }
}
