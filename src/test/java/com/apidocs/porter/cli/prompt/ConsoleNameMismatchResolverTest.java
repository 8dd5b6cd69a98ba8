package com.apidocs.porter.cli.prompt;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;

import com.apidocs.porter.porting.MismatchDecision;
import com.apidocs.porter.porting.NameMismatch;

import static org.assertj.core.api.Assertions.*;

class ConsoleNameMismatchResolverTest {

    private static final NameMismatch MISMATCH = NameMismatch.builder()
            .kind(NameMismatch.Kind.PARAM)
            .docId("M:MyNamespace.MyType.MyMethod(System.Int32,System.String)")
            .filePath(Path.of("MyType.xml"))
            .docsName("oldName")
            .candidate("count")
            .candidate("name")
            .build();

    private final ByteArrayOutputStream output = new ByteArrayOutputStream();

    @Test
    void testSelectCandidate() {
        MismatchDecision decision = resolve("1\n3\n");

        assertThat(decision.getOutcome()).isEqualTo(MismatchDecision.Outcome.SELECT);
        assertThat(decision.getSelectedName()).isEqualTo("name");
        assertThat(printed())
                .contains("Problem in param 'oldName' of M:MyNamespace.MyType.MyMethod(System.Int32,System.String)")
                .contains("  1 - Select the correct IntelliSense param name from a list.")
                .contains("  2 - count")
                .contains("  3 - name");
    }

    @Test
    void testIgnore() {
        assertThat(resolve("2\n").getOutcome()).isEqualTo(MismatchDecision.Outcome.SKIP);
        assertThat(resolve("1\n1\n").getOutcome()).isEqualTo(MismatchDecision.Outcome.SKIP);
    }

    @Test
    void testInvalidInputAsksAgain() {
        MismatchDecision decision = resolve("abc\n7\n1\n9\n2\n");

        assertThat(decision.getSelectedName()).isEqualTo("count");
        assertThat(printed().split("Invalid selection. Try again.", -1)).hasSize(4);
    }

    @Test
    void testExitAndEndOfInputAbort() {
        assertThat(resolve("0\n").getOutcome()).isEqualTo(MismatchDecision.Outcome.ABORT);
        assertThat(resolve("1\n0\n").getOutcome()).isEqualTo(MismatchDecision.Outcome.ABORT);
        assertThat(resolve("").getOutcome()).isEqualTo(MismatchDecision.Outcome.ABORT);
    }

    private MismatchDecision resolve(String input) {
        PrintStream out = new PrintStream(output, true, StandardCharsets.UTF_8);
        return new ConsoleNameMismatchResolver(new BufferedReader(new StringReader(input)), out).resolve(MISMATCH);
    }

    private String printed() {
        return output.toString(StandardCharsets.UTF_8);
    }
}
