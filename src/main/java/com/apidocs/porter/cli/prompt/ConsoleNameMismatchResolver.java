package com.apidocs.porter.cli.prompt;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.util.List;

import com.apidocs.porter.porting.MismatchDecision;
import com.apidocs.porter.porting.NameMismatch;
import com.apidocs.porter.porting.NameMismatchResolver;

/**
 * Asks the operator on the console which IntelliSense name a Docs param or
 * typeparam corresponds to.
 *
 * Main menu: {@code 0} exit, {@code 1} pick from the list, {@code 2} skip.
 * Selection list: {@code 0} exit, {@code 1} skip, {@code 2..n} candidates.
 * Invalid input asks again; end of input exits.
 */
public class ConsoleNameMismatchResolver implements NameMismatchResolver {

    private final BufferedReader in;
    private final PrintStream out;

    public ConsoleNameMismatchResolver() {
        this(new BufferedReader(new InputStreamReader(System.in, Charset.defaultCharset())), System.out);
    }

    public ConsoleNameMismatchResolver(BufferedReader in, PrintStream out) {
        this.in = in;
        this.out = out;
    }

    @Override
    public MismatchDecision resolve(NameMismatch mismatch) {
        String element = mismatch.getKind().getElementName();
        out.println();
        out.println("Problem in " + element + " '" + mismatch.getDocsName() + "' of " + mismatch.getDocId()
                + " in file " + mismatch.getFilePath() + ":");
        out.println("The " + element + " name was not found in the IntelliSense xml.");

        while (true) {
            out.println("  0 - Exit program.");
            out.println("  1 - Select the correct IntelliSense " + element + " name from a list.");
            out.println("  2 - Ignore this " + element + ".");
            Integer choice = readChoice();
            if (choice == null || choice == 0) {
                return MismatchDecision.abort();
            }
            if (choice == 2) {
                return MismatchDecision.skip();
            }
            if (choice == 1) {
                return selectCandidate(element, mismatch.getCandidates());
            }
            out.println("Invalid selection. Try again.");
        }
    }

    private MismatchDecision selectCandidate(String element, List<String> candidates) {
        while (true) {
            out.println("IntelliSense " + element + " names:");
            out.println("  0 - Exit program.");
            out.println("  1 - Ignore this " + element + ".");
            for (int i = 0; i < candidates.size(); i++) {
                out.println("  " + (i + 2) + " - " + candidates.get(i));
            }
            Integer choice = readChoice();
            if (choice == null || choice == 0) {
                return MismatchDecision.abort();
            }
            if (choice == 1) {
                return MismatchDecision.skip();
            }
            if (choice >= 2 && choice < candidates.size() + 2) {
                return MismatchDecision.select(candidates.get(choice - 2));
            }
            out.println("Invalid selection. Try again.");
        }
    }

    /**
     * @return the number typed, -1 when the line is not a number, null at end of input
     */
    private Integer readChoice() {
        out.print("Your choice: ");
        out.flush();
        try {
            String line = in.readLine();
            if (line == null) {
                return null;
            }
            return Integer.parseInt(line.trim());
        } catch (NumberFormatException e) {
            return -1;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
