package com.apidocs.porter;

import com.apidocs.porter.cli.PortCommand;
import picocli.CommandLine;

/**
 * Main entry point for the API docs porter.
 * Copies IntelliSense xml comments into the undocumented parts of a Docs xml repository.
 */
public class PorterApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new PortCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
