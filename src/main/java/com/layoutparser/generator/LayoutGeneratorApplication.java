package com.layoutparser.generator;

import com.layoutparser.generator.cli.LayoutToolCommand;
import picocli.CommandLine;

/**
 * Main entry point for the layout transform generator.
 * Generates TCL maps and XSL stylesheets from positional layouts and mappers,
 * and synthesizes record lines that validate against a layout.
 */
public class LayoutGeneratorApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new LayoutToolCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
