package com.layoutparser.generator.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top level {@code layoutgen} command; the work happens in its subcommands.
 */
@Command(
        name = "layoutgen",
        mixinStandardHelpOptions = true,
        version = "layout-transform-generator 1.0.0",
        description = "Generates TCL maps and XSL transforms from positional layouts, applies them to records and synthesizes test records.",
        subcommands = {
                GenerateMapCommand.class,
                GenerateTransformCommand.class,
                TransformRecordCommand.class,
                ValidateCommand.class,
                SynthesizeCommand.class
        }
)
public class LayoutToolCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing subcommand");
    }
}
