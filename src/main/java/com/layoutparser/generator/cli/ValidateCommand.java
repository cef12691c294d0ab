package com.layoutparser.generator.cli;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;

import com.layoutparser.generator.cli.model.ValidateOptions;
import com.layoutparser.generator.cli.model.ValidatedCommonOptions;
import com.layoutparser.generator.config.GeneratorConfig;
import com.layoutparser.generator.validation.RecordValidationReport;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

@Command(
        name = "validate",
        mixinStandardHelpOptions = true,
        description = "Validates record lines against a positional layout."
)
public class ValidateCommand extends AbstractLayoutCommand {

    @Mixin
    private ValidateOptions validateOptions;

    @Override
    protected String commandName() {
        return "validate";
    }

    @Override
    protected ValidatedCommonOptions validate() {
        return validator.validate(options, validateOptions);
    }

    @Override
    protected int execute(ValidatedCommonOptions validated) throws IOException {
        List<String> lines = Files.readAllLines(validateOptions.getInput(), StandardCharsets.UTF_8);
        GeneratorConfig.GeneratorConfigBuilder config = baseConfig(validated);
        if (validateOptions.getLineWidth() != null) {
            config.lineWidthOverride(validateOptions.getLineWidth());
        }
        RecordValidationReport report = generator(validated, config.build()).validate(options.getLayout(), lines);
        printer.printValidationReport(report);
        return report.isValid() ? 0 : 1;
    }
}
