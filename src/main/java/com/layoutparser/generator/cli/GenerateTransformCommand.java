package com.layoutparser.generator.cli;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import com.layoutparser.generator.cli.model.TransformOptions;
import com.layoutparser.generator.cli.model.ValidatedCommonOptions;
import com.layoutparser.generator.codegen.TransformGenerationResult;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

@Command(
        name = "generate-transform",
        mixinStandardHelpOptions = true,
        description = "Generates the XSL stylesheet for the mapper whose input is the given layout."
)
public class GenerateTransformCommand extends AbstractLayoutCommand {

    @Mixin
    private TransformOptions transformOptions;

    @Override
    protected String commandName() {
        return "generate-transform";
    }

    @Override
    protected ValidatedCommonOptions validate() {
        return validator.validate(options, transformOptions);
    }

    @Override
    protected int execute(ValidatedCommonOptions validated) throws IOException {
        String example = transformOptions.getExampleOutput() != null
                ? Files.readString(transformOptions.getExampleOutput(), StandardCharsets.UTF_8)
                : null;
        TransformGenerationResult result = generator(validated, baseConfig(validated)
                        .preferEmbeddedXsl(transformOptions.isPreferEmbeddedXsl())
                        .build())
                .generateTransform(options.getLayout(), example);
        printer.printTransformResult(result);
        if (result.isSuccess() && validated.getOutputDir() == null) {
            System.out.println(result.getStylesheet());
        }
        return result.isSuccess() ? 0 : 1;
    }
}
