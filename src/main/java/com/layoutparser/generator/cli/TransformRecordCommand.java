package com.layoutparser.generator.cli;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;

import com.layoutparser.generator.cli.model.RecordInputOptions;
import com.layoutparser.generator.cli.model.TransformOptions;
import com.layoutparser.generator.cli.model.ValidatedCommonOptions;
import com.layoutparser.generator.codegen.RecordTransformResult;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

@Command(
        name = "transform",
        mixinStandardHelpOptions = true,
        description = "Transforms record lines with the stylesheet of the mapper whose input is the given layout."
)
public class TransformRecordCommand extends AbstractLayoutCommand {

    @Mixin
    private TransformOptions transformOptions;

    @Mixin
    private RecordInputOptions inputOptions;

    @Override
    protected String commandName() {
        return "transform";
    }

    @Override
    protected ValidatedCommonOptions validate() {
        return validator.validate(options, transformOptions, inputOptions);
    }

    @Override
    protected int execute(ValidatedCommonOptions validated) throws IOException {
        List<String> lines = Files.readAllLines(inputOptions.getInput(), StandardCharsets.UTF_8);
        String example = transformOptions.getExampleOutput() != null
                ? Files.readString(transformOptions.getExampleOutput(), StandardCharsets.UTF_8)
                : null;
        RecordTransformResult result = generator(validated, baseConfig(validated)
                        .preferEmbeddedXsl(transformOptions.isPreferEmbeddedXsl())
                        .build())
                .transformRecord(options.getLayout(), lines, example);
        printer.printRecordTransformResult(result);
        if (result.isSuccess() && validated.getOutputDir() == null) {
            System.out.println(result.getOutput());
        }
        return result.isSuccess() ? 0 : 1;
    }
}
