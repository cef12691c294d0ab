package com.layoutparser.generator.cli;

import com.layoutparser.generator.cli.model.ValidatedCommonOptions;
import com.layoutparser.generator.codegen.MapGenerationResult;

import picocli.CommandLine.Command;

@Command(
        name = "generate-map",
        mixinStandardHelpOptions = true,
        description = "Generates the TCL map document for a positional layout."
)
public class GenerateMapCommand extends AbstractLayoutCommand {

    @Override
    protected String commandName() {
        return "generate-map";
    }

    @Override
    protected ValidatedCommonOptions validate() {
        return validator.validate(options);
    }

    @Override
    protected int execute(ValidatedCommonOptions validated) {
        MapGenerationResult result = generator(validated, baseConfig(validated).build())
                .generateMap(options.getLayout());
        printer.printMapResult(result);
        if (result.isSuccess() && validated.getOutputDir() == null) {
            System.out.println(result.getContent());
        }
        return result.isSuccess() ? 0 : 1;
    }
}
