package com.layoutparser.generator.cli;

import com.layoutparser.generator.cli.model.SynthesizeOptions;
import com.layoutparser.generator.cli.model.ValidatedCommonOptions;
import com.layoutparser.generator.config.GeneratorConfig;
import com.layoutparser.generator.synthesis.CandidateProviderFactory;
import com.layoutparser.generator.synthesis.CandidateProviders;
import com.layoutparser.generator.synthesis.GenerationMode;
import com.layoutparser.generator.synthesis.RecordSynthesis;
import com.layoutparser.generator.synthesis.SynthesisResult;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

@Command(
        name = "synthesize",
        mixinStandardHelpOptions = true,
        description = "Synthesizes record lines that validate against a positional layout."
)
public class SynthesizeCommand extends AbstractLayoutCommand {

    @Mixin
    private SynthesizeOptions synthesizeOptions;

    @Override
    protected String commandName() {
        return "synthesize";
    }

    @Override
    protected ValidatedCommonOptions validate() {
        return validator.validate(options, synthesizeOptions);
    }

    @Override
    protected int execute(ValidatedCommonOptions validated) {
        GeneratorConfig.GeneratorConfigBuilder builder = baseConfig(validated)
                .occurrenceCap(synthesizeOptions.getOccurrences())
                .maxRetries(synthesizeOptions.getMaxRetries())
                .seed(synthesizeOptions.getSeed());
        if (synthesizeOptions.getLineWidth() != null) {
            builder.lineWidthOverride(synthesizeOptions.getLineWidth());
        }
        if (synthesizeOptions.getParallelism() != null) {
            builder.parallelism(synthesizeOptions.getParallelism());
        }
        GeneratorConfig config = builder.build();

        CandidateProviderFactory providers = synthesizeOptions.getMode() == GenerationMode.RANDOM
                ? CandidateProviders.random(config)
                : CandidateProviders.deterministic(config);

        SynthesisResult result = generator(validated, config)
                .synthesize(options.getLayout(), synthesizeOptions.getRecords(), providers);
        printer.printSynthesisResult(result);
        if (result.isSuccess() && validated.getOutputDir() == null) {
            for (RecordSynthesis record : result.getRecords()) {
                record.contents().forEach(System.out::println);
            }
        }
        return result.isSuccess() ? 0 : 1;
    }
}
