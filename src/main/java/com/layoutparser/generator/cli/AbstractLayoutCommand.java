package com.layoutparser.generator.cli;

import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.layoutparser.generator.cli.exception.OptionsValidationException;
import com.layoutparser.generator.cli.model.CommonOptions;
import com.layoutparser.generator.cli.model.ValidatedCommonOptions;
import com.layoutparser.generator.cli.output.ResultsPrinter;
import com.layoutparser.generator.cli.validation.LayoutToolOptionsValidator;
import com.layoutparser.generator.codegen.LayoutArtifactGenerator;
import com.layoutparser.generator.collaborator.CachingLayoutStore;
import com.layoutparser.generator.collaborator.Decryptor;
import com.layoutparser.generator.collaborator.DirectoryLayoutStore;
import com.layoutparser.generator.collaborator.DirectoryMappingStore;
import com.layoutparser.generator.collaborator.ProcessDecryptor;
import com.layoutparser.generator.config.FieldHeuristics;
import com.layoutparser.generator.config.GeneratorConfig;
import com.layoutparser.generator.learning.JsonLearnedModelStore;
import com.layoutparser.generator.learning.LearnedModelStore;
import com.layoutparser.generator.parser.LayoutXmlParser;
import com.layoutparser.generator.parser.MapperXmlParser;

import picocli.CommandLine;
import picocli.CommandLine.Mixin;

/**
 * Validates options, wires the stores and runs one layoutgen subcommand.
 */
public abstract class AbstractLayoutCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AbstractLayoutCommand.class);

    @Mixin
    protected CommonOptions options;

    protected final LayoutToolOptionsValidator validator = new LayoutToolOptionsValidator();
    protected final ResultsPrinter printer = new ResultsPrinter();

    @Override
    public Integer call() {
        try {
            ValidatedCommonOptions validated = validate();
            printer.printBanner(commandName(), options, validated);
            return execute(validated);
        } catch (OptionsValidationException e) {
            printer.printOptionErrors(e.getErrors());
            return CommandLine.ExitCode.USAGE;
        } catch (Exception e) {
            log.error("{} failed with exception", commandName(), e);
            return CommandLine.ExitCode.SOFTWARE;
        }
    }

    protected abstract String commandName();

    protected abstract ValidatedCommonOptions validate();

    protected abstract int execute(ValidatedCommonOptions validated) throws Exception;

    protected GeneratorConfig.GeneratorConfigBuilder baseConfig(ValidatedCommonOptions v) {
        return GeneratorConfig.builder()
                .collaboratorTimeout(v.getTimeout())
                .outputDir(v.getOutputDir())
                .force(options.isForce());
    }

    protected LayoutArtifactGenerator generator(ValidatedCommonOptions v, GeneratorConfig config) {
        FieldHeuristics heuristics = v.getHeuristicsFile() != null
                ? FieldHeuristics.load(v.getHeuristicsFile())
                : FieldHeuristics.defaults();
        Decryptor decryptor = v.getDecryptCommand().isEmpty()
                ? Decryptor.identity()
                : new ProcessDecryptor(v.getDecryptCommand(), v.getTimeout());
        LearnedModelStore models = v.getModelsDir() != null
                ? new JsonLearnedModelStore(v.getModelsDir())
                : LearnedModelStore.none();
        return new LayoutArtifactGenerator(config,
                new CachingLayoutStore(new DirectoryLayoutStore(v.getLayoutsDir(), new LayoutXmlParser(heuristics), decryptor)),
                new DirectoryMappingStore(v.getMapperDir(), new MapperXmlParser(), decryptor),
                models,
                heuristics);
    }
}
