package com.layoutparser.generator.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.layoutparser.generator.cli.exception.OptionsValidationException;
import com.layoutparser.generator.cli.model.CommonOptions;
import com.layoutparser.generator.cli.model.RecordInputOptions;
import com.layoutparser.generator.cli.model.SynthesizeOptions;
import com.layoutparser.generator.cli.model.TransformOptions;
import com.layoutparser.generator.cli.model.ValidateOptions;
import com.layoutparser.generator.cli.model.ValidatedCommonOptions;
import com.layoutparser.generator.synthesis.GenerationMode;

public class LayoutToolOptionsValidator {

	public ValidatedCommonOptions validate(CommonOptions o) {
		return validate(o, new ArrayList<>());
	}

	public ValidatedCommonOptions validate(CommonOptions o, TransformOptions t) {
		List<String> errors = new ArrayList<>();
		if (t.getExampleOutput() != null && !Files.isRegularFile(t.getExampleOutput())) {
			errors.add("Example output file does not exist: " + t.getExampleOutput());
		}
		return validate(o, errors);
	}

	public ValidatedCommonOptions validate(CommonOptions o, TransformOptions t, RecordInputOptions r) {
		List<String> errors = new ArrayList<>();
		if (t.getExampleOutput() != null && !Files.isRegularFile(t.getExampleOutput())) {
			errors.add("Example output file does not exist: " + t.getExampleOutput());
		}
		if (r.getInput() == null || !Files.isRegularFile(r.getInput())) {
			errors.add("Input file does not exist: " + r.getInput());
		}
		return validate(o, errors);
	}

	public ValidatedCommonOptions validate(CommonOptions o, ValidateOptions v) {
		List<String> errors = new ArrayList<>();
		if (v.getInput() == null || !Files.isRegularFile(v.getInput())) {
			errors.add("Input file does not exist: " + v.getInput());
		}
		checkLineWidth(v.getLineWidth(), errors);
		return validate(o, errors);
	}

	public ValidatedCommonOptions validate(CommonOptions o, SynthesizeOptions s) {
		List<String> errors = new ArrayList<>();
		if (s.getRecords() < 1) {
			errors.add("Record count must be at least 1. Got: " + s.getRecords());
		}
		if (s.getMode() == GenerationMode.LLM) {
			errors.add("Mode LLM needs a chat model and is only available through the library API.");
		}
		if (s.getSeed() != null && s.getMode() != GenerationMode.RANDOM) {
			errors.add("--seed only applies to RANDOM mode.");
		}
		if (s.getOccurrences() < 1) {
			errors.add("Occurrence cap must be at least 1. Got: " + s.getOccurrences());
		}
		if (s.getParallelism() != null && s.getParallelism() < 1) {
			errors.add("Parallelism must be at least 1. Got: " + s.getParallelism());
		}
		if (s.getMaxRetries() < 0) {
			errors.add("Max retries must be >= 0. Got: " + s.getMaxRetries());
		}
		checkLineWidth(s.getLineWidth(), errors);
		return validate(o, errors);
	}

	private ValidatedCommonOptions validate(CommonOptions o, List<String> errors) {
		if (isBlank(o.getLayout())) {
			errors.add("Layout is required (--layout / -l).");
		}

		Path layoutsDir = normalize(o.getLayoutsDir() == null ? Path.of(".") : o.getLayoutsDir());
		if (!existsDirectory(layoutsDir)) {
			errors.add("Layouts directory does not exist or is not a directory: " + layoutsDir);
		}

		Path mapperDir = o.getMapperDir() == null ? layoutsDir : normalize(o.getMapperDir());
		if (o.getMapperDir() != null && !existsDirectory(mapperDir)) {
			errors.add("Mapper directory does not exist or is not a directory: " + mapperDir);
		}

		Path modelsDir = o.getModelsDir() == null ? null : normalize(o.getModelsDir());
		if (modelsDir != null && !existsDirectory(modelsDir)) {
			errors.add("Models directory does not exist or is not a directory: " + modelsDir);
		}

		Path heuristicsFile = o.getHeuristicsFile() == null ? null : normalize(o.getHeuristicsFile());
		if (heuristicsFile != null && !Files.isRegularFile(heuristicsFile)) {
			errors.add("Heuristics file does not exist: " + heuristicsFile);
		}

		Path outputDir = o.getOutputDir() == null ? null : normalize(o.getOutputDir());
		if (outputDir != null && Files.exists(outputDir) && !Files.isDirectory(outputDir)) {
			errors.add("Output path is not a directory: " + outputDir);
		}

		if (o.getTimeoutSeconds() <= 0) {
			errors.add("Timeout must be positive. Got: " + o.getTimeoutSeconds());
		}

		List<String> decryptCommand = parseCommand(o.getDecryptCommand());

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		return new ValidatedCommonOptions(layoutsDir, mapperDir, modelsDir, outputDir, heuristicsFile, decryptCommand,
				Duration.ofSeconds(o.getTimeoutSeconds()));
	}

	private static void checkLineWidth(Integer lineWidth, List<String> errors) {
		if (lineWidth != null && lineWidth <= 0) {
			errors.add("Line width must be positive. Got: " + lineWidth);
		}
	}

	private static Path normalize(Path p) {
		return p.toAbsolutePath().normalize();
	}

	private static boolean existsDirectory(Path p) {
		return p != null && Files.exists(p) && Files.isDirectory(p);
	}

	private static boolean isBlank(String s) {
		return s == null || s.trim().isEmpty();
	}

	private static List<String> parseCommand(String raw) {
		if (raw == null || raw.isBlank()) {
			return List.of();
		}
		return Arrays.stream(raw.trim().split("\\s+")).toList();
	}
}
