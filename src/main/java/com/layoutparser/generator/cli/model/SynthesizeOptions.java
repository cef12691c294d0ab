package com.layoutparser.generator.cli.model;

import com.layoutparser.generator.synthesis.GenerationMode;

import lombok.Getter;
import picocli.CommandLine.Option;

@Getter
public class SynthesizeOptions {

	@Option(names = { "--records", "-r" }, defaultValue = "1", description = "Number of records to synthesize")
	private int records;

	@Option(names = { "--mode" }, defaultValue = "DETERMINISTIC", description = "Content mode: DETERMINISTIC or RANDOM")
	private GenerationMode mode;

	@Option(names = { "--seed" }, description = "Seed for RANDOM mode")
	private Long seed;

	@Option(names = { "--line-width", "-w" }, description = "Overrides the layout line width")
	private Integer lineWidth;

	@Option(names = { "--occurrences" }, defaultValue = "1", description = "Occurrence cap for repeatable lines")
	private int occurrences;

	@Option(names = { "--parallelism" }, description = "Records synthesized concurrently (defaults to CPU count)")
	private Integer parallelism;

	@Option(names = { "--max-retries" }, defaultValue = "3", description = "Retries per line before giving up")
	private int maxRetries;
}
