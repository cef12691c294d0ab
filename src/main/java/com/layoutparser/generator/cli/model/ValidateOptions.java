package com.layoutparser.generator.cli.model;

import java.nio.file.Path;

import lombok.Getter;
import picocli.CommandLine.Option;

@Getter
public class ValidateOptions {

	@Option(names = { "--input", "-i" }, required = true, description = "Text file with one record line per line")
	private Path input;

	@Option(names = { "--line-width", "-w" }, description = "Overrides the layout line width")
	private Integer lineWidth;
}
