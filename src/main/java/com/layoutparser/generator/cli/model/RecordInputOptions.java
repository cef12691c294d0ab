package com.layoutparser.generator.cli.model;

import java.nio.file.Path;

import lombok.Getter;
import picocli.CommandLine.Option;

@Getter
public class RecordInputOptions {

	@Option(names = { "--input", "-i" }, required = true, description = "Text file with the record lines to transform")
	private Path input;
}
