package com.layoutparser.generator.cli.model;

import java.nio.file.Path;

import lombok.Getter;
import picocli.CommandLine.Option;

@Getter
public class TransformOptions {

	@Option(names = { "--example-output", "-x" }, description = "Example output XML used to detect root element and namespace")
	private Path exampleOutput;

	@Option(names = { "--prefer-embedded-xsl" }, description = "Use XSL embedded in the mapper instead of generating one")
	private boolean preferEmbeddedXsl;
}
