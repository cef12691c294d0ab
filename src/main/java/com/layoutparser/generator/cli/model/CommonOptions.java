package com.layoutparser.generator.cli.model;

import java.nio.file.Path;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Options shared by every subcommand: where layouts and mappers live and where artifacts go.
 */
@Getter
public class CommonOptions {

	@Option(names = { "--layout", "-l" }, required = true, description = "Layout GUID or name")
	private String layout;

	@Option(names = { "--layouts-dir", "-d" }, defaultValue = ".", description = "Directory holding LayoutVO XML files")
	private Path layoutsDir;

	@Option(names = { "--mapper", "-m" }, description = "Directory holding MapperVO XML files (defaults to --layouts-dir)")
	private Path mapperDir;

	@Option(names = { "--models-dir" }, description = "Directory with learned models (<layout>_tcl.json, <layout>_xsl.json)")
	private Path modelsDir;

	@Option(names = { "--heuristics" }, description = "Field heuristics properties file (defaults to the bundled table)")
	private Path heuristicsFile;

	@Option(names = { "--decrypt-command" }, description = "Command that decrypts stored layouts from stdin to stdout (space separated)")
	private String decryptCommand;

	@Option(names = { "--timeout-seconds" }, defaultValue = "30", description = "Timeout for external collaborators")
	private int timeoutSeconds;

	@Option(names = { "--output-dir", "-o" }, description = "Directory for generated artifacts (nothing is written when absent)")
	private Path outputDir;

	@Option(names = { "--force", "-f" }, description = "Overwrite existing artifacts")
	private boolean force;
}
