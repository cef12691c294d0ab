package com.layoutparser.generator.cli.model;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Normalized paths and parsed values derived from {@link CommonOptions}.
 */
@Data
@AllArgsConstructor
public class ValidatedCommonOptions {
    Path layoutsDir;
    Path mapperDir;
    Path modelsDir;
    Path outputDir;
    Path heuristicsFile;
    List<String> decryptCommand;
    Duration timeout;
}
