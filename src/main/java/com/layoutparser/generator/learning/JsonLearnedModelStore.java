package com.layoutparser.generator.learning;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.layoutparser.generator.exception.CollaboratorException;

/**
 * Reads {@code <layout>_tcl.json} and {@code <layout>_xsl.json} models from a directory.
 */
public class JsonLearnedModelStore implements LearnedModelStore {

    private static final Logger log = LoggerFactory.getLogger(JsonLearnedModelStore.class);
    private static final String COLLABORATOR = "learned-model-store";

    private final Path modelsDir;
    private final ObjectMapper objectMapper;

    public JsonLearnedModelStore(Path modelsDir) {
        this.modelsDir = modelsDir;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public Optional<LearnedModel> load(String layoutName, ModelKind kind) {
        Path file = modelsDir.resolve(fileNameFor(layoutName) + kind.getFileSuffix());
        if (!Files.isRegularFile(file)) {
            log.debug("No learned {} model at {}", kind, file);
            return Optional.empty();
        }
        try {
            LearnedModel model = objectMapper.readValue(file.toFile(), LearnedModel.class);
            log.info("Loaded learned {} model for {} ({} patterns, {} rules)", kind, layoutName,
                    model.getPatterns().size(), model.getMappingRules().size());
            return Optional.of(model);
        } catch (IOException e) {
            throw new CollaboratorException(COLLABORATOR, "cannot read " + file + ": " + e.getMessage(), e);
        }
    }

    static String fileNameFor(String layoutName) {
        return layoutName == null ? "unknown" : layoutName.replaceAll("[^A-Za-z0-9]", "_");
    }
}
