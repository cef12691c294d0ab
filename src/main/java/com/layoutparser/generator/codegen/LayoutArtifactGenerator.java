package com.layoutparser.generator.codegen;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;

import com.layoutparser.generator.codegen.transform.GeneratedTransform;
import com.layoutparser.generator.codegen.transform.OutputProfile;
import com.layoutparser.generator.codegen.transform.StylesheetRunner;
import com.layoutparser.generator.codegen.transform.TransformGenerator;
import com.layoutparser.generator.collaborator.LayoutStore;
import com.layoutparser.generator.collaborator.MappingStore;
import com.layoutparser.generator.config.FieldHeuristics;
import com.layoutparser.generator.config.GeneratorConfig;
import com.layoutparser.generator.exception.LayoutGeneratorException;
import com.layoutparser.generator.learning.LearnedMapRefiner;
import com.layoutparser.generator.learning.LearnedModel;
import com.layoutparser.generator.learning.LearnedModelStore;
import com.layoutparser.generator.learning.LearnedPattern;
import com.layoutparser.generator.learning.ModelKind;
import com.layoutparser.generator.learning.PatternComparator;
import com.layoutparser.generator.learning.PatternExtractor;
import com.layoutparser.generator.learning.SimilarityResult;
import com.layoutparser.generator.model.Layout;
import com.layoutparser.generator.model.Mapping;
import com.layoutparser.generator.parser.IntermediateRecordParser;
import com.layoutparser.generator.synthesis.CandidateProviderFactory;
import com.layoutparser.generator.synthesis.IncrementalSynthesizer;
import com.layoutparser.generator.synthesis.SynthesisResult;
import com.layoutparser.generator.validation.RecordValidationReport;
import com.layoutparser.generator.validation.RecordValidator;

/**
 * Runs the generators against the layout and mapping stores: maps, stylesheets, record
 * transformation, synthetic records and record validation, consulting learned models when they exist.
 */
public class LayoutArtifactGenerator {

    private static final Logger log = LoggerFactory.getLogger(LayoutArtifactGenerator.class);

    private final GeneratorConfig config;
    private final LayoutStore layouts;
    private final MappingStore mappings;
    private final LearnedModelStore models;

    private final MapGenerator mapGenerator;
    private final TransformGenerator transformGenerator;
    private final RecordValidator validator;
    private final PatternExtractor extractor;
    private final PatternComparator comparator;
    private final IntermediateRecordParser recordParser;
    private final StylesheetRunner stylesheetRunner;

    public LayoutArtifactGenerator(GeneratorConfig config, LayoutStore layouts, MappingStore mappings,
            LearnedModelStore models, FieldHeuristics heuristics) {
        this.config = config;
        this.layouts = layouts;
        this.mappings = mappings;
        this.models = models;
        TemplateEngine templateEngine = new TemplateEngine();
        this.mapGenerator = new MapGenerator(heuristics, templateEngine);
        this.transformGenerator = new TransformGenerator(config, templateEngine);
        this.validator = new RecordValidator();
        this.extractor = new PatternExtractor();
        this.comparator = new PatternComparator(config);
        this.recordParser = new IntermediateRecordParser();
        this.stylesheetRunner = new StylesheetRunner();
    }

    public MapGenerationResult generateMap(String layoutId) {
        try {
            log.info("Step 1: Loading layout {}", layoutId);
            Optional<Layout> found = layouts.fetch(layoutId);
            if (found.isEmpty()) {
                return MapGenerationResult.failure("Layout not found: " + layoutId);
            }
            Layout layout = found.get();

            log.info("Step 2: Building map for {} ({} lines)", layout.getName(), layout.getLines().size());
            GeneratedMap map = mapGenerator.build(layout);

            List<String> warnings = new ArrayList<>();
            List<String> suggestions = new ArrayList<>();
            Optional<LearnedModel> learned = loadModel(layout.getName(), ModelKind.TCL, warnings);
            if (learned.isPresent()) {
                log.info("Step 3: Comparing with learned model");
                LearnedMapRefiner.Refinement refinement = new LearnedMapRefiner(config.getLearnedHintConfidence())
                        .refine(map, learned.get());
                map = refinement.getMap();
                warnings.addAll(refinement.getChanges());
                List<LearnedPattern> learnedLines = learned.get().patternsOfType(LearnedPattern.TCL_LINE);
                for (LearnedPattern pattern : extractor.fromMap(map)) {
                    suggestions.addAll(comparator.suggestImprovements(pattern, learnedLines));
                }
            }

            log.info("Step 4: Rendering map");
            String content = mapGenerator.render(map);
            Path outputPath = write(ArtifactFiles.fileStem(layout.getName()) + ".tcl", content);

            return MapGenerationResult.builder()
                    .success(true)
                    .layoutName(layout.getName())
                    .map(map)
                    .content(content)
                    .outputPath(outputPath)
                    .warnings(warnings)
                    .suggestions(suggestions)
                    .build();
        } catch (LayoutGeneratorException e) {
            log.error("Map generation failed: {}", e.getMessage());
            return MapGenerationResult.failure(e.getMessage());
        }
    }

    /**
     * @param exampleOutput optional example of the output document, used to detect its root and namespace
     */
    public TransformGenerationResult generateTransform(String inputLayoutId, String exampleOutput) {
        try {
            log.info("Step 1: Loading input layout {} and its mapping", inputLayoutId);
            Optional<Layout> layout = layouts.fetch(inputLayoutId);
            if (layout.isEmpty()) {
                return TransformGenerationResult.failure("Layout not found: " + inputLayoutId);
            }
            Optional<Mapping> mapping = mappings.fetchByInputLayout(layout.get().getId());
            if (mapping.isEmpty()) {
                return TransformGenerationResult.failure("No mapping has input layout " + layout.get().getName());
            }

            TransformGenerationResult result = buildTransform(layout.get(), mapping.get(), exampleOutput);
            result.setOutputPath(write(transformStem(mapping.get(), layout.get()) + ".xsl", result.getStylesheet()));
            return result;
        } catch (LayoutGeneratorException e) {
            log.error("Transform generation failed: {}", e.getMessage());
            return TransformGenerationResult.failure(e.getMessage());
        }
    }

    /**
     * Runs record lines through the stylesheet of the mapping whose input is the given layout:
     * record, intermediate XML, then the mapping's output document.
     */
    public RecordTransformResult transformRecord(String inputLayoutId, List<String> lines, String exampleOutput) {
        try {
            log.info("Step 1: Loading input layout {} and its mapping", inputLayoutId);
            Optional<Layout> layout = layouts.fetch(inputLayoutId);
            if (layout.isEmpty()) {
                return RecordTransformResult.failure("Layout not found: " + inputLayoutId);
            }
            Optional<Mapping> mapping = mappings.fetchByInputLayout(layout.get().getId());
            if (mapping.isEmpty()) {
                return RecordTransformResult.failure("No mapping has input layout " + layout.get().getName());
            }

            TransformGenerationResult transform = buildTransform(layout.get(), mapping.get(), exampleOutput);

            log.info("Step 3: Parsing {} record line(s) into the intermediate record", lines.size());
            Document record = recordParser.parse(lines, layout.get());

            log.info("Step 4: Applying stylesheet");
            String output = stylesheetRunner.apply(transform.getStylesheet(), record);
            Path outputPath = write(transformStem(mapping.get(), layout.get()) + "_output.xml", output);

            return RecordTransformResult.builder()
                    .success(true)
                    .layoutName(layout.get().getName())
                    .mappingName(mapping.get().getName())
                    .intermediateXml(IntermediateRecordParser.serialize(record))
                    .output(output)
                    .outputPath(outputPath)
                    .warnings(transform.getWarnings())
                    .build();
        } catch (LayoutGeneratorException e) {
            log.error("Record transformation failed: {}", e.getMessage());
            return RecordTransformResult.failure(e.getMessage());
        }
    }

    private TransformGenerationResult buildTransform(Layout layout, Mapping mapping, String exampleOutput) {
        List<String> warnings = new ArrayList<>();
        if (mapping.hasEmbeddedXsl() && !config.isPreferEmbeddedXsl()) {
            warnings.add("Mapper " + mapping.getName() + " embeds XSL; generating a new stylesheet instead");
        }

        Optional<LearnedModel> learned = loadModel(layout.getName(), ModelKind.XSL, warnings);
        Map<String, String> hints = learned.map(m -> m.lookupHints(config.getLearnedHintConfidence())).orElse(Map.of());

        log.info("Step 2: Generating stylesheet for mapper {}", mapping.getName());
        OutputProfile profile = OutputProfile.detect(exampleOutput, config);
        GeneratedTransform transform = transformGenerator.generate(mapping, layout, profile, hints);
        warnings.addAll(transform.getWarnings());

        List<String> suggestions = new ArrayList<>();
        learned.ifPresent(model -> suggestions.addAll(compareTemplates(transform.getStylesheet(), model)));

        return TransformGenerationResult.builder()
                .success(true)
                .mappingName(mapping.getName())
                .transform(transform)
                .warnings(warnings)
                .suggestions(suggestions)
                .build();
    }

    private static String transformStem(Mapping mapping, Layout layout) {
        return ArtifactFiles.fileStem(mapping.getName()) + "_" + ArtifactFiles.fileStem(layout.getName());
    }

    public SynthesisResult synthesize(String layoutId, int recordCount, CandidateProviderFactory providers) {
        try {
            Optional<Layout> layout = layouts.fetch(layoutId);
            if (layout.isEmpty()) {
                return SynthesisResult.failure("Layout not found: " + layoutId);
            }
            SynthesisResult result = new IncrementalSynthesizer(validator, config)
                    .synthesize(layout.get(), recordCount, providers);
            if (result.isSuccess()) {
                List<String> allLines = new ArrayList<>();
                result.getRecords().forEach(r -> allLines.addAll(r.contents()));
                result.setOutputPath(write(ArtifactFiles.fileStem(layout.get().getName()) + "_synthetic.txt",
                        String.join(System.lineSeparator(), allLines) + System.lineSeparator()));
            }
            return result;
        } catch (LayoutGeneratorException e) {
            log.error("Synthesis failed: {}", e.getMessage());
            return SynthesisResult.failure(e.getMessage());
        }
    }

    public RecordValidationReport validate(String layoutId, List<String> lines) {
        Layout layout = layouts.fetch(layoutId)
                .orElseThrow(() -> new LayoutGeneratorException("Layout not found: " + layoutId));
        return validator.validateRecord(lines, layout, config.effectiveLineWidth(layout.getLineWidth()));
    }

    private List<String> compareTemplates(String stylesheet, LearnedModel model) {
        List<String> suggestions = new ArrayList<>();
        List<LearnedPattern> learnedTemplates = model.patternsOfType(LearnedPattern.XSL_TEMPLATE);
        for (LearnedPattern template : extractor.fromStylesheet(stylesheet)) {
            List<SimilarityResult> similar = comparator.findMostSimilar(template, learnedTemplates,
                    config.getSimilarityThreshold());
            if (similar.isEmpty()) {
                suggestions.add("Template '" + template.getName() + "' does not resemble any learned template");
            } else if (similar.get(0).getSimilarity() < config.getTransformReviewThreshold()) {
                suggestions.add(String.format("Template '%s' is %.0f%% similar to learned '%s', review it",
                        template.getName(), similar.get(0).getSimilarity() * 100, similar.get(0).getPattern().getName()));
            }
        }
        return suggestions;
    }

    private Optional<LearnedModel> loadModel(String layoutName, ModelKind kind, List<String> warnings) {
        try {
            return models.load(layoutName, kind);
        } catch (LayoutGeneratorException e) {
            warnings.add("Learned " + kind + " model ignored: " + e.getMessage());
            log.warn("Could not load learned {} model for {}: {}", kind, layoutName, e.getMessage());
            return Optional.empty();
        }
    }

    private Path write(String fileName, String content) {
        if (config.getOutputDir() == null) {
            return null;
        }
        Path path = ArtifactFiles.write(config.getOutputDir().resolve(fileName), content, config.isForce());
        log.info("Wrote {}", path.toAbsolutePath());
        return path;
    }
}
