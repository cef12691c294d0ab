package com.layoutparser.generator.cli.output;

import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.layoutparser.generator.cli.model.CommonOptions;
import com.layoutparser.generator.cli.model.ValidatedCommonOptions;
import com.layoutparser.generator.codegen.MapGenerationResult;
import com.layoutparser.generator.codegen.RecordTransformResult;
import com.layoutparser.generator.codegen.TransformGenerationResult;
import com.layoutparser.generator.codegen.transform.LookupPlan;
import com.layoutparser.generator.synthesis.SynthesisResult;
import com.layoutparser.generator.synthesis.UnresolvedDefect;
import com.layoutparser.generator.validation.LineValidationResult;
import com.layoutparser.generator.validation.RecordValidationReport;

/**
 * Prints CLI output for the layoutgen subcommands. No validation, no execution.
 */
public class ResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(ResultsPrinter.class);

    private static final String RULE = "=================================================";

    public void printBanner(String command, CommonOptions o, ValidatedCommonOptions v) {
        log.info(RULE);
        log.info("Layout Transform Generator: {}", command);
        log.info(RULE);
        log.info("Layout: {}", o.getLayout());
        log.info("Layouts Directory: {}", v.getLayoutsDir());
        log.info("Mapper Directory: {}", v.getMapperDir());
        log.info("Models Directory: {}", v.getModelsDir() != null ? v.getModelsDir() : "None");
        log.info("Field Heuristics: {}", v.getHeuristicsFile() != null ? v.getHeuristicsFile() : "Bundled");
        log.info("Decryption: {}", v.getDecryptCommand().isEmpty() ? "None" : String.join(" ", v.getDecryptCommand()));
        log.info("Output Directory: {}", v.getOutputDir() != null ? v.getOutputDir() : "None (stdout only)");
        log.info(RULE);
    }

    public void printMapResult(MapGenerationResult result) {
        if (!result.isSuccess()) {
            printFailure("MAP GENERATION FAILED", result.getErrors());
            return;
        }
        log.info("");
        log.info(RULE);
        log.info("MAP GENERATED");
        log.info(RULE);
        log.info("Layout: {}", result.getLayoutName());
        log.info("Lines: {}", result.getMap().getLines().size());
        log.info("Output Path: {}", result.getOutputPath() != null ? result.getOutputPath().toAbsolutePath() : "None");
        printList("Warnings", result.getWarnings());
        printList("Suggestions", result.getSuggestions());
        log.info(RULE);
    }

    public void printTransformResult(TransformGenerationResult result) {
        if (!result.isSuccess()) {
            printFailure("TRANSFORM GENERATION FAILED", result.getErrors());
            return;
        }
        log.info("");
        log.info(RULE);
        log.info("TRANSFORM GENERATED");
        log.info(RULE);
        log.info("Mapper: {}", result.getMappingName());
        log.info("Root Element: {}", result.getTransform().getRootElement());
        log.info("Namespace: {}", result.getTransform().getNamespace());
        log.info("Rule Assignments: {}", result.getTransform().getAssignmentCount());
        log.info("Link Mapping Lookups: {}", result.getTransform().getLookupPlans().size());
        if (result.getTransform().isFromEmbeddedXsl()) {
            log.info("Source: XSL embedded in mapper");
        }
        for (LookupPlan plan : result.getTransform().getLookupPlans()) {
            log.debug("  {} -> {} candidates", plan.getElementName(), plan.getEmbedded().size());
        }
        log.info("Output Path: {}", result.getOutputPath() != null ? result.getOutputPath().toAbsolutePath() : "None");
        printList("Warnings", result.getWarnings());
        printList("Suggestions", result.getSuggestions());
        log.info(RULE);
    }

    public void printRecordTransformResult(RecordTransformResult result) {
        if (!result.isSuccess()) {
            printFailure("RECORD TRANSFORMATION FAILED", result.getErrors());
            return;
        }
        log.info("");
        log.info(RULE);
        log.info("RECORD TRANSFORMED");
        log.info(RULE);
        log.info("Layout: {}", result.getLayoutName());
        log.info("Mapper: {}", result.getMappingName());
        log.debug("Intermediate record: {}", result.getIntermediateXml());
        log.info("Output Path: {}", result.getOutputPath() != null ? result.getOutputPath().toAbsolutePath() : "None");
        printList("Warnings", result.getWarnings());
        log.info(RULE);
    }

    public void printValidationReport(RecordValidationReport report) {
        log.info("");
        log.info(RULE);
        log.info(report.isValid() ? "RECORD VALID" : "RECORD INVALID");
        log.info(RULE);
        log.info("Layout: {}", report.getLayoutName());
        log.info("Lines Checked: {}", report.getLines().size());
        log.info("Invalid Lines: {}", report.invalidLineCount());
        for (Map.Entry<Integer, LineValidationResult> entry : report.getLines().entrySet()) {
            LineValidationResult line = entry.getValue();
            for (String error : line.getErrors()) {
                log.error("  line {} ({}): {}", entry.getKey(), line.getLineName(), error);
            }
            for (String warning : line.getWarnings()) {
                log.warn("  line {} ({}): {}", entry.getKey(), line.getLineName(), warning);
            }
        }
        log.info(RULE);
    }

    public void printSynthesisResult(SynthesisResult result) {
        if (!result.isSuccess()) {
            printFailure("SYNTHESIS FAILED", result.getErrors());
            return;
        }
        log.info("");
        log.info(RULE);
        log.info("SYNTHESIS COMPLETE");
        log.info(RULE);
        log.info("Layout: {}", result.getLayoutName());
        log.info("Records: {}", result.getRecords().size());
        log.info("Lines: {}", result.lineCount());
        log.info("Output Path: {}", result.getOutputPath() != null ? result.getOutputPath().toAbsolutePath() : "None");
        List<UnresolvedDefect> defects = result.defects();
        if (!defects.isEmpty()) {
            log.warn("Unresolved Defects: {}", defects.size());
            defects.forEach(d -> log.warn("  {}", d.describe()));
        }
        printList("Warnings", result.getWarnings());
        log.info(RULE);
    }

    public void printOptionErrors(List<String> errors) {
        log.error("Invalid options:");
        errors.forEach(e -> log.error("  - {}", e));
    }

    private void printFailure(String title, List<String> errors) {
        log.error(RULE);
        log.error(title);
        log.error(RULE);
        errors.forEach(e -> log.error("  - {}", e));
    }

    private void printList(String title, List<String> items) {
        if (items == null || items.isEmpty()) {
            return;
        }
        log.info("");
        log.info("{}:", title);
        items.forEach(i -> log.info("  - {}", i));
    }
}
