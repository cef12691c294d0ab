package com.layoutparser.generator.synthesis;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.layoutparser.generator.config.GeneratorConfig;
import com.layoutparser.generator.exception.StructureException;
import com.layoutparser.generator.model.Layout;
import com.layoutparser.generator.model.LineDef;
import com.layoutparser.generator.validation.LineValidationResult;
import com.layoutparser.generator.validation.RecordValidator;

/**
 * Synthesizes records line by line: generate a candidate, validate it, and either accept
 * it or retry with the validator's errors as feedback. After the retry budget the last
 * candidate is forced to width, accepted, and reported as an unresolved defect.
 */
public class IncrementalSynthesizer {

    private static final Logger log = LoggerFactory.getLogger(IncrementalSynthesizer.class);

    private final RecordValidator validator;
    private final GeneratorConfig config;

    public IncrementalSynthesizer(RecordValidator validator, GeneratorConfig config) {
        this.validator = validator;
        this.config = config;
    }

    public SynthesisResult synthesize(Layout layout, int recordCount, CandidateProviderFactory providers) {
        if (layout.getLines().isEmpty()) {
            throw new StructureException("Layout " + layout.getName() + " has no lines");
        }
        if (recordCount < 1) {
            return SynthesisResult.failure("Record count must be at least 1, got " + recordCount);
        }

        log.info("Synthesizing {} record(s) for layout {}", recordCount, layout.getName());
        SynthesisResult result = SynthesisResult.builder().success(true).layoutName(layout.getName()).build();

        int workers = Math.min(Math.max(1, config.getParallelism()), recordCount);
        if (workers == 1) {
            for (int i = 0; i < recordCount; i++) {
                result.getRecords().add(synthesizeRecord(layout, i, providers.forRecord(i)));
            }
        } else {
            runParallel(layout, recordCount, providers, workers, result);
        }

        for (RecordSynthesis record : result.getRecords()) {
            record.getDefects().forEach(d -> result.getWarnings().add("Unresolved defect in " + d.describe()));
        }
        if (!result.getErrors().isEmpty()) {
            result.setSuccess(false);
            result.setErrorMessage(result.getErrors().get(0));
        }
        log.info("Synthesized {} line(s), {} unresolved defect(s)", result.lineCount(), result.defects().size());
        return result;
    }

    private void runParallel(Layout layout, int recordCount, CandidateProviderFactory providers, int workers,
            SynthesisResult result) {
        ExecutorService pool = Executors.newFixedThreadPool(workers);
        try {
            List<Future<RecordSynthesis>> futures = new ArrayList<>();
            for (int i = 0; i < recordCount; i++) {
                int recordIndex = i;
                futures.add(pool.submit(() -> synthesizeRecord(layout, recordIndex, providers.forRecord(recordIndex))));
            }
            for (int i = 0; i < futures.size(); i++) {
                try {
                    result.getRecords().add(futures.get(i).get());
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    result.getErrors().add("Record " + (i + 1) + " failed: " + cause.getMessage());
                    log.error("Record {} failed", i + 1, cause);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            result.getErrors().add("Synthesis interrupted");
        } finally {
            pool.shutdownNow();
        }
    }

    public RecordSynthesis synthesizeRecord(Layout layout, int recordIndex, CandidateContentProvider provider) {
        int lineWidth = config.effectiveLineWidth(layout.getLineWidth());
        List<SynthesizedLine> lines = new ArrayList<>();
        List<UnresolvedDefect> defects = new ArrayList<>();

        int lineNumber = 0;
        for (LineDef line : layout.getLines()) {
            int occurrences = occurrencesOf(line);
            for (int occurrence = 0; occurrence < occurrences; occurrence++) {
                lineNumber++;
                LineRequest request = LineRequest.builder()
                        .layout(layout)
                        .line(line)
                        .lineWidth(lineWidth)
                        .recordIndex(recordIndex)
                        .occurrence(occurrence)
                        .lineNumber(lineNumber)
                        .build();
                SynthesizedLine accepted = synthesizeLine(request, provider);
                lines.add(accepted);
                if (accepted.isNormalized()) {
                    defects.add(new UnresolvedDefect(recordIndex, line.getName(), occurrence, accepted.getErrors()));
                }
            }
        }
        return new RecordSynthesis(recordIndex, lines, defects);
    }

    SynthesizedLine synthesizeLine(LineRequest initial, CandidateContentProvider provider) {
        LineDef line = initial.getLine();
        LineRequest request = initial;
        SynthesisState state = SynthesisState.GENERATE;
        int retries = 0;
        String candidate = null;
        String collaboratorError = null;
        LineValidationResult validation = null;

        while (true) {
            switch (state) {
                case GENERATE -> {
                    collaboratorError = null;
                    try {
                        candidate = provider.generate(request);
                    } catch (RuntimeException e) {
                        // any provider failure costs one attempt
                        log.warn("Content provider failed for line {}: {}", line.getName(), e.getMessage());
                        collaboratorError = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                        candidate = null;
                    }
                    if (candidate == null) {
                        candidate = "";
                    }
                    state = SynthesisState.VALIDATE;
                }
                case VALIDATE -> {
                    validation = validator.validateLine(candidate, line, request.getLineWidth());
                    if (collaboratorError != null) {
                        validation.addError("collaborator failure: " + collaboratorError);
                    }
                    if (validation.isValid()) {
                        state = SynthesisState.ACCEPT;
                    } else if (retries < config.getMaxRetries()) {
                        state = SynthesisState.RETRY;
                    } else {
                        state = SynthesisState.GIVE_UP;
                    }
                }
                case RETRY -> {
                    retries++;
                    log.debug("Retrying line {} ({}/{}): {}", line.getName(), retries, config.getMaxRetries(),
                            validation.getErrors());
                    request = request.toBuilder()
                            .priorAttempt(candidate)
                            .clearPriorErrors()
                            .priorErrors(validation.getErrors())
                            .build();
                    state = SynthesisState.GENERATE;
                }
                case ACCEPT -> {
                    return new SynthesizedLine(line.getName(), request.getOccurrence(), candidate, retries + 1, false,
                            List.of());
                }
                case GIVE_UP -> {
                    String normalized = ComposingCandidateProvider.fitLine(candidate, request.getLineWidth());
                    log.warn("Giving up on line {} of record {} after {} retries: {}", line.getName(),
                            request.getRecordIndex() + 1, retries, validation.getErrors());
                    return new SynthesizedLine(line.getName(), request.getOccurrence(), normalized, retries + 1, true,
                            List.copyOf(validation.getErrors()));
                }
            }
        }
    }

    /**
     * Bounded lines repeat up to {@code maxOccurs} (capped); unbounded lines use the cap.
     * Never fewer than {@code minOccurs}.
     */
    int occurrencesOf(LineDef line) {
        int cap = Math.max(1, config.getOccurrenceCap());
        int count = line.getMaxOccurs() > 0 ? Math.min(line.getMaxOccurs(), cap) : cap;
        return Math.max(count, line.getMinOccurs());
    }
}
