package com.layoutparser.generator.synthesis;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.layoutparser.generator.collaborator.CollaboratorCalls;
import com.layoutparser.generator.exception.CollaboratorException;
import com.layoutparser.generator.model.FieldDef;
import com.layoutparser.generator.model.LineDef;

import dev.langchain4j.model.chat.ChatModel;

/**
 * Asks a chat model for a line. The prompt lists every field with its exact offset and
 * width; on retries it carries the rejected line and the validator's errors.
 */
public class LlmCandidateProvider implements CandidateContentProvider {

    private static final Logger log = LoggerFactory.getLogger(LlmCandidateProvider.class);

    static final String COLLABORATOR = "language-model";
    static final int MAX_EXAMPLES = 2;

    private final ChatModel chatModel;
    private final Duration timeout;
    private final Map<String, List<String>> examplesByLine;

    public LlmCandidateProvider(ChatModel chatModel, Duration timeout, Map<String, List<String>> examplesByLine) {
        this.chatModel = chatModel;
        this.timeout = timeout;
        this.examplesByLine = examplesByLine;
    }

    @Override
    public String generate(LineRequest request) {
        String prompt = buildPrompt(request);
        log.debug("Requesting line {} (record {}, attempt after {} errors)",
                request.getLine().getName(), request.getRecordIndex(), request.getPriorErrors().size());
        String response = CollaboratorCalls.call(COLLABORATOR, timeout, () -> chatModel.chat(prompt));
        if (response == null) {
            throw new CollaboratorException(COLLABORATOR, "empty response");
        }
        return extractLine(response);
    }

    String buildPrompt(LineRequest request) {
        LineDef line = request.getLine();
        StringBuilder sb = new StringBuilder();
        sb.append("Generate one line of the fixed-width layout '").append(request.getLayout().getName())
                .append("', line type '").append(line.getName()).append("'.\n");
        sb.append("The line must be exactly ").append(request.getLineWidth()).append(" characters long.\n");

        if (line.getInitialValue() != null && !line.getInitialValue().isEmpty()) {
            sb.append("It starts with '").append(line.getInitialValue()).append("'.\n");
        }
        if (!line.isHeader()) {
            sb.append("After the initial value comes the 6 digit sequence '").append(request.sequenceCounter())
                    .append("', then the fields.\n");
        }

        sb.append("\nFields (0-based start, length):\n");
        int position = line.prefixLength();
        for (FieldDef field : line.positionalFields()) {
            sb.append("- ").append(field.getName())
                    .append(" start=").append(position)
                    .append(" length=").append(field.getLength())
                    .append(" kind=").append(field.getKind())
                    .append(" align=").append(field.getAlignment());
            if (field.isRequired()) {
                sb.append(" REQUIRED");
            }
            if (field.hasFixedValue()) {
                sb.append(" value='").append(field.getFixedValue()).append("'");
            } else if (field.hasDomain()) {
                sb.append(" one of ").append(field.getDomain());
            }
            if (field.getDescription() != null && !field.getDescription().isBlank()) {
                sb.append(" (").append(field.getDescription()).append(")");
            }
            sb.append('\n');
            position += field.getLength();
        }
        sb.append("Required fields must never be blank. Pad every field with spaces to its exact length.\n");

        List<String> examples = examplesByLine.getOrDefault(line.getName(), List.of());
        if (!examples.isEmpty()) {
            sb.append("\nValid examples:\n");
            examples.stream().limit(MAX_EXAMPLES).forEach(e -> sb.append(e).append('\n'));
        }

        if (request.isRetry()) {
            sb.append("\nYour previous line was rejected:\n").append(request.getPriorAttempt()).append('\n');
            sb.append("Fix these problems:\n");
            request.getPriorErrors().forEach(e -> sb.append("- ").append(e).append('\n'));
        }

        sb.append("\nAnswer with the line only, no explanation.");
        return sb.toString();
    }

    /**
     * First non-blank line of the answer outside code fences. Trailing spaces are kept.
     */
    static String extractLine(String response) {
        for (String candidate : response.split("\\r?\\n")) {
            if (candidate.strip().startsWith("```") || candidate.isBlank()) {
                continue;
            }
            return candidate;
        }
        return "";
    }
}
