package com.layoutparser.generator.synthesis;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.layoutparser.generator.TestFixtures;
import com.layoutparser.generator.exception.CollaboratorException;
import com.layoutparser.generator.model.Layout;

import dev.langchain4j.model.chat.ChatModel;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LlmCandidateProviderTest {

    private static final String VALID_LINE = TestFixtures.RECORD.get(1);

    @Mock
    private ChatModel chatModel;

    private LlmCandidateProvider provider;
    private LineRequest request;

    @BeforeEach
    void setUp() {
        Layout layout = TestFixtures.layout();
        provider = new LlmCandidateProvider(chatModel, Duration.ofSeconds(5),
                Map.of("LINHA000", List.of(VALID_LINE, VALID_LINE, VALID_LINE)));
        request = LineRequest.builder()
                .layout(layout)
                .line(layout.findLine("LINHA000").orElseThrow())
                .lineWidth(TestFixtures.LINE_WIDTH)
                .lineNumber(2)
                .build();
    }

    @Test
    void testGenerateStripsCodeFences() {
        when(chatModel.chat(anyString())).thenReturn("```\n" + VALID_LINE + "\n```");

        assertThat(provider.generate(request)).isEqualTo(VALID_LINE);
    }

    @Test
    void testPromptDescribesFieldPositions() {
        when(chatModel.chat(anyString())).thenReturn(VALID_LINE);

        provider.generate(request);

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(chatModel).chat(prompt.capture());
        assertThat(prompt.getValue())
                .contains("line type 'LINHA000'")
                .contains("exactly 80 characters")
                .contains("It starts with '01'")
                .contains("sequence '000002'")
                .contains("- numero start=8 length=9")
                .contains("- Valor Total start=17 length=15")
                .doesNotContain("rejected");
        assertThat(prompt.getValue().split(VALID_LINE, -1)).hasSize(LlmCandidateProvider.MAX_EXAMPLES + 1);
    }

    @Test
    void testRetryPromptCarriesErrors() {
        LineRequest retry = request.toBuilder()
                .priorAttempt("01")
                .priorError("LINHA000: expected 80 characters but found 2")
                .build();

        String prompt = provider.buildPrompt(retry);

        assertThat(prompt).contains("Your previous line was rejected:\n01\n")
                .contains("- LINHA000: expected 80 characters but found 2");
    }

    @Test
    void testNullResponseFails() {
        when(chatModel.chat(anyString())).thenReturn(null);

        assertThatThrownBy(() -> provider.generate(request))
                .isInstanceOf(CollaboratorException.class)
                .hasMessage("language-model: empty response");
    }

    @Test
    void testModelFailureBecomesCollaboratorException() {
        when(chatModel.chat(anyString())).thenThrow(new IllegalStateException("quota exceeded"));

        assertThatThrownBy(() -> provider.generate(request))
                .isInstanceOfSatisfying(CollaboratorException.class, e -> {
                    assertThat(e.getCollaborator()).isEqualTo("language-model");
                    assertThat(e.isTimeout()).isFalse();
                    assertThat(e).hasMessageContaining("quota exceeded");
                });
    }

    @Test
    void testExtractLine() {
        assertThat(LlmCandidateProvider.extractLine("\n```text\nABC  \n```")).isEqualTo("ABC  ");
        assertThat(LlmCandidateProvider.extractLine("   \n")).isEmpty();
    }
}
