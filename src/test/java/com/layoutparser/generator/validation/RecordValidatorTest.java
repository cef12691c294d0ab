package com.layoutparser.generator.validation;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.layoutparser.generator.TestFixtures;
import com.layoutparser.generator.model.Layout;
import com.layoutparser.generator.model.LineDef;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for RecordValidator.
 */
class RecordValidatorTest {

    private final RecordValidator validator = new RecordValidator();
    private final Layout layout = TestFixtures.layout();
    private final LineDef linha000 = layout.findLine("LINHA000").orElseThrow();

    @Test
    void testValidLine() {
        LineValidationResult result = validator.validateLine(TestFixtures.RECORD.get(1), linha000, TestFixtures.LINE_WIDTH);

        assertThat(result.isValid()).isTrue();
        assertThat(result.getWarnings()).isEmpty();
        assertThat(result.getFields()).extracting(FieldSlice::getName).containsExactly("numero", "Valor Total");
        assertThat(result.getFields().get(0).getStart()).isEqualTo(8);
        assertThat(result.getFields().get(0).getValue()).isEqualTo("000000123");
    }

    @Test
    void testWrongLength() {
        String line = "01" + "000001" + "000000123" + "000000000015000";

        LineValidationResult result = validator.validateLine(line, linha000, TestFixtures.LINE_WIDTH);

        assertThat(result.isValid()).isFalse();
        assertThat(result.getErrors()).containsExactly("LINHA000: expected 80 characters but found 32");
        assertThat(result.getActualLength()).isEqualTo(32);
    }

    @Test
    void testWrongInitialValue() {
        String line = TestFixtures.pad("03" + "000001" + "000000123" + "000000000015000");

        LineValidationResult result = validator.validateLine(line, linha000, TestFixtures.LINE_WIDTH);

        assertThat(result.getErrors()).containsExactly("LINHA000: line does not start with '01'");
    }

    @Test
    void testRequiredFieldBlank() {
        String line = TestFixtures.pad("01" + "000001" + " ".repeat(9) + "000000000015000");

        LineValidationResult result = validator.validateLine(line, linha000, TestFixtures.LINE_WIDTH);

        assertThat(result.getErrors()).containsExactly("numero: required field is empty");
        assertThat(result.getFields().get(0).getStatus()).isEqualTo(FieldSlice.Status.ERROR);
        assertThat(result.getFields().get(1).getStatus()).isEqualTo(FieldSlice.Status.VALID);
    }

    @Test
    void testFieldRunningPastLineEndIsOutOfBounds() {
        String line = "01" + "000001" + "000000123" + "12345";

        LineValidationResult result = validator.validateLine(line, linha000, line.length());

        assertThat(result.isValid()).isFalse();
        assertThat(result.getErrors()).contains("Valor Total: out of bounds (ends at 32, line has 22 characters)");
        assertThat(result.getWarnings()).containsExactly("Valor Total: truncated, 5 of 15 characters present");
        assertThat(result.getFields().get(1).getStatus()).isEqualTo(FieldSlice.Status.ERROR);
        assertThat(result.getFields().get(1).getValue()).isEqualTo("12345");
    }

    @Test
    void testFieldOutOfBounds() {
        String line = "01000001";

        LineValidationResult result = validator.validateLine(line, linha000, line.length());

        assertThat(result.getErrors()).anyMatch(e -> e.startsWith("numero: out of bounds"));
        assertThat(result.getErrors()).anyMatch(e -> e.startsWith("Valor Total: out of bounds"));
    }

    @Test
    void testDefinitionWiderThanLine() {
        LineValidationResult result = validator.validateLine(TestFixtures.RECORD.get(1).substring(0, 20), linha000, 20);

        assertThat(result.getErrors()).contains("LINHA000: fields need 32 characters but the line width is 20");
    }

    @Test
    void testEmptyLine() {
        LineValidationResult result = validator.validateLine("", linha000, TestFixtures.LINE_WIDTH);

        assertThat(result.getErrors()).containsExactly("LINHA000: line is empty");
    }

    @Test
    void testValidateRecord() {
        RecordValidationReport report = validator.validateRecord(TestFixtures.RECORD, layout, TestFixtures.LINE_WIDTH);

        assertThat(report.isValid()).isTrue();
        assertThat(report.getLines()).containsOnlyKeys(1, 2, 3, 4);
        assertThat(report.getLines().get(3).getLineName()).isEqualTo("LINHA001");
        assertThat(report.getLayoutName()).isEqualTo("NotaFiscalEntrada");
    }

    @Test
    void testValidateRecordWithUnmatchedLine() {
        List<String> lines = new ArrayList<>(TestFixtures.RECORD);
        lines.add(2, TestFixtures.pad("ZZ000009"));

        RecordValidationReport report = validator.validateRecord(lines, layout, TestFixtures.LINE_WIDTH);

        assertThat(report.isValid()).isFalse();
        assertThat(report.invalidLineCount()).isEqualTo(1);
        assertThat(report.getLines().get(3).getErrors()).containsExactly("no line definition matches line 3");
    }

    @Test
    void testLongestInitialValueWins() {
        Layout overlapping = layout.toBuilder()
                .line(LineDef.builder().name("LINHA010").initialValue("010").build())
                .build();
        LineResolver resolver = new LineResolver(overlapping);

        assertThat(resolver.resolve("010000001", 3)).map(LineDef::getName).contains("LINHA010");
        assertThat(resolver.resolve("01500001", 3)).map(LineDef::getName).contains("LINHA000");
    }
}
