package com.layoutparser.generator.parser;

import org.junit.jupiter.api.Test;

import com.layoutparser.generator.TestFixtures;
import com.layoutparser.generator.config.FieldHeuristics;
import com.layoutparser.generator.exception.StructureException;
import com.layoutparser.generator.model.Alignment;
import com.layoutparser.generator.model.FieldKind;
import com.layoutparser.generator.model.Layout;
import com.layoutparser.generator.model.LineDef;

import static org.assertj.core.api.Assertions.*;

class LayoutXmlParserTest {

    private final LayoutXmlParser parser = new LayoutXmlParser(FieldHeuristics.defaults());

    @Test
    void testParseLayout() {
        Layout layout = parser.parse(TestFixtures.LAYOUT_XML);

        assertThat(layout.getId()).isEqualTo("LAY_0001");
        assertThat(layout.getName()).isEqualTo("NotaFiscalEntrada");
        assertThat(layout.getLineWidth()).isEqualTo(80);
        assertThat(layout.getLines()).extracting(LineDef::getName)
                .containsExactly("HEADER", "LINHA000", "LINHA001", "TRAILER");
    }

    @Test
    void testFieldsAndOffsets() {
        Layout layout = parser.parse(TestFixtures.LAYOUT_XML);

        LineDef header = layout.findLine("HEADER").orElseThrow();
        assertThat(header.prefixLength()).isEqualTo(1);
        assertThat(header.getFields().get(0).getKind()).isEqualTo(FieldKind.CNPJ);
        assertThat(header.getFields().get(0).isRequired()).isTrue();

        LineDef linha000 = layout.findLine("LINHA000").orElseThrow();
        assertThat(linha000.prefixLength()).isEqualTo(8);
        assertThat(linha000.positionalFields()).extracting(f -> f.getName())
                .containsExactly("numero", "Valor Total");
        assertThat(linha000.positionalFields().get(0).getAlignment()).isEqualTo(Alignment.RIGHT);
        assertThat(linha000.contentWidth()).isEqualTo(32);
    }

    @Test
    void testNestedLineRecordsParent() {
        Layout layout = parser.parse(TestFixtures.LAYOUT_XML);

        LineDef linha001 = layout.findLine("LINHA001").orElseThrow();
        assertThat(linha001.getParentLine()).isEqualTo("LINHA000");
        assertThat(linha001.getMaxOccurs()).isZero();
        assertThat(layout.childLinesOf("LINHA000")).extracting(LineDef::getName).containsExactly("LINHA001");
    }

    @Test
    void testStaticValueBecomesFixedValue() {
        Layout layout = parser.parse(TestFixtures.LAYOUT_XML);

        assertThat(layout.findLine("TRAILER").orElseThrow().getFields().get(0).getFixedValue()).isEqualTo("000004");
    }

    @Test
    void testMissingLineWidthDefaultsTo600() {
        String xml = """
                <LayoutVO xmlns:xsi="http://www.w3.org/2001/XMLSchema-instance">
                  <Name>SemLargura</Name>
                  <LimitOfCaracters>0</LimitOfCaracters>
                  <Elements>
                    <Element xsi:type="LineElementVO">
                      <Name>HEADER</Name>
                    </Element>
                  </Elements>
                </LayoutVO>
                """;

        Layout layout = parser.parse(xml);

        assertThat(layout.getLineWidth()).isEqualTo(Layout.DEFAULT_LINE_WIDTH);
        assertThat(layout.getId()).isEqualTo("SemLargura");
    }

    @Test
    void testByteOrderMarkIsIgnored() {
        Layout layout = parser.parse('\uFEFF' + TestFixtures.LAYOUT_XML.strip());

        assertThat(layout.getName()).isEqualTo("NotaFiscalEntrada");
    }

    @Test
    void testFieldWithoutLengthFails() {
        String xml = """
                <LayoutVO xmlns:xsi="http://www.w3.org/2001/XMLSchema-instance">
                  <Name>Quebrado</Name>
                  <Elements>
                    <Element xsi:type="LineElementVO">
                      <Name>LINHA000</Name>
                      <Elements>
                        <Element xsi:type="FieldElementVO">
                          <Name>numero</Name>
                          <LengthField>0</LengthField>
                        </Element>
                      </Elements>
                    </Element>
                  </Elements>
                </LayoutVO>
                """;

        assertThatThrownBy(() -> parser.parse(xml))
                .isInstanceOf(StructureException.class)
                .hasMessageContaining("numero");
    }

    @Test
    void testMalformedXmlFails() {
        assertThatThrownBy(() -> parser.parse("<LayoutVO><Name>x</LayoutVO>"))
                .isInstanceOf(StructureException.class);
    }
}
