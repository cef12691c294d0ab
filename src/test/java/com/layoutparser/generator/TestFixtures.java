package com.layoutparser.generator;

import java.util.List;

import com.layoutparser.generator.model.Alignment;
import com.layoutparser.generator.model.FieldDef;
import com.layoutparser.generator.model.FieldKind;
import com.layoutparser.generator.model.Layout;
import com.layoutparser.generator.model.LineDef;

/**
 * Sample layout, mapper and record shared by the tests.
 */
public final class TestFixtures {

    public static final int LINE_WIDTH = 80;

    public static final String LAYOUT_XML = """
            <?xml version="1.0" encoding="utf-8"?>
            <LayoutVO xmlns:xsi="http://www.w3.org/2001/XMLSchema-instance">
              <LayoutGuid>LAY_0001</LayoutGuid>
              <LayoutType>TextPositional</LayoutType>
              <Name>NotaFiscalEntrada</Name>
              <Description>Nota fiscal de entrada</Description>
              <LimitOfCaracters>80</LimitOfCaracters>
              <Elements>
                <Element xsi:type="LineElementVO">
                  <Name>HEADER</Name>
                  <Sequence>1</Sequence>
                  <IsRequired>true</IsRequired>
                  <InitialValue>H</InitialValue>
                  <Elements>
                    <Element xsi:type="FieldElementVO">
                      <Name>Cnpj</Name>
                      <Sequence>1</Sequence>
                      <IsRequired>true</IsRequired>
                      <LengthField>14</LengthField>
                    </Element>
                    <Element xsi:type="FieldElementVO">
                      <Name>DataEmissao</Name>
                      <Sequence>2</Sequence>
                      <LengthField>8</LengthField>
                    </Element>
                  </Elements>
                </Element>
                <Element xsi:type="LineElementVO">
                  <Name>LINHA000</Name>
                  <Sequence>2</Sequence>
                  <IsRequired>true</IsRequired>
                  <InitialValue>01</InitialValue>
                  <Elements>
                    <Element xsi:type="FieldElementVO">
                      <Name>Sequencia</Name>
                      <Sequence>0</Sequence>
                      <LengthField>6</LengthField>
                    </Element>
                    <Element xsi:type="FieldElementVO">
                      <Name>numero</Name>
                      <Sequence>1</Sequence>
                      <IsRequired>true</IsRequired>
                      <LengthField>9</LengthField>
                      <AlignmentType>Right</AlignmentType>
                    </Element>
                    <Element xsi:type="FieldElementVO">
                      <Name>Valor Total</Name>
                      <Description>Valor total da nota 15,2</Description>
                      <Sequence>2</Sequence>
                      <LengthField>15</LengthField>
                      <AlignmentType>Right</AlignmentType>
                    </Element>
                    <Element xsi:type="LineElementVO">
                      <Name>LINHA001</Name>
                      <Sequence>3</Sequence>
                      <InitialValue>02</InitialValue>
                      <MinimalOccurrence>1</MinimalOccurrence>
                      <MaximumOccurrence>0</MaximumOccurrence>
                      <Elements>
                        <Element xsi:type="FieldElementVO">
                          <Name>Produto</Name>
                          <Sequence>1</Sequence>
                          <IsRequired>true</IsRequired>
                          <LengthField>20</LengthField>
                        </Element>
                        <Element xsi:type="FieldElementVO">
                          <Name>Quantidade</Name>
                          <Sequence>2</Sequence>
                          <LengthField>5</LengthField>
                          <AlignmentType>Right</AlignmentType>
                        </Element>
                      </Elements>
                    </Element>
                  </Elements>
                </Element>
                <Element xsi:type="LineElementVO">
                  <Name>TRAILER</Name>
                  <Sequence>4</Sequence>
                  <InitialValue>99</InitialValue>
                  <Elements>
                    <Element xsi:type="FieldElementVO">
                      <Name>totalLinhas</Name>
                      <Sequence>1</Sequence>
                      <LengthField>6</LengthField>
                      <AlignmentType>Right</AlignmentType>
                      <IsStaticValue>true</IsStaticValue>
                      <StaticValue>000004</StaticValue>
                    </Element>
                  </Elements>
                </Element>
              </Elements>
            </LayoutVO>
            """;

    public static final String MAPPER_XML = """
            <?xml version="1.0" encoding="utf-8"?>
            <MapperVO>
              <MapperGuid>MAP_0001</MapperGuid>
              <Name>NotaFiscalParaNFe</Name>
              <InputLayoutGuid>LAY_0001</InputLayoutGuid>
              <TargetLayoutGuid>GRT_0002</TargetLayoutGuid>
              <Rules>
                <Rule>
                  <Name>Identificacao</Name>
                  <Sequence>1</Sequence>
                  <ContentValue><![CDATA[
            #region ide
            T.infNFe/ide/nNF = I.LINHA000/numero;
            T.infNFe/ide/cUF = GetConfig("cUF");
            // emitter
            T.infNFe/emit/CNPJ = I.HEADER/cnpj;
            #endregion
            ]]></ContentValue>
                </Rule>
                <Rule>
                  <Name>Natureza</Name>
                  <Sequence>2</Sequence>
                  <ContentValue>T.infNFe/ide/natOp = Concat("VENDA ", I.LINHA001/produto)</ContentValue>
                </Rule>
              </Rules>
              <LinkMappings>
                <LinkMappingItem>
                  <Name>T.infNFe/dest/B2BDirectory</Name>
                  <Sequence>1</Sequence>
                  <DefaultValue>N/A</DefaultValue>
                  <AllowEmpty>true</AllowEmpty>
                </LinkMappingItem>
                <LinkMappingItem>
                  <Name>T.infNFe/total/valorTotal</Name>
                  <Sequence>2</Sequence>
                  <AllowEmpty>true</AllowEmpty>
                </LinkMappingItem>
                <LinkMappingItem>
                  <Name>T.infNFe/total/vFrete</Name>
                  <Sequence>3</Sequence>
                  <AllowEmpty>true</AllowEmpty>
                </LinkMappingItem>
              </LinkMappings>
            </MapperVO>
            """;

    public static final List<String> RECORD = List.of(
            pad("H" + "12345678000195" + "20240115"),
            pad("01" + "000001" + "000000123" + "000000000015000"),
            pad("02" + "000002" + "PARAFUSO            " + "00010"),
            pad("99" + "000003" + "000004"));

    private TestFixtures() {
        // Utility class
    }

    public static String pad(String text) {
        return text + " ".repeat(LINE_WIDTH - text.length());
    }

    /**
     * Same shape as {@link #LAYOUT_XML}, built directly.
     */
    public static Layout layout() {
        return Layout.builder()
                .id("LAY_0001")
                .name("NotaFiscalEntrada")
                .lineWidth(LINE_WIDTH)
                .line(LineDef.builder()
                        .name("HEADER")
                        .initialValue("H")
                        .sequence(1)
                        .required(true)
                        .field(field("Cnpj", 1, 14).required(true).kind(FieldKind.CNPJ).build())
                        .field(field("DataEmissao", 2, 8).kind(FieldKind.DATE).build())
                        .build())
                .line(LineDef.builder()
                        .name("LINHA000")
                        .initialValue("01")
                        .sequence(2)
                        .required(true)
                        .field(field("Sequencia", 0, 6).build())
                        .field(field("numero", 1, 9).required(true).alignment(Alignment.RIGHT).build())
                        .field(field("Valor Total", 2, 15).description("15,2").alignment(Alignment.RIGHT)
                                .kind(FieldKind.DECIMAL).build())
                        .build())
                .line(LineDef.builder()
                        .name("LINHA001")
                        .initialValue("02")
                        .sequence(3)
                        .maxOccurs(0)
                        .parentLine("LINHA000")
                        .field(field("Produto", 1, 20).required(true).build())
                        .field(field("Quantidade", 2, 5).alignment(Alignment.RIGHT).kind(FieldKind.NUMERIC).build())
                        .build())
                .line(LineDef.builder()
                        .name("TRAILER")
                        .initialValue("99")
                        .sequence(4)
                        .field(field("totalLinhas", 1, 6).fixedValue("000004").alignment(Alignment.RIGHT).build())
                        .build())
                .build();
    }

    private static FieldDef.FieldDefBuilder field(String name, int sequence, int length) {
        return FieldDef.builder().name(name).sequence(sequence).length(length);
    }
}
