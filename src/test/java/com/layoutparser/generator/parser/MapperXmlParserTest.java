package com.layoutparser.generator.parser;

import org.junit.jupiter.api.Test;

import com.layoutparser.generator.TestFixtures;
import com.layoutparser.generator.model.LinkMapping;
import com.layoutparser.generator.model.Mapping;

import static org.assertj.core.api.Assertions.*;

class MapperXmlParserTest {

    private final MapperXmlParser parser = new MapperXmlParser();

    @Test
    void testParseMapper() {
        Mapping mapping = parser.parse(TestFixtures.MAPPER_XML);

        assertThat(mapping.getId()).isEqualTo("MAP_0001");
        assertThat(mapping.getName()).isEqualTo("NotaFiscalParaNFe");
        assertThat(mapping.getInputLayoutId()).isEqualTo("LAY_0001");
        assertThat(mapping.getTargetLayoutId()).isEqualTo("GRT_0002");
        assertThat(mapping.getRules()).hasSize(2);
        assertThat(mapping.getRules().get(0).getContent()).contains("T.infNFe/ide/nNF = I.LINHA000/numero");
        assertThat(mapping.hasEmbeddedXsl()).isFalse();
    }

    @Test
    void testParseLinkMappings() {
        Mapping mapping = parser.parse(TestFixtures.MAPPER_XML);

        assertThat(mapping.orderedLinkMappings()).extracting(LinkMapping::getName)
                .containsExactly("T.infNFe/dest/B2BDirectory", "T.infNFe/total/valorTotal", "T.infNFe/total/vFrete");
        LinkMapping b2b = mapping.getLinkMappings().get(0);
        assertThat(b2b.getDefaultValue()).isEqualTo("N/A");
        assertThat(b2b.isAllowEmpty()).isTrue();
    }

    @Test
    void testAllowEmptyDefaultsToFalseWhenAbsent() {
        String xml = """
                <MapperVO>
                  <Name>SemAllowEmpty</Name>
                  <LinkMappings>
                    <LinkMappingItem><Name>vNF</Name></LinkMappingItem>
                  </LinkMappings>
                  <XslContent><![CDATA[<xsl:stylesheet version="1.0" xmlns:xsl="http://www.w3.org/1999/XSL/Transform"/>]]></XslContent>
                </MapperVO>
                """;

        Mapping mapping = parser.parse(xml);

        assertThat(mapping.getLinkMappings().get(0).isAllowEmpty()).isFalse();
        assertThat(mapping.hasEmbeddedXsl()).isTrue();
    }
}
