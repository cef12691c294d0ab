package com.layoutparser.generator.codegen.transform;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class XslPostProcessorTest {

    private final XslPostProcessor postProcessor = new XslPostProcessor();

    private static final String VENDOR_XSL = """
            <xsl:stylesheet version="1.0" xmlns:xsl="http://www.w3.org/1999/XSL/Transform" xmlns:ng="urn:vendor:ng" exclude-result-prefixes="ng">
            	<xsl:template match="/">
            		<NFe xmlns="http://www.portalfiscal.inf.br/nfe">
            			<xsl:attribute name="xsi:schemaLocation">http://www.portalfiscal.inf.br/nfe nfe.xsd</xsl:attribute>
            		</NFe>
            	</xsl:template>
            </xsl:stylesheet>
            """;

    @Test
    void testRemovesVendorNamespaceAndDeclaresXsi() {
        String cleaned = postProcessor.clean(VENDOR_XSL);

        assertThat(cleaned).doesNotContain("xmlns:ng").doesNotContain("exclude-result-prefixes=\"ng\"");
        assertThat(cleaned).contains("<xsl:stylesheet " + XslPostProcessor.XSI_DECLARATION);
        assertThat(cleaned).contains("<NFe " + XslPostProcessor.XSI_DECLARATION + " xmlns=");
    }

    @Test
    void testCleaningTwiceChangesNothing() {
        String once = postProcessor.clean(VENDOR_XSL);

        assertThat(postProcessor.clean(once)).isEqualTo(once);
    }

    @Test
    void testNoXsiDeclarationWhenUnused() {
        String xsl = "<xsl:stylesheet version=\"1.0\" xmlns:xsl=\"http://www.w3.org/1999/XSL/Transform\"></xsl:stylesheet>";

        assertThat(postProcessor.clean(xsl)).isEqualTo(xsl);
    }
}
