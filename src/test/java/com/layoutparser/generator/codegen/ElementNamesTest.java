package com.layoutparser.generator.codegen;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ElementNamesTest {

    @Test
    void testToMapFieldName() {
        assertThat(ElementNames.toMapFieldName("Valor Total")).isEqualTo("valorTotal");
        assertThat(ElementNames.toMapFieldName("CNPJ-Emitente")).isEqualTo("cNPJEmitente");
        assertThat(ElementNames.toMapFieldName("data_emissao")).isEqualTo("dataemissao");
    }

    @Test
    void testSanitize() {
        assertThat(ElementNames.sanitize("1campo")).isEqualTo("n1campo");
        assertThat(ElementNames.sanitize("xmlns:tipo")).isEqualTo("tipo");
        assertThat(ElementNames.sanitize("nfe:infNFe")).isEqualTo("nfe_infNFe");
        assertThat(ElementNames.sanitize("__valor  total__")).isEqualTo("valor_total");
        assertThat(ElementNames.sanitize("___")).isEqualTo("element");
        assertThat(ElementNames.sanitize("campo com espaco")).isEqualTo("campo_com_espaco");
        assertThat(ElementNames.sanitize(null)).isEqualTo("element");
        assertThat(ElementNames.isValid("B2BDirectory")).isTrue();
        assertThat(ElementNames.isValid("a/b")).isFalse();
    }
}
