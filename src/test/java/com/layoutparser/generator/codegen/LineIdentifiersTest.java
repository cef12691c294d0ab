package com.layoutparser.generator.codegen;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

class LineIdentifiersTest {

    @ParameterizedTest
    @CsvSource({
            "HEADER, HEADER",
            "header, HEADER",
            "LINHA000, A",
            "LINHA001, B",
            "LINHA025, Z",
            "LINHA026, AA",
            "LINHA051, AZ",
            "LINHA052, Z52",
            "LINHA120, Z120",
            "TRAILER, TRAILER",
            "TRAILER_NF, TRAILER",
            "chave, C"
    })
    void testIdentifierFor(String lineName, String expected) {
        assertThat(LineIdentifiers.identifierFor(lineName)).isEqualTo(expected);
    }

    @Test
    void testUnknownIdentifierForEmptyOrNonLetterNames() {
        assertThat(LineIdentifiers.identifierFor("")).isEqualTo("UNKNOWN");
        assertThat(LineIdentifiers.identifierFor("9LINE")).isEqualTo("UNKNOWN");
    }

    @Test
    void testSequenceKeysOrderHeaderNumberedUnnumberedTrailer() {
        assertThat(LineIdentifiers.sequenceKeyFor("HEADER")).isEqualTo(LineIdentifiers.HEADER_KEY);
        assertThat(LineIdentifiers.sequenceKeyFor("LINHA000")).isEqualTo(1);
        assertThat(LineIdentifiers.sequenceKeyFor("LINHA010")).isEqualTo(11);
        assertThat(LineIdentifiers.sequenceKeyFor("chave")).isEqualTo(LineIdentifiers.UNNUMBERED_KEY);
        assertThat(LineIdentifiers.sequenceKeyFor("TRAILER")).isEqualTo(LineIdentifiers.TRAILER_KEY);
    }

    @Test
    void testTrailerSortsAfterHighNumberedLines() {
        int trailer = LineIdentifiers.sequenceKeyFor("TRAILER");

        assertThat(trailer).isEqualTo(Integer.MAX_VALUE);
        assertThat(LineIdentifiers.sequenceKeyFor("LINHA9998")).isEqualTo(9999).isLessThan(trailer);
        assertThat(LineIdentifiers.sequenceKeyFor("LINHA99999")).isLessThan(trailer);
        assertThat(LineIdentifiers.sequenceKeyFor("LINHA123456789012")).isLessThan(trailer);
        assertThat(LineIdentifiers.identifierFor("LINHA123456789012")).startsWith("Z");
    }
}
