package com.layoutparser.generator.model;

import java.util.Locale;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Layout attribute values must parse the same under any default locale.
 */
class CaseInsensitiveValuesTest {

    private Locale previous;

    @BeforeEach
    void useTurkishLocale() {
        previous = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
    }

    @AfterEach
    void restoreLocale() {
        Locale.setDefault(previous);
    }

    @Test
    void testAlignment() {
        assertThat(Alignment.fromValue("direita")).isEqualTo(Alignment.RIGHT);
        assertThat(Alignment.fromValue("right")).isEqualTo(Alignment.RIGHT);
    }

    @Test
    void testTrailerLine() {
        assertThat(LineDef.builder().name("trailer").build().isTrailer()).isTrue();
        assertThat(LineDef.builder().name("linha_trailer_nf").build().isTrailer()).isTrue();
    }

    @Test
    void testLayoutType() {
        assertThat(LayoutType.fromValue("xml")).isEqualTo(LayoutType.XML);
        assertThat(LayoutType.fromValue("json")).isEqualTo(LayoutType.JSON);
    }
}
