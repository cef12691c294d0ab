package com.layoutparser.generator.collaborator;

import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

import static org.assertj.core.api.Assertions.*;

class ProcessDecryptorTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    @Test
    void testMissingCommandFailsClosed() {
        ProcessDecryptor decryptor = new ProcessDecryptor(List.of("decryptor-that-does-not-exist-42"), TIMEOUT);

        assertThat(decryptor.decrypt("ENCcGF5bG9hZA==")).isEqualTo("ENCcGF5bG9hZA==");
    }

    @Test
    void testShortContentReturnedAsStored() {
        ProcessDecryptor decryptor = new ProcessDecryptor(List.of("decryptor-that-does-not-exist-42"), TIMEOUT);

        assertThat(decryptor.decrypt("ENC")).isEqualTo("ENC");
        assertThat(decryptor.decrypt(null)).isNull();
    }

    @Test
    @EnabledOnOs({ OS.LINUX, OS.MAC })
    void testPrefixStrippedAndPipedThroughCommand() {
        ProcessDecryptor decryptor = new ProcessDecryptor(List.of("cat"), TIMEOUT);

        assertThat(decryptor.decrypt("ENC<LayoutVO/>\n")).isEqualTo("<LayoutVO/>");
    }

    @Test
    @EnabledOnOs({ OS.LINUX, OS.MAC })
    void testPayloadLargerThanPipeBuffer() {
        ProcessDecryptor decryptor = new ProcessDecryptor(List.of("cat"), Duration.ofSeconds(5));
        String payload = "<LayoutVO>" + "A".repeat(1024 * 1024) + "</LayoutVO>";

        assertThat(decryptor.decrypt("ENC" + payload)).isEqualTo(payload);
    }

    @Test
    @EnabledOnOs({ OS.LINUX, OS.MAC })
    void testNonZeroExitFailsClosed() {
        ProcessDecryptor decryptor = new ProcessDecryptor(List.of("false"), TIMEOUT);

        assertThat(decryptor.decrypt("ENCcGF5bG9hZA==")).isEqualTo("ENCcGF5bG9hZA==");
    }

    @Test
    void testEmptyCommandRejected() {
        assertThatThrownBy(() -> new ProcessDecryptor(List.of(), TIMEOUT))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
