package com.example.calendar.service.util;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class FeedTextNormalizerTest {

    @Test
    void shouldDecodeUtf8AndStripBom() {
        byte[] body = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF, 'B', 'E', 'G', 'I', 'N'};

        assertThat(FeedTextNormalizer.decode(body)).isEqualTo("BEGIN");
    }

    @Test
    void shouldDecodeUtf16WithBom() {
        byte[] text = "Fête".getBytes(StandardCharsets.UTF_16BE);
        byte[] body = new byte[text.length + 2];
        body[0] = (byte) 0xFE;
        body[1] = (byte) 0xFF;
        System.arraycopy(text, 0, body, 2, text.length);

        assertThat(FeedTextNormalizer.decode(body)).isEqualTo("Fête");
    }

    @Test
    void shouldReplaceMalformedBytes() {
        byte[] body = {'F', (byte) 0xEA, 't', 'e'};

        assertThat(FeedTextNormalizer.decode(body)).isEqualTo("F?te");
    }

    @Test
    void shouldNormalizeToComposedForm() {
        String decomposed = "Mariae\u0301";

        assertThat(FeedTextNormalizer.normalize(decomposed)).isEqualTo("Maria\u00E9");
    }

    @Test
    void shouldReplaceBrokenCharacters() {
        assertThat(FeedTextNormalizer.normalize("Bad\uD800day\u0000\uFFFD")).isEqualTo("Bad?day??");
        assertThat(FeedTextNormalizer.normalize("Line\tone")).isEqualTo("Line\tone");
        assertThat(FeedTextNormalizer.normalize(null)).isEmpty();
    }

    @Test
    void shouldKeepSurrogatePairs() {
        assertThat(FeedTextNormalizer.normalize("Party 🎉")).isEqualTo("Party 🎉");
    }
}
