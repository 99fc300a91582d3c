package com.example.calendar.service.util;

import lombok.extern.slf4j.Slf4j;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.text.Normalizer;

/**
 * Turns feed bytes and feed text into clean UTF-16 strings. Undecodable input never fails:
 * offending sequences become {@link #PLACEHOLDER}.
 */
@Slf4j
public final class FeedTextNormalizer {

    public static final String PLACEHOLDER = "?";

    private static final byte[] UTF8_BOM = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};

    private FeedTextNormalizer() {
    }

    public static String decode(byte[] raw) {
        if (raw == null || raw.length == 0) {
            return "";
        }

        Charset charset = StandardCharsets.UTF_8;
        int offset = 0;
        if (startsWith(raw, UTF8_BOM)) {
            offset = UTF8_BOM.length;
        } else if (raw.length >= 2 && (raw[0] & 0xFF) == 0xFE && (raw[1] & 0xFF) == 0xFF) {
            charset = StandardCharsets.UTF_16BE;
            offset = 2;
        } else if (raw.length >= 2 && (raw[0] & 0xFF) == 0xFF && (raw[1] & 0xFF) == 0xFE) {
            charset = StandardCharsets.UTF_16LE;
            offset = 2;
        }

        try {
            return decoder(charset, CodingErrorAction.REPORT).decode(ByteBuffer.wrap(raw, offset, raw.length - offset)).toString();
        } catch (CharacterCodingException e) {
            log.debug("Feed is not valid {}, replacing malformed sequences: {}", charset, e.toString());
            try {
                return decoder(charset, CodingErrorAction.REPLACE).decode(ByteBuffer.wrap(raw, offset, raw.length - offset)).toString();
            } catch (CharacterCodingException unreachable) {
                // REPLACE never reports
                throw new IllegalStateException(unreachable);
            }
        }
    }

    /**
     * Canonical form of a holiday description: NFC, with unpaired surrogates and control
     * characters other than whitespace replaced by the placeholder.
     */
    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        StringBuilder clean = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isHighSurrogate(c) && i + 1 < text.length() && Character.isLowSurrogate(text.charAt(i + 1))) {
                clean.append(c).append(text.charAt(++i));
            } else if (Character.isSurrogate(c) || c == '\uFFFD' || (Character.isISOControl(c) && !Character.isWhitespace(c))) {
                clean.append(PLACEHOLDER);
            } else {
                clean.append(c);
            }
        }
        return Normalizer.normalize(clean, Normalizer.Form.NFC);
    }

    private static CharsetDecoder decoder(Charset charset, CodingErrorAction action) {
        return charset.newDecoder()
                .onMalformedInput(action)
                .onUnmappableCharacter(action)
                .replaceWith(PLACEHOLDER);
    }

    private static boolean startsWith(byte[] raw, byte[] prefix) {
        if (raw.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (raw[i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }
}
