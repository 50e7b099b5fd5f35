package com.astwriter.core.util;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetEncoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * UTF-8 byte length measurement and encoding.
 *
 * <p>Source map offsets are expressed in UTF-8 bytes, not in Java {@code char}s. Both
 * {@link #encodedLength(CharSequence)} and {@link #encode(String)} treat an unpaired
 * surrogate as U+FFFD (three bytes), so lengths and encoded bytes always agree.
 */
public final class Utf8 {

    private static final byte[] REPLACEMENT = {(byte) 0xEF, (byte) 0xBF, (byte) 0xBD};

    private Utf8() {
        // Utility class
    }

    /**
     * Returns the number of bytes the UTF-8 encoding of {@code text} occupies.
     *
     * @param text text to measure
     * @return encoded length in bytes
     */
    public static int encodedLength(CharSequence text) {
        int length = text.length();
        int bytes = 0;

        for (int i = 0; i < length; i++) {
            char c = text.charAt(i);

            if (c < 0x80) {
                bytes += 1;
            } else if (c < 0x800) {
                bytes += 2;
            } else if (Character.isHighSurrogate(c) && i + 1 < length && Character.isLowSurrogate(text.charAt(i + 1))) {
                bytes += 4;
                i++;
            } else {
                // BMP character or unpaired surrogate (replaced by U+FFFD)
                bytes += 3;
            }
        }

        return bytes;
    }

    /**
     * Encodes {@code text} as UTF-8, replacing unpaired surrogates with U+FFFD.
     *
     * @param text text to encode
     * @return encoded bytes
     */
    public static byte[] encode(String text) {
        CharsetEncoder encoder = StandardCharsets.UTF_8.newEncoder()
            .onMalformedInput(CodingErrorAction.REPLACE)
            .onUnmappableCharacter(CodingErrorAction.REPLACE)
            .replaceWith(REPLACEMENT);

        try {
            ByteBuffer buffer = encoder.encode(CharBuffer.wrap(text));
            return Arrays.copyOfRange(buffer.array(), buffer.position(), buffer.limit());
        } catch (CharacterCodingException e) {
            throw new IllegalStateException("UTF-8 encoding failed despite replacement", e);
        }
    }
}
