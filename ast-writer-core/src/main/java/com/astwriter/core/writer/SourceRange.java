package com.astwriter.core.writer;

import com.astwriter.core.util.Utf8;

import java.nio.charset.StandardCharsets;

/**
 * Byte range of a node in generated source.
 *
 * <p>Offsets and lengths count bytes of the UTF-8 encoded source, not characters.
 *
 * @param offset start offset in bytes
 * @param length length in bytes
 */
public record SourceRange(
    int offset,
    int length
) {
    /**
     * Compact constructor with validation.
     */
    public SourceRange {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative: " + offset);
        }
        if (length < 0) {
            throw new IllegalArgumentException("length must not be negative: " + length);
        }
    }

    /**
     * Returns the exclusive end offset.
     *
     * @return {@code offset + length}
     */
    public int end() {
        return offset + length;
    }

    /**
     * Checks whether {@code other} lies entirely within this range.
     *
     * @param other range to test
     * @return true if contained (equal ranges contain each other)
     */
    public boolean contains(SourceRange other) {
        return offset <= other.offset && other.end() <= end();
    }

    /**
     * Checks whether this range and {@code other} share at least one byte.
     *
     * @param other range to test
     * @return true if overlapping
     */
    public boolean overlaps(SourceRange other) {
        return offset < other.end() && other.offset < end();
    }

    /**
     * Returns the range in {@code offset:length} notation.
     *
     * @return compact range string
     */
    public String toSrc() {
        return offset + ":" + length;
    }

    /**
     * Extracts the text this range covers in {@code source}.
     *
     * @param source generated source the range refers to
     * @return covered text
     * @throws IndexOutOfBoundsException if the range exceeds the encoded source
     */
    public String extract(String source) {
        byte[] bytes = Utf8.encode(source);
        if (end() > bytes.length) {
            throw new IndexOutOfBoundsException(
                "Range " + toSrc() + " exceeds source of " + bytes.length + " bytes");
        }
        return new String(bytes, offset, length, StandardCharsets.UTF_8);
    }
}
