package com.astwriter.core.util;

import java.util.Objects;

/**
 * Comparison of dotted numeric version strings such as {@code "0.8.13"}.
 *
 * <p>Writers use this for version gating against the configured target version.
 * Missing components count as zero; non-numeric suffixes ({@code "0.8.20+commit.a1b79de6"})
 * are ignored.
 */
public final class Versions {

    private Versions() {
        // Utility class
    }

    /**
     * Compares two version strings.
     *
     * @param left first version
     * @param right second version
     * @return negative, zero or positive as {@code left} is lower than, equal to or higher than {@code right}
     * @throws IllegalArgumentException if either version does not start with a number
     */
    public static int compare(String left, String right) {
        int[] a = parse(left);
        int[] b = parse(right);

        for (int i = 0; i < Math.max(a.length, b.length); i++) {
            int x = i < a.length ? a[i] : 0;
            int y = i < b.length ? b[i] : 0;

            if (x != y) {
                return Integer.compare(x, y);
            }
        }

        return 0;
    }

    /**
     * Checks whether {@code version} is at least {@code minimum}.
     *
     * @param version version to check
     * @param minimum lowest accepted version
     * @return true if {@code version >= minimum}
     */
    public static boolean atLeast(String version, String minimum) {
        return compare(version, minimum) >= 0;
    }

    /**
     * Checks whether {@code version} can be compared.
     *
     * @param version candidate version string
     * @return true if it starts with a dotted number
     */
    public static boolean isValid(String version) {
        if (version == null) {
            return false;
        }
        try {
            parse(version);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private static int[] parse(String version) {
        Objects.requireNonNull(version, "version must not be null");

        String core = version.trim();
        int cut = 0;
        while (cut < core.length() && (Character.isDigit(core.charAt(cut)) || core.charAt(cut) == '.')) {
            cut++;
        }
        core = core.substring(0, cut);

        if (core.isEmpty() || core.startsWith(".")) {
            throw new IllegalArgumentException("Not a version: " + version);
        }

        String[] parts = core.split("\\.");
        int[] result = new int[parts.length];
        for (int i = 0; i < parts.length; i++) {
            result[i] = Integer.parseInt(parts[i]);
        }
        return result;
    }
}
