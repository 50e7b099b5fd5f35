package com.astwriter.core.config;

import com.astwriter.core.format.PrettyFormatter;
import com.astwriter.core.format.SourceFormatter;
import com.astwriter.core.format.SpacelessFormatter;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;

/**
 * Rendering configuration.
 *
 * <p>Loaded from {@code astwriter.yaml}. Sections or properties left out of the file fall
 * back to the values of {@link #defaults()}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * mapping: solidity
 * targetVersion: "0.8.20"
 *
 * formatter:
 *   style: pretty
 *   indentSize: 4
 *   offset: 0
 * }</pre>
 *
 * @param mapping id of the writer mapping provider
 * @param targetVersion target language version passed to writers
 * @param formatter formatter settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WriterConfig(
    @JsonProperty("mapping") String mapping,
    @JsonProperty("targetVersion") String targetVersion,
    @JsonProperty("formatter") FormatterSettings formatter
) {
    public static final String DEFAULT_MAPPING = "solidity";
    public static final String DEFAULT_TARGET_VERSION = "0.8.20";

    /**
     * Compact constructor filling absent values with defaults.
     */
    public WriterConfig {
        if (mapping == null || mapping.isBlank()) {
            mapping = DEFAULT_MAPPING;
        }
        if (targetVersion == null || targetVersion.isBlank()) {
            targetVersion = DEFAULT_TARGET_VERSION;
        }
        if (formatter == null) {
            formatter = FormatterSettings.defaults();
        }
    }

    /**
     * Creates the default configuration: Solidity writers, version 0.8.20, four-space
     * pretty printing.
     *
     * @return default configuration
     */
    public static WriterConfig defaults() {
        return new WriterConfig(DEFAULT_MAPPING, DEFAULT_TARGET_VERSION, FormatterSettings.defaults());
    }

    /**
     * Returns a copy using {@code mapping} when it is non-null.
     *
     * @param mapping override, or null to keep the current value
     * @return adjusted configuration
     */
    public WriterConfig withMapping(String mapping) {
        return mapping == null ? this : new WriterConfig(mapping, targetVersion, formatter);
    }

    /**
     * Returns a copy using {@code targetVersion} when it is non-null.
     *
     * @param targetVersion override, or null to keep the current value
     * @return adjusted configuration
     */
    public WriterConfig withTargetVersion(String targetVersion) {
        return targetVersion == null ? this : new WriterConfig(mapping, targetVersion, formatter);
    }

    /**
     * Builds the configured formatter.
     *
     * @return new formatter at nesting level zero
     */
    public SourceFormatter createFormatter() {
        return switch (formatter.style()) {
            case PRETTY -> new PrettyFormatter(formatter.indentSize(), formatter.offset());
            case SPACELESS -> new SpacelessFormatter();
        };
    }

    /**
     * Layout style.
     */
    public enum FormatterStyle {
        /** Line breaks and space indentation */
        PRETTY,
        /** No layout whitespace at all */
        SPACELESS;

        /**
         * Parses a style name case-insensitively ({@code pretty}, {@code SPACELESS}).
         */
        @JsonCreator
        public static FormatterStyle fromString(String value) {
            return FormatterStyle.valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }

    /**
     * Formatter settings.
     *
     * @param style layout style
     * @param indentSize spaces per nesting level (pretty style only)
     * @param offset spaces before every indent (pretty style only)
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record FormatterSettings(
        @JsonProperty("style") FormatterStyle style,
        @JsonProperty("indentSize") Integer indentSize,
        @JsonProperty("offset") Integer offset
    ) {
        public static final int DEFAULT_INDENT_SIZE = 4;

        public FormatterSettings {
            if (style == null) {
                style = FormatterStyle.PRETTY;
            }
            if (indentSize == null) {
                indentSize = DEFAULT_INDENT_SIZE;
            }
            if (offset == null) {
                offset = 0;
            }
            if (indentSize < 0 || offset < 0) {
                throw new IllegalArgumentException(
                    "indentSize and offset must not be negative: indentSize=" + indentSize + ", offset=" + offset);
            }
        }

        public static FormatterSettings defaults() {
            return new FormatterSettings(FormatterStyle.PRETTY, DEFAULT_INDENT_SIZE, 0);
        }
    }
}
