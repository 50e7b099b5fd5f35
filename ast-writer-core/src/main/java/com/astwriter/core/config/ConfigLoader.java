package com.astwriter.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads {@link WriterConfig} from {@code astwriter.yaml}.
 *
 * <p>Never fails: a missing, unreadable or malformed file yields {@link WriterConfig#defaults()}
 * and a logged warning.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * WriterConfig config = ConfigLoader.load(Paths.get("astwriter.yaml"));
 * SourceFormatter formatter = config.createFormatter();
 * }</pre>
 */
public class ConfigLoader {

    public static final String DEFAULT_FILE_NAME = "astwriter.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /**
     * Loads configuration from a YAML file.
     *
     * @param configPath path to {@code astwriter.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static WriterConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return WriterConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return WriterConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            WriterConfig config = YAML_MAPPER.readValue(configPath.toFile(), WriterConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return WriterConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.warn("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return WriterConfig.defaults();
        }
    }
}
