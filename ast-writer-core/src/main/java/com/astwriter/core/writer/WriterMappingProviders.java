package com.astwriter.core.writer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.stream.Collectors;

/**
 * Discovery of {@link WriterMappingProvider}s registered via {@link ServiceLoader}.
 */
public final class WriterMappingProviders {

    private static final Logger log = LoggerFactory.getLogger(WriterMappingProviders.class);

    private WriterMappingProviders() {
        // Utility class
    }

    /**
     * Loads all registered providers, sorted by id.
     *
     * @return discovered providers
     */
    public static List<WriterMappingProvider> all() {
        List<WriterMappingProvider> providers = ServiceLoader.load(WriterMappingProvider.class).stream()
            .map(ServiceLoader.Provider::get)
            .sorted(Comparator.comparing(WriterMappingProvider::getId))
            .toList();

        log.debug("Discovered {} writer mapping providers", providers.size());
        return providers;
    }

    /**
     * Finds a provider by id.
     *
     * @param id provider id
     * @return provider, or empty if none is registered under {@code id}
     */
    public static Optional<WriterMappingProvider> find(String id) {
        return all().stream()
            .filter(provider -> provider.getId().equals(id))
            .findFirst();
    }

    /**
     * Gets a provider by id.
     *
     * @param id provider id
     * @return provider
     * @throws IllegalArgumentException if no provider is registered under {@code id}
     */
    public static WriterMappingProvider require(String id) {
        return find(id).orElseThrow(() -> new IllegalArgumentException(
            "Unknown writer mapping: " + id + ". Available: "
                + all().stream().map(WriterMappingProvider::getId).collect(Collectors.joining(", "))));
    }
}
