package com.fnparser.json;

import java.util.List;
import java.util.ServiceLoader;
import java.util.stream.Collectors;

/**
 * Entry point of a JSON backend, found through {@link ServiceLoader}. Putting
 * {@code fugue-jackson} on the classpath registers the Jackson backend.
 */
public interface AstJsonProvider {

    AstJsonSerializer getSerializer();

    /**
     * Short backend name, matched case-insensitively by {@link #getProvider(String)}.
     */
    String getName();

    /**
     * @throws IllegalStateException when no backend is registered
     */
    static AstJsonProvider getProvider() {
        return loadAll().stream()
            .findFirst()
            .orElseThrow(() -> new IllegalStateException(
                "No AstJsonProvider registered; add fugue-jackson to the classpath"));
    }

    /**
     * @throws IllegalStateException when no registered backend has that name
     */
    static AstJsonProvider getProvider(String name) {
        List<AstJsonProvider> providers = loadAll();
        return providers.stream()
            .filter(p -> p.getName().equalsIgnoreCase(name))
            .findFirst()
            .orElseThrow(() -> new IllegalStateException("No AstJsonProvider named '" + name + "' (registered: "
                + providers.stream().map(AstJsonProvider::getName).collect(Collectors.joining(", ")) + ")"));
    }

    static boolean isProviderAvailable() {
        return !loadAll().isEmpty();
    }

    private static List<AstJsonProvider> loadAll() {
        return ServiceLoader.load(AstJsonProvider.class).stream()
            .map(ServiceLoader.Provider::get)
            .collect(Collectors.toList());
    }
}
