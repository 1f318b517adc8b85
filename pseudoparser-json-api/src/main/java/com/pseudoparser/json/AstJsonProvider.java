package com.pseudoparser.json;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.ServiceLoader;

/**
 * Source of an {@link AstJsonSerializer} and {@link AstJsonDeserializer} pair.
 * Implementations are discovered with {@link ServiceLoader}: put one on the
 * classpath (e.g. pseudoparser-jackson) and look it up here.
 *
 * <pre>{@code
 * AstJsonProvider provider = AstJsonProvider.getProvider();
 * String json = provider.getSerializer().serialize(program);
 * Program copy = provider.getDeserializer().deserializeProgram(json);
 * }</pre>
 */
public interface AstJsonProvider {

    AstJsonSerializer getSerializer();

    AstJsonDeserializer getDeserializer();

    /**
     * @return the provider name, e.g. "Jackson"
     */
    String getName();

    /**
     * @return the first provider found on the classpath
     * @throws IllegalStateException if there is none
     */
    static AstJsonProvider getProvider() {
        Iterator<AstJsonProvider> iterator = ServiceLoader.load(AstJsonProvider.class).iterator();
        if (iterator.hasNext()) {
            return iterator.next();
        }
        throw new IllegalStateException(
            "No AstJsonProvider found on the classpath. " +
            "Add pseudoparser-jackson (or another provider) to your dependencies."
        );
    }

    /**
     * @param name provider name, compared ignoring case
     * @throws IllegalStateException if no provider has that name
     */
    static AstJsonProvider getProvider(String name) {
        for (AstJsonProvider provider : ServiceLoader.load(AstJsonProvider.class)) {
            if (provider.getName().equalsIgnoreCase(name)) {
                return provider;
            }
        }
        throw new IllegalStateException(
            "No AstJsonProvider named '" + name + "'; available: " + getProviderNames()
        );
    }

    /**
     * @return names of all providers on the classpath, in discovery order
     */
    static List<String> getProviderNames() {
        List<String> names = new ArrayList<>();
        for (AstJsonProvider provider : ServiceLoader.load(AstJsonProvider.class)) {
            names.add(provider.getName());
        }
        return names;
    }

    static boolean isProviderAvailable() {
        return ServiceLoader.load(AstJsonProvider.class).iterator().hasNext();
    }
}
