package com.proseparser.json;

import java.util.ServiceLoader;

/**
 * Entry point to a JSON binding for program trees. Implementations register themselves in
 * {@code META-INF/services/com.proseparser.json.AstJsonProvider} and are found through
 * {@link ServiceLoader}, so callers only depend on this module:
 *
 * <pre>{@code
 * AstJsonProvider json = AstJsonProvider.getProvider();
 * String text = json.getSerializer().serialize(program);
 * Program copy = json.getDeserializer().deserializeProgram(text);
 * }</pre>
 */
public interface AstJsonProvider {

    AstJsonSerializer getSerializer();

    AstJsonDeserializer getDeserializer();

    /**
     * @return a short provider name such as "Jackson", matched case-insensitively by
     *         {@link #getProvider(String)}
     */
    String getName();

    /**
     * @return the first provider on the classpath
     * @throws IllegalStateException if there is none
     */
    static AstJsonProvider getProvider() {
        for (AstJsonProvider provider : ServiceLoader.load(AstJsonProvider.class)) {
            return provider;
        }
        throw new IllegalStateException(
            "No AstJsonProvider on the classpath; add parlance-jackson to the dependencies");
    }

    /**
     * @throws IllegalStateException if no provider has the given name
     */
    static AstJsonProvider getProvider(String name) {
        for (AstJsonProvider provider : ServiceLoader.load(AstJsonProvider.class)) {
            if (provider.getName().equalsIgnoreCase(name)) {
                return provider;
            }
        }
        throw new IllegalStateException("No AstJsonProvider named '" + name + "' on the classpath");
    }

    static boolean isProviderAvailable() {
        return ServiceLoader.load(AstJsonProvider.class).findFirst().isPresent();
    }
}
