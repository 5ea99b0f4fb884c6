package com.umlcodegen.core.generator;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps language keys to code generators.
 *
 * <p>{@link #load()} discovers generators via {@link ServiceLoader}. Keys are matched
 * case-insensitively; the first generator registered for a key wins.
 */
public final class GeneratorRegistry {

    private static final Logger log = LoggerFactory.getLogger(GeneratorRegistry.class);

    private final Map<String, CodeGenerator> generators = new TreeMap<>();

    /**
     * Creates a registry from explicit generators.
     *
     * @param generators generators to register
     */
    public GeneratorRegistry(Collection<? extends CodeGenerator> generators) {
        for (CodeGenerator generator : generators) {
            String key = generator.getId().toLowerCase(Locale.ROOT);
            if (this.generators.putIfAbsent(key, generator) != null) {
                log.warn("Duplicate generator for language '{}': {} ignored", key, generator.getClass().getName());
            }
        }
    }

    /**
     * Creates a registry with every generator found on the classpath.
     *
     * @return loaded registry
     */
    public static GeneratorRegistry load() {
        List<CodeGenerator> found = new ArrayList<>();
        ServiceLoader.load(CodeGenerator.class).forEach(found::add);
        log.debug("Discovered {} code generators", found.size());
        return new GeneratorRegistry(found);
    }

    /**
     * Looks up a generator.
     *
     * @param language language key, any case
     * @return generator, empty if the key is unknown or null
     */
    public Optional<CodeGenerator> find(String language) {
        if (language == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(generators.get(language.trim().toLowerCase(Locale.ROOT)));
    }

    /**
     * Looks up a generator that must exist.
     *
     * @param language language key, any case
     * @return generator
     * @throws UnsupportedLanguageException if no generator has that key
     */
    public CodeGenerator require(String language) {
        return find(language).orElseThrow(() -> new UnsupportedLanguageException(language, languages()));
    }

    /**
     * Returns the registered language keys in alphabetical order.
     *
     * @return sorted keys
     */
    public List<String> languages() {
        return List.copyOf(generators.keySet());
    }

    /**
     * Returns the registered generators ordered by key.
     *
     * @return generators
     */
    public List<CodeGenerator> generators() {
        return List.copyOf(generators.values());
    }
}
