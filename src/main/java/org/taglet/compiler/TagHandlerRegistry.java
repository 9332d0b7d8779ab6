package org.taglet.compiler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.taglet.compiler.tags.TagHandler;
import org.taglet.compiler.vocab.core.CoreTags;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * A registry of tag vocabularies. This class maps namespace prefixes to factories that
 * create a {@link TagHandler} for a given compiler.
 */
public class TagHandlerRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(TagHandlerRegistry.class);

    private final Map<String, Function<TagCompiler, ? extends TagHandler>> factories = new HashMap<>();

    /**
     * Registers a vocabulary.
     * @param prefix The namespace prefix (e.g., "c").
     * @param factory Creates the handler for one compilation.
     */
    public void register(String prefix, Function<TagCompiler, ? extends TagHandler> factory) {
        if (factories.put(prefix, factory) != null) {
            LOG.debug("Replaced tag handler factory for prefix '{}'", prefix);
        }
    }

    /**
     * Gets the factory for a namespace prefix.
     * @param prefix The prefix.
     * @return An {@link Optional} containing the factory if it exists, otherwise empty.
     */
    public Optional<Function<TagCompiler, ? extends TagHandler>> get(String prefix) {
        return Optional.ofNullable(factories.get(prefix));
    }

    /**
     * Initializes a registry with the built-in vocabularies.
     * @return A new instance with {@link CoreTags} registered under {@code c}.
     */
    public static TagHandlerRegistry initialize() {
        TagHandlerRegistry registry = new TagHandlerRegistry();
        registry.register(CoreTags.PREFIX, CoreTags::new);
        return registry;
    }
}
