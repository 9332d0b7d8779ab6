package org.taglet.compiler.tags;

import org.taglet.compiler.api.CompilationException;
import org.taglet.compiler.dom.Element;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Registration table mapping local tag names to the methods of one handler type.
 * <p>
 * Built once per handler type, typically into a {@code static final} field, and consulted
 * by {@link TagHandler#dispatch(Element)}. Reserved names can not be registered, so markup
 * can never reach the base contract through a table.
 *
 * @param <H> The handler type the methods are bound to.
 */
public final class TagTable<H extends TagHandler> {

    private final Class<H> handlerType;
    private final Map<String, TagMethod<H>> methods;

    private TagTable(Class<H> handlerType, Map<String, TagMethod<H>> methods) {
        this.handlerType = handlerType;
        this.methods = Collections.unmodifiableMap(new LinkedHashMap<>(methods));
    }

    /**
     * Starts a table for the given handler type.
     * @param handlerType The concrete handler class.
     * @param <H> The handler type.
     * @return A new builder.
     */
    public static <H extends TagHandler> Builder<H> builder(Class<H> handlerType) {
        return new Builder<>(handlerType);
    }

    public Class<H> handlerType() {
        return handlerType;
    }

    /**
     * @param name A registered name, e.g. {@code out} or {@code _if}.
     * @return true if a method is registered under exactly this name.
     */
    public boolean defines(String name) {
        return methods.containsKey(name);
    }

    /**
     * @return All registered names in registration order.
     */
    public Set<String> names() {
        return methods.keySet();
    }

    /**
     * Invokes the method registered under {@code name}.
     *
     * @throws IllegalArgumentException if nothing is registered under the name.
     * @throws ClassCastException if the handler is not of this table's handler type.
     */
    Object invoke(String name, TagHandler handler, Element element) throws CompilationException {
        TagMethod<H> method = methods.get(name);
        if (method == null) {
            throw new IllegalArgumentException("No tag '" + name + "' in " + handlerType.getSimpleName());
        }
        return method.handle(handlerType.cast(handler), element);
    }

    /**
     * Collects registrations for a {@link TagTable}.
     *
     * @param <H> The handler type.
     */
    public static final class Builder<H extends TagHandler> {
        private final Class<H> handlerType;
        private final Map<String, TagMethod<H>> methods = new LinkedHashMap<>();

        private Builder(Class<H> handlerType) {
            this.handlerType = handlerType;
        }

        /**
         * Registers a tag whose result is passed back to the caller of dispatch.
         *
         * @param name The local name, optionally with a single leading underscore
         *             (used for names that are Java keywords, such as {@code _if}).
         * @param method The implementation.
         * @return This builder.
         * @throws IllegalArgumentException if the name is reserved or already registered.
         */
        public Builder<H> tag(String name, TagMethod<H> method) {
            if (name == null || name.isEmpty()) {
                throw new IllegalArgumentException("Tag name must not be empty");
            }
            if (TagHandler.isReserved(name)) {
                throw new IllegalArgumentException("Tag name '" + name + "' is reserved for "
                        + TagHandler.class.getSimpleName() + " and can not be registered");
            }
            if (methods.putIfAbsent(name, method) != null) {
                throw new IllegalArgumentException("Tag '" + name + "' registered twice for " + handlerType.getSimpleName());
            }
            return this;
        }

        /**
         * Registers a tag without a result.
         * @see #tag(String, TagMethod)
         */
        public Builder<H> action(String name, TagAction<H> action) {
            return tag(name, (handler, element) -> {
                action.handle(handler, element);
                return null;
            });
        }

        public TagTable<H> build() {
            return new TagTable<>(handlerType, methods);
        }
    }
}
