package org.taglet.compiler.dom;

import org.taglet.compiler.api.SourceInfo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * An immutable markup element with a namespace-qualified name such as {@code c:out}.
 * <p>
 * Attributes keep their document order and names are unique. The parent reference is
 * wired by {@link Builder#build()} and is never owned by the child.
 */
public final class Element implements Node {

    /** Separates the namespace prefix from the local name. */
    public static final char NAMESPACE_SEPARATOR = ':';

    private final String qualifiedName;
    private final Map<String, String> attributes;
    private final List<Node> children;
    private final Element parent;
    private final SourceInfo sourceInfo;

    private Element(Builder builder, Element parent) {
        this.qualifiedName = builder.qualifiedName;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.attributes));
        this.parent = parent;
        this.sourceInfo = builder.sourceInfo;
        List<Node> built = new ArrayList<>(builder.children.size());
        for (Object child : builder.children) {
            if (child instanceof Builder b) {
                built.add(new Element(b, this));
            } else {
                built.add(new Text((String) child, this));
            }
        }
        this.children = Collections.unmodifiableList(built);
    }

    /**
     * Starts building an element.
     * @param qualifiedName The tag name, usually {@code prefix:localName}.
     * @return A new builder.
     */
    public static Builder builder(String qualifiedName) {
        return new Builder(qualifiedName);
    }

    public String getQualifiedName() {
        return qualifiedName;
    }

    /**
     * @return The part before the first {@code ':'}, or null if the name is not qualified.
     */
    public String getPrefix() {
        int idx = qualifiedName.indexOf(NAMESPACE_SEPARATOR);
        return idx < 0 ? null : qualifiedName.substring(0, idx);
    }

    /**
     * @return Everything after the first {@code ':'}, or the whole name if it is not qualified.
     */
    public String getLocalName() {
        int idx = qualifiedName.indexOf(NAMESPACE_SEPARATOR);
        return idx < 0 ? qualifiedName : qualifiedName.substring(idx + 1);
    }

    public boolean hasAttribute(String name) {
        return attributes.containsKey(name);
    }

    /**
     * @param name The attribute name.
     * @return The raw attribute value, or empty if the attribute is absent.
     */
    public Optional<String> getAttribute(String name) {
        return Optional.ofNullable(attributes.get(name));
    }

    /**
     * @return An unmodifiable view of all attributes in document order.
     */
    public Map<String, String> getAttributes() {
        return attributes;
    }

    public boolean hasChildNodes() {
        return !children.isEmpty();
    }

    public List<Node> getChildren() {
        return children;
    }

    @Override
    public Element getParent() {
        return parent;
    }

    /**
     * @return The location of the element in the markup source, or null if unknown.
     */
    public SourceInfo getSourceInfo() {
        return sourceInfo;
    }

    @Override
    public String toString() {
        return "<" + qualifiedName + (sourceInfo != null ? "> at " + sourceInfo : ">");
    }

    /**
     * Collects the parts of an element tree before it is frozen.
     */
    public static final class Builder {
        private final String qualifiedName;
        private final Map<String, String> attributes = new LinkedHashMap<>();
        private final List<Object> children = new ArrayList<>();
        private SourceInfo sourceInfo;

        private Builder(String qualifiedName) {
            this.qualifiedName = Objects.requireNonNull(qualifiedName, "qualifiedName");
        }

        /**
         * Adds an attribute.
         * @throws IllegalArgumentException if the attribute was already added.
         */
        public Builder attribute(String name, String value) {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(value, "value");
            if (attributes.putIfAbsent(name, value) != null) {
                throw new IllegalArgumentException("Duplicate attribute '" + name + "' on <" + qualifiedName + ">");
            }
            return this;
        }

        public Builder child(Builder child) {
            children.add(Objects.requireNonNull(child, "child"));
            return this;
        }

        public Builder text(String content) {
            children.add(Objects.requireNonNull(content, "content"));
            return this;
        }

        public Builder location(SourceInfo sourceInfo) {
            this.sourceInfo = sourceInfo;
            return this;
        }

        /**
         * Freezes the tree rooted at this builder. Builders may be reused afterwards; the
         * returned tree is unaffected.
         * @return The root element.
         */
        public Element build() {
            return new Element(this, null);
        }
    }
}
