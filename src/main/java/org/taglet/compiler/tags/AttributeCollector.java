package org.taglet.compiler.tags;

import org.taglet.compiler.dom.Element;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Batch-reads a set of attributes into an ordered map or into a fragment such as
 * {@code  href="x" rel="y"} that can be spliced into an output tag.
 */
public final class AttributeCollector {

    private final AttributeReader reader;

    /**
     * @param reader Reads the raw values.
     */
    public AttributeCollector(AttributeReader reader) {
        this.reader = reader;
    }

    /**
     * Collects attributes in specification order. Entries whose attribute is absent and
     * that have no default are skipped.
     *
     * @param element The element to read.
     * @param spec The attributes to collect.
     * @return An insertion-ordered map of name to raw value.
     */
    public Map<String, String> getAttributes(Element element, AttributeSpec spec) {
        Map<String, String> collected = new LinkedHashMap<>();
        for (AttributeSpec.Entry entry : spec.entries()) {
            String value = reader.getUnquotedAttr(element, entry.name(), entry.defaultValue());
            if (value != null) {
                collected.put(entry.name(), value);
            }
        }
        return collected;
    }

    /**
     * Collects attributes like {@link #getAttributes(Element, AttributeSpec)} and serializes them.
     * @return A string like {@code ' a="1" b="2"'}, empty if nothing was collected.
     */
    public String getAttributeString(Element element, AttributeSpec spec) {
        return getAttributeString(getAttributes(element, spec));
    }

    /**
     * Serializes a map as space-prefixed {@code name="value"} tokens in iteration order.
     * Values are written as-is.
     */
    public String getAttributeString(Map<String, String> attributes) {
        StringBuilder sb = new StringBuilder();
        attributes.forEach((name, value) -> sb.append(' ').append(name).append("=\"").append(value).append('"'));
        return sb.toString();
    }
}
