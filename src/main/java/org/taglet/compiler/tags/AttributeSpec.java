package org.taglet.compiler.tags;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An ordered list of attribute names to collect, each with an optional default.
 * <p>
 * Example: {@code AttributeSpec.of("href").with("rel", "nofollow")}.
 */
public final class AttributeSpec {

    /**
     * One entry of the specification.
     * @param name The attribute name.
     * @param defaultValue The value used when the attribute is absent, or null for none.
     */
    public record Entry(String name, String defaultValue) {
        public Entry {
            Objects.requireNonNull(name, "name");
        }
    }

    private final List<Entry> entries;

    private AttributeSpec(List<Entry> entries) {
        this.entries = Collections.unmodifiableList(entries);
    }

    /**
     * Creates a specification of bare names, none of which has a default.
     * @param names The attribute names in output order.
     * @return A new specification.
     */
    public static AttributeSpec of(String... names) {
        List<Entry> list = new ArrayList<>(names.length);
        for (String name : names) {
            list.add(new Entry(name, null));
        }
        return new AttributeSpec(list);
    }

    /**
     * Returns a copy of this specification with a bare name appended.
     */
    public AttributeSpec with(String name) {
        return with(name, null);
    }

    /**
     * Returns a copy of this specification with a (name, default) pair appended.
     */
    public AttributeSpec with(String name, String defaultValue) {
        List<Entry> list = new ArrayList<>(entries);
        list.add(new Entry(name, defaultValue));
        return new AttributeSpec(list);
    }

    public List<Entry> entries() {
        return entries;
    }
}
