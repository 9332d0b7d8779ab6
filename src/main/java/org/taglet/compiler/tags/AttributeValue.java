package org.taglet.compiler.tags;

/**
 * Classified attribute text. The kind is never written in the markup; it is inferred by
 * {@link QuotingRule#classify(String)} from the first character of the raw value.
 */
public sealed interface AttributeValue permits AttributeValue.Literal, AttributeValue.Expression, AttributeValue.Absent {

    /**
     * Renders the value as a fragment of generated code.
     * @return The code text, or {@code null} for {@link Absent}.
     */
    String toCode();

    /**
     * Text emitted as a quoted string constant.
     * @param text The raw attribute text.
     */
    record Literal(String text) implements AttributeValue {
        @Override
        public String toCode() {
            return "'" + text + "'";
        }
    }

    /**
     * Variable reference or computed value, emitted verbatim.
     * @param text The raw attribute text, sentinel included.
     */
    record Expression(String text) implements AttributeValue {
        @Override
        public String toCode() {
            return text;
        }
    }

    /**
     * No value at all. Distinct from an empty {@link Literal}.
     */
    record Absent() implements AttributeValue {
        /** The shared instance. */
        public static final Absent INSTANCE = new Absent();

        @Override
        public String toCode() {
            return null;
        }
    }
}
