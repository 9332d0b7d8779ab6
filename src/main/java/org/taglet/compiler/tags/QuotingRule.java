package org.taglet.compiler.tags;

/**
 * Decides whether raw attribute text is a literal to be quoted or an expression to be
 * emitted unchanged.
 * <p>
 * A value is an expression when its first character is the expression marker
 * ({@code $} by default) or the reference marker ({@code @} by default). Everything else,
 * including the empty string, is a literal. The rule is a pure function of its input.
 */
public final class QuotingRule {

    private static final QuotingRule STANDARD = new QuotingRule('$', '@', "null");

    private final char expressionMarker;
    private final char referenceMarker;
    private final String nullLiteral;

    /**
     * @param expressionMarker Leading character of expression text.
     * @param referenceMarker Leading character of reference text.
     * @param nullLiteral The generated-code spelling of "no value".
     */
    public QuotingRule(char expressionMarker, char referenceMarker, String nullLiteral) {
        if (nullLiteral == null || nullLiteral.isEmpty()) {
            throw new IllegalArgumentException("nullLiteral must not be empty");
        }
        this.expressionMarker = expressionMarker;
        this.referenceMarker = referenceMarker;
        this.nullLiteral = nullLiteral;
    }

    /**
     * @return The rule with the built-in sentinels {@code $} and {@code @}.
     */
    public static QuotingRule standard() {
        return STANDARD;
    }

    /**
     * Classifies raw attribute text.
     * @param raw The raw value, or null if absent.
     * @return The classified value, never null.
     */
    public AttributeValue classify(String raw) {
        if (raw == null) {
            return AttributeValue.Absent.INSTANCE;
        }
        return needsQuote(raw) ? new AttributeValue.Literal(raw) : new AttributeValue.Expression(raw);
    }

    /**
     * Quotes a value if it is found to require it.
     * @param value The subject to quote (or not), may be null.
     * @return The quoted or unchanged value, or null if {@code value} is null.
     */
    public String quote(String value) {
        return classify(value).toCode();
    }

    /**
     * @param value A non-null raw value.
     * @return true if the value is a literal and must be quoted.
     */
    public boolean needsQuote(String value) {
        if (value.isEmpty()) {
            return true;
        }
        char first = value.charAt(0);
        return first != expressionMarker && first != referenceMarker;
    }

    public String nullLiteral() {
        return nullLiteral;
    }
}
