package org.taglet.compiler.tags;

import org.taglet.compiler.api.InvalidBooleanLiteralException;
import org.taglet.compiler.api.MissingRequiredAttributeException;
import org.taglet.compiler.dom.Element;

/**
 * Reads single attributes off an element, applying defaults, quoting or boolean coercion.
 * All reads are pure; the element is never modified.
 */
public final class AttributeReader {

    private final QuotingRule quotingRule;

    /**
     * @param quotingRule The rule used to quote literal values.
     */
    public AttributeReader(QuotingRule quotingRule) {
        this.quotingRule = quotingRule;
    }

    /**
     * Requires the attribute to be present and returns it quoted.
     * @see #requiredAttr(Element, String, boolean)
     */
    public String requiredAttr(Element element, String name) throws MissingRequiredAttributeException {
        return requiredAttr(element, name, true);
    }

    /**
     * Requires the attribute to be on the element.
     *
     * @param element The target element.
     * @param name The attribute name.
     * @param quote true if the value should be passed through the quoting rule.
     * @return The attribute value.
     * @throws MissingRequiredAttributeException if the element lacks the attribute.
     */
    public String requiredAttr(Element element, String name, boolean quote) throws MissingRequiredAttributeException {
        String value = element.getAttribute(name)
                .orElseThrow(() -> new MissingRequiredAttributeException(element, name));
        return quote ? quotingRule.quote(value) : value;
    }

    /**
     * @return The quoted attribute value, or null if absent.
     */
    public String getAttr(Element element, String name) {
        return getAttr(element, name, null);
    }

    /**
     * Gets an attribute, quoted. A default is quoted the same way as a present value.
     *
     * @param element The target element.
     * @param name The attribute name.
     * @param defaultValue Used when the attribute is absent, may be null.
     * @return The quoted value, or null if both the attribute and the default are absent.
     */
    public String getAttr(Element element, String name, String defaultValue) {
        return quotingRule.quote(element.getAttribute(name).orElse(defaultValue));
    }

    /**
     * @return The raw attribute value, or null if absent.
     */
    public String getUnquotedAttr(Element element, String name) {
        return getUnquotedAttr(element, name, null);
    }

    /**
     * Gets a raw attribute, without quoting.
     *
     * @param element The target element.
     * @param name The attribute name.
     * @param defaultValue Returned verbatim when the attribute is absent, may be null.
     * @return The raw value or the default.
     */
    public String getUnquotedAttr(Element element, String name, String defaultValue) {
        return element.getAttribute(name).orElse(defaultValue);
    }

    /**
     * @return The boolean value of the attribute, false if absent.
     */
    public boolean getBooleanAttr(Element element, String name) throws InvalidBooleanLiteralException {
        return getBooleanAttr(element, name, false);
    }

    /**
     * Gets a boolean attribute. Accepts {@code true}/{@code yes} and {@code false}/{@code no}.
     *
     * @param element The target element.
     * @param name The attribute name.
     * @param defaultValue Returned when the attribute is absent.
     * @return A value matching the author's intent.
     * @throws InvalidBooleanLiteralException if the value is anything else.
     */
    public boolean getBooleanAttr(Element element, String name, boolean defaultValue) throws InvalidBooleanLiteralException {
        if (!element.hasAttribute(name)) {
            return defaultValue;
        }
        String raw = element.getAttribute(name).get();
        return switch (raw) {
            case "true", "yes" -> true;
            case "false", "no" -> false;
            default -> throw new InvalidBooleanLiteralException(element, name, raw);
        };
    }
}
