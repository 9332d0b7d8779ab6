package org.taglet.compiler.api;

import org.taglet.compiler.dom.Element;
import org.taglet.compiler.internal.i18n.Messages;

/**
 * Thrown when a boolean attribute holds a value other than {@code true}, {@code yes},
 * {@code false} or {@code no}.
 */
public class InvalidBooleanLiteralException extends CompilationException {

    private final transient Element element;
    private final String attributeName;
    private final String rawValue;

    /**
     * @param element The element carrying the attribute.
     * @param attributeName The attribute name.
     * @param rawValue The offending value as written in the markup.
     */
    public InvalidBooleanLiteralException(Element element, String attributeName, String rawValue) {
        super(CompilerErrorCode.INVALID_BOOLEAN_LITERAL,
                Messages.get("attribute.invalidBoolean", attributeName, element.getQualifiedName(), rawValue),
                element.getSourceInfo());
        this.element = element;
        this.attributeName = attributeName;
        this.rawValue = rawValue;
    }

    public Element getElement() {
        return element;
    }

    public String getAttributeName() {
        return attributeName;
    }

    public String getRawValue() {
        return rawValue;
    }
}
