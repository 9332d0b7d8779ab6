package org.taglet.compiler.api;

import org.taglet.compiler.dom.Element;
import org.taglet.compiler.internal.i18n.Messages;

/**
 * Thrown when a tag requires an attribute that the element does not carry.
 */
public class MissingRequiredAttributeException extends CompilationException {

    private final transient Element element;
    private final String attributeName;

    /**
     * @param element The element lacking the attribute.
     * @param attributeName The name of the missing attribute.
     */
    public MissingRequiredAttributeException(Element element, String attributeName) {
        super(CompilerErrorCode.MISSING_REQUIRED_ATTRIBUTE,
                Messages.get("attribute.missingRequired", attributeName, element.getQualifiedName()),
                element.getSourceInfo());
        this.element = element;
        this.attributeName = attributeName;
    }

    public Element getElement() {
        return element;
    }

    public String getAttributeName() {
        return attributeName;
    }
}
