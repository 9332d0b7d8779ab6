package org.taglet.compiler.api;

import org.taglet.compiler.dom.Element;
import org.taglet.compiler.internal.i18n.Messages;

/**
 * Thrown when markup names an internal handler method (prefixed with {@code __}) or a
 * method of the base tag handler contract, such as {@code process} or {@code quote}.
 */
public class ReservedMethodInvocationException extends CompilationException {

    private final transient Element element;
    private final String handlerType;
    private final String resolvedName;

    /**
     * @param element The offending element.
     * @param handlerType The simple name of the handler class.
     * @param resolvedName The reserved name the element resolved to.
     */
    public ReservedMethodInvocationException(Element element, String handlerType, String resolvedName) {
        super(CompilerErrorCode.RESERVED_METHOD_INVOCATION,
                Messages.get("dispatch.reserved", handlerType, resolvedName, element.getQualifiedName()),
                element.getSourceInfo());
        this.element = element;
        this.handlerType = handlerType;
        this.resolvedName = resolvedName;
    }

    public Element getElement() {
        return element;
    }

    public String getHandlerType() {
        return handlerType;
    }

    public String getResolvedName() {
        return resolvedName;
    }
}
