package org.taglet.compiler.api;

import org.taglet.compiler.dom.Element;
import org.taglet.compiler.internal.i18n.Messages;

/**
 * Thrown when no handler can be found for an element: either the namespace has no
 * registered tag handler, or the handler defines no tag for the local name.
 */
public class UnresolvedHandlerException extends CompilationException {

    private final transient Element element;
    private final String qualifiedName;
    private final String handlerType;

    /**
     * @param element The element that could not be handled.
     * @param handlerType The simple name of the handler class consulted, or null if no
     *                    handler is registered for the element's namespace.
     */
    public UnresolvedHandlerException(Element element, String handlerType) {
        super(CompilerErrorCode.UNRESOLVED_HANDLER,
                handlerType == null
                        ? Messages.get("dispatch.unknownNamespace", element.getPrefix(), element.getQualifiedName())
                        : Messages.get("dispatch.unresolved", handlerType, element.getQualifiedName()),
                element.getSourceInfo());
        this.element = element;
        this.qualifiedName = element.getQualifiedName();
        this.handlerType = handlerType;
    }

    public Element getElement() {
        return element;
    }

    public String getQualifiedName() {
        return qualifiedName;
    }

    /**
     * @return The handler class name, or null when the namespace itself is unknown.
     */
    public String getHandlerType() {
        return handlerType;
    }
}
