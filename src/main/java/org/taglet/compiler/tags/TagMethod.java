package org.taglet.compiler.tags;

import org.taglet.compiler.api.CompilationException;
import org.taglet.compiler.dom.Element;

/**
 * A tag implementation bound to a handler type. The return value is passed through
 * {@link TagHandler#dispatch(Element)} unchanged and carries no meaning for the core.
 *
 * @param <H> The handler type.
 */
@FunctionalInterface
public interface TagMethod<H extends TagHandler> {

    Object handle(H handler, Element element) throws CompilationException;
}
