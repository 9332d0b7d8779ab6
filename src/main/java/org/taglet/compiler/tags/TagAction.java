package org.taglet.compiler.tags;

import org.taglet.compiler.api.CompilationException;
import org.taglet.compiler.dom.Element;

/**
 * A tag implementation without a result, the usual case.
 *
 * @param <H> The handler type.
 */
@FunctionalInterface
public interface TagAction<H extends TagHandler> {

    void handle(H handler, Element element) throws CompilationException;
}
