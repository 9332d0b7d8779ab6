package org.taglet.compiler;

import org.taglet.compiler.api.CompilationException;
import org.taglet.compiler.config.CompilerSettings;
import org.taglet.compiler.dom.Node;

/**
 * The compiler as seen by tag handlers: it owns the traversal order and the output
 * buffer. Handlers hold a reference to it for the duration of one compilation.
 */
public interface TagCompiler {

    /**
     * Compiles a node, dispatching elements to their tag handlers. This is the re-entry
     * point handlers use to process their children.
     *
     * @param node The node to compile.
     * @throws CompilationException if the node or one of its descendants fails.
     */
    void process(Node node) throws CompilationException;

    /**
     * Appends a fragment of generated code to the output.
     * @param code The code fragment.
     */
    void write(String code);

    /**
     * @return The settings of this compilation.
     */
    CompilerSettings settings();
}
