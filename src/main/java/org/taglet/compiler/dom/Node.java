package org.taglet.compiler.dom;

/**
 * A node of an already-parsed markup tree. Nodes are immutable once built.
 */
public sealed interface Node permits Element, Text {

    /**
     * @return The enclosing element, or null for a root node.
     */
    Element getParent();
}
