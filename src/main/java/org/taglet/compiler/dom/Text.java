package org.taglet.compiler.dom;

/**
 * Character data between elements.
 */
public final class Text implements Node {

    private final String content;
    private final Element parent;

    Text(String content, Element parent) {
        this.content = content;
        this.parent = parent;
    }

    public String getContent() {
        return content;
    }

    @Override
    public Element getParent() {
        return parent;
    }

    @Override
    public String toString() {
        return "Text[" + content + "]";
    }
}
