package org.taglet.compiler.vocab.core;

import org.taglet.compiler.TagCompiler;
import org.taglet.compiler.api.CompilationException;
import org.taglet.compiler.dom.Element;
import org.taglet.compiler.tags.AttributeSpec;
import org.taglet.compiler.tags.TagHandler;
import org.taglet.compiler.tags.TagTable;

/**
 * The core vocabulary, bound to the {@code c} prefix. Emits PHP template code.
 * <ul>
 *     <li>{@code <c:out value="$name" default="anonymous" escape="no"/>}</li>
 *     <li>{@code <c:if test="$user->isAdmin()">...</c:if>}</li>
 *     <li>{@code <c:forEach items="$users" var="$user">...</c:forEach>}</li>
 *     <li>{@code <c:set var="$title" value="Home"/>}</li>
 *     <li>{@code <c:link href="$url" title="Home">...</c:link>}</li>
 * </ul>
 */
public class CoreTags extends TagHandler {

    /** The namespace prefix the vocabulary is registered under by default. */
    public static final String PREFIX = "c";

    private static final AttributeSpec LINK_ATTRIBUTES = AttributeSpec.of("href", "title").with("rel", "nofollow");

    // "if" is a keyword, hence the underscore
    private static final TagTable<CoreTags> TAGS = TagTable.builder(CoreTags.class)
            .action("out", CoreTags::out)
            .action("_if", CoreTags::conditional)
            .action("forEach", CoreTags::forEach)
            .action("set", CoreTags::set)
            .action("link", CoreTags::link)
            .build();

    public CoreTags(TagCompiler compiler) {
        super(compiler);
    }

    @Override
    protected TagTable<CoreTags> tagTable() {
        return TAGS;
    }

    private void out(Element element) throws CompilationException {
        boolean escape = getBooleanAttr(element, "escape", true);
        compiler.write("<?php echo Core::out("
                + argList(requiredAttr(element, "value"), getAttr(element, "default"), escape ? null : "false")
                + "); ?>");
    }

    private void conditional(Element element) throws CompilationException {
        compiler.write("<?php if (" + requiredAttr(element, "test", false) + "): ?>");
        process(element);
        compiler.write("<?php endif; ?>");
    }

    private void forEach(Element element) throws CompilationException {
        compiler.write("<?php foreach (" + requiredAttr(element, "items", false)
                + " as " + requiredAttr(element, "var", false) + "): ?>");
        process(element);
        compiler.write("<?php endforeach; ?>");
    }

    private void set(Element element) throws CompilationException {
        compiler.write("<?php " + requiredAttr(element, "var", false)
                + " = " + getAttr(element, "value", "") + "; ?>");
    }

    private void link(Element element) throws CompilationException {
        compiler.write("<a" + getAttributeString(element, LINK_ATTRIBUTES) + ">");
        process(element);
        compiler.write("</a>");
    }
}
