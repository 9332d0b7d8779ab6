package org.taglet.compiler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.taglet.compiler.api.CompilationException;
import org.taglet.compiler.api.UnresolvedHandlerException;
import org.taglet.compiler.config.CompilerSettings;
import org.taglet.compiler.config.ConfigLoader;
import org.taglet.compiler.diagnostics.DiagnosticsEngine;
import org.taglet.compiler.dom.Element;
import org.taglet.compiler.dom.Node;
import org.taglet.compiler.dom.Text;
import org.taglet.compiler.tags.AttributeCollector;
import org.taglet.compiler.tags.AttributeReader;
import org.taglet.compiler.tags.TagHandler;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Compiles a parsed markup tree into generated code. Text is copied verbatim, plain
 * elements are written back as markup and namespaced elements are dispatched to the tag
 * handler registered for their prefix. It is not thread-safe; use one instance per
 * compilation at a time.
 */
public class MarkupCompiler implements TagCompiler {

    private static final Logger LOG = LoggerFactory.getLogger(MarkupCompiler.class);

    private final TagHandlerRegistry registry;
    private final CompilerSettings settings;
    private final AttributeCollector attributeCollector;
    private final DiagnosticsEngine diagnostics = new DiagnosticsEngine();
    private final Map<String, TagHandler> handlers = new HashMap<>();
    private final StringBuilder out = new StringBuilder();

    /**
     * Creates a compiler with the built-in vocabularies and the settings found by
     * {@link ConfigLoader#loadSettings()}.
     */
    public MarkupCompiler() {
        this(TagHandlerRegistry.initialize(), ConfigLoader.loadSettings());
    }

    /**
     * @param registry The vocabularies available to documents.
     * @param settings The compiler settings.
     */
    public MarkupCompiler(TagHandlerRegistry registry, CompilerSettings settings) {
        this.registry = registry;
        this.settings = settings;
        this.attributeCollector = new AttributeCollector(new AttributeReader(settings.quotingRule()));
    }

    /**
     * Compiles a document.
     *
     * @param root The document element.
     * @return The generated code.
     * @throws CompilationException if any element fails; the error is also recorded in
     *         {@link #getDiagnostics()}.
     */
    public String compile(Element root) throws CompilationException {
        out.setLength(0);
        handlers.clear();
        diagnostics.clear();
        LOG.debug("Compiling document rooted at {}", root);
        try {
            process(root);
        } catch (CompilationException e) {
            diagnostics.reportError(e);
            throw e;
        }
        return out.toString();
    }

    @Override
    public void process(Node node) throws CompilationException {
        if (node instanceof Text text) {
            out.append(text.getContent());
        } else if (node instanceof Element element) {
            if (element.getPrefix() == null) {
                writeMarkup(element);
            } else {
                handlerFor(element).dispatch(element);
            }
        }
    }

    @Override
    public void write(String code) {
        out.append(code);
    }

    @Override
    public CompilerSettings settings() {
        return settings;
    }

    public DiagnosticsEngine getDiagnostics() {
        return diagnostics;
    }

    private void writeMarkup(Element element) throws CompilationException {
        out.append('<').append(element.getQualifiedName())
                .append(attributeCollector.getAttributeString(element.getAttributes()));
        if (!element.hasChildNodes()) {
            out.append("/>");
            return;
        }
        out.append('>');
        for (Node child : element.getChildren()) {
            process(child);
        }
        out.append("</").append(element.getQualifiedName()).append('>');
    }

    private TagHandler handlerFor(Element element) throws UnresolvedHandlerException {
        String prefix = element.getPrefix();
        TagHandler handler = handlers.get(prefix);
        if (handler == null) {
            Function<TagCompiler, ? extends TagHandler> factory = registry.get(prefix)
                    .orElseThrow(() -> new UnresolvedHandlerException(element, null));
            handler = factory.apply(this);
            handlers.put(prefix, handler);
            LOG.debug("Created {} for prefix '{}'", handler.getClass().getSimpleName(), prefix);
        }
        return handler;
    }
}
