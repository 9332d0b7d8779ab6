package org.taglet.compiler.tags;

import org.taglet.compiler.TagCompiler;
import org.taglet.compiler.api.CompilationException;
import org.taglet.compiler.api.InvalidBooleanLiteralException;
import org.taglet.compiler.api.MissingRequiredAttributeException;
import org.taglet.compiler.api.ReservedMethodInvocationException;
import org.taglet.compiler.api.UnresolvedHandlerException;
import org.taglet.compiler.dom.Element;
import org.taglet.compiler.dom.Node;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Base class for tag vocabularies.
 * <p>
 * A handler is created by the compiler for one namespace of one document and keeps only
 * the compiler reference. Given an element named {@code <ns:name/>}, {@link #dispatch(Element)}
 * looks up {@code name} in the handler's {@link TagTable}, then {@code _name}. A resolved
 * name beginning with {@code __} or naming a method declared by this class is never
 * dispatched.
 * <p>
 * Subclasses implement tags with the protected attribute helpers and write the generated
 * code to the compiler:
 * <pre>{@code
 * public class HtmlTags extends TagHandler {
 *     private static final TagTable<HtmlTags> TAGS = TagTable.builder(HtmlTags.class)
 *             .action("img", HtmlTags::img)
 *             .build();
 *
 *     public HtmlTags(TagCompiler compiler) { super(compiler); }
 *
 *     protected TagTable<HtmlTags> tagTable() { return TAGS; }
 *
 *     private void img(Element element) {
 *         compiler.write("<img" + getAttributeString(element, AttributeSpec.of("src", "alt")) + ">");
 *     }
 * }
 * }</pre>
 */
public abstract class TagHandler {

    /** Prefix of names that are internal to a handler and never reachable from markup. */
    public static final String INTERNAL_PREFIX = "__";

    private static final Set<String> BASE_CONTRACT_METHODS = Set.of(
            "dispatch", "tagTable", "getCompiler", "process",
            "quote", "needsQuote",
            "requiredAttr", "getAttr", "getUnquotedAttr", "getBooleanAttr",
            "argList", "getAttributes", "getAttributeString");

    /** The compiler to write to. Not owned by the handler. */
    protected final TagCompiler compiler;

    private final QuotingRule quotingRule;
    private final AttributeReader attributeReader;
    private final AttributeCollector attributeCollector;
    private final ArgumentList argumentList;

    /**
     * @param compiler The compiler this handler writes to.
     */
    protected TagHandler(TagCompiler compiler) {
        this.compiler = Objects.requireNonNull(compiler, "compiler");
        this.quotingRule = compiler.settings().quotingRule();
        this.attributeReader = new AttributeReader(quotingRule);
        this.attributeCollector = new AttributeCollector(attributeReader);
        this.argumentList = new ArgumentList(quotingRule.nullLiteral());
    }

    /**
     * @param name A candidate tag or method name.
     * @return true if markup must never reach a method of that name.
     */
    public static boolean isReserved(String name) {
        return name.startsWith(INTERNAL_PREFIX) || BASE_CONTRACT_METHODS.contains(name);
    }

    /**
     * @return The registration table of this handler type. Implementations return a
     *         shared {@code static final} table.
     */
    protected abstract TagTable<? extends TagHandler> tagTable();

    /**
     * Dispatches an element to the tag registered for its local name.
     * <p>
     * The name is resolved before it is checked: {@code name} is taken if the table defines
     * it or this class declares a method of that name, otherwise {@code _name} if the table
     * defines it. Only a resolved name is tested with {@link #isReserved(String)}, so an
     * unknown {@code <ns:__foo/>} is unresolved while {@code <ns:process/>} is reserved.
     *
     * @param element The element to handle.
     * @return Whatever the tag returns, usually null.
     * @throws UnresolvedHandlerException if neither {@code name} nor {@code _name} resolves.
     * @throws ReservedMethodInvocationException if the resolved name is internal or part of the base contract.
     * @throws CompilationException if the tag itself fails.
     */
    public final Object dispatch(Element element) throws CompilationException {
        String localName = element.getLocalName();
        TagTable<? extends TagHandler> table = tagTable();

        String method;
        if (table.defines(localName) || BASE_CONTRACT_METHODS.contains(localName)) {
            method = localName;
        } else if (table.defines("_" + localName)) {
            method = "_" + localName;
        } else {
            throw new UnresolvedHandlerException(element, getClass().getSimpleName());
        }

        if (isReserved(method)) {
            throw new ReservedMethodInvocationException(element, getClass().getSimpleName(), method);
        }
        return table.invoke(method, this, element);
    }

    public TagCompiler getCompiler() {
        return compiler;
    }

    /**
     * Hands every child of the element back to the compiler, in document order.
     * @param element The parent element.
     */
    protected void process(Element element) throws CompilationException {
        if (element.hasChildNodes()) {
            for (Node node : element.getChildren()) {
                compiler.process(node);
            }
        }
    }

    /**
     * Quotes a value if it is a literal.
     * @param value The subject to quote (or not), may be null.
     * @return The quoted (or not) value, null if {@code value} is null.
     */
    protected String quote(String value) {
        return quotingRule.quote(value);
    }

    protected boolean needsQuote(String value) {
        return quotingRule.needsQuote(value);
    }

    protected String requiredAttr(Element element, String name) throws MissingRequiredAttributeException {
        return attributeReader.requiredAttr(element, name);
    }

    protected String requiredAttr(Element element, String name, boolean quote) throws MissingRequiredAttributeException {
        return attributeReader.requiredAttr(element, name, quote);
    }

    protected String getAttr(Element element, String name) {
        return attributeReader.getAttr(element, name);
    }

    protected String getAttr(Element element, String name, String defaultValue) {
        return attributeReader.getAttr(element, name, defaultValue);
    }

    protected String getUnquotedAttr(Element element, String name) {
        return attributeReader.getUnquotedAttr(element, name);
    }

    protected String getUnquotedAttr(Element element, String name, String defaultValue) {
        return attributeReader.getUnquotedAttr(element, name, defaultValue);
    }

    protected boolean getBooleanAttr(Element element, String name) throws InvalidBooleanLiteralException {
        return attributeReader.getBooleanAttr(element, name);
    }

    protected boolean getBooleanAttr(Element element, String name, boolean defaultValue) throws InvalidBooleanLiteralException {
        return attributeReader.getBooleanAttr(element, name, defaultValue);
    }

    /**
     * Formats arguments as a call argument list, dropping trailing nulls.
     * @see ArgumentList#argList(List, boolean)
     */
    protected String argList(String... args) {
        return argumentList.argList(Arrays.asList(args), true);
    }

    protected String argList(List<String> args, boolean pruneTail) {
        return argumentList.argList(args, pruneTail);
    }

    protected Map<String, String> getAttributes(Element element, AttributeSpec spec) {
        return attributeCollector.getAttributes(element, spec);
    }

    protected String getAttributeString(Element element, AttributeSpec spec) {
        return attributeCollector.getAttributeString(element, spec);
    }

    protected String getAttributeString(Map<String, String> attributes) {
        return attributeCollector.getAttributeString(attributes);
    }
}
