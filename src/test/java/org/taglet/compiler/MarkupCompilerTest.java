package org.taglet.compiler;

import org.taglet.compiler.api.CompilationException;
import org.taglet.compiler.api.CompilerErrorCode;
import org.taglet.compiler.api.MissingRequiredAttributeException;
import org.taglet.compiler.api.ReservedMethodInvocationException;
import org.taglet.compiler.api.SourceInfo;
import org.taglet.compiler.api.UnresolvedHandlerException;
import org.taglet.compiler.config.CompilerSettings;
import org.taglet.compiler.dom.Element;
import org.taglet.compiler.vocab.core.CoreTags;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end tests of document traversal, handler creation and error reporting.
 */
@Tag("unit")
class MarkupCompilerTest {

    @AfterEach
    void tearDown() {
        System.clearProperty("taglet.compiler.null-literal");
        ConfigFactory.invalidateCaches();
    }

    @Test
    void plainMarkupAndTextArePassedThrough() throws Exception {
        Element doc = Element.builder("html")
                .child(Element.builder("body").attribute("class", "main")
                        .text("Hello ")
                        .child(Element.builder("br")))
                .build();

        String code = new MarkupCompiler().compile(doc);

        assertThat(code).isEqualTo("<html><body class=\"main\">Hello <br/></body></html>");
    }

    @Test
    void nestedTagsRecurseThroughTheCompiler() throws Exception {
        Element doc = Element.builder("ul")
                .child(Element.builder("c:if").attribute("test", "$users")
                        .child(Element.builder("c:forEach").attribute("items", "$users").attribute("var", "$u")
                                .child(Element.builder("li")
                                        .child(Element.builder("c:if").attribute("test", "$u->active")
                                                .child(Element.builder("c:out").attribute("value", "$u->name"))))))
                .build();

        String code = new MarkupCompiler().compile(doc);

        assertThat(code).isEqualTo("<ul><?php if ($users): ?>"
                + "<?php foreach ($users as $u): ?>"
                + "<li><?php if ($u->active): ?><?php echo Core::out($u->name); ?><?php endif; ?></li>"
                + "<?php endforeach; ?>"
                + "<?php endif; ?></ul>");
    }

    @Test
    void createsOneHandlerPerPrefixPerCompilation() throws Exception {
        AtomicInteger created = new AtomicInteger();
        TagHandlerRegistry registry = new TagHandlerRegistry();
        registry.register("c", c -> {
            created.incrementAndGet();
            return new CoreTags(c);
        });
        MarkupCompiler compiler = new MarkupCompiler(registry, CompilerSettings.defaults());
        Element doc = Element.builder("p")
                .child(Element.builder("c:out").attribute("value", "$a"))
                .child(Element.builder("c:out").attribute("value", "$b"))
                .build();

        compiler.compile(doc);
        assertThat(created).hasValue(1);

        compiler.compile(doc);
        assertThat(created).hasValue(2);
    }

    @Test
    void vocabulariesCanBeBoundToAnyPrefix() throws Exception {
        TagHandlerRegistry registry = new TagHandlerRegistry();
        registry.register("core", CoreTags::new);

        String code = new MarkupCompiler(registry, CompilerSettings.defaults())
                .compile(Element.builder("core:out").attribute("value", "x").build());

        assertThat(code).isEqualTo("<?php echo Core::out('x'); ?>");
    }

    @Test
    void settingsReachTheHandlers() throws Exception {
        MarkupCompiler compiler = new MarkupCompiler(TagHandlerRegistry.initialize(), new CompilerSettings('#', '&', "NULL"));

        String code = compiler.compile(Element.builder("c:out")
                .attribute("value", "$literal")
                .attribute("escape", "no")
                .build());

        assertThat(code).isEqualTo("<?php echo Core::out('$literal', NULL, false); ?>");
    }

    @Test
    void unknownPrefixFailsWithUnresolvedHandler() {
        MarkupCompiler compiler = new MarkupCompiler();
        Element doc = Element.builder("x:widget").location(new SourceInfo("page.xml", 2, 5)).build();

        assertThatThrownBy(() -> compiler.compile(doc))
                .isInstanceOfSatisfying(UnresolvedHandlerException.class, ex -> {
                    assertThat(ex.getHandlerType()).isNull();
                    assertThat(ex.getMessage()).contains("'x'").contains("x:widget").contains("page.xml:2:5");
                });
        assertThat(compiler.getDiagnostics().hasErrors()).isTrue();
    }

    @Test
    void reservedNameInMarkupFails() {
        assertThatThrownBy(() -> new MarkupCompiler().compile(Element.builder("c:process").build()))
                .isInstanceOf(ReservedMethodInvocationException.class)
                .hasMessageContaining("CoreTags");
    }

    @Test
    void failureInNestedChildUnwindsAndIsRecorded() {
        MarkupCompiler compiler = new MarkupCompiler();
        SourceInfo where = new SourceInfo("page.xml", 9, 3);
        Element doc = Element.builder("div")
                .child(Element.builder("c:if").attribute("test", "$a")
                        .child(Element.builder("c:out").location(where)))
                .build();

        assertThatThrownBy(() -> compiler.compile(doc))
                .isInstanceOf(MissingRequiredAttributeException.class);

        assertThat(compiler.getDiagnostics().getDiagnostics())
                .singleElement()
                .satisfies(d -> {
                    assertThat(d.code()).isEqualTo(CompilerErrorCode.MISSING_REQUIRED_ATTRIBUTE);
                    assertThat(d.sourceInfo()).isEqualTo(where);
                });
    }

    @Test
    void compilerIsReusableAfterFailure() throws CompilationException {
        MarkupCompiler compiler = new MarkupCompiler();

        assertThatThrownBy(() -> compiler.compile(Element.builder("c:nothing").build()))
                .isInstanceOf(UnresolvedHandlerException.class);

        assertThat(compiler.getDiagnostics().hasErrors()).isTrue();

        assertThat(compiler.compile(Element.builder("c:out").attribute("value", "$x").build()))
                .isEqualTo("<?php echo Core::out($x); ?>");
        assertThat(compiler.getDiagnostics().hasErrors()).isFalse();
        assertThat(compiler.getDiagnostics().getDiagnostics()).isEmpty();
    }

    @Test
    void defaultCompilerPicksUpSystemPropertyOverrides() throws CompilationException {
        System.setProperty("taglet.compiler.null-literal", "NULL");
        ConfigFactory.invalidateCaches();

        String code = new MarkupCompiler().compile(
                Element.builder("c:out").attribute("value", "x").attribute("escape", "no").build());

        assertThat(code).isEqualTo("<?php echo Core::out('x', NULL, false); ?>");
    }
}
