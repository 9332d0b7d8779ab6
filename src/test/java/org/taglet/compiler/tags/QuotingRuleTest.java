package org.taglet.compiler.tags;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests the classification and quoting of raw attribute text.
 */
@Tag("unit")
class QuotingRuleTest {

    private final QuotingRule rule = QuotingRule.standard();

    @Test
    void expressionAndReferenceTextIsLeftUnchanged() {
        assertThat(rule.quote("$x")).isEqualTo("$x");
        assertThat(rule.quote("@ref")).isEqualTo("@ref");
        assertThat(rule.quote("$user->name")).isEqualTo("$user->name");
    }

    @Test
    void literalTextIsSingleQuoted() {
        assertThat(rule.quote("abc")).isEqualTo("'abc'");
        assertThat(rule.quote("a $b")).isEqualTo("'a $b'");
    }

    @Test
    void absentValueYieldsNull() {
        assertThat(rule.quote(null)).isNull();
        assertThat(rule.classify(null)).isSameAs(AttributeValue.Absent.INSTANCE);
    }

    @Test
    void emptyStringIsALiteralNotAbsent() {
        assertThat(rule.classify("")).isEqualTo(new AttributeValue.Literal(""));
        assertThat(rule.quote("")).isEqualTo("''");
        assertThat(rule.needsQuote("")).isTrue();
    }

    @Test
    void classifyTagsValuesByLeadingCharacter() {
        assertThat(rule.classify("$x")).isEqualTo(new AttributeValue.Expression("$x"));
        assertThat(rule.classify("@x")).isEqualTo(new AttributeValue.Expression("@x"));
        assertThat(rule.classify("x$")).isEqualTo(new AttributeValue.Literal("x$"));
    }

    @Test
    void customSentinelsReplaceTheBuiltInOnes() {
        QuotingRule custom = new QuotingRule('#', '&', "NULL");

        assertThat(custom.quote("#x")).isEqualTo("#x");
        assertThat(custom.quote("&x")).isEqualTo("&x");
        assertThat(custom.quote("$x")).isEqualTo("'$x'");
        assertThat(custom.nullLiteral()).isEqualTo("NULL");
    }

    @Test
    void emptyNullLiteralIsRejected() {
        assertThatThrownBy(() -> new QuotingRule('$', '@', ""))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
