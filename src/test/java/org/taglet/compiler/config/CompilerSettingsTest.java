package org.taglet.compiler.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.taglet.compiler.tags.QuotingRule;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class CompilerSettingsTest {

    @Test
    void defaultsMatchBuiltInQuotingRule() {
        CompilerSettings settings = CompilerSettings.defaults();
        QuotingRule rule = settings.quotingRule();

        assertThat(settings).isEqualTo(new CompilerSettings('$', '@', "null"));
        assertThat(rule.quote("$x")).isEqualTo("$x");
        assertThat(rule.quote("@x")).isEqualTo("@x");
        assertThat(rule.nullLiteral()).isEqualTo("null");
    }

    @Test
    void readsOverridesOnTopOfReference() {
        Config config = ConfigFactory.parseString("""
                taglet.compiler.quoting.expression-marker = "#"
                taglet.compiler.null-literal = "nil"
                """).withFallback(ConfigFactory.parseResources("reference.conf")).resolve();

        CompilerSettings settings = CompilerSettings.fromConfig(config);

        assertThat(settings.expressionMarker()).isEqualTo('#');
        assertThat(settings.referenceMarker()).isEqualTo('@');
        assertThat(settings.nullLiteral()).isEqualTo("nil");
    }

    @Test
    void rejectsMultiCharacterMarkers() {
        Config config = ConfigFactory.parseString("taglet.compiler.quoting.reference-marker = \"@@\"")
                .withFallback(ConfigFactory.parseResources("reference.conf")).resolve();

        assertThatThrownBy(() -> CompilerSettings.fromConfig(config))
                .isInstanceOf(ConfigException.BadValue.class)
                .hasMessageContaining("reference-marker");
    }

    @Test
    void missingBlockFails() {
        assertThatThrownBy(() -> CompilerSettings.fromConfig(ConfigFactory.empty()))
                .isInstanceOf(ConfigException.Missing.class);
    }
}
