package org.taglet.compiler.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.taglet.compiler.tags.QuotingRule;

/**
 * Immutable compiler settings, read from the {@code taglet.compiler} configuration block.
 *
 * @param expressionMarker Leading character marking expression attribute text.
 * @param referenceMarker Leading character marking reference attribute text.
 * @param nullLiteral The generated-code spelling of "no value".
 */
public record CompilerSettings(char expressionMarker, char referenceMarker, String nullLiteral) {

    /** Path of the settings block in the configuration tree. */
    public static final String CONFIG_PATH = "taglet.compiler";

    /** Classpath resource holding the built-in defaults. */
    public static final String REFERENCE_RESOURCE = "reference.conf";

    /**
     * @return The settings declared in {@code reference.conf}, ignoring every override.
     * @see ConfigLoader#loadSettings()
     */
    public static CompilerSettings defaults() {
        return fromConfig(ConfigFactory.parseResources(REFERENCE_RESOURCE).resolve());
    }

    /**
     * Reads settings from a resolved configuration.
     *
     * @param config A configuration containing the {@code taglet.compiler} block.
     * @return The settings.
     * @throws ConfigException if a value is missing or malformed.
     */
    public static CompilerSettings fromConfig(Config config) {
        Config c = config.getConfig(CONFIG_PATH);
        return new CompilerSettings(
                singleChar(c, "quoting.expression-marker"),
                singleChar(c, "quoting.reference-marker"),
                c.getString("null-literal"));
    }

    /**
     * @return A quoting rule using these settings.
     */
    public QuotingRule quotingRule() {
        return new QuotingRule(expressionMarker, referenceMarker, nullLiteral);
    }

    private static char singleChar(Config config, String path) {
        String value = config.getString(path);
        if (value.length() != 1) {
            throw new ConfigException.BadValue(config.origin(), path,
                    "expected a single character but got '" + value + "'");
        }
        return value.charAt(0);
    }
}
