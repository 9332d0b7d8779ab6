package org.taglet.compiler.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Assembles the compiler configuration from layered sources. Earlier layers win:
 * <ol>
 *     <li>environment variables</li>
 *     <li>system properties, e.g. {@code -Dtaglet.compiler.null-literal=NULL}</li>
 *     <li>{@code taglet.conf} (or the file given to {@link #load(File)})</li>
 *     <li>{@code reference.conf} on the classpath</li>
 * </ol>
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    /** Looked up in the working directory by {@link #load()}. */
    public static final String CONFIG_FILE_NAME = "taglet.conf";

    private ConfigLoader() {}

    /**
     * Reads the compiler settings from all layers, using {@code taglet.conf} in the
     * working directory.
     * @return The effective settings.
     */
    public static CompilerSettings loadSettings() {
        return CompilerSettings.fromConfig(load());
    }

    /**
     * @return The merged configuration, using {@code taglet.conf} in the working directory.
     */
    public static Config load() {
        return load(new File(CONFIG_FILE_NAME));
    }

    /**
     * Merges all layers.
     *
     * @param overrides The file layer; ignored unless it is an existing regular file.
     * @return The resolved configuration.
     */
    public static Config load(File overrides) {
        Config fileLayer = ConfigFactory.empty();
        if (overrides.isFile()) {
            LOG.info("Reading compiler configuration overrides from {}", overrides.getAbsolutePath());
            fileLayer = ConfigFactory.parseFile(overrides);
        } else {
            LOG.debug("No compiler configuration file at {}", overrides.getPath());
        }

        return ConfigFactory.systemEnvironment()
                .withFallback(ConfigFactory.systemProperties())
                .withFallback(fileLayer)
                .withFallback(ConfigFactory.parseResources(CompilerSettings.REFERENCE_RESOURCE))
                .resolve();
    }
}
