package com.sentinelx.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Loads and validates {@link SentinelConfig} from a YAML source.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_CONFIG_PATH} (file system path)</li>
 * <li>Explicit file system path passed to {@link #fromFile(String)}</li>
 * <li>Classpath resource {@value #DEFAULT_RESOURCE}</li>
 * </ol>
 *
 * <p>
 * All {@code load*} methods call {@link SentinelConfig#validate()} after
 * parsing so that a misconfigured client fails at startup.
 * </p>
 *
 * @since 1.0.0
 */
public final class SentinelConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(SentinelConfigLoader.class);

    /** Environment variable that can override the default config location. */
    public static final String ENV_CONFIG_PATH = "SENTINEL_CONFIG_PATH";

    public static final String DEFAULT_RESOURCE = "sentinel.yml";

    private SentinelConfigLoader() {
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Load configuration using automatic resolution.
     *
     * <p>
     * When no classpath resource exists either, built-in defaults are used.
     * </p>
     *
     * @return parsed and validated configuration
     * @throws IllegalStateException if validation fails
     */
    public static SentinelConfig load() {
        return load(System.getenv(ENV_CONFIG_PATH));
    }

    static SentinelConfig load(String envPath) {
        if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
            LOG.info("Loading configuration from environment path: {}", envPath);
            return fromFile(envPath);
        }
        if (SentinelConfigLoader.class.getClassLoader().getResource(DEFAULT_RESOURCE) == null) {
            LOG.warn("No {} on classpath, using built-in defaults", DEFAULT_RESOURCE);
            SentinelConfig config = SentinelConfig.defaults();
            config.validate();
            return config;
        }
        LOG.info("Loading configuration from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * Load configuration from a file system path.
     *
     * @throws NullPointerException     if {@code path} is {@code null}
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading or validation fails
     */
    public static SentinelConfig fromFile(String path) {
        Objects.requireNonNull(path, "Config file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Config file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read config file: " + path, e);
        }
    }

    /**
     * Load configuration from a classpath resource.
     *
     * @throws NullPointerException     if {@code resource} is {@code null}
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading or validation fails
     */
    public static SentinelConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = SentinelConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static SentinelConfig parseAndValidate(InputStream is) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(SentinelConfig.class, options));
        SentinelConfig config = yaml.load(is);

        if (config == null) {
            LOG.warn("Empty configuration document, using built-in defaults");
            config = SentinelConfig.defaults();
        }
        config.validate();

        LOG.info("Loaded configuration: {}", config);
        return config;
    }
}
