package com.telemetrysentinel.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads the ordered classification rule table from YAML.
 *
 * <h3>Where the table comes from</h3>
 * <p>
 * {@link #load()} uses the file named by {@value #ENV_RULES_PATH} when that
 * variable is set, and the bundled {@value #DEFAULT_RESOURCE} otherwise. A
 * set variable that points at a missing file is an error: falling back to
 * the stock rules would silently reclassify every message.
 * </p>
 *
 * <h3>What is checked</h3>
 * <ul>
 * <li>The document parses, with duplicate mapping keys refused.</li>
 * <li>Every rule has a known category and severity, a priority in range and
 * at least one pattern, and every pattern compiles as a regular
 * expression.</li>
 * <li>Rule names are unique, since the first match wins and two rules with
 * one name could not be told apart in a classification.</li>
 * </ul>
 * <p>
 * All problems in one document are reported together, prefixed with the
 * source they came from.
 * </p>
 *
 * <h3>Empty table</h3>
 * <p>
 * A blank document or {@code rules: []} is accepted and yields
 * {@link ClassificationRulesConfig#defaultOnly()}: every message then
 * receives the default {@code application/medium} classification.
 * </p>
 *
 * @since 1.0.0
 */
public final class ClassificationRulesLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ClassificationRulesLoader.class);

    /** Names a YAML file that replaces the bundled rule table. */
    public static final String ENV_RULES_PATH = "CLASSIFICATION_RULES_PATH";

    /** Classpath resource holding the stock rule table. */
    public static final String DEFAULT_RESOURCE = "classification-rules.yml";

    private ClassificationRulesLoader() {
    }

    /**
     * @return the rule table for this process
     * @throws IllegalArgumentException if {@value #ENV_RULES_PATH} names a missing file
     * @throws IllegalStateException    if the table cannot be read or is invalid
     */
    public static ClassificationRulesConfig load() {
        String override = System.getenv(ENV_RULES_PATH);
        if (override == null || override.isBlank()) {
            return fromClasspath(DEFAULT_RESOURCE);
        }
        return fromFile(Path.of(override.trim()));
    }

    /**
     * @param file YAML rule table
     * @return the validated rules, in file order
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if the file cannot be read or is invalid
     */
    public static ClassificationRulesConfig fromFile(Path file) {
        Objects.requireNonNull(file, "file must not be null");
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return parse(reader, file.toString());
        } catch (NoSuchFileException e) {
            throw new IllegalArgumentException("Classification rules file not found: " + file, e);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read classification rules file " + file, e);
        }
    }

    /**
     * @param resource classpath resource name
     * @return the validated rules, in document order
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if the resource cannot be read or is invalid
     */
    public static ClassificationRulesConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "resource must not be null");
        InputStream in = ClassificationRulesLoader.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new IllegalArgumentException("Classification rules resource not found on classpath: " + resource);
        }
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return parse(reader, "classpath:" + resource);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read classification rules resource " + resource, e);
        }
    }

    /**
     * Parse an in-memory rule table.
     *
     * @param yaml   document text
     * @param source label used in log lines and error messages
     * @return the validated rules, in document order
     * @throws IllegalStateException if the document is malformed or invalid
     */
    public static ClassificationRulesConfig fromString(String yaml, String source) {
        Objects.requireNonNull(yaml, "yaml must not be null");
        return parse(new StringReader(yaml), source);
    }

    private static ClassificationRulesConfig parse(Reader reader, String source) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        ClassificationRulesConfig config;
        try {
            config = new Yaml(new Constructor(ClassificationRulesConfig.class, options)).load(reader);
        } catch (YAMLException e) {
            throw new IllegalStateException("Malformed classification rules in " + source + ": " + e.getMessage(), e);
        }

        if (config == null || config.getRules().isEmpty()) {
            LOG.info("Classification rules in {} are empty; every message gets the default classification", source);
            return ClassificationRulesConfig.defaultOnly();
        }
        try {
            config.validate();
        } catch (IllegalStateException e) {
            throw new IllegalStateException(source + ": " + e.getMessage(), e);
        }
        LOG.info("Loaded {} classification rule(s) from {}: {}", config.getRules().size(), source, config.ruleNames());
        return config;
    }
}
