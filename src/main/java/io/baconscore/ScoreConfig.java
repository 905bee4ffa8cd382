package io.baconscore;

import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Scoring settings loaded from YAML.
 * <p>
 * The defaults live in {@code /bacon-score.yaml} on the classpath. A user file may
 * override any key; keys it leaves out keep their default value.
 * <pre>
 * referenceActor: Kevin Bacon
 * unreachableLabel: No Bacon!
 * </pre>
 */
public class ScoreConfig {

    private static final String DEFAULT_CONFIG = "/bacon-score.yaml";

    private final String referenceActor;
    private final String unreachableLabel;

    private ScoreConfig(String referenceActor, String unreachableLabel) {
        this.referenceActor = referenceActor;
        this.unreachableLabel = unreachableLabel;
    }

    /**
     * Loads the default configuration from the classpath.
     */
    public static ScoreConfig loadDefault() {
        try (InputStream is = ScoreConfig.class.getResourceAsStream(DEFAULT_CONFIG)) {
            if (is == null) {
                throw new IllegalStateException("Default configuration not found: " + DEFAULT_CONFIG);
            }
            return load(is);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load default configuration", e);
        }
    }

    /**
     * Loads configuration from a file path.
     */
    public static ScoreConfig loadFromFile(Path path) throws IOException {
        try (InputStream is = Files.newInputStream(path)) {
            return load(is);
        } catch (YAMLException e) {
            throw new IOException("Invalid config file " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Loads configuration from an input stream. Missing keys are left unset.
     */
    public static ScoreConfig load(InputStream is) throws IOException {
        Yaml yaml = new Yaml();
        Object data = yaml.load(is);
        if (data == null) {
            return new ScoreConfig(null, null);
        }
        if (!(data instanceof Map<?, ?> map)) {
            throw new IOException("Config must be a YAML mapping");
        }
        return new ScoreConfig(
                getString(map, "referenceActor"),
                getString(map, "unreachableLabel")
        );
    }

    private static String getString(Map<?, ?> map, String key) throws IOException {
        Object value = map.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof String s) || s.isEmpty()) {
            throw new IOException("Config key '" + key + "' must be a non-empty string");
        }
        return s;
    }

    /**
     * Merges this configuration with another, with the other taking precedence.
     */
    public ScoreConfig merge(ScoreConfig other) {
        return new ScoreConfig(
                other.referenceActor != null ? other.referenceActor : referenceActor,
                other.unreachableLabel != null ? other.unreachableLabel : unreachableLabel
        );
    }

    /**
     * Returns a copy using a different reference actor.
     */
    public ScoreConfig withReferenceActor(String name) {
        return new ScoreConfig(name, unreachableLabel);
    }

    public String getReferenceActor() {
        return referenceActor;
    }

    public String getUnreachableLabel() {
        return unreachableLabel;
    }
}
