package com.checklist.config;

import com.checklist.emit.PercentMode;
import com.checklist.exception.ConfigurationException;
import com.checklist.rule.CeeScore;
import com.checklist.validation.DuplicateOptionPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Loads rule dialect configuration from YAML files.
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private static final String ROOT_KEY = "checklist-rules";

    /**
     * Load configuration from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the configuration file
     * @return Loaded configuration
     */
    public static RulesConfig load(String path) {
        log.info("Loading rules configuration from: {}", path);

        try {
            Resource resource = getResource(path);
            try (InputStream inputStream = resource.getInputStream()) {
                return parseYaml(inputStream);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    private static RulesConfig parseYaml(InputStream inputStream) {
        Yaml yaml = new Yaml();
        Object document = yaml.load(inputStream);

        if (document == null) {
            throw new ConfigurationException("Configuration file is empty");
        }
        Map<String, Object> root = asSection(document, "document root");

        // Settings may sit at the root or under 'checklist-rules'
        if (root.containsKey(ROOT_KEY) && root.get(ROOT_KEY) == null) {
            throw new ConfigurationException("Section '" + ROOT_KEY + "' is empty");
        }
        Map<String, Object> rulesConfig = root.containsKey(ROOT_KEY)
                ? asSection(root.get(ROOT_KEY), ROOT_KEY)
                : root;

        RulesConfig defaults = RulesConfig.defaults();

        String name = getString(rulesConfig, "name", defaults.name());
        DuplicateOptionPolicy duplicateOptions = getEnum(rulesConfig, "duplicate-options",
                DuplicateOptionPolicy.class, defaults.duplicateOptions());
        PercentMode percentMode = getEnum(rulesConfig, "percent-mode",
                PercentMode.class, defaults.percentMode());
        String optionNameFormat = parseOptionNameFormat(
                getString(rulesConfig, "option-name-format", defaults.optionNameFormat()));
        String fieldRefPattern = parseFieldRefPattern(
                getString(rulesConfig, "field-ref-pattern", defaults.fieldRefPattern()));
        String yesChoice = getString(rulesConfig, "yes-choice", defaults.yesChoice());
        String noChoice = getString(rulesConfig, "no-choice", defaults.noChoice());
        CeeScore defaultScore = parseScore(getString(rulesConfig, "default-score", defaults.defaultScore().label()));
        Object batchSection = rulesConfig.get("batch");
        RulesConfig.BatchConfig batch = parseBatchConfig(batchSection == null ? null : asSection(batchSection, "batch"));

        RulesConfig config = new RulesConfig(name, duplicateOptions, percentMode, optionNameFormat,
                fieldRefPattern, yesChoice, noChoice, defaultScore, batch);

        log.info("Loaded rules configuration: {} with duplicate-options={}, percent-mode={}, parallelism={}",
                name, duplicateOptions, percentMode, batch.parallelism());

        return config;
    }

    private static String parseOptionNameFormat(String format) {
        if (!format.contains(RulesConfig.INDEX_PLACEHOLDER)) {
            throw new ConfigurationException("option-name-format '" + format
                    + "' must contain " + RulesConfig.INDEX_PLACEHOLDER);
        }
        return format;
    }

    private static String parseFieldRefPattern(String pattern) {
        try {
            Pattern.compile(pattern);
            return pattern;
        } catch (PatternSyntaxException e) {
            throw new ConfigurationException("Invalid field-ref-pattern '" + pattern + "'", e);
        }
    }

    private static CeeScore parseScore(String label) {
        return CeeScore.fromLabel(label)
                .or(() -> CeeScore.fromLabel(capitalize(label)))
                .orElseThrow(() -> new ConfigurationException("Unknown default-score '" + label + "'"));
    }

    private static RulesConfig.BatchConfig parseBatchConfig(Map<String, Object> map) {
        if (map == null) {
            return RulesConfig.BatchConfig.defaults();
        }
        int parallelism = getInt(map, "parallelism", RulesConfig.BatchConfig.defaults().parallelism());
        if (parallelism < 1) {
            throw new ConfigurationException("batch.parallelism must be at least 1 but was " + parallelism);
        }
        log.debug("Parsed batch config: parallelism={}", parallelism);
        return new RulesConfig.BatchConfig(parallelism);
    }

    // Helper methods

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asSection(Object value, String key) {
        if (!(value instanceof Map)) {
            throw new ConfigurationException("Expected a mapping for '" + key + "' but found '" + value + "'");
        }
        return (Map<String, Object>) value;
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).intValue();
        try {
            return Integer.parseInt(value.toString());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Expected an integer for '" + key + "' but found '" + value + "'", e);
        }
    }

    private static <E extends Enum<E>> E getEnum(Map<String, Object> map, String key,
                                                 Class<E> type, E defaultValue) {
        String value = getString(map, key, null);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Enum.valueOf(type, value.toUpperCase().replace("-", "_"));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown value '" + value + "' for '" + key + "'", e);
        }
    }

    private static String capitalize(String value) {
        if (value.isEmpty()) {
            return value;
        }
        return Character.toUpperCase(value.charAt(0)) + value.substring(1).toLowerCase();
    }
}
