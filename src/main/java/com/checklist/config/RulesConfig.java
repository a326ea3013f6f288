package com.checklist.config;

import com.checklist.emit.PercentMode;
import com.checklist.rule.CeeScore;
import com.checklist.validation.DuplicateOptionPolicy;

import java.util.Objects;

/**
 * Dialect settings for parsing, validating and emitting rules.
 *
 * @param name              Configuration name, for logging
 * @param duplicateOptions  Policy for repeated selection options
 * @param percentMode       How percentage thresholds are emitted
 * @param optionNameFormat  Choice name template with {@code {question}} and {@code {index}} placeholders
 * @param fieldRefPattern   Regular expression a field reference must match
 * @param yesChoice         Choice name of a "yes" answer
 * @param noChoice          Choice name of a "no" answer
 * @param defaultScore      Score of a single scoring rule when its condition fails
 * @param batch             Batch compilation settings
 */
public record RulesConfig(
        String name,
        DuplicateOptionPolicy duplicateOptions,
        PercentMode percentMode,
        String optionNameFormat,
        String fieldRefPattern,
        String yesChoice,
        String noChoice,
        CeeScore defaultScore,
        BatchConfig batch
) {

    public static final String QUESTION_PLACEHOLDER = "{question}";
    public static final String INDEX_PLACEHOLDER = "{index}";

    public static final String DEFAULT_NAME = "default-rules";
    public static final String DEFAULT_OPTION_NAME_FORMAT = QUESTION_PLACEHOLDER + "_" + INDEX_PLACEHOLDER;
    public static final String DEFAULT_FIELD_REF_PATTERN = "[A-Za-z_][A-Za-z0-9._-]*";

    public RulesConfig {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(duplicateOptions, "duplicateOptions");
        Objects.requireNonNull(percentMode, "percentMode");
        Objects.requireNonNull(optionNameFormat, "optionNameFormat");
        Objects.requireNonNull(fieldRefPattern, "fieldRefPattern");
        Objects.requireNonNull(yesChoice, "yesChoice");
        Objects.requireNonNull(noChoice, "noChoice");
        Objects.requireNonNull(defaultScore, "defaultScore");
        Objects.requireNonNull(batch, "batch");
    }

    /**
     * Settings used when no configuration file is given.
     */
    public static RulesConfig defaults() {
        return new RulesConfig(
                DEFAULT_NAME,
                DuplicateOptionPolicy.REJECT,
                PercentMode.WHOLE,
                DEFAULT_OPTION_NAME_FORMAT,
                DEFAULT_FIELD_REF_PATTERN,
                "yes",
                "no",
                CeeScore.GRAY,
                BatchConfig.defaults()
        );
    }

    public RulesConfig withDuplicateOptions(DuplicateOptionPolicy policy) {
        return new RulesConfig(name, policy, percentMode, optionNameFormat, fieldRefPattern,
                yesChoice, noChoice, defaultScore, batch);
    }

    public RulesConfig withPercentMode(PercentMode mode) {
        return new RulesConfig(name, duplicateOptions, mode, optionNameFormat, fieldRefPattern,
                yesChoice, noChoice, defaultScore, batch);
    }

    /**
     * Batch compilation settings.
     *
     * @param parallelism Number of worker threads
     */
    public record BatchConfig(int parallelism) {

        public BatchConfig {
            if (parallelism < 1) {
                throw new IllegalArgumentException("parallelism must be at least 1: " + parallelism);
            }
        }

        public static BatchConfig defaults() {
            return new BatchConfig(Math.max(1, Runtime.getRuntime().availableProcessors()));
        }
    }
}
