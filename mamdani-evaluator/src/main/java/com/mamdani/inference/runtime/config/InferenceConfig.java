/*
 * Copyright (c) 2025 Mamdani Inference Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.mamdani.inference.runtime.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * Evaluation settings for {@link com.mamdani.inference.runtime.evaluation.MamdaniEngine}.
 *
 * <p>Defaults reproduce classic Mamdani inference: min implication, max
 * aggregation and a centroid integration step of 0.1.
 *
 * <p><b>Sources</b>, later ones winning:
 * <ol>
 *   <li>built-in defaults</li>
 *   <li>{@code mamdani.properties} (classpath, then file system)</li>
 *   <li>environment variables {@code MAMDANI_<PROPERTY>}</li>
 * </ol>
 *
 * <p>Example {@code mamdani.properties}:
 * <pre>
 * mamdani.integration.step=0.1
 * mamdani.implication=MIN
 * mamdani.aggregation=MAX
 * mamdani.validate.inputs=true
 * mamdani.batch.parallelism=1
 * </pre>
 */
public final class InferenceConfig {

    private static final Logger logger = LoggerFactory.getLogger(InferenceConfig.class);

    public static final String DEFAULT_PROPERTIES = "mamdani.properties";

    public static final double DEFAULT_INTEGRATION_STEP = 0.1;

    private static final String PROP_INTEGRATION_STEP = "mamdani.integration.step";
    private static final String PROP_IMPLICATION = "mamdani.implication";
    private static final String PROP_AGGREGATION = "mamdani.aggregation";
    private static final String PROP_VALIDATE_INPUTS = "mamdani.validate.inputs";
    private static final String PROP_BATCH_PARALLELISM = "mamdani.batch.parallelism";

    static final String ENV_INTEGRATION_STEP = "MAMDANI_INTEGRATION_STEP";
    static final String ENV_IMPLICATION = "MAMDANI_IMPLICATION";
    static final String ENV_AGGREGATION = "MAMDANI_AGGREGATION";
    static final String ENV_VALIDATE_INPUTS = "MAMDANI_VALIDATE_INPUTS";
    static final String ENV_BATCH_PARALLELISM = "MAMDANI_BATCH_PARALLELISM";

    private final double integrationStep;
    private final ImplicationMethod implication;
    private final AggregationMethod aggregation;
    private final boolean validateInputs;
    private final int batchParallelism;

    private InferenceConfig(Builder builder) {
        this.integrationStep = builder.integrationStep;
        this.implication = builder.implication;
        this.aggregation = builder.aggregation;
        this.validateInputs = builder.validateInputs;
        this.batchParallelism = builder.batchParallelism;
        validate();
    }

    // ========================================================================
    // FACTORY METHODS
    // ========================================================================

    /**
     * Built-in defaults, ignoring properties files and the environment.
     */
    public static InferenceConfig defaults() {
        return builder().build();
    }

    /**
     * Defaults overridden by environment variables.
     */
    public static InferenceConfig fromEnvironment() {
        return builder().applyEnvironment(System.getenv()).build();
    }

    /**
     * Loads {@value #DEFAULT_PROPERTIES}, then applies environment overrides.
     */
    public static InferenceConfig loadDefault() {
        return loadFromProperties(DEFAULT_PROPERTIES);
    }

    /**
     * Loads a properties file from the classpath, falling back to the file
     * system, then applies environment overrides. A missing file leaves the
     * defaults in place.
     */
    public static InferenceConfig loadFromProperties(String propertiesPath) {
        Properties props = new Properties();

        try (InputStream is = InferenceConfig.class.getClassLoader().getResourceAsStream(propertiesPath)) {
            if (is != null) {
                props.load(is);
                logger.debug("Loaded {} properties from classpath: {}", props.size(), propertiesPath);
            }
        } catch (IOException e) {
            logger.warn("Could not read classpath resource {}: {}", propertiesPath, e.getMessage());
        }

        if (props.isEmpty()) {
            try (InputStream is = new FileInputStream(propertiesPath)) {
                props.load(is);
                logger.debug("Loaded {} properties from file: {}", props.size(), propertiesPath);
            } catch (IOException e) {
                logger.debug("No inference properties at {}, using defaults", propertiesPath);
            }
        }

        return builder()
                .applyProperties(props)
                .applyEnvironment(System.getenv())
                .build();
    }

    // ========================================================================
    // BUILDER
    // ========================================================================

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .integrationStep(integrationStep)
                .implication(implication)
                .aggregation(aggregation)
                .validateInputs(validateInputs)
                .batchParallelism(batchParallelism);
    }

    public static final class Builder {
        private double integrationStep = DEFAULT_INTEGRATION_STEP;
        private ImplicationMethod implication = ImplicationMethod.MIN;
        private AggregationMethod aggregation = AggregationMethod.MAX;
        private boolean validateInputs = true;
        private int batchParallelism = 1;

        private Builder() {
        }

        public Builder integrationStep(double integrationStep) {
            this.integrationStep = integrationStep;
            return this;
        }

        public Builder implication(ImplicationMethod implication) {
            this.implication = implication;
            return this;
        }

        public Builder aggregation(AggregationMethod aggregation) {
            this.aggregation = aggregation;
            return this;
        }

        public Builder validateInputs(boolean validateInputs) {
            this.validateInputs = validateInputs;
            return this;
        }

        public Builder batchParallelism(int batchParallelism) {
            this.batchParallelism = batchParallelism;
            return this;
        }

        /**
         * Applies the {@code mamdani.*} keys present in {@code props}.
         */
        public Builder applyProperties(Properties props) {
            String step = props.getProperty(PROP_INTEGRATION_STEP);
            if (step != null) {
                integrationStep = parseDouble(PROP_INTEGRATION_STEP, step, integrationStep);
            }
            String impl = props.getProperty(PROP_IMPLICATION);
            if (impl != null) {
                implication = parseEnum(ImplicationMethod.class, PROP_IMPLICATION, impl, implication);
            }
            String agg = props.getProperty(PROP_AGGREGATION);
            if (agg != null) {
                aggregation = parseEnum(AggregationMethod.class, PROP_AGGREGATION, agg, aggregation);
            }
            String validate = props.getProperty(PROP_VALIDATE_INPUTS);
            if (validate != null) {
                validateInputs = Boolean.parseBoolean(validate.trim());
            }
            String parallelism = props.getProperty(PROP_BATCH_PARALLELISM);
            if (parallelism != null) {
                batchParallelism = parseInt(PROP_BATCH_PARALLELISM, parallelism, batchParallelism);
            }
            return this;
        }

        /**
         * Applies the {@code MAMDANI_*} entries present in {@code env}.
         */
        public Builder applyEnvironment(Map<String, String> env) {
            String step = env.get(ENV_INTEGRATION_STEP);
            if (step != null) {
                integrationStep = parseDouble(ENV_INTEGRATION_STEP, step, integrationStep);
            }
            String impl = env.get(ENV_IMPLICATION);
            if (impl != null) {
                implication = parseEnum(ImplicationMethod.class, ENV_IMPLICATION, impl, implication);
            }
            String agg = env.get(ENV_AGGREGATION);
            if (agg != null) {
                aggregation = parseEnum(AggregationMethod.class, ENV_AGGREGATION, agg, aggregation);
            }
            String validate = env.get(ENV_VALIDATE_INPUTS);
            if (validate != null) {
                validateInputs = Boolean.parseBoolean(validate.trim());
            }
            String parallelism = env.get(ENV_BATCH_PARALLELISM);
            if (parallelism != null) {
                batchParallelism = parseInt(ENV_BATCH_PARALLELISM, parallelism, batchParallelism);
            }
            return this;
        }

        public InferenceConfig build() {
            return new InferenceConfig(this);
        }
    }

    // ========================================================================
    // VALIDATION
    // ========================================================================

    private void validate() {
        if (!Double.isFinite(integrationStep) || integrationStep <= 0.0) {
            throw new IllegalArgumentException("integrationStep must be a positive finite number: " + integrationStep);
        }
        if (implication == null) {
            throw new IllegalArgumentException("implication must not be null");
        }
        if (aggregation == null) {
            throw new IllegalArgumentException("aggregation must not be null");
        }
        if (batchParallelism < 1) {
            throw new IllegalArgumentException("batchParallelism must be >= 1: " + batchParallelism);
        }
    }

    private static double parseDouble(String key, String raw, double fallback) {
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid {}: '{}', keeping {}", key, raw, fallback);
            return fallback;
        }
    }

    private static int parseInt(String key, String raw, int fallback) {
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid {}: '{}', keeping {}", key, raw, fallback);
            return fallback;
        }
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String key, String raw, E fallback) {
        try {
            return Enum.valueOf(type, raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            logger.warn("Invalid {}: '{}', keeping {}", key, raw, fallback);
            return fallback;
        }
    }

    // ========================================================================
    // GETTERS
    // ========================================================================

    public double getIntegrationStep() {
        return integrationStep;
    }

    public ImplicationMethod getImplication() {
        return implication;
    }

    public AggregationMethod getAggregation() {
        return aggregation;
    }

    public boolean isValidateInputs() {
        return validateInputs;
    }

    public int getBatchParallelism() {
        return batchParallelism;
    }

    @Override
    public String toString() {
        return "InferenceConfig{" +
                "integrationStep=" + integrationStep +
                ", implication=" + implication +
                ", aggregation=" + aggregation +
                ", validateInputs=" + validateInputs +
                ", batchParallelism=" + batchParallelism +
                '}';
    }
}
