package io.isoflow.langchain4j;

import java.time.Duration;
import java.util.Objects;

/// Chat model parameters for step extraction.
///
/// Extraction wants deterministic output, so the default temperature is much lower than a
/// conversational agent would use.
///
/// @param modelName provider model name, e.g. {@code claude-sonnet-4}, not null
/// @param temperature sampling temperature, 0.0 to 2.0
/// @param maxTokens response token limit, positive
/// @param timeout per-call timeout, positive
public record ModelSettings(String modelName, double temperature, int maxTokens, Duration timeout) {

    public static final double DEFAULT_TEMPERATURE = 0.1;
    public static final int DEFAULT_MAX_TOKENS = 4096;
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);

    public ModelSettings {
        Objects.requireNonNull(modelName, "modelName required");
        Objects.requireNonNull(timeout, "timeout required");
        if (modelName.isBlank()) {
            throw new IllegalArgumentException("modelName must not be blank");
        }
        if (temperature < 0.0 || temperature > 2.0) {
            throw new IllegalArgumentException("temperature out of range: " + temperature);
        }
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be positive: " + maxTokens);
        }
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive: " + timeout);
        }
    }

    public static ModelSettings of(String modelName) {
        return new ModelSettings(modelName, DEFAULT_TEMPERATURE, DEFAULT_MAX_TOKENS, DEFAULT_TIMEOUT);
    }
}
