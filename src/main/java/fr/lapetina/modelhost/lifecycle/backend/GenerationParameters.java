package fr.lapetina.modelhost.lifecycle.backend;

/**
 * Sampling parameters for a serve call.
 *
 * @param maxTokens   upper bound on generated tokens
 * @param temperature creativity, 0.0 - 1.0
 */
public record GenerationParameters(int maxTokens, double temperature) {

    public GenerationParameters {
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be positive: " + maxTokens);
        }
        if (temperature < 0.0 || temperature > 2.0) {
            throw new IllegalArgumentException("temperature out of range: " + temperature);
        }
    }

    public static GenerationParameters defaults() {
        return new GenerationParameters(512, 0.7);
    }
}
