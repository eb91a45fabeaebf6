package com.sdkforge.core.generator;

import com.sdkforge.core.emitter.EmitterOptions;
import java.util.Map;

/**
 * Configuration for SDK source generation.
 *
 * @param emitterOptions formatting options handed to the emitter
 * @param generateExamples whether to generate {@code examples/basic.ts}
 * @param customSettings generator-specific settings (e.g. "package.scope", "package.license")
 */
public record GeneratorConfig(
    EmitterOptions emitterOptions,
    boolean generateExamples,
    Map<String, Object> customSettings
) {
    /**
     * Compact constructor with defaults.
     */
    public GeneratorConfig {
        if (emitterOptions == null) {
            emitterOptions = EmitterOptions.defaults();
        }
        customSettings = customSettings != null ? Map.copyOf(customSettings) : Map.of();
    }

    /**
     * Creates a default configuration: default emitter options, examples on.
     *
     * @return default generator config
     */
    public static GeneratorConfig defaults() {
        return new GeneratorConfig(EmitterOptions.defaults(), true, Map.of());
    }

    /**
     * Gets a custom setting with a default.
     *
     * @param key setting key
     * @param defaultValue default value
     * @param <T> expected type
     * @return setting value or default
     */
    @SuppressWarnings("unchecked")
    public <T> T getSettingOrDefault(String key, T defaultValue) {
        T value = (T) customSettings.get(key);
        return value != null ? value : defaultValue;
    }
}
