package org.tabbit.compute;

import org.tabbit.model.DrawConfig;

import java.util.List;

/**
 * Thrown before any computation starts when a {@link DrawConfig} is unusable.
 */
public class ConfigurationException extends TabbitException {

    private final List<String> problems;

    public ConfigurationException(List<String> problems) {
        super("Invalid draw configuration: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> problems() {
        return problems;
    }

    /**
     * Throws unless {@code config} is present and valid.
     */
    public static DrawConfig requireValid(DrawConfig config) {
        if (config == null) {
            throw new ConfigurationException(List.of("draw configuration is missing"));
        }
        List<String> problems = config.problems();
        if (!problems.isEmpty()) {
            throw new ConfigurationException(problems);
        }
        return config;
    }
}
