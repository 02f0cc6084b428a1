package com.crosswatch.application.error;

import java.util.List;

/** Invalid or incomplete configuration. Fatal at startup. */
public class ConfigurationException extends RuntimeException {

    private final List<String> errors;

    public ConfigurationException(String message) {
        this(message, List.of(message));
    }

    public ConfigurationException(String message, List<String> errors) {
        super(message);
        this.errors = List.copyOf(errors);
    }

    public List<String> errors() {
        return errors;
    }
}
