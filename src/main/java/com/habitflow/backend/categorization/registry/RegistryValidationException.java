package com.habitflow.backend.categorization.registry;

/**
 * Thrown when the category registry cannot be loaded or is inconsistent. Fatal at startup.
 */
public class RegistryValidationException extends IllegalStateException {

    public RegistryValidationException(String message) {
        super(message);
    }

    public RegistryValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
