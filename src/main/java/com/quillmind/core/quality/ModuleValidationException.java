package com.quillmind.core.quality;

/**
 * Thrown when a module's output cannot be scored against its standard.
 */
public class ModuleValidationException extends RuntimeException {

    public ModuleValidationException(String message) {
        super(message);
    }
}
