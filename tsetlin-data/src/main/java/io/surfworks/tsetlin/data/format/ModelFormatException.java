package io.surfworks.tsetlin.data.format;

import java.io.IOException;

/**
 * Thrown when a model file is truncated or its contents disagree with each other.
 */
public class ModelFormatException extends IOException {

    public ModelFormatException(String message) {
        super(message);
    }

    public ModelFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
