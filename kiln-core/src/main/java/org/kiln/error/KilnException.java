package org.kiln.error;

/**
 * Base type of every error Kiln raises.
 */
public class KilnException extends RuntimeException {

    public KilnException(String message) {
        super(message);
    }

    public KilnException(String message, Throwable cause) {
        super(message, cause);
    }
}
