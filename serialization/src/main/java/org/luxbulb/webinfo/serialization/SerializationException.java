package org.luxbulb.webinfo.serialization;

/**
 * Thrown when an object cannot be converted to or from its serialized form.
 */
public class SerializationException extends RuntimeException {
    public SerializationException(String message) {
        super(message);
    }

    public SerializationException(Throwable cause) {
        super(cause);
    }

    public SerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
