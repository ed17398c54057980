package org.luxbulb.webinfo.enricher.domain;

import org.luxbulb.webinfo.models.ResultCodes;

/**
 * Signals that an origin cannot be enriched because its URL or host name is not valid.
 */
public class InvalidOriginException extends Exception {
    private final int _code;

    public InvalidOriginException(int code, String message) {
        super(message);
        _code = code;
    }

    public InvalidOriginException(int code, String message, Throwable cause) {
        super(message, cause);
        _code = code;
    }

    /**
     * The result code describing the failure, either {@link ResultCodes#INVALID_URL}
     * or {@link ResultCodes#INVALID_HOSTNAME}.
     */
    public int getCode() {
        return _code;
    }
}
