package org.luxbulb.webinfo.models;

/**
 * Status codes of the {@link org.luxbulb.webinfo.models.results.Result} records.
 */
public final class ResultCodes {
    private ResultCodes() {
    }

    /**
     * The operation was successful.
     */
    public static final int OK = 0;

    /**
     * The input row could not be read as an origin record.
     */
    public static final int INVALID_INPUT = 5;

    /**
     * A generic error caused inside the enricher (e.g. invalid state).
     */
    public static final int INTERNAL_ERROR = 20;

    /**
     * The origin is not a well-formed URL or has no host component.
     */
    public static final int INVALID_URL = 60;

    /**
     * The origin's host has no recognised public suffix.
     */
    public static final int INVALID_HOSTNAME = 61;

    /**
     * Enriching the record took longer than the configured limit.
     */
    public static final int TIMEOUT = 90;
}
