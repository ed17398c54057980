package org.luxbulb.webinfo.enricher.tls;

import org.jetbrains.annotations.NotNull;

/**
 * Signals that the TLS certificate probe could not obtain the issuer of a host's certificate.
 */
public class TlsProbeException extends Exception {

    /**
     * The kind of probe failure.
     */
    public enum ProbeFailure {
        NO_ADDRESS_AVAILABLE,
        CONNECT_FAILURE,
        HANDSHAKE_FAILURE,
        MISSING_PEER_CERTIFICATES,
        MISSING_ISSUER_ORGANIZATION,
        TIMEOUT
    }

    private final ProbeFailure _failure;

    public TlsProbeException(@NotNull ProbeFailure failure, String message) {
        super(message);
        _failure = failure;
    }

    public TlsProbeException(@NotNull ProbeFailure failure, String message, Throwable cause) {
        super(message, cause);
        _failure = failure;
    }

    @NotNull
    public ProbeFailure getFailure() {
        return _failure;
    }
}
