package com.acme.pgprecheck.exceptions;

/**
 * A read-only catalog probe could not produce an answer: connection refused, query error,
 * permission denied or timeout.
 *
 * <p>Once a session has started this is a local failure. It is recorded against the
 * scope unit that raised it and reported as "could not verify", never as a pass.
 */
public class ProbeException extends Exception {

    private final String probeId;

    public ProbeException(String message) {
        this(null, message, null);
    }

    public ProbeException(String probeId, String message) {
        this(probeId, message, null);
    }

    public ProbeException(String probeId, String message, Throwable cause) {
        super(message, cause);
        this.probeId = probeId;
    }

    public String getProbeId() {
        return probeId;
    }

    @Override
    public String getMessage() {
        String base = super.getMessage();
        return probeId == null ? base : base + " [probe=" + probeId + "]";
    }
}
