package de.bsommerfeld.repoindex.verifier;

/**
 * Thrown when a downloaded index cannot be trusted. Transport failures are
 * reported as {@link java.io.IOException} instead.
 */
public class VerificationException extends Exception {

    public enum Reason {
        /** The repository URL carries no {@code fingerprint} parameter. */
        MISSING_FINGERPRINT,
        /** The archive is not signed. */
        NO_SIGNER,
        /** The archive is signed by more than one certificate. */
        AMBIGUOUS_SIGNER,
        /** The signing certificate does not match the pinned fingerprint. */
        FINGERPRINT_MISMATCH,
        /** The archive is corrupt, tampered with, or partially unsigned. */
        INVALID_ARCHIVE
    }

    private final Reason reason;

    public VerificationException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public VerificationException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
