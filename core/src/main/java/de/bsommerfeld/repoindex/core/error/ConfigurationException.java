package de.bsommerfeld.repoindex.core.error;

/**
 * Thrown when the repository configuration is incomplete or malformed:
 * missing keystore settings, request lists of the wrong shape, mirrors
 * outside the expected web root.
 */
public class ConfigurationException extends RepoIndexException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
