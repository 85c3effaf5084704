package de.bsommerfeld.repoindex.core.error;

/**
 * Thrown when an index document or catalog file does not match the expected
 * structure.
 */
public class IndexFormatException extends RepoIndexException {

    public IndexFormatException(String message) {
        super(message);
    }

    public IndexFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
