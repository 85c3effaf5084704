package de.bsommerfeld.repoindex.core.error;

/**
 * Root of all fatal index generation failures. A run that raises one of
 * these leaves no signed index behind.
 */
public class RepoIndexException extends RuntimeException {

    public RepoIndexException(String message) {
        super(message);
    }

    public RepoIndexException(String message, Throwable cause) {
        super(message, cause);
    }
}
