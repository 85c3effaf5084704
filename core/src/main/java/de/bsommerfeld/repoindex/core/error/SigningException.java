package de.bsommerfeld.repoindex.core.error;

public class SigningException extends RepoIndexException {

    public SigningException(String message) {
        super(message);
    }

    public SigningException(String message, Throwable cause) {
        super(message, cause);
    }
}
