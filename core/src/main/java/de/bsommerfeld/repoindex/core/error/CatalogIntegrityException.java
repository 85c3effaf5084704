package de.bsommerfeld.repoindex.core.error;

/**
 * Thrown when the catalog itself is inconsistent, e.g. two packages of one
 * app share a version code or a description links to an unknown app.
 */
public class CatalogIntegrityException extends RepoIndexException {

    private final String appId;

    public CatalogIntegrityException(String appId, String message) {
        super(message);
        this.appId = appId;
    }

    /** The app the inconsistency was found in. */
    public String getAppId() {
        return appId;
    }
}
