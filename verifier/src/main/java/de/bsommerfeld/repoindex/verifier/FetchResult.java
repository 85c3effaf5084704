package de.bsommerfeld.repoindex.verifier;

import de.bsommerfeld.repoindex.core.model.RepositoryIndex;

/**
 * Result of {@link TrustVerifier#fetch}.
 *
 * @param index the verified index, {@code null} when the server reported no
 *              change since {@code etag}
 * @param etag  entity tag to pass to the next fetch
 */
public record FetchResult(RepositoryIndex index, String etag) {

    public static FetchResult unchanged(String etag) {
        return new FetchResult(null, etag);
    }

    public boolean isUnchanged() {
        return index == null;
    }
}
