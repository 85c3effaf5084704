package de.bsommerfeld.repoindex.verifier.transport;

/**
 * Outcome of a conditional download.
 *
 * @param body the archive bytes, {@code null} when the server reported the
 *             resource as not modified
 * @param etag the entity tag to send next time, may be {@code null}
 */
public record TransportResponse(byte[] body, String etag) {

    public static TransportResponse notModified(String etag) {
        return new TransportResponse(null, etag);
    }

    public boolean isNotModified() {
        return body == null;
    }
}
