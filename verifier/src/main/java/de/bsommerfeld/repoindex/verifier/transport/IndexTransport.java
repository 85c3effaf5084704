package de.bsommerfeld.repoindex.verifier.transport;

import java.io.IOException;
import java.net.URI;

/**
 * Fetches index archives.
 */
public interface IndexTransport {

    /**
     * Downloads {@code uri}, sending {@code etag} as {@code If-None-Match}
     * when it is not {@code null}.
     *
     * @throws IOException on network errors and non-success status codes
     */
    TransportResponse get(URI uri, String etag) throws IOException;
}
