package de.bsommerfeld.repoindex.verifier.transport;

import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * {@link IndexTransport} on top of the JDK {@link HttpClient}.
 *
 * <p>
 * Redirects are followed, since mirrors commonly redirect to a CDN. A
 * {@code 304 Not Modified} answer is a regular result, not an error; the
 * caller's entity tag is handed back unchanged.
 */
@Singleton
public class HttpIndexTransport implements IndexTransport {

    private static final Logger LOG = LoggerFactory.getLogger(HttpIndexTransport.class);
    private static final int NOT_MODIFIED = 304;

    private final HttpClient http;

    public HttpIndexTransport() {
        this(HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(Duration.ofSeconds(30))
                .build());
    }

    HttpIndexTransport(HttpClient http) {
        this.http = http;
    }

    @Override
    public TransportResponse get(URI uri, String etag) throws IOException {
        HttpRequest.Builder request = HttpRequest.newBuilder(uri).GET();
        if (etag != null) {
            request.header("If-None-Match", etag);
        }
        try {
            HttpResponse<byte[]> response = http.send(request.build(), HttpResponse.BodyHandlers.ofByteArray());
            if (response.statusCode() == NOT_MODIFIED) {
                LOG.info("{} not modified", uri);
                return TransportResponse.notModified(etag);
            }
            validateStatus(response.statusCode(), uri);
            String newEtag = response.headers().firstValue("ETag").orElse(null);
            LOG.debug("Downloaded {} bytes from {}", response.body().length, uri);
            return new TransportResponse(response.body(), newEtag);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Download interrupted: " + uri, e);
        }
    }

    /** Validates that the HTTP status code is in the 2xx success range. */
    private static void validateStatus(int status, URI uri) throws IOException {
        if (status < 200 || status >= 300) {
            throw new IOException("HTTP " + status + " for " + uri);
        }
    }
}
