package de.bsommerfeld.repoindex.verifier;

import com.google.inject.Singleton;
import de.bsommerfeld.repoindex.core.hash.Fingerprints;
import de.bsommerfeld.repoindex.core.model.IndexConstants;
import de.bsommerfeld.repoindex.core.model.RepositoryIndex;
import de.bsommerfeld.repoindex.verifier.VerificationException.Reason;
import de.bsommerfeld.repoindex.verifier.transport.IndexTransport;
import de.bsommerfeld.repoindex.verifier.transport.TransportResponse;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.cert.X509Certificate;
import java.util.List;
import java.util.Optional;
import java.util.jar.JarEntry;
import java.util.jar.JarFile;

/**
 * Downloads a repository's signed flat index and accepts it only when it is
 * signed by exactly one certificate whose fingerprint matches the pin.
 *
 * <h3>Checks</h3>
 * <ol>
 * <li>Every entry's signature is valid ({@link SignerInspector}).</li>
 * <li>There is exactly one signer. An archive signed by two keys is
 * rejected even if one of them matches the pin.</li>
 * <li>The signer's fingerprint equals the pin.</li>
 * </ol>
 * Nothing from the archive is parsed before all checks pass. The downloaded
 * archive lives in a temporary file that is removed on every path.
 */
@Singleton
public class TrustVerifier {

    private static final Logger LOG = LoggerFactory.getLogger(TrustVerifier.class);
    private static final String FINGERPRINT_PARAMETER = "fingerprint";

    private final IndexTransport transport;
    private final SignerInspector inspector;
    private final IndexLoader loader;

    @Inject
    public TrustVerifier(IndexTransport transport, SignerInspector inspector, IndexLoader loader) {
        this.transport = transport;
        this.inspector = inspector;
        this.loader = loader;
    }

    /**
     * Fetches the index, pinning the fingerprint given in the URL's
     * {@code fingerprint} query parameter.
     *
     * @throws VerificationException {@link Reason#MISSING_FINGERPRINT} when the
     *                               URL has no such parameter, or any
     *                               verification failure
     */
    public FetchResult fetch(String url, String etag) throws IOException, VerificationException {
        String pin = fingerprintParameter(URI.create(url))
                .orElseThrow(() -> new VerificationException(Reason.MISSING_FINGERPRINT,
                        "No fingerprint in repository URL " + url));
        return fetch(url, pin, etag);
    }

    /**
     * Fetches the index with an explicit pin. A {@code null} pin accepts any
     * single signer.
     */
    public FetchResult fetch(String url, String pinnedFingerprint, String etag)
            throws IOException, VerificationException {
        URI archiveUri = archiveUri(URI.create(url));
        TransportResponse response = transport.get(archiveUri, etag);
        if (response.isNotModified()) {
            return FetchResult.unchanged(response.etag());
        }

        Path archive = Files.createTempFile("index-v1-", ".jar");
        try {
            Files.write(archive, response.body());
            X509Certificate signer = singleSigner(archive, archiveUri);
            String fingerprint = Fingerprints.of(signer);
            if (pinnedFingerprint != null && !Fingerprints.matches(pinnedFingerprint, fingerprint)) {
                throw new VerificationException(Reason.FINGERPRINT_MISMATCH,
                        "Signing key of " + archiveUri + " does not match: expected "
                                + Fingerprints.normalize(pinnedFingerprint) + " but found " + fingerprint);
            }
            RepositoryIndex index = readIndex(archive, signer);
            LOG.info("Verified {} signed by {}", archiveUri, fingerprint);
            return new FetchResult(index, response.etag());
        } finally {
            Files.deleteIfExists(archive);
        }
    }

    private X509Certificate singleSigner(Path archive, URI source) throws IOException, VerificationException {
        List<X509Certificate> signers = inspector.listEmbeddedSigners(archive);
        if (signers.isEmpty()) {
            throw new VerificationException(Reason.NO_SIGNER, source + " is not signed");
        }
        if (signers.size() > 1) {
            throw new VerificationException(Reason.AMBIGUOUS_SIGNER,
                    source + " is signed by " + signers.size() + " certificates, expected exactly one");
        }
        return signers.get(0);
    }

    private RepositoryIndex readIndex(Path archive, X509Certificate signer) throws IOException, VerificationException {
        try (JarFile jar = new JarFile(archive.toFile(), true)) {
            JarEntry entry = jar.getJarEntry(IndexConstants.FLAT_INDEX);
            if (entry == null) {
                throw new VerificationException(Reason.INVALID_ARCHIVE,
                        "Archive holds no " + IndexConstants.FLAT_INDEX);
            }
            try (InputStream in = jar.getInputStream(entry)) {
                return loader.load(in, signer);
            }
        }
    }

    /** Appends {@code /index-v1.jar} to the path and drops query and fragment. */
    static URI archiveUri(URI repoUri) {
        String path = repoUri.getPath() == null ? "" : repoUri.getPath();
        if (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        try {
            return new URI(repoUri.getScheme(), repoUri.getAuthority(),
                    path + "/" + IndexConstants.FLAT_ARCHIVE, null, null);
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid repository URL " + repoUri, e);
        }
    }

    static Optional<String> fingerprintParameter(URI uri) {
        String query = uri.getRawQuery();
        if (query == null) {
            return Optional.empty();
        }
        for (String pair : query.split("&")) {
            int eq = pair.indexOf('=');
            String key = eq < 0 ? pair : pair.substring(0, eq);
            if (FINGERPRINT_PARAMETER.equals(URLDecoder.decode(key, StandardCharsets.UTF_8)) && eq >= 0) {
                String value = URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8);
                if (!value.isBlank()) {
                    return Optional.of(value);
                }
            }
        }
        return Optional.empty();
    }
}
