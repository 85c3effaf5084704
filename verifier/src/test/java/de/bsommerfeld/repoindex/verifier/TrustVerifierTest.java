package de.bsommerfeld.repoindex.verifier;

import de.bsommerfeld.repoindex.core.hash.Fingerprints;
import de.bsommerfeld.repoindex.verifier.VerificationException.Reason;
import de.bsommerfeld.repoindex.verifier.transport.IndexTransport;
import de.bsommerfeld.repoindex.verifier.transport.TransportResponse;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.KeyStore;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TrustVerifierTest {

    private static final String REPO_URL = "https://example.org/fdroid/repo";
    private static final URI ARCHIVE_URI = URI.create(REPO_URL + "/index-v1.jar");
    private static final String JSON = """
            {"repo": {"timestamp": 1700000000000, "version": 19, "name": "Example",
                      "address": "https://example.org/fdroid/repo"},
             "requests": {"install": [], "uninstall": []},
             "apps": [{"packageName": "org.example.a", "name": "A"}],
             "packages": {"org.example.a": [{"apkName": "a_1.apk", "versionCode": 1, "hash": "ab"}]}}
            """;

    private static KeyStore.PrivateKeyEntry key;
    private static KeyStore.PrivateKeyEntry otherKey;
    private static String fingerprint;

    @TempDir
    Path dir;

    @Mock
    IndexTransport transport;

    private TrustVerifier verifier;

    @BeforeAll
    static void generateKeys() throws Exception {
        key = TestArchives.generateKey("repo");
        otherKey = TestArchives.generateKey("other");
        fingerprint = Fingerprints.of(TestArchives.certificateOf(key));
    }

    @BeforeEach
    void setUp() {
        verifier = new TrustVerifier(transport, new SignerInspector(), new IndexLoader());
    }

    // -- accepted --

    @Test
    void fetch_shouldAcceptArchiveSignedByPinnedKey() throws Exception {
        serve(TestArchives.signedIndex(dir, JSON, key), "\"v2\"");

        FetchResult result = verifier.fetch(REPO_URL + "?fingerprint=" + fingerprint, null);

        assertFalse(result.isUnchanged());
        assertEquals("\"v2\"", result.etag());
        assertEquals("Example", result.index().repo().name());
        assertEquals(fingerprint, result.index().repo().fingerprint());
        assertEquals(Fingerprints.pubkeyHex(TestArchives.certificateOf(key)), result.index().repo().pubkey());
        assertEquals(1, result.index().packagesOf("org.example.a").get(0).versionCode());
    }

    @Test
    void fetch_shouldNormalizePin() throws Exception {
        serve(TestArchives.signedIndex(dir, JSON, key), null);
        String pin = fingerprint.toLowerCase().replaceAll("(..)(?!$)", "$1:");

        FetchResult result = verifier.fetch(REPO_URL, pin, null);

        assertNotNull(result.index());
    }

    @Test
    void fetch_shouldAcceptAnySingleSignerWithoutPin() throws Exception {
        serve(TestArchives.signedIndex(dir, JSON, otherKey), null);

        FetchResult result = verifier.fetch(REPO_URL, null, null);

        assertEquals(Fingerprints.of(TestArchives.certificateOf(otherKey)), result.index().repo().fingerprint());
    }

    @Test
    void fetch_shouldReportUnchangedIndex() throws Exception {
        when(transport.get(ARCHIVE_URI, "\"v1\"")).thenReturn(TransportResponse.notModified("\"v1\""));

        FetchResult result = verifier.fetch(REPO_URL, fingerprint, "\"v1\"");

        assertTrue(result.isUnchanged());
        assertNull(result.index());
        assertEquals("\"v1\"", result.etag());
    }

    // -- rejected --

    @Test
    void fetch_shouldRejectDifferentSigner() throws Exception {
        serve(TestArchives.signedIndex(dir, JSON, otherKey), null);

        VerificationException e = assertThrows(VerificationException.class,
                () -> verifier.fetch(REPO_URL, fingerprint, null));

        assertEquals(Reason.FINGERPRINT_MISMATCH, e.getReason());
        assertTrue(e.getMessage().contains(fingerprint));
        assertTrue(e.getMessage().contains(Fingerprints.of(TestArchives.certificateOf(otherKey))));
    }

    @Test
    void fetch_shouldRejectTwoSignersEvenIfOneMatches() throws Exception {
        serve(TestArchives.signedIndex(dir, JSON, key, otherKey), null);

        VerificationException e = assertThrows(VerificationException.class,
                () -> verifier.fetch(REPO_URL, fingerprint, null));

        assertEquals(Reason.AMBIGUOUS_SIGNER, e.getReason());
    }

    @Test
    void fetch_shouldRejectUnreferencedSecondSignatureBlock() throws Exception {
        serve(TestArchives.withForeignSignatureBlock(TestArchives.signedIndex(dir, JSON, key), otherKey), null);

        VerificationException e = assertThrows(VerificationException.class,
                () -> verifier.fetch(REPO_URL, fingerprint, null));

        assertEquals(Reason.AMBIGUOUS_SIGNER, e.getReason());
    }

    @Test
    void fetch_shouldRejectUnsignedArchive() throws Exception {
        serve(TestArchives.unsignedIndex(dir, JSON), null);

        VerificationException e = assertThrows(VerificationException.class,
                () -> verifier.fetch(REPO_URL, fingerprint, null));

        assertEquals(Reason.NO_SIGNER, e.getReason());
    }

    @Test
    void fetch_shouldRejectArchiveWithoutIndex() throws Exception {
        serve(TestArchives.signedArchive(dir, "catalog.json", JSON, key), null);

        VerificationException e = assertThrows(VerificationException.class,
                () -> verifier.fetch(REPO_URL, fingerprint, null));

        assertEquals(Reason.INVALID_ARCHIVE, e.getReason());
    }

    @Test
    void fetch_shouldRequireFingerprintParameter() {
        VerificationException e = assertThrows(VerificationException.class,
                () -> verifier.fetch(REPO_URL, null));

        assertEquals(Reason.MISSING_FINGERPRINT, e.getReason());
        verifyNoInteractions(transport);
    }

    // -- url handling --

    @Test
    void archiveUri_shouldAppendArchiveNameAndDropQuery() {
        assertEquals(ARCHIVE_URI, TrustVerifier.archiveUri(URI.create(REPO_URL + "/?fingerprint=AB#x")));
    }

    @Test
    void fingerprintParameter_shouldFindDecodedValue() {
        assertEquals(Optional.of("AB:CD"),
                TrustVerifier.fingerprintParameter(URI.create(REPO_URL + "?x=1&fingerprint=AB%3ACD")));
        assertTrue(TrustVerifier.fingerprintParameter(URI.create(REPO_URL + "?fingerprint=")).isEmpty());
    }

    private void serve(Path archive, String etag) throws Exception {
        when(transport.get(ARCHIVE_URI, null)).thenReturn(new TransportResponse(Files.readAllBytes(archive), etag));
    }
}
