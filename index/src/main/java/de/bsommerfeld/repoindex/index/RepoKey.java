package de.bsommerfeld.repoindex.index;

import de.bsommerfeld.repoindex.core.hash.Fingerprints;

import java.security.cert.X509Certificate;
import java.util.HexFormat;
import java.util.Locale;

/**
 * The repository signing certificate as published in the legacy index.
 *
 * @param pubkey      hex encoded DER certificate
 * @param fingerprint SHA-256 fingerprint of the certificate
 */
public record RepoKey(String pubkey, String fingerprint) {

    public static RepoKey of(X509Certificate certificate) {
        return new RepoKey(Fingerprints.pubkeyHex(certificate), Fingerprints.of(certificate));
    }

    /** Builds the key from a configured hex certificate. */
    public static RepoKey fromHex(String pubkeyHex) {
        byte[] encoded = HexFormat.of().parseHex(pubkeyHex.strip());
        return new RepoKey(pubkeyHex.strip().toLowerCase(Locale.ROOT), Fingerprints.of(encoded));
    }
}
