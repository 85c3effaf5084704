package de.bsommerfeld.repoindex.core.hash;

import com.google.common.base.CharMatcher;

import java.security.cert.CertificateEncodingException;
import java.security.cert.X509Certificate;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Repository signing key fingerprints.
 *
 * <p>
 * A fingerprint is the upper-case hex SHA-256 digest of the DER encoded
 * signing certificate, without separators. It depends on nothing but the
 * certificate bytes, so a pin taken from one index stays valid for every
 * later index signed with the same key.
 */
public final class Fingerprints {

    private static final CharMatcher SEPARATORS = CharMatcher.whitespace().or(CharMatcher.is(':'));

    private Fingerprints() {
    }

    public static String of(byte[] encodedCertificate) {
        return HexFormat.of().withUpperCase().formatHex(HashUtil.sha256Raw(encodedCertificate));
    }

    public static String of(X509Certificate certificate) {
        return of(encoded(certificate));
    }

    /** Hex encoded DER form of the certificate, as published in the {@code pubkey} field. */
    public static String pubkeyHex(X509Certificate certificate) {
        return HexFormat.of().formatHex(encoded(certificate));
    }

    /**
     * Brings a user supplied pin into fingerprint form: separators and
     * whitespace removed, upper case.
     */
    public static String normalize(String pin) {
        return SEPARATORS.removeFrom(pin).toUpperCase(Locale.ROOT);
    }

    /** Case-insensitive comparison of a pin against a computed fingerprint. */
    public static boolean matches(String pin, String fingerprint) {
        return normalize(pin).equals(normalize(fingerprint));
    }

    private static byte[] encoded(X509Certificate certificate) {
        try {
            return certificate.getEncoded();
        } catch (CertificateEncodingException e) {
            throw new IllegalArgumentException("Certificate cannot be encoded: "
                    + certificate.getSubjectX500Principal(), e);
        }
    }
}
