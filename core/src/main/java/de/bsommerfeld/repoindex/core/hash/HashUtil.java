package de.bsommerfeld.repoindex.core.hash;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * SHA-256 hashing utility.
 */
public final class HashUtil {

    private static final String ALGORITHM = "SHA-256";

    private HashUtil() {
    }

    /**
     * Computes the raw SHA-256 digest of a byte array.
     */
    public static byte[] sha256Raw(byte[] data) {
        try {
            return MessageDigest.getInstance(ALGORITHM).digest(data);
        } catch (NoSuchAlgorithmException e) {
            // every JVM ships SHA-256
            throw new AssertionError(ALGORITHM + " not available", e);
        }
    }
}
