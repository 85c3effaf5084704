package de.bsommerfeld.repoindex.core.hash;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.HexFormat;

import static org.junit.jupiter.api.Assertions.*;

class FingerprintsTest {

    private static final String ABC_SHA256 = "ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad";

    @Test
    void sha256Raw_shouldProduceThirtyTwoByteDigest() {
        byte[] digest = HashUtil.sha256Raw("abc".getBytes(StandardCharsets.UTF_8));

        assertEquals(32, digest.length);
        assertEquals(ABC_SHA256, HexFormat.of().formatHex(digest));
    }

    @Test
    void of_shouldProduceUpperCaseHexWithoutSeparators() {
        String fingerprint = Fingerprints.of("abc".getBytes(StandardCharsets.UTF_8));

        assertEquals(ABC_SHA256.toUpperCase(), fingerprint);
        assertEquals(64, fingerprint.length());
    }

    @Test
    void normalize_shouldStripSeparatorsAndWhitespace() {
        assertEquals("ABCDEF01", Fingerprints.normalize(" ab:cd ef:01\n"));
    }

    @Test
    void matches_shouldIgnoreCaseAndSeparators() {
        String fingerprint = Fingerprints.of("abc".getBytes(StandardCharsets.UTF_8));
        String pin = ABC_SHA256.replaceAll("(..)(?!$)", "$1:");

        assertTrue(Fingerprints.matches(pin, fingerprint));
        assertFalse(Fingerprints.matches("00" + ABC_SHA256.substring(2), fingerprint));
    }
}
