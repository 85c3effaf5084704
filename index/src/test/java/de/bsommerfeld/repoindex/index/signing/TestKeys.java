package de.bsommerfeld.repoindex.index.signing;

import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.cert.jcajce.JcaX509v3CertificateBuilder;
import org.bouncycastle.operator.ContentSigner;
import org.bouncycastle.operator.jcajce.JcaContentSignerBuilder;

import java.io.OutputStream;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.KeyStore;
import java.security.cert.Certificate;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;

/**
 * Self-signed repository keys for tests.
 */
public final class TestKeys {

    public static final String PASSWORD = "secret";

    private TestKeys() {
    }

    public static KeyStore.PrivateKeyEntry generate(String commonName) throws Exception {
        KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
        generator.initialize(2048);
        KeyPair keyPair = generator.generateKeyPair();

        X500Name subject = new X500Name("CN=" + commonName);
        Instant now = Instant.now();
        JcaX509v3CertificateBuilder builder = new JcaX509v3CertificateBuilder(
                subject,
                BigInteger.valueOf(now.toEpochMilli()),
                Date.from(now.minus(Duration.ofDays(1))),
                Date.from(now.plus(Duration.ofDays(3650))),
                subject,
                keyPair.getPublic());
        ContentSigner signer = new JcaContentSignerBuilder("SHA256withRSA").build(keyPair.getPrivate());
        X509Certificate certificate = new JcaX509CertificateConverter().getCertificate(builder.build(signer));

        return new KeyStore.PrivateKeyEntry(keyPair.getPrivate(), new Certificate[]{certificate});
    }

    /** Stores {@code entry} under {@code alias} in a PKCS12 keystore protected by {@link #PASSWORD}. */
    public static Path writeKeystore(Path file, String alias, KeyStore.PrivateKeyEntry entry) throws Exception {
        KeyStore store = KeyStore.getInstance("PKCS12");
        store.load(null, null);
        store.setKeyEntry(alias, entry.getPrivateKey(), PASSWORD.toCharArray(), entry.getCertificateChain());
        try (OutputStream out = Files.newOutputStream(file)) {
            store.store(out, PASSWORD.toCharArray());
        }
        return file;
    }

    /** TOML settings pointing the signing gateway at {@code keystore}. */
    public static String signingConfig(Path keystore, String alias) {
        return "keystore = '" + keystore.toAbsolutePath() + "'\n"
                + "keystorepass = '" + PASSWORD + "'\n"
                + "keypass = '" + PASSWORD + "'\n"
                + "repo-keyalias = '" + alias + "'\n";
    }
}
