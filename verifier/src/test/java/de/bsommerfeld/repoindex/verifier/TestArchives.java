package de.bsommerfeld.repoindex.verifier;

import de.bsommerfeld.repoindex.index.signing.IndexArchives;
import jdk.security.jarsigner.JarSigner;
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.cert.jcajce.JcaX509v3CertificateBuilder;
import org.bouncycastle.operator.jcajce.JcaContentSignerBuilder;

import java.io.InputStream;
import java.io.OutputStream;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.KeyStore;
import java.security.cert.Certificate;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Enumeration;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;
import java.util.zip.ZipOutputStream;

/**
 * Builds signed, unsigned and damaged index archives for tests.
 */
final class TestArchives {

    private TestArchives() {
    }

    static KeyStore.PrivateKeyEntry generateKey(String commonName) throws Exception {
        KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
        generator.initialize(2048);
        KeyPair keyPair = generator.generateKeyPair();

        X500Name subject = new X500Name("CN=" + commonName);
        Instant now = Instant.now();
        X509Certificate certificate = new JcaX509CertificateConverter().getCertificate(
                new JcaX509v3CertificateBuilder(subject, BigInteger.valueOf(now.toEpochMilli()),
                        Date.from(now.minus(Duration.ofDays(1))), Date.from(now.plus(Duration.ofDays(3650))),
                        subject, keyPair.getPublic())
                        .build(new JcaContentSignerBuilder("SHA256withRSA").build(keyPair.getPrivate())));
        return new KeyStore.PrivateKeyEntry(keyPair.getPrivate(), new Certificate[]{certificate});
    }

    static X509Certificate certificateOf(KeyStore.PrivateKeyEntry key) {
        return (X509Certificate) key.getCertificate();
    }

    /** An {@code index-v1.jar} holding {@code json}, signed by each key in turn. */
    static Path signedIndex(Path dir, String json, KeyStore.PrivateKeyEntry... keys) throws Exception {
        return signedArchive(dir, "index-v1.json", json, keys);
    }

    static Path signedArchive(Path dir, String entryName, String content, KeyStore.PrivateKeyEntry... keys)
            throws Exception {
        Path archive = unsignedArchive(dir, entryName, content);
        for (int i = 0; i < keys.length; i++) {
            Path signed = dir.resolve("signed-" + i + ".jar");
            JarSigner signer = new JarSigner.Builder(keys[i])
                    .digestAlgorithm("SHA-256")
                    .signerName("SIGNER" + i)
                    .build();
            try (ZipFile in = new ZipFile(archive.toFile());
                    OutputStream out = Files.newOutputStream(signed)) {
                signer.sign(in, out);
            }
            Files.move(signed, archive, StandardCopyOption.REPLACE_EXISTING);
        }
        return archive;
    }

    static Path unsignedIndex(Path dir, String json) throws Exception {
        return unsignedArchive(dir, "index-v1.json", json);
    }

    private static Path unsignedArchive(Path dir, String entryName, String content) throws Exception {
        Path document = dir.resolve(entryName);
        Files.writeString(document, content);
        Path archive = dir.resolve("index-v1.jar");
        IndexArchives.writeJar(document, archive);
        Files.delete(document);
        return archive;
    }

    /**
     * Copies {@code archive}, replacing the content of {@code entryName}, or
     * adding it when the archive has no such entry.
     */
    static Path withEntry(Path archive, String entryName, String content) throws Exception {
        return withEntry(archive, entryName, content.getBytes(StandardCharsets.UTF_8));
    }

    static Path withEntry(Path archive, String entryName, byte[] content) throws Exception {
        Path copy = archive.resolveSibling("modified-" + archive.getFileName());
        boolean replaced = false;
        try (ZipFile in = new ZipFile(archive.toFile());
                ZipOutputStream out = new ZipOutputStream(Files.newOutputStream(copy))) {
            Enumeration<? extends ZipEntry> entries = in.entries();
            while (entries.hasMoreElements()) {
                ZipEntry entry = entries.nextElement();
                out.putNextEntry(new ZipEntry(entry.getName()));
                if (entry.getName().equals(entryName)) {
                    out.write(content);
                    replaced = true;
                } else {
                    try (InputStream data = in.getInputStream(entry)) {
                        data.transferTo(out);
                    }
                }
                out.closeEntry();
            }
            if (!replaced) {
                out.putNextEntry(new ZipEntry(entryName));
                out.write(content);
                out.closeEntry();
            }
        }
        return copy;
    }

    /**
     * Copies {@code archive} with {@code key}'s signature block added as
     * {@code META-INF/OTHER.RSA}. No signature file refers to the block.
     */
    static Path withForeignSignatureBlock(Path archive, KeyStore.PrivateKeyEntry key) throws Exception {
        Path otherDir = Files.createDirectories(archive.resolveSibling("foreign"));
        Path other = signedIndex(otherDir, "{}", key);
        byte[] block;
        try (ZipFile zip = new ZipFile(other.toFile());
                InputStream in = zip.getInputStream(zip.getEntry("META-INF/SIGNER0.RSA"))) {
            block = in.readAllBytes();
        }
        return withEntry(archive, "META-INF/OTHER.RSA", block);
    }
}
