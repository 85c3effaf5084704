package de.bsommerfeld.repoindex.verifier;

import de.bsommerfeld.repoindex.core.hash.Fingerprints;
import de.bsommerfeld.repoindex.verifier.VerificationException.Reason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Path;
import java.security.CodeSigner;
import java.security.cert.Certificate;
import java.security.cert.CertificateException;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.jar.JarEntry;
import java.util.jar.JarFile;
import java.util.zip.ZipException;

/**
 * Verifies the signatures of a jar archive and reports who signed it.
 *
 * <p>
 * Every entry is read in full so the JDK checks its digest against the
 * signed manifest. An archive is only reported as signed when all of its
 * content entries carry a signature; signature metadata under
 * {@code META-INF/} is not content.
 *
 * <p>
 * Certificates found in signature block files ({@code .RSA}, {@code .DSA},
 * {@code .EC}) are reported as well, even when no signature file refers to
 * the block.
 */
public class SignerInspector {

    private static final Logger LOG = LoggerFactory.getLogger(SignerInspector.class);

    /**
     * Lists the distinct certificates that signed {@code archive}, in the order
     * they were first seen. An empty list means the archive is not signed.
     *
     * @throws VerificationException {@link Reason#INVALID_ARCHIVE} when the file
     *                               is not a jar, an entry was modified after
     *                               signing, or signed and unsigned content is
     *                               mixed
     * @throws IOException           when the file cannot be read
     */
    public List<X509Certificate> listEmbeddedSigners(Path archive) throws IOException, VerificationException {
        Map<String, X509Certificate> signers = new LinkedHashMap<>();
        List<String> unsigned = new ArrayList<>();

        try (JarFile jar = new JarFile(archive.toFile(), true)) {
            Enumeration<JarEntry> entries = jar.entries();
            while (entries.hasMoreElements()) {
                JarEntry entry = entries.nextElement();
                if (isSignatureBlock(entry.getName())) {
                    X509Certificate certificate = blockCertificate(jar, entry);
                    signers.putIfAbsent(Fingerprints.of(certificate), certificate);
                    continue;
                }
                if (entry.isDirectory() || isSignatureMetadata(entry.getName())) {
                    continue;
                }
                drain(jar, entry);
                CodeSigner[] codeSigners = entry.getCodeSigners();
                if (codeSigners == null || codeSigners.length == 0) {
                    unsigned.add(entry.getName());
                    continue;
                }
                for (CodeSigner codeSigner : codeSigners) {
                    X509Certificate certificate = leafCertificate(codeSigner);
                    signers.putIfAbsent(Fingerprints.of(certificate), certificate);
                }
            }
        } catch (ZipException e) {
            throw new VerificationException(Reason.INVALID_ARCHIVE,
                    archive.getFileName() + " is not a valid jar archive: " + e.getMessage(), e);
        } catch (SecurityException e) {
            throw new VerificationException(Reason.INVALID_ARCHIVE,
                    "Signature check failed for " + archive.getFileName() + ": " + e.getMessage(), e);
        }

        if (!signers.isEmpty() && !unsigned.isEmpty()) {
            throw new VerificationException(Reason.INVALID_ARCHIVE,
                    archive.getFileName() + " contains unsigned entries: " + unsigned);
        }
        LOG.debug("{} signed by {} certificate(s)", archive.getFileName(), signers.size());
        return List.copyOf(signers.values());
    }

    private static void drain(JarFile jar, JarEntry entry) throws IOException {
        try (InputStream in = jar.getInputStream(entry)) {
            in.transferTo(OutputStream.nullOutputStream());
        }
    }

    /** The first certificate of a PKCS#7 signature block is the signer's. */
    private static X509Certificate blockCertificate(JarFile jar, JarEntry entry)
            throws IOException, VerificationException {
        try (InputStream in = jar.getInputStream(entry)) {
            Collection<? extends Certificate> certificates =
                    CertificateFactory.getInstance("X.509").generateCertificates(in);
            for (Certificate certificate : certificates) {
                if (certificate instanceof X509Certificate x509) {
                    return x509;
                }
            }
        } catch (CertificateException e) {
            throw new VerificationException(Reason.INVALID_ARCHIVE,
                    "Unreadable signature block " + entry.getName() + ": " + e.getMessage(), e);
        }
        throw new VerificationException(Reason.INVALID_ARCHIVE,
                "Signature block " + entry.getName() + " holds no X.509 certificate");
    }

    private static X509Certificate leafCertificate(CodeSigner codeSigner) throws VerificationException {
        List<? extends Certificate> path = codeSigner.getSignerCertPath().getCertificates();
        if (path.isEmpty() || !(path.get(0) instanceof X509Certificate certificate)) {
            throw new VerificationException(Reason.INVALID_ARCHIVE, "Signer without X.509 certificate");
        }
        return certificate;
    }

    static boolean isSignatureBlock(String name) {
        String upper = name.toUpperCase(Locale.ROOT);
        return isSignatureMetadata(name)
                && (upper.endsWith(".RSA") || upper.endsWith(".DSA") || upper.endsWith(".EC"));
    }

    static boolean isSignatureMetadata(String name) {
        String upper = name.toUpperCase(Locale.ROOT);
        if (!upper.startsWith("META-INF/") || upper.indexOf('/', "META-INF/".length()) >= 0) {
            return false;
        }
        return upper.equals("META-INF/MANIFEST.MF")
                || upper.endsWith(".SF")
                || upper.endsWith(".RSA")
                || upper.endsWith(".DSA")
                || upper.endsWith(".EC")
                || upper.startsWith("META-INF/SIG-");
    }
}
