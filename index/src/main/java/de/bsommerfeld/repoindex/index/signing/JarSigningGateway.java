package de.bsommerfeld.repoindex.index.signing;

import de.bsommerfeld.repoindex.core.config.IndexConfig;
import de.bsommerfeld.repoindex.core.error.ConfigurationException;
import de.bsommerfeld.repoindex.core.error.SigningException;
import jdk.security.jarsigner.JarSigner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.zip.ZipFile;

/**
 * Signs index archives with the repository key from a keystore, using the
 * JDK's jar signing API.
 *
 * <p>
 * The unsigned archive is written to a temporary sibling first and only the
 * signed result is moved into place, so a failed signing never leaves an
 * unsigned {@code .jar} under the published name.
 */
public final class JarSigningGateway implements SigningGateway {

    private static final Logger LOG = LoggerFactory.getLogger(JarSigningGateway.class);
    private static final String DIGEST_ALGORITHM = "SHA-256";

    private final KeyStore.PrivateKeyEntry keyEntry;
    private final String signerName;

    JarSigningGateway(KeyStore.PrivateKeyEntry keyEntry, String alias) {
        this.keyEntry = keyEntry;
        this.signerName = signerName(alias);
    }

    /**
     * Loads the repository key named by the keystore settings.
     *
     * @throws ConfigurationException if a setting is missing, the keystore
     *                                does not exist or holds no such key
     */
    public static JarSigningGateway fromConfig(IndexConfig config) {
        List<String> missing = new ArrayList<>();
        if (config.getRepoKeyAlias() == null) missing.add("repo-keyalias");
        if (config.getKeystore() == null) missing.add("keystore");
        if (config.getKeystorePass() == null) missing.add("keystorepass");
        if (config.getKeyPass() == null) missing.add("keypass");
        if (!missing.isEmpty()) {
            missing.forEach(key -> LOG.error("'{}' not found in configuration!", key));
            throw new ConfigurationException("Signing requires " + String.join(", ", missing)
                    + "; create a key or run with --nosign");
        }

        Path keystore = Path.of(config.getKeystore());
        if (!Files.exists(keystore)) {
            LOG.error("'{}' does not exist!", keystore);
            throw new ConfigurationException("Keystore " + keystore + " does not exist");
        }

        try (InputStream in = Files.newInputStream(keystore)) {
            KeyStore store = KeyStore.getInstance(config.getKeystoreType());
            store.load(in, config.getKeystorePass().toCharArray());
            KeyStore.Entry entry = store.getEntry(config.getRepoKeyAlias(),
                    new KeyStore.PasswordProtection(config.getKeyPass().toCharArray()));
            if (!(entry instanceof KeyStore.PrivateKeyEntry keyEntry)) {
                throw new ConfigurationException("No private key '" + config.getRepoKeyAlias() + "' in " + keystore);
            }
            return new JarSigningGateway(keyEntry, config.getRepoKeyAlias());
        } catch (IOException | GeneralSecurityException e) {
            throw new ConfigurationException("Cannot load key '" + config.getRepoKeyAlias()
                    + "' from " + keystore + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Path sign(Path repoDir, String documentName) {
        Path document = repoDir.resolve(documentName);
        Path signed = repoDir.resolve(IndexArchives.archiveNameFor(documentName));
        Path unsigned = repoDir.resolve(signed.getFileName() + ".unsigned");
        Path partial = repoDir.resolve(signed.getFileName() + ".tmp");
        try {
            IndexArchives.writeJar(document, unsigned);
            JarSigner signer = new JarSigner.Builder(keyEntry)
                    .digestAlgorithm(DIGEST_ALGORITHM)
                    .signerName(signerName)
                    .build();
            try (ZipFile in = new ZipFile(unsigned.toFile());
                    OutputStream out = Files.newOutputStream(partial)) {
                signer.sign(in, out);
            }
            Files.move(partial, signed, StandardCopyOption.REPLACE_EXISTING);
            LOG.info("Signed {}", signed);
            return signed;
        } catch (IOException | GeneralSecurityException | RuntimeException e) {
            throw new SigningException("Failed to sign " + document + ": " + e.getMessage(), e);
        } finally {
            deleteQuietly(unsigned);
            deleteQuietly(partial);
        }
    }

    @Override
    public X509Certificate certificate() {
        return (X509Certificate) keyEntry.getCertificate();
    }

    /**
     * Jar signer names are limited to eight characters out of
     * {@code A-Z 0-9 _ -}.
     */
    static String signerName(String alias) {
        String name = alias.toUpperCase(Locale.ROOT).replaceAll("[^A-Z0-9_-]", "");
        if (name.isEmpty()) {
            return "SIGNER";
        }
        return name.length() > 8 ? name.substring(0, 8) : name;
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            LOG.warn("Could not remove temporary file {}", path, e);
        }
    }
}
