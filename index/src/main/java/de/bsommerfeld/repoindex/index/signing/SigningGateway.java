package de.bsommerfeld.repoindex.index.signing;

import java.nio.file.Path;
import java.security.cert.X509Certificate;

/**
 * Wraps a finished index document into a signed archive.
 */
public interface SigningGateway {

    /**
     * Packs {@code documentName} from {@code repoDir} into its archive and
     * signs it.
     *
     * @return path of the signed archive
     * @throws de.bsommerfeld.repoindex.core.error.SigningException on any
     *         failure; the run must not continue
     */
    Path sign(Path repoDir, String documentName);

    /** The certificate archives are signed with. */
    X509Certificate certificate();
}
