package de.bsommerfeld.repoindex.verifier;

import com.google.inject.Guice;
import de.bsommerfeld.repoindex.core.error.RepoIndexException;
import de.bsommerfeld.repoindex.core.model.RepositoryIndex;
import de.bsommerfeld.repoindex.verifier.config.VerifierModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Command line entry point: downloads and verifies a repository index.
 *
 * <pre>
 * repo-index-fetch &lt;url?fingerprint=...&gt; [etag]
 * </pre>
 */
public final class IndexFetchMain {

    private static final Logger LOG = LoggerFactory.getLogger(IndexFetchMain.class);

    private IndexFetchMain() {
    }

    public static void main(String[] args) {
        if (args.length < 1 || args.length > 2) {
            LOG.info("Usage: repo-index-fetch <url?fingerprint=...> [etag]");
            System.exit(1);
        }
        TrustVerifier verifier = Guice.createInjector(new VerifierModule()).getInstance(TrustVerifier.class);
        try {
            FetchResult result = verifier.fetch(args[0], args.length > 1 ? args[1] : null);
            if (result.isUnchanged()) {
                LOG.info("Index unchanged (etag {})", result.etag());
                return;
            }
            RepositoryIndex index = result.index();
            LOG.info("{}: {} apps, signed by {}, etag {}", index.repo().name(), index.apps().size(),
                    index.repo().fingerprint(), result.etag());
        } catch (VerificationException e) {
            LOG.error("Verification failed ({}): {}", e.getReason(), e.getMessage());
            System.exit(1);
        } catch (IOException | RepoIndexException | IllegalArgumentException e) {
            LOG.error("{}", e.getMessage(), e);
            System.exit(1);
        }
    }
}
