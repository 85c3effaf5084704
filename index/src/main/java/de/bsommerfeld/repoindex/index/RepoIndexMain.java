package de.bsommerfeld.repoindex.index;

import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.ProvisionException;
import de.bsommerfeld.repoindex.core.config.IndexOptions;
import de.bsommerfeld.repoindex.core.config.RepoProfile;
import de.bsommerfeld.repoindex.core.error.RepoIndexException;
import de.bsommerfeld.repoindex.core.model.Catalog;
import de.bsommerfeld.repoindex.index.catalog.CatalogReader;
import de.bsommerfeld.repoindex.index.config.IndexModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Command line entry point.
 *
 * <pre>
 * repo-index update [--pretty] [--nosign] [--archive]
 *                   [--config config.toml] [--catalog catalog.json] [--repo dir]
 * </pre>
 *
 * Exits with status 1 when the index could not be generated.
 */
public final class RepoIndexMain {

    private static final Logger LOG = LoggerFactory.getLogger(RepoIndexMain.class);

    private RepoIndexMain() {
    }

    public static void main(String[] args) {
        int status;
        try {
            status = run(args);
        } catch (RepoIndexException | IllegalArgumentException | IOException e) {
            LOG.error("{}", e.getMessage(), e);
            status = 1;
        }
        System.exit(status);
    }

    static int run(String[] args) throws IOException {
        if (args.length == 0 || !"update".equals(args[0])) {
            usage();
            return 1;
        }

        boolean pretty = false;
        boolean nosign = false;
        RepoProfile profile = RepoProfile.PRIMARY;
        Path configPath = Path.of("config.toml");
        Path catalogPath = Path.of("catalog.json");
        Path repoDir = null;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--pretty" -> pretty = true;
                case "--nosign" -> nosign = true;
                case "--archive" -> profile = RepoProfile.ARCHIVE;
                case "--config" -> configPath = Path.of(value(args, ++i, "--config"));
                case "--catalog" -> catalogPath = Path.of(value(args, ++i, "--catalog"));
                case "--repo" -> repoDir = Path.of(value(args, ++i, "--repo"));
                default -> {
                    LOG.error("Unknown option: {}", args[i]);
                    usage();
                    return 1;
                }
            }
        }
        if (repoDir == null) {
            repoDir = Path.of(profile.directoryName());
        }

        Injector injector = Guice.createInjector(
                IndexModule.fromFile(configPath, new IndexOptions(pretty, nosign)));
        Catalog catalog = new CatalogReader().read(catalogPath);
        try {
            IndexResult result = injector.getInstance(IndexAssembler.class).make(catalog, repoDir, profile);
            LOG.info("Wrote {} and {}", result.legacyIndex(), result.flatIndex());
        } catch (ProvisionException e) {
            // signing gateway creation failures arrive wrapped by Guice
            if (e.getCause() instanceof RepoIndexException cause) {
                throw cause;
            }
            throw e;
        }
        return 0;
    }

    private static String value(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new IllegalArgumentException(option + " requires a value");
        }
        return args[index];
    }

    private static void usage() {
        LOG.info("Usage: repo-index update [--pretty] [--nosign] [--archive] "
                + "[--config FILE] [--catalog FILE] [--repo DIR]");
    }
}
