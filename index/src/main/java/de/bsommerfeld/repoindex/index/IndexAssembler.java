package de.bsommerfeld.repoindex.index;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.inject.Singleton;
import de.bsommerfeld.repoindex.core.config.IndexConfig;
import de.bsommerfeld.repoindex.core.config.IndexOptions;
import de.bsommerfeld.repoindex.core.config.RepoIdentity;
import de.bsommerfeld.repoindex.core.config.RepoProfile;
import de.bsommerfeld.repoindex.core.error.CatalogIntegrityException;
import de.bsommerfeld.repoindex.core.model.App;
import de.bsommerfeld.repoindex.core.model.Catalog;
import de.bsommerfeld.repoindex.core.model.IndexConstants;
import de.bsommerfeld.repoindex.core.model.PackageBuild;
import de.bsommerfeld.repoindex.core.model.RepoDescriptor;
import de.bsommerfeld.repoindex.core.model.Requests;
import de.bsommerfeld.repoindex.core.text.DescriptionFormatter;
import de.bsommerfeld.repoindex.core.text.LinkResolver;
import de.bsommerfeld.repoindex.index.alias.CurrentVersionLinker;
import de.bsommerfeld.repoindex.index.flat.FlatIndexBuilder;
import de.bsommerfeld.repoindex.index.flat.FlatIndexWriter;
import de.bsommerfeld.repoindex.index.legacy.LegacyIndex;
import de.bsommerfeld.repoindex.index.legacy.LegacyIndexBuilder;
import de.bsommerfeld.repoindex.index.legacy.LegacyIndexWriter;
import de.bsommerfeld.repoindex.index.mirror.MirrorResolver;
import de.bsommerfeld.repoindex.index.signing.IndexArchives;
import de.bsommerfeld.repoindex.index.signing.SigningGateway;
import jakarta.inject.Inject;
import jakarta.inject.Provider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Generates the index files of one repository.
 *
 * <h3>Phases</h3>
 * <ol>
 * <li>Configuration: request lists, signing key, mirrors and the alias
 * setting are resolved first. Any problem aborts the run before a single
 * file is touched.</li>
 * <li>Catalog: disabled apps and apps without packages are dropped,
 * descriptions are rendered to HTML.</li>
 * <li>Build: both documents are assembled in memory. Catalog integrity
 * errors surface here, still before any write.</li>
 * <li>Write, alias, sign, copy the repository icon.</li>
 * </ol>
 *
 * <p>
 * An assembler holds no state between runs. The primary repository and the
 * archive are two separate {@link #make} calls.
 */
@Singleton
public class IndexAssembler {

    private static final Logger LOG = LoggerFactory.getLogger(IndexAssembler.class);

    private final IndexConfig config;
    private final IndexOptions options;
    private final Provider<SigningGateway> signingGateway;
    private final Clock clock;
    private final LegacyIndexBuilder legacyBuilder = new LegacyIndexBuilder();
    private final FlatIndexBuilder flatBuilder = new FlatIndexBuilder();

    @Inject
    public IndexAssembler(IndexConfig config, IndexOptions options,
            Provider<SigningGateway> signingGateway, Clock clock) {
        this.config = config;
        this.options = options;
        this.signingGateway = signingGateway;
        this.clock = clock;
    }

    public IndexResult make(Catalog catalog, Path repoDir, RepoProfile profile) throws IOException {
        // -- configuration --
        Requests requests = config.requests();
        SigningGateway gateway = options.nosign() ? null : signingGateway.get();
        RepoKey key = resolveKey(gateway);
        CurrentVersionLinker linker = config.isMakeCurrentVersionLink() && profile == RepoProfile.PRIMARY
                ? new CurrentVersionLinker(config.getCurrentVersionNameSource())
                : null;
        RepoIdentity identity = config.identity(profile);
        RepoDescriptor repo = describe(identity);

        // -- catalog --
        List<App> apps = publishedApps(catalog);
        List<PackageBuild> packages = catalog.packages();
        LOG.info("Building {} index with {} apps", profile.directoryName(), apps.size());

        // -- build --
        LegacyIndex legacy = legacyBuilder.build(repo, key, requests, apps, packages);
        ObjectNode flat = flatBuilder.build(repo, requests, apps, packages);

        // -- write --
        Files.createDirectories(repoDir);
        Path legacyFile = repoDir.resolve(IndexConstants.LEGACY_INDEX);
        LegacyIndexWriter.write(legacy.document(), legacyFile, options.pretty());
        Path flatFile = repoDir.resolve(IndexConstants.FLAT_INDEX);
        FlatIndexWriter.write(flat, flatFile, options.pretty());

        List<Path> aliases = List.of();
        if (linker != null) {
            Map<String, App> appsById = new LinkedHashMap<>();
            apps.forEach(app -> appsById.put(app.id(), app));
            aliases = linker.link(repoDir, appsById, legacy.currentVersionFiles());
        }

        // -- sign --
        Path legacyArchive;
        Path flatArchive = null;
        if (gateway == null) {
            LOG.info("Creating unsigned index in preparation for signing");
            legacyArchive = repoDir.resolve(IndexConstants.LEGACY_UNSIGNED_ARCHIVE);
            IndexArchives.writeJar(legacyFile, legacyArchive);
            Files.deleteIfExists(repoDir.resolve(IndexConstants.LEGACY_ARCHIVE));
            LOG.debug("{} must have a signature, sign it before publishing", IndexConstants.FLAT_INDEX);
        } else {
            LOG.info("Creating signed index with this key (SHA256):");
            LOG.info("{}", key.fingerprint());
            legacyArchive = gateway.sign(repoDir, IndexConstants.LEGACY_INDEX);
            flatArchive = gateway.sign(repoDir, IndexConstants.FLAT_INDEX);
        }

        copyIcon(identity, repoDir);
        return new IndexResult(repo, legacyFile, flatFile, legacyArchive, flatArchive, aliases);
    }

    private RepoDescriptor describe(RepoIdentity identity) {
        List<String> mirrors = MirrorResolver.resolve(config, identity.address());
        return new RepoDescriptor(
                identity.name(),
                iconName(identity),
                identity.address(),
                identity.description(),
                clock.instant().truncatedTo(ChronoUnit.MILLIS),
                IndexConstants.METADATA_VERSION,
                config.getRepoMaxAge() != 0 ? config.getRepoMaxAge() : null,
                mirrors);
    }

    /**
     * The configured public key wins; otherwise the signing key's certificate
     * is published. Unsigned runs without either publish no key.
     */
    private RepoKey resolveKey(SigningGateway gateway) {
        if (config.getRepoPubkey() != null) {
            return RepoKey.fromHex(config.getRepoPubkey());
        }
        if (gateway != null) {
            return RepoKey.of(gateway.certificate());
        }
        if (config.getKeystore() != null) {
            return RepoKey.of(signingGateway.get().certificate());
        }
        LOG.warn("No repo-pubkey or keystore configured, the index will not name its signing key");
        return null;
    }

    /**
     * Apps that make it into the index, in id order, with descriptions
     * rendered to HTML.
     */
    private List<App> publishedApps(Catalog catalog) {
        List<App> published = new ArrayList<>();
        for (App app : catalog.apps()) {
            if (app.isDisabled() || !catalog.hasPackages(app.id())) {
                continue;
            }
            DescriptionFormatter formatter = new DescriptionFormatter(descriptionLinks(catalog, app.id()));
            published.add(app.withDescription(formatter.toHtml(app.description())));
        }
        return published;
    }

    private static LinkResolver descriptionLinks(Catalog catalog, String referencingApp) {
        return appId -> catalog.app(appId)
                .map(target -> new LinkResolver.Link(IndexConstants.APP_LINK_SCHEME + appId, target.displayName()))
                .orElseThrow(() -> new CatalogIntegrityException(referencingApp,
                        "Cannot resolve app id " + appId + " in the description of " + referencingApp));
    }

    private static String iconName(RepoIdentity identity) {
        if (identity.icon() == null) {
            return null;
        }
        Path fileName = Path.of(identity.icon()).getFileName();
        return fileName == null ? null : fileName.toString();
    }

    private static void copyIcon(RepoIdentity identity, Path repoDir) throws IOException {
        if (identity.icon() == null) {
            return;
        }
        Path source = Path.of(identity.icon());
        if (!Files.isRegularFile(source)) {
            LOG.warn("Repository icon {} not found, not copying it", source);
            return;
        }
        Path iconDir = repoDir.resolve("icons");
        Files.createDirectories(iconDir);
        Files.copy(source, iconDir.resolve(source.getFileName()), StandardCopyOption.REPLACE_EXISTING);
    }
}
