package de.bsommerfeld.repoindex.index.alias;

import com.google.common.base.CharMatcher;
import de.bsommerfeld.repoindex.core.error.ConfigurationException;
import de.bsommerfeld.repoindex.core.model.App;
import de.bsommerfeld.repoindex.core.model.PackageBuild;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Maintains stable file names for the current version of each app, so that
 * links like {@code https://host/fdroid/MyApp.apk} keep working across
 * version bumps.
 *
 * <p>
 * Aliases are created next to the repository directory and point into it.
 * An existing alias is always removed before the new one is created, which
 * makes repeated runs idempotent. Where the file system cannot hold
 * symbolic links the package is copied instead.
 */
public final class CurrentVersionLinker {

    private static final Logger LOG = LoggerFactory.getLogger(CurrentVersionLinker.class);

    /** Characters that are unsafe in file names or URLs. */
    private static final CharMatcher UNSAFE = CharMatcher.anyOf(" '\"&%?+=/");
    private static final List<String> SIGNATURE_EXTENSIONS = List.of(".asc", ".sig");

    private final String nameSource;

    /**
     * @param nameSource metadata field the alias name is derived from, e.g.
     *                   {@code Name}
     * @throws ConfigurationException if the field cannot be used for names
     */
    public CurrentVersionLinker(String nameSource) {
        if (!App.LOOKUP_FIELDS.contains(nameSource)) {
            throw new ConfigurationException("current-version-name-source: unsupported app field '"
                    + nameSource + "', expected one of " + App.LOOKUP_FIELDS);
        }
        this.nameSource = nameSource;
    }

    static String sanitize(String name) {
        return UNSAFE.removeFrom(name);
    }

    /**
     * Creates one alias per app with a current version package.
     *
     * @param repoDir  the repository directory holding the package files
     * @param apps     apps by id
     * @param currents current version package per app id
     * @return the created aliases, signature aliases included
     */
    public List<Path> link(Path repoDir, Map<String, App> apps, Map<String, PackageBuild> currents)
            throws IOException {
        Path absoluteRepo = repoDir.toAbsolutePath().normalize();
        Path linkDir = absoluteRepo.getParent();
        List<Path> created = new ArrayList<>();

        for (Map.Entry<String, PackageBuild> entry : currents.entrySet()) {
            App app = apps.get(entry.getKey());
            PackageBuild current = entry.getValue();
            String value = app == null ? null : app.fieldValue(nameSource);
            String sanitized = value == null ? "" : sanitize(value);
            if (sanitized.isEmpty()) {
                LOG.warn("{}: no usable '{}' for a current version link", entry.getKey(), nameSource);
                continue;
            }

            String extension = current.fileExtension().isEmpty() ? "" : "." + current.fileExtension();
            Path alias = linkDir.resolve(sanitized + extension);
            Path target = absoluteRepo.resolve(current.apkName());
            created.add(replaceLink(alias, target));

            for (String signatureExtension : SIGNATURE_EXTENSIONS) {
                Path signature = absoluteRepo.resolve(current.apkName() + signatureExtension);
                if (Files.exists(signature)) {
                    created.add(replaceLink(linkDir.resolve(alias.getFileName() + signatureExtension), signature));
                }
            }
        }
        return created;
    }

    private static Path replaceLink(Path alias, Path target) throws IOException {
        Files.deleteIfExists(alias);
        Path relativeTarget = alias.getParent().relativize(target);
        try {
            Files.createSymbolicLink(alias, relativeTarget);
            LOG.debug("Linked {} -> {}", alias.getFileName(), relativeTarget);
        } catch (UnsupportedOperationException | FileSystemException e) {
            LOG.debug("Symbolic links unavailable ({}), copying {}", e.getMessage(), target.getFileName());
            Files.copy(target, alias, StandardCopyOption.REPLACE_EXISTING);
        }
        return alias;
    }
}
