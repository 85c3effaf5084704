package de.bsommerfeld.repoindex.index.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.bsommerfeld.repoindex.core.error.IndexFormatException;
import de.bsommerfeld.repoindex.core.flat.AppFields;
import de.bsommerfeld.repoindex.core.flat.PackageFields;
import de.bsommerfeld.repoindex.core.model.App;
import de.bsommerfeld.repoindex.core.model.Catalog;
import de.bsommerfeld.repoindex.core.model.PackageBuild;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a pre-resolved catalog from JSON, standing in for the metadata
 * parser and the package scanner.
 *
 * <p>
 * The file uses the flat index field names:
 * <pre>{@code
 * {
 *   "apps": [ { "packageName": "org.example", "name": "Example", ... } ],
 *   "packages": [ { "packageName": "org.example", "versionCode": 3, "apkName": "org.example_3.apk", ... } ]
 * }
 * }</pre>
 * On top of those, apps may carry the unpublished {@code autoName},
 * {@code disabled}, {@code provides} and {@code requiresRoot}, and packages
 * the display-only {@code name} and {@code icon}.
 */
public final class CatalogReader {

    private static final Logger LOG = LoggerFactory.getLogger(CatalogReader.class);

    private final ObjectMapper mapper;

    public CatalogReader() {
        this.mapper = new ObjectMapper();
    }

    public Catalog read(Path catalogFile) throws IOException {
        LOG.info("Reading catalog from {}", catalogFile.toAbsolutePath());
        try (InputStream in = Files.newInputStream(catalogFile)) {
            return read(in);
        }
    }

    public Catalog read(InputStream in) throws IOException {
        JsonNode root = mapper.readTree(in);
        if (root == null || !root.isObject()) {
            throw new IndexFormatException("Catalog must be a JSON object");
        }

        List<App> apps = new ArrayList<>();
        for (JsonNode node : root.path("apps")) {
            apps.add(readApp(node));
        }
        List<PackageBuild> packages = new ArrayList<>();
        for (JsonNode node : root.path("packages")) {
            packages.add(readPackage(node));
        }
        LOG.debug("Catalog holds {} apps and {} packages", apps.size(), packages.size());
        return new Catalog(apps, packages);
    }

    private static App readApp(JsonNode node) {
        App.Builder builder = AppFields.read(node).toBuilder();
        if (node.hasNonNull("autoName")) {
            builder.autoName(node.get("autoName").asText());
        }
        if (node.hasNonNull("disabled")) {
            builder.disabled(node.get("disabled").asText());
        }
        if (node.has("provides")) {
            List<String> provides = new ArrayList<>();
            node.get("provides").forEach(item -> provides.add(item.asText()));
            builder.provides(provides);
        }
        builder.requiresRoot(node.path("requiresRoot").asBoolean(false));
        return builder.build();
    }

    private static PackageBuild readPackage(JsonNode node) {
        if (!node.hasNonNull("packageName")) {
            throw new IndexFormatException("Catalog package without packageName: " + node);
        }
        return PackageFields.read(node, node.get("packageName").asText())
                .withDisplayFields(node.path("name").asText(null), node.path("icon").asText(null));
    }
}
