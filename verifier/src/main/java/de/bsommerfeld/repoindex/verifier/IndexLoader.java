package de.bsommerfeld.repoindex.verifier;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.bsommerfeld.repoindex.core.error.IndexFormatException;
import de.bsommerfeld.repoindex.core.flat.AppFields;
import de.bsommerfeld.repoindex.core.flat.PackageFields;
import de.bsommerfeld.repoindex.core.flat.RepoFields;
import de.bsommerfeld.repoindex.core.hash.Fingerprints;
import de.bsommerfeld.repoindex.core.model.App;
import de.bsommerfeld.repoindex.core.model.PackageBuild;
import de.bsommerfeld.repoindex.core.model.RepoDescriptor;
import de.bsommerfeld.repoindex.core.model.RepositoryIndex;
import de.bsommerfeld.repoindex.core.model.Requests;

import java.io.IOException;
import java.io.InputStream;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses {@code index-v1.json} into a {@link RepositoryIndex}. Keys that are
 * not part of the field tables are ignored.
 */
public class IndexLoader {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * Parses the document and records {@code signer} as the repository key.
     *
     * @throws IndexFormatException if the document is malformed
     */
    public RepositoryIndex load(InputStream json, X509Certificate signer) throws IOException {
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JacksonException e) {
            throw new IndexFormatException("Malformed index document: " + e.getOriginalMessage(), e);
        }
        RepositoryIndex index = fromTree(root);
        RepoDescriptor signed = index.repo().withSigner(Fingerprints.pubkeyHex(signer), Fingerprints.of(signer));
        return new RepositoryIndex(signed, index.requests(), index.apps(), index.packages());
    }

    /** Parses an unsigned document; the repository key stays unknown. */
    public RepositoryIndex parse(String json) {
        try {
            return fromTree(MAPPER.readTree(json));
        } catch (JacksonException e) {
            throw new IndexFormatException("Malformed index document: " + e.getOriginalMessage(), e);
        }
    }

    private static RepositoryIndex fromTree(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new IndexFormatException("Index document is not a JSON object");
        }
        if (!root.path("repo").isObject()) {
            throw new IndexFormatException("Index document has no 'repo' section");
        }
        RepoDescriptor repo = RepoFields.read(root.get("repo"));
        Requests requests = new Requests(
                textList(root.path("requests").path("install")),
                textList(root.path("requests").path("uninstall")));

        List<App> apps = new ArrayList<>();
        for (JsonNode appNode : root.path("apps")) {
            apps.add(AppFields.read(appNode));
        }

        Map<String, List<PackageBuild>> packages = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> groups = root.path("packages").fields();
        while (groups.hasNext()) {
            Map.Entry<String, JsonNode> group = groups.next();
            List<PackageBuild> builds = new ArrayList<>();
            for (JsonNode buildNode : group.getValue()) {
                builds.add(PackageFields.read(buildNode, group.getKey()));
            }
            packages.put(group.getKey(), List.copyOf(builds));
        }
        return new RepositoryIndex(repo, requests, apps, packages);
    }

    private static List<String> textList(JsonNode node) {
        List<String> values = new ArrayList<>();
        for (JsonNode item : node) {
            values.add(item.asText());
        }
        return values;
    }
}
