package de.bsommerfeld.repoindex.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A parsed flat index: what a client knows about a repository after a
 * successful, verified download.
 *
 * @param packages package builds keyed by app id, in document order
 */
public record RepositoryIndex(
        RepoDescriptor repo,
        Requests requests,
        List<App> apps,
        Map<String, List<PackageBuild>> packages) {

    public RepositoryIndex {
        apps = List.copyOf(apps);
        packages = Collections.unmodifiableMap(new LinkedHashMap<>(packages));
    }

    public List<PackageBuild> packagesOf(String appId) {
        return packages.getOrDefault(appId, List.of());
    }
}
