package de.bsommerfeld.repoindex.core.model;

import com.google.common.collect.ImmutableList;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Read-only snapshot of all apps and package builds one index run works on.
 * Apps are kept sorted by id.
 */
public final class Catalog {

    private final Map<String, App> appsById;
    private final List<PackageBuild> packages;

    public Catalog(List<App> apps, List<PackageBuild> packages) {
        this.appsById = apps.stream()
                .sorted(Comparator.comparing(App::id))
                .collect(Collectors.toMap(App::id, Function.identity(),
                        (a, b) -> {
                            throw new IllegalArgumentException("Duplicate app id in catalog: " + a.id());
                        },
                        LinkedHashMap::new));
        this.packages = ImmutableList.copyOf(packages);
    }

    /** All apps, sorted by id. */
    public List<App> apps() {
        return List.copyOf(appsById.values());
    }

    public List<PackageBuild> packages() {
        return packages;
    }

    public Optional<App> app(String id) {
        return Optional.ofNullable(appsById.get(id));
    }

    public boolean hasPackages(String appId) {
        return packages.stream().anyMatch(p -> p.packageName().equals(appId));
    }
}
