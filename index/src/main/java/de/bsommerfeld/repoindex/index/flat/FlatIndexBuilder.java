package de.bsommerfeld.repoindex.index.flat;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import de.bsommerfeld.repoindex.core.flat.AppFields;
import de.bsommerfeld.repoindex.core.flat.PackageFields;
import de.bsommerfeld.repoindex.core.flat.RepoFields;
import de.bsommerfeld.repoindex.core.model.App;
import de.bsommerfeld.repoindex.core.model.PackageBuild;
import de.bsommerfeld.repoindex.core.model.RepoDescriptor;
import de.bsommerfeld.repoindex.core.model.Requests;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Renders the catalog into the flat {@code index-v1.json} document.
 *
 * <p>
 * Every record is produced through the field tables in
 * {@code de.bsommerfeld.repoindex.core.flat}, which decide naming and
 * omission of empty values. Packages are grouped under their app id in input
 * order; consumers sort them if they need to.
 */
public final class FlatIndexBuilder {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    /**
     * Builds the document.
     *
     * @param apps     apps to publish; disabled apps and apps without packages
     *                 are skipped
     * @param packages package builds of all apps; builds of apps that are not
     *                 published are skipped as well
     */
    public ObjectNode build(RepoDescriptor repo, Requests requests, List<App> apps, List<PackageBuild> packages) {
        Set<String> withPackages = packages.stream()
                .map(PackageBuild::packageName)
                .collect(Collectors.toSet());
        List<App> published = apps.stream()
                .filter(app -> !app.isDisabled() && withPackages.contains(app.id()))
                .toList();
        Set<String> publishedIds = published.stream().map(App::id).collect(Collectors.toSet());

        ObjectNode output = NODES.objectNode();
        output.set("repo", RepoFields.write(repo));
        output.set("requests", requestsNode(requests));

        ArrayNode appList = output.putArray("apps");
        for (App app : published) {
            appList.add(AppFields.write(app));
        }

        ObjectNode packageMap = output.putObject("packages");
        for (PackageBuild build : packages) {
            if (!publishedIds.contains(build.packageName())) {
                continue;
            }
            ArrayNode packageList = packageMap.has(build.packageName())
                    ? (ArrayNode) packageMap.get(build.packageName())
                    : packageMap.putArray(build.packageName());
            packageList.add(PackageFields.write(build));
        }
        return output;
    }

    private static ObjectNode requestsNode(Requests requests) {
        ObjectNode node = NODES.objectNode();
        ArrayNode install = node.putArray("install");
        requests.install().forEach(install::add);
        ArrayNode uninstall = node.putArray("uninstall");
        requests.uninstall().forEach(uninstall::add);
        return node;
    }
}
