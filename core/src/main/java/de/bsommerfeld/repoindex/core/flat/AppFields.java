package de.bsommerfeld.repoindex.core.flat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import de.bsommerfeld.repoindex.core.error.IndexFormatException;
import de.bsommerfeld.repoindex.core.model.App;

import java.util.List;
import java.util.Set;

/**
 * Field table of an app record in the flat index, sorted by external name.
 *
 * <p>
 * External names follow the client's app model: lower camel case, with the
 * id published as {@code packageName} and the current version as the
 * suggested version. Build-server bookkeeping, {@code provides} and
 * {@code requiresRoot} have no entry and are therefore never published.
 */
public final class AppFields {

    /** Internal field names that must never appear in a published app record. */
    public static final Set<String> EXCLUDED = Set.of(
            "builds", "comments", "metadatapath", "archivePolicy", "autoUpdateMode",
            "maintainerNotes", "provides", "repo", "repoType", "requiresRoot",
            "updateCheckData", "updateCheckIgnore", "updateCheckMode", "updateCheckName",
            "noSourceSince", "vercodeOperation");

    public static final List<FlatField<App, App.Builder>> FIELDS = List.<FlatField<App, App.Builder>>of(
            FlatField.instant("added", App::added, App.Builder::added),
            FlatField.textList("antiFeatures", App::antiFeatures, App.Builder::antiFeatures),
            FlatField.text("authorEmail", App::authorEmail, App.Builder::authorEmail),
            FlatField.text("authorName", App::authorName, App.Builder::authorName),
            FlatField.text("bitcoin", App::bitcoin, App.Builder::bitcoin),
            FlatField.textList("categories", App::categories, App.Builder::categories),
            FlatField.text("changelog", App::changelog, App.Builder::changelog),
            FlatField.text("description", App::description, App.Builder::description),
            FlatField.text("donate", App::donate, App.Builder::donate),
            FlatField.text("flattrID", App::flattrId, App.Builder::flattrId),
            FlatField.text("icon", App::icon, App.Builder::icon),
            FlatField.text("issueTracker", App::issueTracker, App.Builder::issueTracker),
            FlatField.instant("lastUpdated", App::lastUpdated, App.Builder::lastUpdated),
            FlatField.text("license", App::license, App.Builder::license),
            FlatField.text("litecoin", App::litecoin, App.Builder::litecoin),
            // autoName stands in when no name was set
            FlatField.text("name", App::displayName, App.Builder::name),
            FlatField.text("packageName", App::id, App.Builder::id),
            FlatField.text("sourceCode", App::sourceCode, App.Builder::sourceCode),
            FlatField.integerAsText("suggestedVersionCode", App::currentVersionCode,
                    App.Builder::currentVersionCode),
            FlatField.text("suggestedVersionName", App::currentVersion, App.Builder::currentVersion),
            FlatField.text("summary", App::summary, App.Builder::summary),
            FlatField.text("webSite", App::webSite, App.Builder::webSite));

    private AppFields() {
    }

    public static ObjectNode write(App app) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        for (FlatField<App, App.Builder> field : FIELDS) {
            field.write(app, node);
        }
        return node;
    }

    public static App read(JsonNode node) {
        if (!node.hasNonNull("packageName")) {
            throw new IndexFormatException("App record without packageName: " + node);
        }
        App.Builder builder = App.builder(null);
        for (FlatField<App, App.Builder> field : FIELDS) {
            field.read(node, builder);
        }
        return builder.build();
    }
}
