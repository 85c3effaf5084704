package de.bsommerfeld.repoindex.core.flat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import de.bsommerfeld.repoindex.core.model.RepoDescriptor;

import java.util.List;

/**
 * Field table of the {@code repo} section. Unlike app and package records
 * the order is fixed by the format, not alphabetical.
 */
public final class RepoFields {

    public static final List<FlatField<RepoDescriptor, RepoDescriptor.Builder>> FIELDS =
            List.<FlatField<RepoDescriptor, RepoDescriptor.Builder>>of(
                    FlatField.instant("timestamp", RepoDescriptor::timestamp, RepoDescriptor.Builder::timestamp),
                    FlatField.integer("version", RepoDescriptor::version, RepoDescriptor.Builder::version),
                    FlatField.integer("maxage", RepoDescriptor::maxAge, RepoDescriptor.Builder::maxAge),
                    FlatField.text("name", RepoDescriptor::name, RepoDescriptor.Builder::name),
                    FlatField.text("icon", RepoDescriptor::icon, RepoDescriptor.Builder::icon),
                    FlatField.text("address", RepoDescriptor::address, RepoDescriptor.Builder::address),
                    FlatField.text("description", RepoDescriptor::description, RepoDescriptor.Builder::description),
                    FlatField.textList("mirrors", RepoDescriptor::mirrors, RepoDescriptor.Builder::mirrors));

    private RepoFields() {
    }

    public static ObjectNode write(RepoDescriptor repo) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        for (FlatField<RepoDescriptor, RepoDescriptor.Builder> field : FIELDS) {
            field.write(repo, node);
        }
        return node;
    }

    public static RepoDescriptor read(JsonNode node) {
        RepoDescriptor.Builder builder = RepoDescriptor.builder();
        for (FlatField<RepoDescriptor, RepoDescriptor.Builder> field : FIELDS) {
            field.read(node, builder);
        }
        return builder.build();
    }
}
