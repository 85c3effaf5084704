package de.bsommerfeld.repoindex.core.flat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import de.bsommerfeld.repoindex.core.error.IndexFormatException;
import de.bsommerfeld.repoindex.core.model.PackageBuild;

import java.util.List;

/**
 * Field table of a package record in the flat index, sorted by external
 * name. The display-only {@code icon} and {@code name} already live on the
 * app record and are left out here.
 */
public final class PackageFields {

    public static final List<FlatField<PackageBuild, PackageBuild.Builder>> FIELDS =
            List.<FlatField<PackageBuild, PackageBuild.Builder>>of(
                    FlatField.instant("added", PackageBuild::added, PackageBuild.Builder::added),
                    FlatField.textList("antiFeatures", PackageBuild::antiFeatures, PackageBuild.Builder::antiFeatures),
                    FlatField.text("apkName", PackageBuild::apkName, PackageBuild.Builder::apkName),
                    FlatField.textList("features", PackageBuild::features, PackageBuild.Builder::features),
                    FlatField.text("hash", PackageBuild::hash, PackageBuild.Builder::hash),
                    FlatField.text("hashType", PackageBuild::hashType, PackageBuild.Builder::hashType),
                    FlatField.integer("maxSdkVersion", PackageBuild::maxSdkVersion, PackageBuild.Builder::maxSdkVersion),
                    FlatField.integer("minSdkVersion", PackageBuild::minSdkVersion, PackageBuild.Builder::minSdkVersion),
                    FlatField.textList("nativecode", PackageBuild::nativecode, PackageBuild.Builder::nativecode),
                    FlatField.text("obbMainFile", PackageBuild::obbMainFile, PackageBuild.Builder::obbMainFile),
                    FlatField.text("obbMainFileSha256", PackageBuild::obbMainFileSha256,
                            PackageBuild.Builder::obbMainFileSha256),
                    FlatField.text("obbPatchFile", PackageBuild::obbPatchFile, PackageBuild.Builder::obbPatchFile),
                    FlatField.text("obbPatchFileSha256", PackageBuild::obbPatchFileSha256,
                            PackageBuild.Builder::obbPatchFileSha256),
                    FlatField.text("packageName", PackageBuild::packageName, PackageBuild.Builder::packageName),
                    FlatField.text("sig", PackageBuild::sig, PackageBuild.Builder::sig),
                    FlatField.longValue("size", PackageBuild::size, PackageBuild.Builder::size),
                    FlatField.text("srcname", PackageBuild::srcname, PackageBuild.Builder::srcname),
                    FlatField.integer("targetSdkVersion", PackageBuild::targetSdkVersion,
                            PackageBuild.Builder::targetSdkVersion),
                    FlatField.permissions("uses-permission", PackageBuild::permissions,
                            PackageBuild.Builder::permissions),
                    FlatField.permissions("uses-permission-sdk-23", PackageBuild::permissionsSdk23,
                            PackageBuild.Builder::permissionsSdk23),
                    FlatField.integer("versionCode", PackageBuild::versionCode, PackageBuild.Builder::versionCode),
                    FlatField.text("versionName", PackageBuild::versionName, PackageBuild.Builder::versionName));

    private PackageFields() {
    }

    public static ObjectNode write(PackageBuild build) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        for (FlatField<PackageBuild, PackageBuild.Builder> field : FIELDS) {
            field.write(build, node);
        }
        return node;
    }

    /**
     * Reads one package record. Records that omit {@code packageName} take
     * the id of the app they are listed under.
     */
    public static PackageBuild read(JsonNode node, String appId) {
        if (!node.hasNonNull("apkName")) {
            throw new IndexFormatException("Package record of " + appId + " without apkName: " + node);
        }
        PackageBuild.Builder builder = PackageBuild.builder().packageName(appId);
        for (FlatField<PackageBuild, PackageBuild.Builder> field : FIELDS) {
            field.read(node, builder);
        }
        return builder.build();
    }
}
