package de.bsommerfeld.repoindex.core.model;

import com.google.common.collect.ImmutableList;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * One published build of an app, as reported by the package scanner.
 *
 * @param packageName  id of the owning {@link App}
 * @param versionCode  ordering key, higher is newer, unique per app
 * @param apkName      file name inside the repository directory
 * @param srcname      source tarball published next to the package, if any
 * @param hash         hex encoded digest of the file
 * @param hashType     digest algorithm of {@code hash}
 * @param sig          hash of the package signing certificate
 * @param name         app label found in the binary, display only
 * @param icon         icon file extracted from the binary, display only
 */
public record PackageBuild(
        String packageName,
        String versionName,
        int versionCode,
        String apkName,
        String srcname,
        String hash,
        String hashType,
        long size,
        Integer minSdkVersion,
        Integer targetSdkVersion,
        Integer maxSdkVersion,
        String sig,
        List<Permission> permissions,
        List<Permission> permissionsSdk23,
        List<String> nativecode,
        List<String> features,
        List<String> antiFeatures,
        String obbMainFile,
        String obbMainFileSha256,
        String obbPatchFile,
        String obbPatchFileSha256,
        Instant added,
        String name,
        String icon) {

    public static final String DEFAULT_HASH_TYPE = "sha256";

    public PackageBuild {
        Objects.requireNonNull(packageName, "packageName");
        Objects.requireNonNull(apkName, "apkName");
        hashType = hashType == null ? DEFAULT_HASH_TYPE : hashType;
        permissions = permissions == null ? List.of() : ImmutableList.copyOf(permissions);
        permissionsSdk23 = permissionsSdk23 == null ? List.of() : ImmutableList.copyOf(permissionsSdk23);
        nativecode = nativecode == null ? List.of() : ImmutableList.copyOf(nativecode);
        features = features == null ? List.of() : ImmutableList.copyOf(features);
        antiFeatures = antiFeatures == null ? List.of() : ImmutableList.copyOf(antiFeatures);
    }

    public static Builder builder(String packageName, int versionCode, String apkName) {
        return new Builder(packageName, versionCode, apkName);
    }

    /** A builder without identity; used when fields arrive one by one. */
    public static Builder builder() {
        return new Builder(null, 0, null);
    }

    public PackageBuild withDisplayFields(String newName, String newIcon) {
        return new PackageBuild(packageName, versionName, versionCode, apkName, srcname, hash, hashType,
                size, minSdkVersion, targetSdkVersion, maxSdkVersion, sig, permissions, permissionsSdk23,
                nativecode, features, antiFeatures, obbMainFile, obbMainFileSha256, obbPatchFile,
                obbPatchFileSha256, added, newName, newIcon);
    }

    /** Lower-cased extension of {@link #apkName()}, empty when there is none. */
    public String fileExtension() {
        int dot = apkName.lastIndexOf('.');
        return dot < 0 ? "" : apkName.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    /**
     * Whether this is an installable binary. Only binaries carry a signing
     * hash, permissions, ABIs and features; source packages do not.
     */
    public boolean isBinaryPackage() {
        return "apk".equals(fileExtension());
    }

    public static final class Builder {

        private String packageName;
        private int versionCode;
        private String apkName;
        private String versionName;
        private String srcname;
        private String hash;
        private String hashType = DEFAULT_HASH_TYPE;
        private long size;
        private Integer minSdkVersion;
        private Integer targetSdkVersion;
        private Integer maxSdkVersion;
        private String sig;
        private List<Permission> permissions = List.of();
        private List<Permission> permissionsSdk23 = List.of();
        private List<String> nativecode = List.of();
        private List<String> features = List.of();
        private List<String> antiFeatures = List.of();
        private String obbMainFile;
        private String obbMainFileSha256;
        private String obbPatchFile;
        private String obbPatchFileSha256;
        private Instant added;
        private String name;
        private String icon;

        private Builder(String packageName, int versionCode, String apkName) {
            this.packageName = packageName;
            this.versionCode = versionCode;
            this.apkName = apkName;
        }

        public Builder packageName(String packageName) { this.packageName = packageName; return this; }
        public Builder versionCode(int versionCode) { this.versionCode = versionCode; return this; }
        public Builder apkName(String apkName) { this.apkName = apkName; return this; }
        public Builder versionName(String versionName) { this.versionName = versionName; return this; }
        public Builder srcname(String srcname) { this.srcname = srcname; return this; }
        public Builder hash(String hash) { this.hash = hash; return this; }
        public Builder hashType(String hashType) { this.hashType = hashType; return this; }
        public Builder size(long size) { this.size = size; return this; }
        public Builder minSdkVersion(Integer minSdkVersion) { this.minSdkVersion = minSdkVersion; return this; }
        public Builder targetSdkVersion(Integer targetSdkVersion) { this.targetSdkVersion = targetSdkVersion; return this; }
        public Builder maxSdkVersion(Integer maxSdkVersion) { this.maxSdkVersion = maxSdkVersion; return this; }
        public Builder sig(String sig) { this.sig = sig; return this; }
        public Builder permissions(List<Permission> permissions) { this.permissions = permissions; return this; }
        public Builder permissionsSdk23(List<Permission> permissionsSdk23) { this.permissionsSdk23 = permissionsSdk23; return this; }
        public Builder nativecode(List<String> nativecode) { this.nativecode = nativecode; return this; }
        public Builder features(List<String> features) { this.features = features; return this; }
        public Builder antiFeatures(List<String> antiFeatures) { this.antiFeatures = antiFeatures; return this; }
        public Builder obbMainFile(String obbMainFile) { this.obbMainFile = obbMainFile; return this; }
        public Builder obbMainFileSha256(String obbMainFileSha256) { this.obbMainFileSha256 = obbMainFileSha256; return this; }
        public Builder obbPatchFile(String obbPatchFile) { this.obbPatchFile = obbPatchFile; return this; }
        public Builder obbPatchFileSha256(String obbPatchFileSha256) { this.obbPatchFileSha256 = obbPatchFileSha256; return this; }
        public Builder added(Instant added) { this.added = added; return this; }
        public Builder name(String name) { this.name = name; return this; }
        public Builder icon(String icon) { this.icon = icon; return this; }

        public PackageBuild build() {
            return new PackageBuild(packageName, versionName, versionCode, apkName, srcname, hash,
                    hashType, size, minSdkVersion, targetSdkVersion, maxSdkVersion, sig, permissions,
                    permissionsSdk23, nativecode, features, antiFeatures, obbMainFile, obbMainFileSha256,
                    obbPatchFile, obbPatchFileSha256, added, name, icon);
        }
    }
}
