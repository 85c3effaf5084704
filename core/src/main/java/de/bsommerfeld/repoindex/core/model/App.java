package de.bsommerfeld.repoindex.core.model;

import com.google.common.collect.ImmutableList;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * One application of the catalog, as resolved from its metadata file.
 *
 * <p>
 * Instances are immutable. List components are copied on construction so a
 * catalog snapshot cannot change while an index is being built from it.
 *
 * @param id                 unique, stable application id (the package name)
 * @param name               display name, may be {@code null} when only
 *                           {@code autoName} is known
 * @param autoName           name read from the package binary
 * @param description        rich text, may contain {@code [[app.id]]} links
 * @param categories         ordered, the first entry is the primary category
 * @param disabled           reason the app is disabled, {@code null} when
 *                           enabled
 * @param currentVersionCode declared current version code, {@code null} when
 *                           not declared
 * @param provides           ids of components this app provides
 * @param bookkeeping        internal fields never published in an index
 */
public record App(
        String id,
        String name,
        String autoName,
        String summary,
        String description,
        String license,
        List<String> categories,
        String webSite,
        String sourceCode,
        String issueTracker,
        String changelog,
        String authorName,
        String authorEmail,
        String donate,
        String bitcoin,
        String litecoin,
        String flattrId,
        String disabled,
        List<String> antiFeatures,
        String currentVersion,
        Integer currentVersionCode,
        List<String> provides,
        boolean requiresRoot,
        String icon,
        Instant added,
        Instant lastUpdated,
        AppBookkeeping bookkeeping) {

    /** Field names accepted by {@link #fieldValue(String)}. */
    public static final Set<String> LOOKUP_FIELDS = Set.of(
            "Name", "AutoName", "id", "packageName", "Summary", "License", "CurrentVersion");

    public App {
        Objects.requireNonNull(id, "id");
        categories = categories == null ? List.of() : ImmutableList.copyOf(categories);
        antiFeatures = antiFeatures == null ? List.of() : ImmutableList.copyOf(antiFeatures);
        provides = provides == null ? List.of() : ImmutableList.copyOf(provides);
        bookkeeping = bookkeeping == null ? AppBookkeeping.EMPTY : bookkeeping;
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public boolean isDisabled() {
        return disabled != null;
    }

    /** The name shown to users: {@code name}, falling back to {@code autoName}. */
    public String displayName() {
        return name != null && !name.isEmpty() ? name : autoName;
    }

    public App withDescription(String newDescription) {
        return toBuilder().description(newDescription).build();
    }

    /**
     * Looks up a field by its metadata name, as used by the
     * {@code current-version-name-source} setting.
     *
     * @throws IllegalArgumentException for names outside {@link #LOOKUP_FIELDS}
     */
    public String fieldValue(String fieldName) {
        return switch (fieldName) {
            case "Name" -> name;
            case "AutoName" -> autoName;
            case "id", "packageName" -> id;
            case "Summary" -> summary;
            case "License" -> license;
            case "CurrentVersion" -> currentVersion;
            default -> throw new IllegalArgumentException("Unsupported app field: " + fieldName);
        };
    }

    public Builder toBuilder() {
        return new Builder(id)
                .name(name).autoName(autoName).summary(summary).description(description)
                .license(license).categories(categories).webSite(webSite).sourceCode(sourceCode)
                .issueTracker(issueTracker).changelog(changelog).authorName(authorName)
                .authorEmail(authorEmail).donate(donate).bitcoin(bitcoin).litecoin(litecoin)
                .flattrId(flattrId).disabled(disabled).antiFeatures(antiFeatures)
                .currentVersion(currentVersion).currentVersionCode(currentVersionCode)
                .provides(provides).requiresRoot(requiresRoot).icon(icon).added(added)
                .lastUpdated(lastUpdated).bookkeeping(bookkeeping);
    }

    public static final class Builder {

        private String id;
        private String name;
        private String autoName;
        private String summary;
        private String description;
        private String license;
        private List<String> categories = List.of();
        private String webSite;
        private String sourceCode;
        private String issueTracker;
        private String changelog;
        private String authorName;
        private String authorEmail;
        private String donate;
        private String bitcoin;
        private String litecoin;
        private String flattrId;
        private String disabled;
        private List<String> antiFeatures = List.of();
        private String currentVersion;
        private Integer currentVersionCode;
        private List<String> provides = List.of();
        private boolean requiresRoot;
        private String icon;
        private Instant added;
        private Instant lastUpdated;
        private AppBookkeeping bookkeeping = AppBookkeeping.EMPTY;

        private Builder(String id) {
            this.id = id;
        }

        public Builder id(String id) { this.id = id; return this; }
        public Builder name(String name) { this.name = name; return this; }
        public Builder autoName(String autoName) { this.autoName = autoName; return this; }
        public Builder summary(String summary) { this.summary = summary; return this; }
        public Builder description(String description) { this.description = description; return this; }
        public Builder license(String license) { this.license = license; return this; }
        public Builder categories(List<String> categories) { this.categories = categories; return this; }
        public Builder webSite(String webSite) { this.webSite = webSite; return this; }
        public Builder sourceCode(String sourceCode) { this.sourceCode = sourceCode; return this; }
        public Builder issueTracker(String issueTracker) { this.issueTracker = issueTracker; return this; }
        public Builder changelog(String changelog) { this.changelog = changelog; return this; }
        public Builder authorName(String authorName) { this.authorName = authorName; return this; }
        public Builder authorEmail(String authorEmail) { this.authorEmail = authorEmail; return this; }
        public Builder donate(String donate) { this.donate = donate; return this; }
        public Builder bitcoin(String bitcoin) { this.bitcoin = bitcoin; return this; }
        public Builder litecoin(String litecoin) { this.litecoin = litecoin; return this; }
        public Builder flattrId(String flattrId) { this.flattrId = flattrId; return this; }
        public Builder disabled(String disabled) { this.disabled = disabled; return this; }
        public Builder antiFeatures(List<String> antiFeatures) { this.antiFeatures = antiFeatures; return this; }
        public Builder currentVersion(String currentVersion) { this.currentVersion = currentVersion; return this; }
        public Builder currentVersionCode(Integer currentVersionCode) { this.currentVersionCode = currentVersionCode; return this; }
        public Builder provides(List<String> provides) { this.provides = provides; return this; }
        public Builder requiresRoot(boolean requiresRoot) { this.requiresRoot = requiresRoot; return this; }
        public Builder icon(String icon) { this.icon = icon; return this; }
        public Builder added(Instant added) { this.added = added; return this; }
        public Builder lastUpdated(Instant lastUpdated) { this.lastUpdated = lastUpdated; return this; }
        public Builder bookkeeping(AppBookkeeping bookkeeping) { this.bookkeeping = bookkeeping; return this; }

        public App build() {
            return new App(id, name, autoName, summary, description, license, categories, webSite,
                    sourceCode, issueTracker, changelog, authorName, authorEmail, donate, bitcoin,
                    litecoin, flattrId, disabled, antiFeatures, currentVersion, currentVersionCode,
                    provides, requiresRoot, icon, added, lastUpdated, bookkeeping);
        }
    }
}
