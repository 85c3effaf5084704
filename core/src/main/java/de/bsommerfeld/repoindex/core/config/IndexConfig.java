package de.bsommerfeld.repoindex.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import de.bsommerfeld.repoindex.core.error.ConfigurationException;
import de.bsommerfeld.repoindex.core.model.Requests;

import java.util.ArrayList;
import java.util.List;

/**
 * Repository configuration. Values are read from {@code config.toml} by
 * {@link ConfigLoader} and never change afterwards; there are no setters,
 * the fields are populated by Jackson.
 */
public class IndexConfig {

    @JsonProperty("repo-url")
    private String repoUrl = "https://MyFirstFDroidRepo.org/fdroid/repo";

    @JsonProperty("repo-name")
    private String repoName = "My First F-Droid Repo Demo";

    @JsonProperty("repo-icon")
    private String repoIcon = "fdroid-icon.png";

    @JsonProperty("repo-description")
    private String repoDescription = "This is a repository of apps to be used with F-Droid.";

    @JsonProperty("archive-url")
    private String archiveUrl = "https://f-droid.org/archive";

    @JsonProperty("archive-name")
    private String archiveName = "My First F-Droid Archive Demo";

    @JsonProperty("archive-icon")
    private String archiveIcon = "fdroid-icon.png";

    @JsonProperty("archive-description")
    private String archiveDescription = "The repository of older versions of applications from the main demo repository.";

    @JsonProperty("repo-maxage")
    private int repoMaxAge = 0;

    @JsonProperty("mirrors")
    private List<String> mirrors = List.of();

    @JsonProperty("server-git-mirrors")
    private List<String> serverGitMirrors = List.of();

    @JsonProperty("nonstandard-webroot")
    private boolean nonstandardWebroot = false;

    @JsonProperty("install-list")
    private JsonNode installList;

    @JsonProperty("uninstall-list")
    private JsonNode uninstallList;

    @JsonProperty("make-current-version-link")
    private boolean makeCurrentVersionLink = false;

    @JsonProperty("current-version-name-source")
    private String currentVersionNameSource = "Name";

    @JsonProperty("keystore")
    private String keystore;

    @JsonProperty("keystore-type")
    private String keystoreType = "PKCS12";

    @JsonProperty("keystorepass")
    private String keystorePass;

    @JsonProperty("keypass")
    private String keyPass;

    @JsonProperty("repo-keyalias")
    private String repoKeyAlias;

    @JsonProperty("repo-pubkey")
    private String repoPubkey;

    public RepoIdentity identity(RepoProfile profile) {
        return profile == RepoProfile.ARCHIVE
                ? new RepoIdentity(archiveName, archiveIcon, archiveUrl, archiveDescription)
                : new RepoIdentity(repoName, repoIcon, repoUrl, repoDescription);
    }

    /**
     * Resolves the install and uninstall request lists. Each accepts a single
     * id or a list of ids.
     *
     * @throws ConfigurationException for any other shape
     */
    public Requests requests() {
        return new Requests(
                toIdList("install-list", installList),
                toIdList("uninstall-list", uninstallList));
    }

    private static List<String> toIdList(String key, JsonNode node) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (node.isTextual()) {
            return List.of(node.asText());
        }
        if (node.isArray()) {
            List<String> ids = new ArrayList<>();
            for (JsonNode item : node) {
                if (!item.isTextual()) {
                    throw new ConfigurationException(
                            "'" + key + "' only accepts strings and lists of strings, found element: " + item);
                }
                ids.add(item.asText());
            }
            return ids;
        }
        throw new ConfigurationException(
                "'" + key + "' only accepts strings and lists of strings, found: " + node);
    }

    public int getRepoMaxAge() {
        return repoMaxAge;
    }

    public List<String> getMirrors() {
        return mirrors;
    }

    public List<String> getServerGitMirrors() {
        return serverGitMirrors;
    }

    public boolean isNonstandardWebroot() {
        return nonstandardWebroot;
    }

    public boolean isMakeCurrentVersionLink() {
        return makeCurrentVersionLink;
    }

    public String getCurrentVersionNameSource() {
        return currentVersionNameSource;
    }

    public String getKeystore() {
        return keystore;
    }

    public String getKeystoreType() {
        return keystoreType;
    }

    public String getKeystorePass() {
        return keystorePass;
    }

    public String getKeyPass() {
        return keyPass;
    }

    public String getRepoKeyAlias() {
        return repoKeyAlias;
    }

    public String getRepoPubkey() {
        return repoPubkey;
    }
}
