package de.bsommerfeld.repoindex.index.mirror;

import de.bsommerfeld.repoindex.core.config.IndexConfig;
import de.bsommerfeld.repoindex.core.error.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds the mirror list published in the index.
 *
 * <h3>Web root check</h3>
 * A mirror copies the whole server web root, so its URL must end in the
 * {@value #WEBROOT} segment; the repository's own last path segment
 * ({@code repo} or {@code archive}) is then appended. Mirrors that do not
 * end in {@value #WEBROOT} are rejected unless {@code nonstandard-webroot} is
 * set. All offending mirrors are reported together.
 *
 * <h3>Git hosting mirrors</h3>
 * Repositories pushed to GitHub or GitLab are served from the host's raw
 * content or pages domain. Other hosts have no such service and are skipped.
 */
public final class MirrorResolver {

    private static final Logger LOG = LoggerFactory.getLogger(MirrorResolver.class);

    static final String WEBROOT = "fdroid";
    private static final String BRANCH = "master";
    private static final Pattern SSH_URL = Pattern.compile("^git@(.*):(.*)");

    private MirrorResolver() {
    }

    /**
     * Resolves all configured mirrors for the repository at {@code repoAddress}.
     *
     * @throws ConfigurationException if the address or any mirror is malformed
     *                                or fails the web root check
     */
    public static List<String> resolve(IndexConfig config, String repoAddress) {
        List<String> failed = new ArrayList<>();
        String repoSegment = "";
        try {
            repoSegment = lastSegment(URI.create(repoAddress).getPath());
        } catch (IllegalArgumentException e) {
            LOG.error("repository address '{}' is not a valid URL: {}", repoAddress, e.getMessage());
            failed.add(repoAddress + " (" + e.getMessage() + ")");
        }

        List<String> mirrors = new ArrayList<>();
        for (String mirror : config.getMirrors().stream().sorted().toList()) {
            URI mirrorUri;
            try {
                mirrorUri = URI.create(mirror);
            } catch (IllegalArgumentException e) {
                LOG.error("mirror '{}' is not a valid URL: {}", mirror, e.getMessage());
                failed.add(mirror + " (" + e.getMessage() + ")");
                continue;
            }
            if (!config.isNonstandardWebroot() && !WEBROOT.equals(lastSegment(mirrorUri.getPath()))) {
                LOG.error("mirror '{}' does not end with '{}'!", mirror, WEBROOT);
                failed.add(mirror);
            }
            // without the trailing slash resolve() would replace the last segment
            String directory = mirror.endsWith("/") ? mirror : mirror + "/";
            mirrors.add(URI.create(directory).resolve(repoSegment).toString());
        }

        for (String gitMirror : config.getServerGitMirrors()) {
            gitMirrorUrl(gitMirror).ifPresent(url -> mirrors.add(url + "/"));
        }

        if (!failed.isEmpty()) {
            throw new ConfigurationException("Invalid mirrors, each must be a URL ending with '" + WEBROOT + "': "
                    + String.join(", ", failed));
        }
        return mirrors;
    }

    /**
     * Converts a git remote on a supported hosting service into the URL the
     * service serves the pushed repository from.
     *
     * @return the URL, or empty for unsupported hosts
     */
    public static Optional<String> gitMirrorUrl(String url) {
        Matcher ssh = SSH_URL.matcher(url);
        if (ssh.matches()) {
            url = "https://" + ssh.group(1) + "/" + ssh.group(2);
        }

        List<String> segments = new ArrayList<>(Arrays.asList(url.split("/")));
        if (segments.size() < 5) {
            LOG.warn("Ignoring git mirror without user and repository: {}", url);
            return Optional.empty();
        }
        String repo = segments.get(4);
        if (repo.endsWith(".git")) {
            repo = repo.substring(0, repo.length() - ".git".length());
            segments.set(4, repo);
        }

        String host = segments.get(2);
        String user = segments.get(3);
        switch (host) {
            case "github.com" -> {
                segments.set(2, "raw.githubusercontent.com");
                segments.add(BRANCH);
                segments.add(WEBROOT);
                return Optional.of(String.join("/", segments));
            }
            case "gitlab.com" -> {
                return Optional.of("https://" + user + ".gitlab.io/" + repo + "/" + WEBROOT);
            }
            default -> {
                LOG.debug("No mirror service known for git host {}", host);
                return Optional.empty();
            }
        }
    }

    private static String lastSegment(String path) {
        if (path == null) {
            return "";
        }
        String trimmed = path.replaceAll("/+$", "");
        return trimmed.substring(trimmed.lastIndexOf('/') + 1);
    }
}
