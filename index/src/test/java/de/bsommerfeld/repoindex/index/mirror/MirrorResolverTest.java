package de.bsommerfeld.repoindex.index.mirror;

import de.bsommerfeld.repoindex.core.config.ConfigLoader;
import de.bsommerfeld.repoindex.core.error.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class MirrorResolverTest {

    // -- web mirrors --

    @Test
    void resolve_shouldAppendRepositorySegment() {
        var config = ConfigLoader.parse("mirrors = [\"https://example.org/fdroid/\"]");

        List<String> mirrors = MirrorResolver.resolve(config, "https://example.com/fdroid");

        assertEquals(List.of("https://example.org/fdroid/fdroid"), mirrors);
    }

    @Test
    void resolve_shouldSortMirrorsAndAddMissingSlash() {
        var config = ConfigLoader.parse(
                "mirrors = [\"https://z.example.org/fdroid\", \"https://a.example.org/fdroid/\"]");

        List<String> mirrors = MirrorResolver.resolve(config, "https://example.com/fdroid/repo");

        assertEquals(List.of("https://a.example.org/fdroid/repo", "https://z.example.org/fdroid/repo"), mirrors);
    }

    @Test
    void resolve_shouldRejectMirrorsOutsideWebroot() {
        var config = ConfigLoader.parse(
                "mirrors = [\"https://example.org/other/\", \"https://example.net/alt\", \"https://ok.org/fdroid\"]");

        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> MirrorResolver.resolve(config, "https://example.com/fdroid/repo"));

        assertTrue(e.getMessage().contains("https://example.org/other/"));
        assertTrue(e.getMessage().contains("https://example.net/alt"));
        assertFalse(e.getMessage().contains("https://ok.org/fdroid"));
    }

    @Test
    void resolve_shouldReportMalformedMirrorTogetherWithOthers() {
        var config = ConfigLoader.parse(
                "mirrors = [\"https://a.org/f droid/\", \"https://b.org/other/\"]");

        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> MirrorResolver.resolve(config, "https://example.com/fdroid/repo"));

        assertTrue(e.getMessage().contains("https://a.org/f droid/"));
        assertTrue(e.getMessage().contains("https://b.org/other/"));
    }

    @Test
    void resolve_shouldRejectMalformedRepositoryAddress() {
        var config = ConfigLoader.parse("mirrors = [\"https://example.org/fdroid/\"]");

        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> MirrorResolver.resolve(config, "https://example.com/f droid/repo"));

        assertTrue(e.getMessage().contains("https://example.com/f droid/repo"));
    }

    @Test
    void resolve_shouldAcceptNonstandardWebrootWhenEnabled() {
        var config = ConfigLoader.parse("""
                nonstandard-webroot = true
                mirrors = ["https://example.org/other/"]
                """);

        assertEquals(List.of("https://example.org/other/repo"),
                MirrorResolver.resolve(config, "https://example.com/fdroid/repo"));
    }

    @Test
    void resolve_shouldAppendConvertedGitMirrors() {
        var config = ConfigLoader.parse("""
                server-git-mirrors = ["git@github.com:user/repo.git", "https://git.example.org/user/repo"]
                """);

        assertEquals(List.of("https://raw.githubusercontent.com/user/repo/master/fdroid/"),
                MirrorResolver.resolve(config, "https://example.com/fdroid/repo"));
    }

    // -- git mirrors --

    @Test
    void gitMirrorUrl_shouldConvertGithub() {
        assertEquals(Optional.of("https://raw.githubusercontent.com/user/repo/master/fdroid"),
                MirrorResolver.gitMirrorUrl("https://github.com/user/repo"));
    }

    @Test
    void gitMirrorUrl_shouldConvertGitlabSshUrl() {
        assertEquals(Optional.of("https://user.gitlab.io/repo/fdroid"),
                MirrorResolver.gitMirrorUrl("git@gitlab.com:user/repo.git"));
    }

    @Test
    void gitMirrorUrl_shouldIgnoreUnknownHosts() {
        assertTrue(MirrorResolver.gitMirrorUrl("https://codeberg.org/user/repo").isEmpty());
        assertTrue(MirrorResolver.gitMirrorUrl("https://github.com/user").isEmpty());
    }
}
