package de.bsommerfeld.repoindex.verifier;

import de.bsommerfeld.repoindex.core.error.IndexFormatException;
import de.bsommerfeld.repoindex.core.model.App;
import de.bsommerfeld.repoindex.core.model.PackageBuild;
import de.bsommerfeld.repoindex.core.model.RepoDescriptor;
import de.bsommerfeld.repoindex.core.model.RepositoryIndex;
import de.bsommerfeld.repoindex.core.model.Requests;
import de.bsommerfeld.repoindex.index.flat.FlatIndexBuilder;
import de.bsommerfeld.repoindex.index.flat.FlatIndexWriter;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IndexLoaderTest {

    private final IndexLoader loader = new IndexLoader();

    @Test
    void parse_shouldReconstructBuiltIndex() throws Exception {
        RepoDescriptor repo = new RepoDescriptor("Example", "repo.png", "https://example.org/fdroid/repo",
                "Apps", Instant.ofEpochMilli(1_700_000_000_123L), 19, 14, List.of("https://m.example.net/fdroid/repo"));
        List<App> apps = List.of(
                App.builder("org.example.a").name("A").currentVersionCode(2).build(),
                App.builder("org.example.b").name("B").build());
        List<PackageBuild> packages = List.of(
                PackageBuild.builder("org.example.a", 1, "a_1.apk").hash("aa01").size(10).build(),
                PackageBuild.builder("org.example.a", 2, "a_2.apk").hash("aa02").size(10).build(),
                PackageBuild.builder("org.example.b", 7, "b_7.apk").hash("bb07").size(10).build());
        String json = FlatIndexWriter.toString(
                new FlatIndexBuilder().build(repo, new Requests(List.of("org.example.b"), List.of()), apps, packages),
                false);

        RepositoryIndex index = loader.parse(json);

        assertEquals(repo, index.repo());
        assertEquals(List.of("org.example.b"), index.requests().install());
        assertEquals(List.of("org.example.a", "org.example.b"), index.apps().stream().map(App::id).toList());
        assertEquals(Integer.valueOf(2), index.apps().get(0).currentVersionCode());
        assertEquals(List.of(1, 2), index.packagesOf("org.example.a").stream().map(PackageBuild::versionCode).toList());
        assertEquals(List.of("aa01", "aa02"), index.packagesOf("org.example.a").stream().map(PackageBuild::hash).toList());
        assertEquals("bb07", index.packagesOf("org.example.b").get(0).hash());
    }

    @Test
    void parse_shouldIgnoreUnknownKeys() {
        RepositoryIndex index = loader.parse("""
                {"repo": {"name": "Example", "version": 19, "future": true},
                 "apps": [{"packageName": "org.example.a", "antiFeatureReasons": {}}],
                 "extra": []}
                """);

        assertEquals("Example", index.repo().name());
        assertEquals(1, index.apps().size());
        assertTrue(index.packages().isEmpty());
        assertTrue(index.requests().install().isEmpty());
    }

    @Test
    void parse_shouldRequireRepoSection() {
        assertThrows(IndexFormatException.class, () -> loader.parse("{\"apps\": []}"));
    }

    @Test
    void parse_shouldRejectMalformedJson() {
        assertThrows(IndexFormatException.class, () -> loader.parse("{\"repo\": "));
    }
}
