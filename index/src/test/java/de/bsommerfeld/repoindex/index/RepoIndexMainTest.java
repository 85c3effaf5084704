package de.bsommerfeld.repoindex.index;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class RepoIndexMainTest {

    @TempDir
    Path dir;

    @Test
    void run_shouldRequireUpdateCommand() throws IOException {
        assertEquals(1, RepoIndexMain.run(new String[0]));
        assertEquals(1, RepoIndexMain.run(new String[]{"publish"}));
    }

    @Test
    void run_shouldRejectUnknownOptions() throws IOException {
        assertEquals(1, RepoIndexMain.run(new String[]{"update", "--verbose"}));
    }

    @Test
    void run_shouldBuildUnsignedIndex() throws IOException {
        Path config = Files.writeString(dir.resolve("config.toml"), """
                repo-url = "https://example.org/fdroid/repo"
                repo-name = "Example"
                """);
        Path catalog = Files.writeString(dir.resolve("catalog.json"), """
                {"apps": [{"packageName": "org.example.a", "name": "A"}],
                 "packages": [{"packageName": "org.example.a", "versionCode": 1, "apkName": "a_1.apk"}]}
                """);
        Path repo = dir.resolve("repo");

        int status = RepoIndexMain.run(new String[]{
                "update", "--nosign", "--pretty",
                "--config", config.toString(),
                "--catalog", catalog.toString(),
                "--repo", repo.toString()});

        assertEquals(0, status);
        assertTrue(Files.exists(repo.resolve("index.xml")));
        assertTrue(Files.readString(repo.resolve("index-v1.json")).contains("\"org.example.a\""));
        assertTrue(Files.exists(repo.resolve("index_unsigned.jar")));
    }
}
