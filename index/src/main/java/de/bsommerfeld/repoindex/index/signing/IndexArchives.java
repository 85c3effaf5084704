package de.bsommerfeld.repoindex.index.signing;

import de.bsommerfeld.repoindex.core.model.IndexConstants;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.jar.Attributes;
import java.util.jar.JarEntry;
import java.util.jar.JarOutputStream;
import java.util.jar.Manifest;

/**
 * Creates the unsigned jar archives index documents are shipped in.
 */
public final class IndexArchives {

    private IndexArchives() {
    }

    /** {@code index.xml} ships in {@code index.jar}, {@code index-v1.json} in {@code index-v1.jar}. */
    public static String archiveNameFor(String documentName) {
        if (IndexConstants.LEGACY_INDEX.equals(documentName)) {
            return IndexConstants.LEGACY_ARCHIVE;
        }
        int dot = documentName.lastIndexOf('.');
        return (dot < 0 ? documentName : documentName.substring(0, dot)) + ".jar";
    }

    /**
     * Writes a jar holding {@code document} as its only entry, stored under its
     * file name.
     */
    public static void writeJar(Path document, Path jar) throws IOException {
        Manifest manifest = new Manifest();
        manifest.getMainAttributes().put(Attributes.Name.MANIFEST_VERSION, "1.0");
        manifest.getMainAttributes().putValue("Created-By", "repo-index");

        try (OutputStream file = Files.newOutputStream(jar);
                JarOutputStream out = new JarOutputStream(file, manifest)) {
            JarEntry entry = new JarEntry(document.getFileName().toString());
            entry.setTime(Files.getLastModifiedTime(document).toMillis());
            out.putNextEntry(entry);
            Files.copy(document, out);
            out.closeEntry();
        }
    }
}
