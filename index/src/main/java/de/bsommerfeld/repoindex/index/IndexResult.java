package de.bsommerfeld.repoindex.index;

import de.bsommerfeld.repoindex.core.model.RepoDescriptor;

import java.nio.file.Path;
import java.util.List;

/**
 * Files produced by one index run.
 *
 * @param legacyArchive signed {@code index.jar}, or {@code index_unsigned.jar}
 *                      when signing was skipped
 * @param flatArchive   signed {@code index-v1.jar}, {@code null} when signing
 *                      was skipped
 * @param aliases       current version aliases created next to the repository
 */
public record IndexResult(
        RepoDescriptor repo,
        Path legacyIndex,
        Path flatIndex,
        Path legacyArchive,
        Path flatArchive,
        List<Path> aliases) {
}
