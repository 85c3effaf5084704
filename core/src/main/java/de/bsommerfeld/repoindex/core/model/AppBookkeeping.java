package de.bsommerfeld.repoindex.core.model;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.List;
import java.util.Map;

/**
 * Build-server bookkeeping attached to an {@link App}. None of these fields
 * are ever published in an index; they travel with the catalog so the
 * publishing side can prove it leaves them out.
 */
public record AppBookkeeping(
        List<String> builds,
        Map<String, String> comments,
        String metadataPath,
        String archivePolicy,
        String autoUpdateMode,
        String maintainerNotes,
        String repo,
        String repoType,
        String updateCheckMode,
        String updateCheckData,
        String updateCheckIgnore,
        String updateCheckName,
        String noSourceSince,
        String vercodeOperation) {

    public static final AppBookkeeping EMPTY = new AppBookkeeping(
            List.of(), Map.of(), null, null, null, null, null, null, null, null, null, null, null, null);

    public AppBookkeeping {
        builds = builds == null ? List.of() : ImmutableList.copyOf(builds);
        comments = comments == null ? Map.of() : ImmutableMap.copyOf(comments);
    }
}
