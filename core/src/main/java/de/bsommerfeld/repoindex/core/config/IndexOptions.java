package de.bsommerfeld.repoindex.core.config;

/**
 * Per-invocation switches of an index run.
 *
 * @param pretty write indented documents
 * @param nosign skip signing; the legacy archive is written unsigned and the
 *               flat document is left for a later signing step
 */
public record IndexOptions(boolean pretty, boolean nosign) {

    public static final IndexOptions DEFAULT = new IndexOptions(false, false);
}
