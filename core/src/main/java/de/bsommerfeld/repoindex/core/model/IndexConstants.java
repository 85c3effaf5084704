package de.bsommerfeld.repoindex.core.model;

/**
 * File names and versions shared by the publishing and the verifying side.
 */
public final class IndexConstants {

    /** Schema version written into every generated index. */
    public static final int METADATA_VERSION = 19;

    public static final String LEGACY_INDEX = "index.xml";
    public static final String LEGACY_ARCHIVE = "index.jar";
    public static final String LEGACY_UNSIGNED_ARCHIVE = "index_unsigned.jar";
    public static final String FLAT_INDEX = "index-v1.json";
    public static final String FLAT_ARCHIVE = "index-v1.jar";

    /** Scheme used for links between apps inside descriptions. */
    public static final String APP_LINK_SCHEME = "fdroid.app:";

    private IndexConstants() {
    }
}
