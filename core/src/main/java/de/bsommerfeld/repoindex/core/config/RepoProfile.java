package de.bsommerfeld.repoindex.core.config;

/**
 * Which of the two configured repositories an index run publishes. The
 * archive holds older package builds moved out of the primary repository.
 */
public enum RepoProfile {

    PRIMARY("repo"),
    ARCHIVE("archive");

    private final String directoryName;

    RepoProfile(String directoryName) {
        this.directoryName = directoryName;
    }

    /** Conventional directory of this repository below the server root. */
    public String directoryName() {
        return directoryName;
    }
}
