package de.bsommerfeld.repoindex.core.model;

import com.google.common.collect.ImmutableList;

import java.time.Instant;
import java.util.List;

/**
 * Repository level metadata shared by both index formats.
 *
 * @param timestamp   when the index was generated
 * @param version     index schema version
 * @param maxAge      days after which clients treat the index as stale,
 *                    {@code null} when unset
 * @param pubkey      hex encoded DER certificate of the signer, only known
 *                    after verification
 * @param fingerprint fingerprint of {@code pubkey}, only known after
 *                    verification
 */
public record RepoDescriptor(
        String name,
        String icon,
        String address,
        String description,
        Instant timestamp,
        int version,
        Integer maxAge,
        List<String> mirrors,
        String pubkey,
        String fingerprint) {

    public RepoDescriptor {
        mirrors = mirrors == null ? List.of() : ImmutableList.copyOf(mirrors);
    }

    public RepoDescriptor(String name, String icon, String address, String description,
            Instant timestamp, int version, Integer maxAge, List<String> mirrors) {
        this(name, icon, address, description, timestamp, version, maxAge, mirrors, null, null);
    }

    public static Builder builder() {
        return new Builder();
    }

    public RepoDescriptor withSigner(String pubkey, String fingerprint) {
        return new RepoDescriptor(name, icon, address, description, timestamp, version, maxAge,
                mirrors, pubkey, fingerprint);
    }

    public static final class Builder {

        private String name;
        private String icon;
        private String address;
        private String description;
        private Instant timestamp;
        private int version;
        private Integer maxAge;
        private List<String> mirrors = List.of();

        private Builder() {
        }

        public Builder name(String name) { this.name = name; return this; }
        public Builder icon(String icon) { this.icon = icon; return this; }
        public Builder address(String address) { this.address = address; return this; }
        public Builder description(String description) { this.description = description; return this; }
        public Builder timestamp(Instant timestamp) { this.timestamp = timestamp; return this; }
        public Builder version(int version) { this.version = version; return this; }
        public Builder maxAge(Integer maxAge) { this.maxAge = maxAge; return this; }
        public Builder mirrors(List<String> mirrors) { this.mirrors = mirrors; return this; }

        public RepoDescriptor build() {
            return new RepoDescriptor(name, icon, address, description, timestamp, version, maxAge, mirrors);
        }
    }
}
