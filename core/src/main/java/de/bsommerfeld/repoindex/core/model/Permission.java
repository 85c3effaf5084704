package de.bsommerfeld.repoindex.core.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * A permission requested by a package.
 *
 * @param name          fully qualified permission name
 * @param maxSdkVersion highest SDK the request applies to, {@code null} for all
 */
public record Permission(String name, Integer maxSdkVersion) implements Comparable<Permission> {

    private static final String PLATFORM_PREFIX = "android.permission.";

    private static final Comparator<Permission> ORDER = Comparator
            .comparing(Permission::name)
            .thenComparing(Permission::maxSdkVersion, Comparator.nullsFirst(Comparator.naturalOrder()));

    public Permission {
        Objects.requireNonNull(name, "name");
    }

    public static Permission of(String name) {
        return new Permission(name, null);
    }

    /** The name without the platform namespace, as legacy clients expect it. */
    public String shortName() {
        return name.startsWith(PLATFORM_PREFIX) ? name.substring(PLATFORM_PREFIX.length()) : name;
    }

    @Override
    public int compareTo(Permission other) {
        return ORDER.compare(this, other);
    }
}
