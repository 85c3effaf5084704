package de.bsommerfeld.repoindex.core.config;

/**
 * Name, icon, address and description of one repository profile.
 *
 * @param icon path of the icon file as configured; the index only carries its
 *             base name
 */
public record RepoIdentity(String name, String icon, String address, String description) {
}
