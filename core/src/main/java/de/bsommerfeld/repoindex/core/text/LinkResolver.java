package de.bsommerfeld.repoindex.core.text;

/**
 * Turns an app id referenced from a description into a link.
 */
@FunctionalInterface
public interface LinkResolver {

    /**
     * @throws de.bsommerfeld.repoindex.core.error.CatalogIntegrityException
     *         if no app with this id exists
     */
    Link resolve(String appId);

    record Link(String href, String text) {
    }
}
