package de.bsommerfeld.repoindex.index.legacy;

import de.bsommerfeld.repoindex.core.model.PackageBuild;
import org.w3c.dom.Document;

import java.util.Map;

/**
 * A built legacy index document.
 *
 * @param currentVersionFiles per app id, the package matching the app's
 *                            declared current version code; apps without a
 *                            match have no entry
 */
public record LegacyIndex(Document document, Map<String, PackageBuild> currentVersionFiles) {
}
