package de.bsommerfeld.repoindex.index.legacy;

import com.google.common.base.Joiner;
import de.bsommerfeld.repoindex.core.error.CatalogIntegrityException;
import de.bsommerfeld.repoindex.core.model.App;
import de.bsommerfeld.repoindex.core.model.PackageBuild;
import de.bsommerfeld.repoindex.core.model.Permission;
import de.bsommerfeld.repoindex.core.model.RepoDescriptor;
import de.bsommerfeld.repoindex.core.model.Requests;
import de.bsommerfeld.repoindex.index.RepoKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.nio.file.Path;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Renders the catalog into the legacy {@code index.xml} document.
 *
 * <h3>Compatibility</h3>
 * Element names are frozen by clients that have been parsing this format for
 * years, including the historically mis-named {@code marketversion} and
 * {@code marketvercode} which carry the <em>current</em> version. Packages
 * are listed newest first; clients rely on that order to show the latest
 * build without sorting.
 *
 * <h3>Integrity</h3>
 * Two packages of one app with the same version code make the whole build
 * fail. The document is only assembled in memory here, so a failure leaves
 * nothing on disk.
 */
public final class LegacyIndexBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(LegacyIndexBuilder.class);

    static final String NO_DESCRIPTION = "<p>No description available</p>";

    private static final DateTimeFormatter DATE = DateTimeFormatter.ISO_LOCAL_DATE.withZone(ZoneOffset.UTC);
    private static final Joiner COMMA = Joiner.on(',');
    private static final Comparator<PackageBuild> NEWEST_FIRST =
            Comparator.comparingInt(PackageBuild::versionCode).reversed();

    /**
     * Builds the document.
     *
     * @param key      signing certificate to publish, {@code null} to leave the
     *                 {@code pubkey} attribute out
     * @param apps     apps to publish; disabled apps and apps without packages
     *                 are skipped
     * @param packages package builds of all apps, in any order
     * @throws CatalogIntegrityException on duplicate version codes
     */
    public LegacyIndex build(RepoDescriptor repo, RepoKey key, Requests requests,
            List<App> apps, List<PackageBuild> packages) {
        Document doc = newDocument();
        Element root = doc.createElement("fdroid");
        doc.appendChild(root);

        root.appendChild(repoElement(doc, repo, key));

        for (String id : requests.install()) {
            Element element = doc.createElement("install");
            element.setAttribute("packageName", id);
            root.appendChild(element);
        }
        for (String id : requests.uninstall()) {
            Element element = doc.createElement("uninstall");
            element.setAttribute("packageName", id);
            root.appendChild(element);
        }

        Map<String, List<PackageBuild>> packagesByApp = packages.stream()
                .collect(Collectors.groupingBy(PackageBuild::packageName, LinkedHashMap::new, Collectors.toList()));

        Map<String, PackageBuild> currentVersionFiles = new LinkedHashMap<>();
        for (App app : apps) {
            if (app.isDisabled()) {
                continue;
            }
            List<PackageBuild> appPackages = packagesByApp.getOrDefault(app.id(), List.of());
            if (appPackages.isEmpty()) {
                continue;
            }
            PackageBuild current = appendApplication(doc, root, app, appPackages);
            if (current != null) {
                currentVersionFiles.put(app.id(), current);
            }
        }
        return new LegacyIndex(doc, currentVersionFiles);
    }

    private static Element repoElement(Document doc, RepoDescriptor repo, RepoKey key) {
        Element repoEl = doc.createElement("repo");
        repoEl.setAttribute("name", repo.name());
        if (repo.maxAge() != null) {
            repoEl.setAttribute("maxage", String.valueOf(repo.maxAge()));
        }
        repoEl.setAttribute("icon", baseName(repo.icon()));
        repoEl.setAttribute("url", repo.address());
        addElement(doc, repoEl, "description", repo.description());
        for (String mirror : repo.mirrors()) {
            addElement(doc, repoEl, "mirror", mirror);
        }
        repoEl.setAttribute("version", String.valueOf(repo.version()));
        repoEl.setAttribute("timestamp", String.valueOf(repo.timestamp().getEpochSecond()));
        if (key != null) {
            repoEl.setAttribute("pubkey", key.pubkey());
            repoEl.setAttribute("fingerprint", key.fingerprint());
        }
        return repoEl;
    }

    /**
     * Appends one {@code application} element.
     *
     * @return the package matching the declared current version code, or
     *         {@code null}
     */
    private PackageBuild appendApplication(Document doc, Element root, App app, List<PackageBuild> appPackages) {
        Element appEl = doc.createElement("application");
        appEl.setAttribute("id", app.id());
        root.appendChild(appEl);

        addElement(doc, appEl, "id", app.id());
        if (app.added() != null) {
            addElement(doc, appEl, "added", DATE.format(app.added()));
        }
        if (app.lastUpdated() != null) {
            addElement(doc, appEl, "lastupdated", DATE.format(app.lastUpdated()));
        }
        addElement(doc, appEl, "name", app.displayName());
        addElement(doc, appEl, "summary", app.summary());
        addElementNonEmpty(doc, appEl, "icon", app.icon());
        addElement(doc, appEl, "desc", isEmpty(app.description()) ? NO_DESCRIPTION : app.description());
        addElement(doc, appEl, "license", app.license());
        if (!app.categories().isEmpty()) {
            addElement(doc, appEl, "categories", COMMA.join(app.categories()));
            // primary category last, so clients that only read one category see it
            addElement(doc, appEl, "category", app.categories().get(0));
        }
        addElement(doc, appEl, "web", app.webSite());
        addElement(doc, appEl, "source", app.sourceCode());
        addElement(doc, appEl, "tracker", app.issueTracker());
        addElementNonEmpty(doc, appEl, "changelog", app.changelog());
        addElementNonEmpty(doc, appEl, "author", app.authorName());
        addElementNonEmpty(doc, appEl, "email", app.authorEmail());
        addElementNonEmpty(doc, appEl, "donate", app.donate());
        addElementNonEmpty(doc, appEl, "bitcoin", app.bitcoin());
        addElementNonEmpty(doc, appEl, "litecoin", app.litecoin());
        addElementNonEmpty(doc, appEl, "flattr", app.flattrId());

        // these carry the current (recommended) version despite their names
        addElement(doc, appEl, "marketversion", app.currentVersion());
        addElement(doc, appEl, "marketvercode", String.valueOf(declaredCurrentVersionCode(app)));

        if (!app.provides().isEmpty()) {
            addElement(doc, appEl, "provides", COMMA.join(app.provides()));
        }
        if (app.requiresRoot()) {
            addElement(doc, appEl, "requirements", "root");
        }

        List<PackageBuild> sorted = new ArrayList<>(appPackages);
        sorted.sort(NEWEST_FIRST);
        rejectDuplicateVersionCodes(app, sorted);

        Set<String> antiFeatures = new LinkedHashSet<>(app.antiFeatures());
        antiFeatures.addAll(sorted.get(0).antiFeatures());
        if (!antiFeatures.isEmpty()) {
            addElement(doc, appEl, "antifeatures", COMMA.join(antiFeatures));
        }

        PackageBuild current = null;
        for (PackageBuild build : sorted) {
            if (app.currentVersionCode() != null && build.versionCode() == app.currentVersionCode()) {
                current = build;
            }
            appEl.appendChild(packageElement(doc, build));
        }
        if (current == null && app.currentVersionCode() != null) {
            LOG.debug("{}: no package with current version code {}", app.id(), app.currentVersionCode());
        }
        return current;
    }

    private static void rejectDuplicateVersionCodes(App app, List<PackageBuild> sorted) {
        for (int i = 0; i < sorted.size() - 1; i++) {
            PackageBuild a = sorted.get(i);
            PackageBuild b = sorted.get(i + 1);
            if (a.versionCode() == b.versionCode()) {
                LOG.error("duplicate versions: '{}' - '{}'", a.apkName(), b.apkName());
                throw new CatalogIntegrityException(app.id(), "Duplicate version code " + a.versionCode()
                        + " in " + app.id() + ": '" + a.apkName() + "' - '" + b.apkName() + "'");
            }
        }
    }

    private static Element packageElement(Document doc, PackageBuild build) {
        Element pkgEl = doc.createElement("package");
        addElement(doc, pkgEl, "version", build.versionName());
        addElement(doc, pkgEl, "versioncode", String.valueOf(build.versionCode()));
        addElement(doc, pkgEl, "apkname", build.apkName());
        addElementNonEmpty(doc, pkgEl, "srcname", build.srcname());

        Element hashEl = doc.createElement("hash");
        hashEl.setAttribute("type", build.hashType());
        hashEl.appendChild(doc.createTextNode(nullToEmpty(build.hash())));
        pkgEl.appendChild(hashEl);

        addElement(doc, pkgEl, "size", String.valueOf(build.size()));
        addElementIfKnown(doc, pkgEl, "sdkver", build.minSdkVersion());
        addElementIfKnown(doc, pkgEl, "targetSdkVersion", build.targetSdkVersion());
        addElementIfKnown(doc, pkgEl, "maxsdkver", build.maxSdkVersion());
        addElementNonEmpty(doc, pkgEl, "obbMainFile", build.obbMainFile());
        addElementNonEmpty(doc, pkgEl, "obbMainFileSha256", build.obbMainFileSha256());
        addElementNonEmpty(doc, pkgEl, "obbPatchFile", build.obbPatchFile());
        addElementNonEmpty(doc, pkgEl, "obbPatchFileSha256", build.obbPatchFileSha256());
        if (build.added() != null) {
            addElement(doc, pkgEl, "added", DATE.format(build.added()));
        }

        if (build.isBinaryPackage()) {
            addElement(doc, pkgEl, "sig", build.sig());

            List<Permission> permissions = new ArrayList<>(build.permissions());
            permissions.sort(null);
            Set<String> shortNames = new TreeSet<>();
            for (Permission permission : permissions) {
                shortNames.add(permission.shortName());
            }
            if (!shortNames.isEmpty()) {
                addElement(doc, pkgEl, "permissions", COMMA.join(shortNames));
            }
            appendPermissionElements(doc, pkgEl, "uses-permission", permissions);

            List<Permission> permissionsSdk23 = new ArrayList<>(build.permissionsSdk23());
            permissionsSdk23.sort(null);
            appendPermissionElements(doc, pkgEl, "uses-permission-sdk-23", permissionsSdk23);

            if (!build.nativecode().isEmpty()) {
                addElement(doc, pkgEl, "nativecode", COMMA.join(new TreeSet<>(build.nativecode())));
            }
            if (!build.features().isEmpty()) {
                addElement(doc, pkgEl, "features", COMMA.join(new TreeSet<>(build.features())));
            }
        }
        return pkgEl;
    }

    private static void appendPermissionElements(Document doc, Element parent, String tag,
            List<Permission> permissions) {
        for (Permission permission : permissions) {
            Element permEl = doc.createElement(tag);
            permEl.setAttribute("name", permission.name());
            if (permission.maxSdkVersion() != null) {
                permEl.setAttribute("maxSdkVersion", String.valueOf(permission.maxSdkVersion()));
            }
            parent.appendChild(permEl);
        }
    }

    /** Undeclared current version codes are published as {@code 0}. */
    private static int declaredCurrentVersionCode(App app) {
        return app.currentVersionCode() == null ? 0 : app.currentVersionCode();
    }

    // =====================================================================
    // DOM helpers
    // =====================================================================

    private static void addElement(Document doc, Element parent, String name, String value) {
        Element el = doc.createElement(name);
        el.appendChild(doc.createTextNode(nullToEmpty(value)));
        parent.appendChild(el);
    }

    private static void addElementNonEmpty(Document doc, Element parent, String name, String value) {
        if (!isEmpty(value)) {
            addElement(doc, parent, name, value);
        }
    }

    private static void addElementIfKnown(Document doc, Element parent, String name, Integer value) {
        if (value != null) {
            addElement(doc, parent, name, String.valueOf(value));
        }
    }

    private static Document newDocument() {
        try {
            return DocumentBuilderFactory.newInstance().newDocumentBuilder().newDocument();
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("No DOM implementation available", e);
        }
    }

    private static String baseName(String path) {
        if (path == null || path.isEmpty()) {
            return "";
        }
        Path fileName = Path.of(path).getFileName();
        return fileName == null ? "" : fileName.toString();
    }

    private static boolean isEmpty(String value) {
        return value == null || value.isEmpty();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
