package de.bsommerfeld.repoindex.core.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CatalogTest {

    @Test
    void apps_shouldBeSortedById() {
        Catalog catalog = new Catalog(
                List.of(App.builder("org.example.b").build(), App.builder("org.example.a").build()),
                List.of());

        assertEquals(List.of("org.example.a", "org.example.b"),
                catalog.apps().stream().map(App::id).toList());
    }

    @Test
    void constructor_shouldRejectDuplicateIds() {
        List<App> apps = List.of(App.builder("org.example.a").build(), App.builder("org.example.a").build());

        assertThrows(IllegalArgumentException.class, () -> new Catalog(apps, List.of()));
    }

    @Test
    void hasPackages_shouldLookAtPackageNames() {
        Catalog catalog = new Catalog(
                List.of(App.builder("org.example.a").build()),
                List.of(PackageBuild.builder("org.example.a", 1, "a_1.apk").build()));

        assertTrue(catalog.hasPackages("org.example.a"));
        assertFalse(catalog.hasPackages("org.example.b"));
        assertTrue(catalog.app("org.example.b").isEmpty());
    }

    @Test
    void fieldValue_shouldRejectUnknownFields() {
        App app = App.builder("org.example.a").name("Example").build();

        assertEquals("Example", app.fieldValue("Name"));
        assertEquals("org.example.a", app.fieldValue("packageName"));
        assertThrows(IllegalArgumentException.class, () -> app.fieldValue("Description"));
    }
}
