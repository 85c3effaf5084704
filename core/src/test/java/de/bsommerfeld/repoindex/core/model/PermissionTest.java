package de.bsommerfeld.repoindex.core.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PermissionTest {

    @Test
    void shortName_shouldStripPlatformNamespaceOnly() {
        assertEquals("INTERNET", Permission.of("android.permission.INTERNET").shortName());
        assertEquals("com.example.permission.C2D", Permission.of("com.example.permission.C2D").shortName());
    }

    @Test
    void compareTo_shouldSortByNameThenMaxSdk() {
        List<Permission> permissions = new ArrayList<>(List.of(
                new Permission("b", 23),
                Permission.of("b"),
                Permission.of("a")));

        Collections.sort(permissions);

        assertEquals(List.of(Permission.of("a"), Permission.of("b"), new Permission("b", 23)), permissions);
    }
}
