/*
 * Copyright (c) 2024-Present Perracodex. Use of this source code is governed by an MIT license.
 */

package org.permafrost.utils;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Placeholder and home-directory expansion of configured storage paths.
 */
@Tag("unit")
class PathExpansionTest {

    @AfterEach
    void cleanup() {
        System.clearProperty("permafrost.test.root");
        System.clearProperty("permafrost.test.world");
    }

    @Test
    void testExpandPath_NoVariables() {
        assertEquals("/srv/archives", PathExpansion.expandPath("/srv/archives"));
        assertEquals("", PathExpansion.expandPath(""));
        assertNull(PathExpansion.expandPath(null));
    }

    @Test
    void testExpandPath_SystemProperties() {
        System.setProperty("permafrost.test.root", "/mnt/frost");
        System.setProperty("permafrost.test.world", "colony");

        assertEquals("/mnt/frost/colony/regions",
            PathExpansion.expandPath("${permafrost.test.root}/${permafrost.test.world}/regions"));
    }

    @Test
    void testExpandPath_SystemPropertyWinsOverEnvironment() {
        String envName = System.getenv().keySet().stream().findFirst().orElse(null);
        if (envName == null) {
            return;
        }
        System.setProperty(envName, "/from/property");
        try {
            assertEquals("/from/property/x", PathExpansion.expandPath("${" + envName + "}/x"));
        } finally {
            System.clearProperty(envName);
        }
    }

    @Test
    void testExpandPath_LeadingTilde() {
        String home = System.getProperty("user.home");

        assertEquals(home + "/.permafrost/archives", PathExpansion.expandPath("~/.permafrost/archives"));
        assertEquals(home, PathExpansion.expandPath("~"));
        assertEquals("/opt/~backup", PathExpansion.expandPath("/opt/~backup"));
    }

    @Test
    void testExpandPath_UndefinedVariable() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> PathExpansion.expandPath("${permafrost.test.undefined.variable}/data"));
        assertTrue(e.getMessage().contains("permafrost.test.undefined.variable"));
    }

    @Test
    void testExpandPath_UnclosedVariable() {
        assertThrows(IllegalArgumentException.class, () -> PathExpansion.expandPath("${permafrost.test.root/data"));
    }

    @Test
    void testToAbsolutePath_Normalizes() {
        System.setProperty("permafrost.test.root", "/mnt/frost");

        Path path = PathExpansion.toAbsolutePath("${permafrost.test.root}/a/../b");

        assertTrue(path.isAbsolute());
        assertEquals(Path.of("/mnt/frost/b").toAbsolutePath(), path);
    }
}
