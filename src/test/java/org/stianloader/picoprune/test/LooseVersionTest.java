package org.stianloader.picoprune.test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.jetbrains.annotations.NotNull;
import org.junit.jupiter.api.Test;
import org.stianloader.picoprune.version.LooseVersion;

public class LooseVersionTest {

    private boolean isNewer(@NotNull String newer, @NotNull String older) {
        return LooseVersion.parse(newer).isNewerThan(LooseVersion.parse(older));
    }

    @Test
    public void testNumericComparison() {
        assertTrue(isNewer("1.10", "1.9"));
        assertFalse(isNewer("1.9", "1.10"));
        assertTrue(isNewer("2", "1.99.99"));
        assertTrue(isNewer("10.0", "9.0"));
        assertTrue(isNewer("1.0.100000000000000000000", "1.0.99999999999999999999"));
    }

    @Test
    public void testComponentCount() {
        assertTrue(isNewer("1.0.0", "1.0"));
        assertFalse(isNewer("1.0", "1.0.0"));
        assertTrue(isNewer("1.0", ""));
        assertTrue(LooseVersion.parse("0").isNewerThan(LooseVersion.EMPTY));
    }

    @Test
    public void testTextComponents() {
        // Text always sorts after numbers
        assertTrue(isNewer("1.0a", "1.0.1"));
        assertTrue(isNewer("1.0b", "1.0a"));
        assertTrue(isNewer("1.0.0b", "1.0.0"));
        // Case-sensitive lexical ordering
        assertTrue(isNewer("1.0a", "1.0B"));
    }

    @Test
    public void testEquality() {
        assertEquals(LooseVersion.parse("1.0"), LooseVersion.parse("1..0"));
        assertEquals(0, LooseVersion.parse("1.0").compareTo(LooseVersion.parse("1..0")));
        assertEquals(LooseVersion.parse("1.0").hashCode(), LooseVersion.parse("1..0").hashCode());
        assertNotEquals(LooseVersion.parse("1.0"), LooseVersion.parse("1.0.0"));
        assertEquals("1..0", LooseVersion.parse("1..0").getOriginText());
        assertEquals("1..0", LooseVersion.parse("1..0").toString());
    }

    @Test
    public void testSeparators() {
        // Separators other than the dot are components of their own
        assertTrue(isNewer("1.0-2", "1.0-1"));
        assertTrue(isNewer("1.0_1", "1.0-1"));
    }

    @Test
    public void testSorting() {
        List<LooseVersion> versions = new ArrayList<>();
        for (String version : Arrays.asList("2.0", "1.10", "1.2", "1.0a", "1.0", "10")) {
            versions.add(LooseVersion.parse(version));
        }
        versions.sort(null);
        List<String> sorted = new ArrayList<>();
        for (LooseVersion version : versions) {
            sorted.add(version.getOriginText());
        }
        assertEquals(Arrays.asList("1.0", "1.0a", "1.2", "1.10", "2.0", "10"), sorted);
    }
}
