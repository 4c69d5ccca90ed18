package de.bsommerfeld.fnpack.core.domain;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DependencySetTest {

    private static Distribution dist(String name) {
        return new Distribution(name, "1.0", null, List.of());
    }

    @Test
    void add_shouldDeduplicateByCanonicalKey() {
        var set = new DependencySet("app");

        assertTrue(set.add(dist("Flask")));
        assertFalse(set.add(dist("flask")));
        assertEquals(1, set.size());
        assertTrue(set.contains("FLASK"));
    }

    @Test
    void withoutRoot_shouldExcludeRootDistribution() {
        var set = new DependencySet("My_App");
        set.add(dist("my-app"));
        set.add(dist("six"));
        set.add(dist("idna"));

        var names = set.withoutRoot().stream().map(Distribution::key).toList();

        assertEquals(List.of("six", "idna"), names);
        assertTrue(set.root().isPresent());
    }

    @Test
    void root_shouldBeEmptyBeforeResolution() {
        assertTrue(new DependencySet("app").root().isEmpty());
    }
}
