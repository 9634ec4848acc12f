package io.jenkins.infra.repository_rulesets_updater.github;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.jenkins.infra.repository_rulesets_updater.UnresolvedReferenceException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class NameIdCacheTest {

    private final NameIdCache cache = new NameIdCache("team", Map.of("core", 10L, "infra", 20L, "docs", 30L));

    @Test
    void testMappingIsSymmetric() {
        for (Map.Entry<String, Long> entry : cache.idsByName().entrySet()) {
            assertEquals(entry.getKey(), cache.namesById().get(entry.getValue()));
        }
        assertEquals(cache.idsByName().size(), cache.namesById().size());
        assertEquals(3, cache.size());
    }

    @Test
    void testLookups() {
        assertEquals(20L, cache.idOf("infra"));
        assertEquals("docs", cache.nameOf(30L));
        assertTrue(cache.containsName("core"));
        assertFalse(cache.containsName("Core"));
        assertEquals(List.of("core", "docs", "infra"), List.copyOf(cache.names()));
    }

    @Test
    void testUnknownName() {
        UnresolvedReferenceException e = assertThrows(UnresolvedReferenceException.class, () -> cache.idOf("nope"));
        assertEquals("Unknown team: 'nope'", e.getMessage());
    }

    @Test
    void testUnknownId() {
        assertThrows(UnresolvedReferenceException.class, () -> cache.nameOf(99L));
    }

    @Test
    void testDuplicateId() {
        assertThrows(IllegalStateException.class, () -> new NameIdCache("team", Map.of("a", 1L, "b", 1L)));
    }

    @Test
    void testImmutable() {
        assertThrows(UnsupportedOperationException.class, () -> cache.idsByName().put("x", 1L));
    }
}
