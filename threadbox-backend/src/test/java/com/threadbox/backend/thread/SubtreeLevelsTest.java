package com.threadbox.backend.thread;

import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

class SubtreeLevelsTest {

    @Test
    void shouldPlaceNestedSeedUnderItsAncestor() {
        UUID root = UUID.randomUUID();
        UUID child = UUID.randomUUID();
        UUID grandchild = UUID.randomUUID();
        UUID leaf = UUID.randomUUID();

        // grandchild is a seed too, listed before its ancestors
        Map<UUID, UUID> parentOf = new LinkedHashMap<>();
        parentOf.put(grandchild, null);
        parentOf.put(root, null);
        parentOf.put(leaf, grandchild);
        parentOf.put(child, root);
        parentOf.put(grandchild, child);

        SubtreeLevels levels = SubtreeLevels.fromParentLinks(parentOf);

        assertEquals(4, levels.size());
        assertEquals(0, levels.depthOf(root));
        assertEquals(1, levels.depthOf(child));
        assertEquals(2, levels.depthOf(grandchild));
        assertEquals(3, levels.depthOf(leaf));
        assertEquals(
                List.of(List.of(leaf), List.of(grandchild), List.of(child), List.of(root)),
                levels.deepestFirst()
        );
    }

    @Test
    void shouldKeepSeparateRootsAtDepthZero() {
        UUID a = UUID.randomUUID();
        UUID b = UUID.randomUUID();
        Map<UUID, UUID> parentOf = new LinkedHashMap<>();
        parentOf.put(a, null);
        parentOf.put(b, UUID.randomUUID()); // parent outside the collected set

        SubtreeLevels levels = SubtreeLevels.fromParentLinks(parentOf);

        assertEquals(0, levels.depthOf(a));
        assertEquals(0, levels.depthOf(b));
        assertEquals(1, levels.deepestFirst().size());
    }

    @Test
    void shouldHandleLongChainsWithoutRecursion() {
        Map<UUID, UUID> parentOf = new LinkedHashMap<>();
        UUID parent = null;
        List<UUID> chain = new ArrayList<>();
        for (int i = 0; i < 20_000; i++) {
            UUID id = UUID.randomUUID();
            chain.add(id);
            parentOf.put(id, parent);
            parent = id;
        }

        SubtreeLevels levels = SubtreeLevels.fromParentLinks(parentOf);

        assertEquals(19_999, levels.depthOf(chain.get(chain.size() - 1)));
    }

    @Test
    void shouldRejectUnknownIds() {
        assertTrue(SubtreeLevels.empty().isEmpty());
        assertThrows(NoSuchElementException.class, () -> SubtreeLevels.empty().depthOf(UUID.randomUUID()));
    }
}
