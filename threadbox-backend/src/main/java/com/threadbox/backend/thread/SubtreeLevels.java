package com.threadbox.backend.thread;

import java.util.*;

/**
 * Every message reachable from a set of seed messages, with its depth inside
 * the forest they form. A seed that is itself a descendant of another seed is
 * placed under that seed, so {@link #deepestFirst()} always lists a child
 * before its parent.
 */
public final class SubtreeLevels {

    private final Map<UUID, Integer> depths;

    SubtreeLevels(Map<UUID, Integer> depths) {
        this.depths = Collections.unmodifiableMap(depths);
    }

    public static SubtreeLevels empty() {
        return new SubtreeLevels(new LinkedHashMap<>());
    }

    /**
     * @param parentOf every collected node mapped to its parent id; the parent is
     *                 null or outside the key set for the forest roots
     */
    public static SubtreeLevels fromParentLinks(Map<UUID, UUID> parentOf) {
        Map<UUID, Integer> depths = new LinkedHashMap<>();
        Deque<UUID> chain = new ArrayDeque<>();
        for (UUID node : parentOf.keySet()) {
            UUID current = node;
            while (current != null && !depths.containsKey(current)) {
                chain.push(current);
                UUID parent = parentOf.get(current);
                current = parentOf.containsKey(parent) ? parent : null;
            }
            int depth = current == null ? -1 : depths.get(current);
            while (!chain.isEmpty()) {
                depth++;
                depths.put(chain.pop(), depth);
            }
        }
        return new SubtreeLevels(depths);
    }

    public Set<UUID> ids() {
        return depths.keySet();
    }

    public int size() {
        return depths.size();
    }

    public boolean isEmpty() {
        return depths.isEmpty();
    }

    public int depthOf(UUID id) {
        Integer depth = depths.get(id);
        if (depth == null) throw new NoSuchElementException("Not in subtree: " + id);
        return depth;
    }

    public List<List<UUID>> deepestFirst() {
        TreeMap<Integer, List<UUID>> byDepth = new TreeMap<>(Comparator.reverseOrder());
        depths.forEach((id, depth) -> byDepth.computeIfAbsent(depth, d -> new ArrayList<>()).add(id));
        return new ArrayList<>(byDepth.values());
    }
}
