package com.threadbox.backend.shared;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Splits id sets for {@code in (:ids)} statements. PostgreSQL rejects a
 * statement with more than 32767 bind parameters.
 */
public final class IdBatches {
    private IdBatches() {}

    public static final int SIZE = 1000;

    public static <T> List<List<T>> of(Collection<T> ids) {
        return of(ids, SIZE);
    }

    public static <T> List<List<T>> of(Collection<T> ids, int size) {
        if (size < 1) throw new IllegalArgumentException("Batch size must be positive: " + size);
        List<List<T>> batches = new ArrayList<>();
        List<T> current = new ArrayList<>(Math.min(size, ids.size()));
        for (T id : ids) {
            current.add(id);
            if (current.size() == size) {
                batches.add(current);
                current = new ArrayList<>(size);
            }
        }
        if (!current.isEmpty()) batches.add(current);
        return batches;
    }
}
