package com.t2aassist.engine.snapshot;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide reference to the current {@link DataSnapshot}.
 *
 * Readers call {@link #current()} once per query and keep using that snapshot;
 * a reload publishes a new one with a single reference swap.
 */
public class SnapshotHolder {

    private final AtomicReference<DataSnapshot> current = new AtomicReference<>(DataSnapshot.empty());

    public DataSnapshot current() {
        return current.get();
    }

    /**
     * Replace the current snapshot.
     *
     * @return the snapshot that was replaced
     */
    public DataSnapshot publish(DataSnapshot snapshot) {
        if (snapshot == null) {
            throw new IllegalArgumentException("snapshot must not be null");
        }
        return current.getAndSet(snapshot);
    }
}
