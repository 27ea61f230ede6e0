package org.covidwatch.scheduler;

import org.covidwatch.model.Snapshot;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The currently published snapshot. Written only by the scheduler, read lock-free by queries;
 * a new snapshot replaces the old one by reference.
 */
public final class SnapshotHolder {

    private final AtomicReference<Snapshot> current = new AtomicReference<>();

    public Optional<Snapshot> current() {
        return Optional.ofNullable(current.get());
    }

    /** @return the snapshot that was replaced, or {@code null} */
    public Snapshot publish(Snapshot snapshot) {
        if (snapshot == null) {
            throw new IllegalArgumentException("snapshot");
        }
        return current.getAndSet(snapshot);
    }
}
