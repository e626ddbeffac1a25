package com.ryuqq.autocycle.testkit.store;

import com.ryuqq.autocycle.core.health.HealthSnapshot;
import com.ryuqq.autocycle.core.spi.PersistenceException;
import com.ryuqq.autocycle.core.spi.StatusStore;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory implementation of StatusStore for testing purposes.
 *
 * <p>Holds only the latest snapshot. Writes can be made to fail on demand
 * to exercise the fatal persistence path of the supervisor.</p>
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public class InMemoryStatusStore implements StatusStore {

    private final AtomicReference<HealthSnapshot> latest = new AtomicReference<>();
    private final AtomicInteger writes = new AtomicInteger();
    private final AtomicBoolean failWrites = new AtomicBoolean(false);
    private final AtomicBoolean failPrepare = new AtomicBoolean(false);

    @Override
    public void prepare() {
        if (failPrepare.get()) {
            throw new PersistenceException("status storage unavailable (simulated)");
        }
    }

    @Override
    public void write(HealthSnapshot snapshot) {
        if (snapshot == null) {
            throw new IllegalArgumentException("snapshot cannot be null");
        }
        if (failWrites.get()) {
            throw new PersistenceException("status write failed (simulated)");
        }
        latest.set(snapshot);
        writes.incrementAndGet();
    }

    @Override
    public Optional<HealthSnapshot> read() {
        return Optional.ofNullable(latest.get());
    }

    /**
     * Makes subsequent writes throw {@link PersistenceException}.
     */
    public void failWrites(boolean fail) {
        failWrites.set(fail);
    }

    /**
     * Makes {@link #prepare()} throw {@link PersistenceException}.
     */
    public void failPrepare(boolean fail) {
        failPrepare.set(fail);
    }

    public int writeCount() {
        return writes.get();
    }

    public void clear() {
        latest.set(null);
        writes.set(0);
        failWrites.set(false);
        failPrepare.set(false);
    }
}
