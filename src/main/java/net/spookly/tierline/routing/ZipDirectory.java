package net.spookly.tierline.routing;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import net.spookly.tierline.tier.TierId;

/**
 * Holds the current ZIP index snapshot and swaps it atomically on reload.
 *
 * <p>The index, the last successful load time and the last load result are published together,
 * so readers never see a new snapshot next to an older load's status. A reader that fetched the
 * old snapshot keeps using it until its next lookup.
 */
public final class ZipDirectory {
    private final Clock clock;
    private final AtomicReference<State> state = new AtomicReference<>(new State(ZipIndex.empty(), null, null));

    public ZipDirectory() {
        this(Clock.systemUTC());
    }

    public ZipDirectory(Clock clock) {
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public Optional<TierId> lookup(String zip) {
        return state.get().index.lookup(zip);
    }

    public ZipIndex snapshot() {
        return state.get().index;
    }

    /**
     * Replace the snapshot with one built from already acquired rows; failures are reported,
     * never thrown.
     */
    public ZipLoadResult load(Iterable<ZipRecord> records) {
        Instant now = clock.instant();
        ZipIndex index;
        try {
            index = ZipIndex.build(records);
        } catch (RuntimeException e) {
            return recordFailure(describe(e));
        }
        ZipLoadResult result = ZipLoadResult.success(now, index);
        state.set(new State(index, now, result));
        return result;
    }

    /**
     * Pull rows from a source and load them; failures are reported, never thrown.
     */
    public ZipLoadResult reload(ZipSource source) {
        Objects.requireNonNull(source, "source");
        List<ZipRecord> records;
        try {
            records = source.fetch();
        } catch (IOException | RuntimeException e) {
            return recordFailure(describe(e));
        }
        if (records == null) {
            return recordFailure("ZIP source returned no data");
        }
        return load(records);
    }

    public Optional<Instant> lastSuccessfulLoad() {
        return Optional.ofNullable(state.get().lastSuccessfulLoad);
    }

    public Optional<ZipLoadResult> lastResult() {
        return Optional.ofNullable(state.get().lastResult);
    }

    /**
     * True when the most recent load attempt failed and routing uses an older snapshot.
     */
    public boolean isDegraded() {
        ZipLoadResult result = state.get().lastResult;
        return result != null && !result.ok();
    }

    /**
     * Consistent view of the snapshot and its load status for health reporting.
     */
    public Status status() {
        State current = state.get();
        return new Status(current.index.size(), current.lastSuccessfulLoad, current.lastResult);
    }

    private ZipLoadResult recordFailure(String error) {
        Instant now = clock.instant();
        ZipLoadResult result = state.updateAndGet(current -> new State(
                current.index,
                current.lastSuccessfulLoad,
                ZipLoadResult.failure(now, current.index.size(), error)
        )).lastResult;
        System.err.println("ZIP data unavailable, keeping previous snapshot (" + result.zipCount()
                + " zips): " + error);
        return result;
    }

    private String describe(Exception e) {
        String message = e.getMessage();
        if (message == null || message.isBlank()) {
            return e.getClass().getSimpleName();
        }
        return message;
    }

    /**
     * Snapshot size and load status read together.
     *
     * @param zipCount           ZIPs in the current snapshot
     * @param lastSuccessfulLoad time of the load that produced the snapshot, or null before any
     * @param lastResult         most recent load attempt, or null before any
     */
    public record Status(int zipCount, Instant lastSuccessfulLoad, ZipLoadResult lastResult) {
        public boolean degraded() {
            return lastResult != null && !lastResult.ok();
        }
    }

    private static final class State {
        private final ZipIndex index;
        private final Instant lastSuccessfulLoad;
        private final ZipLoadResult lastResult;

        private State(ZipIndex index, Instant lastSuccessfulLoad, ZipLoadResult lastResult) {
            this.index = index;
            this.lastSuccessfulLoad = lastSuccessfulLoad;
            this.lastResult = lastResult;
        }
    }
}
