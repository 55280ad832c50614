package net.spookly.tierline.outcome;

import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.CopyOnWriteArrayList;

import net.spookly.tierline.routing.ZipIndex;
import net.spookly.tierline.tier.TierId;

/**
 * Bounded call history plus running aggregates.
 *
 * <p>The history append and the aggregate update happen under one lock, so a snapshot never
 * sees one without the other. Evicted history entries stay counted in the aggregates.
 */
public final class OutcomeRecorder {
    public static final int DEFAULT_CAPACITY = 10_000;
    /**
     * {@code byZip} key shared by every record whose ZIP is not a valid five digit code.
     */
    public static final String INVALID_ZIP_KEY = "invalid";

    private final Object lock = new Object();
    private final int capacity;
    private final ZoneId reportingZone;
    private final List<CallRecordListener> listeners = new CopyOnWriteArrayList<>();

    private final Deque<CallRecord> history = new ArrayDeque<>();
    private long total;
    private long success;
    private long failure;
    private long unrouted;
    private long fallbackCount;
    private long totalResponseTimeMs;
    private final Map<CallStatus, Long> byStatus = new EnumMap<>(CallStatus.class);
    private final Map<TierId, Long> byTier = new EnumMap<>(TierId.class);
    private final Map<Integer, Long> byHour = new HashMap<>();
    private final Map<String, Long> byZip = new HashMap<>();

    public OutcomeRecorder() {
        this(DEFAULT_CAPACITY, ZoneOffset.UTC);
    }

    public OutcomeRecorder(int capacity, ZoneId reportingZone) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("history capacity must be greater than 0");
        }
        this.capacity = capacity;
        this.reportingZone = reportingZone == null ? ZoneOffset.UTC : reportingZone;
    }

    public void addListener(CallRecordListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    /**
     * Append a finalized record and fold it into the aggregates.
     */
    public void record(CallRecord entry) {
        Objects.requireNonNull(entry, "entry");
        Objects.requireNonNull(entry.status(), "entry.status");
        Objects.requireNonNull(entry.timestamp(), "entry.timestamp");
        synchronized (lock) {
            if (history.size() >= capacity) {
                history.removeFirst();
            }
            history.addLast(entry);
            fold(entry);
        }
        for (CallRecordListener listener : listeners) {
            try {
                listener.onRecord(entry);
            } catch (RuntimeException e) {
                System.err.println("Call record listener failed: " + e.getMessage());
            }
        }
    }

    public AnalyticsSnapshot snapshotAnalytics() {
        synchronized (lock) {
            return new AnalyticsSnapshot(
                    total,
                    success,
                    failure,
                    unrouted,
                    fallbackCount,
                    totalResponseTimeMs,
                    history.size(),
                    Collections.unmodifiableMap(new EnumMap<>(byStatus)),
                    Collections.unmodifiableMap(new EnumMap<>(byTier)),
                    Collections.unmodifiableMap(new TreeMap<>(byHour)),
                    Collections.unmodifiableMap(new HashMap<>(byZip))
            );
        }
    }

    /**
     * Up to {@code n} most recent records, newest first.
     */
    public List<CallRecord> recentHistory(int n) {
        if (n <= 0) {
            return List.of();
        }
        synchronized (lock) {
            List<CallRecord> recent = new ArrayList<>(Math.min(n, history.size()));
            Iterator<CallRecord> iterator = history.descendingIterator();
            while (iterator.hasNext() && recent.size() < n) {
                recent.add(iterator.next());
            }
            return Collections.unmodifiableList(recent);
        }
    }

    public int capacity() {
        return capacity;
    }

    private void fold(CallRecord entry) {
        total++;
        CallStatus status = entry.status();
        if (status == CallStatus.SUCCESS) {
            success++;
        } else if (status == CallStatus.NO_TIER) {
            unrouted++;
        } else if (status.isFailure()) {
            failure++;
        }
        if (entry.fallbackUsed()) {
            fallbackCount++;
        }
        totalResponseTimeMs += Math.max(entry.responseTimeMs(), 0L);
        byStatus.merge(status, 1L, Long::sum);
        if (entry.chosenTier() != null) {
            byTier.merge(entry.chosenTier(), 1L, Long::sum);
        }
        byHour.merge(entry.timestamp().atZone(reportingZone).getHour(), 1L, Long::sum);
        byZip.merge(ZipIndex.normalizeZip(entry.zipCode()).orElse(INVALID_ZIP_KEY), 1L, Long::sum);
    }
}
