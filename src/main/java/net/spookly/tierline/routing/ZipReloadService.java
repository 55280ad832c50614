package net.spookly.tierline.routing;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodically reloads the ZIP directory from its source.
 */
public final class ZipReloadService implements AutoCloseable {
    private final ZipDirectory directory;
    private final ZipSource source;
    private final int intervalSeconds;
    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private ScheduledFuture<?> scheduledTask;

    public ZipReloadService(ZipDirectory directory, ZipSource source, int intervalSeconds) {
        this.directory = Objects.requireNonNull(directory, "directory");
        this.source = Objects.requireNonNull(source, "source");
        this.intervalSeconds = intervalSeconds;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(threadFactory());
    }

    /**
     * Start periodic reloads; the first runs after one interval.
     */
    public synchronized void start() {
        if (stopped.get() || scheduledTask != null || intervalSeconds <= 0) {
            return;
        }
        scheduledTask = scheduler.scheduleAtFixedRate(this::runOnce, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
    }

    public synchronized void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        if (scheduledTask != null) {
            scheduledTask.cancel(false);
            scheduledTask = null;
        }
        scheduler.shutdownNow();
    }

    @Override
    public void close() {
        stop();
    }

    ZipLoadResult runOnce() {
        ZipLoadResult result = directory.reload(source);
        if (result.ok()) {
            System.out.println("ZIP data reloaded: zips=" + result.zipCount()
                    + " skipped=" + result.skippedRows() + " conflicts=" + result.conflicts());
        }
        return result;
    }

    private static ThreadFactory threadFactory() {
        return runnable -> {
            Thread thread = new Thread(runnable, "tierline-zip-reload");
            thread.setDaemon(true);
            return thread;
        };
    }
}
