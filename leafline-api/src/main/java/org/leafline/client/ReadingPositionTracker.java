package org.leafline.client;

import lombok.extern.slf4j.Slf4j;
import org.leafline.model.dto.ReadingProgress;
import org.leafline.model.dto.request.ReadingProgressRequest;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Turns a stream of navigation events into a small number of persisted progress saves.
 * <p>
 * Navigation only updates in-memory state. Three timers drive persistence: a debounce that
 * coalesces bursts of navigation into one save, a periodic flush that records read time
 * during idle reading, and the last-chance flush issued from {@link #onHidden()} and
 * {@link #close()}. The displayed percentage is published at most once per display interval.
 * <p>
 * Once a local navigation has happened, server progress passed to
 * {@link #applyServerProgress(ReadingProgress)} is ignored.
 * <p>
 * All state changes go through the tracker's monitor. Sink calls are made outside it, so
 * saves may complete out of order; the server keeps whichever arrives last.
 */
@Slf4j
public class ReadingPositionTracker implements AutoCloseable {

    public static final Duration DEFAULT_DEBOUNCE = Duration.ofSeconds(2);
    public static final Duration DEFAULT_DISPLAY_INTERVAL = Duration.ofSeconds(1);
    public static final Duration DEFAULT_FLUSH_INTERVAL = Duration.ofSeconds(30);

    private final Long bookId;
    private final ProgressSink sink;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;
    private final Consumer<Float> displayListener;
    private final Duration debounce;
    private final Duration displayInterval;
    private final Duration flushInterval;

    private float percentage;
    private Float displayPercentage;
    private String currentLocation;
    private boolean hasLocalUpdate;
    private boolean closed;
    private Instant lastSaveAt;

    private ScheduledFuture<?> debounceTask;
    private ScheduledFuture<?> displayTask;
    private ScheduledFuture<?> flushTask;

    public ReadingPositionTracker(Long bookId, ProgressSink sink, ScheduledExecutorService scheduler, Clock clock,
                                  Consumer<Float> displayListener) {
        this(bookId, sink, scheduler, clock, displayListener, DEFAULT_DEBOUNCE, DEFAULT_DISPLAY_INTERVAL, DEFAULT_FLUSH_INTERVAL);
    }

    public ReadingPositionTracker(Long bookId, ProgressSink sink, ScheduledExecutorService scheduler, Clock clock,
                                  Consumer<Float> displayListener, Duration debounce, Duration displayInterval,
                                  Duration flushInterval) {
        this.bookId = bookId;
        this.sink = sink;
        this.scheduler = scheduler;
        this.clock = clock;
        this.displayListener = displayListener != null ? displayListener : p -> { };
        this.debounce = debounce;
        this.displayInterval = displayInterval;
        this.flushInterval = flushInterval;
        this.lastSaveAt = clock.instant();
    }

    /** Starts the periodic read-time flush. */
    public synchronized void start() {
        if (closed || flushTask != null) {
            return;
        }
        long period = flushInterval.toMillis();
        flushTask = scheduler.scheduleAtFixedRate(this::periodicFlush, period, period, TimeUnit.MILLISECONDS);
    }

    public synchronized void onNavigate(float newPercentage, String location) {
        if (closed) {
            return;
        }
        percentage = clampPercentage(newPercentage);
        if (location != null) {
            currentLocation = location;
        }
        hasLocalUpdate = true;

        if (debounceTask != null) {
            debounceTask.cancel(false);
        }
        debounceTask = scheduler.schedule(this::debouncedSave, debounce.toMillis(), TimeUnit.MILLISECONDS);

        if (displayTask == null) {
            displayTask = scheduler.schedule(this::publishDisplay, displayInterval.toMillis(), TimeUnit.MILLISECONDS);
        }
    }

    /**
     * Seeds the tracker with progress loaded from the server. Returns {@code false} when the
     * value was ignored because local navigation already happened.
     */
    public synchronized boolean applyServerProgress(ReadingProgress progress) {
        if (closed || progress == null || hasLocalUpdate) {
            return false;
        }
        percentage = progress.getPercentage() == null ? 0f : clampPercentage(progress.getPercentage());
        currentLocation = progress.getCurrentLocation();
        displayPercentage = percentage;
        displayListener.accept(percentage);
        return true;
    }

    /** Last-chance flush when the reader goes to the background. */
    public void onHidden() {
        ReadingProgressRequest request;
        synchronized (this) {
            if (closed) {
                return;
            }
            cancel(debounceTask);
            debounceTask = null;
            request = snapshot();
        }
        if (request != null) {
            sink.saveAsync(request);
        }
    }

    @Override
    public void close() {
        ReadingProgressRequest request;
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            cancel(debounceTask);
            cancel(displayTask);
            cancel(flushTask);
            debounceTask = null;
            displayTask = null;
            flushTask = null;
            request = snapshot();
        }
        if (request != null) {
            sink.saveAsync(request);
        }
    }

    public synchronized float getPercentage() {
        return percentage;
    }

    public synchronized Float getDisplayPercentage() {
        return displayPercentage;
    }

    public synchronized String getCurrentLocation() {
        return currentLocation;
    }

    public synchronized boolean hasLocalUpdate() {
        return hasLocalUpdate;
    }

    void debouncedSave() {
        ReadingProgressRequest request;
        synchronized (this) {
            if (closed) {
                return;
            }
            request = snapshot();
        }
        send(request);
    }

    void periodicFlush() {
        ReadingProgressRequest request;
        synchronized (this) {
            if (closed || percentage <= 0f) {
                return;
            }
            request = snapshot();
        }
        send(request);
    }

    synchronized void publishDisplay() {
        displayTask = null;
        if (closed) {
            return;
        }
        displayPercentage = percentage;
        displayListener.accept(percentage);
    }

    private void send(ReadingProgressRequest request) {
        if (request == null) {
            return;
        }
        try {
            sink.save(request);
        } catch (RuntimeException e) {
            log.warn("Failed to save reading progress for book {}: {}", bookId, e.getMessage());
        }
    }

    /** Builds the next save and restarts read-time accounting. Caller holds the monitor. */
    private ReadingProgressRequest snapshot() {
        if (currentLocation == null && percentage <= 0f) {
            return null;
        }
        Instant now = clock.instant();
        long readSeconds = Math.max(0L, Duration.between(lastSaveAt, now).getSeconds());
        lastSaveAt = now;
        return ReadingProgressRequest.builder()
                .bookId(bookId)
                .currentLocation(currentLocation)
                .percentage(percentage)
                .readTimeDelta(readSeconds)
                .build();
    }

    private static void cancel(ScheduledFuture<?> task) {
        if (task != null) {
            task.cancel(false);
        }
    }

    private static float clampPercentage(float value) {
        if (Float.isNaN(value)) {
            return 0f;
        }
        return Math.max(0f, Math.min(100f, value));
    }
}
