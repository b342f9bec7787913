package org.janelia.reconstruction.util;

import com.google.common.base.Stopwatch;

import java.util.concurrent.TimeUnit;

/**
 * Monotonic timer for stage timings, lap timings and throttled progress logging.
 */
public class ProcessTimer {

    /** Minimum time between progress log messages for long streams. */
    public static final long PROGRESS_INTERVAL_MILLISECONDS = 5000;

    private final Stopwatch stopwatch;
    private long lastProgressMilliseconds;
    private long lastLapMilliseconds;

    public ProcessTimer() {
        this.stopwatch = Stopwatch.createStarted();
        this.lastProgressMilliseconds = 0;
        this.lastLapMilliseconds = 0;
    }

    /**
     * @return true at most once per {@link #PROGRESS_INTERVAL_MILLISECONDS}.
     */
    public boolean hasIntervalPassed() {
        final long now = getElapsedMilliseconds();
        final boolean hasPassed = (now - lastProgressMilliseconds) > PROGRESS_INTERVAL_MILLISECONDS;
        if (hasPassed) {
            lastProgressMilliseconds = now;
        }
        return hasPassed;
    }

    /**
     * @return milliseconds since the previous lap (or since construction for the first lap).
     */
    public long lap() {
        final long now = getElapsedMilliseconds();
        final long lapMilliseconds = now - lastLapMilliseconds;
        lastLapMilliseconds = now;
        return lapMilliseconds;
    }

    public long getElapsedMilliseconds() {
        return stopwatch.elapsed(TimeUnit.MILLISECONDS);
    }

    @Override
    public String toString() {
        final long elapsed = getElapsedMilliseconds();
        final long minutes = TimeUnit.MILLISECONDS.toMinutes(elapsed);
        final long seconds = TimeUnit.MILLISECONDS.toSeconds(elapsed) % 60;
        return String.format("%d minutes, %d.%03d seconds", minutes, seconds, elapsed % 1000);
    }
}
