package net.littleredcomputer.vmgraphs;

import com.google.common.base.Stopwatch;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.time.Instant;

/** Logs the number of processed variables, at most once per interval. */
final class ProgressReporter {
    private static final Logger log = LogManager.getFormatterLogger(ProgressReporter.class);
    private final int total;
    private final Duration logInterval;
    private final Stopwatch stopwatch = Stopwatch.createStarted();
    private Instant lastLogTime = Instant.EPOCH;
    private int lastCompleted = -1;

    ProgressReporter(int total, Duration logInterval) {
        this.total = total;
        this.logInterval = logInterval;
    }

    void maybeReport(int completed) {
        Instant now = Instant.now();
        if (completed == lastCompleted || Duration.between(lastLogTime, now).compareTo(logInterval) < 0) return;
        log.info("Progress: %d of %d variables (%s)", completed, total, stopwatch);
        lastLogTime = now;
        lastCompleted = completed;
    }

    void finish(int completed) {
        stopwatch.stop();
        log.info("Progress: %d of %d variables in %s", completed, total, stopwatch);
    }
}
