package net.littleredcomputer.vmgraphs;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Processes one contiguous range of the variables to process. A fault is caught and
 * recorded here instead of escaping to the thread pool; the coordinator inspects
 * {@link #failure()} after all workers have finished.
 */
final class GraphWorker implements Runnable {
    private static final Logger log = LogManager.getFormatterLogger(GraphWorker.class);
    private final int id;
    private final WorkRange range;
    private final int[] variables;
    private final VariableProcessor processor;
    private final AtomicInteger progress;
    private String failure;

    GraphWorker(int id, WorkRange range, int[] variables, VariableProcessor processor, AtomicInteger progress) {
        this.id = id;
        this.range = range;
        this.variables = variables;
        this.processor = processor;
        this.progress = progress;
    }

    @Override
    public void run() {
        log.debug("worker %d: positions %s", id, range);
        int v = 0;
        try {
            for (int idx = range.start(); idx < range.end(); ++idx) {
                v = variables[idx];
                processor.process(v);
                progress.incrementAndGet();
            }
        } catch (RuntimeException e) {
            failure = String.format("Worker %d failed on variable %d: %s", id, v, e.getMessage());
            log.error("%s", failure, e);
        }
    }

    Optional<String> failure() { return Optional.ofNullable(failure); }

    void fail(String message) { failure = message; }

    Edges requires() { return processor.requires(); }
    Edges excludes() { return processor.excludes(); }
}
