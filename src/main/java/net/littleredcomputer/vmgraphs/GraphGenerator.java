package net.littleredcomputer.vmgraphs;

import com.google.common.collect.ImmutableList;
import com.google.common.io.MoreFiles;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import net.littleredcomputer.vmgraphs.GraphGenerationException.Stage;
import net.littleredcomputer.vmgraphs.sat.Backbone;
import net.littleredcomputer.vmgraphs.sat.BackboneOracle;
import net.littleredcomputer.vmgraphs.sat.BackboneSolver;
import net.littleredcomputer.vmgraphs.sat.CnfFormula;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Builds the requires and excludes graphs of a CNF formula.
 * <p>
 * Backbone oracles are not thread-safe, not even while loading. The generator
 * therefore creates and initializes one oracle per worker, sequentially on the
 * calling thread, before any worker starts; each worker then uses only its own
 * oracle and its own edge buffers. The buffers are merged in worker order once all
 * workers have finished, so the output does not depend on thread timing.
 * <p>
 * A generator holds no per-run state and may be reused.
 */
public class GraphGenerator {
    private static final Logger log = LogManager.getFormatterLogger(GraphGenerator.class);
    static final long POLL_MILLIS = 100;
    private final Supplier<? extends BackboneOracle> oracles;
    private final int availableProcessors;

    public GraphGenerator() {
        this(BackboneSolver::new, Runtime.getRuntime().availableProcessors());
    }

    /**
     * @param oracles creates a fresh, unloaded oracle on each call
     * @param availableProcessors upper bound for the requested thread count
     */
    public GraphGenerator(Supplier<? extends BackboneOracle> oracles, int availableProcessors) {
        this.oracles = oracles;
        this.availableProcessors = availableProcessors;
    }

    /**
     * Runs the analysis and writes the four output files. Never throws for a failed
     * run: the failure is described by the result.
     */
    public GraphResult generate(GraphOptions options) {
        try {
            DependencyGraph graph = analyze(options);
            Path input = resolveInput(options.input());
            Path directory = options.outputDirectory().orElseGet(() -> directoryOf(input));
            GraphFiles files = GraphWriter.write(graph, directory, MoreFiles.getNameWithoutExtension(input));
            log.info("Done!");
            return GraphResult.success(graph, files);
        } catch (GraphGenerationException e) {
            log.error("%s failed: %s", e.stage().description(), e.getMessage());
            return GraphResult.failure(e.stage(), e.getMessage());
        }
    }

    /** Runs the analysis without writing anything. */
    public DependencyGraph analyze(GraphOptions options) throws GraphGenerationException {
        return new Run(options).execute();
    }

    /** {@code path} itself, or {@code path.dimacs} if only that exists. */
    static Path resolveInput(Path path) {
        if (!Files.exists(path)) {
            Path withExtension = Paths.get(path + ".dimacs");
            if (Files.exists(withExtension)) return withExtension;
        }
        return path;
    }

    private static Path directoryOf(Path input) {
        Path parent = input.toAbsolutePath().getParent();
        return parent != null ? parent : Paths.get(".");
    }

    /** The state of one call to {@link #analyze}. */
    private final class Run {
        private final GraphOptions options;
        private final Path input;
        private Phase phase = Phase.IDLE;

        Run(GraphOptions options) {
            this.options = options;
            this.input = resolveInput(options.input());
        }

        private void enter(Phase next) {
            log.debug("%s -> %s", phase, next);
            phase = next;
        }

        DependencyGraph execute() throws GraphGenerationException {
            try {
                return phases();
            } catch (GraphGenerationException e) {
                log.debug("%s -> %s", phase, Phase.FAILED);
                phase = Phase.FAILED;
                throw e;
            }
        }

        private DependencyGraph phases() throws GraphGenerationException {
            BackboneOracle primary = oracles.get();
            CnfFormula formula;
            try {
                primary.load(input);
                formula = primary.formula();
            } catch (IOException | IllegalArgumentException e) {
                throw new GraphGenerationException(Stage.LOAD, "The input formula " + input
                        + " could not be loaded. Please check that it conforms to the DIMACS CNF format and is accessible: "
                        + e.getMessage(), e);
            }
            log.info("Loaded formula: %s", input);
            enter(Phase.LOADED);

            try {
                primary.prepare(options.detector());
            } catch (IllegalArgumentException | IllegalStateException e) {
                throw new GraphGenerationException(Stage.STRATEGY,
                        "Failed to create backbone detector: " + options.detector() + " - " + e.getMessage(), e);
            }
            final int n = primary.maxVariable();
            log.info("Detected %d variables and %d clauses...", n, formula.declaredClauses());
            log.info("Computing core and dead features...");
            Backbone global;
            try {
                global = primary.globalBackbone();
            } catch (IllegalStateException e) {
                throw new GraphGenerationException(Stage.LOAD,
                        "The input formula " + input + " cannot be analysed: " + e.getMessage(), e);
            }
            Classification classification =
                    VariableClassifier.classify(global, n, formula.names(), options.filterAuxiliary());
            if (options.filterAuxiliary()) {
                log.info("Filtering %d auxiliary (%s*) variables", classification.auxiliaryCount(),
                        VariableClassifier.AUXILIARY_PREFIX);
            }
            enter(Phase.CLASSIFIED);

            WorkPartitioner.validateThreadCount(options.threads(), availableProcessors);
            final int[] variables = classification.variablesToProcess();
            ImmutableList<WorkRange> ranges = WorkPartitioner.partition(variables.length, options.threads());
            log.info("Processing %d variables with %d threads", variables.length, ranges.size());
            enter(Phase.PARTITIONED);

            enter(Phase.INITIALIZING);
            List<BackboneOracle> instances = new ArrayList<>(ranges.size());
            for (int t = 0; t < ranges.size(); ++t) {
                instances.add(t == 0 ? primary : initialize(t));
            }

            enter(Phase.RUNNING);
            List<GraphWorker> workers = new ArrayList<>(ranges.size());
            AtomicInteger progress = new AtomicInteger();
            for (int t = 0; t < ranges.size(); ++t) {
                workers.add(new GraphWorker(t, ranges.get(t), variables,
                        new VariableProcessor(instances.get(t), classification), progress));
            }
            runAll(workers, progress, variables.length);

            enter(Phase.MERGING);
            for (GraphWorker w : workers) {
                if (w.failure().isPresent()) throw new GraphGenerationException(Stage.WORKER, w.failure().get());
            }
            Edges requires = new Edges();
            Edges excludes = new Edges();
            for (GraphWorker w : workers) {
                requires.addAll(w.requires());
                excludes.addAll(w.excludes());
            }
            log.info("Found %d requires and %d excludes edges", requires.size(), excludes.size());
            enter(Phase.DONE);
            return new DependencyGraph(n, formula.declaredClauses(), formula.names(), classification, requires, excludes);
        }

        private BackboneOracle initialize(int t) throws GraphGenerationException {
            BackboneOracle oracle = oracles.get();
            try {
                oracle.load(input);
            } catch (IOException | IllegalArgumentException e) {
                throw new GraphGenerationException(Stage.LOAD,
                        "Failed to load DIMACS for worker " + t + ": " + e.getMessage(), e);
            }
            try {
                oracle.prepare(options.detector());
            } catch (IllegalArgumentException | IllegalStateException e) {
                throw new GraphGenerationException(Stage.STRATEGY,
                        "Failed to create detector for worker " + t + ": " + e.getMessage(), e);
            }
            return oracle;
        }

        private void runAll(List<GraphWorker> workers, AtomicInteger progress, int total)
                throws GraphGenerationException {
            if (workers.isEmpty()) return;
            ExecutorService pool = Executors.newFixedThreadPool(workers.size(),
                    new ThreadFactoryBuilder().setNameFormat("graph-worker-%d").setDaemon(true).build());
            ProgressReporter reporter = new ProgressReporter(total, options.logInterval());
            try {
                List<Future<?>> futures = new ArrayList<>(workers.size());
                for (GraphWorker w : workers) futures.add(pool.submit(w));
                pool.shutdown();
                while (!futures.stream().allMatch(Future::isDone)) {
                    reporter.maybeReport(progress.get());
                    Thread.sleep(POLL_MILLIS);
                }
                for (int t = 0; t < futures.size(); ++t) {
                    try {
                        futures.get(t).get();
                    } catch (ExecutionException e) {
                        workers.get(t).fail("Worker " + t + " failed: " + e.getCause());
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new GraphGenerationException(Stage.WORKER, "Interrupted while waiting for workers", e);
            } finally {
                pool.shutdownNow();
            }
            reporter.finish(progress.get());
        }
    }
}
