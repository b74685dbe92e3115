package net.littleredcomputer.vmgraphs.sat;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.FormattedMessage;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * A solver for one satisfiability question: the formula together with a list of
 * assumed literals, each of which behaves like an extra unit clause. Solvers are
 * single-use and not thread-safe.
 */
public abstract class AbstractSATSolver {
    private static final Logger log = LogManager.getFormatterLogger(AbstractSATSolver.class);
    final int logCheckSteps = 10000;
    final CnfFormula formula;
    final ImmutableList<Integer> assumptions;
    long stepCount;
    private long lastStepCount;
    private final String name;
    private final Duration logInterval = Duration.ofMillis(1000);
    private Instant lastLogTime = Instant.EPOCH;
    private final Stopwatch stopwatch = Stopwatch.createUnstarted();

    AbstractSATSolver(String name, CnfFormula formula, int... assumptions) {
        this.name = name;
        this.formula = formula;
        ImmutableList.Builder<Integer> b = ImmutableList.builder();
        for (int l : assumptions) {
            if (l == 0 || Math.abs(l) > formula.nVariables()) {
                throw new IllegalArgumentException("assumption out of bounds: " + l);
            }
            b.add(l);
        }
        this.assumptions = b.build();
    }

    void start() {
        if (!stopwatch.isRunning()) stopwatch.start();
        lastLogTime = Instant.now();
        lastStepCount = stepCount;
    }

    /** The formula's clauses followed by one unit clause per assumption, all encoded. */
    List<List<Integer>> clausesWithAssumptions() {
        List<List<Integer>> clauses = new ArrayList<>(formula.encodedClauses());
        for (int l : assumptions) clauses.add(ImmutableList.of(CnfFormula.encodeLiteral(l)));
        return clauses;
    }

    static int literalCount(List<List<Integer>> clauses) {
        int n = 0;
        for (List<Integer> c : clauses) n += c.size();
        return n;
    }

    Optional<boolean[]> solutionFromSteps(int[] steps) {
        // Success: convert the move notation into a satisfying assignment.
        boolean[] solution = new boolean[formula.nVariables()];
        for (int i = 1; i < steps.length; ++i) solution[i - 1] = (steps[i] & 1) == 0;
        return Optional.of(solution);
    }

    private final static int initialStateSegment = 81;
    private final static int finalStateSegment = 16;
    private String stateToString(int[] state) {
        StringBuilder s = new StringBuilder();
        if (state.length > 100) {
            for (int i = 0; i < initialStateSegment; ++i)  s.append(state[i]);
            s.append("...");
            for (int i = state.length-finalStateSegment; i < state.length; ++i) s.append(state[i]);
        } else {
            for (int aState : state) s.append(aState);
        }
        return s.toString();
    }

    void maybeReportProgress(Supplier<String> s) {
        Instant now = Instant.now();

        Duration tween = Duration.between(lastLogTime, now);
        if (tween.compareTo(logInterval) < 0) return;
        final double perSec = 1e3 * (stepCount - lastStepCount) / Math.max(1, tween.toMillis());
        log.debug(() -> new FormattedMessage("%s %d steps %s %.0f/sec %s", name, stepCount, stopwatch, perSec, s.get()));
        lastLogTime = now;
        lastStepCount = stepCount;
    }

    void maybeReportProgress(int[] m) {
        maybeReportProgress(() -> stateToString(m));
    }

    public long stepCount() { return stepCount; }

    /**
     * @return a satisfying assignment (variable i at index i-1) that agrees with every
     * assumption, or empty if there is none
     */
    public abstract Optional<boolean[]> solve();
}
