package net.littleredcomputer.vmgraphs.sat;

import gnu.trove.list.array.TIntArrayList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

/**
 * A {@link BackboneOracle} built on {@link SATAlgorithmD}: a literal of some model is a
 * backbone literal iff the formula becomes unsatisfiable when that literal is negated.
 * <p>
 * Literals reached by unit propagation from the unit clauses and the assumptions are
 * backbone literals outright and cost no satisfiability check. Under
 * {@link BackboneStrategy#ONE} each check also asks the solver to flip as many of the
 * remaining candidates as it can, so that a single model rules out many of them.
 */
public class BackboneSolver implements BackboneOracle {
    private static final Logger log = LogManager.getFormatterLogger(BackboneSolver.class);
    private CnfFormula formula;
    private BackboneStrategy strategy;
    private long solverCalls = 0;
    private long solverSteps = 0;

    @Override
    public void load(Path path) throws IOException {
        load(CnfFormula.read(path));
        log.debug("loaded %s: %d variables", path, formula.nVariables());
    }

    public void load(CnfFormula formula) {
        this.formula = formula;
        this.strategy = null;
    }

    @Override
    public CnfFormula formula() {
        checkState(formula != null, "no formula loaded");
        return formula;
    }

    @Override
    public void prepare(String strategyName) {
        checkState(formula != null, "no formula loaded");
        strategy = BackboneStrategy.fromId(strategyName);
    }

    @Override
    public int maxVariable() {
        return formula().nVariables();
    }

    /** Number of satisfiability checks made by this instance so far. */
    public long solverCalls() { return solverCalls; }

    @Override
    public Backbone globalBackbone() {
        checkState(strategy != null, "backbone detector not prepared");
        boolean[] model = solve(null).orElseThrow(() -> new IllegalStateException("formula is unsatisfiable"));
        Backbone b = backbone(model);
        log.debug("global backbone of size %d after %d calls, %d steps", b.size(), solverCalls, solverSteps);
        return b;
    }

    @Override
    public Backbone backboneUnderAssumption(int literal) {
        checkState(strategy != null, "backbone detector not prepared");
        checkArgument(literal != 0 && Math.abs(literal) <= formula.nVariables(), "literal out of range: %s", literal);
        boolean[] model = solve(null, literal).orElseThrow(() ->
                new IllegalArgumentException("assumption " + literal + " contradicts the formula"));
        return backbone(model, literal);
    }

    private Optional<boolean[]> solve(boolean[] phase, int... assumptions) {
        ++solverCalls;
        SATAlgorithmD solver = new SATAlgorithmD(formula, assumptions);
        solver.setPhase(phase);
        Optional<boolean[]> model = solver.solve();
        solverSteps += solver.stepCount();
        return model;
    }

    private Backbone backbone(boolean[] model, int... assumptions) {
        final int n = formula.nVariables();
        final int[] implied = propagate(assumptions);
        TIntArrayList found = new TIntArrayList(implied);
        // candidates[v] is the literal of v still believed to be forced, or 0
        int[] candidates = new int[n + 1];
        for (int v = 1; v <= n; ++v) candidates[v] = model[v - 1] ? v : -v;
        for (int l : implied) candidates[Math.abs(l)] = 0;

        int[] probe = new int[assumptions.length + 1];
        System.arraycopy(assumptions, 0, probe, 0, assumptions.length);
        boolean[] phase = strategy == BackboneStrategy.ONE ? new boolean[n] : null;
        for (int v = 1; v <= n; ++v) {
            final int lit = candidates[v];
            if (lit == 0) continue;
            if (phase != null) {
                for (int u = 1; u <= n; ++u) phase[u - 1] = candidates[u] != 0 ? candidates[u] < 0 : model[u - 1];
            }
            probe[assumptions.length] = -lit;
            Optional<boolean[]> other = solve(phase, probe);
            if (!other.isPresent()) {
                found.add(lit);
            } else if (strategy == BackboneStrategy.ONE) {
                boolean[] o = other.get();
                for (int u = v + 1; u <= n; ++u) {
                    if (candidates[u] != 0 && o[u - 1] != (candidates[u] > 0)) candidates[u] = 0;
                }
            }
        }
        return Backbone.of(n, found.toArray());
    }

    /**
     * The assumptions together with every literal unit propagation derives from them and
     * from the unit clauses of the formula. Only called once a model is known, so the
     * propagation cannot reach a conflict.
     */
    private int[] propagate(int... assumptions) {
        int[] value = new int[formula.nVariables() + 1];
        TIntArrayList forced = new TIntArrayList();
        for (int l : assumptions) {
            value[Math.abs(l)] = Integer.signum(l);
            forced.add(l);
        }
        boolean changed = true;
        while (changed) {
            changed = false;
            CLAUSE:
            for (List<Integer> clause : formula.encodedClauses()) {
                int open = 0;
                for (int encoded : clause) {
                    int l = CnfFormula.decodeLiteral(encoded);
                    int v = value[Math.abs(l)] * Integer.signum(l);
                    if (v > 0) continue CLAUSE;
                    if (v == 0) {
                        if (open != 0) continue CLAUSE;
                        open = l;
                    }
                }
                checkState(open != 0, "unit propagation falsified a clause of a satisfiable formula");
                value[Math.abs(open)] = Integer.signum(open);
                forced.add(open);
                changed = true;
            }
        }
        return forced.toArray();
    }
}
