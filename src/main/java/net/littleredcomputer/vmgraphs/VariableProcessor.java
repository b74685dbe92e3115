package net.littleredcomputer.vmgraphs;

import net.littleredcomputer.vmgraphs.sat.Backbone;
import net.littleredcomputer.vmgraphs.sat.BackboneOracle;

/**
 * Turns the backbone under the assumption "v is true" into requires and excludes
 * edges for v. Owns its oracle and its edge buffers, so one instance must only ever
 * be used by one thread.
 */
final class VariableProcessor {
    private final BackboneOracle oracle;
    private final Classification classification;
    private final Edges requires = new Edges();
    private final Edges excludes = new Edges();

    VariableProcessor(BackboneOracle oracle, Classification classification) {
        this.oracle = oracle;
        this.classification = classification;
    }

    Edges requires() { return requires; }
    Edges excludes() { return excludes; }

    void process(int v) {
        // +v contradicts the formula, and every edge it could produce is vacuous.
        if (classification.isDead(v)) return;
        final Backbone line = oracle.backboneUnderAssumption(v);
        if (!line.forcesTrue(v)) {
            throw new IllegalStateException("backbone under assumption " + v + " does not contain " + v);
        }
        final int n = classification.maxVariable();

        // v requires i: assuming v forces i, and i is not already core.
        for (int i = 1; i <= n; ++i) {
            if (i != v && line.forcesTrue(i) && classification.isFree(i) && !classification.isAuxiliary(i)) {
                requires.add(v, i);
            }
        }
        // v excludes i: assuming v forbids i. Only i >= v, so each pair is emitted once.
        for (int i = v; i <= n; ++i) {
            if (line.forcesFalse(i) && !classification.isDead(i) && !classification.isAuxiliary(i)) {
                excludes.add(v, i);
            }
        }
    }
}
