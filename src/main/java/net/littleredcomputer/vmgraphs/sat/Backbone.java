package net.littleredcomputer.vmgraphs.sat;

import com.google.common.base.Joiner;
import com.google.common.primitives.Ints;
import gnu.trove.list.array.TIntArrayList;

import java.util.Arrays;

/**
 * The literals forced in every satisfying assignment of a formula, held as a dense
 * table indexed by variable: {@code literalOf(v)} is {@code v}, {@code -v} or 0.
 */
public final class Backbone {
    private final int[] line;

    private Backbone(int[] line) {
        this.line = line;
    }

    /**
     * @throws IllegalArgumentException if a literal is 0 or exceeds {@code maxVariable}
     * @throws IllegalStateException if some variable occurs with both polarities
     */
    public static Backbone of(int maxVariable, int... literals) {
        int[] line = new int[maxVariable + 1];
        for (int lit : literals) {
            int var = Math.abs(lit);
            if (lit == 0 || var > maxVariable) throw new IllegalArgumentException("literal out of range: " + lit);
            if (line[var] == -lit) {
                throw new IllegalStateException("backbone contains both polarities of variable " + var);
            }
            line[var] = lit;
        }
        return new Backbone(line);
    }

    public int maxVariable() { return line.length - 1; }

    public int literalOf(int variable) { return line[variable]; }

    public boolean forcesTrue(int variable) { return line[variable] == variable; }

    public boolean forcesFalse(int variable) { return line[variable] == -variable; }

    public boolean isForced(int variable) { return line[variable] != 0; }

    /** The backbone literals in increasing variable order. */
    public int[] literals() {
        TIntArrayList ls = new TIntArrayList();
        for (int v = 1; v < line.length; ++v) if (line[v] != 0) ls.add(line[v]);
        return ls.toArray();
    }

    public int size() {
        int n = 0;
        for (int v = 1; v < line.length; ++v) if (line[v] != 0) ++n;
        return n;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Backbone)) return false;
        return Arrays.equals(line, ((Backbone) o).line);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(line);
    }

    @Override
    public String toString() {
        return "{" + Joiner.on(' ').join(Ints.asList(literals())) + "}";
    }
}
