package net.littleredcomputer.vmgraphs;

import com.google.common.collect.ImmutableList;
import gnu.trove.list.array.TIntArrayList;
import net.littleredcomputer.vmgraphs.sat.Backbone;

/**
 * Read-only per-variable facts shared by all workers: whether each variable is core,
 * dead or free in the global backbone, and whether it is auxiliary.
 */
public final class Classification {
    public enum VariableClass { CORE, DEAD, FREE }

    private final Backbone global;
    private final boolean[] auxiliary;

    Classification(Backbone global, boolean[] auxiliary) {
        this.global = global;
        this.auxiliary = auxiliary;
    }

    public int maxVariable() { return global.maxVariable(); }

    public Backbone globalBackbone() { return global; }

    public boolean isCore(int v) { return global.forcesTrue(v); }
    public boolean isDead(int v) { return global.forcesFalse(v); }
    public boolean isFree(int v) { return !global.isForced(v); }
    public boolean isAuxiliary(int v) { return auxiliary[v]; }

    public VariableClass classOf(int v) {
        if (isCore(v)) return VariableClass.CORE;
        if (isDead(v)) return VariableClass.DEAD;
        return VariableClass.FREE;
    }

    /** Every non-auxiliary variable, in increasing order. */
    public int[] variablesToProcess() {
        TIntArrayList vs = new TIntArrayList(maxVariable());
        for (int v = 1; v <= maxVariable(); ++v) if (!auxiliary[v]) vs.add(v);
        return vs.toArray();
    }

    public int auxiliaryCount() {
        int n = 0;
        for (int v = 1; v <= maxVariable(); ++v) if (auxiliary[v]) ++n;
        return n;
    }

    public ImmutableList<Integer> coreVariables() { return collect(VariableClass.CORE); }
    public ImmutableList<Integer> deadVariables() { return collect(VariableClass.DEAD); }

    private ImmutableList<Integer> collect(VariableClass c) {
        ImmutableList.Builder<Integer> b = ImmutableList.builder();
        for (int v = 1; v <= maxVariable(); ++v) if (classOf(v) == c) b.add(v);
        return b.build();
    }
}
