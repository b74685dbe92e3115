package net.littleredcomputer.vmgraphs;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;

/**
 * The outcome of the analysis, before anything is written: vertex labels, the
 * classification of every variable and the merged edge lists.
 */
public final class DependencyGraph {
    private final int maxVariable;
    private final int declaredClauses;
    private final ImmutableSortedMap<Integer, ImmutableList<String>> names;
    private final Classification classification;
    private final Edges requires;
    private final Edges excludes;

    DependencyGraph(int maxVariable, int declaredClauses, ImmutableSortedMap<Integer, ImmutableList<String>> names,
                    Classification classification, Edges requires, Edges excludes) {
        this.maxVariable = maxVariable;
        this.declaredClauses = declaredClauses;
        this.names = names;
        this.classification = classification;
        this.requires = requires;
        this.excludes = excludes;
    }

    public int maxVariable() { return maxVariable; }
    public int declaredClauses() { return declaredClauses; }
    public ImmutableSortedMap<Integer, ImmutableList<String>> names() { return names; }
    public Classification classification() { return classification; }
    public Edges requires() { return requires; }
    public Edges excludes() { return excludes; }
}
