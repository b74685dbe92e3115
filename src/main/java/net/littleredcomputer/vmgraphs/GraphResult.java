package net.littleredcomputer.vmgraphs;

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Ints;

import java.util.Optional;

/** What a call to {@link GraphGenerator#generate} reports back to its caller. */
public final class GraphResult {
    private final boolean success;
    private final GraphGenerationException.Stage failedStage;
    private final String errorMessage;
    private final int numVariables;
    private final int numClauses;
    private final ImmutableList<Integer> globalBackbone;
    private final ImmutableList<Integer> coreFeatures;
    private final ImmutableList<Integer> deadFeatures;
    private final int requiresCount;
    private final int excludesCount;
    private final GraphFiles files;

    private GraphResult(boolean success, GraphGenerationException.Stage failedStage, String errorMessage,
                        int numVariables, int numClauses, ImmutableList<Integer> globalBackbone,
                        ImmutableList<Integer> coreFeatures, ImmutableList<Integer> deadFeatures,
                        int requiresCount, int excludesCount, GraphFiles files) {
        this.success = success;
        this.failedStage = failedStage;
        this.errorMessage = errorMessage;
        this.numVariables = numVariables;
        this.numClauses = numClauses;
        this.globalBackbone = globalBackbone;
        this.coreFeatures = coreFeatures;
        this.deadFeatures = deadFeatures;
        this.requiresCount = requiresCount;
        this.excludesCount = excludesCount;
        this.files = files;
    }

    static GraphResult success(DependencyGraph graph, GraphFiles files) {
        Classification c = graph.classification();
        return new GraphResult(true, null, "", graph.maxVariable(), graph.declaredClauses(),
                ImmutableList.copyOf(Ints.asList(c.globalBackbone().literals())),
                c.coreVariables(), c.deadVariables(),
                graph.requires().size(), graph.excludes().size(), files);
    }

    static GraphResult failure(GraphGenerationException.Stage stage, String message) {
        return new GraphResult(false, stage, message, 0, 0,
                ImmutableList.of(), ImmutableList.of(), ImmutableList.of(), 0, 0, null);
    }

    public boolean success() { return success; }

    public Optional<GraphGenerationException.Stage> failedStage() { return Optional.ofNullable(failedStage); }

    /** Empty on success. */
    public String errorMessage() { return errorMessage; }

    public int numVariables() { return numVariables; }
    public int numClauses() { return numClauses; }

    /** Backbone literals in variable order: positive for core, negative for dead variables. */
    public ImmutableList<Integer> globalBackbone() { return globalBackbone; }
    public ImmutableList<Integer> coreFeatures() { return coreFeatures; }
    public ImmutableList<Integer> deadFeatures() { return deadFeatures; }
    public int requiresCount() { return requiresCount; }
    public int excludesCount() { return excludesCount; }

    public Optional<GraphFiles> files() { return Optional.ofNullable(files); }
}
