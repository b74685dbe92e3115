package net.littleredcomputer.vmgraphs.sat;

import java.util.Arrays;
import java.util.stream.Collectors;

/** The ways {@link BackboneSolver} can decide which model literals are backbone literals. */
public enum BackboneStrategy {
    /**
     * Test the candidates one by one; every model found along the way removes the
     * candidates it disagrees with.
     */
    ONE("one"),
    /**
     * Test every literal of the first model on its own, ignoring later models. Literals
     * found by unit propagation are still taken without a test.
     */
    WITHOUT("without");

    private final String id;

    BackboneStrategy(String id) {
        this.id = id;
    }

    public String id() { return id; }

    public static BackboneStrategy fromId(String id) {
        for (BackboneStrategy s : values()) {
            if (s.id.equals(id)) return s;
        }
        throw new IllegalArgumentException("Unknown backbone detector: " + id + " (expected one of "
                + Arrays.stream(values()).map(BackboneStrategy::id).collect(Collectors.joining(", ")) + ")");
    }
}
