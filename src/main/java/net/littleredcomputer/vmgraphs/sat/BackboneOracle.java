package net.littleredcomputer.vmgraphs.sat;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Computes backbones of a CNF formula, optionally under one assumed literal.
 * <p>
 * An oracle must be loaded and prepared before it is queried. Once prepared it may be
 * queried any number of times; queries do not change the loaded formula. Oracles are
 * <em>not</em> thread-safe, including during {@link #load} and {@link #prepare}: every
 * thread needs its own, fully initialized instance.
 */
public interface BackboneOracle {
    /**
     * Reads a DIMACS CNF file.
     * @throws IOException if the file cannot be read
     * @throws IllegalArgumentException if the file is not valid DIMACS CNF
     */
    void load(Path path) throws IOException;

    /**
     * Selects the backbone detection strategy.
     * @throws IllegalArgumentException if the strategy name is unknown
     * @throws IllegalStateException if no formula has been loaded
     */
    void prepare(String strategyName);

    /**
     * The loaded formula, with its variable names.
     * @throws IllegalStateException if no formula has been loaded
     */
    CnfFormula formula();

    /** The highest variable index of the loaded formula. */
    int maxVariable();

    /**
     * @throws IllegalStateException if the oracle is not prepared or the formula is unsatisfiable
     */
    Backbone globalBackbone();

    /**
     * The backbone of the formula with {@code literal} temporarily asserted. The result
     * always contains {@code literal}.
     * @throws IllegalArgumentException if the literal is out of range or contradicts the formula
     * @throws IllegalStateException if the oracle is not prepared
     */
    Backbone backboneUnderAssumption(int literal);
}
