package net.littleredcomputer.vmgraphs;

import net.littleredcomputer.vmgraphs.sat.Backbone;
import net.littleredcomputer.vmgraphs.sat.BackboneSolver;
import net.littleredcomputer.vmgraphs.sat.CnfFormula;
import org.junit.Test;

import java.io.IOException;
import java.util.Collections;
import java.util.List;

import static net.littleredcomputer.vmgraphs.Fixtures.edges;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class VariableProcessorTest {
    private static VariableProcessor processAll(String fixture, String strategy, boolean filterAuxiliary)
            throws IOException {
        CnfFormula f = Fixtures.formula(fixture);
        BackboneSolver oracle = new BackboneSolver();
        oracle.load(f);
        oracle.prepare(strategy);
        Classification c = VariableClassifier.classify(oracle.globalBackbone(), f.nVariables(), f.names(), filterAuxiliary);
        VariableProcessor p = new VariableProcessor(oracle, c);
        for (int v : c.variablesToProcess()) p.process(v);
        return p;
    }

    @Test
    public void ex1() throws IOException {
        VariableProcessor p = processAll(Fixtures.EX1, "one", false);
        assertThat(p.requires(), is(edges(1, 2, 1, 3, 2, 1, 2, 3)));
        assertThat(p.excludes().isEmpty(), is(true));
    }

    @Test
    public void model() throws IOException {
        for (String strategy : new String[]{"one", "without"}) {
            VariableProcessor p = processAll(Fixtures.MODEL, strategy, false);
            assertThat(p.requires(), is(edges(3, 5, 5, 3)));
            assertThat(p.excludes(), is(edges(3, 4, 4, 5)));
        }
    }

    @Test
    public void modelWithoutAuxiliary() throws IOException {
        VariableProcessor p = processAll(Fixtures.MODEL, "one", true);
        assertThat(p.requires().isEmpty(), is(true));
        assertThat(p.excludes(), is(edges(3, 4)));
    }

    @Test
    public void deadVariableIsNotQueried() {
        // The oracle would fail on any query.
        Classification c = VariableClassifier.classify(Backbone.of(2, -1), 2,
                Collections.<Integer, List<String>>emptyMap(), false);
        VariableProcessor p = new VariableProcessor(new BackboneSolver(), c);
        p.process(1);
        assertThat(p.requires().isEmpty(), is(true));
        assertThat(p.excludes().isEmpty(), is(true));
    }

    @Test(expected = IllegalStateException.class)
    public void assumptionMissingFromBackbone() {
        BackboneSolver broken = new BackboneSolver() {
            @Override
            public Backbone backboneUnderAssumption(int literal) {
                return Backbone.of(2);
            }
        };
        Classification c = VariableClassifier.classify(Backbone.of(2), 2,
                Collections.<Integer, List<String>>emptyMap(), false);
        new VariableProcessor(broken, c).process(1);
    }
}
