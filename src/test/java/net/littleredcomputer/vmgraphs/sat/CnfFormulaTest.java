package net.littleredcomputer.vmgraphs.sat;

import com.google.common.collect.ImmutableList;
import org.junit.Test;

import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

import static com.github.npathai.hamcrestopt.OptionalMatchers.isEmpty;
import static com.github.npathai.hamcrestopt.OptionalMatchers.isPresentAndIs;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class CnfFormulaTest {
    static CnfFormula fromResource(String name) {
        return CnfFormula.parseFrom(new InputStreamReader(
                CnfFormulaTest.class.getClassLoader().getResourceAsStream(name), StandardCharsets.UTF_8));
    }

    @Test
    public void simple() {
        CnfFormula f = CnfFormula.parseFrom("c simple test\nc heh\np cnf 3 2\n1 -3 0\n2 3 -1 0");
        assertThat(f.nVariables(), is(3));
        assertThat(f.declaredClauses(), is(2));
        assertThat(f.getClause(0), is(ImmutableList.of(1, -3)));
        assertThat(f.getClause(1), is(ImmutableList.of(2, 3, -1)));
        assertThat(f.names().isEmpty(), is(true));
    }

    @Test
    public void clausesMaySpanLines() {
        CnfFormula f = CnfFormula.parseFrom("p cnf 4 3\n1 2\n-3 0 2 3 -4 0\n\n4 0\n");
        assertThat(f.nClauses(), is(3));
        assertThat(f.getClause(0), is(ImmutableList.of(1, 2, -3)));
        assertThat(f.getClause(2), is(ImmutableList.of(4)));
    }

    @Test
    public void namesFromComments() {
        CnfFormula f = fromResource("model.dimacs");
        assertThat(f.nVariables(), is(6));
        assertThat(f.declaredClauses(), is(6));
        assertThat(f.name(1), isPresentAndIs(ImmutableList.of("Root")));
        assertThat(f.name(2), isPresentAndIs(ImmutableList.of("Legacy", "Support")));
        assertThat(f.name(5), isPresentAndIs(ImmutableList.of("aux_1")));
        assertThat(f.name(7), isEmpty());
        assertThat(f.names().keySet().asList(), is(ImmutableList.of(1, 2, 3, 4, 5, 6)));
    }

    @Test
    public void laterNameWins() {
        CnfFormula f = CnfFormula.parseFrom("c 1 First\nc 1 Second Name\np cnf 1 1\n1 0");
        assertThat(f.name(1), isPresentAndIs(ImmutableList.of("Second", "Name")));
    }

    @Test
    public void namesOutsideTheFormulaAreIgnored() {
        CnfFormula f = CnfFormula.parseFrom("c 0 Zero\nc 3 Three\nc 2\nc x y\np cnf 2 1\n1 2 0");
        assertThat(f.names().isEmpty(), is(true));
    }

    @Test
    public void tautologyIsDropped() {
        CnfFormula f = CnfFormula.parseFrom("p cnf 2 2\n1 -1 2 0\n2 0");
        assertThat(f.declaredClauses(), is(2));
        assertThat(f.nClauses(), is(1));
    }

    @Test
    public void repeatedLiteralsCollapse() {
        CnfFormula f = CnfFormula.parseFrom("p cnf 2 1\n1 2 1 0");
        assertThat(f.nLiterals(), is(2));
        assertThat(f.getClause(0), is(ImmutableList.of(1, 2)));
    }

    @Test
    public void evaluate() {
        CnfFormula f = fromResource("ex1.dimacs");
        assertThat(f.evaluate(new boolean[]{true, true, true}), is(true));
        assertThat(f.evaluate(new boolean[]{false, false, false}), is(true));
        assertThat(f.evaluate(new boolean[]{true, false, true}), is(false));
        assertThat(f.evaluate(new boolean[]{true, true, false}), is(false));
    }

    @Test(expected = IllegalArgumentException.class)
    public void invalidHeader() {
        CnfFormula.parseFrom("p dnf 3 1\n1 0");
    }

    @Test(expected = IllegalArgumentException.class)
    public void missingHeader() {
        CnfFormula.parseFrom("c nothing here\n");
    }

    @Test(expected = IllegalArgumentException.class)
    public void noVariables() {
        CnfFormula.parseFrom("p cnf 0 0\n");
    }

    @Test(expected = IllegalArgumentException.class)
    public void emptyClauseThrows() {
        CnfFormula.parseFrom("c empty clause\np cnf 3 3\n1 2 3 0 0 1 2 0");
    }

    @Test(expected = IllegalArgumentException.class)
    public void literalOutOfBounds() {
        CnfFormula.parseFrom("c oob literal\np cnf 3 2\n1 2 3 0\n2 3 4 0");
    }

    @Test(expected = IllegalArgumentException.class)
    public void invalidLiteral() {
        CnfFormula.parseFrom("p cnf 3 1\n1 x 0");
    }

    @Test(expected = IllegalArgumentException.class)
    public void tooManyClauses() {
        CnfFormula.parseFrom("c oob clause\np cnf 3 2\n1 2 3 0\n2 3 -1 0\n-2 -3 0");
    }

    @Test(expected = IllegalArgumentException.class)
    public void tooFewClauses() {
        CnfFormula.parseFrom("p cnf 3 2\n1 2 3 0");
    }

    @Test(expected = IllegalArgumentException.class)
    public void danglingClause() {
        CnfFormula.parseFrom("c unclosed clause\np cnf 3 2\n1 2 3 0\n2 3 -1 0\n-2 -3");
    }
}
