package net.littleredcomputer.vmgraphs;

import net.littleredcomputer.vmgraphs.sat.Backbone;
import net.littleredcomputer.vmgraphs.sat.CnfFormula;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static net.littleredcomputer.vmgraphs.Fixtures.edges;
import static net.littleredcomputer.vmgraphs.Fixtures.read;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.fail;

public class GraphWriterTest {
    @Rule public TemporaryFolder folder = new TemporaryFolder();

    private static DependencyGraph ex1() throws IOException {
        CnfFormula f = Fixtures.formula(Fixtures.EX1);
        Classification c = VariableClassifier.classify(Backbone.of(3), 3, f.names(), false);
        return new DependencyGraph(3, 3, f.names(), c, edges(1, 2, 1, 3, 2, 1, 2, 3), new Edges());
    }

    private static DependencyGraph model(boolean filterAuxiliary) throws IOException {
        CnfFormula f = Fixtures.formula(Fixtures.MODEL);
        Classification c = VariableClassifier.classify(Backbone.of(6, 1, -2), 6, f.names(), filterAuxiliary);
        return new DependencyGraph(6, 6, f.names(), c, new Edges(), edges(3, 4));
    }

    @Test
    public void vertexBlock() throws IOException {
        assertThat(GraphWriter.vertexBlock(ex1()), is("1 \"A\"\n2 \"B\"\n3 \"C\"\n"));
        assertThat(GraphWriter.vertexBlock(model(false)),
                is("1 \"Root\"\n2 \"Legacy\" \"Support\"\n3 \"Fast\"\n4 \"Safe\"\n5 \"aux_1\"\n6 \"Logging\"\n"));
        assertThat(GraphWriter.vertexBlock(model(true)),
                is("1 \"Root\"\n2 \"Legacy\" \"Support\"\n3 \"Fast\"\n4 \"Safe\"\n6 \"Logging\"\n"));
    }

    @Test
    public void unnamedVariablesHaveNoLabel() {
        CnfFormula f = CnfFormula.parseFrom("c 2 Middle\np cnf 3 1\n1 2 3 0");
        Classification c = VariableClassifier.classify(Backbone.of(3), 3, f.names(), false);
        DependencyGraph g = new DependencyGraph(3, 1, f.names(), c, edges(1, 3), new Edges());
        assertThat(GraphWriter.network(g, GraphWriter.vertexBlock(g), "*Arcs", g.requires()),
                is("*Vertices 3\n2 \"Middle\"\n*Arcs\n1 3\n\n"));
    }

    @Test
    public void featureLists() throws IOException {
        DependencyGraph g = model(true);
        assertThat(GraphWriter.featureList(g, Classification.VariableClass.CORE), is("1 \"Root\"\n"));
        assertThat(GraphWriter.featureList(g, Classification.VariableClass.DEAD), is("2 \"Legacy\" \"Support\"\n"));
        assertThat(GraphWriter.featureList(ex1(), Classification.VariableClass.CORE), is(""));
    }

    @Test
    public void write() throws IOException, GraphGenerationException {
        Path dir = folder.getRoot().toPath();
        GraphFiles files = GraphWriter.write(ex1(), dir, "ex1");
        assertThat(files.requires(), is(dir.resolve("ex1__requires.net")));
        assertThat(read(files.requires()), is("*Vertices 3\n1 \"A\"\n2 \"B\"\n3 \"C\"\n*Arcs\n1 2\n1 3\n2 1\n2 3\n\n"));
        assertThat(read(files.excludes()), is("*Vertices 3\n1 \"A\"\n2 \"B\"\n3 \"C\"\n*Edges\n\n"));
        assertThat(read(files.core()), is(""));
        assertThat(read(files.dead()), is(""));
    }

    @Test
    public void createsDirectory() throws IOException, GraphGenerationException {
        Path dir = folder.getRoot().toPath().resolve("a").resolve("b");
        GraphFiles files = GraphWriter.write(model(true), dir, "model");
        assertThat(read(files.excludes()), is("*Vertices 6\n1 \"Root\"\n2 \"Legacy\" \"Support\"\n3 \"Fast\"\n"
                + "4 \"Safe\"\n6 \"Logging\"\n*Edges\n3 4\n\n"));
        assertThat(read(files.core()), is("1 \"Root\"\n"));
    }

    @Test
    public void directoryIsAFile() throws IOException {
        Path file = folder.newFile("taken").toPath();
        try {
            GraphWriter.write(ex1(), file, "ex1");
            fail();
        } catch (GraphGenerationException e) {
            assertThat(e.stage(), is(GraphGenerationException.Stage.OUTPUT));
        }
    }

    @Test
    public void failureRemovesWrittenFiles() throws IOException {
        Path dir = folder.getRoot().toPath();
        // The dead list comes second; a directory in its place makes that write fail.
        Path blocker = Files.createDirectory(dir.resolve("ex1" + GraphFiles.DEAD_SUFFIX));
        Files.createFile(blocker.resolve("keep"));
        try {
            GraphWriter.write(ex1(), dir, "ex1");
            fail();
        } catch (GraphGenerationException e) {
            assertThat(e.stage(), is(GraphGenerationException.Stage.OUTPUT));
        }
        assertThat(Files.exists(dir.resolve("ex1" + GraphFiles.CORE_SUFFIX)), is(false));
        assertThat(Files.exists(dir.resolve("ex1" + GraphFiles.REQUIRES_SUFFIX)), is(false));
        assertThat(Files.isDirectory(blocker), is(true));
    }
}
