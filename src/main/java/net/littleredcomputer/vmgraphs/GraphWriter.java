package net.littleredcomputer.vmgraphs;

import com.google.common.collect.ImmutableList;
import com.google.common.io.MoreFiles;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Renders a {@link DependencyGraph} as two Pajek {@code .net} files and two feature
 * lists. Only named, non-auxiliary variables get a label line.
 */
public final class GraphWriter {
    private static final Logger log = LogManager.getFormatterLogger(GraphWriter.class);

    private GraphWriter() {}

    public static GraphFiles write(DependencyGraph graph, Path directory, String basename)
            throws GraphGenerationException {
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new GraphGenerationException(GraphGenerationException.Stage.OUTPUT,
                    "Could not create output directory: " + directory + " - " + e.getMessage(), e);
        }
        GraphFiles files = new GraphFiles(directory, basename);
        String vertices = vertexBlock(graph);
        List<Path> written = new ArrayList<>();
        try {
            save(files.core(), featureList(graph, Classification.VariableClass.CORE), written);
            save(files.dead(), featureList(graph, Classification.VariableClass.DEAD), written);
            save(files.requires(), network(graph, vertices, "*Arcs", graph.requires()), written);
            save(files.excludes(), network(graph, vertices, "*Edges", graph.excludes()), written);
        } catch (GraphGenerationException e) {
            discard(written);
            throw e;
        }
        return files;
    }

    private static void save(Path file, String content, List<Path> written) throws GraphGenerationException {
        log.info("Saving to %s", file);
        try {
            MoreFiles.asCharSink(file, UTF_8).write(content);
            written.add(file);
        } catch (IOException e) {
            // a partially written file goes too
            if (Files.isRegularFile(file)) written.add(file);
            throw new GraphGenerationException(GraphGenerationException.Stage.OUTPUT,
                    "Could not create output file: " + file + " - " + e.getMessage(), e);
        }
    }

    private static void discard(List<Path> written) {
        for (Path p : written) {
            try {
                Files.deleteIfExists(p);
            } catch (IOException e) {
                log.warn("could not remove incomplete output %s: %s", p, e.getMessage());
            }
        }
    }

    /** One {@code v "tok" "tok"...} line per labelled variable, in index order. */
    static String vertexBlock(DependencyGraph graph) {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<Integer, ImmutableList<String>> e : graph.names().entrySet()) {
            if (graph.classification().isAuxiliary(e.getKey())) continue;
            appendLabel(sb, e.getKey(), e.getValue());
        }
        return sb.toString();
    }

    static String featureList(DependencyGraph graph, Classification.VariableClass c) {
        StringBuilder sb = new StringBuilder();
        Classification classification = graph.classification();
        for (Map.Entry<Integer, ImmutableList<String>> e : graph.names().entrySet()) {
            int v = e.getKey();
            if (classification.isAuxiliary(v) || classification.classOf(v) != c) continue;
            appendLabel(sb, v, e.getValue());
        }
        return sb.toString();
    }

    static String network(DependencyGraph graph, String vertices, String section, Edges edges) {
        StringBuilder sb = new StringBuilder();
        sb.append("*Vertices ").append(graph.maxVariable()).append('\n');
        sb.append(vertices);
        sb.append(section).append('\n');
        for (int i = 0; i < edges.size(); ++i) {
            sb.append(edges.from(i)).append(' ').append(edges.to(i)).append('\n');
        }
        sb.append('\n');
        return sb.toString();
    }

    private static void appendLabel(StringBuilder sb, int v, List<String> tokens) {
        sb.append(v);
        for (String t : tokens) sb.append(" \"").append(t).append('"');
        sb.append('\n');
    }
}
