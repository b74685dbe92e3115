package net.littleredcomputer.vmgraphs;

import com.google.common.io.Resources;
import net.littleredcomputer.vmgraphs.sat.CnfFormula;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static java.nio.charset.StandardCharsets.UTF_8;

/** Test formulas kept under src/test/resources. */
final class Fixtures {
    static final String EX1 = "ex1.dimacs";
    static final String MODEL = "model.dimacs";
    static final String UNSAT = "unsat.dimacs";
    static final String MALFORMED = "malformed.cnf";

    private Fixtures() {}

    static String text(String name) throws IOException {
        return Resources.toString(Resources.getResource(name), UTF_8);
    }

    static CnfFormula formula(String name) throws IOException {
        return CnfFormula.parseFrom(text(name));
    }

    /** Copies a fixture into the folder and returns its path there. */
    static Path copy(TemporaryFolder folder, String name) throws IOException {
        Path p = folder.getRoot().toPath().resolve(name);
        Files.write(p, text(name).getBytes(UTF_8));
        return p;
    }

    static String read(Path p) throws IOException {
        return new String(Files.readAllBytes(p), UTF_8);
    }

    static Edges edges(int... pairs) {
        Edges e = new Edges();
        for (int i = 0; i < pairs.length; i += 2) e.add(pairs[i], pairs[i + 1]);
        return e;
    }
}
