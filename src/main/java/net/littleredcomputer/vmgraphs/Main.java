package net.littleredcomputer.vmgraphs;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.format.DateTimeParseException;

public class Main {
    static final int EXIT_USAGE = 1;
    static final int EXIT_FAILURE = 2;

    private static Options options() {
        return new Options()
                .addOption("input", true, "DIMACS CNF file (the .dimacs extension may be omitted)")
                .addOption("output", true, "output directory (default: directory of the input file)")
                .addOption("detector", true, "backbone detector: one (default) or without")
                .addOption("threads", true, "number of worker threads (default: 1)")
                .addOption("filteraux", false, "leave out aux_* variables introduced by CNF transformations")
                .addOption("loginterval", true, "interval between progress log entries in ISO-8601 format");
    }

    private static void usage(PrintStream err) {
        err.println("Generate requires/excludes graphs from a satisfiable CNF formula.");
        PrintWriter pw = new PrintWriter(err);
        new HelpFormatter().printHelp(pw, HelpFormatter.DEFAULT_WIDTH, "vmgraphs -input <file>", null,
                options(), HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, null);
        pw.flush();
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        GraphOptions graphOptions;
        try {
            CommandLine cmd = new DefaultParser().parse(options(), args);
            if (!cmd.hasOption("input")) throw new IllegalArgumentException("Must specify -input");
            GraphOptions.Builder b = GraphOptions.builder(Paths.get(cmd.getOptionValue("input")))
                    .detector(cmd.getOptionValue("detector", GraphOptions.DEFAULT_DETECTOR))
                    .threads(Integer.parseInt(cmd.getOptionValue("threads", "1")))
                    .filterAuxiliary(cmd.hasOption("filteraux"))
                    .logInterval(Duration.parse(cmd.getOptionValue("loginterval", "PT1S")));
            if (cmd.hasOption("output")) b.outputDirectory(Paths.get(cmd.getOptionValue("output")));
            graphOptions = b.build();
        } catch (ParseException | IllegalArgumentException | DateTimeParseException e) {
            err.println("Error: " + e.getMessage());
            usage(err);
            return EXIT_USAGE;
        }

        GraphResult result = new GraphGenerator().generate(graphOptions);
        if (!result.success()) {
            err.println("Error: " + result.errorMessage());
            return EXIT_FAILURE;
        }
        out.printf("variables %d clauses %d%n", result.numVariables(), result.numClauses());
        out.printf("core %d dead %d%n", result.coreFeatures().size(), result.deadFeatures().size());
        out.printf("requires %d excludes %d%n", result.requiresCount(), result.excludesCount());
        result.files().ifPresent(f -> {
            out.println(f.requires());
            out.println(f.excludes());
            out.println(f.core());
            out.println(f.dead());
        });
        return 0;
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }
}
