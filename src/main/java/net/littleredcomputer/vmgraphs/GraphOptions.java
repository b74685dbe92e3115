package net.littleredcomputer.vmgraphs;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Settings for one graph generation run. Thread counts are not checked here: an
 * invalid count is reported by the run itself, as a thread validation failure.
 */
public final class GraphOptions {
    public static final String DEFAULT_DETECTOR = "one";

    private final Path input;
    private final Path outputDirectory;
    private final String detector;
    private final int threads;
    private final boolean filterAuxiliary;
    private final Duration logInterval;

    private GraphOptions(Builder b) {
        this.input = b.input;
        this.outputDirectory = b.outputDirectory;
        this.detector = b.detector;
        this.threads = b.threads;
        this.filterAuxiliary = b.filterAuxiliary;
        this.logInterval = b.logInterval;
    }

    public static Builder builder(Path input) {
        return new Builder(input);
    }

    public Path input() { return input; }

    /** Where to write the output files; the input file's directory when absent. */
    public Optional<Path> outputDirectory() { return Optional.ofNullable(outputDirectory); }

    public String detector() { return detector; }

    public int threads() { return threads; }

    public boolean filterAuxiliary() { return filterAuxiliary; }

    public Duration logInterval() { return logInterval; }

    public static final class Builder {
        private final Path input;
        private Path outputDirectory;
        private String detector = DEFAULT_DETECTOR;
        private int threads = 1;
        private boolean filterAuxiliary = false;
        private Duration logInterval = Duration.ofSeconds(1);

        private Builder(Path input) {
            this.input = checkNotNull(input, "input");
        }

        public Builder outputDirectory(Path dir) {
            this.outputDirectory = dir;
            return this;
        }

        public Builder detector(String detector) {
            this.detector = checkNotNull(detector, "detector");
            return this;
        }

        public Builder threads(int threads) {
            this.threads = threads;
            return this;
        }

        public Builder filterAuxiliary(boolean filter) {
            this.filterAuxiliary = filter;
            return this;
        }

        public Builder logInterval(Duration interval) {
            checkArgument(!interval.isNegative(), "negative log interval: %s", interval);
            this.logInterval = interval;
            return this;
        }

        public GraphOptions build() {
            return new GraphOptions(this);
        }
    }
}
