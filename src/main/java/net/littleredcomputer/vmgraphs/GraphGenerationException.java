package net.littleredcomputer.vmgraphs;

/** A graph generation run failed; {@link #stage()} tells where. */
public class GraphGenerationException extends Exception {
    public enum Stage {
        LOAD("load"),
        STRATEGY("strategy"),
        THREADS("thread validation"),
        WORKER("worker"),
        OUTPUT("file I/O");

        private final String description;

        Stage(String description) {
            this.description = description;
        }

        public String description() { return description; }
    }

    private final Stage stage;

    public GraphGenerationException(Stage stage, String message) {
        super(message);
        this.stage = stage;
    }

    public GraphGenerationException(Stage stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    public Stage stage() { return stage; }
}
