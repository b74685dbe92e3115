package net.littleredcomputer.vmgraphs;

import java.nio.file.Path;

/** The four files written for one input formula. */
public final class GraphFiles {
    static final String REQUIRES_SUFFIX = "__requires.net";
    static final String EXCLUDES_SUFFIX = "__excludes.net";
    static final String CORE_SUFFIX = "__core.txt";
    static final String DEAD_SUFFIX = "__dead.txt";

    private final Path requires;
    private final Path excludes;
    private final Path core;
    private final Path dead;

    GraphFiles(Path directory, String basename) {
        this.requires = directory.resolve(basename + REQUIRES_SUFFIX);
        this.excludes = directory.resolve(basename + EXCLUDES_SUFFIX);
        this.core = directory.resolve(basename + CORE_SUFFIX);
        this.dead = directory.resolve(basename + DEAD_SUFFIX);
    }

    public Path requires() { return requires; }
    public Path excludes() { return excludes; }
    public Path core() { return core; }
    public Path dead() { return dead; }
}
