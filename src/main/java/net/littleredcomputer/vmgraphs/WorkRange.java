package net.littleredcomputer.vmgraphs;

import com.google.common.base.Objects;

/** A half-open range [start, end) of positions in the list of variables to process. */
public final class WorkRange {
    private final int start;
    private final int end;

    WorkRange(int start, int end) {
        this.start = start;
        this.end = end;
    }

    public int start() { return start; }
    public int end() { return end; }
    public int size() { return end - start; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WorkRange)) return false;
        WorkRange r = (WorkRange) o;
        return start == r.start && end == r.end;
    }

    @Override
    public int hashCode() { return Objects.hashCode(start, end); }

    @Override
    public String toString() { return "[" + start + ", " + end + ")"; }
}
