package net.littleredcomputer.vmgraphs;

import gnu.trove.list.array.TIntArrayList;

/**
 * An append-only list of (from, to) vertex pairs in emission order. Not thread-safe;
 * each worker fills its own.
 */
public final class Edges {
    private final TIntArrayList ends = new TIntArrayList();

    public void add(int from, int to) {
        ends.add(from);
        ends.add(to);
    }

    public void addAll(Edges other) {
        ends.addAll(other.ends);
    }

    public int size() { return ends.size() / 2; }

    public boolean isEmpty() { return ends.isEmpty(); }

    public int from(int i) { return ends.get(2 * i); }

    public int to(int i) { return ends.get(2 * i + 1); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Edges)) return false;
        return ends.equals(((Edges) o).ends);
    }

    @Override
    public int hashCode() { return ends.hashCode(); }

    @Override
    public String toString() {
        StringBuilder s = new StringBuilder("[");
        for (int i = 0; i < size(); ++i) {
            if (i > 0) s.append(", ");
            s.append(from(i)).append("->").append(to(i));
        }
        return s.append(']').toString();
    }
}
