package net.littleredcomputer.vmgraphs.sat;

import java.util.List;
import java.util.Optional;
import java.util.function.IntPredicate;

/**
 * Knuth's Algorithm D (cyclic DPLL with watched literals), TAOCP 7.2.2.2. Assumptions
 * enter as unit clauses. Unit clauses are found before every branch, so the forced
 * consequences of the assumptions are settled before any free choice is made.
 * <p>
 * An optional phase picks the value tried first at each free choice; variables that
 * end up unconstrained also take their phase value.
 */
public class SATAlgorithmD extends AbstractSATSolver {
    private boolean[] phase;

    public SATAlgorithmD(CnfFormula formula, int... assumptions) {
        super("D", formula, assumptions);
    }

    /** @param phase preferred value of variable i at index i-1, or null for Knuth's rule */
    void setPhase(boolean[] phase) {
        if (phase != null && phase.length != formula.nVariables()) {
            throw new IllegalArgumentException("phase covers " + phase.length + " variables, formula has "
                    + formula.nVariables());
        }
        this.phase = phase;
    }

    @Override
    public Optional<boolean[]> solve() {
        start();
        final List<List<Integer>> clauses = clausesWithAssumptions();
        final int n = formula.nVariables();
        final int nClauses = clauses.size();
        int[] m = new int[n + 1];
        int[] x = new int[n + 1];         // -1 unset, else the value
        int[] H = new int[n + 1];         // variable set at each depth
        int[] NEXT = new int[n + 1];      // ring of unset variables that head some watch list
        int[] W = new int[2 * n + 2];     // first clause watching each literal
        int[] L = new int[literalCount(clauses)];
        int[] LINK = new int[nClauses + 1];
        int[] START = new int[nClauses + 1];

        // Clause j occupies L[START[j]] .. L[START[j-1]-1] and is watched by its first literal.
        int c = 0;
        for (int j = nClauses; j >= 1; --j) {
            List<Integer> clause = clauses.get(j - 1);
            START[j] = c;
            LINK[j] = W[clause.get(0)];
            W[clause.get(0)] = j;
            for (int l : clause) L[c++] = l;
        }
        START[0] = L.length;

        int head = 0;
        int tail = 0;
        for (int k = n; k > 0; --k) {
            x[k] = -1;
            if (W[2 * k] != 0 || W[2 * k + 1] != 0) {
                NEXT[k] = head;
                head = k;
                if (tail == 0) tail = k;
            }
            if (tail != 0) NEXT[tail] = head;
        }

        // l is forced true if some clause it watches has every other literal false.
        IntPredicate forced = l -> {
            for (int j = W[l]; j != 0; j = LINK[j]) {
                int p = START[j] + 1;
                while (p != START[j - 1] && x[L[p] >> 1] == (L[p] & 1)) ++p;
                if (p == START[j - 1]) return true;
            }
            return false;
        };

        int d = 0;
        int k = 0;
        int state = 2;
        while (true) {
            ++stepCount;
            if (stepCount % logCheckSteps == 0) maybeReportProgress(m);
            switch (state) {
                case 2:  // Success?
                    if (tail == 0) return Optional.of(assignment(x));
                    k = tail;
                case 3: {  // Look for unit clauses.
                    head = NEXT[k];
                    int f = (forced.test(2 * head) ? 1 : 0) + (forced.test(2 * head + 1) ? 2 : 0);
                    if (f == 3) {
                        state = 7;
                        continue;
                    }
                    if (f != 0) {
                        m[d + 1] = f + 3;
                        tail = k;
                        state = 5;
                        continue;
                    }
                    if (head != tail) {
                        k = head;
                        state = 3;
                        continue;
                    }
                    // Two-way branch.
                    head = NEXT[tail];
                    m[d + 1] = firstTry(head, W);
                }
                case 5:  // Move on.
                    ++d;
                    H[d] = k = head;
                    if (tail == k) {
                        tail = 0;
                    } else {
                        NEXT[tail] = head = NEXT[k];
                    }
                case 6: {  // Update watches: every clause watching the now false literal finds another.
                    int b = (m[d] + 1) % 2;
                    x[k] = b;
                    int l = 2 * k + b;
                    int j = W[l];
                    W[l] = 0;
                    while (j != 0) {
                        int next = LINK[j];
                        int i = START[j];
                        int p = i + 1;
                        while (x[L[p] >> 1] == (L[p] & 1)) ++p;
                        int ll = L[p];
                        L[p] = l;
                        L[i] = ll;
                        int v = ll >> 1;
                        if (W[ll] == 0 && W[ll ^ 1] == 0 && x[v] < 0) {
                            // v starts heading a watch list, so it joins the ring.
                            if (tail == 0) {
                                tail = head = v;
                                NEXT[tail] = head;
                            } else {
                                NEXT[v] = head;
                                head = v;
                                NEXT[tail] = head;
                            }
                        }
                        LINK[j] = W[ll];
                        W[ll] = j;
                        j = next;
                    }
                    state = 2;
                    continue;
                }
                case 7:  // Backtrack.
                    tail = k;
                    while (m[d] >= 2) {
                        k = H[d];
                        x[k] = -1;
                        if (W[2 * k] != 0 || W[2 * k + 1] != 0) {
                            NEXT[k] = head;
                            head = k;
                            NEXT[tail] = head;
                        }
                        --d;
                    }
                case 8:  // Failure?
                    if (d > 0) {
                        m[d] = 3 - m[d];
                        k = H[d];
                        state = 6;
                        continue;
                    }
                    return Optional.empty();
                default:
                    throw new IllegalStateException("unknown state " + state);
            }
        }
    }

    /** Move code for a free choice of v: 0 tries true first, 1 tries false first. */
    private int firstTry(int v, int[] W) {
        if (phase != null) return phase[v - 1] ? 0 : 1;
        return (W[2 * v] == 0 || W[2 * v + 1] != 0) ? 1 : 0;
    }

    private boolean[] assignment(int[] x) {
        boolean[] solution = new boolean[formula.nVariables()];
        for (int v = 1; v < x.length; ++v) {
            solution[v - 1] = x[v] < 0 ? phase != null && phase[v - 1] : x[v] == 1;
        }
        return solution;
    }
}
