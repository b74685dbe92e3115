package net.littleredcomputer.vmgraphs.sat;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static java.util.stream.Collectors.collectingAndThen;
import static java.util.stream.Collectors.toList;

/**
 * A CNF formula read from a DIMACS file, together with the variable names found in
 * its comment lines ({@code c <index> <name tokens...>}).
 * <p>
 * Clauses are held in the [2n|2n+1] literal encoding of TAOCP 7.2.2.2 (57), which
 * is what the solvers in this package consume.
 */
public class CnfFormula {
    private final static Pattern pLineRe = Pattern.compile("p\\s+cnf\\s+([0-9]+)\\s+([0-9]+)\\s*");
    private final static Splitter splitter = Splitter.onPattern("\\s+").trimResults().omitEmptyStrings();
    private final int nVariables;
    private final int declaredClauses;
    private final List<List<Integer>> clauses = new ArrayList<>();
    private final SortedMap<Integer, ImmutableList<String>> names = new TreeMap<>();
    private int nLiterals = 0;
    private int parsedClauses = 0;  // includes tautologies, which addClause drops

    private CnfFormula(int nVariables, int declaredClauses) {
        if (nVariables < 1) throw new IllegalArgumentException("Must have at least one variable");
        this.nVariables = nVariables;
        this.declaredClauses = declaredClauses;
    }

    public int nVariables() {
        return nVariables;
    }

    /** The clause count announced by the {@code p cnf} header. */
    public int declaredClauses() {
        return declaredClauses;
    }

    int nClauses() {
        return clauses.size();
    }

    int nLiterals() {
        return nLiterals;
    }

    List<List<Integer>> encodedClauses() { return Collections.unmodifiableList(clauses); }

    List<Integer> getClause(int i) {
        return clauses.get(i).stream().map(CnfFormula::decodeLiteral).collect(toList());
    }

    public Optional<ImmutableList<String>> name(int variable) {
        return Optional.ofNullable(names.get(variable));
    }

    /** Name tokens of every named variable, in index order. */
    public ImmutableSortedMap<Integer, ImmutableList<String>> names() {
        return ImmutableSortedMap.copyOfSorted(names);
    }

    static int encodeLiteral(int literal) {
        return literal > 0 ? 2 * literal : -2 * literal + 1;
    }

    static int decodeLiteral(int literal) {
        int sign = ((literal & 1) == 0) ? 1 : -1;
        return sign * (literal >> 1);
    }

    /**
     * Adds a clause given in DIMACS literals. Repeated literals are collapsed and a
     * clause containing both polarities of a variable is dropped, since it is always
     * satisfied.
     */
    private void addClause(List<Integer> literals) {
        Set<Integer> seen = new LinkedHashSet<>();
        for (int l : literals) {
            if (seen.contains(-l)) return;
            seen.add(l);
        }
        List<Integer> clause = seen.stream()
                .map(CnfFormula::encodeLiteral)
                .collect(collectingAndThen(toList(), Collections::unmodifiableList));
        nLiterals += clause.size();
        clauses.add(clause);
    }

    /**
     * Evaluate the formula at the specified point
     * @param p point (i.e., vector of booleans, variable i at index i-1)
     * @return the truth value of this formula at p
     */
    public boolean evaluate(boolean[] p) {
        CLAUSE:
        for (List<Integer> clause : clauses) {
            for (int literal : clause) {
                if (p[(literal >> 1) - 1] == ((literal & 1) == 0)) continue CLAUSE;
            }
            return false;
        }
        return true;
    }

    public static CnfFormula read(Path path) throws IOException {
        try (Reader r = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return parseFrom(r);
        }
    }

    public static CnfFormula parseFrom(String s) {
        return parseFrom(new StringReader(s));
    }

    public static CnfFormula parseFrom(Reader r) {
        Iterable<String> lines = new BufferedReader(r).lines()::iterator;
        Map<Integer, ImmutableList<String>> named = new HashMap<>();
        CnfFormula f = null;
        List<Integer> literals = new ArrayList<>();
        for (String line : lines) {
            if (line.startsWith("c")) {
                nameFromComment(line).ifPresent(e -> named.put(e.getKey(), e.getValue()));
                continue;
            }
            if (line.trim().isEmpty()) continue;
            if (f == null) {
                Matcher m = pLineRe.matcher(line.trim());
                if (!m.matches()) throw new IllegalArgumentException("invalid p line: " + line);
                f = new CnfFormula(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)));
                continue;
            }
            for (String token : splitter.split(line)) {
                int l;
                try {
                    l = Integer.parseInt(token);
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("invalid literal: " + token, e);
                }
                if (l == 0) {
                    if (literals.isEmpty())
                        throw new IllegalArgumentException("Empty clause, so problem is trivially unsatisfiable");
                    f.addClause(literals);
                    ++f.parsedClauses;
                    literals.clear();
                } else {
                    if (l > f.nVariables || l < -f.nVariables) throw new IllegalArgumentException("literal out of declared bounds: " + l);
                    literals.add(l);
                }
            }
        }
        if (f == null) throw new IllegalArgumentException("Missing SAT instance data");
        if (!literals.isEmpty()) throw new IllegalArgumentException("Unterminated final clause");
        if (f.parsedClauses != f.declaredClauses) {
            throw new IllegalArgumentException("Observed clause count disagrees with DIMACS p header");
        }
        for (Map.Entry<Integer, ImmutableList<String>> e : named.entrySet()) {
            if (e.getKey() >= 1 && e.getKey() <= f.nVariables) f.names.put(e.getKey(), e.getValue());
        }
        return f;
    }

    /** Reads {@code c <index> <tokens...>}; anything else is an ordinary comment. */
    private static Optional<Map.Entry<Integer, ImmutableList<String>>> nameFromComment(String line) {
        List<String> tokens = splitter.splitToList(line.substring(1));
        if (tokens.size() < 2) return Optional.empty();
        int variable;
        try {
            variable = Integer.parseInt(tokens.get(0));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
        return Optional.of(new AbstractMap.SimpleImmutableEntry<>(variable, ImmutableList.copyOf(tokens.subList(1, tokens.size()))));
    }
}
