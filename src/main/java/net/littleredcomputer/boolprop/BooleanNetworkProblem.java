package net.littleredcomputer.boolprop;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import net.littleredcomputer.boolprop.atoms.AtLeastKTrigger;
import net.littleredcomputer.boolprop.atoms.AtMostKGuard;
import net.littleredcomputer.boolprop.atoms.AtomIndex;
import net.littleredcomputer.boolprop.atoms.AtomStore;
import net.littleredcomputer.boolprop.atoms.BooleanRelations;
import net.littleredcomputer.boolprop.solver.Contradiction;
import net.littleredcomputer.boolprop.solver.DepthFirstSearch;
import net.littleredcomputer.boolprop.solver.IntVar;
import net.littleredcomputer.boolprop.solver.Solver;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.Reader;
import java.io.StringReader;
import java.time.Duration;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * A set of boolean variables related by equalities, orderings, negations and
 * aggregate (at-most-K, at-least-K-then) constraints. Literals are non-zero integers:
 * {@code v} names variable v (counting from 1) and {@code -v} its negation.
 */
public class BooleanNetworkProblem {
    private static final Logger log = LogManager.getFormatterLogger(BooleanNetworkProblem.class);
    private final static Pattern pLineRe = Pattern.compile("p\\s+bnet\\s+([0-9]+)\\s+([0-9]+)\\s*");
    private final static Splitter splitter = Splitter.on(' ').trimResults().omitEmptyStrings();
    private final static Joiner spaceJoiner = Joiner.on(' ');
    private final int nVariables;
    private final List<Relation> relations = new ArrayList<>();

    public BooleanNetworkProblem(int nVariables) {
        if (nVariables < 1) throw new IllegalArgumentException("Must have at least one variable");
        this.nVariables = nVariables;
    }

    public int nVariables() {
        return nVariables;
    }

    public int nRelations() {
        return relations.size();
    }

    private abstract static class Relation {
        /** Add this relation to the network under construction. */
        abstract void install(Network n);

        /** Evaluate this relation at the point p. */
        abstract boolean holds(boolean[] p);
    }

    /** The solver-side image of a problem: one boolean variable per problem variable. */
    private class Network {
        final Solver solver = new Solver();
        final AtomStore store = new AtomStore(solver);
        final List<IntVar> x = new ArrayList<>(nVariables);

        Network() {
            for (int i = 1; i <= nVariables; ++i) x.add(solver.makeBoolVar("x" + i));
        }

        IntVar var(int literal) {
            IntVar v = x.get(Math.abs(literal) - 1);
            return literal > 0 ? v : solver.makeNot(v);
        }

        AtomIndex atom(int literal) {
            return store.atomFor(x.get(Math.abs(literal) - 1), literal < 0);
        }

        void require(boolean installed) {
            if (!installed) throw new IllegalStateException("relation operands are not boolean");
        }

        List<AtomIndex> atoms(int[] literals) {
            return Arrays.stream(literals).mapToObj(this::atom).collect(Collectors.toList());
        }
    }

    private static boolean value(boolean[] p, int literal) {
        return literal > 0 ? p[literal - 1] : !p[-literal - 1];
    }

    private static int countTrue(boolean[] p, int[] literals) {
        int c = 0;
        for (int l : literals) if (value(p, l)) ++c;
        return c;
    }

    private void checkLiteral(int literal) {
        if (literal == 0) throw new IllegalArgumentException("0 is not a literal");
        if (literal > nVariables || literal < -nVariables) throw new IllegalArgumentException("literal out of declared bounds: " + literal);
    }

    private void checkDistinct(int[] literals) {
        Set<Integer> seen = new HashSet<>();
        for (int l : literals) {
            checkLiteral(l);
            if (!seen.add(l)) throw new IllegalArgumentException("literal repeated: " + l);
        }
    }

    public BooleanNetworkProblem addEq(int a, int b) {
        checkLiteral(a);
        checkLiteral(b);
        relations.add(new Relation() {
            @Override void install(Network n) { n.require(BooleanRelations.addBoolEq(n.store, n.var(a), n.var(b))); }
            @Override boolean holds(boolean[] p) { return value(p, a) == value(p, b); }
            @Override public String toString() { return "eq " + a + " " + b; }
        });
        return this;
    }

    public BooleanNetworkProblem addLe(int a, int b) {
        checkLiteral(a);
        checkLiteral(b);
        relations.add(new Relation() {
            @Override void install(Network n) { n.require(BooleanRelations.addBoolLe(n.store, n.var(a), n.var(b))); }
            @Override boolean holds(boolean[] p) { return !value(p, a) || value(p, b); }
            @Override public String toString() { return "le " + a + " " + b; }
        });
        return this;
    }

    public BooleanNetworkProblem addNot(int a, int b) {
        checkLiteral(a);
        checkLiteral(b);
        relations.add(new Relation() {
            @Override void install(Network n) { n.require(BooleanRelations.addBoolNot(n.store, n.var(a), n.var(b))); }
            @Override boolean holds(boolean[] p) { return value(p, a) != value(p, b); }
            @Override public String toString() { return "not " + a + " " + b; }
        });
        return this;
    }

    public BooleanNetworkProblem addAtMost(int k, int... literals) {
        if (k < 0) throw new IllegalArgumentException("threshold must be non-negative");
        if (literals.length == 0) throw new IllegalArgumentException("atmost needs at least one literal");
        checkDistinct(literals);
        final int[] ls = literals.clone();
        relations.add(new Relation() {
            @Override void install(Network n) { new AtMostKGuard(n.atoms(ls), k).post(n.store); }
            @Override boolean holds(boolean[] p) { return countTrue(p, ls) <= k; }
            @Override public String toString() { return "atmost " + k + " " + spaceJoiner.join(Arrays.stream(ls).iterator()); }
        });
        return this;
    }

    public BooleanNetworkProblem addAtLeast(int k, int[] literals, int[] actions) {
        if (literals.length == 0) throw new IllegalArgumentException("atleast needs at least one literal");
        if (k < 1 || k > literals.length) throw new IllegalArgumentException("threshold out of range: " + k);
        if (actions.length == 0) throw new IllegalArgumentException("atleast needs at least one action");
        checkDistinct(literals);
        for (int a : actions) checkLiteral(a);
        final int[] ls = literals.clone();
        final int[] as = actions.clone();
        relations.add(new Relation() {
            @Override void install(Network n) { new AtLeastKTrigger(n.atoms(ls), k, n.atoms(as)).post(n.store); }
            @Override boolean holds(boolean[] p) {
                if (countTrue(p, ls) < k) return true;
                for (int a : as) if (!value(p, a)) return false;
                return true;
            }
            @Override public String toString() {
                return "atleast " + k + " " + spaceJoiner.join(Arrays.stream(ls).iterator()) + " => " + spaceJoiner.join(Arrays.stream(as).iterator());
            }
        });
        return this;
    }

    /**
     * Evaluate the conjunction of the problem's relations at the specified point
     * @param p vector of booleans, one per variable
     * @return whether every relation holds at p
     */
    public boolean evaluate(boolean[] p) {
        if (p.length != nVariables) throw new IllegalArgumentException("point has wrong dimension");
        for (Relation r : relations) if (!r.holds(p)) return false;
        return true;
    }

    public Stream<boolean[]> solutions() {
        return solutions(Duration.ofSeconds(1));
    }

    /**
     * Build the atom network for this problem and enumerate its solutions by depth-first search.
     * @param logInterval time between progress reports
     * @return lazily generated satisfying assignments
     */
    public Stream<boolean[]> solutions(Duration logInterval) {
        Network n = new Network();
        relations.forEach(r -> r.install(n));
        try {
            n.solver.post(n.store);
        } catch (Contradiction e) {
            log.debug("network is inconsistent before search");
            return Stream.empty();
        }
        return new DepthFirstSearch(n.solver, n.x).setLogInterval(logInterval).solutions().map(s -> {
            boolean[] bs = new boolean[s.length];
            for (int i = 0; i < s.length; ++i) bs[i] = s[i] == 1;
            return bs;
        });
    }

    private static int[] parseLiterals(List<String> tokens) {
        return tokens.stream().mapToInt(Integer::parseInt).toArray();
    }

    private static int parseThreshold(List<String> tokens) {
        if (tokens.size() < 2) throw new IllegalArgumentException("missing threshold");
        return Integer.parseInt(tokens.get(1));
    }

    private void parseRelation(List<String> tokens) {
        final String kind = tokens.get(0);
        switch (kind) {
            case "eq":
            case "le":
            case "not": {
                if (tokens.size() != 3) throw new IllegalArgumentException(kind + " takes exactly two literals");
                int[] ls = parseLiterals(tokens.subList(1, 3));
                if (kind.equals("eq")) addEq(ls[0], ls[1]);
                else if (kind.equals("le")) addLe(ls[0], ls[1]);
                else addNot(ls[0], ls[1]);
                break;
            }
            case "atmost":
                addAtMost(parseThreshold(tokens), parseLiterals(tokens.subList(2, tokens.size())));
                break;
            case "atleast": {
                int arrow = tokens.indexOf("=>");
                if (arrow < 0) throw new IllegalArgumentException("atleast requires => before its actions");
                addAtLeast(parseThreshold(tokens),
                        parseLiterals(tokens.subList(2, arrow)),
                        parseLiterals(tokens.subList(arrow + 1, tokens.size())));
                break;
            }
            default:
                throw new IllegalArgumentException("unknown relation: " + kind);
        }
    }

    public static BooleanNetworkProblem parseFrom(String s) {
        return parseFrom(new StringReader(s));
    }

    /**
     * Parse a problem: comment lines begin with {@code c}; a header line
     * {@code p bnet <variables> <relations>}; then one relation per line.
     */
    public static BooleanNetworkProblem parseFrom(Reader r) {
        Iterator<String> ls = new BufferedReader(r).lines()
                .filter(s -> !s.startsWith("c") && !s.trim().isEmpty())
                .iterator();
        if (!ls.hasNext()) throw new IllegalArgumentException("Missing problem data");
        Matcher m = pLineRe.matcher(ls.next());
        if (!m.matches()) throw new IllegalArgumentException("invalid p line");
        int nVar = Integer.parseInt(m.group(1));
        int nRelation = Integer.parseInt(m.group(2));
        BooleanNetworkProblem p = new BooleanNetworkProblem(nVar);
        ls.forEachRemaining(line -> p.parseRelation(splitter.splitToList(line)));
        if (p.nRelations() != nRelation) {
            throw new IllegalArgumentException("Observed relation count disagrees with p header");
        }
        return p;
    }

    /**
     * Generate a random problem. Aggregate relations range over distinct variables, with
     * random polarities.
     * @param n number of variables
     * @param m number of relations
     * @param seed for the random number generator
     * @return random problem instance
     */
    public static BooleanNetworkProblem randomInstance(int n, int m, long seed) {
        if (n < 2) throw new IllegalArgumentException("n must be at least 2");
        if (m < 0) throw new IllegalArgumentException("m must be non-negative");
        Random R = new Random(seed);
        BooleanNetworkProblem p = new BooleanNetworkProblem(n);
        for (int j = 0; j < m; ++j) {
            switch (R.nextInt(5)) {
                case 0: p.addEq(randomLiteral(R, n), randomLiteral(R, n)); break;
                case 1: p.addLe(randomLiteral(R, n), randomLiteral(R, n)); break;
                case 2: p.addNot(randomLiteral(R, n), randomLiteral(R, n)); break;
                case 3: {
                    int[] ls = distinctLiterals(R, n, 2 + R.nextInt(Math.min(n, 5) - 1));
                    p.addAtMost(R.nextInt(ls.length), ls);
                    break;
                }
                default: {
                    int[] ls = distinctLiterals(R, n, 2 + R.nextInt(Math.min(n, 5) - 1));
                    int[] as = distinctLiterals(R, n, 1 + R.nextInt(2));
                    p.addAtLeast(1 + R.nextInt(ls.length), ls, as);
                }
            }
        }
        return p;
    }

    private static int randomLiteral(Random R, int n) {
        int v = 1 + R.nextInt(n);
        return R.nextBoolean() ? v : -v;
    }

    private static int[] distinctLiterals(Random R, int n, int size) {
        List<Integer> vs = new ArrayList<>(n);
        for (int v = 1; v <= n; ++v) vs.add(v);
        Collections.shuffle(vs, R);
        return vs.subList(0, size).stream().mapToInt(v -> R.nextBoolean() ? v : -v).toArray();
    }

    /** @return the problem in the format accepted by {@link #parseFrom(Reader)} */
    public String format() {
        StringBuilder sb = new StringBuilder();
        sb.append("p bnet ").append(nVariables).append(' ').append(relations.size()).append('\n');
        for (Relation r : relations) sb.append(r).append('\n');
        return sb.toString();
    }
}
