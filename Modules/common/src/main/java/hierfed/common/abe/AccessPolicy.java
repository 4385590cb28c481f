package hierfed.common.abe;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Boolean access policy over attribute names, e.g. {@code facility AND (region:X OR region:Y)}.
 * AND binds tighter than OR; attributes may be double-quoted.
 */
public final class AccessPolicy {

    sealed interface Node permits Attr, And, Or {}
    record Attr(String name) implements Node {}
    record And(Node left, Node right) implements Node {}
    record Or(Node left, Node right) implements Node {}

    private final String source;
    private final Node root;

    private AccessPolicy(String source, Node root) {
        this.source = source;
        this.root = root;
    }

    /** @throws IllegalArgumentException on a malformed expression */
    public static AccessPolicy parse(String expression) {
        if (expression == null || expression.isBlank()) throw new IllegalArgumentException("empty policy");
        Parser p = new Parser(tokenize(expression));
        Node root = p.parseOr();
        if (p.pos != p.tokens.size()) {
            throw new IllegalArgumentException("unexpected token '" + p.tokens.get(p.pos) + "'");
        }
        return new AccessPolicy(expression.trim(), root);
    }

    public String source() { return source; }

    public boolean isSatisfiedBy(Collection<String> held) {
        return eval(root, Set.copyOf(held));
    }

    private static boolean eval(Node n, Set<String> held) {
        if (n instanceof Attr a) return held.contains(a.name());
        if (n instanceof And a) return eval(a.left(), held) && eval(a.right(), held);
        Or o = (Or) n;
        return eval(o.left(), held) || eval(o.right(), held);
    }

    /** Every attribute the policy mentions. */
    public Set<String> attributes() {
        Set<String> out = new TreeSet<>();
        collect(root, out);
        return out;
    }

    private static void collect(Node n, Set<String> out) {
        if (n instanceof Attr a) {
            out.add(a.name());
        } else if (n instanceof And a) {
            collect(a.left(), out);
            collect(a.right(), out);
        } else if (n instanceof Or o) {
            collect(o.left(), out);
            collect(o.right(), out);
        }
    }

    /**
     * Disjunctive normal form: the policy holds iff some returned clause is fully held.
     * Each clause is sorted so equal clauses compare equal.
     */
    public List<Set<String>> clauses() {
        List<Set<String>> raw = dnf(root);
        Set<Set<String>> unique = new LinkedHashSet<>(raw);
        return new ArrayList<>(unique);
    }

    private static List<Set<String>> dnf(Node n) {
        if (n instanceof Attr a) {
            Set<String> s = new TreeSet<>();
            s.add(a.name());
            return List.of(s);
        }
        if (n instanceof Or o) {
            List<Set<String>> out = new ArrayList<>(dnf(o.left()));
            out.addAll(dnf(o.right()));
            return out;
        }
        And a = (And) n;
        List<Set<String>> out = new ArrayList<>();
        for (Set<String> l : dnf(a.left())) {
            for (Set<String> r : dnf(a.right())) {
                Set<String> s = new TreeSet<>(l);
                s.addAll(r);
                out.add(s);
            }
        }
        return out;
    }

    @Override
    public String toString() { return source; }

    private static List<String> tokenize(String s) {
        List<String> out = new ArrayList<>();
        int i = 0;
        while (i < s.length()) {
            char c = s.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '(' || c == ')') {
                out.add(String.valueOf(c));
                i++;
            } else if (c == '"') {
                int end = s.indexOf('"', i + 1);
                if (end < 0) throw new IllegalArgumentException("unterminated quote at " + i);
                if (end == i + 1) throw new IllegalArgumentException("empty attribute at " + i);
                out.add("\"" + s.substring(i + 1, end));
                i = end + 1;
            } else {
                int start = i;
                while (i < s.length() && !Character.isWhitespace(s.charAt(i))
                        && s.charAt(i) != '(' && s.charAt(i) != ')' && s.charAt(i) != '"') {
                    i++;
                }
                out.add(s.substring(start, i));
            }
        }
        return out;
    }

    private static final class Parser {
        final List<String> tokens;
        int pos = 0;

        Parser(List<String> tokens) { this.tokens = tokens; }

        Node parseOr() {
            Node left = parseAnd();
            while (peekKeyword("OR")) {
                pos++;
                left = new Or(left, parseAnd());
            }
            return left;
        }

        Node parseAnd() {
            Node left = parseAtom();
            while (peekKeyword("AND")) {
                pos++;
                left = new And(left, parseAtom());
            }
            return left;
        }

        Node parseAtom() {
            if (pos >= tokens.size()) throw new IllegalArgumentException("policy ends unexpectedly");
            String tok = tokens.get(pos++);
            if (tok.equals("(")) {
                Node inner = parseOr();
                if (pos >= tokens.size() || !tokens.get(pos).equals(")")) {
                    throw new IllegalArgumentException("missing ')'");
                }
                pos++;
                return inner;
            }
            if (tok.equals(")")) throw new IllegalArgumentException("unexpected ')'");
            if (tok.startsWith("\"")) return new Attr(tok.substring(1));
            if (tok.equalsIgnoreCase("AND") || tok.equalsIgnoreCase("OR")) {
                throw new IllegalArgumentException("operator '" + tok + "' where attribute expected");
            }
            return new Attr(tok);
        }

        boolean peekKeyword(String kw) {
            return pos < tokens.size() && tokens.get(pos).equalsIgnoreCase(kw);
        }
    }
}
