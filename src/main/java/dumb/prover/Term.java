package dumb.prover;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * A value-denoting expression: variable, constant, function application or tuple.
 * <p>
 * Terms are immutable and freely shared between formulas. Constructors accept any symbol and arity;
 * conformance to the toy signature is a separate check ({@link #isWellFormed()}).
 */
sealed public interface Term permits Term.Var, Term.Const, Term.Fn, Term.Tuple {

    static Var var(String name) {
        return new Var(name);
    }

    static Const constant(String symbol) {
        return new Const(symbol);
    }

    static Fn fn(String symbol, Term... args) {
        return new Fn(symbol, List.of(args));
    }

    static Fn fn(String symbol, List<Term> args) {
        return new Fn(symbol, args);
    }

    static Tuple tuple(Term... args) {
        return new Tuple(List.of(args));
    }

    /** The only equality used by the kernel. */
    static boolean same(Term a, Term b) {
        return a.canonicalKey().equals(b.canonicalKey());
    }

    /** Human-readable rendering. Not injective: {@code var("x")} and {@code constant("x")} both print {@code x}. */
    String text();

    /**
     * Injective encoding of the tree: every node is tagged and every symbol is length-prefixed, so two terms share a
     * key exactly when they are built alike.
     */
    String canonicalKey();

    /** {@code <tag><length>:<symbol>} */
    static String symbolKey(char tag, String symbol) {
        return tag + String.valueOf(symbol.length()) + ':' + symbol;
    }

    /** First violation of the toy signature, if any. */
    Optional<String> wellFormednessError();

    default boolean isWellFormed() {
        return wellFormednessError().isEmpty();
    }

    private static String joinArgs(List<Term> args) {
        return args.stream().map(Term::text).collect(Collectors.joining(", ", "(", ")"));
    }

    private static String joinKeys(List<Term> args) {
        return args.stream().map(Term::canonicalKey).collect(Collectors.joining(",", "(", ")"));
    }

    private static Optional<String> firstError(List<Term> args) {
        return args.stream().map(Term::wellFormednessError).flatMap(Optional::stream).findFirst();
    }

    record Var(String name) implements Term {
        public Var {
            requireNonNull(name);
        }

        @Override
        public String text() {
            return name;
        }

        @Override
        public String canonicalKey() {
            return symbolKey('V', name);
        }

        @Override
        public Optional<String> wellFormednessError() {
            return Language.isVariable(name) ? Optional.empty() : Optional.of("bad var");
        }

        @Override
        public String toString() {
            return name;
        }
    }

    record Const(String symbol) implements Term {
        public Const {
            requireNonNull(symbol);
        }

        @Override
        public String text() {
            return symbol;
        }

        @Override
        public String canonicalKey() {
            return symbolKey('C', symbol);
        }

        @Override
        public Optional<String> wellFormednessError() {
            return Language.isConstant(symbol) ? Optional.empty() : Optional.of("bad const");
        }

        @Override
        public String toString() {
            return symbol;
        }
    }

    final class Fn implements Term {
        public final String symbol;
        public final List<Term> args;
        private volatile String textCache, keyCache;

        public Fn(String symbol, List<Term> args) {
            this.symbol = requireNonNull(symbol);
            this.args = List.copyOf(args);
        }

        public int arity() {
            return args.size();
        }

        @Override
        public String text() {
            if (textCache == null)
                textCache = Language.INFIX_FUNCTIONS.contains(symbol) && arity() == 2 ?
                        "(" + args.get(0).text() + " " + symbol + " " + args.get(1).text() + ")" :
                        symbol + joinArgs(args);
            return textCache;
        }

        @Override
        public String canonicalKey() {
            if (keyCache == null) keyCache = symbolKey('F', symbol) + joinKeys(args);
            return keyCache;
        }

        @Override
        public Optional<String> wellFormednessError() {
            if (!Language.isFunction(symbol, arity())) return Optional.of("bad function/arity");
            return firstError(args);
        }

        @Override
        public boolean equals(Object o) {
            return this == o || (o instanceof Fn that && canonicalKey().equals(that.canonicalKey()));
        }

        @Override
        public int hashCode() {
            return canonicalKey().hashCode();
        }

        @Override
        public String toString() {
            return text();
        }
    }

    final class Tuple implements Term {
        public final List<Term> args;
        private volatile String textCache, keyCache;

        public Tuple(List<Term> args) {
            this.args = List.copyOf(args);
        }

        @Override
        public String text() {
            if (textCache == null) textCache = joinArgs(args);
            return textCache;
        }

        @Override
        public String canonicalKey() {
            if (keyCache == null) keyCache = 'T' + joinKeys(args);
            return keyCache;
        }

        /** Tuples have no place in the toy signature. */
        @Override
        public Optional<String> wellFormednessError() {
            return Optional.of("tuple outside signature");
        }

        @Override
        public boolean equals(Object o) {
            return this == o || (o instanceof Tuple that && canonicalKey().equals(that.canonicalKey()));
        }

        @Override
        public int hashCode() {
            return canonicalKey().hashCode();
        }

        @Override
        public String toString() {
            return text();
        }
    }
}
