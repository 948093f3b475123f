package dumb.prover;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * A truth-bearing expression. Immutable; subformulas and terms are shared by reference.
 * <p>
 * Two formulas are the same exactly when their canonical keys are identical, see {@link #same(Formula, Formula)}.
 */
sealed public interface Formula permits Formula.Eq, Formula.Rel, Formula.Not, Formula.Binary, Formula.Quantified {

    static Eq eq(Term l, Term r) {
        return new Eq(l, r);
    }

    static Rel rel(String symbol, Term... args) {
        return new Rel(symbol, List.of(args));
    }

    static Rel rel(String symbol, List<Term> args) {
        return new Rel(symbol, args);
    }

    static Rel member(Term element, Term domain) {
        return new Rel(Language.ELEMENT_OF, List.of(element, domain));
    }

    static Not not(Formula inner) {
        return new Not(inner);
    }

    static Or or(Formula l, Formula r) {
        return new Or(l, r);
    }

    static And and(Formula l, Formula r) {
        return new And(l, r);
    }

    static Implies implies(Formula l, Formula r) {
        return new Implies(l, r);
    }

    static Forall forall(String var, Term domain, Formula inner) {
        return new Forall(var, domain, inner);
    }

    static Exists exists(String var, Term domain, Formula inner) {
        return new Exists(var, domain, inner);
    }

    static boolean same(Formula a, Formula b) {
        return a.canonicalKey().equals(b.canonicalKey());
    }

    /** Human-readable rendering, used by {@link Proof#render()}. */
    String text();

    /** Injective encoding in the style of {@link Term#canonicalKey()}; the basis of {@link #same}. */
    String canonicalKey();

    Optional<String> wellFormednessError();

    default boolean isWellFormed() {
        return wellFormednessError().isEmpty();
    }

    /** Connective with two immediate subformulas. */
    sealed interface Binary extends Formula permits Or, And, Implies {
        Formula l();

        Formula r();

        String connective();

        /** Key tag, distinct per connective. */
        String tag();

        /** Same connective over new operands. */
        Binary with(Formula l, Formula r);

        @Override
        default String text() {
            return "(" + l().text() + " " + connective() + " " + r().text() + ")";
        }

        @Override
        default String canonicalKey() {
            return tag() + "(" + l().canonicalKey() + "," + r().canonicalKey() + ")";
        }

        @Override
        default Optional<String> wellFormednessError() {
            return l().wellFormednessError().or(() -> r().wellFormednessError());
        }
    }

    /** Quantifier binding {@link #var()} over {@link #domain()}. */
    sealed interface Quantified extends Formula permits Forall, Exists {
        String var();

        Term domain();

        Formula inner();

        String quantifier();

        Quantified with(Formula inner);

        @Override
        default String text() {
            return "(" + quantifier() + var() + " " + Language.ELEMENT_OF + " " + domain().text() + ")(" + inner().text() + ")";
        }

        @Override
        default String canonicalKey() {
            return Term.symbolKey(this instanceof Forall ? 'A' : 'E', var()) + "(" + domain().canonicalKey() + "," + inner().canonicalKey() + ")";
        }

        /** The domain term is not checked. */
        @Override
        default Optional<String> wellFormednessError() {
            if (!Language.isVariable(var()))
                return Optional.of("bad " + (this instanceof Forall ? "forall" : "exists") + " var");
            return inner().wellFormednessError();
        }
    }

    record Eq(Term l, Term r) implements Formula {
        public Eq {
            requireNonNull(l);
            requireNonNull(r);
        }

        @Override
        public String text() {
            return "(" + l.text() + " " + Language.EQUALS + " " + r.text() + ")";
        }

        @Override
        public String canonicalKey() {
            return "Q(" + l.canonicalKey() + "," + r.canonicalKey() + ")";
        }

        @Override
        public Optional<String> wellFormednessError() {
            return l.wellFormednessError().or(r::wellFormednessError);
        }

        @Override
        public String toString() {
            return text();
        }
    }

    record Rel(String symbol, List<Term> args) implements Formula {
        public Rel {
            requireNonNull(symbol);
            args = List.copyOf(args);
        }

        public Term get(int index) {
            return args.get(index);
        }

        @Override
        public String text() {
            if (Language.INFIX_RELATIONS.contains(symbol) && args.size() == 2)
                return "(" + args.get(0).text() + " " + symbol + " " + args.get(1).text() + ")";
            return symbol + args.stream().map(Term::text).collect(Collectors.joining(", ", "(", ")"));
        }

        @Override
        public String canonicalKey() {
            return Term.symbolKey('R', symbol) + args.stream().map(Term::canonicalKey).collect(Collectors.joining(",", "(", ")"));
        }

        @Override
        public Optional<String> wellFormednessError() {
            if (!Language.isRelation(symbol, args.size())) return Optional.of("bad relation/arity");
            return args.stream().map(Term::wellFormednessError).flatMap(Optional::stream).findFirst();
        }

        @Override
        public String toString() {
            return text();
        }
    }

    record Not(Formula inner) implements Formula {
        public Not {
            requireNonNull(inner);
        }

        @Override
        public String text() {
            return "(" + Language.NOT + inner.text() + ")";
        }

        @Override
        public String canonicalKey() {
            return "N(" + inner.canonicalKey() + ")";
        }

        @Override
        public Optional<String> wellFormednessError() {
            return inner.wellFormednessError();
        }

        @Override
        public String toString() {
            return text();
        }
    }

    record Or(Formula l, Formula r) implements Binary {
        public Or {
            requireNonNull(l);
            requireNonNull(r);
        }

        @Override
        public String connective() {
            return Language.OR;
        }

        @Override
        public String tag() {
            return "O";
        }

        @Override
        public Or with(Formula l, Formula r) {
            return new Or(l, r);
        }

        @Override
        public String toString() {
            return text();
        }
    }

    record And(Formula l, Formula r) implements Binary {
        public And {
            requireNonNull(l);
            requireNonNull(r);
        }

        @Override
        public String connective() {
            return Language.AND;
        }

        @Override
        public String tag() {
            return "C";
        }

        @Override
        public And with(Formula l, Formula r) {
            return new And(l, r);
        }

        @Override
        public String toString() {
            return text();
        }
    }

    record Implies(Formula l, Formula r) implements Binary {
        public Implies {
            requireNonNull(l);
            requireNonNull(r);
        }

        @Override
        public String connective() {
            return Language.IMPLIES;
        }

        @Override
        public String tag() {
            return "I";
        }

        @Override
        public Implies with(Formula l, Formula r) {
            return new Implies(l, r);
        }

        @Override
        public String toString() {
            return text();
        }
    }

    record Forall(String var, Term domain, Formula inner) implements Quantified {
        public Forall {
            requireNonNull(var);
            requireNonNull(domain);
            requireNonNull(inner);
        }

        @Override
        public String quantifier() {
            return Language.FORALL;
        }

        @Override
        public Forall with(Formula inner) {
            return new Forall(var, domain, inner);
        }

        @Override
        public String toString() {
            return text();
        }
    }

    record Exists(String var, Term domain, Formula inner) implements Quantified {
        public Exists {
            requireNonNull(var);
            requireNonNull(domain);
            requireNonNull(inner);
        }

        @Override
        public String quantifier() {
            return Language.EXISTS;
        }

        @Override
        public Exists with(Formula inner) {
            return new Exists(var, domain, inner);
        }

        @Override
        public String toString() {
            return text();
        }
    }
}
