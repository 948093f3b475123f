package dumb.prover;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Free-variable analysis and the two substitution operators.
 * <p>
 * {@code replace} is a blind structural rewrite keyed on {@link Term#canonicalKey()}; it descends into quantifier bodies
 * regardless of what they bind. {@code substitute} is name-based {@code φ[t/x]} that stops at a quantifier binding
 * {@code x} but never renames; check {@link #isSubstitutable(Formula, String, Term)} first where capture matters.
 */
public enum Substitution {
    ;

    public static boolean occursIn(String name, Term t) {
        if (t instanceof Term.Var v) return v.name().equals(name);
        if (t instanceof Term.Fn f) return f.args.stream().anyMatch(a -> occursIn(name, a));
        if (t instanceof Term.Tuple tu) return tu.args.stream().anyMatch(a -> occursIn(name, a));
        return false;
    }

    public static Set<String> vars(Term t) {
        var vars = new TreeSet<String>();
        collectVars(t, vars);
        return Collections.unmodifiableSet(vars);
    }

    /** Every variable name mentioned in the formula, bound or free. Bound names themselves are not collected. */
    public static Set<String> vars(Formula f) {
        var vars = new TreeSet<String>();
        collectVars(f, vars);
        return Collections.unmodifiableSet(vars);
    }

    public static void collectVars(Term t, Set<String> vars) {
        if (t instanceof Term.Var v) vars.add(v.name());
        else if (t instanceof Term.Fn f) f.args.forEach(a -> collectVars(a, vars));
        else if (t instanceof Term.Tuple tu) tu.args.forEach(a -> collectVars(a, vars));
    }

    public static void collectVars(Formula f, Set<String> vars) {
        if (f instanceof Formula.Eq e) {
            collectVars(e.l(), vars);
            collectVars(e.r(), vars);
        } else if (f instanceof Formula.Rel r) {
            r.args().forEach(a -> collectVars(a, vars));
        } else if (f instanceof Formula.Not n) {
            collectVars(n.inner(), vars);
        } else if (f instanceof Formula.Binary b) {
            collectVars(b.l(), vars);
            collectVars(b.r(), vars);
        } else if (f instanceof Formula.Quantified q) {
            collectVars(q.inner(), vars);
        }
    }

    /** True if {@code name} occurs in an atomic position not under a quantifier binding {@code name}. */
    public static boolean isFreeIn(String name, Formula f) {
        if (f instanceof Formula.Eq e) return occursIn(name, e.l()) || occursIn(name, e.r());
        if (f instanceof Formula.Rel r) return r.args().stream().anyMatch(a -> occursIn(name, a));
        if (f instanceof Formula.Not n) return isFreeIn(name, n.inner());
        if (f instanceof Formula.Binary b) return isFreeIn(name, b.l()) || isFreeIn(name, b.r());
        if (f instanceof Formula.Quantified q) return !q.var().equals(name) && isFreeIn(name, q.inner());
        return false;
    }

    public static boolean isSentence(Formula f) {
        return vars(f).stream().noneMatch(v -> isFreeIn(v, f));
    }

    public static Term replace(Term u, Term pattern, Term replacement) {
        if (Term.same(u, pattern)) return replacement;
        if (u instanceof Term.Fn f) return Term.fn(f.symbol, f.args.stream().map(a -> replace(a, pattern, replacement)).toList());
        if (u instanceof Term.Tuple tu) return new Term.Tuple(tu.args.stream().map(a -> replace(a, pattern, replacement)).toList());
        return u;
    }

    /** Rewrites every subterm with the same key as {@code pattern}, including inside quantifier bodies. */
    public static Formula replace(Formula phi, Term pattern, Term replacement) {
        if (phi instanceof Formula.Eq e)
            return Formula.eq(replace(e.l(), pattern, replacement), replace(e.r(), pattern, replacement));
        if (phi instanceof Formula.Rel r)
            return Formula.rel(r.symbol(), r.args().stream().map(a -> replace(a, pattern, replacement)).toList());
        if (phi instanceof Formula.Not n)
            return Formula.not(replace(n.inner(), pattern, replacement));
        if (phi instanceof Formula.Binary b)
            return b.with(replace(b.l(), pattern, replacement), replace(b.r(), pattern, replacement));
        if (phi instanceof Formula.Quantified q)
            return q.with(replace(q.inner(), pattern, replacement));
        throw new IllegalStateException("Unhandled formula: " + phi);
    }

    public static Term substitute(Term u, String var, Term t) {
        if (u instanceof Term.Var v) return v.name().equals(var) ? t : v;
        if (u instanceof Term.Fn f) return Term.fn(f.symbol, f.args.stream().map(a -> substitute(a, var, t)).toList());
        if (u instanceof Term.Tuple tu) return new Term.Tuple(tu.args.stream().map(a -> substitute(a, var, t)).toList());
        return u;
    }

    public static Formula substitute(Formula phi, String var, Term t) {
        if (phi instanceof Formula.Eq e)
            return Formula.eq(substitute(e.l(), var, t), substitute(e.r(), var, t));
        if (phi instanceof Formula.Rel r)
            return Formula.rel(r.symbol(), r.args().stream().map(a -> substitute(a, var, t)).toList());
        if (phi instanceof Formula.Not n)
            return Formula.not(substitute(n.inner(), var, t));
        if (phi instanceof Formula.Binary b)
            return b.with(substitute(b.l(), var, t), substitute(b.r(), var, t));
        if (phi instanceof Formula.Quantified q)
            return q.var().equals(var) ? q : q.with(substitute(q.inner(), var, t));
        throw new IllegalStateException("Unhandled formula: " + phi);
    }

    /**
     * Whether {@code t} may replace {@code var} in {@code phi} without any variable of {@code t} being captured.
     * Advisory only; {@link #substitute(Formula, String, Term)} does not consult it.
     */
    public static boolean isSubstitutable(Formula phi, String var, Term t) {
        if (phi instanceof Formula.Eq || phi instanceof Formula.Rel) return true;
        if (phi instanceof Formula.Not n) return isSubstitutable(n.inner(), var, t);
        if (phi instanceof Formula.Binary b) return isSubstitutable(b.l(), var, t) && isSubstitutable(b.r(), var, t);
        if (phi instanceof Formula.Quantified q) {
            if (!isFreeIn(var, phi)) return true;
            return !occursIn(q.var(), t) && isSubstitutable(q.inner(), var, t);
        }
        return false;
    }
}
