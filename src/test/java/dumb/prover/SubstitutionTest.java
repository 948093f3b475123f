package dumb.prover;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Random;
import java.util.Set;

import static dumb.prover.Formula.*;
import static dumb.prover.Substitution.*;
import static dumb.prover.Term.constant;
import static dumb.prover.Term.fn;
import static dumb.prover.Term.tuple;
import static dumb.prover.Term.var;
import static org.junit.jupiter.api.Assertions.*;

class SubstitutionTest {
    private static final Term N = constant("ℕ");

    /** ∀v2 ¬∀v3 ((v1 = succ(v2)) ∨ (v3 = v2)) */
    private static Formula nested() {
        var disj = or(eq(var("v1"), fn("succ", var("v2"))), eq(var("v3"), var("v2")));
        return forall("v2", N, not(forall("v3", N, disj)));
    }

    @Test
    void occursInsideFunctionsAndTuples() {
        assertTrue(occursIn("x", fn("f", constant("c"), tuple(var("y"), fn("g", var("x"))))));
        assertFalse(occursIn("x", fn("f", constant("x"))));
        assertFalse(occursIn("x", constant("x")));
    }

    @Test
    void collectsVariablesIgnoringBinders() {
        assertEquals(Set.of("x", "y"), vars(tuple(var("x"), fn("f", var("y"), constant("c")))));
        assertEquals(Set.of("v1", "v2", "v3"), vars(nested()));
        assertEquals(Set.of(), vars(forall("z", N, eq(constant("0"), constant("0")))));
    }

    @Test
    void freeVariables() {
        var f = nested();
        assertTrue(isFreeIn("v1", f));
        assertFalse(isFreeIn("v2", f));
        assertFalse(isFreeIn("v3", f));
    }

    @Test
    void freeOnOneSideOnly() {
        var f = or(forall("x", N, rel("P", var("x"))), rel("Q", var("x")));
        assertTrue(isFreeIn("x", f));
        assertFalse(isFreeIn("x", forall("x", N, rel("Q", var("x")))));
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 2, 3, 4, 5, 6, 7, 8})
    void unmentionedNameIsNeverFree(int seed) {
        var f = FormulaTest.randomFormula(new Random(seed), 3);
        assertFalse(isFreeIn("unmentioned", f));
    }

    @Test
    void sentences() {
        // (∀v1∀v2 (v1 + v2 = 0)) ∨ v1 = succ(0)
        var closed = forall("v1", N, forall("v2", N, eq(fn("+", var("v1"), var("v2")), constant("0"))));
        assertTrue(isSentence(closed));
        assertFalse(isSentence(or(closed, eq(var("v1"), fn("succ", constant("0"))))));

        var both = forall("v1", N, forall("v2", N, or(
                eq(fn("+", var("v1"), var("v2")), constant("0")),
                eq(fn("*", var("v1"), var("v2")), constant("1")))));
        assertTrue(isSentence(both));
        assertTrue(isSentence(eq(constant("0"), constant("0"))));
    }

    @Test
    void substituteInTerm() {
        var sum = fn("+", var("v1"), var("v2"));
        assertEquals("(1 + v2)", substitute(sum, "v1", constant("1")).text());
        assertEquals("(v1 + v1)", substitute(sum, "v2", var("v1")).text());
        assertEquals("(a, 1)", substitute(tuple(var("a"), var("b")), "b", constant("1")).text());
    }

    @Test
    void substituteStopsAtShadowingBinder() {
        var x = var("x");
        var phi = or(rel("P", x, var("y")), or(
                forall("x", N, rel("Q", fn("g", x), var("z"))),
                forall("y", N, rel("R", x, fn("h", x)))));
        var result = substitute(phi, "x", fn("g", constant("c")));
        assertEquals("(P(g(c), y) ∨ ((∀x ∈ ℕ)(Q(g(x), z)) ∨ (∀y ∈ ℕ)(R(g(c), h(g(c))))))", result.text());
    }

    @Test
    void substituteDoesNotRename() {
        // capture happens: y is bound by the quantifier
        var phi = forall("y", N, rel("R", var("y"), var("x")));
        assertEquals("(∀y ∈ ℕ)(R(y, y))", substitute(phi, "x", var("y")).text());
        assertFalse(isSubstitutable(phi, "x", var("y")));
    }

    @ParameterizedTest
    @ValueSource(ints = {11, 12, 13, 14, 15, 16})
    void substitutingAVariableForItselfIsIdentity(int seed) {
        var phi = FormulaTest.randomFormula(new Random(seed), 3);
        for (var name : Set.of("x", "y", "k"))
            assertTrue(same(phi, substitute(phi, name, var(name))));
    }

    @Test
    void substitutability() {
        var x = var("x");
        var forallY = forall("y", N, rel("R", x, fn("h", x)));
        assertTrue(isSubstitutable(forallY, "x", fn("g", constant("c"))));
        assertFalse(isSubstitutable(forallY, "x", fn("g", var("y"))));
        assertTrue(isSubstitutable(eq(x, var("y")), "x", var("y")), "atomic formulas are always safe");
        assertTrue(isSubstitutable(forall("y", N, rel("R", var("y"))), "x", var("y")), "x is not free");
        assertFalse(isSubstitutable(and(eq(x, x), forall("y", N, eq(x, var("y")))), "x", var("y")));
        assertFalse(isSubstitutable(not(exists("y", N, eq(x, var("y")))), "x", fn("f", var("y"))));
        assertTrue(isSubstitutable(implies(eq(x, x), exists("z", N, eq(x, var("z")))), "x", var("y")));
    }

    @Test
    void blindRewriteReplacesWholeMatchingSubtrees() {
        var k = var("k");
        var kPlus1 = fn("+", k, constant("1"));
        var goal = eq(fn("sum", kPlus1), kPlus1);
        var rewritten = replace(goal, fn("sum", kPlus1), fn("+", fn("sum", k), constant("1")));
        assertEquals("((sum(k) + 1) = (k + 1))", rewritten.text());
    }

    @Test
    void blindRewriteEntersQuantifiersEvenOverBoundNames() {
        var phi = forall("x", N, eq(var("x"), fn("f", var("x"))));
        assertEquals("(∀x ∈ ℕ)((c = f(c)))", replace(phi, var("x"), constant("c")).text());
    }

    @Test
    void blindRewriteLeavesDomainsAlone() {
        var phi = exists("x", var("S"), rel("P", var("S")));
        assertEquals("(∃x ∈ S)(P(T))", replace(phi, var("S"), var("T")).text());
    }

    @Test
    void blindRewriteInsideTuples() {
        assertEquals("(1, f(1))", replace(tuple(var("a"), fn("f", var("a"))), var("a"), constant("1")).text());
    }
}
