package dumb.prover;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Random;

import static dumb.prover.Term.*;
import static org.junit.jupiter.api.Assertions.*;

class TermTest {
    /** Shared by variables, constants and function symbols so that leaves of different kinds can share a name. */
    static final List<String> SYMBOLS = List.of("x", "y", "k", "0", "ℕ", "", "+", "a, b", "(", ",");

    @Test
    void rendersLeaves() {
        assertEquals("x", var("x").text());
        assertEquals("ℕ", constant("ℕ").text());
    }

    @Test
    void rendersInfixFunctionsWhenBinary() {
        assertEquals("(v1 + 1)", fn("+", var("v1"), constant("1")).text());
        assertEquals("(a * b)", fn("*", var("a"), var("b")).text());
        assertEquals("(a ∈ S)", fn("∈", var("a"), constant("S")).text());
    }

    @Test
    void rendersPrefixFunctionsOtherwise() {
        assertEquals("succ(v1)", fn("succ", var("v1")).text());
        assertEquals("+(a, b, c)", fn("+", var("a"), var("b"), var("c")).text());
        assertEquals("va(x, 0)", fn("va", constant("x"), constant("0")).text());
        assertEquals("f()", fn("f").text());
    }

    /** Tuples render as a parenthesised comma list; the historical renderer produced "?" here. */
    @Test
    void rendersTuples() {
        assertEquals("(a, b)", tuple(var("a"), var("b")).text());
        assertEquals("(a)", tuple(var("a")).text());
        assertEquals("()", tuple().text());
        assertNotEquals("?", tuple(var("a"), var("b")).text());
    }

    @Test
    void renderingIsDeterministic() {
        var t = fn("f", fn("+", var("x"), constant("1")), tuple(var("y")));
        assertEquals(t.text(), t.text());
        assertEquals(t.canonicalKey(), fn("f", fn("+", var("x"), constant("1")), tuple(var("y"))).canonicalKey());
    }

    @Test
    void sameComparesRenderings() {
        assertTrue(same(fn("sum", constant("0")), fn("sum", constant("0"))));
        assertFalse(same(fn("sum", constant("0")), fn("sum", constant("1"))));
        assertFalse(same(tuple(var("a"), var("b")), fn("+", var("a"), var("b"))));
        assertEquals(fn("g", var("x")), fn("g", var("x")));
        assertEquals(fn("g", var("x")).hashCode(), fn("g", var("x")).hashCode());
    }

    @Test
    void variableAndConstantOfTheSameNameDiffer() {
        assertEquals(var("x").text(), constant("x").text());
        assertNotEquals(var("x").canonicalKey(), constant("x").canonicalKey());
        assertFalse(same(var("x"), constant("x")));
        assertFalse(same(fn("f", var("0")), fn("f", constant("0"))));
        assertNotEquals(fn("f", var("0")), fn("f", constant("0")));
    }

    @Test
    void keyIsImmuneToDelimitersInSymbols() {
        assertEquals(fn("", var("a"), var("b")).text(), tuple(var("a"), var("b")).text());
        assertFalse(same(fn("", var("a"), var("b")), tuple(var("a"), var("b"))));
        assertFalse(same(var("a, b"), tuple(var("a"), var("b"))));
        assertFalse(same(fn("f", var("a"), var("b")), fn("f", var("a, b"))));
        assertFalse(same(constant(""), tuple()));
    }

    @Test
    void wellFormedInToySignature() {
        assertTrue(fn("+", var("v1"), constant("1")).isWellFormed());
        assertTrue(fn("succ", fn("*", var("v2"), constant("0"))).isWellFormed());
    }

    @ParameterizedTest
    @ValueSource(strings = {"x", "v", "V1", "v1a", "vv1"})
    void rejectsVariablesOutsideSignature(String name) {
        assertEquals("bad var", var(name).wellFormednessError().orElseThrow());
    }

    @Test
    void rejectsOtherSymbols() {
        assertEquals("bad const", constant("2").wellFormednessError().orElseThrow());
        assertEquals("bad function/arity", fn("succ", var("v1"), var("v2")).wellFormednessError().orElseThrow());
        assertEquals("bad function/arity", fn("sum", var("v1")).wellFormednessError().orElseThrow());
        assertEquals("bad const", fn("+", var("v1"), constant("ℕ")).wellFormednessError().orElseThrow());
        assertEquals("tuple outside signature", tuple(var("v1")).wellFormednessError().orElseThrow());
    }

    @Test
    void canonicalKeyIsInjectiveOverGeneratedTerms() {
        var random = new Random(42);
        var seen = new HashMap<String, String>();
        for (var i = 0; i < 5000; i++) {
            var t = randomTerm(random, 4);
            var structure = structure(t);
            var previous = seen.putIfAbsent(t.canonicalKey(), structure);
            if (previous != null)
                assertEquals(previous, structure, "two different terms share the key " + t.canonicalKey());
        }
    }

    static Term randomTerm(Random random, int depth) {
        var pick = depth == 0 ? random.nextInt(2) : random.nextInt(5);
        switch (pick) {
            case 0:
                return var(SYMBOLS.get(random.nextInt(SYMBOLS.size())));
            case 1:
                return constant(SYMBOLS.get(random.nextInt(SYMBOLS.size())));
            case 2:
            case 3: {
                var symbol = random.nextBoolean() ? SYMBOLS.get(random.nextInt(SYMBOLS.size()))
                        : List.of("*", "∈", "f", "succ").get(random.nextInt(4));
                var args = new ArrayList<Term>();
                for (var i = random.nextInt(4); i > 0; i--) args.add(randomTerm(random, depth - 1));
                return fn(symbol, args);
            }
            default: {
                var args = new ArrayList<Term>();
                for (var i = random.nextInt(4); i > 0; i--) args.add(randomTerm(random, depth - 1));
                return new Tuple(args);
            }
        }
    }

    /** Fully tagged description of the tree, independent of the renderer. */
    static String structure(Term t) {
        if (t instanceof Var v) return "V[" + v.name() + "]";
        if (t instanceof Const c) return "C[" + c.symbol() + "]";
        if (t instanceof Fn f) return "F[" + f.symbol + f.args.stream().map(TermTest::structure).toList() + "]";
        return "T" + ((Tuple) t).args.stream().map(TermTest::structure).toList();
    }
}
