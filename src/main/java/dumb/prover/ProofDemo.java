package dumb.prover;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.UnaryOperator;

import static dumb.prover.Formula.*;
import static dumb.prover.Term.constant;
import static dumb.prover.Term.fn;
import static dumb.prover.Term.var;

/** Builds the sample proofs and prints their final state. */
public class ProofDemo {
    private static final Logger logger = LoggerFactory.getLogger(ProofDemo.class);

    private static final ProofConfig CONFIG = ProofConfig.load();
    private static final Term N = CONFIG.naturalsTerm();
    private static final Term ZERO = CONFIG.zeroTerm(), ONE = constant(CONFIG.one());
    private static final UnaryOperator<Term> SUM = t -> fn("sum", t);

    public static void main(String[] args) {
        andIntroduction();
        forallElimination();
        inductionByRule();
        excludedMiddle();
        cases();
        inductionByTactics();
        transitivityChain();
    }

    private static void report(String title, Proof proof, Formula target) {
        System.out.println("=== " + title + " ===");
        proof.print();
        System.out.println(proof.isValid() ? "Proof is valid for target: " + target.text() : "Proof is NOT valid.");
        System.out.println();
    }

    static Proof andIntroduction() {
        logger.info("AND proof");
        var xEq2 = eq(var("x"), constant("2"));
        var yEq3 = eq(var("y"), constant("3"));
        var target = and(xEq2, yEq3);

        var proof = new Proof(List.of(xEq2, yEq3), target, CONFIG);
        proof.addLine(xEq2, "ASSUMPTION");
        proof.addLine(yEq3, "ASSUMPTION");
        proof.addLine(target, "AND", 0, 1);
        report("AND Proof", proof, target);
        return proof;
    }

    static Proof forallElimination() {
        logger.info("FORALL proof");
        var X = constant("X");
        var yInX = member(var("y"), X);
        var all = forall("x", X, eq(var("x"), constant("5")));
        var target = eq(var("y"), constant("5"));

        var proof = new Proof(List.of(yInX, all), target, CONFIG);
        proof.addLine(yInX, "ASSUMPTION");
        proof.addLine(all, "ASSUMPTION");
        proof.addLine(target, "FORALL", 1, 0);
        report("FORALL Proof", proof, target);
        return proof;
    }

    static Proof inductionByRule() {
        logger.info("Induction proof by rule");
        var k = var(CONFIG.stepVariable());
        var n = var(CONFIG.conclusionVariable());
        var kPlus1 = CONFIG.successorOf(k);
        var base = eq(SUM.apply(ZERO), ZERO);
        var recursive = forall(k.name(), N, eq(SUM.apply(kPlus1), fn("+", SUM.apply(k), ONE)));
        var step = forall(k.name(), N, implies(eq(SUM.apply(k), k), eq(SUM.apply(kPlus1), kPlus1)));
        var target = forall(n.name(), N, eq(SUM.apply(n), n));

        var proof = new Proof(List.of(base, recursive, step), target, CONFIG);
        proof.addLine(base, "ASSUMPTION");
        proof.addLine(recursive, "ASSUMPTION");
        proof.addLine(step, "ASSUMPTION");
        proof.addLine(target, "INDUCTION", 0, 2);
        report("Induction Proof: sum(n) = n", proof, target);
        return proof;
    }

    static Proof excludedMiddle() {
        logger.info("Excluded middle proof");
        var px = rel("P", var("x"));
        var target = or(px, not(px));

        var proof = new Proof(List.of(), target, CONFIG);
        proof.addLine(target, "LEM");
        report("Excluded Middle Proof", proof, target);
        return proof;
    }

    static Proof cases() {
        logger.info("Cases proof");
        var px = rel("P", var("x"));
        var qx = rel("Q", var("x"));
        var positive = implies(px, qx);
        var negative = implies(not(px), qx);

        var proof = new Proof(List.of(positive, negative), qx, CONFIG);
        proof.addLine(positive, "ASSUMPTION");
        proof.addLine(negative, "ASSUMPTION");
        proof.addLine(qx, "CASES", 0, 1);
        report("Cases Proof", proof, qx);
        return proof;
    }

    static Proof inductionByTactics() {
        logger.info("Induction proof by tactics");
        var k = var(CONFIG.stepVariable());
        var n = var(CONFIG.conclusionVariable());
        var kPlus1 = CONFIG.successorOf(k);
        var base = eq(SUM.apply(ZERO), ZERO);
        var recursiveInner = eq(SUM.apply(kPlus1), fn("+", SUM.apply(k), ONE));
        var recursive = forall(k.name(), N, recursiveInner);
        var target = forall(n.name(), N, eq(SUM.apply(n), n));

        var proof = new Proof(List.of(base, recursive), target, CONFIG);
        proof.instantiateInduction();
        proof.addLine(base, "ASSUMPTION");
        proof.addLine(recursive, "ASSUMPTION");
        proof.instantiateForall();
        proof.addLine(member(k, N), "ASSUMPTION");
        proof.instantiateImplication();
        proof.addLine(recursiveInner, "FORALL", 1, 2);
        proof.rewriteTargetUsingEquality(3);
        proof.addLine(eq(SUM.apply(k), k), "ASSUMPTION");
        proof.rewriteTargetUsingEquality(4);
        proof.addLine(eq(kPlus1, kPlus1), "EQ");
        report("Induction Proof (tactics): sum(n) = n", proof, target);
        return proof;
    }

    /** Instantiates a three-variable transitivity axiom one quantifier at a time. */
    static Proof transitivityChain() {
        logger.info("Transitivity chain");
        var vaX3 = fn("va", constant("x"), constant("3"));
        var vaX2 = fn("va", constant("x"), constant("2"));
        var vaY2 = fn("va", constant("y"), constant("2"));
        Term a = var("a"), b = var("b"), c = var("c");

        var forallB = forall("b", N, forall("c", N, implies(and(eq(a, b), eq(b, c)), eq(a, c))));
        var transitivity = forall("a", N, forallB);
        var target = implies(and(eq(vaX3, vaX2), eq(vaX2, vaY2)), eq(vaX3, vaY2));

        var assumptions = List.<Formula>of(transitivity, member(vaX3, N), member(vaX2, N), member(vaY2, N));
        var proof = new Proof(assumptions, target, CONFIG);
        assumptions.forEach(f -> proof.addLine(f, "ASSUMPTION"));

        var forB = (Forall) Substitution.substitute(forallB, "a", vaX3);
        proof.addLine(forB, "FORALL", 0, 1);
        var forC = (Forall) Substitution.substitute(forB.inner(), "b", vaX2);
        proof.addLine(forC, "FORALL", 4, 2);
        proof.addLine(Substitution.substitute(forC.inner(), "c", vaY2), "FORALL", 5, 3);
        report("Transitivity Chain", proof, target);
        return proof;
    }
}
