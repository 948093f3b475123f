package dumb.prover.rule;

import dumb.prover.Formula;

import java.util.List;

import static dumb.prover.ProofException.RuleFailure.Reason.CASES_MISMATCH;

/** From {@code (F → T)} and {@code ((¬F) → T)} conclude {@code T}. */
public class CasesRule extends BuiltinRule {
    public static final String NAME = "CASES";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "proof by cases on F and ¬F";
    }

    @Override
    public Formula apply(List<Formula> inputs, Formula claimed) {
        requireInputs(inputs, 2);
        if (!(inputs.get(0) instanceof Formula.Implies positive))
            throw fail(CASES_MISMATCH, "first input must be an implication: " + inputs.get(0).text());
        if (!(inputs.get(1) instanceof Formula.Implies negative))
            throw fail(CASES_MISMATCH, "second input must be an implication: " + inputs.get(1).text());
        if (!Formula.same(positive.r(), claimed) || !Formula.same(negative.r(), claimed))
            throw fail(CASES_MISMATCH, "both implications must derive " + claimed.text());
        if (!(negative.l() instanceof Formula.Not not))
            throw fail(CASES_MISMATCH, "second implication must have ¬F on the left: " + negative.l().text());
        if (!Formula.same(not.inner(), positive.l()))
            throw fail(CASES_MISMATCH, "mismatched F " + positive.l().text() + " and " + negative.l().text());
        return claimed;
    }
}
