package dumb.prover.rule;

import dumb.prover.Formula;

import java.util.List;

import static dumb.prover.ProofException.RuleFailure.Reason.AND_MISMATCH;

/** From {@code A} and {@code B}, in that order, conclude {@code (A ∧ B)}. */
public class AndRule extends BuiltinRule {
    public static final String NAME = "AND";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "conjunction of the two inputs, in order";
    }

    @Override
    public Formula apply(List<Formula> inputs, Formula claimed) {
        requireInputs(inputs, 2);
        var expected = Formula.and(inputs.get(0), inputs.get(1));
        if (!Formula.same(expected, claimed))
            throw fail(AND_MISMATCH, "Claimed " + claimed.text() + " does not match AND result " + expected.text());
        return expected;
    }
}
