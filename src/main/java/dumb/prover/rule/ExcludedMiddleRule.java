package dumb.prover.rule;

import dumb.prover.Formula;

import java.util.List;

import static dumb.prover.ProofException.RuleFailure.Reason.NOT_EXCLUDED_MIDDLE_SHAPE;

/**
 * Law of excluded middle. Only the exact shape {@code (P ∨ (¬P))} is accepted; {@code ((¬P) ∨ P)} is not.
 */
public class ExcludedMiddleRule extends BuiltinRule {
    public static final String NAME = "LEM";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "P ∨ ¬P";
    }

    @Override
    public Formula apply(List<Formula> inputs, Formula claimed) {
        requireInputs(inputs, 0);
        if (!(claimed instanceof Formula.Or or))
            throw fail(NOT_EXCLUDED_MIDDLE_SHAPE, "claimed formula is not a disjunction: " + claimed.text());
        if (!(or.r() instanceof Formula.Not not))
            throw fail(NOT_EXCLUDED_MIDDLE_SHAPE, "right-hand side is not a negation: " + claimed.text());
        if (!Formula.same(or.l(), not.inner()))
            throw fail(NOT_EXCLUDED_MIDDLE_SHAPE, "must be of the form (P ∨ ¬P): " + claimed.text());
        return claimed;
    }
}
