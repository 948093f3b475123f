package dumb.prover.rule;

import dumb.prover.Formula;
import dumb.prover.ProofConfig;
import dumb.prover.Substitution;
import dumb.prover.Term;

import java.util.List;

import static dumb.prover.ProofException.RuleFailure.Reason.*;
import static java.util.Objects.requireNonNull;

/**
 * Mathematical induction over the naturals.
 * <p>
 * Inputs: the base {@code P(0)} and the step {@code (∀k ∈ _)(P(k) → P(k + 1))}. The antecedent of the step is
 * taken as the schema {@code P} in {@code k}. Concludes {@code (∀n ∈ ℕ)(P(n))}.
 */
public class InductionRule extends BuiltinRule {
    public static final String NAME = "INDUCTION";

    private final ProofConfig config;

    public InductionRule(ProofConfig config) {
        this.config = requireNonNull(config);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "induction from P(0) and ∀k (P(k) → P(k+1))";
    }

    @Override
    public Formula apply(List<Formula> inputs, Formula claimed) {
        requireInputs(inputs, 2);
        var base = inputs.get(0);
        if (!(inputs.get(1) instanceof Formula.Forall step))
            throw fail(WRONG_INPUT_SHAPE, "step must be a forall formula: " + inputs.get(1).text());
        if (!(step.inner() instanceof Formula.Implies implies))
            throw fail(WRONG_INPUT_SHAPE, "step must be an implication (P(k) → P(k+1)): " + step.inner().text());

        var k = step.var();
        var schema = implies.l();

        var p0 = Substitution.substitute(schema, k, config.zeroTerm());
        if (!Formula.same(p0, base))
            throw fail(BASE_MISMATCH, "expected " + base.text() + " but got " + p0.text()
                    + " when substituting " + k + " := " + config.zero() + " in " + schema.text());

        var pSucc = Substitution.substitute(schema, k, config.successorOf(Term.var(k)));
        if (!Formula.same(pSucc, implies.r()))
            throw fail(STEP_MISMATCH, "step conclusion " + implies.r().text() + " is not " + pSucc.text());

        var n = config.conclusionVariable();
        var result = Formula.forall(n, config.naturalsTerm(), Substitution.substitute(schema, k, Term.var(n)));
        if (!Formula.same(result, claimed))
            throw fail(INDUCTION_TARGET_MISMATCH, "Claimed " + claimed.text() + " does not match derived " + result.text());
        return result;
    }
}
