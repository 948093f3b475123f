package dumb.prover.rule;

import dumb.prover.Formula;

import java.util.Collection;
import java.util.List;
import java.util.function.Supplier;

import static dumb.prover.ProofException.RuleFailure.Reason.NOT_AN_ASSUMPTION;
import static java.util.Objects.requireNonNull;

/** Restates a current assumption. Sees assumptions added by tactics after registration. */
public class AssumptionRule extends BuiltinRule {
    public static final String NAME = "ASSUMPTION";

    private final Supplier<? extends Collection<Formula>> assumptions;

    public AssumptionRule(Supplier<? extends Collection<Formula>> assumptions) {
        this.assumptions = requireNonNull(assumptions);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "claimed formula is one of the current assumptions";
    }

    @Override
    public Formula apply(List<Formula> inputs, Formula claimed) {
        requireInputs(inputs, 0);
        return assumptions.get().stream()
                .filter(a -> Formula.same(a, claimed))
                .findFirst()
                .orElseThrow(() -> fail(NOT_AN_ASSUMPTION, "Invalid assumption: " + claimed.text()));
    }
}
