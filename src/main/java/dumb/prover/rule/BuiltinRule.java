package dumb.prover.rule;

import dumb.prover.Formula;
import dumb.prover.ProofException.RuleFailure;
import dumb.prover.Rule;

import java.util.List;

/**
 * Base for the rules a {@link dumb.prover.Proof} registers on construction.
 */
public abstract class BuiltinRule implements Rule {

    /** Registry key, also shown as the justification of accepted lines. */
    public abstract String name();

    public abstract String description();

    protected RuleFailure fail(RuleFailure.Reason reason, String msg) {
        return new RuleFailure(name(), reason, msg);
    }

    protected void requireInputs(List<Formula> inputs, int count) {
        if (inputs.size() != count)
            throw fail(RuleFailure.Reason.WRONG_INPUT_COUNT,
                    "expects " + count + " input" + (count == 1 ? "" : "s") + ", got " + inputs.size());
    }

    @Override
    public String toString() {
        return name();
    }
}
