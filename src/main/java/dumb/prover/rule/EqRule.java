package dumb.prover.rule;

import dumb.prover.Formula;
import dumb.prover.Term;

import java.util.List;

import static dumb.prover.ProofException.RuleFailure.Reason.NOT_REFLEXIVE;

/** Reflexivity: {@code (t = t)} holds without premises. */
public class EqRule extends BuiltinRule {
    public static final String NAME = "EQ";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "reflexivity of equality";
    }

    @Override
    public Formula apply(List<Formula> inputs, Formula claimed) {
        requireInputs(inputs, 0);
        if (!(claimed instanceof Formula.Eq eq))
            throw fail(NOT_REFLEXIVE, "Claimed formula is not an equality: " + claimed.text());
        if (!Term.same(eq.l(), eq.r()))
            throw fail(NOT_REFLEXIVE, "Left and right sides of equality differ: " + claimed.text());
        return claimed;
    }
}
