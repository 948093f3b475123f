package dumb.prover.rule;

import dumb.prover.Formula;
import dumb.prover.Language;
import dumb.prover.Substitution;
import dumb.prover.Term;

import java.util.List;

import static dumb.prover.ProofException.RuleFailure.Reason.*;

/**
 * Universal elimination: from {@code (∀v ∈ D)(φ)} and {@code (e ∈ D)} conclude {@code φ[v:=e]}.
 * <p>
 * The instantiation is plain name-based substitution; capture is not checked.
 */
public class ForallRule extends BuiltinRule {
    public static final String NAME = "FORALL";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "instantiate a universal with a member of its domain";
    }

    @Override
    public Formula apply(List<Formula> inputs, Formula claimed) {
        requireInputs(inputs, 2);
        if (!(inputs.get(0) instanceof Formula.Forall forall))
            throw fail(WRONG_INPUT_SHAPE, "first input must be a forall formula: " + inputs.get(0).text());
        if (!(inputs.get(1) instanceof Formula.Rel member) || !member.symbol().equals(Language.ELEMENT_OF) || member.args().size() != 2)
            throw fail(WRONG_INPUT_SHAPE, "second input must be a membership fact (e ∈ D): " + inputs.get(1).text());

        Term element = member.get(0), factDomain = member.get(1);
        if (!Term.same(forall.domain(), factDomain))
            throw fail(DOMAIN_MISMATCH, "element's domain " + factDomain.text() + " does not match forall domain " + forall.domain().text());

        var instantiated = Substitution.substitute(forall.inner(), forall.var(), element);
        if (!Formula.same(instantiated, claimed))
            throw fail(FORALL_ELIM_MISMATCH, "Claimed formula " + claimed.text() + " does not match derived formula " + instantiated.text());
        return instantiated;
    }
}
