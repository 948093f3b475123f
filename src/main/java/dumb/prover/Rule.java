package dumb.prover;

import java.util.List;

/**
 * Verification procedure for one kind of proof line.
 * <p>
 * Receives the statements of the referenced lines, in the order given, and the claimed statement. Returns the
 * formula the inference yields, which the line checker compares against the claim, or throws
 * {@link ProofException.RuleFailure}.
 */
@FunctionalInterface
public interface Rule {
    Formula apply(List<Formula> inputs, Formula claimed);
}
