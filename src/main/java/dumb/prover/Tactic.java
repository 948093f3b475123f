package dumb.prover;

import java.util.List;

/** Transforms the active goal of a proof, optionally guided by term arguments. */
@FunctionalInterface
public interface Tactic {
    void apply(Proof proof, List<Term> args);
}
