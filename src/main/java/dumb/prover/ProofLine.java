package dumb.prover;

import java.util.List;

import static java.util.Objects.requireNonNull;

/** An accepted line: the statement, the rule that licensed it and the earlier lines it used. */
public record ProofLine(Formula statement, String justification, List<Integer> dependencies) {
    public ProofLine {
        requireNonNull(statement);
        requireNonNull(justification);
        dependencies = List.copyOf(dependencies);
    }
}
