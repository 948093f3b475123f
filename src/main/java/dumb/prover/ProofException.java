package dumb.prover;

/**
 * Root of every failure raised by the kernel. A call that throws leaves the {@link Proof} as it was.
 */
public class ProofException extends RuntimeException {

    public ProofException(String msg) {
        super(msg);
    }

    public static class UnknownRule extends ProofException {
        public final String rule;

        public UnknownRule(String rule) {
            super("Unknown rule: " + rule);
            this.rule = rule;
        }
    }

    public static class UnknownTactic extends ProofException {
        public final String tactic;

        public UnknownTactic(String tactic) {
            super("Unknown tactic: " + tactic);
            this.tactic = tactic;
        }
    }

    public static class InvalidDependency extends ProofException {
        public final int index;

        public InvalidDependency(int index, int lineCount) {
            super("Invalid dependency index " + index + " (" + lineCount + " accepted lines)");
            this.index = index;
        }
    }

    /** A rule rejected its inputs or the claim. */
    public static class RuleFailure extends ProofException {
        public final String rule;
        public final Reason reason;

        public RuleFailure(String rule, Reason reason, String msg) {
            super(rule + ": " + msg);
            this.rule = rule;
            this.reason = reason;
        }

        public enum Reason {
            NOT_AN_ASSUMPTION,
            AND_MISMATCH,
            NOT_REFLEXIVE,
            NOT_EXCLUDED_MIDDLE_SHAPE,
            CASES_MISMATCH,
            FORALL_ELIM_MISMATCH,
            DOMAIN_MISMATCH,
            BASE_MISMATCH,
            STEP_MISMATCH,
            INDUCTION_TARGET_MISMATCH,
            WRONG_INPUT_COUNT,
            WRONG_INPUT_SHAPE,
            NO_DERIVATION
        }
    }

    /** The rule derived something other than what the line claims. */
    public static class ClaimMismatch extends ProofException {
        public final Formula claimed, derived;

        public ClaimMismatch(Formula claimed, Formula derived) {
            super("Claimed statement " + claimed.text() + " does not match derived " + derived.text());
            this.claimed = claimed;
            this.derived = derived;
        }
    }

    public static class NoActiveGoal extends ProofException {
        public NoActiveGoal() {
            super("No active goal");
        }
    }

    public static class WrongGoalShape extends ProofException {
        public final Shape expected;

        public WrongGoalShape(Shape expected, String msg) {
            super(msg);
            this.expected = expected;
        }

        public enum Shape {FORALL, IMPLICATION, EQUALITY}
    }

    public static class InvalidLineIndex extends ProofException {
        public final int index;

        public InvalidLineIndex(int index) {
            super("Invalid equality line index " + index);
            this.index = index;
        }
    }
}
