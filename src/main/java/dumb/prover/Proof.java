package dumb.prover;

import com.fasterxml.jackson.databind.JsonNode;
import dumb.prover.ProofException.WrongGoalShape.Shape;
import dumb.prover.rule.*;
import dumb.prover.util.Json;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

import static java.util.Objects.requireNonNull;

/**
 * Goal-directed proof state: assumptions, accepted lines, outstanding goals with one active goal, and the rule and
 * tactic registries.
 * <p>
 * Lines are appended only by {@link #addLine(Formula, String, List)}, which verifies them against their rule.
 * Tactics rewrite the active goal. Every failing call throws a {@link ProofException} and leaves the state unchanged.
 * Not thread-safe.
 */
public class Proof {
    public static final String TACTIC_FORALL = "FORALL_INTRO", TACTIC_IMPLIES = "IMPLIES_INTRO", TACTIC_INDUCTION = "INDUCTION";

    private static final Logger logger = LoggerFactory.getLogger(Proof.class);

    private final ProofConfig config;
    private final List<Formula> assumptions;
    private final List<ProofLine> lines = new ArrayList<>();
    private final List<Formula> goals = new ArrayList<>();
    private int activeGoal = 0;

    /** Snapshot of the goal list taken by each tactic before it mutates; append-only. */
    private final List<List<Formula>> history = new ArrayList<>();

    private final Rules rules = new Rules();
    private final Map<String, Tactic> tactics = new LinkedHashMap<>();

    public Proof(List<Formula> assumptions, Formula target) {
        this(assumptions, target, ProofConfig.DEFAULT);
    }

    public Proof(List<Formula> assumptions, Formula target, ProofConfig config) {
        this.config = requireNonNull(config);
        this.assumptions = new ArrayList<>(assumptions);
        this.assumptions.forEach(a -> requireNonNull(a, "assumption"));
        goals.add(requireNonNull(target));

        rules.add(new AssumptionRule(() -> this.assumptions));
        rules.add(new AndRule());
        rules.add(new ForallRule());
        rules.add(new EqRule());
        rules.add(new ExcludedMiddleRule());
        rules.add(new CasesRule());
        rules.add(new InductionRule(config));

        registerTactic(TACTIC_FORALL, (proof, args) -> {
            requireArgs(TACTIC_FORALL, args, 0, 1);
            proof.instantiateForall(args.isEmpty() ? null : args.get(0));
        });
        registerTactic(TACTIC_IMPLIES, (proof, args) -> {
            requireArgs(TACTIC_IMPLIES, args, 0, 0);
            proof.instantiateImplication();
        });
        registerTactic(TACTIC_INDUCTION, (proof, args) -> {
            requireArgs(TACTIC_INDUCTION, args, 0, 0);
            proof.instantiateInduction();
        });
    }

    private static void requireArgs(String tactic, List<Term> args, int min, int max) {
        if (args.size() < min || args.size() > max)
            throw new IllegalArgumentException(tactic + " takes " + (min == max ? String.valueOf(min) : min + " to " + max)
                    + " term arguments, got " + args.size());
    }

    public void registerRule(String name, Rule rule) {
        rules.register(name, rule);
    }

    public void registerTactic(String name, Tactic tactic) {
        tactics.put(requireNonNull(name), requireNonNull(tactic));
        logger.debug("Registered tactic: {}", name);
    }

    public void applyTactic(String name, List<Term> args) {
        var tactic = tactics.get(name);
        if (tactic == null) throw new ProofException.UnknownTactic(name);
        tactic.apply(this, List.copyOf(args));
    }

    public void applyTactic(String name, Term... args) {
        applyTactic(name, List.of(args));
    }

    public void addLine(Formula claimed, String ruleName, Integer... deps) {
        addLine(claimed, ruleName, List.of(deps));
    }

    /**
     * Checks {@code claimed} with the named rule against the statements of the referenced lines and appends it.
     * The first outstanding goal with the same key as {@code claimed} is discharged.
     */
    public void addLine(Formula claimed, String ruleName, List<Integer> deps) {
        requireNonNull(claimed);
        var rule = rules.get(ruleName).orElseThrow(() -> new ProofException.UnknownRule(ruleName));

        var inputs = new ArrayList<Formula>(deps.size());
        for (int idx : deps) {
            if (idx < 0 || idx >= lines.size()) throw new ProofException.InvalidDependency(idx, lines.size());
            inputs.add(lines.get(idx).statement());
        }

        Formula derived;
        try {
            derived = rule.apply(Collections.unmodifiableList(inputs), claimed);
        } catch (ProofException e) {
            logger.debug("Rejected {} by {}: {}", claimed, ruleName, e.getMessage());
            throw e;
        }
        if (derived == null)
            throw new ProofException.RuleFailure(ruleName, ProofException.RuleFailure.Reason.NO_DERIVATION, "rule derived nothing");
        if (!Formula.same(derived, claimed)) throw new ProofException.ClaimMismatch(claimed, derived);

        lines.add(new ProofLine(claimed, ruleName, deps));
        logger.debug("({}) {} [{} {}]", lines.size() - 1, claimed, ruleName, deps);

        for (var i = 0; i < goals.size(); i++) {
            if (Formula.same(goals.get(i), claimed)) {
                goals.remove(i);
                if (activeGoal >= i && activeGoal > 0) activeGoal--;
                logger.debug("Goal {} completed, {} remaining", claimed, goals.size());
                break;
            }
        }
    }

    /**
     * Active goal {@code (∀v ∈ D)(φ)} becomes {@code φ[v:=w]} and {@code (w ∈ D)} is assumed.
     *
     * @param witness term standing for an arbitrary member of {@code D}; the variable {@code v} itself when null
     */
    public void instantiateForall(@Nullable Term witness) {
        var goal = activeTarget();
        if (!(goal instanceof Formula.Forall forall))
            throw new ProofException.WrongGoalShape(Shape.FORALL, "instantiateForall: active goal is not a forall formula: " + goal.text());

        var w = witness != null ? witness : Term.var(forall.var());
        var instantiated = Substitution.substitute(forall.inner(), forall.var(), w);

        snapshot();
        assumptions.add(Formula.member(w, forall.domain()));
        goals.set(activeGoal, instantiated);
        logger.debug("Instantiated {} with {}", forall, w);
    }

    public void instantiateForall() {
        instantiateForall(null);
    }

    /** Active goal {@code (A → B)} becomes {@code B} and {@code A} is assumed. */
    public void instantiateImplication() {
        var goal = activeTarget();
        if (!(goal instanceof Formula.Implies implies))
            throw new ProofException.WrongGoalShape(Shape.IMPLICATION, "instantiateImplication: active goal is not an implication formula: " + goal.text());

        snapshot();
        assumptions.add(implies.l());
        goals.set(activeGoal, implies.r());
        logger.debug("Assumed {}", implies.l());
    }

    /**
     * Active goal {@code (∀v ∈ ℕ)(P)} is split into the base {@code P[v:=0]}, which stays active, and the step
     * {@code (∀k ∈ ℕ)(P[v:=k] → P[v:=k + 1])}, appended as a new goal.
     */
    public void instantiateInduction() {
        var goal = activeTarget();
        if (!(goal instanceof Formula.Forall forall))
            throw new ProofException.WrongGoalShape(Shape.FORALL, "instantiateInduction: active goal is not a forall formula: " + goal.text());
        var naturals = config.naturalsTerm();
        if (!Term.same(forall.domain(), naturals))
            throw new ProofException.WrongGoalShape(Shape.FORALL, "instantiateInduction: active goal does not range over " + naturals.text() + ": " + goal.text());

        var v = forall.var();
        var p = forall.inner();
        var k = Term.var(config.stepVariable());
        var base = Substitution.substitute(p, v, config.zeroTerm());
        var step = Formula.forall(k.name(), naturals, Formula.implies(
                Substitution.substitute(p, v, k),
                Substitution.substitute(p, v, config.successorOf(k))));

        snapshot();
        goals.set(activeGoal, base);
        goals.add(step);
        logger.debug("Induction on {}: base {}, step {}", v, base, step);
    }

    /** Rewrites the active goal left to right with the equality accepted at {@code equalityLine}. */
    public void rewriteTargetUsingEquality(int equalityLine) {
        var goal = activeTarget();
        if (equalityLine < 0 || equalityLine >= lines.size()) throw new ProofException.InvalidLineIndex(equalityLine);
        var statement = lines.get(equalityLine).statement();
        if (!(statement instanceof Formula.Eq eq))
            throw new ProofException.WrongGoalShape(Shape.EQUALITY, "Selected line is not an equality: " + statement.text());

        var rewritten = Substitution.replace(goal, eq.l(), eq.r());

        snapshot();
        goals.set(activeGoal, rewritten);
        logger.debug("Rewrote {} to {}", goal, rewritten);
    }

    private void snapshot() {
        history.add(List.copyOf(goals));
    }

    public Formula activeTarget() {
        if (goals.isEmpty() || activeGoal >= goals.size()) throw new ProofException.NoActiveGoal();
        return goals.get(activeGoal);
    }

    public boolean isValid() {
        return goals.isEmpty();
    }

    public ProofConfig config() {
        return config;
    }

    public List<Formula> assumptions() {
        return Collections.unmodifiableList(assumptions);
    }

    public List<ProofLine> lines() {
        return Collections.unmodifiableList(lines);
    }

    public List<Formula> goals() {
        return Collections.unmodifiableList(goals);
    }

    public int activeGoalIndex() {
        return activeGoal;
    }

    public List<List<Formula>> history() {
        return Collections.unmodifiableList(history);
    }

    public List<String> ruleNames() {
        return rules.names();
    }

    public List<String> tacticNames() {
        return List.copyOf(tactics.keySet());
    }

    public String render() {
        var sb = new StringBuilder("===== Proof State =====\n");
        sb.append("Assumptions:\n");
        for (var i = 0; i < assumptions.size(); i++)
            sb.append("  [").append(i).append("] ").append(assumptions.get(i).text()).append('\n');

        sb.append("Proof Lines:\n");
        for (var i = 0; i < lines.size(); i++) {
            var line = lines.get(i);
            sb.append("  (").append(i).append(") ").append(line.statement().text()).append("    [").append(line.justification());
            if (!line.dependencies().isEmpty()) {
                sb.append(" deps:");
                line.dependencies().forEach(d -> sb.append(' ').append(d));
            }
            sb.append("]\n");
        }

        sb.append("Targets (").append(goals.size()).append(" remaining):\n");
        for (var i = 0; i < goals.size(); i++) {
            sb.append("  [").append(i).append("] ").append(goals.get(i).text());
            if (i == activeGoal) sb.append("   <-- active goal");
            sb.append('\n');
        }
        if (goals.isEmpty()) sb.append("  <all targets completed>\n");
        return sb.append("=======================\n").toString();
    }

    public void print() {
        System.out.print(render());
    }

    /** Read-only snapshot of the state. */
    public JsonNode toJson() {
        var json = Json.node();
        var a = json.putArray("assumptions");
        assumptions.forEach(f -> a.add(f.text()));
        var l = json.putArray("lines");
        IntStream.range(0, lines.size()).forEach(i -> {
            var line = lines.get(i);
            var n = l.addObject().put("index", i).put("statement", line.statement().text()).put("rule", line.justification());
            var d = n.putArray("dependencies");
            line.dependencies().forEach(d::add);
        });
        var g = json.putArray("goals");
        goals.forEach(f -> g.add(f.text()));
        json.put("activeGoal", goals.isEmpty() ? -1 : activeGoal);
        json.put("historyDepth", history.size());
        json.put("valid", isValid());
        return json;
    }

    @Override
    public String toString() {
        return render();
    }
}
