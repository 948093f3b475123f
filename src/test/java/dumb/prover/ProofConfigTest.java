package dumb.prover;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProofConfigTest {

    @Test
    void bundledResourceMatchesDefaults() {
        assertEquals(ProofConfig.DEFAULT, ProofConfig.load());
    }

    @Test
    void missingFieldsFallBackToDefaults() {
        var config = ProofConfig.parse("{\"naturals\":\"Nat\"}");
        assertEquals("Nat", config.naturals());
        assertEquals("0", config.zero());
        assertEquals("+", config.successor());
        assertEquals("k", config.stepVariable());
        assertEquals(ProofConfig.DEFAULT, ProofConfig.parse("{}"));
    }

    @Test
    void invalidJsonIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> ProofConfig.parse("{naturals"));
        assertThrows(IllegalArgumentException.class, () -> ProofConfig.parse("{\"domain\":\"Nat\"}"));
    }

    @Test
    void vocabularyTerms() {
        var config = ProofConfig.parse("{\"successor\":\"s\",\"one\":\"I\"}");
        assertEquals("s(x, I)", config.successorOf(Term.var("x")).text());
        assertEquals("(x + 1)", ProofConfig.DEFAULT.successorOf(Term.var("x")).text());
        assertEquals("ℕ", ProofConfig.DEFAULT.naturalsTerm().text());
    }

    @Test
    void inductionTacticUsesConfiguredVocabulary() {
        var config = ProofConfig.parse("{\"naturals\":\"Nat\",\"zero\":\"z\",\"stepVariable\":\"j\"}");
        var proof = new Proof(List.of(), Formula.forall("n", Term.constant("Nat"), Formula.rel("P", Term.var("n"))), config);
        proof.instantiateInduction();
        assertEquals("P(z)", proof.goals().get(0).text());
        assertEquals("(∀j ∈ Nat)((P(j) → P((j + 1))))", proof.goals().get(1).text());

        var overDefaultNaturals = new Proof(List.of(), Formula.forall("n", Term.constant("ℕ"), Formula.rel("P", Term.var("n"))), config);
        assertThrows(ProofException.WrongGoalShape.class, overDefaultNaturals::instantiateInduction);
    }
}
