package dumb.prover;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import dumb.prover.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Arithmetic vocabulary used by induction: the natural-number domain, {@code 0}, {@code 1}, the binary successor
 * function ({@code k + 1}) and the variable names introduced for the step and the conclusion.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProofConfig(
        @JsonProperty("naturals") String naturals,
        @JsonProperty("zero") String zero,
        @JsonProperty("one") String one,
        @JsonProperty("successor") String successor,
        @JsonProperty("stepVariable") String stepVariable,
        @JsonProperty("conclusionVariable") String conclusionVariable
) {
    public static final String RESOURCE = "/prover.json";
    public static final String DEFAULT_NATURALS = "ℕ", DEFAULT_ZERO = "0", DEFAULT_ONE = "1",
            DEFAULT_SUCCESSOR = Language.PLUS, DEFAULT_STEP_VARIABLE = "k", DEFAULT_CONCLUSION_VARIABLE = "n";
    public static final ProofConfig DEFAULT = new ProofConfig(null, null, null, null, null, null);

    private static final Logger logger = LoggerFactory.getLogger(ProofConfig.class);

    @JsonCreator
    public ProofConfig {
        naturals = naturals != null ? naturals : DEFAULT_NATURALS;
        zero = zero != null ? zero : DEFAULT_ZERO;
        one = one != null ? one : DEFAULT_ONE;
        successor = successor != null ? successor : DEFAULT_SUCCESSOR;
        stepVariable = stepVariable != null ? stepVariable : DEFAULT_STEP_VARIABLE;
        conclusionVariable = conclusionVariable != null ? conclusionVariable : DEFAULT_CONCLUSION_VARIABLE;
    }

    /** Reads {@value #RESOURCE} from the classpath, or the defaults when it is absent. */
    public static ProofConfig load() {
        try (var in = ProofConfig.class.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                logger.debug("No {} on classpath; using defaults", RESOURCE);
                return DEFAULT;
            }
            var config = Json.obj(in, ProofConfig.class);
            logger.debug("Loaded {}", config);
            return config;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }
    }

    public static ProofConfig parse(String json) {
        try {
            return Json.obj(json, ProofConfig.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid prover configuration: " + e.getOriginalMessage(), e);
        }
    }

    public Term naturalsTerm() {
        return Term.constant(naturals);
    }

    public Term zeroTerm() {
        return Term.constant(zero);
    }

    /** {@code t + 1} */
    public Term successorOf(Term t) {
        return Term.fn(successor, t, Term.constant(one));
    }
}
