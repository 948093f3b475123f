package dumb.prover;

import dumb.prover.rule.BuiltinRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static java.util.Objects.requireNonNull;
import static java.util.Optional.ofNullable;

/** Name-keyed rule registry. Registering an existing name replaces the previous rule. */
public class Rules {
    private static final Logger logger = LoggerFactory.getLogger(Rules.class);

    private final Map<String, Rule> rules = new LinkedHashMap<>();

    public void register(String name, Rule rule) {
        rules.put(requireNonNull(name), requireNonNull(rule));
        logger.debug("Registered rule: {}", name);
    }

    public void add(BuiltinRule rule) {
        rules.put(rule.name(), rule);
        logger.debug("Registered rule: {} ({})", rule.name(), rule.description());
    }

    public Optional<Rule> get(String name) {
        return ofNullable(rules.get(name));
    }

    /** In registration order. */
    public List<String> names() {
        return List.copyOf(rules.keySet());
    }
}
