package dumb.prover;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Symbols shared by the renderer and the rules, plus the fixed toy signature checked by
 * {@link Term#isWellFormed()} and {@link Formula#isWellFormed()}.
 * <p>
 * The signature is intentionally narrower than what the constructors accept: variables {@code v1, v2, ...},
 * constants {@code 0} and {@code 1}, functions {@code succ/1}, {@code +/2}, {@code * /2} and the relation {@code </2}.
 */
public final class Language {
    public static final String ELEMENT_OF = "∈";
    public static final String PLUS = "+";
    public static final String TIMES = "*";
    public static final String SUCC = "succ";
    public static final String LESS = "<";
    public static final String LESS_EQ = "≤";
    public static final String GREATER = ">";
    public static final String EQUALS = "=";
    public static final String NOT = "¬", OR = "∨", AND = "∧", IMPLIES = "→", FORALL = "∀", EXISTS = "∃";

    /** Binary function symbols rendered {@code (a op b)}. */
    static final Set<String> INFIX_FUNCTIONS = Set.of(PLUS, TIMES, ELEMENT_OF);

    /** Binary relation symbols rendered {@code (a op b)}; {@code =} is reserved for {@link Formula.Eq}. */
    static final Set<String> INFIX_RELATIONS = Set.of(ELEMENT_OF, LESS, LESS_EQ, GREATER);

    private static final Pattern VARIABLE = Pattern.compile("v[0-9]+");

    private Language() {
    }

    public static boolean isVariable(String s) {
        return VARIABLE.matcher(s).matches();
    }

    public static boolean isConstant(String s) {
        return s.equals("0") || s.equals("1");
    }

    public static boolean isFunction(String s, int arity) {
        return (s.equals(SUCC) && arity == 1) || (s.equals(PLUS) && arity == 2) || (s.equals(TIMES) && arity == 2);
    }

    public static boolean isRelation(String s, int arity) {
        return s.equals(LESS) && arity == 2;
    }
}
