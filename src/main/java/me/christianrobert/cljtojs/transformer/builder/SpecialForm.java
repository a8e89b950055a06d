package me.christianrobert.cljtojs.transformer.builder;

import java.util.HashMap;
import java.util.Map;

/**
 * Closed set of list heads with bespoke lowering rules.
 *
 * <p>Anything not listed here is an ordinary call, a property accessor ({@code .-name})
 * or an interop method call ({@code .name}).</p>
 */
public enum SpecialForm {
    NS("ns"),
    DEF("def"),
    DEFN("defn"),
    FN("fn"),
    SET("set!"),
    IF("if"),
    IF_NOT("if-not"),
    IF_LET("if-let"),
    WHEN("when"),
    DO("do"),

    // Comparisons use the source operator as the target comparator, except not=
    LESS_THAN("<", "<"),
    GREATER_THAN(">", ">"),
    LESS_OR_EQUAL("<=", "<="),
    GREATER_OR_EQUAL(">=", ">="),
    NUMERIC_EQUAL("==", "=="),
    NOT_EQUAL("not=", "!=="),

    ADD("+", "+"),
    SUBTRACT("-", "-"),
    MULTIPLY("*", "*"),
    DIVIDE("/", "/"),
    INC("inc", "+"),
    DEC("dec", "-"),
    STR("str", "+"),

    AND("and"),
    OR("or"),
    LET("let"),
    LOOP("loop"),
    RECUR("recur"),

    NEW("new"),
    DOT(".");

    private static final Map<String, SpecialForm> BY_SYMBOL = new HashMap<>();

    static {
        for (SpecialForm form : values()) {
            BY_SYMBOL.put(form.symbol, form);
        }
    }

    private final String symbol;
    private final String targetOperator;

    SpecialForm(String symbol) {
        this(symbol, null);
    }

    SpecialForm(String symbol, String targetOperator) {
        this.symbol = symbol;
        this.targetOperator = targetOperator;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * Operator emitted for comparison and arithmetic forms, null for all others.
     */
    public String getTargetOperator() {
        return targetOperator;
    }

    /**
     * Looks up a special form by its exact head symbol.
     *
     * @param symbol Head symbol name
     * @return Matching special form, or null for ordinary calls
     */
    public static SpecialForm fromSymbol(String symbol) {
        return symbol == null ? null : BY_SYMBOL.get(symbol);
    }
}
