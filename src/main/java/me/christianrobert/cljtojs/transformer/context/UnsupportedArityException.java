package me.christianrobert.cljtojs.transformer.context;

import me.christianrobert.cljtojs.transformer.tree.SourcePosition;

/**
 * A form was invoked with an operand count it does not support.
 * Operands are never silently dropped.
 */
public class UnsupportedArityException extends TranslationException {

    private final int minimum;
    private final int maximum;
    private final int actual;

    public UnsupportedArityException(String form, int expected, int actual, SourcePosition position) {
        this(form, expected, expected, actual, position);
    }

    public UnsupportedArityException(String form, int minimum, int maximum, int actual, SourcePosition position) {
        super(form + " expects " + describe(minimum, maximum) + ", got " + actual, position, form);
        this.minimum = minimum;
        this.maximum = maximum;
        this.actual = actual;
    }

    private static String describe(int minimum, int maximum) {
        if (minimum == maximum) {
            return minimum + (minimum == 1 ? " operand" : " operands");
        }
        return minimum + " to " + maximum + " operands";
    }

    public int getMinimum() {
        return minimum;
    }

    public int getMaximum() {
        return maximum;
    }

    public int getActual() {
        return actual;
    }
}
