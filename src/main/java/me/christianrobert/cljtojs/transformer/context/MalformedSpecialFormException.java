package me.christianrobert.cljtojs.transformer.context;

import me.christianrobert.cljtojs.transformer.tree.SourcePosition;

/**
 * A special form is missing a child it requires, or a child has the wrong shape
 * (e.g. {@code def} without a value, {@code let} bindings that are not a vector).
 */
public class MalformedSpecialFormException extends TranslationException {

    public MalformedSpecialFormException(String message, SourcePosition position, String form) {
        super(message, position, form);
    }
}
