package me.christianrobert.cljtojs.transformer.context;

import me.christianrobert.cljtojs.transformer.tree.SourcePosition;

/**
 * A node tag outside the grammar reached the translator.
 * Indicates a reader/grammar mismatch upstream.
 */
public class UnknownNodeKindException extends TranslationException {

    public UnknownNodeKindException(String message, SourcePosition position) {
        super(message, position);
    }
}
