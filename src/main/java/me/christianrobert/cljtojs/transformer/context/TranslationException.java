package me.christianrobert.cljtojs.transformer.context;

import me.christianrobert.cljtojs.transformer.tree.SourcePosition;

/**
 * Exception thrown during translation of a syntax tree.
 * Captures the offending node's position and the form being translated.
 *
 * <p>Translation has no recovery mode: any instance aborts the whole compilation unit.</p>
 */
public class TranslationException extends RuntimeException {

    private final SourcePosition position;
    private final String context;

    public TranslationException(String message) {
        this(message, null, null);
    }

    public TranslationException(String message, SourcePosition position) {
        this(message, position, null);
    }

    public TranslationException(String message, SourcePosition position, String context) {
        super(message);
        this.position = position;
        this.context = context;
    }

    public TranslationException(String message, SourcePosition position, String context, Throwable cause) {
        super(message, cause);
        this.position = position;
        this.context = context;
    }

    /**
     * Gets the source position of the offending node.
     *
     * @return Position, or null if the reader supplied none
     */
    public SourcePosition getPosition() {
        return position;
    }

    /**
     * Gets the form being translated when the failure occurred (e.g. "let").
     */
    public String getContext() {
        return context;
    }

    /**
     * Gets a detailed error message including position and form context.
     */
    public String getDetailedMessage() {
        StringBuilder sb = new StringBuilder(getMessage());
        if (position != null) {
            sb.append("\nPosition: ").append(position);
        }
        if (context != null) {
            sb.append("\nForm: ").append(context);
        }
        return sb.toString();
    }
}
