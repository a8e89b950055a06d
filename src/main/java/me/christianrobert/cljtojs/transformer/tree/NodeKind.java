package me.christianrobert.cljtojs.transformer.tree;

import me.christianrobert.cljtojs.transformer.context.UnknownNodeKindException;

/**
 * Closed set of node kinds produced by the reader.
 *
 * <p>Composite kinds ({@link #SEQUENCE}, {@link #LIST}, {@link #VECTOR}, {@link #MACRO})
 * are binary: {@code left} holds the first child and {@code right} the rest of the
 * siblings. {@link #LEAF} boxes exactly one atom in {@code left}.</p>
 *
 * <p>{@link #DEREF} and {@link #DISPATCH} are macro markers. They only appear as the
 * first child of a {@link #MACRO} node and are never translated on their own.</p>
 */
public enum NodeKind {
    SEQUENCE(true),
    LIST(true),
    VECTOR(true),
    KEYWORD(false),
    SYMBOL(false),
    STRING(false),
    NUMBER(false),
    BOOLEAN(false),
    LEAF(true),
    MACRO(true),
    DEREF(false),
    DISPATCH(false);

    private final boolean composite;

    NodeKind(boolean composite) {
        this.composite = composite;
    }

    public boolean isComposite() {
        return composite;
    }

    public boolean isAtom() {
        return this == KEYWORD || this == SYMBOL || this == STRING || this == NUMBER || this == BOOLEAN;
    }

    public boolean isMarker() {
        return this == DEREF || this == DISPATCH;
    }

    /**
     * Maps a reader tag to its node kind.
     *
     * <p>The reader emits two tags for a sequence of forms ({@code list_list} inside a
     * list, {@code s_exp_list} at program level); both map to {@link #SEQUENCE}.</p>
     *
     * @param tag Reader tag (e.g. "list", "leaf", "s_exp_list")
     * @return Matching node kind
     * @throws UnknownNodeKindException if the tag is outside the grammar
     */
    public static NodeKind fromTag(String tag) {
        if (tag == null) {
            throw new UnknownNodeKindException("Node tag cannot be null", null);
        }

        return switch (tag) {
            case "list_list", "s_exp_list" -> SEQUENCE;
            case "list" -> LIST;
            case "vector" -> VECTOR;
            case "keyword" -> KEYWORD;
            case "symbol" -> SYMBOL;
            case "string" -> STRING;
            case "number" -> NUMBER;
            case "boolean" -> BOOLEAN;
            case "leaf" -> LEAF;
            case "macro" -> MACRO;
            case "deref" -> DEREF;
            case "dispatch" -> DISPATCH;
            default -> throw new UnknownNodeKindException("Unknown node type " + tag, null);
        };
    }
}
