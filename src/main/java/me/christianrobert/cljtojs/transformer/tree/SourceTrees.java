package me.christianrobert.cljtojs.transformer.tree;

import java.util.Arrays;
import java.util.List;

/**
 * Factory for syntax trees in the reader's binary encoding.
 *
 * <p>Builds exactly the shapes the reader produces: atoms inside lists and vectors are
 * boxed in {@link NodeKind#LEAF} wrappers, keywords stay bare, sibling forms are linked
 * through right-leaning {@link NodeKind#SEQUENCE} chains.</p>
 *
 * <pre>
 * SourceNode tree = list(sym("if"), sym("ready"), str("yes"), str("no"));
 * </pre>
 */
public final class SourceTrees {

    private SourceTrees() {
    }

    // ========== Atoms ==========

    public static SourceNode sym(String name) {
        return leaf(SourceNode.atom(NodeKind.SYMBOL, name, null));
    }

    public static SourceNode str(String text) {
        return leaf(SourceNode.atom(NodeKind.STRING, text, null));
    }

    public static SourceNode num(String text) {
        return leaf(SourceNode.atom(NodeKind.NUMBER, text, null));
    }

    public static SourceNode num(long value) {
        return num(Long.toString(value));
    }

    public static SourceNode bool(boolean value) {
        return leaf(SourceNode.atom(NodeKind.BOOLEAN, value, null));
    }

    /**
     * Keyword atom, including its leading marker (e.g. ":foo").
     */
    public static SourceNode kw(String text) {
        return SourceNode.atom(NodeKind.KEYWORD, text, null);
    }

    public static SourceNode leaf(SourceNode atom) {
        return SourceNode.composite(NodeKind.LEAF, atom, null, atom.getPosition());
    }

    // ========== Composites ==========

    public static SourceNode list(SourceNode... forms) {
        return SourceNode.composite(NodeKind.LIST, chain(Arrays.asList(forms)), null, null);
    }

    public static SourceNode vector(SourceNode... forms) {
        return SourceNode.composite(NodeKind.VECTOR, chain(Arrays.asList(forms)), null, null);
    }

    /**
     * Top-level sequence of forms, as produced for a whole program.
     */
    public static SourceNode program(SourceNode... forms) {
        return chain(Arrays.asList(forms));
    }

    /**
     * Links forms into a right-leaning sequence chain.
     *
     * @param forms Ordered sibling forms
     * @return Head of the chain, or null for no forms
     */
    public static SourceNode chain(List<SourceNode> forms) {
        SourceNode rest = null;
        for (int i = forms.size() - 1; i >= 0; i--) {
            rest = SourceNode.composite(NodeKind.SEQUENCE, forms.get(i), rest, null);
        }
        return rest;
    }

    // ========== Reader macros ==========

    /**
     * {@code @form}
     */
    public static SourceNode deref(SourceNode form) {
        return macro(SourceNode.atom(NodeKind.DEREF, "@", null), form);
    }

    /**
     * {@code #(...)}
     */
    public static SourceNode anonymousFn(SourceNode body) {
        return dispatch("#", body);
    }

    /**
     * {@code #_form}
     */
    public static SourceNode discard(SourceNode form) {
        return dispatch("#_", form);
    }

    public static SourceNode dispatch(String marker, SourceNode form) {
        return macro(SourceNode.atom(NodeKind.DISPATCH, marker, null), form);
    }

    private static SourceNode macro(SourceNode marker, SourceNode form) {
        SourceNode markerLink = SourceNode.composite(NodeKind.SEQUENCE, marker, null, null);
        return SourceNode.composite(NodeKind.MACRO, markerLink, form, null);
    }
}
