package me.christianrobert.cljtojs.transformer.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable node of the parsed syntax tree.
 *
 * <p>Composite nodes use a right-leaning binary encoding of n-ary sequences:</p>
 * <pre>
 * (f a b)  =  LIST
 *               left: SEQUENCE
 *                       left: LEAF(SYMBOL f)
 *                       right: SEQUENCE
 *                                left: LEAF(SYMBOL a)
 *                                right: SEQUENCE
 *                                         left: LEAF(SYMBOL b)
 *                                         right: null
 * </pre>
 *
 * <p>Atoms carry a value instead of children: a {@link String} for symbols, keywords,
 * strings, numbers (verbatim source text) and macro markers, a {@link Boolean} for
 * booleans.</p>
 */
public class SourceNode {

    private final NodeKind kind;
    private final SourceNode left;
    private final SourceNode right;
    private final Object value;
    private final SourcePosition position;

    private SourceNode(NodeKind kind, SourceNode left, SourceNode right, Object value, SourcePosition position) {
        if (kind == null) {
            throw new IllegalArgumentException("Node kind cannot be null");
        }
        if (kind.isComposite() && value != null) {
            throw new IllegalArgumentException("Composite node " + kind + " cannot carry a value");
        }
        if (!kind.isComposite() && (left != null || right != null)) {
            throw new IllegalArgumentException("Atom node " + kind + " cannot have children");
        }
        if (kind == NodeKind.BOOLEAN && !(value instanceof Boolean)) {
            throw new IllegalArgumentException("Boolean node requires a Boolean value");
        }
        if (!kind.isComposite() && kind != NodeKind.BOOLEAN && !(value instanceof String)) {
            throw new IllegalArgumentException(kind + " node requires a String value");
        }

        this.kind = kind;
        this.left = left;
        this.right = right;
        this.value = value;
        this.position = position;
    }

    public static SourceNode composite(NodeKind kind, SourceNode left, SourceNode right, SourcePosition position) {
        return new SourceNode(kind, left, right, null, position);
    }

    public static SourceNode atom(NodeKind kind, Object value, SourcePosition position) {
        return new SourceNode(kind, null, null, value, position);
    }

    public NodeKind getKind() {
        return kind;
    }

    public SourceNode getLeft() {
        return left;
    }

    public SourceNode getRight() {
        return right;
    }

    public Object getValue() {
        return value;
    }

    /**
     * Gets the textual payload of an atom (symbol name, keyword text, string contents,
     * number text, marker text).
     *
     * @return Text value, or null for composites
     */
    public String getText() {
        return value == null ? null : value.toString();
    }

    public SourcePosition getPosition() {
        return position;
    }

    public boolean is(NodeKind expected) {
        return kind == expected;
    }

    /**
     * A literal symbol is a leaf wrapper around a symbol atom, the only head shape
     * that takes part in special-form dispatch.
     */
    public boolean isLiteralSymbol() {
        return kind == NodeKind.LEAF && left != null && left.kind == NodeKind.SYMBOL;
    }

    /**
     * Returns the symbol name of a literal symbol.
     *
     * @return Symbol name, or null if this node is not a literal symbol
     */
    public String getSymbolName() {
        return isLiteralSymbol() ? left.getText() : null;
    }

    /**
     * Flattens the binary encoding of a composite into its ordered elements.
     *
     * <p>Both children are walked as sibling chains. A chain link whose kind is not
     * {@link NodeKind#SEQUENCE} is itself the last element of the chain.</p>
     *
     * @return Ordered elements (empty for atoms and empty composites)
     */
    public List<SourceNode> elements() {
        if (!kind.isComposite()) {
            return Collections.emptyList();
        }
        List<SourceNode> result = new ArrayList<>();
        collectChain(left, result);
        collectChain(right, result);
        return result;
    }

    private static void collectChain(SourceNode link, List<SourceNode> out) {
        SourceNode current = link;
        while (current != null) {
            if (current.kind != NodeKind.SEQUENCE) {
                out.add(current);
                return;
            }
            if (current.left != null) {
                out.add(current.left);
            }
            current = current.right;
        }
    }

    /**
     * Copy of this atom with a different value, same kind and position.
     */
    public SourceNode withValue(Object newValue) {
        return new SourceNode(kind, null, null, newValue, position);
    }

    /**
     * Copy of this composite with different children, same kind and position.
     */
    public SourceNode withChildren(SourceNode newLeft, SourceNode newRight) {
        return new SourceNode(kind, newLeft, newRight, null, position);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SourceNode that = (SourceNode) o;
        return kind == that.kind
                && Objects.equals(left, that.left)
                && Objects.equals(right, that.right)
                && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, left, right, value);
    }

    @Override
    public String toString() {
        if (kind.isComposite()) {
            return "SourceNode{kind=" + kind + ", left=" + left + ", right=" + right + "}";
        }
        return "SourceNode{kind=" + kind + ", value='" + value + "'}";
    }
}
