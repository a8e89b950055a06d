package me.christianrobert.cljtojs.target;

import java.util.List;

/**
 * Base class of the target representation.
 *
 * <p>Each subclass is one construct of the C-family target language. Nodes are immutable
 * values; nested parts are held as ordered node sequences because a single source form
 * may lower to several target statements.</p>
 *
 * <p>Renderers traverse the tree through {@link TargetNodeVisitor}.</p>
 */
public abstract class TargetNode {

    public abstract <T> T accept(TargetNodeVisitor<T> visitor);

    /**
     * Immutable copy of a node sequence, rejecting null sequences and null elements.
     */
    protected static List<TargetNode> sequence(List<TargetNode> nodes, String role) {
        if (nodes == null) {
            throw new IllegalArgumentException(role + " cannot be null");
        }
        return List.copyOf(nodes);
    }

    protected static String requireText(String text, String role) {
        if (text == null || text.isEmpty()) {
            throw new IllegalArgumentException(role + " cannot be null or empty");
        }
        return text;
    }
}
