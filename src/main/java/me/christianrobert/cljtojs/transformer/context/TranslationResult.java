package me.christianrobert.cljtojs.transformer.context;

import me.christianrobert.cljtojs.target.TargetNode;
import me.christianrobert.cljtojs.transformer.tree.SourcePosition;

import java.util.List;

/**
 * Result of a translation.
 * Contains either the complete translated node sequence or an error message, never both.
 * Optionally includes rendered source and target trees for debugging.
 */
public class TranslationResult {

    private final boolean success;
    private final List<TargetNode> nodes;
    private final String errorMessage;
    private final SourcePosition errorPosition;
    private final String sourceTree;  // Optional (null by default)
    private final String targetTree;  // Optional (null by default)

    private TranslationResult(boolean success, List<TargetNode> nodes, String errorMessage,
                              SourcePosition errorPosition, String sourceTree, String targetTree) {
        this.success = success;
        this.nodes = nodes;
        this.errorMessage = errorMessage;
        this.errorPosition = errorPosition;
        this.sourceTree = sourceTree;
        this.targetTree = targetTree;
    }

    /**
     * Creates a successful translation result.
     */
    public static TranslationResult success(List<TargetNode> nodes) {
        return new TranslationResult(true, List.copyOf(nodes), null, null, null, null);
    }

    /**
     * Creates a successful translation result with debug trees.
     */
    public static TranslationResult successWithTrees(List<TargetNode> nodes, String sourceTree, String targetTree) {
        return new TranslationResult(true, List.copyOf(nodes), null, null, sourceTree, targetTree);
    }

    /**
     * Creates a failed translation result.
     */
    public static TranslationResult failure(String errorMessage) {
        return new TranslationResult(false, null, errorMessage, null, null, null);
    }

    /**
     * Creates a failed translation result from an exception.
     */
    public static TranslationResult failure(TranslationException exception) {
        return new TranslationResult(false, null, exception.getDetailedMessage(), exception.getPosition(), null, null);
    }

    /**
     * Creates a failed translation result from an exception with the source tree.
     */
    public static TranslationResult failureWithTree(TranslationException exception, String sourceTree) {
        return new TranslationResult(false, null, exception.getDetailedMessage(), exception.getPosition(),
                sourceTree, null);
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isFailure() {
        return !success;
    }

    /**
     * Translated nodes in execution order, null for a failure.
     */
    public List<TargetNode> getNodes() {
        return nodes;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public SourcePosition getErrorPosition() {
        return errorPosition;
    }

    public String getSourceTree() {
        return sourceTree;
    }

    public String getTargetTree() {
        return targetTree;
    }

    public boolean hasTrees() {
        return sourceTree != null || targetTree != null;
    }

    @Override
    public String toString() {
        if (success) {
            return "TranslationResult{success=true, nodes=" + nodes.size() +
                   (hasTrees() ? ", hasTrees=true" : "") + "}";
        } else {
            return "TranslationResult{success=false, error='" + errorMessage + "'" +
                   (hasTrees() ? ", hasTrees=true" : "") + "}";
        }
    }
}
