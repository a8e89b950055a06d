package me.christianrobert.cljtojs.transformer.builder;

import me.christianrobert.cljtojs.target.SymbolReference;
import me.christianrobert.cljtojs.target.TargetNode;
import me.christianrobert.cljtojs.transformer.context.MalformedSpecialFormException;
import me.christianrobert.cljtojs.transformer.context.TranslationContext;
import me.christianrobert.cljtojs.transformer.context.UnknownNodeKindException;
import me.christianrobert.cljtojs.transformer.tree.SourceNode;
import me.christianrobert.cljtojs.transformer.tree.SourcePosition;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Lowers source syntax trees to the target representation.
 *
 * <p>Dispatches on the node kind and delegates every form family to a static
 * {@code Visit*} helper. Every visit returns an ordered sequence of target nodes;
 * order is execution order in the target.</p>
 *
 * <pre>
 * SourceNode ──visit()──&gt; kind switch ──&gt; VisitList ──&gt; SpecialForm switch ──&gt; Visit* helper
 *                                     ├─&gt; VisitAtom / VisitVectorLiteral / VisitKeywordLiteral
 *                                     └─&gt; VisitMacroForm ──&gt; PlaceholderResolver
 * </pre>
 *
 * <p>One builder translates the forms of one compilation unit, in source order.</p>
 */
public class TargetCodeBuilder {

    // no logging is desired, this would create an overkill of logs

    /**
     * Recur target marking a function boundary: {@code recur} does not cross it.
     */
    static final int NO_LOOP = -1;

    private final TranslationContext context;

    // Binding counts of the enclosing loops, innermost on top
    // fn/defn push NO_LOOP so recur inside a nested function is rejected
    private final Deque<Integer> recurTargetStack;

    // Generated parameter names substituted into the #() body being translated
    private Set<String> placeholderParameters = Collections.emptySet();

    public TargetCodeBuilder() {
        this(new TranslationContext());
    }

    public TargetCodeBuilder(TranslationContext context) {
        if (context == null) {
            throw new IllegalArgumentException("Translation context cannot be null");
        }
        this.context = context;
        this.recurTargetStack = new ArrayDeque<>();
    }

    public TranslationContext getContext() {
        return context;
    }

    /**
     * Translates one node.
     *
     * @param node Node to translate, null for an absent child
     * @return Target nodes in execution order (empty for null or empty forms)
     * @throws UnknownNodeKindException if the node may not appear in expression position
     */
    public List<TargetNode> visit(SourceNode node) {
        if (node == null) {
            return new ArrayList<>();
        }

        return switch (node.getKind()) {
            case SEQUENCE -> concat(visit(node.getLeft()), visit(node.getRight()));
            case LEAF -> visitLeaf(node);
            case LIST -> VisitList.v(node, this);
            case VECTOR -> VisitVectorLiteral.v(node, this);
            case KEYWORD -> VisitKeywordLiteral.v(node, this);
            case SYMBOL, STRING, NUMBER, BOOLEAN -> VisitAtom.v(node, this);
            case MACRO -> VisitMacroForm.v(node, this);
            case DEREF, DISPATCH -> throw new UnknownNodeKindException(
                    "Macro marker " + node.getKind() + " cannot be translated outside a macro form",
                    node.getPosition());
        };
    }

    /**
     * Translates sibling forms and concatenates their outputs.
     */
    public List<TargetNode> visitAll(List<SourceNode> forms) {
        List<TargetNode> result = new ArrayList<>();
        for (SourceNode form : forms) {
            result.addAll(visit(form));
        }
        return result;
    }

    private List<TargetNode> visitLeaf(SourceNode leaf) {
        SourceNode boxed = leaf.getLeft();
        if (boxed == null) {
            throw new MalformedSpecialFormException("Leaf wrapper without a value", leaf.getPosition(), null);
        }
        return visit(boxed);
    }

    private static List<TargetNode> concat(List<TargetNode> first, List<TargetNode> second) {
        List<TargetNode> result = new ArrayList<>(first);
        result.addAll(second);
        return result;
    }

    // ========== Synthetic names ==========

    /**
     * Allocates a fresh symbol for a compiler temporary.
     */
    public SymbolReference freshSymbol(String tag) {
        return new SymbolReference(context.freshName(tag));
    }

    /**
     * Checks that a symbol written in the source does not have the shape of a synthetic name.
     *
     * @param name Symbol name as read
     * @param position Position of the symbol, for the error
     * @return The name, unchanged
     * @throws MalformedSpecialFormException if the name is reserved for generated identifiers
     */
    public String sourceSymbol(String name, SourcePosition position) {
        if (context.isReservedName(name) && !placeholderParameters.contains(name)) {
            throw new MalformedSpecialFormException(
                    "Symbol " + name + " has the form reserved for generated names", position, name);
        }
        return name;
    }

    /**
     * Runs the translation of a resolved {@code #()} body, whose generated parameter
     * names are accepted as symbols.
     */
    List<TargetNode> withPlaceholderParameters(Set<String> names, Supplier<List<TargetNode>> body) {
        Set<String> outer = placeholderParameters;
        placeholderParameters = names;
        try {
            return body.get();
        } finally {
            placeholderParameters = outer;
        }
    }

    // ========== Recur targets ==========

    /**
     * Runs a body translation with a recur target on top of the stack.
     *
     * @param bindingCount Number of loop bindings, or {@link #NO_LOOP} for a function body
     * @param body Translation to run
     * @return Result of the body translation
     */
    List<TargetNode> withRecurTarget(int bindingCount, Supplier<List<TargetNode>> body) {
        recurTargetStack.push(bindingCount);
        try {
            return body.get();
        } finally {
            recurTargetStack.pop();
        }
    }

    /**
     * Binding count of the innermost loop a {@code recur} here would jump to.
     *
     * @return Binding count, or {@link #NO_LOOP} outside any loop or inside a nested function
     */
    int currentRecurTarget() {
        Integer top = recurTargetStack.peek();
        return top == null ? NO_LOOP : top;
    }
}
