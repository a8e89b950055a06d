package me.christianrobert.cljtojs.transformer.placeholder;

import me.christianrobert.cljtojs.transformer.context.MalformedSpecialFormException;
import me.christianrobert.cljtojs.transformer.context.TranslationContext;
import me.christianrobert.cljtojs.transformer.tree.NodeKind;
import me.christianrobert.cljtojs.transformer.tree.SourceNode;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves placeholder symbols of the anonymous-function shorthand {@code #(...)}.
 *
 * <h3>Placeholders:</h3>
 * <ul>
 *   <li>{@code %} and {@code %1} - first parameter (slot 0)</li>
 *   <li>{@code %N} - parameter N (slot N-1); {@code %0} is rejected, numbering starts at 1</li>
 *   <li>{@code %&} - the rest parameter, substituted by the configured rest-parameter name</li>
 * </ul>
 *
 * <p>Every slot from 0 up to the highest one referenced gets exactly one fresh name, so
 * {@code #(%3)} still takes three parameters. Names are allocated in ascending slot order.</p>
 *
 * <p>The body may not contain another {@code #(...)}, nor symbols that have the shape of
 * generated names: after substitution every such symbol is a parameter.</p>
 *
 * <p>The input tree is never modified; the resolver returns a rewritten copy.</p>
 */
public class PlaceholderResolver {

    static final Pattern PLACEHOLDER = Pattern.compile("^%([0-9]*|&)$");

    // Upper bound on positional parameters of the shorthand
    static final int MAX_SLOTS = 20;

    private static final String REST = "&";

    private static final String ANONYMOUS_FUNCTION = "#";

    private final TranslationContext context;

    public PlaceholderResolver(TranslationContext context) {
        if (context == null) {
            throw new IllegalArgumentException("Translation context cannot be null");
        }
        this.context = context;
    }

    public ResolvedPlaceholders resolve(SourceNode body) {
        TreeSet<Integer> slots = new TreeSet<>();
        boolean[] rest = new boolean[1];
        collect(body, slots, rest);

        List<String> names = new ArrayList<>();
        if (!slots.isEmpty()) {
            for (int slot = 0; slot <= slots.last(); slot++) {
                names.add(context.freshName("p" + slot));
            }
        }

        return new ResolvedPlaceholders(substitute(body, names), names, rest[0]);
    }

    private void collect(SourceNode node, TreeSet<Integer> slots, boolean[] rest) {
        if (node == null) {
            return;
        }
        if (node.getKind().isComposite()) {
            collect(node.getLeft(), slots, rest);
            collect(node.getRight(), slots, rest);
            return;
        }
        if (node.is(NodeKind.DISPATCH) && ANONYMOUS_FUNCTION.equals(node.getText())) {
            throw new MalformedSpecialFormException(
                    "Anonymous function shorthand cannot be nested", node.getPosition(), ANONYMOUS_FUNCTION);
        }
        if (!node.is(NodeKind.SYMBOL)) {
            return;
        }

        Matcher matcher = PLACEHOLDER.matcher(node.getText());
        if (!matcher.matches()) {
            if (context.isReservedName(node.getText())) {
                throw new MalformedSpecialFormException(
                        "Symbol " + node.getText() + " has the form reserved for generated names",
                        node.getPosition(), node.getText());
            }
            return;
        }
        String index = matcher.group(1);
        if (REST.equals(index)) {
            rest[0] = true;
        } else {
            slots.add(slotOf(index, node));
        }
    }

    private SourceNode substitute(SourceNode node, List<String> names) {
        if (node == null) {
            return null;
        }
        if (node.getKind().isComposite()) {
            SourceNode left = substitute(node.getLeft(), names);
            SourceNode right = substitute(node.getRight(), names);
            if (left == node.getLeft() && right == node.getRight()) {
                return node;
            }
            return node.withChildren(left, right);
        }
        if (!node.is(NodeKind.SYMBOL)) {
            return node;
        }

        Matcher matcher = PLACEHOLDER.matcher(node.getText());
        if (!matcher.matches()) {
            return node;
        }
        String index = matcher.group(1);
        if (REST.equals(index)) {
            return node.withValue(context.getSettings().getRestParameter());
        }
        return node.withValue(names.get(slotOf(index, node)));
    }

    private static int slotOf(String index, SourceNode node) {
        if (index.isEmpty()) {
            return 0;
        }
        // Longer digit strings would overflow before the bound check
        if (index.length() > 3) {
            throw tooManyParameters(node);
        }
        int number = Integer.parseInt(index);
        if (number == 0) {
            throw new MalformedSpecialFormException(
                    "Placeholder %0 is not allowed, parameters are numbered from %1", node.getPosition(), node.getText());
        }
        if (number > MAX_SLOTS) {
            throw tooManyParameters(node);
        }
        return number - 1;
    }

    private static MalformedSpecialFormException tooManyParameters(SourceNode node) {
        return new MalformedSpecialFormException(
                "Anonymous function placeholder exceeds " + MAX_SLOTS + " parameters", node.getPosition(), node.getText());
    }
}
