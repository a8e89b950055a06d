package me.christianrobert.cljtojs.transformer.builder;

import me.christianrobert.cljtojs.target.Invocation;
import me.christianrobert.cljtojs.target.LambdaExpression;
import me.christianrobert.cljtojs.target.SymbolReference;
import me.christianrobert.cljtojs.target.TargetNode;
import me.christianrobert.cljtojs.transformer.context.MalformedSpecialFormException;
import me.christianrobert.cljtojs.transformer.placeholder.PlaceholderResolver;
import me.christianrobert.cljtojs.transformer.placeholder.ResolvedPlaceholders;
import me.christianrobert.cljtojs.transformer.tree.SourceNode;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Static helper for reader macro forms.
 *
 * <p>A macro node holds its marker as the first element of its left chain and the
 * operand form on the right.</p>
 *
 * <pre>
 * @atom      → Invocation([deref], [atom])
 * #_form     → (nothing)
 * #(+ % 1)   → LambdaExpression([p0$1], [p0$1 + 1])
 * #?(...)    → (nothing, unsupported dispatch)
 * </pre>
 */
public class VisitMacroForm {

    private static final String ANONYMOUS_FUNCTION = "#";
    private static final String DISCARD = "#_";

    public static List<TargetNode> v(SourceNode node, TargetCodeBuilder b) {
        SourceNode marker = markerOf(node);
        SourceNode operand = node.getRight();

        return switch (marker.getKind()) {
            case DEREF -> deref(marker, operand, b);
            case DISPATCH -> dispatch(marker, operand, b);
            default -> throw new MalformedSpecialFormException(
                    "Macro form must start with a macro marker, got " + marker.getKind(), node.getPosition(), null);
        };
    }

    private static SourceNode markerOf(SourceNode node) {
        SourceNode link = node.getLeft();
        SourceNode marker = link;
        if (link != null && !link.getKind().isMarker()) {
            marker = link.getLeft();
        }
        if (marker == null) {
            throw new MalformedSpecialFormException("Macro form without a marker", node.getPosition(), null);
        }
        return marker;
    }

    private static List<TargetNode> deref(SourceNode marker, SourceNode operand, TargetCodeBuilder b) {
        if (operand == null) {
            throw new MalformedSpecialFormException("Deref is missing its operand", marker.getPosition(), "@");
        }
        List<TargetNode> callee = new ArrayList<>();
        callee.add(new SymbolReference(b.getContext().getSettings().getDerefFunction()));
        return List.of(new Invocation(callee, b.visit(operand)));
    }

    private static List<TargetNode> dispatch(SourceNode marker, SourceNode operand, TargetCodeBuilder b) {
        String text = marker.getText();

        if (DISCARD.equals(text)) {
            return new ArrayList<>();
        }
        if (!ANONYMOUS_FUNCTION.equals(text)) {
            return new ArrayList<>();
        }

        ResolvedPlaceholders resolved = new PlaceholderResolver(b.getContext()).resolve(operand);

        List<TargetNode> parameters = new ArrayList<>();
        for (String name : resolved.getParameterNames()) {
            parameters.add(new SymbolReference(name));
        }
        Set<String> generated = new HashSet<>(resolved.getParameterNames());
        List<TargetNode> body = b.withRecurTarget(TargetCodeBuilder.NO_LOOP,
                () -> b.withPlaceholderParameters(generated, () -> b.visit(resolved.getBody())));

        return List.of(new LambdaExpression(parameters, body));
    }
}
