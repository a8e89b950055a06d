package me.christianrobert.cljtojs.transformer.builder;

import me.christianrobert.cljtojs.target.TargetNode;
import me.christianrobert.cljtojs.transformer.tree.SourceNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Static helper for visiting list forms.
 *
 * <p>The head decides the lowering:</p>
 * <ul>
 *   <li>Head is not a literal symbol (e.g. a nested list producing a function): explicit invocation</li>
 *   <li>Head names a {@link SpecialForm}: bespoke lowering</li>
 *   <li>Head starts with {@code .-}: property accessor ({@code .-} alone and {@code ..} are malformed)</li>
 *   <li>Head starts with {@code .}: interop method call</li>
 *   <li>Otherwise: ordinary call</li>
 * </ul>
 */
public class VisitList {

    public static List<TargetNode> v(SourceNode node, TargetCodeBuilder b) {
        List<SourceNode> elements = node.elements();

        // Empty list
        if (elements.isEmpty()) {
            return new ArrayList<>();
        }

        SourceNode head = elements.get(0);
        List<SourceNode> arguments = elements.subList(1, elements.size());

        if (!head.isLiteralSymbol()) {
            return VisitCall.expressionHead(head, arguments, b);
        }

        String name = head.getSymbolName();
        FormArguments args = new FormArguments(name, node, arguments);

        SpecialForm form = SpecialForm.fromSymbol(name);
        if (form != null) {
            return visitSpecialForm(form, args, b);
        }

        if (name.equals(".-") || name.startsWith("..")) {
            throw args.malformed("member name missing in interop head " + name);
        }
        if (name.startsWith(".-")) {
            return VisitInterop.propertyAccess(name, args, b);
        }
        if (name.startsWith(".") && name.length() > 1) {
            return VisitInterop.methodCall(name, args, b);
        }

        return VisitCall.named(b.sourceSymbol(name, head.getPosition()), args, b);
    }

    private static List<TargetNode> visitSpecialForm(SpecialForm form, FormArguments args, TargetCodeBuilder b) {
        return switch (form) {
            case NS -> VisitNamespace.v(args, b);
            case DEF -> VisitDefinition.def(args, b);
            case SET -> VisitDefinition.set(args, b);
            case DEFN -> VisitFunction.defn(args, b);
            case FN -> VisitFunction.fn(args, b);
            case IF -> VisitConditional.ifForm(args, b);
            case IF_NOT -> VisitConditional.ifNot(args, b);
            case WHEN -> VisitConditional.when(args, b);
            case IF_LET -> VisitConditional.ifLet(args, b);
            case DO -> b.visitAll(args.all());
            case LESS_THAN, GREATER_THAN, LESS_OR_EQUAL, GREATER_OR_EQUAL, NUMERIC_EQUAL, NOT_EQUAL ->
                    VisitOperator.comparison(form, args, b);
            case ADD, SUBTRACT, MULTIPLY, DIVIDE -> VisitOperator.arithmetic(form, args, b);
            case INC, DEC -> VisitOperator.step(form, args, b);
            case STR -> VisitOperator.str(form, args, b);
            case AND -> VisitLogicalForm.and(args, b);
            case OR -> VisitLogicalForm.or(args, b);
            case LET -> VisitBindingForm.let(args, b);
            case LOOP -> VisitBindingForm.loop(args, b);
            case RECUR -> VisitBindingForm.recur(args, b);
            case NEW -> VisitInterop.construct(args, b);
            case DOT -> VisitInterop.dot(args, b);
        };
    }
}
