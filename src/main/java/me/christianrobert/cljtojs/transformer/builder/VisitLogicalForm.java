package me.christianrobert.cljtojs.transformer.builder;

import me.christianrobert.cljtojs.target.BooleanLiteral;
import me.christianrobert.cljtojs.target.Conditional;
import me.christianrobert.cljtojs.target.SymbolReference;
import me.christianrobert.cljtojs.target.TargetNode;
import me.christianrobert.cljtojs.target.VariableDeclaration;
import me.christianrobert.cljtojs.transformer.tree.SourceNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Static helper for short-circuit {@code and} / {@code or}.
 *
 * <p>Each operand is bound to a fresh temporary. Later operands are nested inside the
 * branch that needs them, so the target evaluates them only when the earlier operands
 * did not already decide the result.</p>
 *
 * <pre>
 * (and a b c) →
 *   and$1 = a
 *   if (and$1) {
 *     and$2 = b
 *     if (and$2) { and$3 = c; and$3 } else { and$2 }
 *   } else { and$1 }
 *
 * (or a b) →
 *   or$1 = a
 *   if (or$1) { or$1 } else { or$2 = b; or$2 }
 * </pre>
 *
 * <p>N operands produce N temporaries and N-1 conditionals. {@code (and)} is {@code true},
 * {@code (or)} is the null symbol.</p>
 */
public class VisitLogicalForm {

    public static List<TargetNode> and(FormArguments args, TargetCodeBuilder b) {
        if (args.size() == 0) {
            return List.of(new BooleanLiteral(true));
        }
        return lower(args.all(), 0, true, b);
    }

    public static List<TargetNode> or(FormArguments args, TargetCodeBuilder b) {
        if (args.size() == 0) {
            return List.of(new SymbolReference(b.getContext().getSettings().getNullSymbol()));
        }
        return lower(args.all(), 0, false, b);
    }

    private static List<TargetNode> lower(List<SourceNode> operands, int index, boolean conjunction,
                                          TargetCodeBuilder b) {
        SymbolReference temp = b.freshSymbol(conjunction ? "and" : "or");

        List<TargetNode> result = new ArrayList<>();
        result.add(new VariableDeclaration(temp, b.visit(operands.get(index))));

        // Last operand yields its own temporary
        if (index == operands.size() - 1) {
            result.add(temp);
            return result;
        }

        List<TargetNode> remaining = lower(operands, index + 1, conjunction, b);
        if (conjunction) {
            result.add(new Conditional(List.of(temp), remaining, List.of(temp)));
        } else {
            result.add(new Conditional(List.of(temp), List.of(temp), remaining));
        }
        return result;
    }
}
