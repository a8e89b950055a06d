package me.christianrobert.cljtojs.transformer.builder;

import me.christianrobert.cljtojs.target.ArithmeticOperation;
import me.christianrobert.cljtojs.target.Comparison;
import me.christianrobert.cljtojs.target.NumberLiteral;
import me.christianrobert.cljtojs.target.StringLiteral;
import me.christianrobert.cljtojs.target.TargetNode;

import java.util.List;

/**
 * Static helper for operator forms.
 *
 * <p>All operators are fixed-arity; any other operand count is rejected, never truncated.</p>
 *
 * <pre>
 * (&lt; a b)      → Comparison("&lt;", [a], [b])       exactly 2 operands
 * (not= a b)   → Comparison("!==", [a], [b])     exactly 2 operands
 * (+ a b)      → ArithmeticOperation("+", ...)   exactly 2 operands
 * (inc x)      → ArithmeticOperation("+", [x], [1])
 * (dec x)      → ArithmeticOperation("-", [x], [1])
 * (str x)      → ArithmeticOperation("+", [""], [x])   exactly 1 operand
 * </pre>
 */
public class VisitOperator {

    public static List<TargetNode> comparison(SpecialForm form, FormArguments args, TargetCodeBuilder b) {
        args.requireCount(2);
        return List.of(new Comparison(form.getTargetOperator(), b.visit(args.get(0)), b.visit(args.get(1))));
    }

    public static List<TargetNode> arithmetic(SpecialForm form, FormArguments args, TargetCodeBuilder b) {
        args.requireCount(2);
        return List.of(new ArithmeticOperation(form.getTargetOperator(), b.visit(args.get(0)), b.visit(args.get(1))));
    }

    /**
     * inc/dec: add or subtract literal 1.
     */
    public static List<TargetNode> step(SpecialForm form, FormArguments args, TargetCodeBuilder b) {
        args.requireCount(1);
        return List.of(new ArithmeticOperation(form.getTargetOperator(), b.visit(args.get(0)),
                List.of(NumberLiteral.of(1))));
    }

    /**
     * Single-argument string coercion by concatenation with the empty string.
     */
    public static List<TargetNode> str(SpecialForm form, FormArguments args, TargetCodeBuilder b) {
        args.requireCount(1);
        return List.of(new ArithmeticOperation(form.getTargetOperator(), List.of(new StringLiteral("")),
                b.visit(args.get(0))));
    }
}
