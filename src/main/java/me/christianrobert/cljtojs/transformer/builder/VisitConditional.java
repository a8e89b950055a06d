package me.christianrobert.cljtojs.transformer.builder;

import me.christianrobert.cljtojs.target.Conditional;
import me.christianrobert.cljtojs.target.Invocation;
import me.christianrobert.cljtojs.target.SymbolReference;
import me.christianrobert.cljtojs.target.TargetNode;
import me.christianrobert.cljtojs.target.VariableDeclaration;
import me.christianrobert.cljtojs.transformer.tree.SourceNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Static helper for the branching forms.
 *
 * <h3>Lowerings:</h3>
 * <pre>
 * (if test then else)    → Conditional([test], [then], [else])
 * (if test then)         → Conditional([test], [then], [])
 * (if-not test a b)      → Conditional([not(test)], [a], [b])
 * (when test body...)    → Conditional([test], [body...], [])
 * (if-let [x test] a b)  → VariableDeclaration(ifLet$n, [test]),
 *                          Conditional([ifLet$n], [VariableDeclaration(x, [ifLet$n]), a], [b])
 * </pre>
 *
 * <h3>Notes:</h3>
 * <ul>
 *   <li>An empty alternative means the conditional has no else branch</li>
 *   <li>In if-let the declared name is bound inside the then-branch only</li>
 *   <li>The if-let test is evaluated exactly once, into the temporary</li>
 * </ul>
 */
public class VisitConditional {

    public static List<TargetNode> ifForm(FormArguments args, TargetCodeBuilder b) {
        SourceNode test = args.require(0, "test");
        SourceNode then = args.require(1, "then branch");
        args.requireCountBetween(2, 3);

        return List.of(new Conditional(b.visit(test), b.visit(then), b.visitAll(args.rest(2))));
    }

    public static List<TargetNode> ifNot(FormArguments args, TargetCodeBuilder b) {
        SourceNode test = args.require(0, "test");
        SourceNode then = args.require(1, "then branch");
        args.requireCountBetween(2, 3);

        List<TargetNode> notFunction = new ArrayList<>();
        notFunction.add(new SymbolReference(b.getContext().getSettings().getNotFunction()));
        List<TargetNode> negated = List.of(new Invocation(notFunction, b.visit(test)));

        return List.of(new Conditional(negated, b.visit(then), b.visitAll(args.rest(2))));
    }

    public static List<TargetNode> when(FormArguments args, TargetCodeBuilder b) {
        SourceNode test = args.require(0, "test");

        return List.of(new Conditional(b.visit(test), b.visitAll(args.rest(1)), new ArrayList<>()));
    }

    public static List<TargetNode> ifLet(FormArguments args, TargetCodeBuilder b) {
        SourceNode bindings = args.requireVector(0, "binding vector");
        SourceNode then = args.require(1, "then branch");
        args.requireCountBetween(2, 3);

        List<SourceNode> pair = bindings.elements();
        if (pair.size() != 2) {
            throw args.malformed("if-let expects exactly one binding pair, got " + pair.size() + " binding forms");
        }
        if (!pair.get(0).isLiteralSymbol()) {
            throw args.malformed("if-let binding name must be a symbol, got " + pair.get(0).getKind());
        }
        SymbolReference name = new SymbolReference(b.sourceSymbol(pair.get(0).getSymbolName(), pair.get(0).getPosition()));

        SymbolReference temp = b.freshSymbol("ifLet");
        List<TargetNode> result = new ArrayList<>();
        result.add(new VariableDeclaration(temp, b.visit(pair.get(1))));

        List<TargetNode> consequent = new ArrayList<>();
        consequent.add(new VariableDeclaration(name, List.of(temp)));
        consequent.addAll(b.visit(then));

        result.add(new Conditional(List.of(temp), consequent, b.visitAll(args.rest(2))));
        return result;
    }
}
