package me.christianrobert.cljtojs.transformer.builder;

import me.christianrobert.cljtojs.target.FunctionDeclaration;
import me.christianrobert.cljtojs.target.LambdaExpression;
import me.christianrobert.cljtojs.target.SymbolReference;
import me.christianrobert.cljtojs.target.TargetNode;
import me.christianrobert.cljtojs.transformer.tree.SourceNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Static helper for {@code defn} and {@code fn}.
 *
 * <pre>
 * (defn add [a b] (+ a b))       → FunctionDeclaration(add, [a, b], [a + b])
 * (defn add "doc" [a b] (+ a b)) → same, docstring skipped
 * (fn [x] (inc x))               → LambdaExpression([x], [x + 1])
 * </pre>
 *
 * <p>Function bodies are a recur boundary: a {@code recur} inside them does not reach
 * an enclosing {@code loop}.</p>
 */
public class VisitFunction {

    public static List<TargetNode> defn(FormArguments args, TargetCodeBuilder b) {
        String name = b.sourceSymbol(args.requireSymbol(0, "name"), args.getPosition());

        int paramsIndex = 1;
        if (args.has(2) && VisitDefinition.isString(args.require(1, "parameter vector"))) {
            paramsIndex = 2;
        }
        SourceNode params = args.requireVector(paramsIndex, "parameter vector");
        List<SourceNode> body = args.rest(paramsIndex + 1);

        return List.of(new FunctionDeclaration(
                new SymbolReference(name),
                parameters(params, args, b),
                b.withRecurTarget(TargetCodeBuilder.NO_LOOP, () -> b.visitAll(body))));
    }

    public static List<TargetNode> fn(FormArguments args, TargetCodeBuilder b) {
        SourceNode params = args.requireVector(0, "parameter vector");
        List<SourceNode> body = args.rest(1);

        return List.of(new LambdaExpression(
                parameters(params, args, b),
                b.withRecurTarget(TargetCodeBuilder.NO_LOOP, () -> b.visitAll(body))));
    }

    /**
     * Translates a parameter vector. Every parameter must be a plain symbol
     * (destructuring is not supported).
     */
    private static List<TargetNode> parameters(SourceNode vector, FormArguments args, TargetCodeBuilder b) {
        List<TargetNode> result = new ArrayList<>();
        for (SourceNode param : vector.elements()) {
            if (!param.isLiteralSymbol()) {
                throw args.malformed(args.getForm() + " parameters must be symbols, got " + param.getKind());
            }
            result.add(new SymbolReference(b.sourceSymbol(param.getSymbolName(), param.getPosition())));
        }
        return result;
    }
}
