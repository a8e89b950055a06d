package me.christianrobert.cljtojs.transformer.builder;

import me.christianrobert.cljtojs.target.Assignment;
import me.christianrobert.cljtojs.target.SymbolReference;
import me.christianrobert.cljtojs.target.TargetNode;
import me.christianrobert.cljtojs.target.VariableDeclaration;
import me.christianrobert.cljtojs.transformer.tree.NodeKind;
import me.christianrobert.cljtojs.transformer.tree.SourceNode;

import java.util.List;

/**
 * Static helper for {@code def} and {@code set!}.
 *
 * <pre>
 * (def answer 42)            → VariableDeclaration(answer, [42])
 * (def answer "doc" 42)      → VariableDeclaration(answer, [42])   docstring skipped
 * (set! (.-x point) 3)       → Assignment([PropertyAccess(point, .-x)], [3])
 * </pre>
 */
public class VisitDefinition {

    public static List<TargetNode> def(FormArguments args, TargetCodeBuilder b) {
        String name = b.sourceSymbol(args.requireSymbol(0, "name"), args.getPosition());
        args.require(1, "value");
        args.requireCountBetween(2, 3);

        SourceNode value;
        if (args.size() == 3) {
            // (def name "docstring" value)
            if (!isString(args.get(1))) {
                throw args.malformed("def with three arguments expects a docstring before the value");
            }
            value = args.get(2);
        } else {
            value = args.get(1);
        }

        return List.of(new VariableDeclaration(new SymbolReference(name), b.visit(value)));
    }

    public static List<TargetNode> set(FormArguments args, TargetCodeBuilder b) {
        SourceNode target = args.require(0, "target");
        SourceNode value = args.require(1, "value");
        args.requireCount(2);

        return List.of(new Assignment(b.visit(target), b.visit(value)));
    }

    static boolean isString(SourceNode node) {
        if (node.is(NodeKind.STRING)) {
            return true;
        }
        return node.is(NodeKind.LEAF) && node.getLeft() != null && node.getLeft().is(NodeKind.STRING);
    }
}
