package me.christianrobert.cljtojs.transformer.builder;

import me.christianrobert.cljtojs.target.Invocation;
import me.christianrobert.cljtojs.target.SymbolReference;
import me.christianrobert.cljtojs.target.TargetNode;
import me.christianrobert.cljtojs.transformer.tree.SourceNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Static helper for ordinary calls.
 *
 * <pre>
 * (f a b)           → Invocation(callee=[f], arguments=[a, b])
 * ((get-fn) a b)    → Invocation(callee=[(get-fn)], arguments=[a, b])
 * </pre>
 */
public class VisitCall {

    /**
     * Call whose head is a literal symbol that names no special form.
     */
    public static List<TargetNode> named(String name, FormArguments args, TargetCodeBuilder b) {
        List<TargetNode> callee = new ArrayList<>();
        callee.add(new SymbolReference(name));
        return List.of(new Invocation(callee, b.visitAll(args.all())));
    }

    /**
     * Call whose head is any other form. The head is evaluated to obtain the callee;
     * it never takes part in special-form dispatch.
     */
    public static List<TargetNode> expressionHead(SourceNode head, List<SourceNode> arguments, TargetCodeBuilder b) {
        return List.of(new Invocation(b.visit(head), b.visitAll(arguments)));
    }
}
