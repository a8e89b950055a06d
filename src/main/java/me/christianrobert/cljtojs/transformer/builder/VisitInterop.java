package me.christianrobert.cljtojs.transformer.builder;

import me.christianrobert.cljtojs.target.Invocation;
import me.christianrobert.cljtojs.target.ObjectConstruction;
import me.christianrobert.cljtojs.target.PropertyAccess;
import me.christianrobert.cljtojs.target.SymbolReference;
import me.christianrobert.cljtojs.target.TargetNode;
import me.christianrobert.cljtojs.transformer.tree.SourceNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Static helper for host interop forms.
 *
 * <pre>
 * (.-length s)          → PropertyAccess([s], .-length)
 * (.push items x)       → Invocation([items, .push], [x])
 * (. items push x)      → Invocation([items, .push], [x])
 * (. point -x)          → PropertyAccess([point], .-x)
 * (new Date 2024 1)     → ObjectConstruction([Date], [2024, 1])
 * </pre>
 *
 * <p>Member symbols keep their source text including the leading dot; the emitter
 * renders {@code receiver.member}.</p>
 */
public class VisitInterop {

    public static List<TargetNode> propertyAccess(String property, FormArguments args, TargetCodeBuilder b) {
        SourceNode receiver = args.require(0, "receiver");
        args.requireCount(1);

        return List.of(new PropertyAccess(b.visit(receiver), new SymbolReference(property)));
    }

    public static List<TargetNode> methodCall(String method, FormArguments args, TargetCodeBuilder b) {
        SourceNode receiver = args.require(0, "receiver");
        return invokeMember(receiver, method, args.rest(1), b);
    }

    public static List<TargetNode> construct(FormArguments args, TargetCodeBuilder b) {
        SourceNode constructor = args.require(0, "constructor");

        return List.of(new ObjectConstruction(b.visit(constructor), b.visitAll(args.rest(1))));
    }

    /**
     * Generic member form {@code (. receiver member args...)}. A member starting with
     * {@code -} is a field read and takes no arguments.
     */
    public static List<TargetNode> dot(FormArguments args, TargetCodeBuilder b) {
        SourceNode receiver = args.require(0, "receiver");
        String member = args.requireSymbol(1, "member");

        if (member.startsWith("-")) {
            if (member.length() == 1) {
                throw args.malformed("field name missing after '-'");
            }
            args.requireCount(2);
            return List.of(new PropertyAccess(b.visit(receiver), new SymbolReference("." + member)));
        }
        return invokeMember(receiver, "." + member, args.rest(2), b);
    }

    private static List<TargetNode> invokeMember(SourceNode receiver, String member, List<SourceNode> arguments,
                                                 TargetCodeBuilder b) {
        List<TargetNode> callee = new ArrayList<>(b.visit(receiver));
        callee.add(new SymbolReference(member));
        return List.of(new Invocation(callee, b.visitAll(arguments)));
    }
}
