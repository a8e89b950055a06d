package me.christianrobert.cljtojs.transformer.builder;

import me.christianrobert.cljtojs.target.NamespaceDeclaration;
import me.christianrobert.cljtojs.target.TargetNode;

import java.util.List;

/**
 * Static helper for {@code (ns name clauses...)}.
 *
 * <p>Only the namespace name is recorded. Require/import clauses are not resolved
 * and produce no output.</p>
 */
public class VisitNamespace {

    public static List<TargetNode> v(FormArguments args, TargetCodeBuilder b) {
        args.requireSymbol(0, "namespace name");
        return List.of(new NamespaceDeclaration(b.visit(args.get(0))));
    }
}
