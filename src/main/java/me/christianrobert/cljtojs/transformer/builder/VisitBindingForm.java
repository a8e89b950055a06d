package me.christianrobert.cljtojs.transformer.builder;

import me.christianrobert.cljtojs.target.Assignment;
import me.christianrobert.cljtojs.target.IndexedSymbolReference;
import me.christianrobert.cljtojs.target.InfiniteLoop;
import me.christianrobert.cljtojs.target.LoopContinue;
import me.christianrobert.cljtojs.target.ScopeBlock;
import me.christianrobert.cljtojs.target.SymbolReference;
import me.christianrobert.cljtojs.target.TargetNode;
import me.christianrobert.cljtojs.target.VariableDeclaration;
import me.christianrobert.cljtojs.transformer.context.UnsupportedArityException;
import me.christianrobert.cljtojs.transformer.tree.SourceNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Static helper for {@code let}, {@code loop} and {@code recur}.
 *
 * <h3>let</h3>
 * <pre>
 * (let [a 1 b (f a)] body)  →  VariableDeclaration(a, [1]), VariableDeclaration(b, [f(a)]), body...
 * </pre>
 *
 * <h3>loop / recur</h3>
 * <pre>
 * (loop [i 0] (if (&lt; i 3) (recur (inc i)) i))
 *   →  ScopeBlock([
 *          VariableDeclaration(i, [0]),
 *          InfiniteLoop([ Conditional(..., [Assignment([slot 0], [i + 1]), LoopContinue], [i]) ])
 *      ])
 * </pre>
 *
 * <p>Loop variables are declared by name but reassigned by position: {@code recur} targets
 * {@link IndexedSymbolReference} slots of the nearest enclosing loop, so shadowing inside
 * the body cannot redirect the rebinding.</p>
 *
 * <p>Binding pair k is always (element 2k, element 2k+1) of the binding vector.</p>
 */
public class VisitBindingForm {

    public static List<TargetNode> let(FormArguments args, TargetCodeBuilder b) {
        SourceNode bindings = args.requireVector(0, "binding vector");

        List<TargetNode> result = bindingDeclarations(bindings, args, b);
        result.addAll(b.visitAll(args.rest(1)));
        return result;
    }

    public static List<TargetNode> loop(FormArguments args, TargetCodeBuilder b) {
        SourceNode bindings = args.requireVector(0, "binding vector");

        List<TargetNode> scope = bindingDeclarations(bindings, args, b);
        int bindingCount = scope.size();

        List<TargetNode> body = b.withRecurTarget(bindingCount, () -> b.visitAll(args.rest(1)));
        scope.add(new InfiniteLoop(body));

        return List.of(new ScopeBlock(scope));
    }

    /**
     * Rebinds the loop slots and jumps back to the top of the loop.
     *
     * <p>With more than one value, every new value is first captured in a temporary so
     * all right-hand sides observe the bindings as they were before this recur.</p>
     */
    public static List<TargetNode> recur(FormArguments args, TargetCodeBuilder b) {
        int target = b.currentRecurTarget();
        if (target == TargetCodeBuilder.NO_LOOP) {
            throw args.malformed("recur must appear inside a loop body");
        }
        if (args.size() != target) {
            throw new UnsupportedArityException(args.getForm(), target, args.size(), args.getPosition());
        }

        List<TargetNode> result = new ArrayList<>();

        if (args.size() == 1) {
            result.add(new Assignment(List.of(new IndexedSymbolReference(0)), b.visit(args.get(0))));
        } else if (args.size() > 1) {
            List<SymbolReference> temps = new ArrayList<>();
            for (SourceNode value : args.all()) {
                SymbolReference temp = b.freshSymbol("recur");
                result.add(new VariableDeclaration(temp, b.visit(value)));
                temps.add(temp);
            }
            for (int slot = 0; slot < temps.size(); slot++) {
                result.add(new Assignment(List.of(new IndexedSymbolReference(slot)), List.of(temps.get(slot))));
            }
        }

        result.add(new LoopContinue());
        return result;
    }

    /**
     * Translates a binding vector into variable declarations, in declaration order.
     */
    static List<TargetNode> bindingDeclarations(SourceNode bindings, FormArguments args, TargetCodeBuilder b) {
        List<SourceNode> elements = bindings.elements();
        if (elements.size() % 2 != 0) {
            throw args.malformed(args.getForm() + " expects an even number of binding forms, got " + elements.size());
        }

        List<TargetNode> declarations = new ArrayList<>();
        for (int pair = 0; pair < elements.size() / 2; pair++) {
            SourceNode name = elements.get(2 * pair);
            SourceNode value = elements.get(2 * pair + 1);
            if (!name.isLiteralSymbol()) {
                throw args.malformed(args.getForm() + " binding name must be a symbol, got " + name.getKind());
            }
            String bound = b.sourceSymbol(name.getSymbolName(), name.getPosition());
            declarations.add(new VariableDeclaration(new SymbolReference(bound), b.visit(value)));
        }
        return declarations;
    }
}
