package me.christianrobert.cljtojs.transformer.builder;

import me.christianrobert.cljtojs.target.ArrayLiteral;
import me.christianrobert.cljtojs.target.NumberLiteral;
import me.christianrobert.cljtojs.target.ObjectConstruction;
import me.christianrobert.cljtojs.target.SymbolReference;
import me.christianrobert.cljtojs.target.TargetNode;
import me.christianrobert.cljtojs.transformer.context.TranslatorSettings;
import me.christianrobert.cljtojs.transformer.tree.SourceNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Static helper for vector literals.
 *
 * <p>Builds the persistent vector directly in its runtime shape:</p>
 * <pre>
 * [1 2 3]  →  new PersistentVector(null, identity, 5, PersistentVector.EMPTY_NODE, [1, 2, 3], null)
 *                                  edit  count     shift root                       tail       meta
 * </pre>
 *
 * <p>The identity is drawn from the unit's counter before the elements are translated,
 * so an outer vector always has a smaller identity than the vectors nested in it.</p>
 */
public class VisitVectorLiteral {

    public static List<TargetNode> v(SourceNode node, TargetCodeBuilder b) {
        TranslatorSettings settings = b.getContext().getSettings();
        long identity = b.getContext().nextVectorIdentity();

        List<TargetNode> elements = b.visitAll(node.elements());

        List<TargetNode> slots = new ArrayList<>();
        slots.add(new SymbolReference(settings.getNullSymbol()));
        slots.add(NumberLiteral.of(identity));
        slots.add(NumberLiteral.of(settings.getVectorShift()));
        slots.add(new SymbolReference(settings.getVectorEmptyNode()));
        slots.add(new ArrayLiteral(elements));
        slots.add(new SymbolReference(settings.getNullSymbol()));

        return List.of(new ObjectConstruction(List.of(new SymbolReference(settings.getVectorClass())), slots));
    }
}
