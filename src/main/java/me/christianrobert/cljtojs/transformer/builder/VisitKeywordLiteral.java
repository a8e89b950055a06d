package me.christianrobert.cljtojs.transformer.builder;

import me.christianrobert.cljtojs.target.ObjectConstruction;
import me.christianrobert.cljtojs.target.StringLiteral;
import me.christianrobert.cljtojs.target.SymbolReference;
import me.christianrobert.cljtojs.target.TargetNode;
import me.christianrobert.cljtojs.transformer.context.MalformedSpecialFormException;
import me.christianrobert.cljtojs.transformer.context.TranslatorSettings;
import me.christianrobert.cljtojs.transformer.tree.SourceNode;

import java.util.List;

/**
 * Static helper for keyword literals.
 *
 * <pre>
 * :foo  →  new Keyword(null, "foo", "foo")
 *                      ns    name   fqn
 * </pre>
 *
 * <p>Namespaced keywords are not supported: the namespace slot is always null and the
 * full name equals the short name.</p>
 */
public class VisitKeywordLiteral {

    public static List<TargetNode> v(SourceNode node, TargetCodeBuilder b) {
        TranslatorSettings settings = b.getContext().getSettings();

        String text = node.getText();
        String name = text.startsWith(":") ? text.substring(1) : text;
        if (name.isEmpty()) {
            throw new MalformedSpecialFormException("Keyword without a name", node.getPosition(), text);
        }

        List<TargetNode> slots = List.of(
                new SymbolReference(settings.getNullSymbol()),
                new StringLiteral(name),
                new StringLiteral(name));

        return List.of(new ObjectConstruction(List.of(new SymbolReference(settings.getKeywordClass())), slots));
    }
}
