package me.christianrobert.cljtojs.transformer.builder;

import me.christianrobert.cljtojs.target.BooleanLiteral;
import me.christianrobert.cljtojs.target.NumberLiteral;
import me.christianrobert.cljtojs.target.StringLiteral;
import me.christianrobert.cljtojs.target.SymbolReference;
import me.christianrobert.cljtojs.target.TargetNode;
import me.christianrobert.cljtojs.transformer.context.UnknownNodeKindException;
import me.christianrobert.cljtojs.transformer.tree.SourceNode;

import java.util.List;

/**
 * Static helper for scalar atoms. Each atom lowers to exactly one literal carrying
 * the source value verbatim.
 */
public class VisitAtom {

    public static List<TargetNode> v(SourceNode atom, TargetCodeBuilder b) {
        TargetNode literal = switch (atom.getKind()) {
            case SYMBOL -> new SymbolReference(b.sourceSymbol(atom.getText(), atom.getPosition()));
            case STRING -> new StringLiteral(atom.getText());
            case NUMBER -> new NumberLiteral(atom.getText());
            case BOOLEAN -> new BooleanLiteral((Boolean) atom.getValue());
            default -> throw new UnknownNodeKindException("Not a scalar atom: " + atom.getKind(), atom.getPosition());
        };
        return List.of(literal);
    }
}
