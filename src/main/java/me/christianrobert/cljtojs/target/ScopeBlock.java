package me.christianrobert.cljtojs.target;

import java.util.List;

/**
 * Lexical block: declarations inside it are not visible after it.
 */
public class ScopeBlock extends TargetNode {

    private final List<TargetNode> body;

    public ScopeBlock(List<TargetNode> body) {
        this.body = sequence(body, "Scope body");
    }

    public List<TargetNode> getBody() {
        return body;
    }

    @Override
    public <T> T accept(TargetNodeVisitor<T> visitor) {
        return visitor.visitScope(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return body.equals(((ScopeBlock) o).body);
    }

    @Override
    public int hashCode() {
        return body.hashCode();
    }

    @Override
    public String toString() {
        return "ScopeBlock{body=" + body + "}";
    }
}
