package me.christianrobert.cljtojs.target;

import java.util.List;

/**
 * Always-true loop. The body runs again only when it reaches a {@link LoopContinue};
 * otherwise the loop completes with the value of the body.
 */
public class InfiniteLoop extends TargetNode {

    private final List<TargetNode> body;

    public InfiniteLoop(List<TargetNode> body) {
        this.body = sequence(body, "Loop body");
    }

    public List<TargetNode> getBody() {
        return body;
    }

    @Override
    public <T> T accept(TargetNodeVisitor<T> visitor) {
        return visitor.visitInfiniteLoop(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return body.equals(((InfiniteLoop) o).body);
    }

    @Override
    public int hashCode() {
        return body.hashCode();
    }

    @Override
    public String toString() {
        return "InfiniteLoop{body=" + body + "}";
    }
}
