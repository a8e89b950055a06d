package me.christianrobert.cljtojs.target;

/**
 * Returns control to the top of the nearest enclosing {@link InfiniteLoop}.
 */
public class LoopContinue extends TargetNode {

    @Override
    public <T> T accept(TargetNodeVisitor<T> visitor) {
        return visitor.visitContinue(this);
    }

    @Override
    public boolean equals(Object o) {
        return o != null && getClass() == o.getClass();
    }

    @Override
    public int hashCode() {
        return LoopContinue.class.hashCode();
    }

    @Override
    public String toString() {
        return "LoopContinue{}";
    }
}
