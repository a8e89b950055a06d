package me.christianrobert.cljtojs.target;

import java.util.List;
import java.util.Objects;

public class Assignment extends TargetNode {

    private final List<TargetNode> target;
    private final List<TargetNode> value;

    public Assignment(List<TargetNode> target, List<TargetNode> value) {
        this.target = sequence(target, "Assignment target");
        this.value = sequence(value, "Assignment value");
    }

    public List<TargetNode> getTarget() {
        return target;
    }

    public List<TargetNode> getValue() {
        return value;
    }

    @Override
    public <T> T accept(TargetNodeVisitor<T> visitor) {
        return visitor.visitAssignment(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Assignment that = (Assignment) o;
        return target.equals(that.target) && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(target, value);
    }

    @Override
    public String toString() {
        return "Assignment{target=" + target + ", value=" + value + "}";
    }
}
