package me.christianrobert.cljtojs.target;

import java.util.List;
import java.util.Objects;

/**
 * Function or method call.
 *
 * <p>For method calls the callee sequence is the receiver followed by the method symbol
 * (whose text keeps its leading dot), so a renderer concatenates them.</p>
 */
public class Invocation extends TargetNode {

    private final List<TargetNode> callee;
    private final List<TargetNode> arguments;

    public Invocation(List<TargetNode> callee, List<TargetNode> arguments) {
        this.callee = sequence(callee, "Invocation callee");
        this.arguments = sequence(arguments, "Invocation arguments");
    }

    public List<TargetNode> getCallee() {
        return callee;
    }

    public List<TargetNode> getArguments() {
        return arguments;
    }

    @Override
    public <T> T accept(TargetNodeVisitor<T> visitor) {
        return visitor.visitInvocation(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Invocation that = (Invocation) o;
        return callee.equals(that.callee) && arguments.equals(that.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(callee, arguments);
    }

    @Override
    public String toString() {
        return "Invocation{callee=" + callee + ", arguments=" + arguments + "}";
    }
}
