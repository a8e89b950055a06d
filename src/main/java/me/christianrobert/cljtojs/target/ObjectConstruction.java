package me.christianrobert.cljtojs.target;

import java.util.List;
import java.util.Objects;

/**
 * {@code new Constructor(arguments...)}
 */
public class ObjectConstruction extends TargetNode {

    private final List<TargetNode> constructor;
    private final List<TargetNode> arguments;

    public ObjectConstruction(List<TargetNode> constructor, List<TargetNode> arguments) {
        this.constructor = sequence(constructor, "Constructor");
        this.arguments = sequence(arguments, "Constructor arguments");
    }

    public List<TargetNode> getConstructor() {
        return constructor;
    }

    public List<TargetNode> getArguments() {
        return arguments;
    }

    @Override
    public <T> T accept(TargetNodeVisitor<T> visitor) {
        return visitor.visitObjectConstruction(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ObjectConstruction that = (ObjectConstruction) o;
        return constructor.equals(that.constructor) && arguments.equals(that.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(constructor, arguments);
    }

    @Override
    public String toString() {
        return "ObjectConstruction{constructor=" + constructor + ", arguments=" + arguments + "}";
    }
}
