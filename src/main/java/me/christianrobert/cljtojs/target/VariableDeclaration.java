package me.christianrobert.cljtojs.target;

import java.util.List;
import java.util.Objects;

/**
 * Declares a variable and binds it to the value of its initializer sequence.
 */
public class VariableDeclaration extends TargetNode {

    private final SymbolReference name;
    private final List<TargetNode> initializer;

    public VariableDeclaration(SymbolReference name, List<TargetNode> initializer) {
        if (name == null) {
            throw new IllegalArgumentException("Variable name cannot be null");
        }
        this.name = name;
        this.initializer = sequence(initializer, "Variable initializer");
    }

    public SymbolReference getName() {
        return name;
    }

    public List<TargetNode> getInitializer() {
        return initializer;
    }

    @Override
    public <T> T accept(TargetNodeVisitor<T> visitor) {
        return visitor.visitVariable(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        VariableDeclaration that = (VariableDeclaration) o;
        return name.equals(that.name) && initializer.equals(that.initializer);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, initializer);
    }

    @Override
    public String toString() {
        return "VariableDeclaration{name=" + name.getName() + ", initializer=" + initializer + "}";
    }
}
