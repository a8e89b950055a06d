package me.christianrobert.cljtojs.target;

import java.util.List;

public class ArrayLiteral extends TargetNode {

    private final List<TargetNode> elements;

    public ArrayLiteral(List<TargetNode> elements) {
        this.elements = sequence(elements, "Array elements");
    }

    public List<TargetNode> getElements() {
        return elements;
    }

    @Override
    public <T> T accept(TargetNodeVisitor<T> visitor) {
        return visitor.visitArrayLiteral(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return elements.equals(((ArrayLiteral) o).elements);
    }

    @Override
    public int hashCode() {
        return elements.hashCode();
    }

    @Override
    public String toString() {
        return "ArrayLiteral{elements=" + elements + "}";
    }
}
