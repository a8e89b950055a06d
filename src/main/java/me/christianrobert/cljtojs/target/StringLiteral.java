package me.christianrobert.cljtojs.target;

import java.util.Objects;

public class StringLiteral extends TargetNode {

    private final String value;

    public StringLiteral(String value) {
        if (value == null) {
            throw new IllegalArgumentException("String literal value cannot be null");
        }
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    @Override
    public <T> T accept(TargetNodeVisitor<T> visitor) {
        return visitor.visitString(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return value.equals(((StringLiteral) o).value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value);
    }

    @Override
    public String toString() {
        return "StringLiteral{value='" + value + "'}";
    }
}
