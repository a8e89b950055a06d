package me.christianrobert.cljtojs.target;

import java.util.List;
import java.util.Objects;

/**
 * Field read on an object. The property symbol keeps its source text ({@code .-name}).
 */
public class PropertyAccess extends TargetNode {

    private final List<TargetNode> object;
    private final SymbolReference property;

    public PropertyAccess(List<TargetNode> object, SymbolReference property) {
        if (property == null) {
            throw new IllegalArgumentException("Property cannot be null");
        }
        this.object = sequence(object, "Property owner");
        this.property = property;
    }

    public List<TargetNode> getObject() {
        return object;
    }

    public SymbolReference getProperty() {
        return property;
    }

    @Override
    public <T> T accept(TargetNodeVisitor<T> visitor) {
        return visitor.visitPropertyAccess(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PropertyAccess that = (PropertyAccess) o;
        return object.equals(that.object) && property.equals(that.property);
    }

    @Override
    public int hashCode() {
        return Objects.hash(object, property);
    }

    @Override
    public String toString() {
        return "PropertyAccess{object=" + object + ", property=" + property.getName() + "}";
    }
}
