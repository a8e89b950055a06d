package me.christianrobert.cljtojs.target;

import java.util.Objects;

/**
 * Bare reference to a named binding, function or runtime constant.
 */
public class SymbolReference extends TargetNode {

    private final String name;

    public SymbolReference(String name) {
        this.name = requireText(name, "Symbol name");
    }

    public String getName() {
        return name;
    }

    @Override
    public <T> T accept(TargetNodeVisitor<T> visitor) {
        return visitor.visitSymbol(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return name.equals(((SymbolReference) o).name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name);
    }

    @Override
    public String toString() {
        return "SymbolReference{name='" + name + "'}";
    }
}
