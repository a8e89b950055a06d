package me.christianrobert.cljtojs.target;

import java.util.List;

/**
 * Declares the namespace the following forms belong to. Only the name is recorded;
 * requires and imports are not resolved.
 */
public class NamespaceDeclaration extends TargetNode {

    private final List<TargetNode> name;

    public NamespaceDeclaration(List<TargetNode> name) {
        this.name = sequence(name, "Namespace name");
    }

    public List<TargetNode> getName() {
        return name;
    }

    @Override
    public <T> T accept(TargetNodeVisitor<T> visitor) {
        return visitor.visitNamespace(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return name.equals(((NamespaceDeclaration) o).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return "NamespaceDeclaration{name=" + name + "}";
    }
}
