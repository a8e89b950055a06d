package me.christianrobert.cljtojs.target;

/**
 * Reference to a loop-bound variable by its declaration index in the nearest enclosing
 * loop scope. Unaffected by shadowing inside the loop body.
 */
public class IndexedSymbolReference extends TargetNode {

    private final int index;

    public IndexedSymbolReference(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("Slot index cannot be negative");
        }
        this.index = index;
    }

    public int getIndex() {
        return index;
    }

    @Override
    public <T> T accept(TargetNodeVisitor<T> visitor) {
        return visitor.visitIndexedSymbol(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return index == ((IndexedSymbolReference) o).index;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(index);
    }

    @Override
    public String toString() {
        return "IndexedSymbolReference{index=" + index + "}";
    }
}
