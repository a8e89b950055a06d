package me.christianrobert.cljtojs.target;

import java.util.List;
import java.util.Objects;

/**
 * Two-way branch. Only the taken branch is executed; its last node is the value of
 * the conditional. An empty alternative means "no else branch".
 */
public class Conditional extends TargetNode {

    private final List<TargetNode> test;
    private final List<TargetNode> consequent;
    private final List<TargetNode> alternative;

    public Conditional(List<TargetNode> test, List<TargetNode> consequent, List<TargetNode> alternative) {
        this.test = sequence(test, "Conditional test");
        this.consequent = sequence(consequent, "Conditional consequent");
        this.alternative = sequence(alternative, "Conditional alternative");
    }

    public List<TargetNode> getTest() {
        return test;
    }

    public List<TargetNode> getConsequent() {
        return consequent;
    }

    public List<TargetNode> getAlternative() {
        return alternative;
    }

    public boolean hasAlternative() {
        return !alternative.isEmpty();
    }

    @Override
    public <T> T accept(TargetNodeVisitor<T> visitor) {
        return visitor.visitConditional(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Conditional that = (Conditional) o;
        return test.equals(that.test) && consequent.equals(that.consequent) && alternative.equals(that.alternative);
    }

    @Override
    public int hashCode() {
        return Objects.hash(test, consequent, alternative);
    }

    @Override
    public String toString() {
        return "Conditional{test=" + test + ", consequent=" + consequent + ", alternative=" + alternative + "}";
    }
}
