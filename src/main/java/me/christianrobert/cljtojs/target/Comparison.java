package me.christianrobert.cljtojs.target;

import java.util.List;
import java.util.Objects;

/**
 * Binary comparison. The operator is the target operator text ({@code <}, {@code >=},
 * {@code ==}, {@code !==}, ...).
 */
public class Comparison extends TargetNode {

    private final String operator;
    private final List<TargetNode> left;
    private final List<TargetNode> right;

    public Comparison(String operator, List<TargetNode> left, List<TargetNode> right) {
        this.operator = requireText(operator, "Comparison operator");
        this.left = sequence(left, "Comparison left operand");
        this.right = sequence(right, "Comparison right operand");
    }

    public String getOperator() {
        return operator;
    }

    public List<TargetNode> getLeft() {
        return left;
    }

    public List<TargetNode> getRight() {
        return right;
    }

    @Override
    public <T> T accept(TargetNodeVisitor<T> visitor) {
        return visitor.visitComparison(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Comparison that = (Comparison) o;
        return operator.equals(that.operator) && left.equals(that.left) && right.equals(that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, left, right);
    }

    @Override
    public String toString() {
        return "Comparison{operator='" + operator + "', left=" + left + ", right=" + right + "}";
    }
}
