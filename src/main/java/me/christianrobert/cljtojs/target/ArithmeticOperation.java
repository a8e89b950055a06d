package me.christianrobert.cljtojs.target;

import java.util.List;
import java.util.Objects;

/**
 * Binary arithmetic ({@code + - * /}). Also used for string concatenation with an empty
 * string literal on the left.
 */
public class ArithmeticOperation extends TargetNode {

    private final String operator;
    private final List<TargetNode> left;
    private final List<TargetNode> right;

    public ArithmeticOperation(String operator, List<TargetNode> left, List<TargetNode> right) {
        this.operator = requireText(operator, "Arithmetic operator");
        this.left = sequence(left, "Arithmetic left operand");
        this.right = sequence(right, "Arithmetic right operand");
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
        return visitor.visitArithmetic(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ArithmeticOperation that = (ArithmeticOperation) o;
        return operator.equals(that.operator) && left.equals(that.left) && right.equals(that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, left, right);
    }

    @Override
    public String toString() {
        return "ArithmeticOperation{operator='" + operator + "', left=" + left + ", right=" + right + "}";
    }
}
