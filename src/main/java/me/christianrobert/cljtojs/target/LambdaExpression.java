package me.christianrobert.cljtojs.target;

import java.util.List;
import java.util.Objects;

/**
 * Anonymous function literal.
 */
public class LambdaExpression extends TargetNode {

    private final List<TargetNode> parameters;
    private final List<TargetNode> body;

    public LambdaExpression(List<TargetNode> parameters, List<TargetNode> body) {
        this.parameters = sequence(parameters, "Lambda parameters");
        this.body = sequence(body, "Lambda body");
    }

    public List<TargetNode> getParameters() {
        return parameters;
    }

    public List<TargetNode> getBody() {
        return body;
    }

    @Override
    public <T> T accept(TargetNodeVisitor<T> visitor) {
        return visitor.visitLambda(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        LambdaExpression that = (LambdaExpression) o;
        return parameters.equals(that.parameters) && body.equals(that.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(parameters, body);
    }

    @Override
    public String toString() {
        return "LambdaExpression{parameters=" + parameters + ", body=" + body + "}";
    }
}
