package me.christianrobert.cljtojs.target;

import java.util.List;
import java.util.Objects;

/**
 * Named function declaration. The value of the last body node is the return value.
 */
public class FunctionDeclaration extends TargetNode {

    private final SymbolReference name;
    private final List<TargetNode> parameters;
    private final List<TargetNode> body;

    public FunctionDeclaration(SymbolReference name, List<TargetNode> parameters, List<TargetNode> body) {
        if (name == null) {
            throw new IllegalArgumentException("Function name cannot be null");
        }
        this.name = name;
        this.parameters = sequence(parameters, "Function parameters");
        this.body = sequence(body, "Function body");
    }

    public SymbolReference getName() {
        return name;
    }

    public List<TargetNode> getParameters() {
        return parameters;
    }

    public List<TargetNode> getBody() {
        return body;
    }

    @Override
    public <T> T accept(TargetNodeVisitor<T> visitor) {
        return visitor.visitFunction(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FunctionDeclaration that = (FunctionDeclaration) o;
        return name.equals(that.name) && parameters.equals(that.parameters) && body.equals(that.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, parameters, body);
    }

    @Override
    public String toString() {
        return "FunctionDeclaration{name=" + name.getName() + ", parameters=" + parameters + ", body=" + body + "}";
    }
}
