package me.christianrobert.cljtojs.transformer.placeholder;

import me.christianrobert.cljtojs.transformer.tree.SourceNode;

import java.util.List;

/**
 * Result of resolving an anonymous-function body: the rewritten body and the
 * allocated parameter names in positional order.
 */
public class ResolvedPlaceholders {

    private final SourceNode body;
    private final List<String> parameterNames;
    private final boolean usesRestParameter;

    public ResolvedPlaceholders(SourceNode body, List<String> parameterNames, boolean usesRestParameter) {
        if (parameterNames == null) {
            throw new IllegalArgumentException("Parameter names cannot be null");
        }
        this.body = body;
        this.parameterNames = List.copyOf(parameterNames);
        this.usesRestParameter = usesRestParameter;
    }

    public SourceNode getBody() {
        return body;
    }

    public List<String> getParameterNames() {
        return parameterNames;
    }

    /**
     * Whether the body referenced {@code %&}.
     */
    public boolean usesRestParameter() {
        return usesRestParameter;
    }

    @Override
    public String toString() {
        return "ResolvedPlaceholders{parameterNames=" + parameterNames + ", usesRestParameter=" + usesRestParameter + "}";
    }
}
