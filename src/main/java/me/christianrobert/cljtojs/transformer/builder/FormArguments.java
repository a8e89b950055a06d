package me.christianrobert.cljtojs.transformer.builder;

import me.christianrobert.cljtojs.transformer.context.MalformedSpecialFormException;
import me.christianrobert.cljtojs.transformer.context.UnsupportedArityException;
import me.christianrobert.cljtojs.transformer.tree.NodeKind;
import me.christianrobert.cljtojs.transformer.tree.SourceNode;
import me.christianrobert.cljtojs.transformer.tree.SourcePosition;

import java.util.Collections;
import java.util.List;

/**
 * Positional view of the arguments of a list form (everything after the head).
 *
 * <p>All shape checks raise {@link MalformedSpecialFormException} and all count checks raise
 * {@link UnsupportedArityException}, both carrying the form's source position.</p>
 */
public class FormArguments {

    private final String form;
    private final SourcePosition position;
    private final List<SourceNode> arguments;

    public FormArguments(String form, SourceNode listNode, List<SourceNode> arguments) {
        this.form = form;
        this.position = positionOf(listNode);
        this.arguments = List.copyOf(arguments);
    }

    private static SourcePosition positionOf(SourceNode listNode) {
        if (listNode.getPosition() != null) {
            return listNode.getPosition();
        }
        List<SourceNode> elements = listNode.elements();
        if (!elements.isEmpty() && elements.get(0).getPosition() != null) {
            return elements.get(0).getPosition();
        }
        return null;
    }

    public String getForm() {
        return form;
    }

    public SourcePosition getPosition() {
        return position;
    }

    public int size() {
        return arguments.size();
    }

    public List<SourceNode> all() {
        return arguments;
    }

    /**
     * Arguments from {@code from} (inclusive) to the end; empty if there are fewer.
     */
    public List<SourceNode> rest(int from) {
        if (from >= arguments.size()) {
            return Collections.emptyList();
        }
        return arguments.subList(from, arguments.size());
    }

    public boolean has(int index) {
        return index < arguments.size();
    }

    public SourceNode get(int index) {
        return has(index) ? arguments.get(index) : null;
    }

    /**
     * Gets a required argument.
     *
     * @param index Argument index (0 = first after the head)
     * @param role What the argument is, for the error message (e.g. "value")
     */
    public SourceNode require(int index, String role) {
        if (!has(index)) {
            throw malformed(form + " is missing its " + role);
        }
        return arguments.get(index);
    }

    /**
     * Gets a required argument that must be a literal symbol.
     *
     * @return Symbol name
     */
    public String requireSymbol(int index, String role) {
        SourceNode node = require(index, role);
        if (!node.isLiteralSymbol()) {
            throw malformed(form + " expects a symbol as its " + role + ", got " + node.getKind());
        }
        return node.getSymbolName();
    }

    /**
     * Gets a required argument that must be a vector.
     */
    public SourceNode requireVector(int index, String role) {
        SourceNode node = require(index, role);
        if (!node.is(NodeKind.VECTOR)) {
            throw malformed(form + " expects a vector as its " + role + ", got " + node.getKind());
        }
        return node;
    }

    public void requireCount(int expected) {
        if (arguments.size() != expected) {
            throw new UnsupportedArityException(form, expected, arguments.size(), position);
        }
    }

    public void requireCountBetween(int minimum, int maximum) {
        if (arguments.size() < minimum || arguments.size() > maximum) {
            throw new UnsupportedArityException(form, minimum, maximum, arguments.size(), position);
        }
    }

    public MalformedSpecialFormException malformed(String message) {
        return new MalformedSpecialFormException(message, position, form);
    }
}
