package me.christianrobert.cljtojs.target;

import java.util.Objects;

/**
 * Numeric literal, kept as its verbatim source text so no precision or notation is lost.
 */
public class NumberLiteral extends TargetNode {

    private final String text;

    public NumberLiteral(String text) {
        this.text = requireText(text, "Number literal text");
    }

    public static NumberLiteral of(long value) {
        return new NumberLiteral(Long.toString(value));
    }

    public String getText() {
        return text;
    }

    @Override
    public <T> T accept(TargetNodeVisitor<T> visitor) {
        return visitor.visitNumber(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return text.equals(((NumberLiteral) o).text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(text);
    }

    @Override
    public String toString() {
        return "NumberLiteral{text='" + text + "'}";
    }
}
