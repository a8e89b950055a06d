package me.christianrobert.cljtojs.transformer;

import me.christianrobert.cljtojs.target.ArithmeticOperation;
import me.christianrobert.cljtojs.target.Comparison;
import me.christianrobert.cljtojs.target.NumberLiteral;
import me.christianrobert.cljtojs.target.StringLiteral;
import me.christianrobert.cljtojs.target.SymbolReference;
import me.christianrobert.cljtojs.target.TargetNode;
import me.christianrobert.cljtojs.transformer.builder.TargetCodeBuilder;
import me.christianrobert.cljtojs.transformer.context.UnsupportedArityException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static me.christianrobert.cljtojs.transformer.tree.SourceTrees.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for comparison and arithmetic operators.
 *
 * <p>All operators are fixed-arity. Variadic use is rejected with
 * {@link UnsupportedArityException} rather than truncated.</p>
 */
class OperatorTranslationTest {

    private TargetCodeBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new TargetCodeBuilder();
    }

    // ========== Comparisons ==========

    private static final String[] COMPARATORS = {"<", ">", "<=", ">=", "=="};

    @Test
    void comparisonUsesOperatorAsComparator() {
        for (String operator : COMPARATORS) {
            List<TargetNode> result = builder.visit(list(sym(operator), sym("a"), num(1)));

            assertEquals(List.of(new Comparison(operator,
                    List.of(new SymbolReference("a")),
                    List.of(new NumberLiteral("1")))), result, "Comparator for " + operator);
        }
    }

    @Test
    void notEqualBecomesStrictInequality() {
        List<TargetNode> result = builder.visit(list(sym("not="), sym("a"), sym("b")));

        assertEquals(List.of(new Comparison("!==",
                List.of(new SymbolReference("a")),
                List.of(new SymbolReference("b")))), result);
    }

    @Test
    void comparisonRejectsChaining() {
        for (String operator : List.of("<", ">", "<=", ">=", "==", "not=")) {
            UnsupportedArityException e = assertThrows(UnsupportedArityException.class,
                    () -> builder.visit(list(sym(operator), num(1), num(2), num(3))), operator);

            assertEquals(2, e.getMinimum());
            assertEquals(2, e.getMaximum());
            assertEquals(3, e.getActual());
        }
    }

    @Test
    void comparisonsEvaluate() {
        TargetEvaluator evaluator = new TargetEvaluator();

        assertEquals(true, evaluator.run(builder.visit(list(sym("<"), num(1), num(2)))));
        assertEquals(false, evaluator.run(builder.visit(list(sym(">="), num(1), num(2)))));
        assertEquals(true, evaluator.run(builder.visit(list(sym("not="), num(1), num(2)))));
    }

    @Test
    void comparisonRejectsSingleOperand() {
        assertThrows(UnsupportedArityException.class, () -> builder.visit(list(sym("<"), num(1))));
    }

    // ========== Arithmetic ==========

    @Test
    void binaryArithmetic() {
        for (String operator : List.of("+", "-", "*", "/")) {
            List<TargetNode> result = builder.visit(list(sym(operator), num(6), num(3)));

            assertEquals(List.of(new ArithmeticOperation(operator,
                    List.of(new NumberLiteral("6")),
                    List.of(new NumberLiteral("3")))), result, "Operator " + operator);
        }
    }

    @Test
    void arithmeticRejectsThreeOperands() {
        UnsupportedArityException e = assertThrows(UnsupportedArityException.class,
                () -> builder.visit(list(sym("+"), num(1), num(2), num(3))));

        assertEquals("+ expects 2 operands, got 3", e.getMessage());
    }

    @Test
    void arithmeticRejectsUnaryMinus() {
        assertThrows(UnsupportedArityException.class, () -> builder.visit(list(sym("-"), num(1))));
    }

    @Test
    void nestedArithmeticKeepsStructure() {
        List<TargetNode> result = builder.visit(list(sym("*"), list(sym("+"), num(1), num(2)), num(3)));

        ArithmeticOperation product = (ArithmeticOperation) result.get(0);
        assertEquals("*", product.getOperator());
        assertEquals("+", ((ArithmeticOperation) product.getLeft().get(0)).getOperator());
        assertEquals(9L, new TargetEvaluator().run(result));
    }

    // ========== inc / dec ==========

    @Test
    void incAddsOne() {
        assertEquals(List.of(new ArithmeticOperation("+",
                List.of(new SymbolReference("i")),
                List.of(new NumberLiteral("1")))), builder.visit(list(sym("inc"), sym("i"))));
    }

    @Test
    void decSubtractsOne() {
        assertEquals(List.of(new ArithmeticOperation("-",
                List.of(new SymbolReference("i")),
                List.of(new NumberLiteral("1")))), builder.visit(list(sym("dec"), sym("i"))));
    }

    @Test
    void incRequiresExactlyOneOperand() {
        assertThrows(UnsupportedArityException.class, () -> builder.visit(list(sym("inc"))));
        assertThrows(UnsupportedArityException.class, () -> builder.visit(list(sym("dec"), num(1), num(2))));
    }

    // ========== str ==========

    @Test
    void strConcatenatesWithEmptyString() {
        List<TargetNode> result = builder.visit(list(sym("str"), str("x")));

        assertEquals(List.of(new ArithmeticOperation("+",
                List.of(new StringLiteral("")),
                List.of(new StringLiteral("x")))), result);
    }

    @Test
    void strCoercesNumberWhenEvaluated() {
        assertEquals("42", new TargetEvaluator().run(builder.visit(list(sym("str"), num(42)))));
    }

    @Test
    void strWithTwoArgumentsIsRejected() {
        UnsupportedArityException e = assertThrows(UnsupportedArityException.class,
                () -> builder.visit(list(sym("str"), str("a"), str("b"))));

        assertEquals("str expects 1 operand, got 2", e.getMessage());
        assertEquals("str", e.getContext());
    }

    @Test
    void strWithoutArgumentsIsRejected() {
        assertThrows(UnsupportedArityException.class, () -> builder.visit(list(sym("str"))));
    }
}
