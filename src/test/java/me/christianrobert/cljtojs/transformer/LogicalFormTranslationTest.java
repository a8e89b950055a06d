package me.christianrobert.cljtojs.transformer;

import me.christianrobert.cljtojs.target.BooleanLiteral;
import me.christianrobert.cljtojs.target.Conditional;
import me.christianrobert.cljtojs.target.SymbolReference;
import me.christianrobert.cljtojs.target.TargetNode;
import me.christianrobert.cljtojs.target.VariableDeclaration;
import me.christianrobert.cljtojs.transformer.builder.TargetCodeBuilder;
import me.christianrobert.cljtojs.transformer.context.MalformedSpecialFormException;
import me.christianrobert.cljtojs.transformer.tree.SourceNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static me.christianrobert.cljtojs.transformer.tree.SourceTrees.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for short-circuit lowering of {@code and} / {@code or}.
 *
 * <p>Shape tests pin the nesting; evaluator tests run the emitted nodes with counting
 * side effects to prove that later operands are evaluated only when needed.</p>
 */
class LogicalFormTranslationTest {

    private TargetCodeBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new TargetCodeBuilder();
    }

    private static SymbolReference s(String name) {
        return new SymbolReference(name);
    }

    private static SourceNode call(String name) {
        return list(sym(name));
    }

    // ========== Shape ==========

    @Test
    void andNestsLaterOperandsInThenBranch() {
        List<TargetNode> result = builder.visit(list(sym("and"), sym("a"), sym("b"), sym("c")));

        List<TargetNode> expected = List.of(
                new VariableDeclaration(s("and$1"), List.of(s("a"))),
                new Conditional(
                        List.of(s("and$1")),
                        List.of(
                                new VariableDeclaration(s("and$2"), List.of(s("b"))),
                                new Conditional(
                                        List.of(s("and$2")),
                                        List.of(new VariableDeclaration(s("and$3"), List.of(s("c"))), s("and$3")),
                                        List.of(s("and$2")))),
                        List.of(s("and$1"))));
        assertEquals(expected, result);
    }

    @Test
    void orNestsLaterOperandsInElseBranch() {
        List<TargetNode> result = builder.visit(list(sym("or"), sym("a"), sym("b")));

        List<TargetNode> expected = List.of(
                new VariableDeclaration(s("or$1"), List.of(s("a"))),
                new Conditional(
                        List.of(s("or$1")),
                        List.of(s("or$1")),
                        List.of(new VariableDeclaration(s("or$2"), List.of(s("b"))), s("or$2"))));
        assertEquals(expected, result);
    }

    @Test
    void nOperandsGiveNTemporariesAndNMinusOneConditionals() {
        List<TargetNode> result = builder.visit(
                list(sym("or"), sym("a"), sym("b"), sym("c"), sym("d"), sym("e")));

        int[] counts = new int[2];
        countShape(result, counts);
        assertEquals(5, counts[0], "Temporaries");
        assertEquals(4, counts[1], "Conditionals");
    }

    private static void countShape(List<TargetNode> nodes, int[] counts) {
        for (TargetNode node : nodes) {
            if (node instanceof VariableDeclaration) {
                counts[0]++;
            } else if (node instanceof Conditional) {
                Conditional conditional = (Conditional) node;
                counts[1]++;
                countShape(conditional.getConsequent(), counts);
                countShape(conditional.getAlternative(), counts);
            }
        }
    }

    @Test
    void singleOperandYieldsItsTemporary() {
        List<TargetNode> result = builder.visit(list(sym("and"), sym("x")));

        assertEquals(List.of(new VariableDeclaration(s("and$1"), List.of(s("x"))), s("and$1")), result);
    }

    @Test
    void emptyAndIsTrue() {
        assertEquals(List.of(new BooleanLiteral(true)), builder.visit(list(sym("and"))));
    }

    @Test
    void emptyOrIsNull() {
        assertEquals(List.of(s("js/null")), builder.visit(list(sym("or"))));
    }

    @Test
    void temporariesAreUniqueAcrossForms() {
        List<TargetNode> first = builder.visit(list(sym("and"), sym("a")));
        List<TargetNode> second = builder.visit(list(sym("and"), sym("a")));

        assertNotEquals(first, second, "Each lowering must allocate fresh temporaries");
    }

    // ========== Evaluation ==========

    @Test
    void andStopsAtFirstFalsyOperand() {
        TargetEvaluator evaluator = new TargetEvaluator().define("sideEffect", args -> true);

        Object value = evaluator.run(builder.visit(list(sym("and"), bool(false), call("sideEffect"))));

        assertEquals(false, value);
        assertEquals(0, evaluator.callCount("sideEffect"), "Second operand must not run");
    }

    @Test
    void andStopsAtNull() {
        TargetEvaluator evaluator = new TargetEvaluator()
                .define("missing", args -> null)
                .define("sideEffect", args -> true);

        Object value = evaluator.run(builder.visit(list(sym("and"), call("missing"), call("sideEffect"))));

        assertNull(value);
        assertEquals(0, evaluator.callCount("sideEffect"));
    }

    @Test
    void andReturnsLastOperandWhenAllTruthy() {
        TargetEvaluator evaluator = new TargetEvaluator().define("sideEffect", args -> "done");

        Object value = evaluator.run(builder.visit(list(sym("and"), num(1), bool(true), call("sideEffect"))));

        assertEquals("done", value);
        assertEquals(1, evaluator.callCount("sideEffect"));
    }

    @Test
    void orStopsAtFirstTruthyOperand() {
        TargetEvaluator evaluator = new TargetEvaluator()
                .define("first", args -> "hit")
                .define("second", args -> "never");

        Object value = evaluator.run(builder.visit(list(sym("or"), call("first"), call("second"))));

        assertEquals("hit", value);
        assertEquals(1, evaluator.callCount("first"));
        assertEquals(0, evaluator.callCount("second"));
    }

    @Test
    void orFallsThroughFalsyOperands() {
        TargetEvaluator evaluator = new TargetEvaluator()
                .define("miss", args -> false)
                .define("hit", args -> 7L);

        Object value = evaluator.run(builder.visit(list(sym("or"), call("miss"), call("miss"), call("hit"))));

        assertEquals(7L, value);
        assertEquals(2, evaluator.callCount("miss"));
        assertEquals(1, evaluator.callCount("hit"));
    }

    @Test
    void orOfFalsyOperandsReturnsLastOne() {
        Object value = new TargetEvaluator().run(builder.visit(list(sym("or"), bool(false), list(sym("or")))));

        assertNull(value);
    }

    @Test
    void nestedAndInsideOrShortCircuits() {
        TargetEvaluator evaluator = new TargetEvaluator().define("sideEffect", args -> true);
        SourceNode form = list(sym("or"),
                list(sym("and"), bool(true), num(5)),
                call("sideEffect"));

        assertEquals(5L, evaluator.run(builder.visit(form)));
        assertEquals(0, evaluator.callCount("sideEffect"));
    }

    // ========== Temporaries and user symbols ==========

    @Test
    void userBindingWithTemporaryShapeIsRejected() {
        // (let [or$1 42] (or false or$1))
        SourceNode form = list(sym("let"), vector(sym("or$1"), num(42)),
                list(sym("or"), bool(false), sym("or$1")));

        MalformedSpecialFormException e = assertThrows(MalformedSpecialFormException.class, () -> builder.visit(form));
        assertTrue(e.getMessage().contains("or$1"), e.getMessage());
    }

    @Test
    void userReferenceWithTemporaryShapeIsRejected() {
        SourceNode form = list(sym("and"), sym("ready"), sym("and$1"));

        assertThrows(MalformedSpecialFormException.class, () -> builder.visit(form));
    }

    @Test
    void userSymbolsWithDollarStillTranslate() {
        SourceNode form = list(sym("or"), sym("$"), sym("js$lib"), sym("a$1b"));

        List<TargetNode> result = builder.visit(form);

        assertEquals(new VariableDeclaration(s("or$1"), List.of(s("$"))), result.get(0));
    }
}
