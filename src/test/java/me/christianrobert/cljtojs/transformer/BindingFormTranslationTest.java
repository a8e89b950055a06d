package me.christianrobert.cljtojs.transformer;

import me.christianrobert.cljtojs.target.ArithmeticOperation;
import me.christianrobert.cljtojs.target.Assignment;
import me.christianrobert.cljtojs.target.Comparison;
import me.christianrobert.cljtojs.target.Conditional;
import me.christianrobert.cljtojs.target.IndexedSymbolReference;
import me.christianrobert.cljtojs.target.InfiniteLoop;
import me.christianrobert.cljtojs.target.Invocation;
import me.christianrobert.cljtojs.target.LoopContinue;
import me.christianrobert.cljtojs.target.NumberLiteral;
import me.christianrobert.cljtojs.target.ScopeBlock;
import me.christianrobert.cljtojs.target.StringLiteral;
import me.christianrobert.cljtojs.target.SymbolReference;
import me.christianrobert.cljtojs.target.TargetNode;
import me.christianrobert.cljtojs.target.VariableDeclaration;
import me.christianrobert.cljtojs.transformer.builder.TargetCodeBuilder;
import me.christianrobert.cljtojs.transformer.context.MalformedSpecialFormException;
import me.christianrobert.cljtojs.transformer.context.UnsupportedArityException;
import me.christianrobert.cljtojs.transformer.tree.SourceNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static me.christianrobert.cljtojs.transformer.tree.SourceTrees.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@code let}, {@code loop} and {@code recur}.
 */
class BindingFormTranslationTest {

    private TargetCodeBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new TargetCodeBuilder();
    }

    private static SymbolReference s(String name) {
        return new SymbolReference(name);
    }

    private static NumberLiteral n(long value) {
        return NumberLiteral.of(value);
    }

    // ========== let ==========

    @Test
    void letDeclaresBindingsThenBody() {
        SourceNode form = list(sym("let"), vector(sym("a"), num(1)), list(sym("inc"), sym("a")));

        List<TargetNode> result = builder.visit(form);

        assertEquals(List.of(
                new VariableDeclaration(s("a"), List.of(n(1))),
                new ArithmeticOperation("+", List.of(s("a")), List.of(n(1)))), result);
    }

    @Test
    void letPairsEachNameWithItsOwnValue() {
        // Three pairs: every name must get the value written right after it
        SourceNode form = list(sym("let"),
                vector(sym("x"), num(10), sym("y"), str("twenty"), sym("z"), list(sym("f"), sym("x"))),
                sym("z"));

        List<TargetNode> result = builder.visit(form);

        assertEquals(List.of(
                new VariableDeclaration(s("x"), List.of(n(10))),
                new VariableDeclaration(s("y"), List.of(new StringLiteral("twenty"))),
                new VariableDeclaration(s("z"), List.of(new Invocation(List.of(s("f")), List.of(s("x"))))),
                s("z")), result);
    }

    @Test
    void letBindingsSeeEarlierBindings() {
        SourceNode form = list(sym("let"),
                vector(sym("a"), num(2), sym("b"), list(sym("*"), sym("a"), num(10))),
                list(sym("+"), sym("a"), sym("b")));

        assertEquals(22L, new TargetEvaluator().run(builder.visit(form)));
    }

    @Test
    void letWithEmptyBindingsIsJustBody() {
        assertEquals(List.of(n(1)), builder.visit(list(sym("let"), vector(), num(1))));
    }

    @Test
    void letRejectsOddBindingCount() {
        MalformedSpecialFormException e = assertThrows(MalformedSpecialFormException.class,
                () -> builder.visit(list(sym("let"), vector(sym("a"), num(1), sym("b")), sym("a"))));

        assertTrue(e.getMessage().contains("even"), e.getMessage());
    }

    @Test
    void letRejectsNonSymbolName() {
        assertThrows(MalformedSpecialFormException.class,
                () -> builder.visit(list(sym("let"), vector(str("a"), num(1)), sym("a"))));
    }

    @Test
    void letRequiresBindingVector() {
        assertThrows(MalformedSpecialFormException.class,
                () -> builder.visit(list(sym("let"), list(sym("a"), num(1)), sym("a"))));
        assertThrows(MalformedSpecialFormException.class, () -> builder.visit(list(sym("let"))));
    }

    // ========== loop / recur shape ==========

    @Test
    void loopWithSingleBindingLowersToRepeatBlock() {
        SourceNode form = list(sym("loop"), vector(sym("i"), num(0)),
                list(sym("recur"), list(sym("inc"), sym("i"))));

        List<TargetNode> result = builder.visit(form);

        List<TargetNode> expected = List.of(new ScopeBlock(List.of(
                new VariableDeclaration(s("i"), List.of(n(0))),
                new InfiniteLoop(List.of(
                        new Assignment(
                                List.of(new IndexedSymbolReference(0)),
                                List.of(new ArithmeticOperation("+", List.of(s("i")), List.of(n(1))))),
                        new LoopContinue())))));
        assertEquals(expected, result);
    }

    @Test
    void recurNeverProducesRecursiveCall() {
        SourceNode form = list(sym("loop"), vector(sym("i"), num(0)),
                list(sym("if"), list(sym("<"), sym("i"), num(3)),
                        list(sym("recur"), list(sym("inc"), sym("i"))),
                        sym("i")));

        ScopeBlock scope = (ScopeBlock) builder.visit(form).get(0);
        InfiniteLoop loop = (InfiniteLoop) scope.getBody().get(1);
        Conditional conditional = (Conditional) loop.getBody().get(0);

        assertInstanceOf(Comparison.class, conditional.getTest().get(0));
        List<TargetNode> recur = conditional.getConsequent();
        assertEquals(2, recur.size());
        assertInstanceOf(Assignment.class, recur.get(0));
        assertInstanceOf(LoopContinue.class, recur.get(1));
    }

    @Test
    void multiValueRecurBindsTemporariesFirst() {
        SourceNode form = list(sym("loop"), vector(sym("a"), num(1), sym("b"), num(2)),
                list(sym("recur"), sym("b"), sym("a")));

        ScopeBlock scope = (ScopeBlock) builder.visit(form).get(0);
        InfiniteLoop loop = (InfiniteLoop) scope.getBody().get(2);

        assertEquals(List.of(
                new VariableDeclaration(s("recur$1"), List.of(s("b"))),
                new VariableDeclaration(s("recur$2"), List.of(s("a"))),
                new Assignment(List.of(new IndexedSymbolReference(0)), List.of(s("recur$1"))),
                new Assignment(List.of(new IndexedSymbolReference(1)), List.of(s("recur$2"))),
                new LoopContinue()), loop.getBody());
    }

    @Test
    void recurWithoutBindingsOnlyContinues() {
        SourceNode form = list(sym("loop"), vector(), list(sym("recur")));

        ScopeBlock scope = (ScopeBlock) builder.visit(form).get(0);

        assertEquals(List.of(new InfiniteLoop(List.of(new LoopContinue()))), scope.getBody());
    }

    @Test
    void loopRejectsOddBindingCount() {
        assertThrows(MalformedSpecialFormException.class,
                () -> builder.visit(list(sym("loop"), vector(sym("i")), sym("i"))));
    }

    // ========== recur validation ==========

    @Test
    void recurOutsideLoopIsRejected() {
        MalformedSpecialFormException e = assertThrows(MalformedSpecialFormException.class,
                () -> builder.visit(list(sym("recur"), num(1))));

        assertEquals("recur", e.getContext());
    }

    @Test
    void recurDoesNotCrossFunctionBoundary() {
        SourceNode form = list(sym("loop"), vector(sym("i"), num(0)),
                list(sym("fn"), vector(), list(sym("recur"), num(1))));

        assertThrows(MalformedSpecialFormException.class, () -> builder.visit(form));
    }

    @Test
    void recurArgumentCountMustMatchBindings() {
        SourceNode form = list(sym("loop"), vector(sym("i"), num(0), sym("j"), num(0)),
                list(sym("recur"), num(1)));

        UnsupportedArityException e = assertThrows(UnsupportedArityException.class, () -> builder.visit(form));
        assertEquals(2, e.getMinimum());
        assertEquals(1, e.getActual());
    }

    @Test
    void recurTargetsInnermostLoop() {
        SourceNode form = list(sym("loop"), vector(sym("i"), num(0)),
                list(sym("loop"), vector(sym("j"), num(0), sym("k"), num(0)),
                        list(sym("recur"), num(1), num(2))));

        assertDoesNotThrow(() -> builder.visit(form));
    }

    @Test
    void outerLoopIsRestoredAfterInnerLoop() {
        SourceNode form = list(sym("loop"), vector(sym("i"), num(0)),
                list(sym("loop"), vector(sym("j"), num(0), sym("k"), num(0)), num(0)),
                list(sym("recur"), num(1)));

        assertDoesNotThrow(() -> builder.visit(form));
    }

    @Test
    void recurTrackingSurvivesEarlierFailure() {
        assertThrows(MalformedSpecialFormException.class, () -> builder.visit(list(sym("recur"))));

        SourceNode form = list(sym("loop"), vector(sym("i"), num(0)), list(sym("recur"), num(1)));
        assertDoesNotThrow(() -> builder.visit(form));
    }

    // ========== Evaluation ==========

    @Test
    void countingLoopTerminates() {
        SourceNode form = list(sym("loop"), vector(sym("i"), num(0)),
                list(sym("if"), list(sym("<"), sym("i"), num(3)),
                        list(sym("recur"), list(sym("inc"), sym("i"))),
                        sym("i")));

        assertEquals(3L, new TargetEvaluator().run(builder.visit(form)));
    }

    @Test
    void accumulatingLoop() {
        SourceNode form = list(sym("loop"), vector(sym("i"), num(0), sym("acc"), num(0)),
                list(sym("if"), list(sym("<"), sym("i"), num(5)),
                        list(sym("recur"), list(sym("inc"), sym("i")), list(sym("+"), sym("acc"), sym("i"))),
                        sym("acc")));

        assertEquals(10L, new TargetEvaluator().run(builder.visit(form)));
    }

    @Test
    void recurRebindsSimultaneously() {
        // Swapping a and b only works if both right-hand sides see the old values
        SourceNode form = list(sym("loop"), vector(sym("a"), num(1), sym("b"), num(2), sym("n"), num(0)),
                list(sym("if"), list(sym("<"), sym("n"), num(1)),
                        list(sym("recur"), sym("b"), sym("a"), list(sym("inc"), sym("n"))),
                        list(sym("-"), sym("a"), sym("b"))));

        assertEquals(1L, new TargetEvaluator().run(builder.visit(form)));
    }

    @Test
    void loopInsideFunction() {
        List<TargetNode> nodes = builder.visit(program(
                list(sym("defn"), sym("sum-to"), vector(sym("n")),
                        list(sym("loop"), vector(sym("i"), num(0), sym("acc"), num(0)),
                                list(sym("if"), list(sym(">"), sym("i"), sym("n")),
                                        sym("acc"),
                                        list(sym("recur"), list(sym("inc"), sym("i")),
                                                list(sym("+"), sym("acc"), sym("i")))))),
                list(sym("sum-to"), num(4))));

        assertEquals(10L, new TargetEvaluator().run(nodes));
    }
}
