package me.christianrobert.cljtojs.transformer;

import me.christianrobert.cljtojs.target.Invocation;
import me.christianrobert.cljtojs.target.NumberLiteral;
import me.christianrobert.cljtojs.target.ObjectConstruction;
import me.christianrobert.cljtojs.target.PropertyAccess;
import me.christianrobert.cljtojs.target.StringLiteral;
import me.christianrobert.cljtojs.target.SymbolReference;
import me.christianrobert.cljtojs.target.TargetNode;
import me.christianrobert.cljtojs.transformer.builder.TargetCodeBuilder;
import me.christianrobert.cljtojs.transformer.context.MalformedSpecialFormException;
import me.christianrobert.cljtojs.transformer.context.UnsupportedArityException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static me.christianrobert.cljtojs.transformer.tree.SourceTrees.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for host interop: property access, method calls, {@code new} and the {@code .} form.
 *
 * <p>Examples:</p>
 * <ul>
 *   <li>(.-length s) → s.length</li>
 *   <li>(.push items 1) → items.push(1)</li>
 *   <li>(new Date 2024) → new Date(2024)</li>
 * </ul>
 */
class InteropTranslationTest {

    private TargetCodeBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new TargetCodeBuilder();
    }

    private static SymbolReference s(String name) {
        return new SymbolReference(name);
    }

    // ========== Property access ==========

    @Test
    void propertyAccessorKeepsSymbolText() {
        List<TargetNode> result = builder.visit(list(sym(".-length"), sym("s")));

        assertEquals(List.of(new PropertyAccess(List.of(s("s")), s(".-length"))), result);
    }

    @Test
    void propertyAccessOnCallResult() {
        List<TargetNode> result = builder.visit(list(sym(".-body"), list(sym("request"))));

        PropertyAccess access = (PropertyAccess) result.get(0);
        assertEquals(List.of(new Invocation(List.of(s("request")), List.of())), access.getObject());
    }

    @Test
    void propertyAccessRequiresExactlyOneReceiver() {
        assertThrows(MalformedSpecialFormException.class, () -> builder.visit(list(sym(".-length"))));
        assertThrows(UnsupportedArityException.class,
                () -> builder.visit(list(sym(".-length"), sym("a"), sym("b"))));
    }

    @Test
    void interopHeadWithoutMemberNameIsMalformed() {
        for (String head : List.of(".-", "..", "..-x")) {
            assertThrows(MalformedSpecialFormException.class,
                    () -> builder.visit(list(sym(head), sym("obj"))), head);
        }
    }

    // ========== Method calls ==========

    @Test
    void methodCallAppendsMemberToReceiver() {
        List<TargetNode> result = builder.visit(list(sym(".push"), sym("items"), num(1), str("x")));

        assertEquals(List.of(new Invocation(
                List.of(s("items"), s(".push")),
                List.of(NumberLiteral.of(1), new StringLiteral("x")))), result);
    }

    @Test
    void methodCallWithoutArguments() {
        List<TargetNode> result = builder.visit(list(sym(".toUpperCase"), sym("name")));

        assertEquals(List.of(new Invocation(List.of(s("name"), s(".toUpperCase")), List.of())), result);
    }

    @Test
    void methodCallRequiresReceiver() {
        assertThrows(MalformedSpecialFormException.class, () -> builder.visit(list(sym(".push"))));
    }

    @Test
    void loneDotPrefixesAreOrdinarySymbols() {
        // ".-" alone is not an accessor, it falls back to a method call named ".-"
        List<TargetNode> result = builder.visit(list(sym(".-"), sym("x")));

        assertEquals(List.of(new Invocation(List.of(s("x"), s(".-")), List.of())), result);
    }

    // ========== new ==========

    @Test
    void newConstructsObject() {
        List<TargetNode> result = builder.visit(list(sym("new"), sym("Date"), num(2024), num(1)));

        assertEquals(List.of(new ObjectConstruction(
                List.of(s("Date")),
                List.of(NumberLiteral.of(2024), NumberLiteral.of(1)))), result);
    }

    @Test
    void newRequiresConstructor() {
        assertThrows(MalformedSpecialFormException.class, () -> builder.visit(list(sym("new"))));
    }

    // ========== . form ==========

    @Test
    void dotFormCallsMethod() {
        List<TargetNode> viaDot = builder.visit(list(sym("."), sym("items"), sym("push"), num(1)));
        List<TargetNode> viaPrefix = builder.visit(list(sym(".push"), sym("items"), num(1)));

        assertEquals(viaPrefix, viaDot);
    }

    @Test
    void dotFormReadsField() {
        List<TargetNode> result = builder.visit(list(sym("."), sym("point"), sym("-x")));

        assertEquals(List.of(new PropertyAccess(List.of(s("point")), s(".-x"))), result);
    }

    @Test
    void dotFormFieldTakesNoArguments() {
        assertThrows(UnsupportedArityException.class,
                () -> builder.visit(list(sym("."), sym("point"), sym("-x"), num(1))));
    }

    @Test
    void dotFormRequiresSymbolMember() {
        assertThrows(MalformedSpecialFormException.class,
                () -> builder.visit(list(sym("."), sym("point"), str("x"))));
        assertThrows(MalformedSpecialFormException.class, () -> builder.visit(list(sym("."), sym("point"))));
        assertThrows(MalformedSpecialFormException.class,
                () -> builder.visit(list(sym("."), sym("point"), sym("-"))));
    }
}
