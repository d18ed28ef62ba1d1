package org.pragmatica.symbolic.eval;

import org.junit.jupiter.api.Test;
import org.pragmatica.symbolic.Symbolic;
import org.pragmatica.symbolic.error.ExpressionError;
import org.pragmatica.symbolic.error.ExpressionException;
import org.pragmatica.symbolic.parser.ParserConfig;
import org.pragmatica.symbolic.tree.Bindings;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EvaluatorTest {

    private static final double DELTA = 1e-12;

    private static double eval(String text) {
        return Symbolic.parse(text).evaluate();
    }

    private static double eval(String text, double x) {
        return Symbolic.parse(text).evaluate(Bindings.of("x", x));
    }

    // === Arithmetic ===

    @Test
    void arithmetic_followsPrecedence() {
        assertEquals(14, eval("2+3*4"));
        assertEquals(20, eval("(2+3)*4"));
        assertEquals(3, eval("10-4-3"));
        assertEquals(1, eval("8/4/2"));
    }

    @Test
    void power_isRightAssociative() {
        assertEquals(512, eval("2^3^2"));
    }

    @Test
    void negation_appliesAfterPower() {
        assertEquals(-4, eval("-2^2"));
        assertEquals(-6, eval("2*-3"));
        assertEquals(2, eval("--2"));
    }

    @Test
    void implicitMultiplication_usesBindings() {
        assertEquals(10, Symbolic.parse("2x").evaluate(Map.of("x", 5.0)));
        assertEquals(12, eval("(x+1)(x-1)", Math.sqrt(13)), DELTA);
    }

    @Test
    void divisionByZero_followsFloatingPoint() {
        assertEquals(Double.POSITIVE_INFINITY, eval("1/0"));
        assertTrue(Double.isNaN(eval("0/0")));
    }

    // === Functions ===

    @Test
    void trigonometry_usesRadians() {
        assertEquals(0, eval("sin(0)"), DELTA);
        assertEquals(1, eval("cos(0)"), DELTA);
        assertEquals(0, eval("tan(0)"), DELTA);
        assertEquals(1, eval("sin(Pi/2)"), DELTA);
    }

    @Test
    void reciprocalTrigonometry_invertsBaseFunctions() {
        assertEquals(1, eval("sec(0)"), DELTA);
        assertEquals(1, eval("csc(Pi/2)"), DELTA);
        assertEquals(1, eval("cot(Pi/4)"), DELTA);
        assertEquals(2, eval("sec(x)", Math.PI / 3), DELTA);
    }

    @Test
    void transcendental_functions() {
        assertEquals(1, eval("ln(E)"), DELTA);
        assertEquals(4, eval("sqrt(16)"));
        assertEquals(Math.PI / 2, eval("arcsin(1)"), DELTA);
    }

    @Test
    void absAndSign() {
        assertEquals(3, eval("abs(-3)"));
        assertEquals(-1, eval("sign(-2)"));
        assertEquals(0, eval("sign(0)"));
        assertEquals(1, eval("sign(5)"));
    }

    // === Bindings ===

    @Test
    void constants_areAlwaysBound() {
        assertEquals(Math.PI, eval("Pi"));
        assertEquals(Math.E, eval("E"));
    }

    @Test
    void callerBindings_shadowConstants() {
        assertEquals(2, Symbolic.parse("E").evaluate(Bindings.of("E", 2)));
    }

    @Test
    void unboundVariable_fails() {
        var tree = Symbolic.parse("y");

        var exception = assertThrows(ExpressionException.class, tree::evaluate);
        assertEquals(new ExpressionError.UnboundVariable("y"), exception.error());
        assertEquals("Cannot evaluate unbound variable 'y'", exception.getMessage());
    }

    // === Depth limit ===

    @Test
    void deepTree_isRejected() {
        var evaluator = Evaluator.create(ParserConfig.DEFAULT.withMaxTreeDepth(3));
        var tree = Symbolic.parse("1+(2+(3+4))");

        var exception = assertThrows(ExpressionException.class, () -> evaluator.evaluate(tree, Bindings.empty()));
        assertEquals(new ExpressionError.NestingTooDeep(3), exception.error());
        assertEquals(6, evaluator.evaluate(Symbolic.parse("1+2+3"), Bindings.empty()));
    }
}
