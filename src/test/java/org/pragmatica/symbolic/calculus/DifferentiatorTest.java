package org.pragmatica.symbolic.calculus;

import org.junit.jupiter.api.Test;
import org.pragmatica.symbolic.Symbolic;
import org.pragmatica.symbolic.tree.Bindings;
import org.pragmatica.symbolic.tree.Node;
import org.pragmatica.symbolic.tree.Operator;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DifferentiatorTest {

    private static String ddx(String text) {
        return Symbolic.parse(text).derivative("x").toString();
    }

    // === Leaves ===

    @Test
    void leaves_differentiateToConstants() {
        assertEquals("0", ddx("3"));
        assertEquals("1", ddx("x"));
        assertEquals("0", ddx("y"));
        assertEquals("0", ddx("Pi"));
    }

    // === Arithmetic rules ===

    @Test
    void sumAndDifference_distribute() {
        assertEquals("2*x + 3", ddx("x^2 + 3x"));
        assertEquals("1 - 2*x", ddx("x - x^2"));
    }

    @Test
    void productRule() {
        assertEquals("3", ddx("3x"));
        assertEquals("y", ddx("x*y"));
        assertEquals("cos(x)*x + sin(x)", ddx("sin(x)*x"));
    }

    @Test
    void quotientRule() {
        assertEquals("y/y^2", ddx("x/y"));
        assertEquals("-1/x^2", ddx("1/x"));
    }

    @Test
    void powerRule_withConstantExponent() {
        assertEquals("2*x", ddx("x^2"));
        assertEquals("3*x^2", ddx("x^3"));
        assertEquals("(y + 1)*x^(y + 1 - 1)", ddx("x^(y+1)"));
    }

    @Test
    void powerRule_withConstantBase() {
        assertEquals("E^x", ddx("E^x"));
        assertEquals(2 * Math.log(2), Symbolic.parse("2^x").derivative("x").evaluate(Bindings.of("x", 1)), 1e-12);
    }

    @Test
    void powerRule_general() {
        assertEquals("x^x*(ln(x) + 1)", ddx("x^x"));
    }

    @Test
    void negation_negatesDerivative() {
        assertEquals("-1", ddx("-x"));
        assertEquals("-cos(x)", ddx("-sin(x)"));
    }

    // === Function rules ===

    @Test
    void trigonometricRules() {
        assertEquals("cos(x)", ddx("sin(x)"));
        assertEquals("-sin(x)", ddx("cos(x)"));
        assertEquals("sec(x)^2", ddx("tan(x)"));
        assertEquals("sec(x)*tan(x)", ddx("sec(x)"));
        assertEquals("-csc(x)^2", ddx("cot(x)"));
        assertEquals("-csc(x)*cot(x)", ddx("csc(x)"));
    }

    @Test
    void otherFunctionRules() {
        assertEquals("1/x", ddx("ln(x)"));
        assertEquals("1/(2*sqrt(x))", ddx("sqrt(x)"));
        assertEquals("sign(x)", ddx("abs(x)"));
        assertEquals("0", ddx("sign(x)"));
        assertEquals("1/sqrt(1 - x^2)", ddx("arcsin(x)"));
    }

    @Test
    void chainRule_multipliesInnerDerivative() {
        assertEquals("cos(2*x)*2", ddx("sin(2x)"));
        assertEquals("2*x/x^2", ddx("ln(x^2)"));
    }

    // === Properties ===

    @Test
    void otherVariable_isTreatedAsConstant() {
        assertEquals("x", Symbolic.parse("x*y").derivative("y").toString());
        assertEquals("0", Symbolic.parse("sin(x)").derivative("y").toString());
    }

    @Test
    void derivative_isLinear() {
        var pairs = List.of(List.of("x^2", "sin(x)"),
                            List.of("x*y", "ln(x)"),
                            List.of("3", "x^x"),
                            List.of("-x", "x/y"));
        for (var pair : pairs) {
            var f = Symbolic.parse(pair.get(0));
            var g = Symbolic.parse(pair.get(1));

            var ofSum = Node.Operation.of(Operator.ADD, f, g).derivative("x");
            var sumOf = Node.Operation.of(Operator.ADD, f.derivative("x"), g.derivative("x")).simplify();

            assertEquals(sumOf, ofSum, () -> "linearity for " + pair);
        }
    }

    @Test
    void derivative_matchesFiniteDifference() {
        var sources = List.of("x^3 - 2x", "sin(x)cos(x)", "sqrt(x)/x", "x^x", "tan(x)", "arcsin(x/2)", "abs(x)ln(x)");
        var at = 0.7;
        var h = 1e-6;
        for (var source : sources) {
            var tree = Symbolic.parse(source);
            var numeric = (tree.evaluate(Bindings.of("x", at + h)) - tree.evaluate(Bindings.of("x", at - h))) / (2 * h);

            assertEquals(numeric, tree.derivative("x").evaluate(Bindings.of("x", at)), 1e-5, source);
        }
    }
}
