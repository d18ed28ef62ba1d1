package org.pragmatica.symbolic.simplify;

import org.junit.jupiter.api.Test;
import org.pragmatica.symbolic.Symbolic;
import org.pragmatica.symbolic.error.ExpressionError;
import org.pragmatica.symbolic.error.ExpressionException;
import org.pragmatica.symbolic.parser.ParserConfig;
import org.pragmatica.symbolic.tree.Node;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SimplifierTest {

    private static String simplify(String text) {
        return Symbolic.parse(text).simplify().toString();
    }

    // === Constant folding ===

    @Test
    void numericSubtree_foldsToNumber() {
        assertThat(Symbolic.parse("2+3*4").simplify()).isEqualTo(Node.Number.of(14));
        assertThat(simplify("x + 2*3")).isEqualTo("x + 6");
        assertThat(simplify("sin(0)")).isEqualTo("0");
        assertThat(simplify("0^0")).isEqualTo("1");
    }

    @Test
    void constantsByName_areNotFolded() {
        assertThat(simplify("2*Pi")).isEqualTo("2*Pi");
    }

    @Test
    void nonFiniteResult_keepsNodeSymbolic() {
        assertThat(simplify("1/0")).isEqualTo("1/0");
        assertThat(simplify("0/0")).isEqualTo("0/0");
        assertThat(simplify("ln(0)")).isEqualTo("ln(0)");
    }

    // === Identities ===

    @Test
    void addition_dropsZero() {
        assertThat(simplify("x+0")).isEqualTo("x");
        assertThat(simplify("0+x")).isEqualTo("x");
    }

    @Test
    void subtraction_dropsZero() {
        assertThat(simplify("x-0")).isEqualTo("x");
        assertThat(simplify("0-x")).isEqualTo("-x");
        assertThat(simplify("0 - -x")).isEqualTo("x");
    }

    @Test
    void multiplication_absorbsZeroAndDropsOne() {
        assertThat(simplify("x*0")).isEqualTo("0");
        assertThat(simplify("0*sin(x)")).isEqualTo("0");
        assertThat(simplify("x*1")).isEqualTo("x");
        assertThat(simplify("1*x")).isEqualTo("x");
    }

    @Test
    void division_identities() {
        assertThat(simplify("0/x")).isEqualTo("0");
        assertThat(simplify("x/1")).isEqualTo("x");
        assertThat(simplify("x/x")).isEqualTo("1");
        assertThat(simplify("(x+1)/(x+1)")).isEqualTo("1");
        assertThat(simplify("(x+1)/(1+x)")).isEqualTo("(x + 1)/(1 + x)");
    }

    @Test
    void power_identities() {
        assertThat(simplify("0^x")).isEqualTo("0");
        assertThat(simplify("x^0")).isEqualTo("1");
        assertThat(simplify("1^x")).isEqualTo("1");
        assertThat(simplify("x^1")).isEqualTo("x");
    }

    @Test
    void logarithm_identities() {
        assertThat(simplify("ln(1)")).isEqualTo("0");
        assertThat(simplify("ln(E)")).isEqualTo("1");
    }

    @Test
    void negation_identities() {
        assertThat(simplify("--x")).isEqualTo("x");
        assertThat(simplify("-0")).isEqualTo("0");
        assertThat(simplify("-(0*x)")).isEqualTo("0");
    }

    @Test
    void childrenAreSimplifiedFirst() {
        assertThat(simplify("sin(x*1)")).isEqualTo("sin(x)");
        assertThat(simplify("(x+0)*(1*y)")).isEqualTo("x*y");
        assertThat(simplify("x^(2-1)")).isEqualTo("x");
    }

    @Test
    void unmatchedFunction_keepsItsShape() {
        assertThat(simplify("abs(x)")).isEqualTo("abs(x)");
    }

    // === Properties ===

    @Test
    void simplify_isIdempotent() {
        var sources = List.of("x*1 + 0",
                              "0 - (0 - x)",
                              "--(-x)",
                              "(x/x)^y",
                              "ln(E^1)",
                              "0 - 1/0",
                              "sin(x)*0 + cos(0)*x",
                              "2^x*ln(2)",
                              "(x - 0)/(1*x)");
        for (var source : sources) {
            var once = Symbolic.parse(source).simplify();
            assertThat(once.simplify()).as("simplify twice: %s", source).isEqualTo(once);
        }
    }

    @Test
    void deepTree_isRejected() {
        var simplifier = Simplifier.create(ParserConfig.DEFAULT.withMaxTreeDepth(2));

        assertThatThrownBy(() -> simplifier.simplify(Symbolic.parse("1+(2+3)")))
            .isInstanceOf(ExpressionException.class)
            .extracting(e -> ((ExpressionException) e).error())
            .isEqualTo(new ExpressionError.NestingTooDeep(2));
    }
}
