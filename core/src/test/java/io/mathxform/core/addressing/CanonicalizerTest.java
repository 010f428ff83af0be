package io.mathxform.core.addressing;

import static org.assertj.core.api.Assertions.assertThat;

import io.mathxform.core.model.Call;
import io.mathxform.core.model.Derivative;
import io.mathxform.core.model.Identifier;
import io.mathxform.core.model.NumberLiteral;
import io.mathxform.core.model.Power;
import io.mathxform.core.model.Product;
import io.mathxform.core.model.Sum;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Canonicalizer: canonical node strings")
class CanonicalizerTest {

    private static final Identifier X = new Identifier("x");
    private static final NumberLiteral TWO = new NumberLiteral("2");

    @Test
    @DisplayName("Leaves")
    void leaves() {
        assertThat(Canonicalizer.canonicalize(X)).isEqualTo("ident:x");
        assertThat(Canonicalizer.canonicalize(new NumberLiteral("1/2"))).isEqualTo("number:1/2");
    }

    @Test
    @DisplayName("Sums and powers keep operand order")
    void sumAndPower() {
        Sum sum = new Sum(List.of(new Power(X, TWO), new NumberLiteral("1")));
        assertThat(Canonicalizer.canonicalize(sum)).isEqualTo("add(power(ident:x,number:2),number:1)");
    }

    @Test
    @DisplayName("Products are calls to times over an add list")
    void product() {
        assertThat(Canonicalizer.canonicalize(new Product(List.of(TWO, X))))
                .isEqualTo("call:times(add(number:2,ident:x))");
    }

    @Test
    @DisplayName("Calls and derivatives")
    void callAndDerivative() {
        assertThat(Canonicalizer.canonicalize(new Call("sin", X))).isEqualTo("call:sin(ident:x)");
        assertThat(Canonicalizer.canonicalize(new Derivative(X, new Power(X, TWO))))
                .isEqualTo("diff(ident:x,power(ident:x,number:2))");
    }

    @Test
    @DisplayName("Term order matters")
    void orderSensitive() {
        assertThat(Canonicalizer.canonicalize(new Sum(List.of(X, TWO))))
                .isNotEqualTo(Canonicalizer.canonicalize(new Sum(List.of(TWO, X))));
    }
}
