package io.mathxform.core.markup;

import static org.assertj.core.api.Assertions.assertThat;

import io.mathxform.core.algebra.Add;
import io.mathxform.core.algebra.Fn;
import io.mathxform.core.algebra.Mul;
import io.mathxform.core.algebra.Num;
import io.mathxform.core.algebra.Pow;
import io.mathxform.core.algebra.Sym;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("FallbackMarkupPrinter")
class FallbackMarkupPrinterTest {

    private static final Sym X = new Sym("x");
    private static final Sym Z = new Sym("z");

    private final FallbackMarkupPrinter printer = new FallbackMarkupPrinter();

    @Test
    @DisplayName("Content covers sums and products")
    void contentSumAndProduct() {
        assertThat(printer.content(Add.of(X, Mul.of(Num.TWO, new Sym("y")))))
                .isEqualTo(MathMl.contentRoot(
                        "<apply><plus/><ci>x</ci><apply><times/><cn>2</cn><ci>y</ci></apply></apply>"));
    }

    @Test
    @DisplayName("Conjugate uses a ci head in content")
    void contentConjugate() {
        assertThat(printer.content(new Fn("conjugate", Z)))
                .isEqualTo(MathMl.contentRoot("<apply><ci>conjugate</ci><ci>z</ci></apply>"));
    }

    @Test
    @DisplayName("Uncovered constructs fall back to plain text")
    void plainText() {
        assertThat(printer.content(Num.of(1, 2))).isEqualTo(MathMl.contentRoot("<ci>1/2</ci>"));
        assertThat(printer.presentation(new Fn("tan", X))).isEqualTo(MathMl.presentationRoot("<mtext>tan(x)</mtext>"));
    }

    @Test
    @DisplayName("Sum bases are fenced")
    void fencesSumBase() {
        assertThat(printer.presentation(new Pow(Add.of(X, Num.ONE), Num.TWO)))
                .isEqualTo(MathMl.presentationRoot("<msup><mrow><mo>(</mo><mrow><mi>x</mi><mo>+</mo><mn>1</mn></mrow>"
                        + "<mo>)</mo></mrow><mn>2</mn></msup>"));
    }

    @Test
    @DisplayName("Presentation shows conjugate as conj(...) and abs with bars")
    void presentationFunctions() {
        assertThat(printer.presentation(new Fn("conjugate", Z)))
                .isEqualTo(MathMl.presentationRoot("<mrow><mi>conj</mi><mo>(</mo><mi>z</mi><mo>)</mo></mrow>"));
        assertThat(printer.presentation(new Fn("abs", Z)))
                .isEqualTo(MathMl.presentationRoot("<mrow><mo>|</mo><mi>z</mi><mo>|</mo></mrow>"));
    }
}
