package io.mathxform.core.markup;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.mathxform.core.error.MarkupParseException;
import io.mathxform.core.error.UnsupportedOperatorException;
import io.mathxform.core.model.Call;
import io.mathxform.core.model.Derivative;
import io.mathxform.core.model.Identifier;
import io.mathxform.core.model.NumberLiteral;
import io.mathxform.core.model.Power;
import io.mathxform.core.model.Product;
import io.mathxform.core.model.Sum;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("MathMarkupParser: Content MathML to expression tree")
class MathMarkupParserTest {

    private static final String MATH = "<math xmlns=\"http://www.w3.org/1998/Math/MathML\">";
    private static final Identifier X = new Identifier("x");

    private final MathMarkupParser parser = new MathMarkupParser();

    @Nested
    @DisplayName("Leaves")
    class Leaves {

        @Test
        @DisplayName("Empty ci defaults to x and empty cn to 0")
        void emptyLeaves() {
            assertThat(parser.parse("<ci/>")).isEqualTo(X);
            assertThat(parser.parse("<cn></cn>")).isEqualTo(new NumberLiteral("0"));
        }

        @Test
        @DisplayName("Rational numbers join their parts with a slash")
        void rational() {
            assertThat(parser.parse("<cn type=\"rational\">1<sep/>2</cn>")).isEqualTo(new NumberLiteral("1/2"));
        }

        @Test
        @DisplayName("imaginaryi is the identifier i")
        void imaginary() {
            assertThat(parser.parse("<imaginaryi/>")).isEqualTo(new Identifier("i"));
        }
    }

    @Nested
    @DisplayName("apply")
    class Apply {

        @Test
        @DisplayName("A full math document starts at its first child")
        void mathRoot() {
            assertThat(parser.parse(MATH + "<apply><plus/><ci>x</ci><cn>1</cn></apply></math>"))
                    .isEqualTo(new Sum(List.of(X, new NumberLiteral("1"))));
        }

        @Test
        @DisplayName("times becomes a Product and power keeps its two operands")
        void timesAndPower() {
            assertThat(parser.parse("<apply><times/><cn>2</cn><apply><power/><ci>x</ci><cn>2</cn></apply></apply>"))
                    .isEqualTo(new Product(List.of(new NumberLiteral("2"), new Power(X, new NumberLiteral("2")))));
        }

        @Test
        @DisplayName("plus and times without operands are their identities")
        void emptySumAndProduct() {
            assertThat(parser.parse("<apply><plus/></apply>")).isEqualTo(new NumberLiteral("0"));
            assertThat(parser.parse("<apply><times/></apply>")).isEqualTo(new NumberLiteral("1"));
            assertThat(parser.parse("<apply><power/><apply><plus/></apply><cn>2</cn></apply>"))
                    .isEqualTo(new Power(new NumberLiteral("0"), new NumberLiteral("2")));
        }

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({"sin, sin", "ln, log", "log, log", "conj, conjugate", "conjugate, conjugate", "abs, abs",
            "absolutevalue, abs", "sec, sec"})
        @DisplayName("Unary heads map to canonical function names")
        void unaryHeads(String head, String function) {
            assertThat(parser.parse("<apply><" + head + "/><ci>x</ci></apply>")).isEqualTo(new Call(function, X));
        }

        @Test
        @DisplayName("A ci head with one argument is a call to that function")
        void namedFunction() {
            assertThat(parser.parse("<apply><ci>f</ci><ci>x</ci></apply>")).isEqualTo(new Call("f", X));
        }

        @Test
        @DisplayName("diff takes the identifier operand as its variable")
        void derivative() {
            Power body = new Power(X, new NumberLiteral("2"));
            assertThat(parser.parse("<apply><diff/><bvar><ci>x</ci></bvar><apply><power/><ci>x</ci><cn>2</cn></apply></apply>"))
                    .isEqualTo(new Derivative(X, body));
            assertThat(parser.parse("<apply><diff/><apply><power/><ci>x</ci><cn>2</cn></apply><ci>x</ci></apply>"))
                    .isEqualTo(new Derivative(X, body));
        }
    }

    @Test
    @DisplayName("HTML-escaped payloads are unescaped first")
    void escapedPayload() {
        assertThat(parser.parse("&lt;apply&gt;&lt;sin/&gt;&lt;ci&gt;x&lt;/ci&gt;&lt;/apply&gt;"))
                .isEqualTo(new Call("sin", X));
    }

    @Test
    @DisplayName("A fragment with several roots is retried inside a math element")
    void severalRoots() {
        assertThat(parser.parse("<ci>a</ci><ci>b</ci>")).isEqualTo(new Identifier("a"));
    }

    @Test
    @DisplayName("Unknown wrappers with one child are unwrapped")
    void unwrapsSingleChild() {
        assertThat(parser.parse("<semantics><apply><cos/><ci>x</ci></apply></semantics>"))
                .isEqualTo(new Call("cos", X));
    }

    @Nested
    @DisplayName("Errors")
    class Errors {

        @Test
        @DisplayName("Unknown operator names the operator")
        void unknownOperator() {
            assertThatThrownBy(() -> parser.parse("<apply><gcd/><ci>a</ci><ci>b</ci></apply>"))
                    .isInstanceOfSatisfying(UnsupportedOperatorException.class,
                            e -> assertThat(e.operator()).isEqualTo("gcd"));
        }

        @Test
        @DisplayName("A ci head with several arguments is unsupported")
        void multiArgumentFunction() {
            assertThatThrownBy(() -> parser.parse("<apply><ci>f</ci><ci>x</ci><ci>y</ci></apply>"))
                    .isInstanceOfSatisfying(UnsupportedOperatorException.class,
                            e -> assertThat(e.operator()).isEqualTo("f"));
        }

        @Test
        @DisplayName("Unknown tag with several children is unsupported")
        void unknownTag() {
            assertThatThrownBy(() -> parser.parse("<foo><ci>a</ci><ci>b</ci></foo>"))
                    .isInstanceOfSatisfying(UnsupportedOperatorException.class,
                            e -> assertThat(e.operator()).isEqualTo("foo"));
        }

        @Test
        @DisplayName("power with one operand is unsupported")
        void powerArity() {
            assertThatThrownBy(() -> parser.parse("<apply><power/><ci>x</ci></apply>"))
                    .isInstanceOf(UnsupportedOperatorException.class);
        }

        @Test
        @DisplayName("Empty apply is a parse error")
        void emptyApply() {
            assertThatThrownBy(() -> parser.parse("<apply/>")).isExactlyInstanceOf(MarkupParseException.class);
        }

        @Test
        @DisplayName("Malformed XML is a parse error")
        void malformed() {
            assertThatThrownBy(() -> parser.parse("<apply><plus/>")).isExactlyInstanceOf(MarkupParseException.class);
        }

        @Test
        @DisplayName("Blank input is a parse error")
        void blank() {
            assertThatThrownBy(() -> parser.parse("  ")).isExactlyInstanceOf(MarkupParseException.class);
            assertThatThrownBy(() -> parser.parse(null)).isExactlyInstanceOf(MarkupParseException.class);
        }

        @Test
        @DisplayName("DOCTYPE declarations are refused")
        void doctype() {
            assertThatThrownBy(() -> parser.parse("<!DOCTYPE ci [<!ENTITY e \"x\">]><ci>&e;</ci>"))
                    .isInstanceOf(MarkupParseException.class);
        }
    }
}
