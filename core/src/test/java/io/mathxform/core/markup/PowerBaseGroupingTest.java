package io.mathxform.core.markup;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("PowerBaseGrouping: fences sum bases of powers")
class PowerBaseGroupingTest {

    private final PowerBaseGrouping grouping = new PowerBaseGrouping();

    private static String document(String body) {
        return MathMl.presentationRoot(body);
    }

    @Test
    @DisplayName("A sum base gets parentheses")
    void fencesSum() {
        String result = grouping.apply(document("<msup><mrow><mi>x</mi><mo>+</mo><mn>3</mn></mrow><mn>2</mn></msup>"));

        assertThat(result)
                .contains("<msup><mrow><mo>(</mo><mrow><mi>x</mi><mo>+</mo><mn>3</mn></mrow><mo>)</mo></mrow>"
                        + "<mn>2</mn></msup>")
                .contains("display=\"block\"")
                .startsWith("<math");
    }

    @Test
    @DisplayName("The Unicode minus sign counts as an additive operator")
    void unicodeMinus() {
        String result = grouping.apply(document("<msup><mrow><mi>a</mi><mo>−</mo><mi>b</mi></mrow><mi>n</mi></msup>"));

        assertThat(result).contains("<msup><mrow><mo>(</mo><mrow><mi>a</mi><mo>−</mo>");
    }

    @Test
    @DisplayName("Already parenthesized bases are left alone")
    void alreadyFenced() {
        String body = "<msup><mrow><mo>(</mo><mi>x</mi><mo>+</mo><mn>1</mn><mo>)</mo></mrow><mn>2</mn></msup>";

        assertThat(grouping.apply(document(body))).contains(body);
    }

    @Test
    @DisplayName("Bases without a top-level sum are left alone")
    void notASum() {
        String identifier = "<msup><mi>x</mi><mn>2</mn></msup>";
        String product = "<msup><mrow><mi>a</mi><mi>b</mi></mrow><mn>2</mn></msup>";

        assertThat(grouping.apply(document(identifier))).contains(identifier);
        assertThat(grouping.apply(document(product))).contains(product);
    }

    @Test
    @DisplayName("Nested powers are all visited")
    void nested() {
        String inner = "<msup><mrow><mi>y</mi><mo>+</mo><mn>1</mn></mrow><mn>3</mn></msup>";
        String result = grouping.apply(document("<mrow>" + inner + "<mo>+</mo>" + inner + "</mrow>"));

        assertThat(result.split("<mo>\\(</mo>", -1)).hasSize(3);
    }

    @Test
    @DisplayName("Malformed markup is rejected")
    void malformed() {
        assertThatThrownBy(() -> grouping.apply("<math><msup>")).isInstanceOf(IllegalArgumentException.class);
    }
}
