package nl.nfi.cfglab.grammar;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProductionsTest {

    @Test
    void readsAlternativesInOrder() {
        final List<Production> productions = Productions.fromString("""
            S -> ( S ) | x T y

            T -> ε
            """);

        assertThat(productions).containsExactly(
            Production.of("S", "(", "S", ")"),
            Production.of("S", "x", "T", "y"),
            Production.of("T")
        );
    }

    @Test
    void readsMultipleSymbolLhsWhenNotContextFree() {
        final List<Production> productions = Productions.fromString("x T y -> t", false);

        assertThat(productions).containsExactly(new Production(List.of("x", "T", "y"), List.of("t")));
    }

    @ParameterizedTest(name = "\"{0}\" fails with: {1}")
    @CsvSource(delimiter = ';', quoteCharacter = '"', value = {
        "S -> a -> b;       expected exactly one '->'",
        "S a;               expected exactly one '->'",
        " -> a;             the lefthand side is empty",
        "S T -> a;          more than one symbol as lefthand side",
        "S -> a | ;         empty alternative",
        "S -> a ε;          contains ε but has more than one symbol",
    })
    void rejectsMalformedLine(final String line, final String reason) {
        assertThatThrownBy(() -> Productions.fromString("A -> a\n" + line))
            .hasMessageStartingWith("Line 2 ")
            .hasMessageContaining(reason)
            .isInstanceOfSatisfying(GrammarParseException.class, e -> assertThat(e.lineNumber()).isEqualTo(2));
    }
}
