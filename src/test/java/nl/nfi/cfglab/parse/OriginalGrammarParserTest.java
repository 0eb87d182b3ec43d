package nl.nfi.cfglab.parse;

import nl.nfi.cfglab.derive.Derivation;
import nl.nfi.cfglab.grammar.Grammar;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Optional;

import static nl.nfi.cfglab.grammar.Symbols.word;
import static org.assertj.core.api.Assertions.assertThat;

class OriginalGrammarParserTest {

    private static final Grammar NUMBERS = Grammar.fromString("""
        Number -> Integer | Real
        Integer -> Digit | Integer Digit
        Real -> Integer Fraction Scale
        Fraction -> . Integer
        Scale -> e Sign Integer | Empty
        Digit -> 0 | 1 | 2 | 3 | 4 | 5 | 6 | 7 | 8 | 9
        Empty -> ε
        Sign -> + | -
        """);

    @Test
    void derivationOfScientificNumber() {
        final OriginalGrammarParser parser = OriginalGrammarParser.forGrammar(NUMBERS);

        final Optional<Derivation> derivation = parser.derivation(word("3 2 . 5 e + 1"));

        assertThat(derivation).isPresent();
        assertThat(derivation.get().sententialForm()).isEqualTo(word("3 2 . 5 e + 1"));
        assertThat(derivation.get().toString()).startsWith("Number -> Real -> Integer Fraction Scale -> Integer Digit Fraction Scale");
    }

    @Test
    void derivationThroughNullableNonterminal() {
        final OriginalGrammarParser parser = OriginalGrammarParser.forGrammar(NUMBERS);

        final Derivation derivation = parser.derivation(word("4 . 2")).orElseThrow();

        assertThat(derivation).hasToString(String.join(" -> ",
            "Number",
            "Real",
            "Integer Fraction Scale",
            "Digit Fraction Scale",
            "4 Fraction Scale",
            "4 . Integer Scale",
            "4 . Digit Scale",
            "4 . 2 Scale",
            "4 . 2 Empty",
            "4 . 2"));
    }

    @ParameterizedTest(name = "\"{0}\" derivable: {1}")
    @CsvSource({
        "4 2,true",
        "7,true",
        "1 . 0 e - 1 2,true",
        "1 .,false",
        ". 5,false",
        "1 e + 1,false",
    })
    void recognizesNumbers(final String input, final boolean derivable) {
        final Optional<List<Integer>> productions = OriginalGrammarParser.forGrammar(NUMBERS).parse(word(input));

        assertThat(productions.isPresent()).isEqualTo(derivable);
        productions.ifPresent(indices -> assertThat(Derivation.of(NUMBERS).leftmost(indices).sententialForm()).isEqualTo(word(input)));
    }

    @Test
    void normalFormKeepsOriginalNonterminals() {
        final OriginalGrammarParser parser = OriginalGrammarParser.forGrammar(NUMBERS);

        assertThat(parser.cnf().nonterminals()).containsAll(NUMBERS.nonterminals());
        assertThat(parser.grammar()).isSameAs(NUMBERS);
    }
}
