package nl.nfi.cfglab.transform;

import nl.nfi.cfglab.grammar.Grammar;
import nl.nfi.cfglab.grammar.Production;
import nl.nfi.cfglab.parse.CykParser;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static nl.nfi.cfglab.grammar.Symbols.word;
import static nl.nfi.cfglab.transform.ChomskyNormalForm.binarize;
import static nl.nfi.cfglab.transform.ChomskyNormalForm.checkCnf;
import static nl.nfi.cfglab.transform.ChomskyNormalForm.checkCykCompatible;
import static nl.nfi.cfglab.transform.ChomskyNormalForm.eliminateEpsilonRules;
import static nl.nfi.cfglab.transform.ChomskyNormalForm.eliminateNonSolitaryTerminals;
import static nl.nfi.cfglab.transform.ChomskyNormalForm.eliminateUnitRules;
import static nl.nfi.cfglab.transform.ChomskyNormalForm.isInCnf;
import static nl.nfi.cfglab.transform.ChomskyNormalForm.steps;
import static nl.nfi.cfglab.transform.ChomskyNormalForm.transform;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChomskyNormalFormTest {

    private static final String AMBIGUOUS_EXPRESSIONS = "E -> E + E | E * E | i";

    private static final String NUMBERS = """
        Number -> Integer | Real
        Integer -> Digit | Integer Digit
        Real -> Integer Fraction Scale
        Fraction -> . Integer
        Scale -> e Sign Integer | Empty
        Digit -> 0 | 1 | 2 | 3 | 4 | 5 | 6 | 7 | 8 | 9
        Empty -> ε
        Sign -> + | -
        """;

    @Nested
    class EpsilonRules {

        @Test
        void occurrencesAreDroppedOrPrimed() {
            final Grammar grammar = Grammar.fromString("S -> A b\nA -> a | ε");

            assertThat(eliminateEpsilonRules(grammar).productions()).containsExactly(
                Production.of("S", "b"),
                Production.of("S", "A′", "b"),
                Production.of("A", "a"),
                Production.of("A"),
                Production.of("A′", "a")
            );
        }

        @Test
        void everyOccurrenceIsRewritten() {
            final Grammar grammar = Grammar.fromString("S -> A A\nA -> a | ε");

            assertThat(eliminateEpsilonRules(grammar).alternatives("S")).containsExactly(
                List.of("ε"),
                List.of("A′"),
                List.of("A′", "A′")
            );
        }

        @Test
        void cleanedResultOfNullableOnlyContext() {
            final Grammar grammar = Grammar.fromString("""
                S -> L a M
                L -> L M | ε
                M -> M M | ε
                """);

            assertThat(transform(grammar)).isEqualTo(Grammar.fromString("S -> a"));
        }
    }

    @Nested
    class UnitRules {

        @Test
        void cyclicChainsTerminate() {
            final Grammar grammar = Grammar.fromString("""
                S -> A | B
                A -> B | a
                B -> A | b
                """);

            final Grammar result = eliminateUnitRules(grammar);

            assertThat(result.alternatives("S")).containsExactlyInAnyOrder(List.of("a"), List.of("b"));
            assertThat(result.alternatives("A")).containsExactlyInAnyOrder(List.of("a"), List.of("b"));
            assertThat(result.alternatives("B")).containsExactlyInAnyOrder(List.of("a"), List.of("b"));
        }

        @Test
        void replacementTakesPlaceOfUnitRule() {
            final Grammar grammar = Grammar.fromString("""
                S -> a S | T | b
                T -> c d | e
                """);

            assertThat(eliminateUnitRules(grammar).productions()).containsExactly(
                Production.of("S", "a", "S"),
                Production.of("S", "c", "d"),
                Production.of("S", "e"),
                Production.of("S", "b"),
                Production.of("T", "c", "d"),
                Production.of("T", "e")
            );
        }
    }

    @Test
    void terminalsInLongRhsGetCarriers() {
        final Grammar grammar = Grammar.fromString("S -> ( S ) | i | S + i");

        final Grammar result = eliminateNonSolitaryTerminals(grammar);

        assertThat(result.productions()).containsExactly(
            Production.of("S", "N(", "S", "N)"),
            Production.of("S", "i"),
            Production.of("S", "S", "N+", "Ni"),
            Production.of("N(", "("),
            Production.of("N)", ")"),
            Production.of("N+", "+"),
            Production.of("Ni", "i")
        );
        assertThat(result.nonterminals()).containsExactly("N(", "N)", "N+", "Ni", "S");
    }

    @Test
    void longRhsBecomesChain() {
        final Grammar grammar = Grammar.fromString("A -> a b c d | x y z | u v");

        assertThat(binarize(grammar).productions()).containsExactly(
            Production.of("A1", "a", "b"),
            Production.of("A2", "A1", "c"),
            Production.of("A", "A2", "d"),
            Production.of("A3", "x", "y"),
            Production.of("A", "A3", "z"),
            Production.of("A", "u", "v")
        );
    }

    @Test
    void ambiguousExpressions() {
        assertThat(transform(Grammar.fromString(AMBIGUOUS_EXPRESSIONS)).productions()).containsExactly(
            Production.of("E1", "E", "N+"),
            Production.of("E", "E1", "E"),
            Production.of("E2", "E", "N*"),
            Production.of("E", "E2", "E"),
            Production.of("E", "i"),
            Production.of("N+", "+"),
            Production.of("N*", "*")
        );
    }

    @ParameterizedTest
    @ValueSource(strings = {
        AMBIGUOUS_EXPRESSIONS,
        NUMBERS,
        "S -> a S b | ε",
        "S -> A | B\nA -> B | a\nB -> A | b",
        "S -> A B C\nA -> a | ε\nB -> b | ε\nC -> c | ε",
        "E -> E + T | T\nT -> T * F | F\nF -> ( E ) | i",
    })
    void resultIsInCnf(final String text) {
        final Grammar normalForm = transform(Grammar.fromString(text));

        assertThat(isInCnf(normalForm)).isTrue();
        checkCnf(normalForm);
    }

    @Test
    void isDeterministic() {
        final Grammar grammar = Grammar.fromString(NUMBERS);

        assertThat(transform(grammar).productions()).isEqualTo(transform(grammar).productions());
    }

    @Test
    void stepsKeepOriginalNonterminals() {
        final Grammar grammar = Grammar.fromString(NUMBERS);

        final Grammar withoutCleanup = steps(grammar);

        assertThat(withoutCleanup.nonterminals()).containsAll(grammar.nonterminals());
        assertThat(withoutCleanup.productions()).contains(Production.of("Empty"));
        assertThat(isInCnf(withoutCleanup)).isFalse();
        checkCykCompatible(withoutCleanup);
    }

    @ParameterizedTest(name = "\"{0}\" in a^n b^n: {1}")
    @CsvSource({
        "a b,true",
        "a a b b,true",
        "'',true",
        "a b b,false",
        "b a,false",
    })
    void preservesLanguage(final String input, final boolean member) {
        final Grammar normalForm = transform(Grammar.fromString("S -> a S b | ε"));

        assertThat(CykParser.forGrammar(normalForm).recognizes(word(input))).isEqualTo(member);
    }

    @Test
    void checksReportOffendingProductions() {
        final Grammar grammar = Grammar.fromString("S -> A b | a\nA -> a | ε");

        assertThat(isInCnf(grammar)).isFalse();
        assertThatThrownBy(() -> checkCnf(grammar))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("The grammar is not in Chomsky normal form, offending productions: (S -> A b, A -> ε)");
        assertThatThrownBy(() -> checkCykCompatible(grammar))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("The grammar is not suitable for CYK parsing, offending productions: (S -> A b)");
    }

    @Test
    void rejectsGrammarThatIsNotContextFree() {
        final Grammar grammar = Grammar.fromString("S -> a S Q | a b c\nb Q c -> b b c c\nc Q -> Q c", false);

        assertThatThrownBy(() -> transform(grammar))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
