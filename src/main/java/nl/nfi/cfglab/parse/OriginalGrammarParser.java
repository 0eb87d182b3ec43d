package nl.nfi.cfglab.parse;

import nl.nfi.cfglab.derive.Derivation;
import nl.nfi.cfglab.grammar.Grammar;
import nl.nfi.cfglab.transform.ChomskyNormalForm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

import static nl.nfi.cfglab.grammar.Symbols.format;

// parses with CYK on the normal form, but answers in terms of the productions of the grammar as written
public final class OriginalGrammarParser {

    private static final Logger LOG = LoggerFactory.getLogger(OriginalGrammarParser.class);

    private final Grammar grammar;
    private final CykParser cnfParser;

    private OriginalGrammarParser(final Grammar grammar, final CykParser cnfParser) {
        this.grammar = grammar;
        this.cnfParser = cnfParser;
    }

    public static OriginalGrammarParser forGrammar(final Grammar grammar) {
        // without the final cleanup, so the original nonterminals keep their place in the table
        final Grammar cnf = ChomskyNormalForm.steps(grammar);
        return new OriginalGrammarParser(grammar, CykParser.forGrammar(cnf));
    }

    public Grammar grammar() {
        return grammar;
    }

    public Grammar cnf() {
        return cnfParser.grammar();
    }

    public SpanDerivability derivability(final List<String> input) {
        return SpanDerivability.forTable(grammar, cnfParser.parse(input));
    }

    // production indices (into the original grammar) of a leftmost derivation of the input
    public Optional<List<Integer>> parse(final List<String> input) {
        final Optional<List<Integer>> productions = derivability(input).leftmostProductions();
        LOG.debug("Input \"{}\" {}", format(input), productions.isPresent() ? "derived" : "not derivable");
        return productions;
    }

    public Optional<Derivation> derivation(final List<String> input) {
        return parse(input).map(productions -> Derivation.of(grammar).leftmost(productions));
    }
}
