package nl.nfi.cfglab.tool;

import nl.nfi.cfglab.derive.Derivation;
import nl.nfi.cfglab.grammar.Grammar;
import nl.nfi.cfglab.grammar.GrammarSource;
import nl.nfi.cfglab.grammar.Production;
import nl.nfi.cfglab.parse.OriginalGrammarParser;
import nl.nfi.cfglab.transform.ChomskyNormalForm;
import nl.nfi.cfglab.transform.NameAllocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static nl.nfi.cfglab.grammar.Symbols.format;
import static nl.nfi.cfglab.transform.Hygiene.removeUnproductiveUnreachable;

// prints a grammar, optionally cleaned up and/or in Chomsky normal form, and the leftmost derivations of inputs
public final class GrammarTool {

    private static final Logger LOG = LoggerFactory.getLogger(GrammarTool.class);

    private final GrammarSource source;
    private final boolean clean;
    private final boolean cnf;
    private final List<List<String>> inputs;

    private GrammarTool(final GrammarSource source, final boolean clean, final boolean cnf, final List<List<String>> inputs) {
        this.source = source;
        this.clean = clean;
        this.cnf = cnf;
        this.inputs = inputs;
    }

    public static GrammarTool forGrammar(final Path grammarPath) throws IOException {
        return forSource(GrammarSource.loadFrom(grammarPath));
    }

    // the sample inputs of the source are parsed unless other inputs are given
    public static GrammarTool forSource(final GrammarSource source) {
        return new GrammarTool(source, false, false, source.inputs());
    }

    public GrammarTool clean(final boolean clean) {
        return new GrammarTool(source, clean, cnf, inputs);
    }

    public GrammarTool cnf(final boolean cnf) {
        return new GrammarTool(source, clean, cnf, inputs);
    }

    public GrammarTool inputs(final List<List<String>> inputs) {
        return new GrammarTool(source, clean, cnf, List.copyOf(inputs));
    }

    public void run(final PrintStream output) {
        Grammar grammar = source.grammar();
        printGrammar("Grammar", grammar, output);

        if (clean) {
            grammar = removeUnproductiveUnreachable(grammar);
            printGrammar("Without unproductive and unreachable symbols", grammar, output);
        }

        if (cnf) {
            final NameAllocator names = NameAllocator.forGrammar(grammar);
            final Grammar normalForm = removeUnproductiveUnreachable(ChomskyNormalForm.steps(grammar, names));
            printGrammar("Chomsky normal form", normalForm, output);
            names.generated().forEach((name, origin) -> {
                if (normalForm.isNonterminal(name)) {
                    output.println("  %s: %s of %s".formatted(name, origin.kind().name().toLowerCase().replace('_', ' '), origin.symbol()));
                }
            });
        }

        if (inputs.isEmpty()) {
            return;
        }
        final OriginalGrammarParser parser = OriginalGrammarParser.forGrammar(grammar);
        for (final List<String> input : inputs) {
            final Optional<Derivation> derivation = parser.derivation(input);
            LOG.info("Input \"{}\" is {}", format(input), derivation.isPresent() ? "derivable" : "not derivable");
            output.println();
            output.println("Input: " + format(input));
            output.println(derivation.map(Derivation::toString).orElse("not derivable"));
        }
    }

    private static void printGrammar(final String title, final Grammar grammar, final PrintStream output) {
        LOG.info("{}: {} nonterminals, {} terminals, {} productions", title, grammar.nonterminals().size(), grammar.terminals().size(), grammar.productions().size());
        output.println("%s (start symbol %s):".formatted(title, grammar.start()));
        for (int index = 0; index < grammar.productions().size(); index++) {
            final Production production = grammar.production(index);
            output.println("  %d: %s".formatted(index, production));
        }
    }
}
