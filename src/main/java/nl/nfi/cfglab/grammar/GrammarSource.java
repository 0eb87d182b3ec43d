package nl.nfi.cfglab.grammar;

import nl.nfi.cfglab.common.ini.IniConfig;
import nl.nfi.cfglab.common.ini.IniSection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * A grammar loaded from disk, either a plain text file with one production per line, or a directory holding a
 * {@code config.ini} like:
 * <pre>
 * [GRAMMAR]
 * productions = expressions.txt
 * context_free = true
 * terminals = ["+", "*", "i"]
 * inputs = ["i + i * i", "i * i"]
 * </pre>
 * Only {@code productions} is required. With {@code terminals} given every other symbol is a nonterminal,
 * without it the grammar is read as context-free (or, with {@code context_free = false}, by the uppercase
 * convention).
 */
public record GrammarSource(Path basePath, Grammar grammar, List<List<String>> inputs) {

    private static final Logger LOG = LoggerFactory.getLogger(GrammarSource.class);

    public static final String CONFIG_FILE_NAME = "config.ini";
    public static final String GRAMMAR_SECTION = "GRAMMAR";

    public GrammarSource {
        inputs = List.copyOf(inputs);
    }

    public static GrammarSource loadFrom(final Path basePath) throws IOException {
        if (!Files.exists(basePath)) {
            throw new IllegalArgumentException("Grammar path does not exist: %s".formatted(basePath));
        }
        if (!Files.isDirectory(basePath)) {
            final Grammar grammar = Grammar.fromString(Files.readString(basePath, UTF_8));
            LOG.info("Loaded grammar from {} ({} productions)", basePath, grammar.productions().size());
            return new GrammarSource(basePath, grammar, List.of());
        }

        final IniConfig iniConfig = IniConfig.loadFrom(basePath.resolve(CONFIG_FILE_NAME));
        final IniSection section = iniConfig.getSection(GRAMMAR_SECTION);

        final String text = Files.readString(basePath.resolve(section.getString("productions")), UTF_8);
        final Grammar grammar = section.hasKey("terminals")
            ? Grammar.fromString(text, new LinkedHashSet<>(section.getStringList("terminals")))
            : Grammar.fromString(text, section.getBoolean("context_free", true));

        final List<List<String>> inputs = section.hasKey("inputs")
            ? section.getStringList("inputs").stream().map(Symbols::word).toList()
            : List.of();

        LOG.info("Loaded grammar from {} ({} productions, {} sample inputs)", basePath, grammar.productions().size(), inputs.size());
        return new GrammarSource(basePath, grammar, inputs);
    }
}
