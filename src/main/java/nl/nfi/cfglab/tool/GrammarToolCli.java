package nl.nfi.cfglab.tool;

import nl.nfi.cfglab.common.logger.LoggerConfigurator;
import nl.nfi.cfglab.grammar.Symbols;
import org.slf4j.LoggerFactory;

import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import static picocli.CommandLine.Command;
import static picocli.CommandLine.ExitCode;
import static picocli.CommandLine.Option;

@Command(name = "cfg_tool", description = "Cleans up, normalizes and parses with context-free grammars")
public class GrammarToolCli implements Callable<Integer> {

    @Option(names = {"--grammar"}, description = "The grammar file, or a directory containing a config.ini", required = true)
    private String grammarPath;

    @Option(names = {"--clean"}, description = "Remove unproductive and unreachable symbols")
    private boolean clean = false;

    @Option(names = {"--cnf"}, description = "Show the grammar in Chomsky normal form")
    private boolean cnf = false;

    @Option(names = {"--input"}, description = "Space separated symbols to parse, can be repeated (overrides the inputs of a config.ini)")
    private List<String> inputs = new ArrayList<>();

    @Option(names = {"--log_directory_path"}, description = "Directory where to store live and archived log files")
    private String logPath;

    @Override
    public Integer call() throws Exception {
        // must be set before the first logger is created
        if (logPath != null) {
            System.setProperty(LoggerConfigurator.LOG_DIRECTORY_PROPERTY, logPath);
        }

        try {
            GrammarTool tool = GrammarTool.forGrammar(Paths.get(grammarPath))
                .clean(clean)
                .cnf(cnf);
            if (!inputs.isEmpty()) {
                tool = tool.inputs(inputs.stream().map(Symbols::word).toList());
            }
            tool.run(System.out);
        }
        catch (final Throwable t) {
            LoggerFactory.getLogger(GrammarToolCli.class).error("Fatal error", t);
            System.err.println("Fatal error: " + t.getMessage());
            return ExitCode.SOFTWARE;
        }

        return ExitCode.OK;
    }
}
