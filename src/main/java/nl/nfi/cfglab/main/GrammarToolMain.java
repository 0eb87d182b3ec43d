package nl.nfi.cfglab.main;

import nl.nfi.cfglab.tool.GrammarToolCli;
import picocli.CommandLine;

public final class GrammarToolMain {

    public static void main(final String... args) {
        final int exitCode = new CommandLine(new GrammarToolCli()).execute(args);
        System.exit(exitCode);
    }
}
