package org.pragmatica.loft.cli;

import org.pragmatica.loft.Loft;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

/**
 * Command-line front end: {@code loft check}, {@code loft tokens} and {@code loft ast}.
 */
@Command(name = "loft",
         mixinStandardHelpOptions = true,
         version = "loft-parser 0.1.0",
         description = "Tokenize and parse loft source files.",
         subcommands = {CheckCommand.class, TokensCommand.class, AstCommand.class})
public class LoftCommand implements Callable<Integer> {

    @Option(names = "--lookahead-limit",
            defaultValue = "100",
            description = "Maximum tokens scanned when telling a lambda from a parenthesized expression (default: ${DEFAULT-VALUE}).")
    int lookaheadLimit;

    @Option(names = "--max-input-size",
            defaultValue = "10000000",
            description = "Maximum source size in characters (default: ${DEFAULT-VALUE}).")
    int maxInputSize;

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing required subcommand");
    }

    Loft.Builder builder() {
        return Loft.builder()
                   .lambdaLookaheadLimit(lookaheadLimit)
                   .maxInputSize(maxInputSize);
    }

    public static CommandLine commandLine() {
        return new CommandLine(new LoftCommand());
    }

    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }
}
