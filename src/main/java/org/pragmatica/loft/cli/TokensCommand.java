package org.pragmatica.loft.cli;

import org.pragmatica.loft.Loft;
import org.pragmatica.loft.error.ParseError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Dumps the token stream of a file, one {@code line:column token} per line.
 */
@Command(name = "tokens", description = "Print the tokens of a loft source file.")
public class TokensCommand implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(TokensCommand.class);

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", paramLabel = "FILE", description = "File to tokenize.")
    Path file;

    @Option(names = "--comments", description = "Include comments and doc comments.")
    boolean comments;

    @Override
    public Integer call() {
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();
        String source;
        try {
            source = Files.readString(file);
        } catch (IOException e) {
            log.error("Cannot read {}", file, e);
            err.println("error: cannot read " + file + ": " + e.getMessage());
            err.flush();
            return 1;
        }

        try {
            var lexemes = Loft.tokenize(source, file.toString(), comments);
            for (var lexeme : lexemes) {
                out.println(lexeme);
            }
            log.info("{}: {} token(s)", file, lexemes.size());
            out.flush();
            return 0;
        } catch (ParseError e) {
            log.info("{}: tokenizing failed at {}", file, e.location());
            err.print(e.render(source));
            err.flush();
            return 1;
        }
    }
}
