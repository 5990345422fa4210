package org.pragmatica.loft.cli;

import org.pragmatica.loft.error.ParseError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(name = "ast", description = "Print the parsed statements of a loft source file.")
public class AstCommand implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(AstCommand.class);

    @ParentCommand
    LoftCommand parent;

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", paramLabel = "FILE", description = "File to parse.")
    Path file;

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
            var statements = parent.builder().parse(source, file.toString());
            statements.forEach(out::println);
            out.flush();
            return 0;
        } catch (ParseError e) {
            log.info("{}: parsing failed at {}", file, e.location());
            err.print(e.render(source));
            err.flush();
            return 1;
        }
    }
}
