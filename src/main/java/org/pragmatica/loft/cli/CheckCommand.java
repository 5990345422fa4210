package org.pragmatica.loft.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Parses each file with error recovery and prints every syntax error found.
 * Exit code is 1 if any file had errors or could not be read.
 */
@Command(name = "check", description = "Report syntax errors in loft source files.")
public class CheckCommand implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(CheckCommand.class);

    @ParentCommand
    LoftCommand parent;

    @Spec
    CommandSpec spec;

    @Parameters(arity = "1..*", paramLabel = "FILE", description = "Files to check.")
    List<Path> files;

    @Option(names = "--brief", description = "Print one line per error instead of a source snippet.")
    boolean brief;

    @Override
    public Integer call() {
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();
        int failed = 0;

        for (var file : files) {
            String source;
            try {
                source = Files.readString(file);
            } catch (IOException e) {
                log.error("Cannot read {}", file, e);
                err.println("error: cannot read " + file + ": " + e.getMessage());
                failed++;
                continue;
            }

            var outcome = parent.builder().parseRecoverable(source, file.toString());
            if (outcome.hasErrors()) {
                log.info("{}: {} error(s)", file, outcome.errorCount());
                err.print(brief ? outcome.formatSimple() : outcome.formatDiagnostics());
                failed++;
            } else {
                log.info("{}: {} statement(s)", file, outcome.statements().size());
                out.println(file + ": ok");
            }
        }

        err.flush();
        out.flush();
        return failed == 0 ? 0 : 1;
    }
}
