package org.pragmatica.loft.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class LoftCommandTest {

    @TempDir
    Path dir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(String... args) {
        CommandLine cmd = LoftCommand.commandLine();
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
        return cmd.execute(args);
    }

    private Path file(String name, String content) throws IOException {
        var path = dir.resolve(name);
        Files.writeString(path, content);
        return path;
    }

    @Test
    void check_reportsCleanFile() throws IOException {
        var path = file("ok.lf", "let x = 1;");

        assertEquals(0, run("check", path.toString()));
        assertEquals(path + ": ok", out.toString().trim());
        assertEquals("", err.toString());
    }

    @Test
    void check_printsDiagnosticsAndFails() throws IOException {
        var good = file("good.lf", "let x = 1;");
        var bad = file("bad.lf", "let x = ;\nlet y = ;");

        assertEquals(1, run("check", good.toString(), bad.toString()));
        assertThat(out.toString()).contains(good + ": ok");
        assertThat(err.toString())
            .contains("error: Unexpected token in expression: ';'")
            .contains("--> " + bad + ":1:9")
            .contains("--> " + bad + ":2:9");
    }

    @Test
    void check_briefPrintsOneLinePerError() throws IOException {
        var bad = file("bad.lf", "let x = ;");

        assertEquals(1, run("check", "--brief", bad.toString()));
        assertEquals(bad + ":1:9: error: Unexpected token in expression: ';'", err.toString().trim());
    }

    @Test
    void check_unreadableFileFails() {
        var missing = dir.resolve("missing.lf");

        assertEquals(1, run("check", missing.toString()));
        assertThat(err.toString()).startsWith("error: cannot read " + missing);
    }

    @Test
    void tokens_printsPositionAndToken() throws IOException {
        var path = file("t.lf", "let x\n= 1;");

        assertEquals(0, run("tokens", path.toString()));
        assertThat(out.toString().lines())
            .containsExactly("1:1 'let'", "1:5 'x'", "2:1 '='", "2:3 1", "2:4 ';'");
    }

    @Test
    void tokens_withCommentsIncludesDocComments() throws IOException {
        var path = file("t.lf", "/// doc comment\nx");

        assertEquals(0, run("tokens", "--comments", path.toString()));
        assertThat(out.toString()).contains("doc comment");
    }

    @Test
    void tokens_lexicalErrorFails() throws IOException {
        var path = file("t.lf", "let $");

        assertEquals(1, run("tokens", path.toString()));
        assertThat(err.toString()).contains("Unexpected character '$'");
    }

    @Test
    void tokens_unreadableFileFails() {
        var missing = dir.resolve("missing.lf");

        assertEquals(1, run("tokens", missing.toString()));
        assertThat(err.toString()).startsWith("error: cannot read " + missing);
        assertEquals("", out.toString());
    }

    @Test
    void ast_printsStatements() throws IOException {
        var path = file("a.lf", "let x = 1;");

        assertEquals(0, run("ast", path.toString()));
        assertThat(out.toString()).startsWith("VarDecl[name=x");
    }

    @Test
    void ast_honoursLookaheadLimit() throws IOException {
        var path = file("a.lf", "let f = (a, b, c) => a;");

        assertEquals(0, run("ast", path.toString()));
        assertEquals(1, run("--lookahead-limit", "2", "ast", path.toString()));
        assertThat(err.toString()).contains("Expected ')' but got ','");
    }

    @Test
    void ast_unreadableFileFails() {
        var missing = dir.resolve("missing.lf");

        assertEquals(1, run("ast", missing.toString()));
        assertThat(err.toString()).startsWith("error: cannot read " + missing);
    }

    @Test
    void missingSubcommand_isUsageError() {
        assertEquals(2, run());
        assertThat(err.toString()).contains("Missing required subcommand");
    }
}
