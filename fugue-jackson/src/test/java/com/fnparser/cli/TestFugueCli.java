package com.fnparser.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class TestFugueCli {

    private static final String OPERATORS = String.join("\n",
        "#[infix(left, 6)]",
        "let (+) x y = x",
        "#[infix(left, 7)]",
        "let (*) x y = x",
        "1 + 2 * 3");

    @TempDir
    Path dir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();
    private final ObjectMapper mapper = new ObjectMapper();

    private int run(String... args) {
        return FugueCli.run(args,
            new PrintStream(out, true, StandardCharsets.UTF_8),
            new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String file(String name, String content) throws Exception {
        Path path = dir.resolve(name);
        Files.writeString(path, content);
        return path.toString();
    }

    private JsonNode output() throws Exception {
        return mapper.readTree(out.toString(StandardCharsets.UTF_8));
    }

    private static String rootOperator(JsonNode let) {
        JsonNode infix = let.get("body").get("body");
        assertEquals("InfixExpression", infix.get("type").asText());
        return infix.get("operator").get("ident").asText();
    }

    @Test
    void testPrintsAst() throws Exception {
        assertEquals(FugueCli.EXIT_OK, run(file("ok.fn", "let x = 1\nx")));
        assertEquals("LetExpression", output().get("type").asText());
    }

    @Test
    void testResolvesFixities() throws Exception {
        assertEquals(FugueCli.EXIT_OK, run("--pretty", file("ops.fn", OPERATORS)));
        assertEquals("+", rootOperator(output()));
    }

    @Test
    void testNoInfixKeepsGrammarShape() throws Exception {
        assertEquals(FugueCli.EXIT_OK, run("--no-infix", file("ops.fn", OPERATORS)));
        assertEquals("*", rootOperator(output()));
    }

    @Test
    void testParseErrorsPrintDiagnostics() throws Exception {
        assertEquals(FugueCli.EXIT_PARSE_ERRORS, run(file("bad.fn", "1 +")));
        JsonNode diagnostics = output();
        assertTrue(diagnostics.isArray());
        assertEquals("UnexpectedEof", diagnostics.get(0).get("kind").asText());
    }

    @Test
    void testUndeclaredOperatorIsAnError() throws Exception {
        assertEquals(FugueCli.EXIT_PARSE_ERRORS, run(file("undeclared.fn", "1 <> 2")));
        assertEquals("Infix", output().get(0).get("kind").asText());
    }

    @Test
    void testReplMode() throws Exception {
        assertEquals(FugueCli.EXIT_OK, run("--repl", file("line.fn", "let x = 1")));
        assertEquals("ValueBinding", output().get("type").asText());

        out.reset();
        assertEquals(FugueCli.EXIT_OK, run("--repl", file("blank.fn", "   ")));
        assertTrue(output().isNull());
    }

    @Test
    void testUsageErrors() throws Exception {
        assertEquals(FugueCli.EXIT_USAGE, run());
        assertEquals(FugueCli.EXIT_USAGE, run("--bogus", file("ok.fn", "1")));
        assertEquals(FugueCli.EXIT_USAGE, run(dir.resolve("missing.fn").toString()));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Usage"));
    }
}
