package com.pseudoparser;

import com.pseudoparser.ast.ArrayAccess;
import com.pseudoparser.ast.Assignment;
import com.pseudoparser.ast.BinOp;
import com.pseudoparser.ast.Comment;
import com.pseudoparser.ast.FieldAccess;
import com.pseudoparser.ast.Node;
import com.pseudoparser.ast.Program;
import com.pseudoparser.ast.SourcePosition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class SourcePositionsTest {

    private final LanguageParser parser = new LanguageParser();

    private Node valueOf(Program program, int statement) {
        return ((Assignment) program.statements().get(statement)).value();
    }

    @Test
    @DisplayName("Statements and expressions span their source text")
    void testSpans() {
        Program program = parser.parse("x = 1\ny = foo + bar");
        assertEquals(Optional.of(new SourcePosition(2, 1, 2, 13)), program.statements().get(1).position());
        assertEquals(Optional.of(new SourcePosition(2, 5, 2, 13)), valueOf(program, 1).position());
        assertEquals(Optional.of(new SourcePosition(1, 1, 2, 13)), program.position());
    }

    @Test
    @DisplayName("Trailing whitespace does not stretch the program span")
    void testTrailingWhitespace() {
        SourcePosition expected = new SourcePosition(1, 1, 1, 5);
        assertEquals(Optional.of(expected), parser.parse("x = 1\n").position());
        assertEquals(Optional.of(expected), parser.parse("x = 1\n   ").position());
        assertEquals(Optional.of(new SourcePosition(1, 1, 1, 5)), parser.parse("x = 1\n\n\n").position());
        assertEquals(Optional.of(new SourcePosition(1, 1, 1, 1)), parser.parse("").position());
    }

    @Test
    @DisplayName("Comments span their delimiters, across lines for block comments")
    void testCommentSpans() {
        Program program = parser.parse("// header\nx = 1; /* block\n comment */ y = 2;\n");
        Comment header = (Comment) program.statements().get(0);
        Comment block = (Comment) program.statements().get(2);
        assertEquals(Optional.of(new SourcePosition(1, 1, 1, 9)), header.position());
        assertEquals(Optional.of(new SourcePosition(2, 8, 3, 11)), block.position());
        assertEquals(Optional.of(new SourcePosition(3, 13, 3, 18)), program.statements().get(3).position());
        assertEquals(Optional.of(new SourcePosition(1, 1, 3, 18)), program.position());
    }

    @Test
    @DisplayName("Intermediate nodes of an operator chain get their own span")
    void testChainSpans() {
        BinOp outer = (BinOp) valueOf(parser.parse("x = a + b + c"), 0);
        assertEquals(Optional.of(new SourcePosition(1, 5, 1, 13)), outer.position());
        assertEquals(Optional.of(new SourcePosition(1, 5, 1, 9)), outer.left().position());
        assertEquals(Optional.of(new SourcePosition(1, 13, 1, 13)), outer.right().position());
    }

    @Test
    @DisplayName("Each suffix in a postfix chain spans from the primary to its own end")
    void testPostfixSpans() {
        ArrayAccess access = (ArrayAccess) valueOf(parser.parse("x = a.b[0]"), 0);
        assertEquals(Optional.of(new SourcePosition(1, 5, 1, 10)), access.position());
        FieldAccess field = (FieldAccess) access.array();
        assertEquals(Optional.of(new SourcePosition(1, 5, 1, 7)), field.position());
    }

    @Test
    @DisplayName("Parentheses keep the inner expression's span")
    void testParenthesized() {
        Node value = valueOf(parser.parse("x = (a + b)"), 0);
        assertEquals(Optional.of(new SourcePosition(1, 6, 1, 10)), value.position());
    }

    @Test
    @DisplayName("Positions can be switched off")
    void testNoPositions() {
        ParserSettings settings = new ParserSettings();
        settings.setPropagatePositions(false);
        Program program = new LanguageParser(settings).parse("x = a + b * c");
        Assignment assignment = (Assignment) program.statements().get(0);
        BinOp value = (BinOp) assignment.value();

        assertTrue(program.metadata().isEmpty());
        assertTrue(assignment.metadata().isEmpty());
        assertTrue(assignment.target().metadata().isEmpty());
        assertTrue(value.metadata().isEmpty());
        assertTrue(value.right().metadata().isEmpty());
        assertEquals(parser.parse("x = a + b * c"), program);
    }

    @Test
    @DisplayName("Files put their path into every position")
    void testFilePositions(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("prog.pseudo");
        Files.writeString(file, "x = 1\nprint(x)\n");
        Program program = parser.parseFile(file);

        SourcePosition call = program.statements().get(1).position().orElseThrow();
        assertEquals(Optional.of(file.toString()), call.file());
        assertEquals(2, call.line());
        assertEquals(1, call.column());
    }

    @Test
    @DisplayName("Lexer errors report line and column")
    void testLexerErrorPosition() {
        ParsingException e = assertThrows(ParsingException.class, () -> parser.parse("x = 1 @ 2"));
        assertEquals(Optional.of(new SourcePosition(1, 7)), e.getPosition());
        assertTrue(e.getMessage().startsWith("Syntax error at 1:7"), e.getMessage());
    }

    @Test
    @DisplayName("Parser errors report line and column")
    void testParserErrorPosition() {
        ParsingException e = assertThrows(ParsingException.class, () -> parser.parse("y = 0\nx = = 2"));
        SourcePosition position = e.getPosition().orElseThrow();
        assertEquals(2, position.line());
        assertEquals(5, position.column());
    }

    @Test
    void testSyntaxErrorInFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("broken.pseudo");
        Files.writeString(file, "while x {");
        ParsingException e = assertThrows(ParsingException.class, () -> parser.parseFile(file));
        assertEquals(Optional.of(file.toString()), e.getFilePath());
        assertEquals(Optional.of(file.toString()), e.getPosition().flatMap(SourcePosition::file));
    }
}
