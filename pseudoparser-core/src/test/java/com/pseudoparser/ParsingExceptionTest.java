package com.pseudoparser;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Paths;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class ParsingExceptionTest {

    @Test
    @DisplayName("Wrapping a ParsingException returns it unchanged")
    void testWrapKeepsParsingException() {
        ParsingException original = new ParsingException("Syntax error at 1:1: boom");
        assertSame(original, ParsingException.wrap(original, "Failed to parse x", "x"));
    }

    @Test
    void testWrapAddsContext() {
        ValidationException cause = new ValidationException("bad item");
        ParsingException wrapped = ParsingException.wrap(cause, "Failed to parse prog.pseudo", "prog.pseudo");
        assertEquals("Failed to parse prog.pseudo: bad item", wrapped.getMessage());
        assertSame(cause, wrapped.getCause());
        assertEquals(Optional.of("prog.pseudo"), wrapped.getFilePath());
        assertTrue(wrapped.getPosition().isEmpty());
    }

    @Test
    @DisplayName("Unexpected failures are wrapped exactly once")
    void testParserWrapsOnce() {
        GrammarEngine broken = (code, sourceName) -> {
            throw new IllegalStateException("engine broke");
        };
        LanguageParser parser = new LanguageParser(new ParserSettings(), broken, path -> "x = 1");

        ParsingException e = assertThrows(ParsingException.class, () -> parser.parse("x = 1"));
        assertEquals("Failed to parse <string>: engine broke", e.getMessage());
        assertInstanceOf(IllegalStateException.class, e.getCause());

        ParsingException fromFile = assertThrows(ParsingException.class, () -> parser.parseFile("a.pseudo"));
        assertEquals("Failed to parse a.pseudo: engine broke", fromFile.getMessage());
        assertEquals(Optional.of("a.pseudo"), fromFile.getFilePath());
    }

    @Test
    @DisplayName("Reader failures pass through or are wrapped with the file")
    void testReaderFailures() {
        ParsingException missing = new ParsingException("File not found: a.pseudo", null, "a.pseudo");
        LanguageParser failing = new LanguageParser(new ParserSettings(), new AntlrGrammarEngine(), path -> {
            throw missing;
        });
        assertSame(missing, assertThrows(ParsingException.class, () -> failing.parseFile(Paths.get("a.pseudo"))));

        LanguageParser unchecked = new LanguageParser(new ParserSettings(), new AntlrGrammarEngine(), path -> {
            throw new UncheckedIOException("disk failure", new IOException("gone"));
        });
        ParsingException e = assertThrows(ParsingException.class, () -> unchecked.parseFile(Paths.get("a.pseudo")));
        assertEquals("Failed to parse file a.pseudo: disk failure", e.getMessage());
    }
}
