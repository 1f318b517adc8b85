package com.pseudoparser;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class FileSourceReaderTest {

    @TempDir
    Path dir;

    private final FileSourceReader reader = new FileSourceReader(StandardCharsets.UTF_8);

    @Test
    void testRead() throws IOException {
        Path file = dir.resolve("ok.pseudo");
        Files.writeString(file, "s = \"héllo\"\n");
        assertEquals("s = \"héllo\"\n", reader.read(file));
    }

    @Test
    void testMissingFile() {
        Path file = dir.resolve("missing.pseudo");
        ParsingException e = assertThrows(ParsingException.class, () -> reader.read(file));
        assertEquals("File not found: " + file, e.getMessage());
        assertEquals(file.toString(), e.getFilePath().orElseThrow());
    }

    @Test
    void testMalformedInput() throws IOException {
        Path file = dir.resolve("latin1.pseudo");
        Files.write(file, new byte[]{'x', ' ', '=', ' ', (byte) 0xC3, (byte) 0x28});
        ParsingException e = assertThrows(ParsingException.class, () -> reader.read(file));
        assertTrue(e.getMessage().startsWith("Error decoding file " + file), e.getMessage());
    }

    @Test
    void testOtherCharset() throws IOException {
        Path file = dir.resolve("latin1.pseudo");
        Files.write(file, new byte[]{'s', '=', '"', (byte) 0xE9, '"'});
        assertEquals("s=\"é\"", new FileSourceReader(StandardCharsets.ISO_8859_1).read(file));
    }

    @Test
    void testDirectory() {
        ParsingException e = assertThrows(ParsingException.class, () -> reader.read(dir));
        assertTrue(e.getMessage().startsWith("Error reading file " + dir), e.getMessage());
    }

    @Test
    void testParseFileMissing() {
        Path file = dir.resolve("nope.pseudo");
        ParsingException e = assertThrows(ParsingException.class, () -> new LanguageParser().parseFile(file));
        assertTrue(e.getMessage().startsWith("File not found:"), e.getMessage());
    }
}
