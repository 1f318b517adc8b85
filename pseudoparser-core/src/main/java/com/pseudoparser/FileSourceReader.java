package com.pseudoparser;

import org.slf4j.Logger;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads a whole file with a strict decoder: malformed input is an error rather
 * than being replaced.
 */
public class FileSourceReader implements SourceReader {

    private static final Logger LOG = ParserLogger.getLogger(FileSourceReader.class);

    private final Charset charset;

    public FileSourceReader(Charset charset) {
        this.charset = Objects.requireNonNull(charset, "charset");
    }

    @Override
    public String read(Path path) {
        String file = path.toString();
        if (!Files.exists(path)) {
            throw new ParsingException("File not found: " + file, null, file);
        }
        try {
            byte[] bytes = Files.readAllBytes(path);
            String text = charset.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(bytes))
                .toString();
            LOG.debug("Read {} bytes from {}", bytes.length, file);
            return text;
        } catch (NoSuchFileException e) {
            throw new ParsingException("File not found: " + file, e, file);
        } catch (CharacterCodingException e) {
            throw new ParsingException("Error decoding file " + file + " as " + charset + ": " + e.getMessage(), e, file);
        } catch (IOException e) {
            throw new ParsingException("Error reading file " + file + ": " + e.getMessage(), e, file);
        }
    }
}
