package com.pseudoparser;

import java.nio.file.Path;

/**
 * Loads program text from a file.
 */
public interface SourceReader {

    /**
     * @throws ParsingException if the file is missing, unreadable or not valid
     *     text in the expected encoding
     */
    String read(Path path);
}
