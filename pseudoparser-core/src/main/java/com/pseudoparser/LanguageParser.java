package com.pseudoparser;

import com.pseudoparser.ast.Program;
import org.slf4j.Logger;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;

/**
 * Entry point: parses pseudocode text or files into a {@link Program}.
 *
 * <p>Parsing is all or nothing. Every failure surfaces as a
 * {@link ParsingException}; an existing {@code ParsingException} is rethrown
 * unchanged, anything else is wrapped exactly once with the source it came
 * from.</p>
 *
 * <pre>{@code
 * Program program = new LanguageParser().parse("for i = 1 to 3 { print(i) }");
 * }</pre>
 *
 * <p>A parser holds no per-call state and can be reused; each call builds its
 * own {@link AstTransformer}.</p>
 */
public class LanguageParser {

    private static final Logger LOG = ParserLogger.getLogger(LanguageParser.class);

    private final ParserSettings settings;
    private final GrammarEngine grammar;
    private final SourceReader reader;

    public LanguageParser() {
        this(new ParserSettings());
    }

    public LanguageParser(ParserSettings settings) {
        this(settings, new AntlrGrammarEngine(), new FileSourceReader(settings.getCharset()));
    }

    public LanguageParser(ParserSettings settings, GrammarEngine grammar, SourceReader reader) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.grammar = Objects.requireNonNull(grammar, "grammar");
        this.reader = Objects.requireNonNull(reader, "reader");
    }

    public ParserSettings getSettings() {
        return settings;
    }

    /**
     * Parses in-memory program text.
     *
     * @throws ParsingException on any lexical, syntax or construction error
     */
    public Program parse(String code) {
        return parse(code, null);
    }

    /**
     * Reads and parses a source file. Positions in the result carry the file
     * path.
     *
     * @throws ParsingException if the file cannot be read or does not parse
     */
    public Program parseFile(Path path) {
        String file = path.toString();
        LOG.debug("Parsing file {}", file);
        try {
            String code = reader.read(path);
            return parse(code, file);
        } catch (RuntimeException e) {
            throw ParsingException.wrap(e, "Failed to parse file " + file, file);
        }
    }

    public Program parseFile(String path) {
        return parseFile(Paths.get(path));
    }

    private Program parse(String code, String sourceName) {
        Objects.requireNonNull(code, "code");
        String description = sourceName != null ? sourceName : "<string>";
        long start = System.nanoTime();
        try {
            ParseResult parsed = grammar.parse(code, sourceName);
            Program program = new AstTransformer(settings, sourceName, parsed.tokens()).transform(parsed.tree());
            program.freezeMetadata();
            if (LOG.isDebugEnabled()) {
                LOG.debug("Parsed {} into {} statement(s) in {} ms", description, program.statements().size(),
                    (System.nanoTime() - start) / 1_000_000);
            }
            return program;
        } catch (RuntimeException e) {
            throw ParsingException.wrap(e, "Failed to parse " + description, sourceName);
        }
    }
}
