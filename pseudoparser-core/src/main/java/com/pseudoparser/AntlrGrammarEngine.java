package com.pseudoparser;

import com.pseudoparser.ast.SourcePosition;
import com.pseudoparser.grammar.PseudoLexer;
import com.pseudoparser.grammar.PseudoParser;
import org.antlr.v4.runtime.BailErrorStrategy;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.DefaultErrorStrategy;
import org.antlr.v4.runtime.IntStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.atn.PredictionMode;
import org.antlr.v4.runtime.misc.ParseCancellationException;
import org.slf4j.Logger;

/**
 * {@link GrammarEngine} backed by the generated ANTLR lexer and parser.
 *
 * <p>Parsing is tried in SLL mode first and retried in full LL mode only when
 * SLL bails out. The first syntax error reported in LL mode is fatal.
 * Comments stay on the hidden channel of the returned token stream.</p>
 */
public class AntlrGrammarEngine implements GrammarEngine {

    private static final Logger LOG = ParserLogger.getLogger(AntlrGrammarEngine.class);

    @Override
    public ParseResult parse(String code, String sourceName) {
        CharStream input = CharStreams.fromString(code,
            sourceName != null ? sourceName : IntStream.UNKNOWN_SOURCE_NAME);
        SyntaxErrorListener errors = new SyntaxErrorListener(sourceName);

        PseudoLexer lexer = new PseudoLexer(input);
        lexer.removeErrorListeners();
        lexer.addErrorListener(errors);

        CommonTokenStream tokens = new CommonTokenStream(lexer);
        PseudoParser parser = new PseudoParser(tokens);
        parser.removeErrorListeners();
        parser.getInterpreter().setPredictionMode(PredictionMode.SLL);
        parser.setErrorHandler(new BailErrorStrategy());
        try {
            return new ParseResult(parser.program(), tokens);
        } catch (ParseCancellationException e) {
            LOG.debug("SLL parsing failed for {}, retrying in LL mode", describe(sourceName));
        }

        tokens.seek(0);
        parser.reset();
        parser.addErrorListener(errors);
        parser.getInterpreter().setPredictionMode(PredictionMode.LL);
        parser.setErrorHandler(new DefaultErrorStrategy());
        return new ParseResult(parser.program(), tokens);
    }

    private static String describe(String sourceName) {
        return sourceName != null ? sourceName : "<string>";
    }

    /**
     * Converts the first lexer or parser error into a {@link ParsingException}.
     */
    static final class SyntaxErrorListener extends BaseErrorListener {

        private final String sourceName;  // Can be null

        SyntaxErrorListener(String sourceName) {
            this.sourceName = sourceName;
        }

        @Override
        public void syntaxError(
            Recognizer<?, ?> recognizer,
            Object offendingSymbol,
            int line,
            int charPositionInLine,
            String msg,
            RecognitionException e
        ) {
            SourcePosition position = new SourcePosition(line, charPositionInLine + 1, line, charPositionInLine + 1, sourceName);
            throw new ParsingException("Syntax error at " + position + ": " + msg, e, sourceName, position);
        }
    }
}
