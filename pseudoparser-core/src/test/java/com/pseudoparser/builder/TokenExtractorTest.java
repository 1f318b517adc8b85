package com.pseudoparser.builder;

import com.pseudoparser.ValidationException;
import com.pseudoparser.ast.BoolLiteral;
import com.pseudoparser.ast.NumberLiteral;
import com.pseudoparser.ast.Parameter;
import com.pseudoparser.ast.ParameterType;
import com.pseudoparser.ast.StringLiteral;
import com.pseudoparser.ast.Var;
import com.pseudoparser.ast.VarTarget;
import com.pseudoparser.grammar.PseudoLexer;
import org.antlr.v4.runtime.CommonToken;
import org.antlr.v4.runtime.tree.TerminalNodeImpl;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

public class TokenExtractorTest {

    private final TokenExtractor tokens = new TokenExtractor();

    @Test
    @DisplayName("Names come from tokens, lexemes and naming nodes")
    void testExtractName() {
        CommonToken id = new CommonToken(PseudoLexer.ID, "total");
        assertEquals("total", tokens.extractName(id));
        assertEquals("total", tokens.extractName(new TerminalNodeImpl(id)));
        assertEquals("total", tokens.extractName("total"));
        assertEquals("total", tokens.extractName(new Var("total")));
        assertEquals("total", tokens.extractName(new VarTarget("total")));
        assertEquals("total", tokens.extractName(new Parameter("total", ParameterType.SIMPLE, null, null)));
    }

    @Test
    void testExtractNameRejectsOtherShapes() {
        assertThrows(ValidationException.class, () -> tokens.extractName(new NumberLiteral(3)));
        assertThrows(ValidationException.class, () -> tokens.extractName(42));
        assertThrows(ValidationException.class, () -> tokens.extractName(null));
    }

    @Test
    @DisplayName("Integers take the narrowest type that holds them")
    void testNumbers() {
        assertEquals(Integer.valueOf(42), tokens.extractValue("42"));
        assertEquals(Long.valueOf(3_000_000_000L), tokens.extractValue("3000000000"));
        assertEquals(Long.valueOf(Long.MAX_VALUE), tokens.extractValue("9223372036854775807"));
        assertEquals(new BigInteger("9223372036854775808"), tokens.extractValue("9223372036854775808"));
        assertEquals(new BigInteger("99999999999999999999"), tokens.extractValue("99999999999999999999"));
        assertEquals(Double.valueOf(1.5), tokens.extractValue("1.5"));
        assertEquals(Double.valueOf(1500.0), tokens.extractValue("1.5e3"));
        assertEquals(Integer.valueOf(7), tokens.extractValue(new CommonToken(PseudoLexer.NUMBER, "7")));
    }

    @Test
    void testMalformedNumber() {
        assertThrows(ValidationException.class, () -> tokens.extractValue("1.2.3"));
    }

    @Test
    @DisplayName("Comment text loses its delimiters and surrounding whitespace")
    void testCommentText() {
        assertEquals("header", tokens.extractCommentText(new CommonToken(PseudoLexer.LINE_COMMENT, "// header")));
        assertEquals("", tokens.extractCommentText("//"));
        assertEquals("block\n comment", tokens.extractCommentText(
            new TerminalNodeImpl(new CommonToken(PseudoLexer.BLOCK_COMMENT, "/* block\n comment */"))));
        assertEquals("", tokens.extractCommentText("/**/"));
        assertThrows(ValidationException.class, () -> tokens.extractCommentText("x = 1"));
        assertThrows(ValidationException.class, () -> tokens.extractCommentText("/*/"));
        assertThrows(ValidationException.class, () -> tokens.extractCommentText(new Var("x")));
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "\"plain\"     | plain",
        "\"a\\tb\"     | a\tb",
        "\"\\u0041z\"  | Az",
        "\"say \\\"hi\\\"\" | say \"hi\"",
    })
    void testStrings(String lexeme, String expected) {
        assertEquals(expected, tokens.extractValue(lexeme));
    }

    @Test
    void testStringEscapes() {
        assertEquals("line\nnext", tokens.extractValue("\"line\\nnext\""));
        assertEquals("back\\slash", tokens.extractValue("\"back\\\\slash\""));
        assertEquals("it's", tokens.extractValue("\"it\\'s\""));
        assertEquals("", tokens.extractValue("\"\""));
        assertThrows(ValidationException.class, () -> tokens.extractValue("\"bad\\q\""));
    }

    @Test
    void testBooleans() {
        assertEquals(Boolean.TRUE, tokens.extractValue("true"));
        assertEquals(Boolean.FALSE, tokens.extractValue(new CommonToken(PseudoLexer.FALSE, "false")));
    }

    @Test
    @DisplayName("Literal nodes give back their value")
    void testLiteralNodes() {
        assertEquals(7, tokens.extractValue(new NumberLiteral(7)));
        assertEquals("s", tokens.extractValue(new StringLiteral("s")));
        assertEquals(true, tokens.extractValue(new BoolLiteral(true)));
    }

    @Test
    void testExtractValueRejectsNonLiterals() {
        assertThrows(ValidationException.class, () -> tokens.extractValue("total"));
        assertThrows(ValidationException.class, () -> tokens.extractValue(new Var("x")));
        assertThrows(ValidationException.class, () -> tokens.extractValue(null));
    }

    @Test
    void testIsDelimiter() {
        assertTrue(tokens.isDelimiter("(", "("));
        assertTrue(tokens.isDelimiter(new CommonToken(PseudoLexer.LBRACK, "["), "["));
        assertFalse(tokens.isDelimiter("[", "("));
        assertFalse(tokens.isDelimiter(new Var("("), "("));
        assertFalse(tokens.isDelimiter(null, "("));
    }
}
