package com.pseudoparser.jackson;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pseudoparser.ast.ArraySlice;
import com.pseudoparser.ast.IndexRange;
import com.pseudoparser.ast.Node;
import com.pseudoparser.ast.NumberLiteral;
import com.pseudoparser.ast.Parameter;
import com.pseudoparser.ast.ParameterType;
import com.pseudoparser.ast.SubroutineDef;
import com.pseudoparser.ast.Var;
import com.pseudoparser.json.AstJsonException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class AstJsonReaderTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final AstJsonReader reader = new AstJsonReader();
    private final AstJsonWriter writer = new AstJsonWriter();

    private Node read(String json) throws Exception {
        return reader.read(mapper.readTree(json));
    }

    @Test
    void testUnknownTypeReportsPath() {
        AstJsonException e = assertThrows(AstJsonException.class,
            () -> read("{\"type\":\"Program\",\"statements\":[{\"type\":\"Goto\"}]}"));
        assertEquals(Optional.of("/statements/0/type"), e.getJsonPath());
        assertTrue(e.getMessage().contains("Goto"), e.getMessage());
    }

    @Test
    void testMissingFieldReportsPath() {
        AstJsonException e = assertThrows(AstJsonException.class,
            () -> read("{\"type\":\"WhileLoop\",\"condition\":{\"type\":\"Var\",\"name\":\"a\"}}"));
        assertEquals(Optional.of(""), e.getJsonPath());
        assertTrue(e.getMessage().contains("'body'"), e.getMessage());

        e = assertThrows(AstJsonException.class, () -> read("{\"type\":\"UnOp\",\"operator\":\"-\",\"operand\":{}}"));
        assertEquals(Optional.of("/operand"), e.getJsonPath());
    }

    @Test
    void testWrongFieldTypes() {
        AstJsonException e = assertThrows(AstJsonException.class, () -> read("{\"type\":\"Var\",\"name\":3}"));
        assertEquals(Optional.of("/name"), e.getJsonPath());

        e = assertThrows(AstJsonException.class,
            () -> read("{\"type\":\"NumberLiteral\",\"value\":\"3\"}"));
        assertEquals(Optional.of("/value"), e.getJsonPath());

        e = assertThrows(AstJsonException.class,
            () -> read("{\"type\":\"Var\",\"name\":\"a\",\"loc\":{\"line\":1}}"));
        assertEquals(Optional.of("/loc"), e.getJsonPath());
    }

    @Test
    void testConstructorRulesAreEnforced() {
        AstJsonException e = assertThrows(AstJsonException.class, () -> read(
            "{\"type\":\"Parameter\",\"name\":\"p\",\"parameterType\":\"OBJECT\",\"dimensions\":null,\"className\":null}"));
        assertInstanceOf(IllegalArgumentException.class, e.getCause());

        e = assertThrows(AstJsonException.class, () -> read(
            "{\"type\":\"Parameter\",\"name\":\"p\",\"parameterType\":\"TABLE\"}"));
        assertEquals(Optional.of("/parameterType"), e.getJsonPath());
    }

    @Test
    void testParametersAndSlices() {
        SubroutineDef def = new SubroutineDef("f",
            List.of(
                new Parameter("A", ParameterType.ARRAY, List.of(new Var("n")), null),
                new Parameter("q", ParameterType.OBJECT, null, "Point")),
            List.of(new ArraySlice(new Var("A"), List.of(IndexRange.openEnd(new NumberLiteral(1)), IndexRange.open()))));
        JsonNode json = writer.write(def);

        assertTrue(json.get("parameters").get(1).get("dimensions").isNull());
        assertEquals("Point", json.get("parameters").get(1).get("className").asText());
        JsonNode ranges = json.get("body").get(0).get("ranges");
        assertTrue(ranges.get(0).get("end").isNull());
        assertTrue(ranges.get(1).get("start").isNull());

        assertEquals(def, reader.read(json));
    }

    @Test
    void testUnknownFieldsAreIgnored() throws Exception {
        assertEquals(new Var("a"), read("{\"type\":\"Var\",\"name\":\"a\",\"comment\":\"extra\"}"));
    }

    @Test
    void testSubroutineParametersMustBeParameters() {
        AstJsonException e = assertThrows(AstJsonException.class, () -> read(
            "{\"type\":\"SubroutineDef\",\"name\":\"f\",\"parameters\":[{\"type\":\"Var\",\"name\":\"x\"}],\"body\":[]}"));
        assertEquals(Optional.of("/parameters/0"), e.getJsonPath());
    }
}
