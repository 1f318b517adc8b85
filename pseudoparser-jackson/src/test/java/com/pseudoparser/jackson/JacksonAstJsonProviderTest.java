package com.pseudoparser.jackson;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pseudoparser.LanguageParser;
import com.pseudoparser.ast.Assignment;
import com.pseudoparser.ast.Comment;
import com.pseudoparser.ast.ForLoop;
import com.pseudoparser.ast.Node;
import com.pseudoparser.ast.NumberLiteral;
import com.pseudoparser.ast.Program;
import com.pseudoparser.ast.ReturnStmt;
import com.pseudoparser.ast.SourcePosition;
import com.pseudoparser.ast.Var;
import com.pseudoparser.json.AstJsonDeserializer;
import com.pseudoparser.json.AstJsonException;
import com.pseudoparser.json.AstJsonProvider;
import com.pseudoparser.json.AstJsonSerializer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class JacksonAstJsonProviderTest {

    private static final String SAMPLE = String.join("\n",
        "class Point { x, y }",
        "var a, b = 2",
        "array A[10][20]",
        "graph g",
        "Point p",
        "p.x = 3",
        "A[i][j] = 0",
        "for i = 1 to n reset { print(i) }",
        "while a < 10 and not done { a = a + 1 }",
        "repeat { a = a - 1 } until a == 0",
        "if a { b = 1 } else if b { b = 2 } else { b = 3 }",
        "connect g(1, 2)",
        "traverse g from 1 to 5",
        "function f(A[n], Point q, graph h, k) { return A[1:][k] }",
        "stack.push(concat(\"x\", \"y\"), 2.5, 3000000000, null, true)",
        "z = a.b[0](x) + length(A) * -ceil(1.5) ^ 2",
        "y = neighbors(g, addNode(g, new Point()))");

    private final JacksonAstJsonProvider provider = new JacksonAstJsonProvider();
    private final AstJsonSerializer serializer = provider.getSerializer();
    private final AstJsonDeserializer deserializer = provider.getDeserializer();
    private final ObjectMapper mapper = provider.getObjectMapper();

    @Test
    @DisplayName("Nodes are written with a type discriminator, their fields and a location")
    void testSerializationShape() throws Exception {
        Program program = new LanguageParser().parse("x = 1");
        JsonNode json = mapper.readTree(serializer.serialize(program));

        assertEquals("Program", json.get("type").asText());
        JsonNode assignment = json.get("statements").get(0);
        assertEquals("Assignment", assignment.get("type").asText());
        assertEquals("VarTarget", assignment.get("target").get("type").asText());
        assertEquals("x", assignment.get("target").get("name").asText());

        JsonNode value = assignment.get("value");
        assertEquals("NumberLiteral", value.get("type").asText());
        assertTrue(value.get("value").isInt());
        assertEquals(1, value.get("value").intValue());

        JsonNode loc = value.get("loc");
        assertEquals(1, loc.get("line").intValue());
        assertEquals(5, loc.get("column").intValue());
        assertEquals(1, loc.get("endLine").intValue());
        assertEquals(5, loc.get("endColumn").intValue());
        assertTrue(loc.get("filename").isNull());
    }

    @Test
    @DisplayName("Absent optional fields are written as null, unpositioned nodes have no loc")
    void testNullsAndMissingLocation() throws Exception {
        JsonNode json = mapper.readTree(serializer.serialize(new ReturnStmt(null)));
        assertTrue(json.has("value"));
        assertTrue(json.get("value").isNull());
        assertFalse(json.has("loc"));

        JsonNode loop = mapper.readTree(serializer.serialize(
            new ForLoop(null, new NumberLiteral(1), new Var("n"), List.of())));
        assertTrue(loop.get("variable").isNull());
        assertTrue(loop.get("preserveCounter").booleanValue());
    }

    @Test
    @DisplayName("A parsed program survives a round trip with its positions")
    void testRoundTrip() {
        Program program = new LanguageParser().parse(SAMPLE);
        Program copy = deserializer.deserializeProgram(serializer.serialize(program));

        assertEquals(program, copy);
        assertEquals(program.position(), copy.position());
        for (int i = 0; i < program.statements().size(); i++) {
            assertEquals(program.statements().get(i).position(), copy.statements().get(i).position(),
                "statement " + i);
        }
        Node value = ((Assignment) copy.statements().get(15)).value();
        assertEquals(((Assignment) program.statements().get(15)).value().position(), value.position());
    }

    @Test
    @DisplayName("Pretty output reads back to the same tree")
    void testPrettyRoundTrip() {
        Program program = new LanguageParser().parse(SAMPLE);
        String pretty = serializer.serializePretty(program);
        assertTrue(pretty.contains("\n"));
        assertEquals(program, deserializer.deserializeProgram(pretty));
    }

    @Test
    @DisplayName("Number literals keep their numeric type")
    void testNumberTypes() {
        Program program = new LanguageParser().parse("a = 7\nb = 3000000000\nc = 2.5\nd = 99999999999999999999");
        Program copy = deserializer.deserializeProgram(serializer.serialize(program));
        assertEquals(Integer.class, literal(copy, 0).value().getClass());
        assertEquals(Long.class, literal(copy, 1).value().getClass());
        assertEquals(Double.class, literal(copy, 2).value().getClass());
        assertEquals(new BigInteger("99999999999999999999"), literal(copy, 3).value());
    }

    @Test
    @DisplayName("Comments are written with their text and location")
    void testComments() throws Exception {
        Program program = new LanguageParser().parse("// first\nx = 1 /* multi\n line */");
        String text = serializer.serialize(program);
        JsonNode comment = mapper.readTree(text).get("statements").get(0);
        assertEquals("Comment", comment.get("type").asText());
        assertEquals("first", comment.get("text").asText());
        assertEquals(1, comment.get("loc").get("endLine").asInt());

        Program copy = deserializer.deserializeProgram(text);
        assertEquals(program, copy);
        assertEquals(new Comment("multi\n line"), copy.statements().get(2));
        assertEquals(program.statements().get(2).position(), copy.statements().get(2).position());
    }

    @Test
    @DisplayName("File names in locations are kept")
    void testFilename() {
        NumberLiteral literal = new NumberLiteral(4);
        literal.setPosition(new SourcePosition(3, 2, 3, 2, "prog.pseudo"));
        Node copy = deserializer.deserializeNode(serializer.serialize(literal));
        assertEquals(Optional.of("prog.pseudo"), copy.position().flatMap(SourcePosition::file));
    }

    @Test
    @DisplayName("Reading a specific node class")
    void testDeserializeByClass() {
        String json = serializer.serialize(new Var("x"));
        assertEquals(new Var("x"), deserializer.deserialize(json, Var.class));
        assertEquals(new Var("x"), deserializer.deserializeNode(json));

        AstJsonException e = assertThrows(AstJsonException.class, () -> deserializer.deserialize(json, ForLoop.class));
        assertTrue(e.getMessage().contains("ForLoop"), e.getMessage());
    }

    @Test
    @DisplayName("The ObjectMapper can be used directly")
    void testObjectMapper() throws Exception {
        ObjectMapper standalone = PseudoJackson.createObjectMapper();
        Program program = new LanguageParser().parse("if x { y = 1 }");
        Program copy = standalone.readValue(standalone.writeValueAsString(program), Program.class);
        assertEquals(program, copy);
    }

    @Test
    @DisplayName("Invalid JSON is reported as AstJsonException")
    void testInvalidJson() {
        assertThrows(AstJsonException.class, () -> deserializer.deserializeProgram("{ not json"));
        assertThrows(AstJsonException.class, () -> deserializer.deserializeProgram("{\"type\":\"Nope\"}"));
        assertThrows(AstJsonException.class, () -> deserializer.deserializeProgram("{\"statements\":[]}"));
        assertThrows(AstJsonException.class, () -> deserializer.deserializeNode("{\"type\":\"Var\"}"));
    }

    @Test
    @DisplayName("Provider is discovered through ServiceLoader")
    void testServiceLoader() {
        assertTrue(AstJsonProvider.isProviderAvailable());
        assertTrue(AstJsonProvider.getProviderNames().contains("Jackson"));
        assertInstanceOf(JacksonAstJsonProvider.class, AstJsonProvider.getProvider());
        assertEquals("Jackson", AstJsonProvider.getProvider("jackson").getName());

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> AstJsonProvider.getProvider("gson"));
        assertTrue(e.getMessage().contains("Jackson"), e.getMessage());
    }

    private static NumberLiteral literal(Program program, int statement) {
        return (NumberLiteral) ((Assignment) program.statements().get(statement)).value();
    }
}
