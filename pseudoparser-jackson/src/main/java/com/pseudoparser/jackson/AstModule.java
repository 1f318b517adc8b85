package com.pseudoparser.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.DeserializationConfig;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.Deserializers;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.pseudoparser.ast.Node;
import com.pseudoparser.json.AstJsonException;

import java.io.IOException;

/**
 * Jackson module for the AST classes.
 *
 * Every {@link Node} subtype is written through {@link AstJsonWriter} and read
 * through {@link AstJsonReader}, so the JSON form is the same whichever node
 * class is requested.
 */
public class AstModule extends SimpleModule {

    public AstModule() {
        super("AstModule", new Version(1, 0, 0, null, "com.pseudoparser", "pseudoparser-jackson"));
        addSerializer(Node.class, new NodeSerializer());
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);
        context.addDeserializers(new NodeDeserializers());
    }

    // ==================== Serialization ====================

    static class NodeSerializer extends StdSerializer<Node> {

        private final AstJsonWriter writer = new AstJsonWriter();

        NodeSerializer() {
            super(Node.class);
        }

        @Override
        public void serialize(Node value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeTree(writer.write(value));
        }
    }

    // ==================== Deserialization ====================

    private static class NodeDeserializers extends Deserializers.Base {

        @Override
        public JsonDeserializer<?> findBeanDeserializer(
            JavaType type,
            DeserializationConfig config,
            BeanDescription beanDesc
        ) throws JsonMappingException {
            Class<?> raw = type.getRawClass();
            if (Node.class.isAssignableFrom(raw)) {
                return new NodeDeserializer(raw);
            }
            return null;
        }
    }

    static class NodeDeserializer extends StdDeserializer<Node> {

        private final AstJsonReader reader = new AstJsonReader();

        NodeDeserializer(Class<?> expected) {
            super(expected);
        }

        @Override
        public Node deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            JsonNode tree = ctxt.readTree(p);
            Node node;
            try {
                node = reader.read(tree);
            } catch (AstJsonException e) {
                throw JsonMappingException.from(p, e.getMessage(), e);
            }
            if (!handledType().isInstance(node)) {
                throw JsonMappingException.from(p,
                    "Expected " + handledType().getSimpleName() + " but found " + node.type());
            }
            return node;
        }
    }
}
