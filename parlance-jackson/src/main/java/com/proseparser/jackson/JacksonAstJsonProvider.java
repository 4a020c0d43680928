package com.proseparser.jackson;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.proseparser.Token;
import com.proseparser.ast.Node;
import com.proseparser.ast.Program;
import com.proseparser.json.AstJsonDeserializer;
import com.proseparser.json.AstJsonException;
import com.proseparser.json.AstJsonProvider;
import com.proseparser.json.AstJsonSerializer;

import java.util.List;

/**
 * Jackson-based implementation of AstJsonProvider.
 */
public class JacksonAstJsonProvider implements AstJsonProvider {

    private final ObjectMapper mapper;
    private final AstJsonSerializer serializer;
    private final AstJsonDeserializer deserializer;

    public JacksonAstJsonProvider() {
        this(ParlanceJackson.createObjectMapper());
    }

    public JacksonAstJsonProvider(ObjectMapper mapper) {
        this.mapper = mapper;
        this.serializer = new JacksonSerializer(mapper);
        this.deserializer = new JacksonDeserializer(mapper);
    }

    @Override
    public AstJsonSerializer getSerializer() {
        return serializer;
    }

    @Override
    public AstJsonDeserializer getDeserializer() {
        return deserializer;
    }

    @Override
    public String getName() {
        return "Jackson";
    }

    public ObjectMapper getObjectMapper() {
        return mapper;
    }

    private static class JacksonSerializer implements AstJsonSerializer {
        private final ObjectMapper mapper;

        JacksonSerializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public String serialize(Node node) throws AstJsonException {
            return write(mapper.writer(), node, node.type());
        }

        @Override
        public String serializePretty(Node node) throws AstJsonException {
            return write(mapper.writerWithDefaultPrettyPrinter(), node, node.type());
        }

        @Override
        public String serializeTokens(List<Token> tokens, boolean pretty) throws AstJsonException {
            ObjectWriter writer = pretty ? mapper.writerWithDefaultPrettyPrinter() : mapper.writer();
            return write(writer.forType(mapper.getTypeFactory().constructCollectionType(List.class, Token.class)),
                tokens, "token list");
        }

        private static String write(ObjectWriter writer, Object value, String what) {
            try {
                return writer.writeValueAsString(value);
            } catch (Exception e) {
                throw new AstJsonException("Failed to serialize " + what, e);
            }
        }
    }

    private static class JacksonDeserializer implements AstJsonDeserializer {
        private final ObjectMapper mapper;

        JacksonDeserializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public Program deserializeProgram(String json) throws AstJsonException {
            return deserialize(json, Program.class);
        }

        @Override
        public <T extends Node> T deserialize(String json, Class<T> type) throws AstJsonException {
            try {
                return mapper.readValue(json, type);
            } catch (Exception e) {
                throw new AstJsonException("Failed to deserialize " + type.getSimpleName(), e);
            }
        }
    }
}
