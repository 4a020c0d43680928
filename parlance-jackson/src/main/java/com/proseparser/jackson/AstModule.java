package com.proseparser.jackson;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.proseparser.Token;
import com.proseparser.ast.*;
import com.proseparser.jackson.mixins.NodeMixin;

import java.io.IOException;

/**
 * Jackson module for the program tree.
 *
 * This module handles:
 * - Polymorphic node types via NodeMixin
 * - Operators written as their symbols ("+", "and") and type tags as their keyword
 * - Explicit null for a declaration without a type
 * - Literal values that keep their Java type across a round trip
 */
public class AstModule extends SimpleModule {

    public AstModule() {
        super("AstModule", new Version(1, 0, 0, null, "com.proseparser", "parlance-jackson"));

        addSerializer(Operator.class, new OperatorSerializer());
        addDeserializer(Operator.class, new OperatorDeserializer());
        addSerializer(TypeTag.class, new TypeTagSerializer());
        addDeserializer(TypeTag.class, new TypeTagDeserializer());
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(Node.class, NodeMixin.class);
        context.setMixInAnnotations(Statement.class, NodeMixin.class);
        context.setMixInAnnotations(Expression.class, NodeMixin.class);

        context.setMixInAnnotations(VariableDeclaration.class, VariableDeclarationMixin.class);
        context.setMixInAnnotations(Literal.class, LiteralMixin.class);
        context.setMixInAnnotations(Token.class, TokenMixin.class);
    }

    // ==================== Mixins ====================

    // varType is written even when absent
    private abstract static class VariableDeclarationMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract TypeTag varType();
    }

    private abstract static class LiteralMixin {
        @JsonSerialize(using = LiteralValueSerializer.class)
        abstract Object value();
    }

    // isWord() would otherwise show up as a "word" property
    @JsonIgnoreProperties({"word"})
    private abstract static class TokenMixin {
    }

    // ==================== Enum codecs ====================

    private static class OperatorSerializer extends JsonSerializer<Operator> {
        @Override
        public void serialize(Operator value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
            gen.writeString(value.symbol());
        }
    }

    private static class OperatorDeserializer extends JsonDeserializer<Operator> {
        @Override
        public Operator deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            String symbol = p.getValueAsString();
            try {
                return Operator.fromSymbol(symbol);
            } catch (IllegalArgumentException e) {
                return (Operator) ctxt.handleWeirdStringValue(Operator.class, symbol, "not an operator symbol");
            }
        }
    }

    private static class TypeTagSerializer extends JsonSerializer<TypeTag> {
        @Override
        public void serialize(TypeTag value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
            gen.writeString(value.keyword());
        }
    }

    private static class TypeTagDeserializer extends JsonDeserializer<TypeTag> {
        @Override
        public TypeTag deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            String keyword = p.getValueAsString();
            TypeTag tag = keyword != null ? TypeTag.fromKeyword(keyword) : null;
            if (tag == null) {
                return (TypeTag) ctxt.handleWeirdStringValue(TypeTag.class, keyword, "not a type keyword");
            }
            return tag;
        }
    }
}
