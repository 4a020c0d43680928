package com.proseparser.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;
import java.math.BigInteger;

/**
 * Writes a literal's value so that it reads back as the same Java type: integers without
 * a decimal point, doubles always with one ({@code 5.0}, never {@code 5}).
 */
public class LiteralValueSerializer extends JsonSerializer<Object> {
    @Override
    public void serialize(Object value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
        if (value instanceof Double d) {
            if (d.isInfinite() || d.isNaN()) {
                // not representable in JSON
                gen.writeNull();
            } else {
                gen.writeNumber(d);
            }
        } else if (value instanceof Long l) {
            gen.writeNumber(l);
        } else if (value instanceof BigInteger bi) {
            gen.writeNumber(bi);
        } else if (value instanceof Boolean b) {
            gen.writeBoolean(b);
        } else if (value instanceof String s) {
            gen.writeString(s);
        } else {
            gen.writeObject(value);
        }
    }
}
