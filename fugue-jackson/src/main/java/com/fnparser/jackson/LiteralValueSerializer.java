package com.fnparser.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;

/**
 * Writes the decoded value of a literal. Character code points are written as strings.
 */
public class LiteralValueSerializer extends JsonSerializer<Object> {
    @Override
    public void serialize(Object value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
        if (value == null) {
            gen.writeNull();
        } else if (value instanceof Long l) {
            gen.writeNumber(l);
        } else if (value instanceof Short s) {
            gen.writeNumber(s);
        } else if (value instanceof Double d) {
            if (d.isInfinite() || d.isNaN()) {
                gen.writeString(d.toString());
            } else {
                gen.writeNumber(d);
            }
        } else if (value instanceof Integer codePoint) {
            gen.writeString(Character.toString(codePoint));
        } else if (value instanceof String s) {
            gen.writeString(s);
        } else {
            gen.writeObject(value);
        }
    }
}
