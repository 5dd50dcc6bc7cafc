package com.buildsync.model;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;

/**
 * Writes an identifier key as a JSON number when it is all digits (e.g. "7" → 7), otherwise as a string.
 * Use as {@code @JsonSerialize(contentUsing = IdentifierSerializer.class)} on id lists.
 */
public final class IdentifierSerializer extends JsonSerializer<String> {

    @Override
    public void serialize(String value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
        if (Identifiers.isNumeric(value)) {
            gen.writeNumber(Long.parseLong(value));
        } else {
            gen.writeString(value);
        }
    }
}
