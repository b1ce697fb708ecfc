package com.example.xssfilter.codec;

import com.example.xssfilter.models.JsonValue;
import com.example.xssfilter.sanitize.FieldPolicy;
import com.example.xssfilter.service.XssFilterException;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decodes JSON bodies into {@link JsonValue} trees and writes them back with every string leaf
 * run through the {@link FieldPolicy}. Uses Jackson's streaming API so number tokens keep their
 * literal text.
 */
public class JsonCodec {

    private static final JsonFactory FACTORY = JsonFactory.builder().build();

    /**
     * Sanitizes a whole body. The root must be an object or an array of objects.
     */
    public byte[] sanitize(byte[] body, FieldPolicy policy) {
        JsonValue root = decode(body);
        requireSupportedShape(root);
        return encode(root, policy);
    }

    public JsonValue decode(byte[] body) {
        try (JsonParser parser = FACTORY.createParser(body)) {
            JsonToken first = parser.nextToken();
            if (first == null) {
                throw XssFilterException.notJson(null);
            }
            JsonValue root = readValue(parser, first);
            if (parser.nextToken() != null) {
                // Content after the root value.
                throw XssFilterException.notJson(null);
            }
            return root;
        } catch (IOException ex) {
            throw XssFilterException.notJson(ex);
        }
    }

    public byte[] encode(JsonValue value, FieldPolicy policy) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (JsonGenerator generator = FACTORY.createGenerator(out)) {
            writeSanitized(generator, value, policy);
        } catch (IOException ex) {
            // Only a ByteArrayOutputStream sits underneath.
            throw new UncheckedIOException("Failed to encode JSON", ex);
        }
        return out.toByteArray();
    }

    static void requireSupportedShape(JsonValue root) {
        if (root instanceof JsonValue.Obj) {
            return;
        }
        if (root instanceof JsonValue.Array array) {
            for (JsonValue element : array.elements()) {
                if (!(element instanceof JsonValue.Obj)) {
                    throw XssFilterException.unsupportedValueShape("array element of kind " + element.kind());
                }
            }
            return;
        }
        throw XssFilterException.unsupportedValueShape(root.kind().name());
    }

    private JsonValue readValue(JsonParser parser, JsonToken token) throws IOException {
        switch (token) {
            case START_OBJECT -> {
                Map<String, JsonValue> members = new LinkedHashMap<>();
                while (parser.nextToken() == JsonToken.FIELD_NAME) {
                    String name = parser.currentName();
                    members.put(name, readValue(parser, parser.nextToken()));
                }
                return JsonValue.object(members);
            }
            case START_ARRAY -> {
                List<JsonValue> elements = new ArrayList<>();
                JsonToken next;
                while ((next = parser.nextToken()) != JsonToken.END_ARRAY) {
                    elements.add(readValue(parser, next));
                }
                return JsonValue.array(elements);
            }
            case VALUE_STRING -> {
                return JsonValue.string(parser.getText());
            }
            case VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT -> {
                return JsonValue.number(parser.getText());
            }
            case VALUE_TRUE -> {
                return JsonValue.bool(true);
            }
            case VALUE_FALSE -> {
                return JsonValue.bool(false);
            }
            case VALUE_NULL -> {
                return JsonValue.nullValue();
            }
            default -> throw XssFilterException.notJson(null);
        }
    }

    private void writeSanitized(JsonGenerator generator, JsonValue value, FieldPolicy policy) throws IOException {
        if (value instanceof JsonValue.Obj obj) {
            generator.writeStartObject();
            for (Map.Entry<String, JsonValue> member : obj.members().entrySet()) {
                generator.writeFieldName(member.getKey());
                if (policy.isSkipped(member.getKey())) {
                    writeVerbatim(generator, member.getValue());
                } else {
                    writeSanitized(generator, member.getValue(), policy);
                }
            }
            generator.writeEndObject();
        } else if (value instanceof JsonValue.Array array) {
            generator.writeStartArray();
            for (JsonValue element : array.elements()) {
                writeSanitized(generator, element, policy);
            }
            generator.writeEndArray();
        } else if (value instanceof JsonValue.Str str) {
            generator.writeString(policy.sanitize(str.text()));
        } else if (value instanceof JsonValue.Num num) {
            generator.writeNumber(policy.sanitize(num.literal()));
        } else if (value instanceof JsonValue.Bool bool) {
            generator.writeBoolean(bool.value());
        } else {
            generator.writeNull();
        }
    }

    private void writeVerbatim(JsonGenerator generator, JsonValue value) throws IOException {
        if (value instanceof JsonValue.Obj obj) {
            generator.writeStartObject();
            for (Map.Entry<String, JsonValue> member : obj.members().entrySet()) {
                generator.writeFieldName(member.getKey());
                writeVerbatim(generator, member.getValue());
            }
            generator.writeEndObject();
        } else if (value instanceof JsonValue.Array array) {
            generator.writeStartArray();
            for (JsonValue element : array.elements()) {
                writeVerbatim(generator, element);
            }
            generator.writeEndArray();
        } else if (value instanceof JsonValue.Str str) {
            generator.writeString(str.text());
        } else if (value instanceof JsonValue.Num num) {
            generator.writeNumber(num.literal());
        } else if (value instanceof JsonValue.Bool bool) {
            generator.writeBoolean(bool.value());
        } else {
            generator.writeNull();
        }
    }
}
