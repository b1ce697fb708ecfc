package com.example.xssfilter.models;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Decoded JSON document. Numbers keep the literal text they were parsed from so that
 * re-encoding never goes through a binary float, and objects keep their keys in input order.
 */
public sealed interface JsonValue
        permits JsonValue.Null, JsonValue.Bool, JsonValue.Num, JsonValue.Str, JsonValue.Array, JsonValue.Obj {

    enum Kind {
        NULL,
        BOOL,
        NUMBER,
        STRING,
        ARRAY,
        OBJECT
    }

    Kind kind();

    /**
     * Plain text rendering of a scalar; containers render as their JSON-ish shape.
     */
    String asText();

    static JsonValue nullValue() {
        return Null.INSTANCE;
    }

    static JsonValue bool(boolean value) {
        return value ? Bool.TRUE : Bool.FALSE;
    }

    static JsonValue number(String literal) {
        return new Num(literal);
    }

    static JsonValue string(String text) {
        return new Str(text);
    }

    static JsonValue array(List<JsonValue> elements) {
        return new Array(elements);
    }

    static JsonValue object(Map<String, JsonValue> members) {
        return new Obj(members);
    }

    final class Null implements JsonValue {
        private static final Null INSTANCE = new Null();

        private Null() {
        }

        @Override
        public Kind kind() {
            return Kind.NULL;
        }

        @Override
        public String asText() {
            return "null";
        }

        @Override
        public String toString() {
            return "null";
        }
    }

    record Bool(boolean value) implements JsonValue {
        private static final Bool TRUE = new Bool(true);
        private static final Bool FALSE = new Bool(false);

        @Override
        public Kind kind() {
            return Kind.BOOL;
        }

        @Override
        public String asText() {
            return Boolean.toString(value);
        }
    }

    record Num(String literal) implements JsonValue {
        public Num {
            Objects.requireNonNull(literal, "literal");
            if (literal.isEmpty()) {
                throw new IllegalArgumentException("number literal must be non-empty");
            }
        }

        @Override
        public Kind kind() {
            return Kind.NUMBER;
        }

        @Override
        public String asText() {
            return literal;
        }
    }

    record Str(String text) implements JsonValue {
        public Str {
            Objects.requireNonNull(text, "text");
        }

        @Override
        public Kind kind() {
            return Kind.STRING;
        }

        @Override
        public String asText() {
            return text;
        }
    }

    record Array(List<JsonValue> elements) implements JsonValue {
        public Array {
            elements = List.copyOf(elements);
        }

        public int size() {
            return elements.size();
        }

        public JsonValue get(int index) {
            return elements.get(index);
        }

        @Override
        public Kind kind() {
            return Kind.ARRAY;
        }

        @Override
        public String asText() {
            return elements.toString();
        }
    }

    record Obj(Map<String, JsonValue> members) implements JsonValue {
        public Obj {
            Objects.requireNonNull(members, "members");
            // Map.copyOf would lose the insertion order.
            members = Collections.unmodifiableMap(new LinkedHashMap<>(members));
        }

        public JsonValue get(String name) {
            return members.get(name);
        }

        public boolean isEmpty() {
            return members.isEmpty();
        }

        @Override
        public Kind kind() {
            return Kind.OBJECT;
        }

        @Override
        public String asText() {
            return members.toString();
        }
    }
}
