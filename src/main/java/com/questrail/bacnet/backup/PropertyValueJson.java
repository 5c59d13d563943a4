package com.questrail.bacnet.backup;

import com.questrail.bacnet.api.ObjectIdentifier;
import com.questrail.bacnet.api.ObjectType;
import com.questrail.bacnet.api.PropertyValues;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Tagged JSON form of property values, so that a value read back has the same
 * Java type it was saved with.
 *
 * <pre>
 *   {"type": "real", "value": 72.5}
 *   {"type": "object-identifier", "value": {"type": "analog-value", "instance": 1}}
 *   {"type": "real", "value": "NaN"}
 *   {"type": "list", "value": [ ...tagged values... ]}
 *   {"type": "map", "value": [ {"key": ...tagged..., "value": ...tagged...} ]}
 * </pre>
 *
 * Non-finite reals and doubles are written as the strings {@code "NaN"},
 * {@code "Infinity"} and {@code "-Infinity"}. Covers the types accepted by
 * {@link PropertyValues}.
 */
final class PropertyValueJson
{
    static final String NULL = "null";
    static final String BOOLEAN = "boolean";
    static final String BYTE = "byte";
    static final String SHORT = "short";
    static final String SIGNED = "signed";
    static final String LONG = "long";
    static final String BIG_INTEGER = "big-integer";
    static final String REAL = "real";
    static final String DOUBLE = "double";
    static final String CHARACTER_STRING = "character-string";
    static final String OBJECT_IDENTIFIER = "object-identifier";
    static final String OBJECT_TYPE = "object-type";
    static final String LIST = "list";
    static final String SET = "set";
    static final String MAP = "map";

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private PropertyValueJson() {
    }

    static ObjectNode write(Object value) {
        ObjectNode node = NODES.objectNode();
        if (value == null) {
            node.put("type", NULL);
        }
        else if (value instanceof Boolean b) {
            node.put("type", BOOLEAN).put("value", b);
        }
        else if (value instanceof Byte b) {
            node.put("type", BYTE).put("value", b.intValue());
        }
        else if (value instanceof Short sh) {
            node.put("type", SHORT).put("value", sh);
        }
        else if (value instanceof Integer i) {
            node.put("type", SIGNED).put("value", i);
        }
        else if (value instanceof Long l) {
            node.put("type", LONG).put("value", l);
        }
        else if (value instanceof BigInteger big) {
            node.put("type", BIG_INTEGER).put("value", big);
        }
        else if (value instanceof Float f) {
            node.put("type", REAL);
            if (Float.isFinite(f)) {
                node.put("value", f);
            }
            else {
                node.put("value", f.toString());
            }
        }
        else if (value instanceof Double d) {
            node.put("type", DOUBLE);
            if (Double.isFinite(d)) {
                node.put("value", d);
            }
            else {
                node.put("value", d.toString());
            }
        }
        else if (value instanceof String s) {
            node.put("type", CHARACTER_STRING).put("value", s);
        }
        else if (value instanceof ObjectIdentifier id) {
            node.put("type", OBJECT_IDENTIFIER).set("value", writeIdentifier(id));
        }
        else if (value instanceof ObjectType t) {
            node.put("type", OBJECT_TYPE).put("value", t.kebabName());
        }
        else if (value instanceof List<?> list) {
            node.put("type", LIST).set("value", writeAll(list));
        }
        else if (value instanceof Set<?> set) {
            node.put("type", SET).set("value", writeAll(set));
        }
        else if (value instanceof Map<?, ?> map) {
            ArrayNode entries = NODES.arrayNode();
            map.forEach((k, v) -> entries.addObject().<ObjectNode>set("key", write(k)).set("value", write(v)));
            node.put("type", MAP).set("value", entries);
        }
        else {
            throw new IllegalArgumentException("cannot persist property value of type " + value.getClass().getName());
        }
        return node;
    }

    private static ArrayNode writeAll(Collection<?> values) {
        ArrayNode items = NODES.arrayNode();
        values.forEach(item -> items.add(write(item)));
        return items;
    }

    static Object read(JsonNode node) {
        String type = required(node, "type").asText();
        if (NULL.equals(type)) {
            return null;
        }
        JsonNode value = required(node, "value");
        switch (type) {
            case BOOLEAN:
                return value.booleanValue();
            case BYTE:
                return (byte) integral(value, Byte.MIN_VALUE, Byte.MAX_VALUE);
            case SHORT:
                return (short) integral(value, Short.MIN_VALUE, Short.MAX_VALUE);
            case SIGNED:
                return (int) integral(value, Integer.MIN_VALUE, Integer.MAX_VALUE);
            case LONG:
                return integral(value, Long.MIN_VALUE, Long.MAX_VALUE);
            case BIG_INTEGER:
                if (!value.isIntegralNumber()) {
                    throw new IllegalArgumentException("not an integer: " + value);
                }
                return value.bigIntegerValue();
            case REAL:
                return (float) floating(value);
            case DOUBLE:
                return floating(value);
            case CHARACTER_STRING:
                return value.asText();
            case OBJECT_IDENTIFIER:
                return readIdentifier(value);
            case OBJECT_TYPE:
                return ObjectType.fromKebabName(value.asText());
            case LIST: {
                List<Object> items = new ArrayList<>();
                value.forEach(item -> items.add(read(item)));
                return Collections.unmodifiableList(items);
            }
            case SET: {
                Set<Object> items = new LinkedHashSet<>();
                value.forEach(item -> items.add(read(item)));
                return Collections.unmodifiableSet(items);
            }
            case MAP: {
                Map<Object, Object> entries = new LinkedHashMap<>();
                for (JsonNode entry : value) {
                    entries.put(read(required(entry, "key")), read(required(entry, "value")));
                }
                return Collections.unmodifiableMap(entries);
            }
            default:
                throw new IllegalArgumentException("unknown property value type: " + type);
        }
    }

    private static long integral(JsonNode value, long min, long max) {
        if (!value.isIntegralNumber() || !value.canConvertToLong()) {
            throw new IllegalArgumentException("not an integer: " + value);
        }
        long n = value.longValue();
        if (n < min || n > max) {
            throw new IllegalArgumentException("integer out of range: " + n);
        }
        return n;
    }

    private static double floating(JsonNode value) {
        if (value.isNumber()) {
            return value.doubleValue();
        }
        switch (value.asText()) {
            case "NaN":
                return Double.NaN;
            case "Infinity":
                return Double.POSITIVE_INFINITY;
            case "-Infinity":
                return Double.NEGATIVE_INFINITY;
            default:
                throw new IllegalArgumentException("not a number: " + value);
        }
    }

    static ObjectNode writeIdentifier(ObjectIdentifier id) {
        return NODES.objectNode()
                .put("type", id.type().kebabName())
                .put("instance", id.instance());
    }

    static ObjectIdentifier readIdentifier(JsonNode node) {
        return ObjectIdentifier.of(
                ObjectType.fromKebabName(required(node, "type").asText()),
                required(node, "instance").intValue());
    }

    static JsonNode required(JsonNode node, String field) {
        JsonNode child = node.get(field);
        if (child == null) {
            throw new IllegalArgumentException("missing field '" + field + "'");
        }
        return child;
    }
}
