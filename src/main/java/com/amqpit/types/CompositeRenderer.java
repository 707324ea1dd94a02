package com.amqpit.types;

import com.amqpit.errors.InteropTestException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Renders AMQP lists and maps into JSON.
 *
 * Nested members may only be lists, maps or strings. Nested arrays are skipped,
 * anything else is rejected with an {@code IncorrectValueTypeError}. This is narrower
 * than what the top-level dispatch in {@link AmqpTypeName} accepts.
 */
public final class CompositeRenderer {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private CompositeRenderer() {
    }

    public static ArrayNode renderList(List<?> list) {
        ArrayNode json = NODES.arrayNode();
        for (Object element : list) {
            JsonNode rendered = renderMember(element);
            if (rendered != null) {
                json.add(rendered);
            }
        }
        return json;
    }

    /**
     * Members are emitted in ascending key order.
     */
    public static ObjectNode renderMap(Map<?, ?> map) {
        Map<String, JsonNode> sorted = new TreeMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            if (!(entry.getKey() instanceof String)) {
                throw InteropTestException.incorrectValueType(AmqpTypeName.describe(entry.getKey()) + " (map key)");
            }
            JsonNode rendered = renderMember(entry.getValue());
            if (rendered != null) {
                sorted.put((String) entry.getKey(), rendered);
            }
        }
        ObjectNode json = NODES.objectNode();
        sorted.forEach(json::set);
        return json;
    }

    /**
     * Returns null for members that are skipped.
     */
    private static JsonNode renderMember(Object member) {
        AmqpTypeName type = AmqpTypeName.of(member);
        if (type == null) {
            throw InteropTestException.incorrectValueType(AmqpTypeName.describe(member));
        }
        switch (type) {
            case LIST:
                return renderList((List<?>) member);
            case MAP:
                return renderMap((Map<?, ?>) member);
            case ARRAY:
                return null;
            case STRING:
                return NODES.textNode((String) member);
            default:
                throw InteropTestException.incorrectValueType(type.getName());
        }
    }
}
