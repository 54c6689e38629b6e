package com.simod.discovery.service.schema;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.function.Predicate;

/**
 * Value shapes accepted by the discovery configuration schema.
 *
 * Hyper-parameters the engine optimises may be given either as a single value
 * or as a list of candidate values, hence the {@code *_OR_LIST} variants.
 */
public enum FieldType {

    INTEGER("an integer", JsonNode::isIntegralNumber),
    NUMBER("a number", JsonNode::isNumber),
    BOOLEAN("a boolean", JsonNode::isBoolean),
    STRING("a string", JsonNode::isTextual),
    STRING_LIST("a list of strings", node -> isListOf(node, JsonNode::isTextual)),
    STRING_MAP("a mapping of strings", FieldType::isStringMap),
    MAPPING("a mapping", JsonNode::isObject),
    NUMBER_OR_LIST("a number or a list of numbers", node -> node.isNumber() || isListOf(node, JsonNode::isNumber)),
    BOOLEAN_OR_LIST("a boolean or a list of booleans", node -> node.isBoolean() || isListOf(node, JsonNode::isBoolean)),
    STRING_OR_LIST("a string or a list of strings", node -> node.isTextual() || isListOf(node, JsonNode::isTextual));

    private final String description;
    private final Predicate<JsonNode> matcher;

    FieldType(String description, Predicate<JsonNode> matcher) {
        this.description = description;
        this.matcher = matcher;
    }

    public String description() {
        return description;
    }

    /**
     * Whether the value has this shape. Explicit nulls are always accepted and
     * leave the engine's default in place.
     */
    public boolean accepts(JsonNode node) {
        return node == null || node.isNull() || matcher.test(node);
    }

    private static boolean isListOf(JsonNode node, Predicate<JsonNode> element) {
        if (!node.isArray()) {
            return false;
        }
        for (JsonNode item : node) {
            if (!element.test(item)) {
                return false;
            }
        }
        return true;
    }

    private static boolean isStringMap(JsonNode node) {
        if (!node.isObject()) {
            return false;
        }
        var values = node.elements();
        while (values.hasNext()) {
            JsonNode value = values.next();
            if (!value.isTextual() && !value.isNull()) {
                return false;
            }
        }
        return true;
    }
}
