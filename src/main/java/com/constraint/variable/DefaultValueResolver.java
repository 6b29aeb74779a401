package com.constraint.variable;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Array;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.constraint.config.expression.DslSymbols.KEY_SEPARATOR;

/**
 * Default implementation of ValueResolver.
 * Walks {@link Map} keys, {@link List} and array indices, and Jackson {@link JsonNode} fields.
 */
public class DefaultValueResolver implements ValueResolver {

    private static final Logger log = LoggerFactory.getLogger(DefaultValueResolver.class);

    @Override
    public Object resolve(Object root, String path) {
        if (path == null || path.isEmpty()) {
            return unwrap(root);
        }

        Object current = root;
        for (String key : path.split("\\" + KEY_SEPARATOR, -1)) {
            current = child(current, key);
            if (MissingValue.isMissing(current)) {
                log.debug("Path '{}' does not resolve at segment '{}'", path, key);
                return MissingValue.INSTANCE;
            }
        }
        return unwrap(current);
    }

    private Object child(Object parent, String key) {
        if (parent == null || key.isEmpty()) {
            return MissingValue.INSTANCE;
        }
        if (parent instanceof Map<?, ?> map) {
            return map.containsKey(key) ? map.get(key) : MissingValue.INSTANCE;
        }
        if (parent instanceof JsonNode node) {
            JsonNode child = node.isArray() ? indexOf(key).map(i -> node.get(i.intValue())).orElse(null) : node.get(key);
            return child == null || child.isMissingNode() ? MissingValue.INSTANCE : child;
        }
        if (parent instanceof List<?> list) {
            return indexOf(key)
                    .filter(i -> i < list.size())
                    .<Object>map(list::get)
                    .orElse(MissingValue.INSTANCE);
        }
        if (parent.getClass().isArray()) {
            int size = Array.getLength(parent);
            return indexOf(key)
                    .filter(i -> i < size)
                    .map(i -> Array.get(parent, i))
                    .orElse(MissingValue.INSTANCE);
        }
        log.debug("Cannot look up '{}' in value of type {}", key, parent.getClass().getName());
        return MissingValue.INSTANCE;
    }

    private Optional<Integer> indexOf(String key) {
        try {
            int index = Integer.parseInt(key);
            return index >= 0 ? Optional.of(index) : Optional.empty();
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * Convert Jackson leaf nodes to plain Java values. Containers stay as nodes.
     */
    private Object unwrap(Object value) {
        if (!(value instanceof JsonNode node)) {
            return value;
        }
        if (node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.numberValue();
        }
        if (node.isTextual()) {
            return node.textValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        return node;
    }
}
