/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.courier.server.registry;

import com.courier.common.message.ValidationError;
import com.courier.common.util.JsonUtil;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Structural validation of JSON trees against record types, reporting every problem
 * rather than stopping at the first. {@link Optional} components may be absent or null;
 * all other components are required.
 */
final class PayloadValidator {

    private PayloadValidator() {}

    static List<ValidationError> validate(Class<?> recordType, JsonNode node, List<Object> loc) {
        List<ValidationError> errors = new ArrayList<>();
        validateRecord(recordType, node, loc, errors);
        return errors;
    }

    private static void validateRecord(Class<?> recordType, JsonNode node, List<Object> loc, List<ValidationError> errors) {
        if (node == null || !node.isObject()) {
            errors.add(error("model_type", "Input should be a valid dictionary or instance of "
                    + recordType.getSimpleName(), loc));
            return;
        }
        for (RecordComponent component : recordType.getRecordComponents()) {
            String name = propertyName(component);
            List<Object> path = append(loc, name);
            JsonNode value = node.get(name);
            Type type = component.getGenericType();
            if (isOptional(type)) {
                if (value != null && !value.isNull()) {
                    validateValue(typeArgument(type, 0), value, path, errors);
                }
            } else if (value == null) {
                errors.add(error("missing", "Field required", path));
            } else {
                validateValue(type, value, path, errors);
            }
        }
    }

    private static void validateValue(Type type, JsonNode value, List<Object> loc, List<ValidationError> errors) {
        Class<?> raw = rawClass(type);
        if (raw == Object.class || JsonNode.class.isAssignableFrom(raw)) {
            return;
        }
        if (isOptional(type)) {
            if (!value.isNull()) {
                validateValue(typeArgument(type, 0), value, loc, errors);
            }
            return;
        }
        if (value.isNull()) {
            errors.add(error(kindFor(raw), describe(raw), loc));
            return;
        }
        if (raw == String.class) {
            check(value.isTextual(), "string_type", "Input should be a valid string", loc, errors);
        } else if (raw == int.class || raw == Integer.class || raw == long.class || raw == Long.class
                || raw == short.class || raw == Short.class || raw == BigInteger.class) {
            check(value.isIntegralNumber(), "int_type", "Input should be a valid integer", loc, errors);
        } else if (raw == double.class || raw == Double.class || raw == float.class || raw == Float.class
                || raw == BigDecimal.class) {
            check(value.isNumber(), "float_type", "Input should be a valid number", loc, errors);
        } else if (raw == boolean.class || raw == Boolean.class) {
            check(value.isBoolean(), "bool_type", "Input should be a valid boolean", loc, errors);
        } else if (raw.isEnum()) {
            validateEnum(raw, value, loc, errors);
        } else if (raw.isRecord()) {
            validateRecord(raw, value, loc, errors);
        } else if (Collection.class.isAssignableFrom(raw)) {
            if (!value.isArray()) {
                errors.add(error("list_type", "Input should be a valid list", loc));
                return;
            }
            Type element = typeArgument(type, 0);
            for (int i = 0; i < value.size(); i++) {
                validateValue(element, value.get(i), append(loc, i), errors);
            }
        } else if (Map.class.isAssignableFrom(raw)) {
            if (!value.isObject()) {
                errors.add(error("dict_type", "Input should be a valid dictionary", loc));
                return;
            }
            Type valueType = typeArgument(type, 1);
            Iterator<Map.Entry<String, JsonNode>> fields = value.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> entry = fields.next();
                validateValue(valueType, entry.getValue(), append(loc, entry.getKey()), errors);
            }
        } else {
            try {
                JsonUtil.mapper().treeToValue(value, raw);
            } catch (JsonProcessingException | IllegalArgumentException e) {
                errors.add(error("value_error", "Value error, cannot read " + raw.getSimpleName(), loc));
            }
        }
    }

    private static void validateEnum(Class<?> raw, JsonNode value, List<Object> loc, List<ValidationError> errors) {
        List<String> names = Arrays.stream(raw.getEnumConstants())
                .map(c -> ((Enum<?>) c).name())
                .toList();
        if (!value.isTextual() || !names.contains(value.asText())) {
            String expected = names.stream().map(n -> "'" + n + "'").collect(Collectors.joining(", "));
            errors.add(error("enum", "Input should be " + expected, loc));
        }
    }

    private static void check(boolean ok, String type, String msg, List<Object> loc, List<ValidationError> errors) {
        if (!ok) {
            errors.add(error(type, msg, loc));
        }
    }

    private static String kindFor(Class<?> raw) {
        if (raw == String.class) return "string_type";
        if (raw == boolean.class || raw == Boolean.class) return "bool_type";
        if (raw.isRecord()) return "model_type";
        if (Collection.class.isAssignableFrom(raw)) return "list_type";
        if (Map.class.isAssignableFrom(raw)) return "dict_type";
        if (Number.class.isAssignableFrom(raw) || raw.isPrimitive()) return numericKind(raw);
        return "value_error";
    }

    private static String numericKind(Class<?> raw) {
        return raw == double.class || raw == Double.class || raw == float.class || raw == Float.class
                || raw == BigDecimal.class ? "float_type" : "int_type";
    }

    private static String describe(Class<?> raw) {
        return "Input should not be null, expected " + raw.getSimpleName();
    }

    private static String propertyName(RecordComponent component) {
        JsonProperty property = component.getAccessor().getAnnotation(JsonProperty.class);
        if (property != null && !property.value().isEmpty()) {
            return property.value();
        }
        return component.getName();
    }

    private static boolean isOptional(Type type) {
        return rawClass(type) == Optional.class;
    }

    private static Class<?> rawClass(Type type) {
        if (type instanceof Class<?> c) {
            return c;
        }
        if (type instanceof ParameterizedType p) {
            return (Class<?>) p.getRawType();
        }
        return Object.class;
    }

    private static Type typeArgument(Type type, int index) {
        if (type instanceof ParameterizedType p && p.getActualTypeArguments().length > index) {
            return p.getActualTypeArguments()[index];
        }
        return Object.class;
    }

    private static List<Object> append(List<Object> loc, Object segment) {
        List<Object> path = new ArrayList<>(loc.size() + 1);
        path.addAll(loc);
        path.add(segment);
        return path;
    }

    private static ValidationError error(String type, String msg, List<Object> loc) {
        return new ValidationError(type, loc, msg);
    }
}
