package me.golemcore.agentloop.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.agentloop.domain.model.ToolDefinition;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Validates tool arguments against the JSON Schema subset tools declare in
 * {@link ToolDefinition#getInputSchema()}.
 *
 * <p>
 * Supported keywords: {@code properties}, {@code required}, {@code type}
 * (string, integer, number, boolean, array, object), {@code enum},
 * {@code minLength}, {@code maxLength}, {@code minimum}, {@code maximum},
 * {@code default} and {@code additionalProperties: false}. Unknown keywords
 * are ignored.
 */
@Component
public class ToolArgumentValidator {

    private static final String KEY_PROPERTIES = "properties";
    private static final String KEY_REQUIRED = "required";
    private static final String KEY_TYPE = "type";

    /**
     * Returns a validated copy of the arguments with schema defaults applied.
     *
     * @throws ToolInputValidationException
     *             listing every violation found
     */
    public Map<String, Object> validate(ToolDefinition definition, Map<String, Object> arguments) {
        Map<String, Object> args = arguments != null ? arguments : Map.of();
        Map<String, Object> schema = definition.getInputSchema();
        Map<String, Object> validated = new LinkedHashMap<>(args);
        if (schema == null || schema.isEmpty()) {
            return validated;
        }

        List<String> violations = new ArrayList<>();
        Map<String, Object> properties = asMap(schema.get(KEY_PROPERTIES));

        for (String required : asStringList(schema.get(KEY_REQUIRED))) {
            if (args.get(required) == null) {
                violations.add(required + ": is required");
            }
        }

        for (Map.Entry<String, Object> property : properties.entrySet()) {
            String name = property.getKey();
            Map<String, Object> propertySchema = asMap(property.getValue());
            Object value = args.get(name);
            if (value == null) {
                if (propertySchema.containsKey("default")) {
                    validated.put(name, propertySchema.get("default"));
                }
                continue;
            }
            validateValue(name, value, propertySchema, violations);
        }

        if (Boolean.FALSE.equals(schema.get("additionalProperties"))) {
            for (String name : args.keySet()) {
                if (!properties.containsKey(name)) {
                    violations.add(name + ": is not an allowed property");
                }
            }
        }

        if (!violations.isEmpty()) {
            throw new ToolInputValidationException(definition.getName(), violations);
        }
        return validated;
    }

    private void validateValue(String path, Object value, Map<String, Object> schema, List<String> violations) {
        Object type = schema.get(KEY_TYPE);
        if (type instanceof String expected && !matchesType(expected, value)) {
            violations.add(path + ": expected " + expected + " but was " + describe(value));
            return;
        }

        Object allowed = schema.get("enum");
        if (allowed instanceof Collection<?> values && !values.contains(value)) {
            violations.add(path + ": must be one of " + values);
        }

        if (value instanceof String text) {
            Integer minLength = asInteger(schema.get("minLength"));
            Integer maxLength = asInteger(schema.get("maxLength"));
            if (minLength != null && text.length() < minLength) {
                violations.add(path + ": length must be at least " + minLength);
            }
            if (maxLength != null && text.length() > maxLength) {
                violations.add(path + ": length must be at most " + maxLength);
            }
        }

        if (value instanceof Number number) {
            BigDecimal actual = new BigDecimal(number.toString());
            Object minimum = schema.get("minimum");
            Object maximum = schema.get("maximum");
            if (minimum instanceof Number min && actual.compareTo(new BigDecimal(min.toString())) < 0) {
                violations.add(path + ": must be >= " + min);
            }
            if (maximum instanceof Number max && actual.compareTo(new BigDecimal(max.toString())) > 0) {
                violations.add(path + ": must be <= " + max);
            }
        }

        if (value instanceof Map<?, ?> nested && schema.containsKey(KEY_PROPERTIES)) {
            Map<String, Object> nestedProperties = asMap(schema.get(KEY_PROPERTIES));
            for (String required : asStringList(schema.get(KEY_REQUIRED))) {
                if (nested.get(required) == null) {
                    violations.add(path + "." + required + ": is required");
                }
            }
            for (Map.Entry<String, Object> property : nestedProperties.entrySet()) {
                Object nestedValue = nested.get(property.getKey());
                if (nestedValue != null) {
                    validateValue(path + "." + property.getKey(), nestedValue, asMap(property.getValue()),
                            violations);
                }
            }
        }

        if (value instanceof List<?> items && schema.get("items") instanceof Map<?, ?>) {
            Map<String, Object> itemSchema = asMap(schema.get("items"));
            for (int i = 0; i < items.size(); i++) {
                if (items.get(i) != null) {
                    validateValue(path + "[" + i + "]", items.get(i), itemSchema, violations);
                }
            }
        }
    }

    private boolean matchesType(String expected, Object value) {
        return switch (expected) {
        case "string" -> value instanceof String;
        case "integer" -> isInteger(value);
        case "number" -> value instanceof Number;
        case "boolean" -> value instanceof Boolean;
        case "array" -> value instanceof List<?>;
        case "object" -> value instanceof Map<?, ?>;
        default -> true;
        };
    }

    private boolean isInteger(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof Byte || value instanceof BigInteger) {
            return true;
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            return !Double.isInfinite(d) && d == Math.rint(d);
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.stripTrailingZeros().scale() <= 0;
        }
        return false;
    }

    private String describe(Object value) {
        if (value instanceof String) {
            return "string";
        }
        if (value instanceof Boolean) {
            return "boolean";
        }
        if (value instanceof Number) {
            return "number";
        }
        if (value instanceof List<?>) {
            return "array";
        }
        if (value instanceof Map<?, ?>) {
            return "object";
        }
        return value.getClass().getSimpleName();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value) {
        if (value instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        return Map.of();
    }

    private static List<String> asStringList(Object value) {
        if (!(value instanceof Collection<?> values)) {
            return List.of();
        }
        List<String> result = new ArrayList<>();
        for (Object item : values) {
            if (item != null) {
                result.add(item.toString());
            }
        }
        return result;
    }

    private static Integer asInteger(Object value) {
        return value instanceof Number number ? number.intValue() : null;
    }
}
