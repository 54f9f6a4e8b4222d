package de.mirkosertic.mcp.memoryindex.mcp;

import io.modelcontextprotocol.spec.McpSchema;
import org.jspecify.annotations.Nullable;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Derives MCP tool input schemas from request records.
 * <p>
 * Record components become properties; components without {@code @Nullable} are required. Nested records
 * (also as list elements) are inlined with their own required list. Enum constants are offered in lower case,
 * matching how the request records parse them.
 */
public final class SchemaGenerator {

    private SchemaGenerator() {
    }

    public static McpSchema.JsonSchema generateSchema(final Class<? extends Record> recordClass) {
        final Map<String, Object> properties = new LinkedHashMap<>();
        final List<String> required = new ArrayList<>();
        describeComponents(recordClass, properties, required);
        return new McpSchema.JsonSchema("object", properties, required, null, null, null);
    }

    public static McpSchema.JsonSchema emptySchema() {
        return new McpSchema.JsonSchema("object", Map.of(), List.of(), null, null, null);
    }

    private static void describeComponents(final Class<?> recordClass, final Map<String, Object> properties,
                                           final List<String> required) {
        for (final RecordComponent component : recordClass.getRecordComponents()) {
            final Map<String, Object> property = typeSchema(component.getGenericType());
            final Description description = component.getAnnotation(Description.class);
            if (description != null) {
                property.put("description", description.value());
            }
            properties.put(component.getName(), property);
            if (!isNullable(component)) {
                required.add(component.getName());
            }
        }
    }

    private static boolean isNullable(final RecordComponent component) {
        return component.isAnnotationPresent(Nullable.class)
                || component.getAnnotatedType().isAnnotationPresent(Nullable.class);
    }

    private static Map<String, Object> typeSchema(final Type type) {
        final Map<String, Object> schema = new LinkedHashMap<>();
        if (type instanceof ParameterizedType parameterized
                && parameterized.getRawType() instanceof Class<?> raw) {
            if (Collection.class.isAssignableFrom(raw)) {
                schema.put("type", "array");
                schema.put("items", typeSchema(parameterized.getActualTypeArguments()[0]));
            } else if (Map.class.isAssignableFrom(raw)) {
                schema.put("type", "object");
                schema.put("additionalProperties", true);
            } else {
                schema.put("type", "object");
            }
            return schema;
        }
        if (!(type instanceof Class<?> clazz)) {
            schema.put("type", "string");
            return schema;
        }

        if (clazz == String.class) {
            schema.put("type", "string");
        } else if (clazz == Integer.class || clazz == int.class || clazz == Long.class || clazz == long.class) {
            schema.put("type", "integer");
        } else if (clazz == Double.class || clazz == double.class || clazz == Float.class || clazz == float.class) {
            schema.put("type", "number");
        } else if (clazz == Boolean.class || clazz == boolean.class) {
            schema.put("type", "boolean");
        } else if (clazz.isEnum()) {
            schema.put("type", "string");
            final List<String> values = new ArrayList<>();
            for (final Object constant : clazz.getEnumConstants()) {
                values.add(((Enum<?>) constant).name().toLowerCase(Locale.ROOT));
            }
            schema.put("enum", values);
        } else if (clazz.isRecord()) {
            final Map<String, Object> properties = new LinkedHashMap<>();
            final List<String> required = new ArrayList<>();
            describeComponents(clazz, properties, required);
            schema.put("type", "object");
            schema.put("properties", properties);
            if (!required.isEmpty()) {
                schema.put("required", required);
            }
        } else {
            schema.put("type", "object");
        }
        return schema;
    }
}
