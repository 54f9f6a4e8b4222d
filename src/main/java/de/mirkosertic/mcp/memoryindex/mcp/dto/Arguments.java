package de.mirkosertic.mcp.memoryindex.mcp.dto;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Typed access to the loosely typed argument map of a tool call. JSON numbers arrive as any
 * {@link Number} subtype, so everything numeric is converted.
 */
final class Arguments {

    private Arguments() {
    }

    static @Nullable String string(final Map<String, Object> args, final String key) {
        final Object value = args.get(key);
        return value == null ? null : value.toString();
    }

    static String requireString(final Map<String, Object> args, final String key) {
        final String value = string(args, key);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(key + " is required");
        }
        return value;
    }

    static @Nullable Integer integer(final Map<String, Object> args, final String key) {
        final Object value = args.get(key);
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value instanceof String text && !text.isBlank()) {
            return Integer.valueOf(text.trim());
        }
        return null;
    }

    static @Nullable Double decimal(final Map<String, Object> args, final String key) {
        final Object value = args.get(key);
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String text && !text.isBlank()) {
            return Double.valueOf(text.trim());
        }
        return null;
    }

    static long requireLong(final Map<String, Object> args, final String key) {
        final Object value = args.get(key);
        if (value instanceof Number number) {
            return number.longValue();
        }
        if (value instanceof String text && !text.isBlank()) {
            return Long.parseLong(text.trim());
        }
        throw new IllegalArgumentException(key + " is required");
    }

    static @Nullable Boolean bool(final Map<String, Object> args, final String key) {
        final Object value = args.get(key);
        if (value instanceof Boolean flag) {
            return flag;
        }
        if (value instanceof String text && !text.isBlank()) {
            return Boolean.valueOf(text.trim());
        }
        return null;
    }

    static @Nullable List<String> stringList(final Map<String, Object> args, final String key) {
        final Object value = args.get(key);
        if (value instanceof List<?> items) {
            final List<String> result = new ArrayList<>(items.size());
            for (final Object item : items) {
                if (item != null) {
                    result.add(item.toString());
                }
            }
            return result;
        }
        if (value instanceof String text && !text.isBlank()) {
            return List.of(text.split(","));
        }
        return null;
    }

    @SuppressWarnings("unchecked")
    static List<Map<String, Object>> objectList(final Map<String, Object> args, final String key) {
        final Object value = args.get(key);
        if (!(value instanceof List<?> items)) {
            return List.of();
        }
        final List<Map<String, Object>> result = new ArrayList<>(items.size());
        for (final Object item : items) {
            if (item instanceof Map<?, ?> map) {
                result.add((Map<String, Object>) map);
            }
        }
        return result;
    }

    static int limit(final @Nullable Integer requested, final int defaultValue, final int maximum) {
        return (requested != null && requested > 0) ? Math.min(requested, maximum) : defaultValue;
    }

    static int offset(final @Nullable Integer requested) {
        return (requested != null && requested >= 0) ? requested : 0;
    }
}
