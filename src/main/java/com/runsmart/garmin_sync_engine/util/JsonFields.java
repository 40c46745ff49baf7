package com.runsmart.garmin_sync_engine.util;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.function.Supplier;

/**
 * Best-effort field extraction over upstream JSON. Each getter walks its candidate paths in
 * order and returns the first value that parses; dotted paths descend into nested objects.
 * Nothing here throws on unexpected shapes.
 */
public final class JsonFields {

    /** 9999-12-31T23:59:59Z; anything later is not a real timestamp. */
    static final long MAX_EPOCH_SECONDS = 253_402_300_799L;

    private JsonFields() {
    }

    public static JsonNode at(JsonNode node, String path) {
        if (node == null || path == null) {
            return null;
        }
        JsonNode current = node;
        for (String part : path.split("\\.")) {
            if (current == null || !current.isObject()) {
                return null;
            }
            current = current.get(part);
        }
        return current == null || current.isNull() || current.isMissingNode() ? null : current;
    }

    public static Double firstDouble(JsonNode node, String... paths) {
        for (String path : paths) {
            Double value = toDouble(at(node, path));
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    public static Integer firstInteger(JsonNode node, String... paths) {
        return roundToInt(firstDouble(node, paths));
    }

    /** Rounded value, or null when it does not fit in an int. */
    public static Integer roundToInt(Double value) {
        if (value == null || !Double.isFinite(value)) {
            return null;
        }
        long rounded = Math.round(value);
        return rounded < Integer.MIN_VALUE || rounded > Integer.MAX_VALUE ? null : (int) rounded;
    }

    public static String firstText(JsonNode node, String... paths) {
        for (String path : paths) {
            JsonNode value = at(node, path);
            if (value == null) {
                continue;
            }
            if (value.isTextual() && !value.asText().isBlank()) {
                return value.asText().trim();
            }
            if (value.isNumber()) {
                return value.isIntegralNumber() ? String.valueOf(value.asLong()) : value.asText();
            }
        }
        return null;
    }

    public static Instant firstEpochSeconds(JsonNode node, String... paths) {
        return epochSeconds(firstDouble(node, paths));
    }

    /** Positive epoch seconds up to year 9999, else null. */
    public static Instant epochSeconds(Double seconds) {
        if (seconds == null || !(seconds > 0) || seconds > MAX_EPOCH_SECONDS) {
            return null;
        }
        return Instant.ofEpochSecond(seconds.longValue());
    }

    public static Instant firstIsoInstant(JsonNode node, String... paths) {
        for (String path : paths) {
            String text = firstText(node, path);
            Instant parsed = parseInstant(text);
            if (parsed != null) {
                return parsed;
            }
        }
        return null;
    }

    public static LocalDate firstDate(JsonNode node, String... paths) {
        for (String path : paths) {
            String text = firstText(node, path);
            if (text == null || text.length() < 10) {
                continue;
            }
            LocalDate parsed = orNull(() -> LocalDate.parse(text.substring(0, 10)));
            if (parsed != null) {
                return parsed;
            }
        }
        return null;
    }

    /**
     * Accepts an array of objects, a single object wrapping the first nested array, or anything
     * else (empty result).
     */
    public static List<JsonNode> rows(JsonNode value) {
        List<JsonNode> rows = new ArrayList<>();
        if (value == null) {
            return rows;
        }
        if (value.isArray()) {
            collectObjects(value, rows);
            return rows;
        }
        if (value.isObject()) {
            Iterator<JsonNode> nested = value.elements();
            while (nested.hasNext()) {
                JsonNode candidate = nested.next();
                if (candidate.isArray()) {
                    collectObjects(candidate, rows);
                    return rows;
                }
            }
        }
        return rows;
    }

    private static void collectObjects(JsonNode array, List<JsonNode> out) {
        for (JsonNode entry : array) {
            if (entry.isObject() && entry.size() > 0) {
                out.add(entry);
            }
        }
    }

    private static Double toDouble(JsonNode value) {
        if (value == null) {
            return null;
        }
        if (value.isNumber()) {
            double d = value.asDouble();
            return Double.isFinite(d) ? d : null;
        }
        if (value.isTextual()) {
            try {
                double d = Double.parseDouble(value.asText().trim());
                return Double.isFinite(d) ? d : null;
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static Instant parseInstant(String text) {
        if (text == null) {
            return null;
        }
        Instant instant = orNull(() -> Instant.parse(text));
        if (instant == null) {
            instant = orNull(() -> OffsetDateTime.parse(text).toInstant());
        }
        if (instant == null) {
            instant = orNull(() -> LocalDateTime.parse(text.replace(' ', 'T')).toInstant(ZoneOffset.UTC));
        }
        if (instant == null || instant.getEpochSecond() > MAX_EPOCH_SECONDS) {
            return null;
        }
        return instant;
    }

    private static <T> T orNull(Supplier<T> parse) {
        try {
            return parse.get();
        } catch (DateTimeException e) {
            return null;
        }
    }
}
