package com.e2eq.restcore.util;

import com.google.common.html.HtmlEscapers;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.text.StringEscapeUtils;
import org.bson.types.ObjectId;
import org.jetbrains.annotations.Nullable;

import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Lenient parsers used for request input and query string coercion.
 *
 * <p>Every parser takes the raw value plus a default and returns the default instead of throwing
 * when the value can not be interpreted. Raw values may be {@code String}, {@code byte[]} (decoded
 * as UTF-8) or an already typed value.</p>
 */
public final class ParseUtils {

    public static final Pattern PHONE_RE = Pattern.compile("^\\+?([0-9 ])+$");
    public static final Pattern PHONE_9_RE = Pattern.compile("^\\+?([0-9 ]){9}$");
    public static final Pattern TAG_RE = Pattern.compile("(<!--.*?-->|<[^>]*>)");

    private static final Pattern UUID_HEX = Pattern.compile("^[0-9a-fA-F]{32}$");
    private static final Pattern INTEGER_RE = Pattern.compile("^[+-]?\\d+$");
    private static final Pattern DECIMAL_RE = Pattern.compile("^[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?$");
    private static final Set<String> TRUE_STRINGS = Set.of("1", "True", "true");

    private static final DateTimeFormatter ISO_LENIENT = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart()
                .optionalStart().appendLiteral('T').optionalEnd()
                .optionalStart().appendLiteral(' ').optionalEnd()
                .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalEnd()
            .optionalStart().appendPattern("[XXX][XX][X]").optionalEnd()
            .toFormatter();

    private ParseUtils() {
    }

    @Nullable
    public static String asText(@Nullable Object value) {
        if (value instanceof String) {
            return (String) value;
        }
        if (value instanceof byte[]) {
            return new String((byte[]) value, StandardCharsets.UTF_8);
        }
        return null;
    }

    /**
     * Parses a UUID in any of the common textual forms: canonical with dashes, 32 hex digits,
     * wrapped in braces or prefixed with {@code urn:uuid:}.
     */
    public static UUID parseUuid(@Nullable Object value, @Nullable UUID defaultValue) {
        if (value instanceof UUID) {
            return (UUID) value;
        }
        String text = asText(value);
        if (text == null) {
            return defaultValue;
        }
        String hex = text.replace("urn:", "").replace("uuid:", "");
        hex = hex.replaceAll("^\\{+|}+$", "").replace("-", "");
        if (!UUID_HEX.matcher(hex).matches()) {
            return defaultValue;
        }
        return new UUID(Long.parseUnsignedLong(hex.substring(0, 16), 16),
                Long.parseUnsignedLong(hex.substring(16), 16));
    }

    @Nullable
    public static UUID parseUuid(@Nullable Object value) {
        return parseUuid(value, null);
    }

    public static ObjectId parseObjectId(@Nullable Object value, @Nullable ObjectId defaultValue) {
        if (value instanceof ObjectId) {
            return (ObjectId) value;
        }
        String text = asText(value);
        if (text == null || !ObjectId.isValid(text)) {
            return defaultValue;
        }
        return new ObjectId(text);
    }

    @Nullable
    public static ObjectId parseObjectId(@Nullable Object value) {
        return parseObjectId(value, null);
    }

    /**
     * Booleans pass through, whole numbers are {@code true} only when equal to 1, strings are
     * {@code true} for "1", "True" and "true" and {@code false} otherwise. Any other type yields the
     * default.
     */
    public static Boolean parseBool(@Nullable Object value, @Nullable Boolean defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue() == 1L;
        }
        String text = asText(value);
        if (text != null) {
            return TRUE_STRINGS.contains(text);
        }
        return defaultValue;
    }

    @Nullable
    public static Boolean parseBool(@Nullable Object value) {
        return parseBool(value, null);
    }

    /**
     * Whole number parsing. Decimal numbers are truncated, decimal strings are rejected.
     */
    public static Long parseLong(@Nullable Object value, @Nullable Long defaultValue) {
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            return Double.isFinite(d) ? (long) d : defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        String text = asText(value);
        if (text == null) {
            return defaultValue;
        }
        text = text.trim();
        if (!INTEGER_RE.matcher(text).matches()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(text.startsWith("+") ? text.substring(1) : text);
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    @Nullable
    public static Long parseLong(@Nullable Object value) {
        return parseLong(value, null);
    }

    public static Double parseDouble(@Nullable Object value, @Nullable Double defaultValue) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        String text = asText(value);
        if (text == null) {
            return defaultValue;
        }
        text = text.trim();
        if (!DECIMAL_RE.matcher(text).matches()) {
            return defaultValue;
        }
        return Double.parseDouble(text);
    }

    @Nullable
    public static Double parseDouble(@Nullable Object value) {
        return parseDouble(value, null);
    }

    /**
     * Parses an ISO-8601 date or date-time. A value without zone information is taken as UTC and a
     * bare date as midnight UTC.
     */
    public static OffsetDateTime parseDate(@Nullable Object value, @Nullable OffsetDateTime defaultValue) {
        if (value instanceof OffsetDateTime) {
            return (OffsetDateTime) value;
        }
        String text = asText(value);
        if (StringUtils.isBlank(text)) {
            return defaultValue;
        }
        try {
            TemporalAccessor parsed = ISO_LENIENT.parseBest(text.trim(), OffsetDateTime::from, LocalDateTime::from, LocalDate::from);
            if (parsed instanceof OffsetDateTime) {
                return (OffsetDateTime) parsed;
            } else if (parsed instanceof LocalDateTime) {
                return ((LocalDateTime) parsed).atOffset(ZoneOffset.UTC);
            } else {
                return ((LocalDate) parsed).atStartOfDay().atOffset(ZoneOffset.UTC);
            }
        } catch (DateTimeParseException e) {
            return defaultValue;
        }
    }

    @Nullable
    public static OffsetDateTime parseDate(@Nullable Object value) {
        return parseDate(value, null);
    }

    public static Long parseDateToUnixTs(@Nullable Object value, @Nullable Long defaultValue) {
        OffsetDateTime dateTime = parseDate(value);
        return dateTime == null ? defaultValue : getUnixTimestamp(dateTime);
    }

    /**
     * Seconds since the epoch for the given instant, or for now when {@code dateTime} is null.
     */
    public static long getUnixTimestamp(@Nullable OffsetDateTime dateTime) {
        return dateTime == null ? System.currentTimeMillis() / 1000L : dateTime.toEpochSecond();
    }

    @Nullable
    public static String parsePhoneNumber(@Nullable Object value, boolean nineDigits) {
        if (!(value instanceof String)) {
            return null;
        }
        String phone = (String) value;
        Pattern pattern = nineDigits ? PHONE_9_RE : PHONE_RE;
        return pattern.matcher(phone).matches() ? phone : null;
    }

    /**
     * Drops markup tags and comments, then HTML-escapes whatever text is left. Entities already in
     * the text are decoded first, so running it over its own output changes nothing.
     */
    public static String removeTags(@Nullable String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String plain = StringEscapeUtils.unescapeHtml4(TAG_RE.matcher(text).replaceAll(""));
        return HtmlEscapers.htmlEscaper().escape(plain);
    }
}
