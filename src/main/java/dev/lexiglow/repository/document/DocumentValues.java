package dev.lexiglow.repository.document;

import org.bson.Document;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Date;

/**
 * Value conversions between entity fields and BSON. Timestamps are stored as BSON dates
 * interpreted as UTC; enums by name.
 */
final class DocumentValues {

    static final String ID = "_id";

    private DocumentValues() {
    }

    static Date toDate(LocalDateTime value) {
        return value != null ? Date.from(value.toInstant(ZoneOffset.UTC)) : null;
    }

    static LocalDateTime toLocalDateTime(Date value) {
        return value != null ? LocalDateTime.ofInstant(value.toInstant(), ZoneOffset.UTC) : null;
    }

    static LocalDateTime getDateTime(Document document, String key) {
        return toLocalDateTime(document.getDate(key));
    }

    static String enumName(Enum<?> value) {
        return value != null ? value.name() : null;
    }

    static <E extends Enum<E>> E getEnum(Document document, String key, Class<E> type) {
        String value = document.getString(key);
        return value != null ? Enum.valueOf(type, value) : null;
    }

    static Double getDouble(Document document, String key) {
        Object value = document.get(key);
        return value instanceof Number number ? number.doubleValue() : null;
    }

    static Integer getInteger(Document document, String key) {
        Object value = document.get(key);
        return value instanceof Number number ? number.intValue() : null;
    }

    /**
     * Escapes regular expression metacharacters so {@code value} matches literally.
     */
    static String escapeRegex(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 8);
        for (char c : value.toCharArray()) {
            if ("\\^$.|?*+()[]{}".indexOf(c) >= 0) {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.toString();
    }
}
