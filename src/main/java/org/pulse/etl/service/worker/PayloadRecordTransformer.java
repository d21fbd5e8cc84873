package org.pulse.etl.service.worker;

import org.pulse.etl.exceptions.RecordValidationException;
import org.pulse.etl.models.dto.TransformedRecord;
import org.pulse.etl.service.extraction.ExtractionClient;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keys each API item by its stable identifier and rewrites timestamp fields to ISO-8601 UTC.
 */
@Component
public class PayloadRecordTransformer implements RecordTransformer {

    private static final List<String> KEY_FIELDS = List.of("node_id", "id", "key");
    private static final long EPOCH_MILLIS_THRESHOLD = 100_000_000_000L;
    // Jira style offsets: 2024-03-01T10:15:30.000+0000
    private static final DateTimeFormatter COMPACT_OFFSET = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSZ");

    @Override
    public TransformedRecord transform(String entityType, Map<String, Object> item) {
        if (item == null || item.isEmpty()) {
            throw new RecordValidationException(null, "Empty " + entityType + " item");
        }
        String key = KEY_FIELDS.stream()
                .map(item::get)
                .filter(value -> value != null && !value.toString().isBlank())
                .map(Object::toString)
                .findFirst()
                .orElseThrow(() -> new RecordValidationException(null,
                        entityType + " item has none of the identifier fields " + KEY_FIELDS));

        Map<String, Object> payload = normalize(item);
        payload.remove(ExtractionClient.NESTED_CURSORS);
        return new TransformedRecord(entityType, key, payload);
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> normalize(Map<String, Object> source) {
        Map<String, Object> normalized = new LinkedHashMap<>();
        source.forEach((field, value) -> {
            if (value instanceof Map<?, ?> nested) {
                normalized.put(field, normalize((Map<String, Object>) nested));
            } else if (value instanceof List<?> list) {
                List<Object> items = new ArrayList<>();
                for (Object element : list) {
                    items.add(element instanceof Map<?, ?> map ? normalize((Map<String, Object>) map) : element);
                }
                normalized.put(field, items);
            } else if (isTimestampField(field)) {
                normalized.put(field, normalizeTimestamp(value));
            } else {
                normalized.put(field, value);
            }
        });
        return normalized;
    }

    private static boolean isTimestampField(String field) {
        String lower = field.toLowerCase();
        return lower.endsWith("_at") || field.endsWith("At") || lower.endsWith("date")
                || lower.equals("created") || lower.equals("updated");
    }

    private static Object normalizeTimestamp(Object value) {
        if (value instanceof Number number && Math.abs(number.longValue()) >= EPOCH_MILLIS_THRESHOLD) {
            return Instant.ofEpochMilli(number.longValue()).toString();
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return OffsetDateTime.parse(text).toInstant().toString();
            } catch (DateTimeParseException notIso) {
                try {
                    return OffsetDateTime.parse(text, COMPACT_OFFSET).toInstant().toString();
                } catch (DateTimeParseException notCompact) {
                    return text;
                }
            }
        }
        return value;
    }
}
