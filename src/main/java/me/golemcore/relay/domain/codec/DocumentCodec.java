package me.golemcore.relay.domain.codec;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.domain.exception.EncodingException;
import me.golemcore.relay.domain.model.GenericRecord;
import me.golemcore.relay.domain.model.RecordValue;
import me.golemcore.relay.domain.model.TypedField;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converts between {@link GenericRecord} and the store's typed field envelope.
 *
 * <p>
 * Encoding rules:
 * <ul>
 * <li>TEXT - {@code stringValue}</li>
 * <li>INTEGER - {@code integerValue} as decimal text</li>
 * <li>FLOAT - {@code doubleValue}</li>
 * <li>BOOLEAN - {@code booleanValue}</li>
 * <li>OPAQUE - {@code stringValue} holding the JSON text (opaque-as-text
 * policy: nested values are never rejected, they come back as text)</li>
 * </ul>
 *
 * <p>
 * A {@code timestamp} field with the server receipt time is always written and
 * replaces any client-supplied value.
 */
@Component
@Slf4j
public class DocumentCodec {

    public static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter
            .ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'")
            .withZone(ZoneOffset.UTC);

    private final Clock clock;

    public DocumentCodec(Clock clock) {
        this.clock = clock;
    }

    public Map<String, TypedField> encode(GenericRecord record) {
        Map<String, TypedField> fields = new LinkedHashMap<>();
        for (Map.Entry<String, RecordValue> entry : record.asMap().entrySet()) {
            fields.put(entry.getKey(), encodeValue(entry.getKey(), entry.getValue()));
        }
        if (fields.remove(GenericRecord.TIMESTAMP_FIELD) != null) {
            log.debug("[Codec] Replacing client-supplied timestamp");
        }
        fields.put(GenericRecord.TIMESTAMP_FIELD, TypedField.ofTimestamp(TIMESTAMP_FORMAT.format(clock.instant())));
        return fields;
    }

    private TypedField encodeValue(String key, RecordValue value) {
        return switch (value.getKind()) {
        case TEXT, OPAQUE -> TypedField.ofString(value.asText());
        case INTEGER -> TypedField.ofInteger(value.asInteger().toString());
        case FLOAT -> {
            double number = value.asDouble();
            if (!Double.isFinite(number)) {
                throw new EncodingException("Field '" + key + "' holds a non-finite number: " + number);
            }
            yield TypedField.ofDouble(number);
        }
        case BOOLEAN -> TypedField.ofBoolean(value.asBoolean());
        };
    }

    /**
     * Decodes a stored field map. The result starts with {@code id}; fields
     * without a recognised variant are dropped silently.
     */
    public GenericRecord decode(Map<String, TypedField> fields, String documentId) {
        GenericRecord record = GenericRecord.empty();
        record.put(GenericRecord.ID_FIELD, RecordValue.text(documentId));
        if (fields == null) {
            return record;
        }
        for (Map.Entry<String, TypedField> entry : fields.entrySet()) {
            RecordValue value = decodeValue(entry.getKey(), entry.getValue());
            if (value != null) {
                record.put(entry.getKey(), value);
            }
        }
        return record;
    }

    private RecordValue decodeValue(String key, TypedField field) {
        TypedField.Variant variant = field != null ? field.populatedVariant() : null;
        if (variant == null) {
            log.debug("[Codec] Skipping field '{}' without a supported value", key);
            return null;
        }
        return switch (variant) {
        case STRING -> RecordValue.text(field.getStringValue());
        case INTEGER -> parseInteger(key, field.getIntegerValue());
        case DOUBLE -> RecordValue.floating(field.getDoubleValue());
        case BOOLEAN -> RecordValue.bool(field.getBooleanValue());
        case TIMESTAMP -> RecordValue.text(field.getTimestampValue());
        };
    }

    private RecordValue parseInteger(String key, String decimal) {
        try {
            return RecordValue.integer(new BigInteger(decimal.trim()));
        } catch (NumberFormatException e) {
            log.debug("[Codec] Skipping field '{}' with malformed integer: {}", key, decimal);
            return null;
        }
    }
}
