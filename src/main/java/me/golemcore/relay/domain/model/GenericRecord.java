package me.golemcore.relay.domain.model;

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

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Schemaless record as received from the ingestion endpoint or read back from
 * the document store. Keys are unique; insertion order is preserved.
 */
public final class GenericRecord {

    public static final String ID_FIELD = "id";
    public static final String TIMESTAMP_FIELD = "timestamp";

    private final Map<String, RecordValue> values;

    private GenericRecord(Map<String, RecordValue> values) {
        this.values = values;
    }

    public static GenericRecord empty() {
        return new GenericRecord(new LinkedHashMap<>());
    }

    public static GenericRecord of(Map<String, RecordValue> values) {
        return new GenericRecord(new LinkedHashMap<>(values));
    }

    /**
     * Converts an inbound JSON object into a record.
     *
     * <p>
     * Numbers without a fractional component become integers (so {@code 30.0}
     * is stored as {@code 30}); other numbers become floats. Objects, arrays and
     * null are kept as their JSON text.
     *
     * @throws IllegalArgumentException
     *             if the payload is not a JSON object
     */
    public static GenericRecord fromJson(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("Payload must be a JSON object");
        }
        GenericRecord result = empty();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            result.put(field.getKey(), toValue(field.getValue()));
        }
        return result;
    }

    private static RecordValue toValue(JsonNode node) {
        if (node.isTextual()) {
            return RecordValue.text(node.textValue());
        }
        if (node.isIntegralNumber()) {
            return RecordValue.integer(node.bigIntegerValue());
        }
        if (node.isNumber()) {
            BigDecimal decimal = node.decimalValue();
            if (isWhole(decimal)) {
                return RecordValue.integer(decimal.toBigIntegerExact());
            }
            return RecordValue.floating(node.doubleValue());
        }
        if (node.isBoolean()) {
            return RecordValue.bool(node.booleanValue());
        }
        return RecordValue.opaque(node.toString());
    }

    private static boolean isWhole(BigDecimal decimal) {
        return decimal.signum() == 0 || decimal.stripTrailingZeros().scale() <= 0;
    }

    public GenericRecord put(String key, RecordValue value) {
        values.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
        return this;
    }

    public Optional<RecordValue> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    public boolean containsKey(String key) {
        return values.containsKey(key);
    }

    public int size() {
        return values.size();
    }

    public Map<String, RecordValue> asMap() {
        return Collections.unmodifiableMap(values);
    }

    /**
     * Copy of this record without the given key.
     */
    public GenericRecord without(String key) {
        GenericRecord copy = of(values);
        copy.values.remove(key);
        return copy;
    }

    /**
     * Plain map view for JSON serialization.
     */
    public Map<String, Object> toPlainMap() {
        Map<String, Object> plain = new LinkedHashMap<>();
        values.forEach((key, value) -> plain.put(key, value.toPlain()));
        return plain;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GenericRecord)) {
            return false;
        }
        return values.equals(((GenericRecord) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "GenericRecord" + values;
    }
}
