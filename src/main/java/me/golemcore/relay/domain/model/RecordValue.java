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

import java.math.BigInteger;
import java.util.Objects;

/**
 * Single scalar value of a {@link GenericRecord}.
 *
 * <p>
 * Closed set of kinds: every consumer switches on {@link Kind} exhaustively
 * instead of inspecting runtime types. Nested structures never appear as such;
 * they are carried as {@link Kind#OPAQUE} holding their canonical JSON text.
 *
 * <p>
 * OPAQUE is stored as plain text and reads back as TEXT, so equality treats the
 * two kinds as one: values compare by content.
 */
public final class RecordValue {

    public enum Kind {
        TEXT, INTEGER, FLOAT, BOOLEAN, OPAQUE
    }

    private final Kind kind;
    private final Object value;

    private RecordValue(Kind kind, Object value) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.value = Objects.requireNonNull(value, "value");
    }

    public static RecordValue text(String value) {
        return new RecordValue(Kind.TEXT, value);
    }

    public static RecordValue integer(long value) {
        return new RecordValue(Kind.INTEGER, BigInteger.valueOf(value));
    }

    public static RecordValue integer(BigInteger value) {
        return new RecordValue(Kind.INTEGER, value);
    }

    public static RecordValue floating(double value) {
        return new RecordValue(Kind.FLOAT, value);
    }

    public static RecordValue bool(boolean value) {
        return new RecordValue(Kind.BOOLEAN, value);
    }

    /**
     * Nested object, array or null, kept as its JSON serialization.
     */
    public static RecordValue opaque(String json) {
        return new RecordValue(Kind.OPAQUE, json);
    }

    public Kind getKind() {
        return kind;
    }

    public String asText() {
        requireKind(Kind.TEXT, Kind.OPAQUE);
        return (String) value;
    }

    public BigInteger asInteger() {
        requireKind(Kind.INTEGER);
        return (BigInteger) value;
    }

    public double asDouble() {
        requireKind(Kind.FLOAT);
        return (Double) value;
    }

    public boolean asBoolean() {
        requireKind(Kind.BOOLEAN);
        return (Boolean) value;
    }

    /**
     * Plain Java value for JSON output: String, BigInteger, Double or Boolean.
     */
    public Object toPlain() {
        return value;
    }

    private void requireKind(Kind... expected) {
        for (Kind candidate : expected) {
            if (candidate == kind) {
                return;
            }
        }
        throw new IllegalStateException("Value of kind " + kind + " requested as " + expected[0]);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RecordValue)) {
            return false;
        }
        RecordValue other = (RecordValue) o;
        return equalityKind() == other.equalityKind() && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(equalityKind(), value);
    }

    private Kind equalityKind() {
        return kind == Kind.OPAQUE ? Kind.TEXT : kind;
    }

    @Override
    public String toString() {
        return kind + "(" + value + ")";
    }
}
