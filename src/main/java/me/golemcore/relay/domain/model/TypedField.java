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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Typed field envelope of the document store, e.g.
 * {@code {"integerValue": "30"}}.
 *
 * <p>
 * Fields built through the factory methods carry exactly one variant. Fields
 * read from the wire may carry none (unsupported types such as
 * {@code mapValue}); {@link #populatedVariant()} then returns {@code null}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class TypedField {

    public enum Variant {
        STRING, INTEGER, DOUBLE, BOOLEAN, TIMESTAMP
    }

    private String stringValue;
    private String integerValue;
    private Double doubleValue;
    private Boolean booleanValue;
    private String timestampValue;

    public static TypedField ofString(String value) {
        return new TypedField(value, null, null, null, null);
    }

    /**
     * Integers travel as decimal text.
     */
    public static TypedField ofInteger(String decimal) {
        return new TypedField(null, decimal, null, null, null);
    }

    public static TypedField ofDouble(double value) {
        return new TypedField(null, null, value, null, null);
    }

    public static TypedField ofBoolean(boolean value) {
        return new TypedField(null, null, null, value, null);
    }

    public static TypedField ofTimestamp(String instant) {
        return new TypedField(null, null, null, null, instant);
    }

    /**
     * First populated variant in declaration order, or {@code null} if none.
     */
    public Variant populatedVariant() {
        if (stringValue != null) {
            return Variant.STRING;
        }
        if (integerValue != null) {
            return Variant.INTEGER;
        }
        if (doubleValue != null) {
            return Variant.DOUBLE;
        }
        if (booleanValue != null) {
            return Variant.BOOLEAN;
        }
        if (timestampValue != null) {
            return Variant.TIMESTAMP;
        }
        return null;
    }
}
