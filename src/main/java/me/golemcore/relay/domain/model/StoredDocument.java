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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Document as returned by the store. The last segment of the resource path is
 * the document id.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class StoredDocument {

    @JsonProperty("name")
    private String resourcePath;

    @Builder.Default
    private Map<String, TypedField> fields = new LinkedHashMap<>();

    @JsonProperty("createTime")
    private String createdAt;

    @JsonProperty("updateTime")
    private String updatedAt;

    @JsonIgnore
    public String getId() {
        return idOf(resourcePath);
    }

    /**
     * Trailing path segment of a resource name, {@code null} for a null name.
     */
    public static String idOf(String resourcePath) {
        if (resourcePath == null) {
            return null;
        }
        int slash = resourcePath.lastIndexOf('/');
        return slash >= 0 ? resourcePath.substring(slash + 1) : resourcePath;
    }
}
