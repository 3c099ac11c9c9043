package me.golemcore.relay.domain.service;

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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.domain.exception.DocumentStoreException;
import me.golemcore.relay.domain.model.GenericRecord;
import me.golemcore.relay.domain.model.RecordValue;
import me.golemcore.relay.domain.model.StoredDocument;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import me.golemcore.relay.port.outbound.DocumentStorePort;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Ingestion and retrieval of records in the configured collection
 * ({@code relay.firestore.collection}).
 *
 * <p>
 * Listing never fails: when the store is unreachable the error is logged and an
 * empty list is returned, so views render an empty state instead of an error.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentService {

    private static final Comparator<GenericRecord> NEWEST_FIRST = Comparator
            .comparing(DocumentService::timestampOf, Comparator.nullsLast(Comparator.reverseOrder()));

    private final DocumentStorePort documentStorePort;
    private final RelayProperties properties;

    /**
     * Stores an inbound JSON object.
     *
     * @throws IllegalArgumentException
     *             if the payload is not a JSON object
     */
    public CompletableFuture<StoredDocument> receive(JsonNode payload) {
        GenericRecord record = GenericRecord.fromJson(payload);
        String collection = properties.getFirestore().getCollection();
        log.debug("[Relay] Storing {} fields into {}", record.size(), collection);
        return documentStorePort.createDocument(collection, record);
    }

    /**
     * All records of the collection, newest {@code timestamp} first. Records
     * without a parsable timestamp come last in store order.
     */
    public CompletableFuture<List<GenericRecord>> listRecent() {
        String collection = properties.getFirestore().getCollection();
        return documentStorePort.listDocuments(collection)
                .thenApply(DocumentService::sortNewestFirst)
                .exceptionally(throwable -> {
                    Throwable cause = DocumentStoreException.unwrap(throwable);
                    log.warn("[Relay] Listing {} failed, returning no data: {}", collection, cause.getMessage());
                    return List.of();
                });
    }

    static List<GenericRecord> sortNewestFirst(List<GenericRecord> records) {
        List<GenericRecord> sorted = new ArrayList<>(records);
        sorted.sort(NEWEST_FIRST);
        return sorted;
    }

    private static Instant timestampOf(GenericRecord record) {
        RecordValue value = record.get(GenericRecord.TIMESTAMP_FIELD).orElse(null);
        if (value == null || value.getKind() != RecordValue.Kind.TEXT) {
            return null;
        }
        try {
            return Instant.parse(value.asText());
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
