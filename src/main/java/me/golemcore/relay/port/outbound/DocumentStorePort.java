package me.golemcore.relay.port.outbound;

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

import me.golemcore.relay.domain.model.GenericRecord;
import me.golemcore.relay.domain.model.StoredDocument;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Port for the remote document store. Collections are addressed by plain name;
 * no transport concerns leak through this interface.
 */
public interface DocumentStorePort {

    /**
     * Create a document with a store-assigned id.
     *
     * @param collection
     *            collection name
     * @param record
     *            record to store; a server-side {@code timestamp} is added
     * @return the created document with its resource path and metadata
     */
    CompletableFuture<StoredDocument> createDocument(String collection, GenericRecord record);

    /**
     * Fetch all documents of a collection in the store's native order.
     *
     * @param collection
     *            collection name
     * @return decoded records, each carrying its document id under {@code id};
     *         empty for an empty collection
     */
    CompletableFuture<List<GenericRecord>> listDocuments(String collection);
}
