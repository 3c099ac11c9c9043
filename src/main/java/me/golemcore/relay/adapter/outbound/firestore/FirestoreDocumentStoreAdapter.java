package me.golemcore.relay.adapter.outbound.firestore;

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
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.domain.codec.DocumentCodec;
import me.golemcore.relay.domain.exception.OperationTimeoutException;
import me.golemcore.relay.domain.exception.StoreOperationException;
import me.golemcore.relay.domain.model.GenericRecord;
import me.golemcore.relay.domain.model.SigningIdentity;
import me.golemcore.relay.domain.model.StoredDocument;
import me.golemcore.relay.domain.model.TypedField;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import me.golemcore.relay.infrastructure.http.OkHttpConfig;
import me.golemcore.relay.port.outbound.CredentialPort;
import me.golemcore.relay.port.outbound.DocumentStorePort;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Firestore REST v1 adapter.
 *
 * <p>
 * Endpoints, relative to
 * {@code {base-url}/projects/{project}/databases/{database}/documents}:
 * <ul>
 * <li>POST /{collection} - create a document with a generated id</li>
 * <li>GET /{collection} - list the documents of a collection, following
 * {@code nextPageToken} until the last page</li>
 * </ul>
 *
 * <p>
 * {@code collection} may be a subcollection path such as
 * {@code users/u1/events}; each segment is encoded separately.
 *
 * <p>
 * Every call first obtains a bearer token from the {@link CredentialPort}. A
 * 401 drops the cached token so the next call re-authenticates; the failed
 * call itself is not retried.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code relay.firestore.project-id} - Google Cloud project</li>
 * <li>{@code relay.firestore.base-url} - REST API root</li>
 * <li>{@code relay.firestore.database} - database id, {@code (default)}</li>
 * </ul>
 *
 * @see DocumentCodec
 */
@Component
@Slf4j
public class FirestoreDocumentStoreAdapter implements DocumentStorePort {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final RelayProperties properties;
    private final CredentialPort credentialPort;
    private final DocumentCodec codec;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Executor executor;
    private final SigningIdentity identity;

    public FirestoreDocumentStoreAdapter(RelayProperties properties, CredentialPort credentialPort,
            DocumentCodec codec, OkHttpClient httpClient, ObjectMapper objectMapper,
            @Qualifier(OkHttpConfig.IO_EXECUTOR) Executor executor) {
        this.properties = properties;
        this.credentialPort = credentialPort;
        this.codec = codec;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.executor = executor;
        this.identity = properties.getAuth().toSigningIdentity();
    }

    @Override
    public CompletableFuture<StoredDocument> createDocument(String collection, GenericRecord record) {
        return credentialPort.getToken(identity)
                .thenApplyAsync(token -> doCreate(collection, record, token), executor);
    }

    @Override
    public CompletableFuture<List<GenericRecord>> listDocuments(String collection) {
        return credentialPort.getToken(identity)
                .thenApplyAsync(token -> doList(collection, token), executor);
    }

    private StoredDocument doCreate(String collection, GenericRecord record, String token) {
        Map<String, TypedField> fields = codec.encode(record);
        try {
            String body = objectMapper.writeValueAsString(new CreateRequest(fields));
            Request request = authorized(collectionUrl(collection), token)
                    .post(RequestBody.create(body, JSON))
                    .build();

            String responseStr = execute(request, "create");
            StoredDocument document = objectMapper.readValue(responseStr, StoredDocument.class);
            log.info("[Firestore] Created {}/{} ({} fields)", collection, document.getId(), fields.size());
            return document;
        } catch (InterruptedIOException e) {
            throw new OperationTimeoutException("Store create timed out", e);
        } catch (IOException e) {
            log.warn("[Firestore] Create error: {}", e.getMessage());
            throw new StoreOperationException("Store create failed: " + e.getMessage(), e);
        }
    }

    private List<GenericRecord> doList(String collection, String token) {
        List<GenericRecord> records = new ArrayList<>();
        Set<String> seenPageTokens = new HashSet<>();
        String pageToken = null;
        try {
            do {
                HttpUrl.Builder url = collectionUrl(collection).newBuilder();
                if (pageToken != null) {
                    url.addQueryParameter("pageToken", pageToken);
                }
                Request request = authorized(url.build(), token).get().build();
                ListResponse page = objectMapper.readValue(execute(request, "list"), ListResponse.class);
                if (page == null) {
                    break;
                }
                // absent "documents" is how the store reports an empty collection
                if (page.getDocuments() != null) {
                    for (StoredDocument document : page.getDocuments()) {
                        records.add(codec.decode(document.getFields(), document.getId()));
                    }
                }
                String next = page.getNextPageToken();
                if (next == null || next.isBlank()) {
                    pageToken = null;
                } else if (!seenPageTokens.add(next)) {
                    log.warn("[Firestore] Page token repeated while listing {}, stopping after {} documents",
                            collection, records.size());
                    pageToken = null;
                } else {
                    pageToken = next;
                }
            } while (pageToken != null);
        } catch (InterruptedIOException e) {
            throw new OperationTimeoutException("Store list timed out", e);
        } catch (IOException e) {
            log.warn("[Firestore] List error: {}", e.getMessage());
            throw new StoreOperationException("Store list failed: " + e.getMessage(), e);
        }
        log.debug("[Firestore] Listed {} documents from {}", records.size(), collection);
        return records;
    }

    private String execute(Request request, String operation) throws IOException {
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            String responseStr = body != null ? body.string() : "";
            if (!response.isSuccessful()) {
                log.warn("[Firestore] {} failed: HTTP {}", operation, response.code());
                if (response.code() == 401) {
                    credentialPort.invalidate(identity);
                }
                throw new StoreOperationException(operation, response.code(), responseStr);
            }
            return responseStr;
        }
    }

    private Request.Builder authorized(HttpUrl url, String token) {
        return new Request.Builder()
                .url(url)
                .header("Authorization", "Bearer " + token)
                .header("Accept", "application/json");
    }

    HttpUrl collectionUrl(String collection) {
        RelayProperties.FirestoreProperties firestore = properties.getFirestore();
        if (firestore.getProjectId() == null || firestore.getProjectId().isBlank()) {
            throw new IllegalStateException("relay.firestore.project-id is not configured");
        }
        HttpUrl base = HttpUrl.parse(firestore.getBaseUrl());
        if (base == null) {
            throw new IllegalStateException("Invalid relay.firestore.base-url: " + firestore.getBaseUrl());
        }
        return base.newBuilder()
                .addPathSegment("projects")
                .addPathSegment(firestore.getProjectId())
                .addPathSegment("databases")
                .addPathSegment(firestore.getDatabase())
                .addPathSegment("documents")
                .addPathSegments(trimSlashes(collection))
                .build();
    }

    private static String trimSlashes(String collection) {
        if (collection == null || collection.isBlank()) {
            throw new IllegalArgumentException("Collection path must not be blank");
        }
        int start = 0;
        int end = collection.length();
        while (start < end && collection.charAt(start) == '/') {
            start++;
        }
        while (end > start && collection.charAt(end - 1) == '/') {
            end--;
        }
        if (start == end) {
            throw new IllegalArgumentException("Collection path must not be blank");
        }
        return collection.substring(start, end);
    }

    // Request/response DTOs
    record CreateRequest(Map<String, TypedField> fields) {
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ListResponse {
        private List<StoredDocument> documents;
        private String nextPageToken;
    }
}
