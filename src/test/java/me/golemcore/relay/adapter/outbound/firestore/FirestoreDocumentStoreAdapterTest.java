package me.golemcore.relay.adapter.outbound.firestore;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.relay.domain.codec.DocumentCodec;
import me.golemcore.relay.domain.exception.AuthenticationException;
import me.golemcore.relay.domain.exception.OperationTimeoutException;
import me.golemcore.relay.domain.exception.StoreOperationException;
import me.golemcore.relay.domain.model.GenericRecord;
import me.golemcore.relay.domain.model.RecordValue;
import me.golemcore.relay.domain.model.StoredDocument;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import me.golemcore.relay.port.outbound.CredentialPort;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okhttp3.mockwebserver.SocketPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class FirestoreDocumentStoreAdapterTest {

    private static final String COLLECTION = "received_data";
    private static final String COLLECTION_PATH = "/v1/projects/test-project/databases/(default)/documents/"
            + COLLECTION;
    private static final String DOC_PREFIX = "projects/test-project/databases/(default)/documents/received_data/";
    private static final String CONTENT_TYPE = "Content-Type";
    private static final String APPLICATION_JSON = "application/json";
    private static final Instant NOW = Instant.parse("2026-05-01T12:00:00.250Z");

    private MockWebServer mockServer;
    private ExecutorService executor;
    private CredentialPort credentialPort;
    private RelayProperties properties;
    private ObjectMapper objectMapper;
    private FirestoreDocumentStoreAdapter adapter;

    @BeforeEach
    void setUp() throws IOException {
        mockServer = new MockWebServer();
        mockServer.start();
        executor = Executors.newCachedThreadPool();
        objectMapper = new ObjectMapper();

        properties = new RelayProperties();
        properties.getFirestore().setProjectId("test-project");
        properties.getFirestore().setBaseUrl(mockServer.url("/v1").toString());
        properties.getAuth().setClientEmail("relay@test-project.iam.gserviceaccount.com");

        credentialPort = mock(CredentialPort.class);
        when(credentialPort.getToken(any())).thenReturn(CompletableFuture.completedFuture("test-token"));

        adapter = newAdapter();
    }

    @AfterEach
    void tearDown() throws IOException {
        executor.shutdownNow();
        mockServer.shutdown();
    }

    private FirestoreDocumentStoreAdapter newAdapter() {
        return newAdapter(5000);
    }

    private FirestoreDocumentStoreAdapter newAdapter(long callTimeoutMillis) {
        OkHttpClient client = new OkHttpClient.Builder()
                .callTimeout(callTimeoutMillis, TimeUnit.MILLISECONDS)
                .retryOnConnectionFailure(false)
                .build();
        return new FirestoreDocumentStoreAdapter(properties, credentialPort,
                new DocumentCodec(Clock.fixed(NOW, ZoneOffset.UTC)), client, objectMapper, executor);
    }

    private void enqueueJson(String body) {
        mockServer.enqueue(new MockResponse().setBody(body).addHeader(CONTENT_TYPE, APPLICATION_JSON));
    }

    @Test
    void shouldCreateDocumentWithTypedFields() throws Exception {
        enqueueJson("{\"name\":\"" + DOC_PREFIX + "AbC123\","
                + "\"fields\":{\"name\":{\"stringValue\":\"Ali\"}},"
                + "\"createTime\":\"2026-05-01T12:00:00.300000Z\","
                + "\"updateTime\":\"2026-05-01T12:00:00.300000Z\"}");

        GenericRecord record = GenericRecord.empty()
                .put("name", RecordValue.text("Ali"))
                .put("age", RecordValue.integer(30))
                .put("active", RecordValue.bool(true));

        StoredDocument document = adapter.createDocument(COLLECTION, record).get(5, TimeUnit.SECONDS);

        assertEquals("AbC123", document.getId());
        assertEquals(DOC_PREFIX + "AbC123", document.getResourcePath());
        assertEquals("2026-05-01T12:00:00.300000Z", document.getCreatedAt());
        assertEquals("Ali", document.getFields().get("name").getStringValue());

        RecordedRequest request = mockServer.takeRequest(1, TimeUnit.SECONDS);
        assertNotNull(request);
        assertEquals("POST", request.getMethod());
        assertEquals(COLLECTION_PATH, request.getPath());
        assertEquals("Bearer test-token", request.getHeader("Authorization"));
        assertTrue(request.getHeader(CONTENT_TYPE).startsWith(APPLICATION_JSON));

        JsonNode fields = objectMapper.readTree(request.getBody().readUtf8()).get("fields");
        assertEquals("Ali", fields.get("name").get("stringValue").asText());
        assertEquals("30", fields.get("age").get("integerValue").asText());
        assertTrue(fields.get("active").get("booleanValue").asBoolean());
        assertEquals("2026-05-01T12:00:00.250Z", fields.get("timestamp").get("timestampValue").asText());
        assertEquals(1, fields.get("name").size(), "exactly one variant per field");
    }

    @Test
    void shouldListDocumentsInStoreOrder() throws Exception {
        enqueueJson("{\"documents\":["
                + "{\"name\":\"" + DOC_PREFIX + "first\",\"fields\":{\"city\":{\"stringValue\":\"Cairo\"}}},"
                + "{\"name\":\"" + DOC_PREFIX + "second\",\"fields\":{"
                + "\"n\":{\"integerValue\":\"7\"},"
                + "\"nested\":{\"mapValue\":{\"fields\":{}}},"
                + "\"timestamp\":{\"timestampValue\":\"2026-05-01T10:00:00.000Z\"}}}"
                + "]}");

        List<GenericRecord> records = adapter.listDocuments(COLLECTION).get(5, TimeUnit.SECONDS);

        assertEquals(2, records.size());
        assertEquals(GenericRecord.empty()
                .put("id", RecordValue.text("first"))
                .put("city", RecordValue.text("Cairo")), records.get(0));

        GenericRecord second = records.get(1);
        assertEquals(RecordValue.text("second"), second.get("id").orElseThrow());
        assertEquals(RecordValue.integer(7), second.get("n").orElseThrow());
        assertEquals(RecordValue.text("2026-05-01T10:00:00.000Z"), second.get("timestamp").orElseThrow());
        assertFalse(second.containsKey("nested"));

        RecordedRequest request = mockServer.takeRequest(1, TimeUnit.SECONDS);
        assertNotNull(request);
        assertEquals("GET", request.getMethod());
        assertEquals(COLLECTION_PATH, request.getPath());
        assertEquals("Bearer test-token", request.getHeader("Authorization"));
    }

    @Test
    void shouldReturnEmptyListWhenDocumentsAbsent() throws Exception {
        enqueueJson("{}");

        List<GenericRecord> records = adapter.listDocuments(COLLECTION).get(5, TimeUnit.SECONDS);

        assertTrue(records.isEmpty());
    }

    @Test
    void shouldFollowNextPageToken() throws Exception {
        enqueueJson("{\"documents\":[{\"name\":\"" + DOC_PREFIX + "a\",\"fields\":{}}],\"nextPageToken\":\"p2\"}");
        enqueueJson("{\"documents\":[{\"name\":\"" + DOC_PREFIX + "b\"}]}");

        List<GenericRecord> records = adapter.listDocuments(COLLECTION).get(5, TimeUnit.SECONDS);

        assertEquals(2, records.size());
        assertEquals(RecordValue.text("a"), records.get(0).get("id").orElseThrow());
        assertEquals(RecordValue.text("b"), records.get(1).get("id").orElseThrow());

        mockServer.takeRequest(1, TimeUnit.SECONDS);
        RecordedRequest secondPage = mockServer.takeRequest(1, TimeUnit.SECONDS);
        assertNotNull(secondPage);
        assertEquals(COLLECTION_PATH + "?pageToken=p2", secondPage.getPath());
    }

    @Test
    void shouldFailWithStatusAndBodyOnRejectedCreate() {
        mockServer.enqueue(new MockResponse()
                .setResponseCode(403)
                .setBody("{\"error\":{\"status\":\"PERMISSION_DENIED\"}}"));

        CompletableFuture<StoredDocument> future = adapter.createDocument(COLLECTION, GenericRecord.empty());

        ExecutionException ex = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        StoreOperationException cause = assertInstanceOf(StoreOperationException.class, ex.getCause());
        assertEquals(403, cause.getStatus());
        assertTrue(cause.getResponseBody().contains("PERMISSION_DENIED"));
        verify(credentialPort, never()).invalidate(any());
    }

    @Test
    void shouldInvalidateTokenOnUnauthorized() {
        mockServer.enqueue(new MockResponse().setResponseCode(401).setBody("expired"));

        CompletableFuture<List<GenericRecord>> future = adapter.listDocuments(COLLECTION);

        ExecutionException ex = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        assertInstanceOf(StoreOperationException.class, ex.getCause());
        verify(credentialPort).invalidate(any());
        assertEquals(1, mockServer.getRequestCount());
    }

    @Test
    void shouldPropagateAuthenticationFailureWithoutCallingStore() {
        when(credentialPort.getToken(any()))
                .thenReturn(CompletableFuture.failedFuture(new AuthenticationException("bad key")));

        CompletableFuture<List<GenericRecord>> future = adapter.listDocuments(COLLECTION);

        ExecutionException ex = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        assertInstanceOf(AuthenticationException.class, ex.getCause());
        assertEquals(0, mockServer.getRequestCount());
    }

    @Test
    void shouldStopWhenPageTokenRepeats() throws Exception {
        enqueueJson("{\"documents\":[{\"name\":\"" + DOC_PREFIX + "a\"}],\"nextPageToken\":\"p2\"}");
        enqueueJson("{\"documents\":[{\"name\":\"" + DOC_PREFIX + "b\"}],\"nextPageToken\":\"p2\"}");

        List<GenericRecord> records = adapter.listDocuments(COLLECTION).get(5, TimeUnit.SECONDS);

        assertEquals(2, records.size());
        assertEquals(2, mockServer.getRequestCount());
    }

    @Test
    void shouldAddressSubcollectionPath() throws Exception {
        enqueueJson("{}");

        adapter.listDocuments("users/u1/events").get(5, TimeUnit.SECONDS);

        RecordedRequest request = mockServer.takeRequest(1, TimeUnit.SECONDS);
        assertNotNull(request);
        assertEquals("/v1/projects/test-project/databases/(default)/documents/users/u1/events", request.getPath());
    }

    @Test
    void shouldFailWithTimeoutWhenListIsSlow() {
        mockServer.enqueue(new MockResponse().setBody("{}").setHeadersDelay(2, TimeUnit.SECONDS));
        FirestoreDocumentStoreAdapter slowAdapter = newAdapter(200);

        CompletableFuture<List<GenericRecord>> future = slowAdapter.listDocuments(COLLECTION);

        ExecutionException ex = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        assertInstanceOf(OperationTimeoutException.class, ex.getCause());
    }

    @Test
    void shouldFailWithTimeoutWhenCreateIsSlow() {
        mockServer.enqueue(new MockResponse().setBody("{}").setHeadersDelay(2, TimeUnit.SECONDS));
        FirestoreDocumentStoreAdapter slowAdapter = newAdapter(200);

        CompletableFuture<StoredDocument> future = slowAdapter.createDocument(COLLECTION,
                GenericRecord.empty().put("name", RecordValue.text("Ali")));

        ExecutionException ex = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        assertInstanceOf(OperationTimeoutException.class, ex.getCause());
    }

    @Test
    void shouldWrapDroppedConnectionWithCause() {
        mockServer.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.DISCONNECT_AT_START));

        CompletableFuture<List<GenericRecord>> future = adapter.listDocuments(COLLECTION);

        ExecutionException ex = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        StoreOperationException cause = assertInstanceOf(StoreOperationException.class, ex.getCause());
        assertEquals(0, cause.getStatus());
        assertInstanceOf(IOException.class, cause.getCause());
    }

    @Test
    void shouldRejectMissingProjectId() {
        properties.getFirestore().setProjectId(" ");

        assertThrows(IllegalStateException.class, () -> adapter.collectionUrl(COLLECTION));
    }
}
