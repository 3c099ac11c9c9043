package me.golemcore.relay.adapter.inbound.web.controller;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.adapter.inbound.web.dto.DataResponse;
import me.golemcore.relay.adapter.inbound.web.dto.ReceiveResponse;
import me.golemcore.relay.domain.codec.DocumentCodec;
import me.golemcore.relay.domain.model.GenericRecord;
import me.golemcore.relay.domain.service.DocumentService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * JSON ingestion and retrieval endpoints.
 *
 * <ul>
 * <li>{@code GET /} - service banner</li>
 * <li>{@code POST /receive} - store an arbitrary JSON object</li>
 * <li>{@code GET /api/data} - stored records, newest first</li>
 * </ul>
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class DocumentsController {

    private final DocumentService documentService;
    private final Clock clock;

    @GetMapping("/")
    public Mono<ResponseEntity<Map<String, Object>>> index() {
        Map<String, String> endpoints = new LinkedHashMap<>();
        endpoints.put("receive", "POST /receive - store a JSON object");
        endpoints.put("data", "GET /api/data - stored records, newest first");

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "GolemCore Relay is running");
        body.put("endpoints", endpoints);
        return Mono.just(ResponseEntity.ok(body));
    }

    @PostMapping("/receive")
    public Mono<ResponseEntity<ReceiveResponse>> receive(@RequestBody JsonNode payload) {
        return Mono.defer(() -> Mono.fromFuture(documentService.receive(payload)))
                .map(document -> {
                    log.info("[API] Stored document {}", document.getId());
                    return ResponseEntity.ok(ReceiveResponse.builder()
                            .success(true)
                            .message("Data stored successfully")
                            .documentId(document.getId())
                            .timestamp(now())
                            .build());
                });
    }

    @GetMapping("/api/data")
    public Mono<ResponseEntity<DataResponse>> data() {
        return Mono.fromFuture(documentService::listRecent)
                .map(records -> {
                    List<Map<String, Object>> data = records.stream()
                            .map(GenericRecord::toPlainMap)
                            .collect(Collectors.toList());
                    return ResponseEntity.ok(DataResponse.builder()
                            .success(true)
                            .data(data)
                            .total(data.size())
                            .lastUpdated(now())
                            .build());
                });
    }

    private String now() {
        return DocumentCodec.TIMESTAMP_FORMAT.format(clock.instant());
    }
}
