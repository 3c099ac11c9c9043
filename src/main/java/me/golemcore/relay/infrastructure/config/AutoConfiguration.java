package me.golemcore.relay.infrastructure.config;

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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Shared beans and startup diagnostics.
 *
 * <p>
 * Credentials are validated lazily: a missing or malformed key only fails the
 * first token exchange, so startup merely warns about it.
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final RelayProperties properties;

    @Bean
    public static Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @PostConstruct
    public void init() {
        RelayProperties.FirestoreProperties firestore = properties.getFirestore();
        RelayProperties.AuthProperties auth = properties.getAuth();
        log.info("GolemCore Relay starting...");
        log.info("Firestore project: {}, database: {}, collection: {}",
                firestore.getProjectId(), firestore.getDatabase(), firestore.getCollection());
        if (isBlank(firestore.getProjectId())) {
            log.warn("[Relay] relay.firestore.project-id is NOT configured - store calls will fail");
        }
        if (isBlank(auth.getClientEmail()) || isBlank(auth.getPrivateKey())) {
            log.warn("[Relay] Service account credentials are NOT configured - "
                    + "set FIREBASE_CLIENT_EMAIL and FIREBASE_PRIVATE_KEY");
        } else {
            log.info("Service account: {}", auth.getClientEmail());
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
