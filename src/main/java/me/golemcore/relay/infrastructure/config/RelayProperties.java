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

import lombok.Data;
import me.golemcore.relay.domain.model.SigningIdentity;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Centralized configuration properties for the relay, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code relay.*} prefix:
 * <ul>
 * <li>{@link FirestoreProperties} - target project, database and
 * collection</li>
 * <li>{@link AuthProperties} - service account used for token exchange</li>
 * <li>{@link HttpProperties} - outbound HTTP timeouts and pooling</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "relay")
@Data
public class RelayProperties {

    private FirestoreProperties firestore = new FirestoreProperties();
    private AuthProperties auth = new AuthProperties();
    private HttpProperties http = new HttpProperties();

    @Data
    public static class FirestoreProperties {
        private String projectId;
        private String baseUrl = "https://firestore.googleapis.com/v1";
        private String database = "(default)";
        private String collection = "received_data";
    }

    @Data
    public static class AuthProperties {
        private String clientEmail;
        private String privateKey;
        private String tokenUri = "https://oauth2.googleapis.com/token";
        private String scope = "https://www.googleapis.com/auth/datastore";
        private long assertionLifetimeSeconds = 3600;
        private long refreshMarginSeconds = 300;

        public SigningIdentity toSigningIdentity() {
            return SigningIdentity.builder()
                    .serviceIdentity(clientEmail)
                    .privateKey(privateKey)
                    .tokenAudience(tokenUri)
                    .scope(scope)
                    .build();
        }
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 30000;
        private long writeTimeout = 30000;
        private long callTimeout = 30000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
        private int executorThreads = 4;
    }
}
