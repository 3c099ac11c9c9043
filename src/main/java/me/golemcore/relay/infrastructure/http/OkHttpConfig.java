package me.golemcore.relay.infrastructure.http;

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

import me.golemcore.relay.infrastructure.config.RelayProperties;
import lombok.RequiredArgsConstructor;
import okhttp3.ConnectionPool;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Spring configuration for outbound HTTP: the shared {@link OkHttpClient} and
 * the executor that runs blocking calls off the WebFlux event loop.
 *
 * <p>
 * The client is configured from {@link RelayProperties}:
 * <ul>
 * <li>Connect/read/write timeouts</li>
 * <li>Call timeout - hard bound on a whole exchange, surfaced as
 * {@code OperationTimeoutException}</li>
 * <li>Connection pool - maintains idle connections for reuse</li>
 * </ul>
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
public class OkHttpConfig {

    public static final String IO_EXECUTOR = "relayIoExecutor";

    private final RelayProperties properties;

    @Bean
    public OkHttpClient okHttpClient() {
        RelayProperties.HttpProperties http = properties.getHttp();

        return new OkHttpClient.Builder()
                .connectTimeout(http.getConnectTimeout(), TimeUnit.MILLISECONDS)
                .readTimeout(http.getReadTimeout(), TimeUnit.MILLISECONDS)
                .writeTimeout(http.getWriteTimeout(), TimeUnit.MILLISECONDS)
                .callTimeout(http.getCallTimeout(), TimeUnit.MILLISECONDS)
                .connectionPool(new ConnectionPool(
                        http.getMaxIdleConnections(),
                        http.getKeepAliveDuration(),
                        TimeUnit.MILLISECONDS))
                .retryOnConnectionFailure(true)
                .build();
    }

    @Bean(name = IO_EXECUTOR, destroyMethod = "shutdown")
    public ExecutorService relayIoExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(properties.getHttp().getExecutorThreads(), r -> {
            Thread t = new Thread(r, "relay-io-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
