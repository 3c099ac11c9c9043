package me.golemcore.relay.adapter.outbound.auth;

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
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.domain.exception.AuthenticationException;
import me.golemcore.relay.domain.exception.OperationTimeoutException;
import me.golemcore.relay.domain.model.Credential;
import me.golemcore.relay.domain.model.SigningIdentity;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import me.golemcore.relay.infrastructure.http.OkHttpConfig;
import me.golemcore.relay.port.outbound.CredentialPort;
import okhttp3.FormBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PrivateKey;
import java.security.spec.PKCS8EncodedKeySpec;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Date;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;

/**
 * Service-account credential manager using the OAuth 2.0 JWT-bearer grant.
 *
 * <p>
 * Flow:
 * <ol>
 * <li>Sign an RS256 assertion ({@code iss}, {@code scope}, {@code aud},
 * {@code iat}, {@code exp}) with the PKCS8 private key</li>
 * <li>POST it form-encoded to the token audience URL</li>
 * <li>Cache {@code access_token} until {@code expires_in} minus the refresh
 * margin has elapsed</li>
 * </ol>
 *
 * <p>
 * Acquisition is single-flight per identity: callers arriving while an exchange
 * is running share its future instead of issuing their own request. Failed
 * exchanges are not cached and nothing is retried here.
 */
@Component
@Slf4j
public class ServiceAccountCredentialManager implements CredentialPort {

    static final String GRANT_TYPE = "urn:ietf:params:oauth:grant-type:jwt-bearer";

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Executor executor;
    private final Duration assertionLifetime;
    private final Duration refreshMargin;
    private final ConcurrentMap<String, CompletableFuture<Credential>> credentials = new ConcurrentHashMap<>();

    public ServiceAccountCredentialManager(RelayProperties properties, OkHttpClient httpClient,
            ObjectMapper objectMapper, Clock clock, @Qualifier(OkHttpConfig.IO_EXECUTOR) Executor executor) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.executor = executor;
        this.assertionLifetime = Duration.ofSeconds(properties.getAuth().getAssertionLifetimeSeconds());
        this.refreshMargin = Duration.ofSeconds(properties.getAuth().getRefreshMarginSeconds());
    }

    @Override
    public CompletableFuture<String> getToken(SigningIdentity identity) {
        CompletableFuture<Credential> credential = credentials.compute(cacheKey(identity),
                (key, current) -> isReusable(current) ? current : acquire(identity));
        return credential.thenApply(Credential::getToken);
    }

    @Override
    public void invalidate(SigningIdentity identity) {
        if (credentials.remove(cacheKey(identity)) != null) {
            log.info("[Auth] Cached token dropped for {}", identity.getServiceIdentity());
        }
    }

    private boolean isReusable(CompletableFuture<Credential> current) {
        if (current == null || current.isCompletedExceptionally()) {
            return false;
        }
        if (!current.isDone()) {
            return true;
        }
        return current.join().isUsableAt(clock.instant(), refreshMargin);
    }

    private CompletableFuture<Credential> acquire(SigningIdentity identity) {
        return CompletableFuture.supplyAsync(() -> exchange(identity), executor);
    }

    private Credential exchange(SigningIdentity identity) {
        Instant now = clock.instant();
        String assertion = buildAssertion(identity, now);

        Request request = new Request.Builder()
                .url(identity.getTokenAudience())
                .post(new FormBody.Builder()
                        .add("grant_type", GRANT_TYPE)
                        .add("assertion", assertion)
                        .build())
                .build();

        log.debug("[Auth] Exchanging assertion for {}", identity.getServiceIdentity());
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            String responseStr = body != null ? body.string() : "";
            if (!response.isSuccessful()) {
                log.warn("[Auth] Token exchange failed: HTTP {}", response.code());
                throw new AuthenticationException(
                        String.format("Token exchange failed (HTTP %d): %s", response.code(), responseStr));
            }
            Credential credential = parseTokenResponse(responseStr, now);
            log.info("[Auth] Token acquired for {} (expires in {}s)",
                    identity.getServiceIdentity(), credential.getExpiresIn().getSeconds());
            return credential;
        } catch (InterruptedIOException e) {
            log.warn("[Auth] Token exchange timed out: {}", e.getMessage());
            throw new OperationTimeoutException("Token exchange timed out", e);
        } catch (IOException e) {
            log.warn("[Auth] Token exchange error: {}", e.getMessage());
            throw new AuthenticationException("Token exchange failed: " + e.getMessage(), e);
        }
    }

    /**
     * Builds the signed JWT-bearer assertion issued at {@code now}.
     */
    String buildAssertion(SigningIdentity identity, Instant now) {
        PrivateKey key = parsePrivateKey(identity.getPrivateKey());
        try {
            return Jwts.builder()
                    .header().type("JWT").and()
                    .issuer(identity.getServiceIdentity())
                    .claim("scope", identity.getScope())
                    .audience().single(identity.getTokenAudience())
                    .issuedAt(Date.from(now))
                    .expiration(Date.from(now.plus(assertionLifetime)))
                    .signWith(key, Jwts.SIG.RS256)
                    .compact();
        } catch (JwtException | IllegalArgumentException e) {
            throw new AuthenticationException("Failed to sign assertion: " + e.getMessage(), e);
        }
    }

    /**
     * Parses PKCS8 key material. Accepts PEM armour and literal {@code \n}
     * escapes as found in environment variables.
     */
    static PrivateKey parsePrivateKey(String keyMaterial) {
        if (keyMaterial == null || keyMaterial.isBlank()) {
            throw new AuthenticationException("Private key is not configured");
        }
        String base64 = keyMaterial.replace("\\n", "\n")
                .replaceAll("-----(BEGIN|END) PRIVATE KEY-----", "")
                .replaceAll("\\s", "");
        try {
            byte[] der = Base64.getDecoder().decode(base64);
            return KeyFactory.getInstance("RSA").generatePrivate(new PKCS8EncodedKeySpec(der));
        } catch (IllegalArgumentException | GeneralSecurityException e) {
            throw new AuthenticationException("Malformed private key: " + e.getMessage(), e);
        }
    }

    private Credential parseTokenResponse(String responseStr, Instant obtainedAt) {
        TokenResponse tokenResponse;
        try {
            tokenResponse = objectMapper.readValue(responseStr, TokenResponse.class);
        } catch (IOException e) {
            throw new AuthenticationException("Unparsable token response", e);
        }
        if (tokenResponse == null || tokenResponse.getAccessToken() == null
                || tokenResponse.getAccessToken().isBlank()) {
            throw new AuthenticationException("Token response has no access_token");
        }
        Duration expiresIn = tokenResponse.getExpiresIn() != null && tokenResponse.getExpiresIn() > 0
                ? Duration.ofSeconds(tokenResponse.getExpiresIn())
                : assertionLifetime;
        return Credential.builder()
                .token(tokenResponse.getAccessToken())
                .obtainedAt(obtainedAt)
                .expiresIn(expiresIn)
                .build();
    }

    private static String cacheKey(SigningIdentity identity) {
        return identity.getServiceIdentity() + "|" + identity.getScope() + "|" + identity.getTokenAudience();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class TokenResponse {
        @JsonProperty("access_token")
        private String accessToken;
        @JsonProperty("expires_in")
        private Long expiresIn;
        @JsonProperty("token_type")
        private String tokenType;
    }
}
