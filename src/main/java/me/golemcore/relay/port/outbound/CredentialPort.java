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

import me.golemcore.relay.domain.model.SigningIdentity;

import java.util.concurrent.CompletableFuture;

/**
 * Port for obtaining bearer tokens for the document-store API.
 */
public interface CredentialPort {

    /**
     * Returns a valid bearer token for the identity, exchanging a freshly signed
     * assertion only when no usable token is cached.
     *
     * @param identity
     *            service account and target scope
     * @return the access token; completes exceptionally with
     *         {@link me.golemcore.relay.domain.exception.AuthenticationException}
     *         or
     *         {@link me.golemcore.relay.domain.exception.OperationTimeoutException}
     */
    CompletableFuture<String> getToken(SigningIdentity identity);

    /**
     * Drops any cached token for the identity, e.g. after the store rejected it.
     * The next {@link #getToken(SigningIdentity)} performs a fresh exchange.
     */
    void invalidate(SigningIdentity identity);
}
