package me.golemcore.relay.domain.model;

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

import lombok.Builder;
import lombok.Value;

/**
 * Service account used to sign token assertions. Supplied by configuration and
 * never mutated.
 */
@Value
@Builder(toBuilder = true)
public class SigningIdentity {

    String serviceIdentity;

    /**
     * PKCS8 private key, PEM armoured or bare base64.
     */
    String privateKey;

    String tokenAudience;
    String scope;

    @Override
    public String toString() {
        return "SigningIdentity(serviceIdentity=" + serviceIdentity + ", tokenAudience=" + tokenAudience
                + ", scope=" + scope + ")";
    }
}
