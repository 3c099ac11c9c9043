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

import java.time.Duration;
import java.time.Instant;

/**
 * Bearer token obtained from the authorization server. Replaced wholesale when
 * it is no longer usable.
 */
@Value
@Builder
public class Credential {

    String token;
    Instant obtainedAt;
    Duration expiresIn;

    /**
     * Whether the token may still be handed out at {@code now}, keeping
     * {@code margin} in reserve before the declared expiry.
     */
    public boolean isUsableAt(Instant now, Duration margin) {
        return now.isBefore(obtainedAt.plus(expiresIn).minus(margin));
    }

    @Override
    public String toString() {
        return "Credential(obtainedAt=" + obtainedAt + ", expiresIn=" + expiresIn + ")";
    }
}
