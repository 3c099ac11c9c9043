package me.golemcore.relay.domain.exception;

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

import lombok.Getter;

/**
 * Create or list call failed. {@code status} is 0 when no HTTP response was
 * received.
 */
@Getter
public class StoreOperationException extends DocumentStoreException {

    private final int status;
    private final String responseBody;

    public StoreOperationException(String operation, int status, String responseBody) {
        super(String.format("Store %s failed (HTTP %d): %s", operation, status, responseBody));
        this.status = status;
        this.responseBody = responseBody;
    }

    public StoreOperationException(String message, Throwable cause) {
        super(message, cause);
        this.status = 0;
        this.responseBody = null;
    }
}
