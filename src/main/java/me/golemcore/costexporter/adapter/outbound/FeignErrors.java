package me.golemcore.costexporter.adapter.outbound;

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

import me.golemcore.costexporter.port.outbound.ProviderException;
import feign.FeignException;
import feign.RetryableException;
import feign.codec.DecodeException;

/**
 * Maps Feign failures onto {@link ProviderException} reasons.
 *
 * <ul>
 * <li>I/O errors and timeouts ({@link RetryableException}) - NETWORK</li>
 * <li>HTTP 401 / 403 - AUTH</li>
 * <li>{@link DecodeException} or an unreadable 2xx body - DECODE</li>
 * <li>any other HTTP status - NETWORK</li>
 * </ul>
 */
public final class FeignErrors {

    private static final int HTTP_UNAUTHORIZED = 401;
    private static final int HTTP_FORBIDDEN = 403;

    private FeignErrors() {
    }

    public static ProviderException translate(String provider, FeignException e) {
        if (e instanceof RetryableException) {
            return ProviderException.network(provider, "Request failed: " + e.getMessage(), e);
        }
        if (e instanceof DecodeException) {
            return ProviderException.decode(provider, "Unexpected response shape: " + e.getMessage(), e);
        }
        int status = e.status();
        if (status == HTTP_UNAUTHORIZED || status == HTTP_FORBIDDEN) {
            return ProviderException.auth(provider, "Credentials rejected (HTTP " + status + ")", e);
        }
        if (status >= 200 && status < 300) {
            return ProviderException.decode(provider, "Unreadable response: " + e.getMessage(), e);
        }
        return ProviderException.network(provider, "HTTP " + status + " from provider", e);
    }
}
