package me.golemcore.costexporter.port.outbound;

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

/**
 * Failure of a single provider fetch.
 *
 * <p>
 * Caught at the provider boundary by the polling scheduler; never propagates
 * to sibling providers.
 */
public class ProviderException extends Exception {

    private static final long serialVersionUID = 1L;

    public enum Reason {
        /** Transport failure, timeout or a non-auth HTTP error. */
        NETWORK,
        /** Credentials or token rejected. */
        AUTH,
        /** Response did not match the expected shape. */
        DECODE
    }

    private final String provider;
    private final Reason reason;

    public ProviderException(String provider, Reason reason, String message) {
        super(message);
        this.provider = provider;
        this.reason = reason;
    }

    public ProviderException(String provider, Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
        this.reason = reason;
    }

    public static ProviderException network(String provider, String message, Throwable cause) {
        return new ProviderException(provider, Reason.NETWORK, message, cause);
    }

    public static ProviderException auth(String provider, String message, Throwable cause) {
        return new ProviderException(provider, Reason.AUTH, message, cause);
    }

    public static ProviderException decode(String provider, String message) {
        return new ProviderException(provider, Reason.DECODE, message);
    }

    public static ProviderException decode(String provider, String message, Throwable cause) {
        return new ProviderException(provider, Reason.DECODE, message, cause);
    }

    public String getProvider() {
        return provider;
    }

    public Reason getReason() {
        return reason;
    }
}
