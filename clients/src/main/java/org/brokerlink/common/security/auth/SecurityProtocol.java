/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements. See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License. You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.brokerlink.common.security.auth;

import java.util.Locale;

/**
 * The channel a client opens to a broker, derived from whether TLS and SASL are enabled.
 */
public enum SecurityProtocol {
    /** Un-authenticated, non-encrypted channel */
    PLAINTEXT(0, "PLAINTEXT"),
    /** TLS channel */
    SSL(1, "SSL"),
    /** SASL authenticated, non-encrypted channel */
    SASL_PLAINTEXT(2, "SASL_PLAINTEXT"),
    /** SASL authenticated, TLS channel */
    SASL_SSL(3, "SASL_SSL");

    /** The permanent and immutable id of a security protocol -- this can't change */
    public final short id;

    /** Name of the security protocol. */
    public final String name;

    SecurityProtocol(int id, String name) {
        this.id = (short) id;
        this.name = name;
    }

    public static SecurityProtocol of(boolean tlsEnabled, boolean saslEnabled) {
        if (saslEnabled)
            return tlsEnabled ? SASL_SSL : SASL_PLAINTEXT;
        return tlsEnabled ? SSL : PLAINTEXT;
    }

    /** Case insensitive lookup by protocol name */
    public static SecurityProtocol forName(String name) {
        return SecurityProtocol.valueOf(name.toUpperCase(Locale.ROOT));
    }

    public boolean encrypted() {
        return this == SSL || this == SASL_SSL;
    }

    public boolean authenticated() {
        return this == SASL_PLAINTEXT || this == SASL_SSL;
    }
}
