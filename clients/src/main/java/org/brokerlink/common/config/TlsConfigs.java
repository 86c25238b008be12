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
package org.brokerlink.common.config;

public class TlsConfigs {
    /*
     * NOTE: DO NOT CHANGE EITHER CONFIG NAMES AS THESE ARE PART OF THE PUBLIC API AND CHANGE WILL BREAK USER CODE.
     */

    public static final String TLS_PREFIX = "tls.";

    public static final String TLS_ENABLED_CONFIG = "tls.enabled";
    public static final String TLS_ENABLED_DOC = "Whether connections to the brokers are encrypted with TLS. "
        + "When false every other tls.* setting is ignored except the client certificate pairing check.";

    public static final String TLS_CA_FILE_CONFIG = "tls.ca.file";
    public static final String TLS_CA_FILE_DOC = "Path of the PEM file holding the certificate authorities used to verify the broker certificate. "
        + "Required when TLS is enabled unless 'tls.insecure.skip.verify' is true.";

    public static final String TLS_CERT_FILE_CONFIG = "tls.cert.file";
    public static final String TLS_CERT_FILE_DOC = "Path of the PEM client certificate chain used for mutual TLS. "
        + "Must be set together with 'tls.key.file'.";

    public static final String TLS_KEY_FILE_CONFIG = "tls.key.file";
    public static final String TLS_KEY_FILE_DOC = "Path of the PEM private key matching 'tls.cert.file'. "
        + "Must be set together with 'tls.cert.file'.";

    public static final String TLS_SERVER_NAME_CONFIG = "tls.server.name";
    public static final String TLS_SERVER_NAME_DOC = "The host name expected in the broker certificate. "
        + "When empty the host part of the broker address is used during the handshake.";

    public static final String TLS_INSECURE_SKIP_VERIFY_CONFIG = "tls.insecure.skip.verify";
    public static final String TLS_INSECURE_SKIP_VERIFY_DOC = "Skip verification of the broker certificate chain and host name. "
        + "Intended for development and testing only; never enable it against production brokers.";

    public static void addClientTlsSupport(ConfigDef config) {
        config.define(TlsConfigs.TLS_ENABLED_CONFIG, ConfigDef.Type.BOOLEAN, false, ConfigDef.Importance.HIGH, TlsConfigs.TLS_ENABLED_DOC)
                .define(TlsConfigs.TLS_CA_FILE_CONFIG, ConfigDef.Type.STRING, "", ConfigDef.Importance.HIGH, TlsConfigs.TLS_CA_FILE_DOC)
                .define(TlsConfigs.TLS_CERT_FILE_CONFIG, ConfigDef.Type.STRING, "", ConfigDef.Importance.HIGH, TlsConfigs.TLS_CERT_FILE_DOC)
                .define(TlsConfigs.TLS_KEY_FILE_CONFIG, ConfigDef.Type.STRING, "", ConfigDef.Importance.HIGH, TlsConfigs.TLS_KEY_FILE_DOC)
                .define(TlsConfigs.TLS_SERVER_NAME_CONFIG, ConfigDef.Type.STRING, "", ConfigDef.Importance.MEDIUM, TlsConfigs.TLS_SERVER_NAME_DOC)
                .define(TlsConfigs.TLS_INSECURE_SKIP_VERIFY_CONFIG, ConfigDef.Type.BOOLEAN, false, ConfigDef.Importance.LOW, TlsConfigs.TLS_INSECURE_SKIP_VERIFY_DOC);
    }
}
