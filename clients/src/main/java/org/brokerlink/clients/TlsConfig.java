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
package org.brokerlink.clients;

import org.brokerlink.common.config.AbstractConfig;
import org.brokerlink.common.config.TlsConfigs;

import java.util.Objects;

/**
 * Transport security intent for broker connections.
 * <p>
 * Instances are immutable. The rules they must satisfy before a dial are checked by
 * {@link ClientConfigValidator#checkTls(TlsConfig)}.
 */
public final class TlsConfig {

    private static final TlsConfig DISABLED = builder().build();

    private final boolean enabled;
    private final String caFile;
    private final String certFile;
    private final String keyFile;
    private final String serverName;
    private final boolean insecureSkipVerify;

    private TlsConfig(Builder builder) {
        this.enabled = builder.enabled;
        this.caFile = builder.caFile;
        this.certFile = builder.certFile;
        this.keyFile = builder.keyFile;
        this.serverName = builder.serverName;
        this.insecureSkipVerify = builder.insecureSkipVerify;
    }

    public static TlsConfig disabled() {
        return DISABLED;
    }

    public static Builder builder() {
        return new Builder();
    }

    static TlsConfig fromConfig(AbstractConfig config) {
        return builder()
            .enabled(config.getBoolean(TlsConfigs.TLS_ENABLED_CONFIG))
            .caFile(config.getString(TlsConfigs.TLS_CA_FILE_CONFIG))
            .certFile(config.getString(TlsConfigs.TLS_CERT_FILE_CONFIG))
            .keyFile(config.getString(TlsConfigs.TLS_KEY_FILE_CONFIG))
            .serverName(config.getString(TlsConfigs.TLS_SERVER_NAME_CONFIG))
            .insecureSkipVerify(config.getBoolean(TlsConfigs.TLS_INSECURE_SKIP_VERIFY_CONFIG))
            .build();
    }

    public Builder toBuilder() {
        return builder()
            .enabled(enabled)
            .caFile(caFile)
            .certFile(certFile)
            .keyFile(keyFile)
            .serverName(serverName)
            .insecureSkipVerify(insecureSkipVerify);
    }

    public boolean enabled() {
        return enabled;
    }

    public String caFile() {
        return caFile;
    }

    public String certFile() {
        return certFile;
    }

    public String keyFile() {
        return keyFile;
    }

    /**
     * @return the host name expected in the broker certificate, or an empty string to use the broker host
     */
    public String serverName() {
        return serverName;
    }

    public boolean insecureSkipVerify() {
        return insecureSkipVerify;
    }

    public boolean hasClientCertificate() {
        return !certFile.isEmpty() && !keyFile.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TlsConfig that = (TlsConfig) o;
        return enabled == that.enabled &&
               insecureSkipVerify == that.insecureSkipVerify &&
               caFile.equals(that.caFile) &&
               certFile.equals(that.certFile) &&
               keyFile.equals(that.keyFile) &&
               serverName.equals(that.serverName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(enabled, caFile, certFile, keyFile, serverName, insecureSkipVerify);
    }

    @Override
    public String toString() {
        return "TlsConfig(" +
               "enabled=" + enabled +
               ", caFile='" + caFile + '\'' +
               ", certFile='" + certFile + '\'' +
               ", keyFile='" + keyFile + '\'' +
               ", serverName='" + serverName + '\'' +
               ", insecureSkipVerify=" + insecureSkipVerify +
               ')';
    }

    public static final class Builder {
        private boolean enabled = false;
        private String caFile = "";
        private String certFile = "";
        private String keyFile = "";
        private String serverName = "";
        private boolean insecureSkipVerify = false;

        private Builder() {
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder caFile(String caFile) {
            this.caFile = caFile == null ? "" : caFile;
            return this;
        }

        public Builder certFile(String certFile) {
            this.certFile = certFile == null ? "" : certFile;
            return this;
        }

        public Builder keyFile(String keyFile) {
            this.keyFile = keyFile == null ? "" : keyFile;
            return this;
        }

        public Builder serverName(String serverName) {
            this.serverName = serverName == null ? "" : serverName;
            return this;
        }

        public Builder insecureSkipVerify(boolean insecureSkipVerify) {
            this.insecureSkipVerify = insecureSkipVerify;
            return this;
        }

        public TlsConfig build() {
            return new TlsConfig(this);
        }
    }
}
