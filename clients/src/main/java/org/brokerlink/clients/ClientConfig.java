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
import org.brokerlink.common.config.ConfigDef;
import org.brokerlink.common.config.ConfigDef.Importance;
import org.brokerlink.common.config.ConfigDef.Type;
import org.brokerlink.common.config.SaslConfigs;
import org.brokerlink.common.config.TlsConfigs;
import org.brokerlink.common.security.auth.SecurityProtocol;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static org.brokerlink.common.config.ConfigDef.Range.atLeast;

/**
 * The connection-level configuration of a client: the brokers to dial, timeouts, pool sizing, the retry budget
 * and the optional TLS and SASL settings.
 * <p>
 * A {@code ClientConfig} is immutable once built and can be shared freely between threads. Reconfiguring a
 * client means building a new instance, usually through {@link #toBuilder()}, and validating it again with
 * {@link ClientConfigValidator#validate(ClientConfig)}.
 * <p>
 * TLS and SASL are modelled as present or absent. An absent section means "not configured", which the
 * connection layer treats like a disabled one but which is never checked against the TLS or SASL rules.
 */
public final class ClientConfig {

    private static final ConfigDef CONFIG = new ConfigDef()
        .define(CommonClientConfigs.BROKERS_CONFIG,
                Type.LIST,
                CommonClientConfigs.DEFAULT_BROKERS,
                Importance.HIGH,
                CommonClientConfigs.BROKERS_DOC)
        .define(CommonClientConfigs.CONNECT_TIMEOUT_MS_CONFIG,
                Type.LONG,
                CommonClientConfigs.DEFAULT_CONNECT_TIMEOUT_MS,
                Importance.MEDIUM,
                CommonClientConfigs.CONNECT_TIMEOUT_MS_DOC)
        .define(CommonClientConfigs.REQUEST_TIMEOUT_MS_CONFIG,
                Type.LONG,
                CommonClientConfigs.DEFAULT_REQUEST_TIMEOUT_MS,
                Importance.MEDIUM,
                CommonClientConfigs.REQUEST_TIMEOUT_MS_DOC)
        .define(CommonClientConfigs.MAX_CONNECTIONS_PER_BROKER_CONFIG,
                Type.INT,
                CommonClientConfigs.DEFAULT_MAX_CONNECTIONS_PER_BROKER,
                atLeast(0),
                Importance.LOW,
                CommonClientConfigs.MAX_CONNECTIONS_PER_BROKER_DOC)
        .define(CommonClientConfigs.MAX_RETRIES_CONFIG,
                Type.INT,
                CommonClientConfigs.DEFAULT_MAX_RETRIES,
                Importance.LOW,
                CommonClientConfigs.MAX_RETRIES_DOC)
        .withClientTlsSupport()
        .withClientSaslSupport();

    private final List<String> brokers;
    private final Duration connectTimeout;
    private final Duration requestTimeout;
    private final int maxConnectionsPerBroker;
    private final int maxRetries;
    private final Optional<TlsConfig> tls;
    private final Optional<SaslConfig> sasl;

    private ClientConfig(Builder builder) {
        this.brokers = Collections.unmodifiableList(new ArrayList<>(builder.brokers));
        this.connectTimeout = builder.connectTimeout;
        this.requestTimeout = builder.requestTimeout;
        this.maxConnectionsPerBroker = builder.maxConnectionsPerBroker;
        this.maxRetries = builder.maxRetries;
        this.tls = Optional.ofNullable(builder.tls);
        this.sasl = Optional.ofNullable(builder.sasl);
    }

    /**
     * Create a new configuration holding the defaults: one local broker, a 10 second connect timeout, a 30 second
     * request timeout, 5 connections per broker, 3 retries, no TLS and no SASL. Every call returns a fresh instance
     * and the result always passes {@link ClientConfigValidator#validate(ClientConfig)}.
     */
    public static ClientConfig defaults() {
        return builder()
            .brokers(CommonClientConfigs.DEFAULT_BROKERS)
            .connectTimeout(Duration.ofMillis(CommonClientConfigs.DEFAULT_CONNECT_TIMEOUT_MS))
            .requestTimeout(Duration.ofMillis(CommonClientConfigs.DEFAULT_REQUEST_TIMEOUT_MS))
            .maxConnectionsPerBroker(CommonClientConfigs.DEFAULT_MAX_CONNECTIONS_PER_BROKER)
            .maxRetries(CommonClientConfigs.DEFAULT_MAX_RETRIES)
            .build();
    }

    /**
     * An empty builder. Unset fields stay at their zero value (no brokers, zero timeouts), so a config built from
     * it only validates once brokers and timeouts have been supplied. Use {@code defaults().toBuilder()} to start
     * from a valid baseline instead.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Build a configuration from a property map such as {@link java.util.Properties}. Missing keys take the same
     * defaults as {@link #defaults()}. The TLS (SASL) section is present iff at least one {@code tls.}
     * ({@code sasl.}) key was supplied.
     * <p>
     * Only value types are checked here; the result still has to pass {@link ClientConfigValidator}.
     *
     * @throws org.brokerlink.common.config.ConfigException if a value cannot be parsed into its type
     */
    public static ClientConfig fromProperties(Map<?, ?> props) {
        ClientProperties config = new ClientProperties(props);
        Builder builder = builder()
            .brokers(config.getList(CommonClientConfigs.BROKERS_CONFIG))
            .connectTimeout(Duration.ofMillis(config.getLong(CommonClientConfigs.CONNECT_TIMEOUT_MS_CONFIG)))
            .requestTimeout(Duration.ofMillis(config.getLong(CommonClientConfigs.REQUEST_TIMEOUT_MS_CONFIG)))
            .maxConnectionsPerBroker(config.getInt(CommonClientConfigs.MAX_CONNECTIONS_PER_BROKER_CONFIG))
            .maxRetries(config.getInt(CommonClientConfigs.MAX_RETRIES_CONFIG));
        if (config.hasOriginalWithPrefix(TlsConfigs.TLS_PREFIX))
            builder.tls(TlsConfig.fromConfig(config));
        if (config.hasOriginalWithPrefix(SaslConfigs.SASL_PREFIX))
            builder.sasl(SaslConfig.fromConfig(config));
        config.logUnused();
        return builder.build();
    }

    public static ConfigDef configDef() {
        return new ConfigDef(CONFIG);
    }

    public Builder toBuilder() {
        return builder()
            .brokers(brokers)
            .connectTimeout(connectTimeout)
            .requestTimeout(requestTimeout)
            .maxConnectionsPerBroker(maxConnectionsPerBroker)
            .maxRetries(maxRetries)
            .tls(tls.orElse(null))
            .sasl(sasl.orElse(null));
    }

    /**
     * @return the broker addresses in preferred dial order; never null
     */
    public List<String> brokers() {
        return brokers;
    }

    public Duration connectTimeout() {
        return connectTimeout;
    }

    public Duration requestTimeout() {
        return requestTimeout;
    }

    public int maxConnectionsPerBroker() {
        return maxConnectionsPerBroker;
    }

    /**
     * @return how many times a failed request is retried; 0 means a single attempt
     */
    public int maxRetries() {
        return maxRetries;
    }

    public int maxAttempts() {
        return maxRetries + 1;
    }

    public Optional<TlsConfig> tls() {
        return tls;
    }

    public Optional<SaslConfig> sasl() {
        return sasl;
    }

    public SecurityProtocol securityProtocol() {
        return SecurityProtocol.of(tls.map(TlsConfig::enabled).orElse(false),
                                   sasl.map(SaslConfig::enabled).orElse(false));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ClientConfig that = (ClientConfig) o;
        return maxConnectionsPerBroker == that.maxConnectionsPerBroker &&
               maxRetries == that.maxRetries &&
               brokers.equals(that.brokers) &&
               connectTimeout.equals(that.connectTimeout) &&
               requestTimeout.equals(that.requestTimeout) &&
               tls.equals(that.tls) &&
               sasl.equals(that.sasl);
    }

    @Override
    public int hashCode() {
        return Objects.hash(brokers, connectTimeout, requestTimeout, maxConnectionsPerBroker, maxRetries, tls, sasl);
    }

    @Override
    public String toString() {
        return "ClientConfig(" +
               "brokers=" + brokers +
               ", connectTimeout=" + connectTimeout +
               ", requestTimeout=" + requestTimeout +
               ", maxConnectionsPerBroker=" + maxConnectionsPerBroker +
               ", maxRetries=" + maxRetries +
               ", tls=" + tls +
               ", sasl=" + sasl +
               ')';
    }

    public static final class Builder {
        private List<String> brokers = Collections.emptyList();
        private Duration connectTimeout = Duration.ZERO;
        private Duration requestTimeout = Duration.ZERO;
        private int maxConnectionsPerBroker = 0;
        private int maxRetries = 0;
        private TlsConfig tls;
        private SaslConfig sasl;

        private Builder() {
        }

        public Builder brokers(Collection<String> brokers) {
            this.brokers = brokers == null ? Collections.emptyList() : new ArrayList<>(brokers);
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout == null ? Duration.ZERO : connectTimeout;
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout == null ? Duration.ZERO : requestTimeout;
            return this;
        }

        public Builder maxConnectionsPerBroker(int maxConnectionsPerBroker) {
            this.maxConnectionsPerBroker = maxConnectionsPerBroker;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        /**
         * @param tls the TLS section, or null to leave TLS unconfigured
         */
        public Builder tls(TlsConfig tls) {
            this.tls = tls;
            return this;
        }

        /**
         * @param sasl the SASL section, or null to leave SASL unconfigured
         */
        public Builder sasl(SaslConfig sasl) {
            this.sasl = sasl;
            return this;
        }

        public ClientConfig build() {
            return new ClientConfig(this);
        }
    }

    private static class ClientProperties extends AbstractConfig {
        ClientProperties(Map<?, ?> props) {
            super(CONFIG, props);
        }
    }
}
