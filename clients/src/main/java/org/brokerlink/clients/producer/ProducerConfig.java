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
package org.brokerlink.clients.producer;

import org.brokerlink.common.config.AbstractConfig;
import org.brokerlink.common.config.ConfigDef;
import org.brokerlink.common.config.ConfigDef.Importance;
import org.brokerlink.common.config.ConfigDef.Type;
import org.brokerlink.common.config.ConfigError;
import org.brokerlink.common.config.ConfigRules;
import org.brokerlink.common.config.InvalidConfigurationException;
import org.brokerlink.common.record.CompressionType;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Configuration for a producer: acknowledgement mode, batching and compression.
 */
public final class ProducerConfig {

    /*
     * NOTE: DO NOT CHANGE EITHER CONFIG STRINGS OR THEIR JAVA VARIABLE NAMES AS THESE ARE PART OF THE PUBLIC API AND
     * CHANGE WILL BREAK USER CODE.
     */

    private static final ConfigDef CONFIG;

    /** <code>require.ack</code> */
    public static final String REQUIRE_ACK_CONFIG = "require.ack";
    private static final String REQUIRE_ACK_DOC = "Whether the producer waits for the broker to acknowledge each publish. "
                                                  + "When false, publishing is fire-and-forget.";
    public static final boolean DEFAULT_REQUIRE_ACK = true;

    /** <code>batch.timeout.ms</code> */
    public static final String BATCH_TIMEOUT_MS_CONFIG = "batch.timeout.ms";
    private static final String BATCH_TIMEOUT_MS_DOC = "The maximum time a message waits in a batch before the batch is sent. "
                                                       + "Must be strictly positive.";
    public static final long DEFAULT_BATCH_TIMEOUT_MS = 1000L;

    /** <code>compression.type</code> */
    public static final String COMPRESSION_TYPE_CONFIG = "compression.type";
    private static final String COMPRESSION_TYPE_DOC = "The compression type for all data generated by the producer. The default is none (i.e. no compression). "
                                                       + "Valid values are <code>none</code>, <code>gzip</code>, <code>snappy</code>, <code>lz4</code>, or <code>zstd</code>. "
                                                       + "Compression is of full batches of data, so the efficacy of batching will also impact the compression ratio.";
    public static final String DEFAULT_COMPRESSION_TYPE = CompressionType.NONE.name;

    static final ConfigRules<ProducerConfig> RULES = ConfigRules.<ProducerConfig>builder()
        .require(BATCH_TIMEOUT_MS_CONFIG, ConfigError.INVALID_BATCH_TIMEOUT,
            p -> !p.batchTimeout.isNegative() && !p.batchTimeout.isZero(), p -> p.batchTimeout)
        .require(COMPRESSION_TYPE_CONFIG, ConfigError.UNKNOWN_COMPRESSION,
            p -> CompressionType.isKnown(p.compression), p -> p.compression,
            "Compression type must be one of " + CompressionType.names())
        .build();

    static {
        CONFIG = new ConfigDef().define(REQUIRE_ACK_CONFIG, Type.BOOLEAN, DEFAULT_REQUIRE_ACK, Importance.HIGH, REQUIRE_ACK_DOC)
                                .define(BATCH_TIMEOUT_MS_CONFIG, Type.LONG, DEFAULT_BATCH_TIMEOUT_MS, Importance.MEDIUM, BATCH_TIMEOUT_MS_DOC)
                                .define(COMPRESSION_TYPE_CONFIG, Type.STRING, DEFAULT_COMPRESSION_TYPE, Importance.HIGH, COMPRESSION_TYPE_DOC);
    }

    private final boolean requireAck;
    private final Duration batchTimeout;
    private final String compression;

    private ProducerConfig(Builder builder) {
        this.requireAck = builder.requireAck;
        this.batchTimeout = builder.batchTimeout;
        this.compression = builder.compression;
    }

    /**
     * A fresh instance holding the defaults: acknowledged publishing, a one second batch timeout and no compression.
     */
    public static ProducerConfig defaults() {
        return builder()
            .requireAck(DEFAULT_REQUIRE_ACK)
            .batchTimeout(Duration.ofMillis(DEFAULT_BATCH_TIMEOUT_MS))
            .compression(DEFAULT_COMPRESSION_TYPE)
            .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ProducerConfig fromProperties(Map<?, ?> props) {
        ProducerProperties config = new ProducerProperties(props);
        ProducerConfig producerConfig = builder()
            .requireAck(config.getBoolean(REQUIRE_ACK_CONFIG))
            .batchTimeout(Duration.ofMillis(config.getLong(BATCH_TIMEOUT_MS_CONFIG)))
            .compression(config.getString(COMPRESSION_TYPE_CONFIG))
            .build();
        config.logUnused();
        return producerConfig;
    }

    public static ConfigDef configDef() {
        return new ConfigDef(CONFIG);
    }

    public Builder toBuilder() {
        return builder()
            .requireAck(requireAck)
            .batchTimeout(batchTimeout)
            .compression(compression);
    }

    /**
     * Check the producer rules in order: the batch timeout must be positive, then the compression codec must be
     * a known one.
     *
     * @throws InvalidConfigurationException with {@link ConfigError#INVALID_BATCH_TIMEOUT} or
     *         {@link ConfigError#UNKNOWN_COMPRESSION}
     */
    public void validate() {
        RULES.ensureValid(this);
    }

    public List<InvalidConfigurationException> violations() {
        return RULES.violations(this);
    }

    public boolean isValid() {
        return RULES.isValid(this);
    }

    public boolean requireAck() {
        return requireAck;
    }

    public Duration batchTimeout() {
        return batchTimeout;
    }

    /**
     * @return the codec name as configured, not normalized
     */
    public String compression() {
        return compression;
    }

    /**
     * @return the codec named by {@link #compression()}
     * @throws InvalidConfigurationException if the name is not a known codec
     */
    public CompressionType compressionType() {
        try {
            return CompressionType.forName(compression);
        } catch (IllegalArgumentException e) {
            throw new InvalidConfigurationException(ConfigError.UNKNOWN_COMPRESSION, COMPRESSION_TYPE_CONFIG, compression);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ProducerConfig that = (ProducerConfig) o;
        return requireAck == that.requireAck &&
               batchTimeout.equals(that.batchTimeout) &&
               compression.equals(that.compression);
    }

    @Override
    public int hashCode() {
        return Objects.hash(requireAck, batchTimeout, compression);
    }

    @Override
    public String toString() {
        return "ProducerConfig(" +
               "requireAck=" + requireAck +
               ", batchTimeout=" + batchTimeout +
               ", compression='" + compression + '\'' +
               ')';
    }

    public static final class Builder {
        private boolean requireAck = false;
        private Duration batchTimeout = Duration.ZERO;
        private String compression = "";

        private Builder() {
        }

        public Builder requireAck(boolean requireAck) {
            this.requireAck = requireAck;
            return this;
        }

        public Builder batchTimeout(Duration batchTimeout) {
            this.batchTimeout = batchTimeout == null ? Duration.ZERO : batchTimeout;
            return this;
        }

        public Builder compression(String compression) {
            this.compression = compression == null ? "" : compression;
            return this;
        }

        public Builder compressionType(CompressionType compressionType) {
            return compression(compressionType == null ? null : compressionType.name);
        }

        public ProducerConfig build() {
            return new ProducerConfig(this);
        }
    }

    private static class ProducerProperties extends AbstractConfig {
        ProducerProperties(Map<?, ?> props) {
            super(CONFIG, props);
        }
    }
}
