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
package org.brokerlink.clients.consumer;

import org.brokerlink.clients.CommonClientConfigs;
import org.brokerlink.common.config.AbstractConfig;
import org.brokerlink.common.config.ConfigDef;
import org.brokerlink.common.config.ConfigDef.Importance;
import org.brokerlink.common.config.ConfigDef.Type;
import org.brokerlink.common.config.ConfigError;
import org.brokerlink.common.config.ConfigRules;
import org.brokerlink.common.config.InvalidConfigurationException;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Configuration for a single consumer. The consumer may belong to a group, but nothing here requires it to; a
 * consumer that must join a group is configured through {@link GroupConsumerConfig}.
 */
public final class ConsumerConfig {

    /*
     * NOTE: DO NOT CHANGE EITHER CONFIG STRINGS OR THEIR JAVA VARIABLE NAMES AS THESE ARE PART OF THE PUBLIC API AND
     * CHANGE WILL BREAK USER CODE.
     */

    private static final ConfigDef CONFIG;

    /** <code>group.id</code> */
    public static final String GROUP_ID_CONFIG = CommonClientConfigs.GROUP_ID_CONFIG;

    /** <code>start.offset</code> */
    public static final String START_OFFSET_CONFIG = "start.offset";
    private static final String START_OFFSET_DOC = "Where to start reading when there is no committed position: "
                                                   + OffsetSpec.EARLIEST + " for the earliest retained message, "
                                                   + OffsetSpec.LATEST + " for the latest, or an explicit offset.";
    public static final long DEFAULT_START_OFFSET = OffsetSpec.LATEST;

    /** <code>max.fetch.bytes</code> */
    public static final String MAX_FETCH_BYTES_CONFIG = "max.fetch.bytes";
    private static final String MAX_FETCH_BYTES_DOC = "The maximum amount of data the broker returns for a single fetch. "
                                                      + "Must be strictly positive.";
    public static final int DEFAULT_MAX_FETCH_BYTES = 1024 * 1024;

    static final ConfigRules<ConsumerConfig> RULES = ConfigRules.<ConsumerConfig>builder()
        .require(MAX_FETCH_BYTES_CONFIG, ConfigError.INVALID_FETCH_SIZE,
            c -> c.maxFetchBytes > 0, c -> c.maxFetchBytes)
        .build();

    static {
        CONFIG = new ConfigDef().define(GROUP_ID_CONFIG, Type.STRING, "", Importance.HIGH, CommonClientConfigs.GROUP_ID_DOC)
                                .define(START_OFFSET_CONFIG, Type.LONG, DEFAULT_START_OFFSET, Importance.MEDIUM, START_OFFSET_DOC)
                                .define(MAX_FETCH_BYTES_CONFIG, Type.INT, DEFAULT_MAX_FETCH_BYTES, Importance.MEDIUM, MAX_FETCH_BYTES_DOC);
    }

    private final String groupId;
    private final long startOffset;
    private final int maxFetchBytes;

    private ConsumerConfig(Builder builder) {
        this.groupId = builder.groupId;
        this.startOffset = builder.startOffset;
        this.maxFetchBytes = builder.maxFetchBytes;
    }

    /**
     * A fresh instance holding the defaults: no group, start at the latest offset, fetch at most 1 MiB.
     */
    public static ConsumerConfig defaults() {
        return builder()
            .startOffset(DEFAULT_START_OFFSET)
            .maxFetchBytes(DEFAULT_MAX_FETCH_BYTES)
            .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ConsumerConfig fromProperties(Map<?, ?> props) {
        ConsumerProperties config = new ConsumerProperties(props);
        ConsumerConfig consumerConfig = builder()
            .groupId(config.getString(GROUP_ID_CONFIG))
            .startOffset(config.getLong(START_OFFSET_CONFIG))
            .maxFetchBytes(config.getInt(MAX_FETCH_BYTES_CONFIG))
            .build();
        config.logUnused();
        return consumerConfig;
    }

    public static ConfigDef configDef() {
        return new ConfigDef(CONFIG);
    }

    public Builder toBuilder() {
        return builder()
            .groupId(groupId)
            .startOffset(startOffset)
            .maxFetchBytes(maxFetchBytes);
    }

    /**
     * @throws InvalidConfigurationException with {@link ConfigError#INVALID_FETCH_SIZE} if the fetch budget is not
     *         positive
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

    /**
     * @return the group id, or an empty string for a consumer outside any group
     */
    public String groupId() {
        return groupId;
    }

    public boolean isGroupMember() {
        return !groupId.isEmpty();
    }

    /**
     * @return the start position; see {@link OffsetSpec} for the sentinel values
     */
    public long startOffset() {
        return startOffset;
    }

    public int maxFetchBytes() {
        return maxFetchBytes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ConsumerConfig that = (ConsumerConfig) o;
        return startOffset == that.startOffset &&
               maxFetchBytes == that.maxFetchBytes &&
               groupId.equals(that.groupId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(groupId, startOffset, maxFetchBytes);
    }

    @Override
    public String toString() {
        return "ConsumerConfig(" +
               "groupId='" + groupId + '\'' +
               ", startOffset=" + OffsetSpec.describe(startOffset) +
               ", maxFetchBytes=" + maxFetchBytes +
               ')';
    }

    public static final class Builder {
        private String groupId = "";
        private long startOffset = 0L;
        private int maxFetchBytes = 0;

        private Builder() {
        }

        public Builder groupId(String groupId) {
            this.groupId = groupId == null ? "" : groupId;
            return this;
        }

        public Builder startOffset(long startOffset) {
            this.startOffset = startOffset;
            return this;
        }

        public Builder maxFetchBytes(int maxFetchBytes) {
            this.maxFetchBytes = maxFetchBytes;
            return this;
        }

        public ConsumerConfig build() {
            return new ConsumerConfig(this);
        }
    }

    private static class ConsumerProperties extends AbstractConfig {
        ConsumerProperties(Map<?, ?> props) {
            super(CONFIG, props);
        }
    }
}
