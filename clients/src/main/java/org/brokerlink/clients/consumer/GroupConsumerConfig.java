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

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Configuration of a consumer that joins a group and subscribes to a fixed set of topics.
 * <p>
 * Topics keep the order they were declared in; a topic listed twice is subscribed once and blank names are dropped.
 */
public final class GroupConsumerConfig {

    /*
     * NOTE: DO NOT CHANGE EITHER CONFIG STRINGS OR THEIR JAVA VARIABLE NAMES AS THESE ARE PART OF THE PUBLIC API AND
     * CHANGE WILL BREAK USER CODE.
     */

    private static final ConfigDef CONFIG;

    /** <code>group.id</code> */
    public static final String GROUP_ID_CONFIG = CommonClientConfigs.GROUP_ID_CONFIG;

    /** <code>topics</code> */
    public static final String TOPICS_CONFIG = "topics";
    private static final String TOPICS_DOC = "Comma separated list of the topics the group consumer subscribes to. "
                                             + "At least one topic is required.";

    static final ConfigRules<GroupConsumerConfig> RULES = ConfigRules.<GroupConsumerConfig>builder()
        .require(GROUP_ID_CONFIG, ConfigError.MISSING_GROUP_IDENTITY,
            g -> !g.groupId.isEmpty(), g -> g.groupId)
        .require(TOPICS_CONFIG, ConfigError.EMPTY_SUBSCRIPTION,
            g -> !g.topics.isEmpty(), g -> g.topics)
        .build();

    static {
        CONFIG = new ConfigDef().define(GROUP_ID_CONFIG, Type.STRING, "", Importance.HIGH, CommonClientConfigs.GROUP_ID_DOC)
                                .define(TOPICS_CONFIG, Type.LIST, Collections.emptyList(), Importance.HIGH, TOPICS_DOC);
    }

    private final String groupId;
    private final Set<String> topics;

    private GroupConsumerConfig(Builder builder) {
        this.groupId = builder.groupId;
        this.topics = Collections.unmodifiableSet(new LinkedHashSet<>(builder.topics));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static GroupConsumerConfig fromProperties(Map<?, ?> props) {
        GroupConsumerProperties config = new GroupConsumerProperties(props);
        GroupConsumerConfig groupConfig = builder()
            .groupId(config.getString(GROUP_ID_CONFIG))
            .topics(config.getList(TOPICS_CONFIG))
            .build();
        config.logUnused();
        return groupConfig;
    }

    public static ConfigDef configDef() {
        return new ConfigDef(CONFIG);
    }

    public Builder toBuilder() {
        return builder()
            .groupId(groupId)
            .topics(topics);
    }

    /**
     * Check that the consumer can join its group: a group id is set, then at least one topic is subscribed.
     *
     * @throws InvalidConfigurationException with {@link ConfigError#MISSING_GROUP_IDENTITY} or
     *         {@link ConfigError#EMPTY_SUBSCRIPTION}
     */
    public void validate() {
        RULES.ensureValid(this);
    }

    public List<InvalidConfigurationException> violations() {
        return RULES.violations(this);
    }

    /**
     * @return true iff the group id is non-empty and at least one topic is subscribed
     */
    public boolean isValid() {
        return RULES.isValid(this);
    }

    public String groupId() {
        return groupId;
    }

    /**
     * @return the subscribed topics in declaration order
     */
    public Set<String> topics() {
        return topics;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GroupConsumerConfig that = (GroupConsumerConfig) o;
        return groupId.equals(that.groupId) &&
               topics.equals(that.topics);
    }

    @Override
    public int hashCode() {
        return Objects.hash(groupId, topics);
    }

    @Override
    public String toString() {
        return "GroupConsumerConfig(" +
               "groupId='" + groupId + '\'' +
               ", topics=" + topics +
               ')';
    }

    public static final class Builder {
        private String groupId = "";
        private final Set<String> topics = new LinkedHashSet<>();

        private Builder() {
        }

        public Builder groupId(String groupId) {
            this.groupId = groupId == null ? "" : groupId;
            return this;
        }

        /**
         * Replace the subscription. A null collection clears it; null and empty topic names are ignored.
         */
        public Builder topics(Collection<String> topics) {
            this.topics.clear();
            if (topics != null) {
                for (String topic : topics)
                    topic(topic);
            }
            return this;
        }

        /**
         * Add a topic to the subscription. A null or empty name is ignored.
         */
        public Builder topic(String topic) {
            if (topic != null && !topic.isEmpty())
                this.topics.add(topic);
            return this;
        }

        public GroupConsumerConfig build() {
            return new GroupConsumerConfig(this);
        }
    }

    private static class GroupConsumerProperties extends AbstractConfig {
        GroupConsumerProperties(Map<?, ?> props) {
            super(CONFIG, props);
        }
    }
}
