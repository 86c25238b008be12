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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * An ordered table of {@link ConfigRule}s for one configuration type.
 * <p>
 * Rules are evaluated in the order they were added. {@link #ensureValid(Object)} and {@link #firstViolation(Object)}
 * stop at the first broken rule, so the reported error is deterministic for a given input. {@link #violations(Object)}
 * evaluates the whole table for callers that want to surface every problem at once.
 * <p>
 * To use the class:
 * <pre>
 * ConfigRules&lt;ConsumerConfig&gt; rules = ConfigRules.&lt;ConsumerConfig&gt;builder()
 *     .require("max.fetch.bytes", ConfigError.INVALID_FETCH_SIZE,
 *         c -&gt; c.maxFetchBytes() &gt; 0, ConsumerConfig::maxFetchBytes)
 *     .build();
 * rules.ensureValid(config);
 * </pre>
 *
 * @param <T> the configuration type the rules inspect
 */
public final class ConfigRules<T> {

    private final List<ConfigRule<T>> rules;

    private ConfigRules(List<ConfigRule<T>> rules) {
        this.rules = Collections.unmodifiableList(new ArrayList<>(rules));
    }

    public static <T> Builder<T> builder() {
        return new Builder<>();
    }

    public List<ConfigRule<T>> rules() {
        return rules;
    }

    /**
     * Check the rules in order and throw on the first one that is broken.
     * @param config the configuration to check; may not be null
     * @throws InvalidConfigurationException describing the first broken rule
     */
    public void ensureValid(T config) {
        Optional<InvalidConfigurationException> violation = firstViolation(config);
        if (violation.isPresent())
            throw violation.get();
    }

    public Optional<InvalidConfigurationException> firstViolation(T config) {
        Objects.requireNonNull(config, "config");
        for (ConfigRule<T> rule : rules) {
            Optional<InvalidConfigurationException> violation = rule.check(config);
            if (violation.isPresent())
                return violation;
        }
        return Optional.empty();
    }

    public List<InvalidConfigurationException> violations(T config) {
        Objects.requireNonNull(config, "config");
        List<InvalidConfigurationException> violations = new ArrayList<>();
        for (ConfigRule<T> rule : rules)
            rule.check(config).ifPresent(violations::add);
        return violations;
    }

    public boolean isValid(T config) {
        return !firstViolation(config).isPresent();
    }

    public static final class Builder<T> {
        private final List<ConfigRule<T>> rules = new ArrayList<>();

        private Builder() {
        }

        /**
         * Append a rule using the default message of its {@link ConfigError}.
         * @param name      the config key the rule concerns
         * @param error     the error reported when the condition does not hold
         * @param condition must hold for a valid configuration
         * @param value     extracts the offending value for the error message
         * @return this
         */
        public Builder<T> require(String name, ConfigError error, Predicate<T> condition, Function<T, Object> value) {
            return require(name, error, condition, value, null);
        }

        public Builder<T> require(String name, ConfigError error, Predicate<T> condition, Function<T, Object> value,
                                  String message) {
            rules.add(new ConfigRule<>(name, error, condition, value, message));
            return this;
        }

        public ConfigRules<T> build() {
            return new ConfigRules<>(rules);
        }
    }
}
