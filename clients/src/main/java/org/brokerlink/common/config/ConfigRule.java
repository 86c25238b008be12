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

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * A single validation rule over a configuration value object: the config key it concerns, the condition the
 * value must satisfy, and the {@link ConfigError} reported when it does not.
 *
 * @param <T> the configuration type the rule inspects
 */
public final class ConfigRule<T> {

    private final String name;
    private final ConfigError error;
    private final Predicate<T> condition;
    private final Function<T, Object> value;
    private final String message;

    ConfigRule(String name, ConfigError error, Predicate<T> condition, Function<T, Object> value, String message) {
        this.name = Objects.requireNonNull(name, "name");
        this.error = Objects.requireNonNull(error, "error");
        this.condition = Objects.requireNonNull(condition, "condition");
        this.value = Objects.requireNonNull(value, "value");
        this.message = message == null ? error.defaultMessage() : message;
    }

    public String name() {
        return name;
    }

    public ConfigError error() {
        return error;
    }

    /**
     * @return the violation if {@code config} breaks this rule, otherwise empty
     */
    public Optional<InvalidConfigurationException> check(T config) {
        if (condition.test(config))
            return Optional.empty();
        return Optional.of(new InvalidConfigurationException(error, name, value.apply(config), message));
    }

    @Override
    public String toString() {
        return name + ": " + message;
    }
}
