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

/**
 * Thrown when a fully built configuration breaks one of its validation rules.
 * The {@link #error()} identifies which rule failed and {@link #configName()} the offending key.
 */
public class InvalidConfigurationException extends ConfigException {

    private static final long serialVersionUID = 1L;

    private final ConfigError error;
    private final String configName;

    public InvalidConfigurationException(ConfigError error, String configName, Object value) {
        this(error, configName, value, error.defaultMessage());
    }

    public InvalidConfigurationException(ConfigError error, String configName, Object value, String message) {
        super(configName, value, message);
        this.error = error;
        this.configName = configName;
    }

    public ConfigError error() {
        return error;
    }

    public String configName() {
        return configName;
    }
}
