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
 * The kinds of rule violation a client configuration can be rejected with. Each
 * {@link InvalidConfigurationException} carries exactly one of these.
 */
public enum ConfigError {
    /** No broker address was configured. */
    EMPTY_BROKER_LIST("At least one broker address must be configured"),
    /** A connect or request timeout is zero or negative. */
    INVALID_TIMEOUT("Timeout must be strictly positive"),
    /** The retry budget is negative. */
    INVALID_RETRY_BUDGET("Retry budget must not be negative"),
    /** A broker entry cannot be split into host and port. */
    INVALID_BROKER_ADDRESS("Broker address must be of the form host:port"),
    /** TLS verifies the broker certificate but no CA file was given. */
    MISSING_TRUST_ROOT("A CA file is required when TLS is enabled and certificate verification is not skipped"),
    /** Exactly one of the client certificate and client key was given. */
    ASYMMETRIC_CLIENT_CERT("Client certificate and key must be configured together"),
    /** SASL is enabled without mechanism, username and password all present. */
    INCOMPLETE_CREDENTIALS("SASL mechanism, username and password are all required when SASL is enabled"),
    /** The producer batch timeout is zero or negative. */
    INVALID_BATCH_TIMEOUT("Batch timeout must be strictly positive"),
    /** The producer compression codec is not a known one. */
    UNKNOWN_COMPRESSION("Compression type must name a known codec"),
    /** The consumer fetch budget is zero or negative. */
    INVALID_FETCH_SIZE("Max fetch bytes must be strictly positive"),
    /** A group consumer has no group id. */
    MISSING_GROUP_IDENTITY("Group id is required for group membership"),
    /** A group consumer subscribes to no topic. */
    EMPTY_SUBSCRIPTION("At least one topic must be subscribed");

    private final String defaultMessage;

    ConfigError(String defaultMessage) {
        this.defaultMessage = defaultMessage;
    }

    public String defaultMessage() {
        return defaultMessage;
    }
}
