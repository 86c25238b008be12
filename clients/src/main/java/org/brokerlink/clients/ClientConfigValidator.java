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

import org.brokerlink.common.config.ConfigError;
import org.brokerlink.common.config.ConfigRules;
import org.brokerlink.common.config.InvalidConfigurationException;
import org.brokerlink.common.config.SaslConfigs;
import org.brokerlink.common.config.TlsConfigs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.brokerlink.common.utils.Utils.isEmpty;

/**
 * Checks client configurations before they are handed to the connection layer.
 * <p>
 * Every check evaluates an ordered rule table and reports the first broken rule as an
 * {@link InvalidConfigurationException} whose {@link InvalidConfigurationException#error() error} names the kind of
 * problem. Checks never perform I/O and never modify their input.
 * <ul>
 *     <li>{@link #validate(ClientConfig)} covers brokers, timeouts and the retry budget. TLS and SASL are not
 *     examined.</li>
 *     <li>{@link #checkTls(TlsConfig)} and {@link #checkSasl(SaslConfig)} are run by the connection layer before it
 *     dials.</li>
 *     <li>{@link #validateForConnection(ClientConfig)} runs all of the above plus broker address parsing.</li>
 * </ul>
 */
public final class ClientConfigValidator {

    private static final Logger log = LoggerFactory.getLogger(ClientConfigValidator.class);

    static final ConfigRules<ClientConfig> CLIENT_RULES = ConfigRules.<ClientConfig>builder()
        .require(CommonClientConfigs.BROKERS_CONFIG, ConfigError.EMPTY_BROKER_LIST,
            c -> !c.brokers().isEmpty(), ClientConfig::brokers)
        .require(CommonClientConfigs.CONNECT_TIMEOUT_MS_CONFIG, ConfigError.INVALID_TIMEOUT,
            c -> isPositive(c.connectTimeout()), ClientConfig::connectTimeout)
        .require(CommonClientConfigs.REQUEST_TIMEOUT_MS_CONFIG, ConfigError.INVALID_TIMEOUT,
            c -> isPositive(c.requestTimeout()), ClientConfig::requestTimeout)
        .require(CommonClientConfigs.MAX_RETRIES_CONFIG, ConfigError.INVALID_RETRY_BUDGET,
            c -> c.maxRetries() >= 0, ClientConfig::maxRetries)
        .build();

    static final ConfigRules<TlsConfig> TLS_RULES = ConfigRules.<TlsConfig>builder()
        .require(TlsConfigs.TLS_CA_FILE_CONFIG, ConfigError.MISSING_TRUST_ROOT,
            t -> !t.enabled() || t.insecureSkipVerify() || !isEmpty(t.caFile()), TlsConfig::caFile)
        .require(TlsConfigs.TLS_KEY_FILE_CONFIG, ConfigError.ASYMMETRIC_CLIENT_CERT,
            t -> isEmpty(t.certFile()) || !isEmpty(t.keyFile()), TlsConfig::keyFile,
            "A client certificate is configured in " + TlsConfigs.TLS_CERT_FILE_CONFIG + " without its private key")
        .require(TlsConfigs.TLS_CERT_FILE_CONFIG, ConfigError.ASYMMETRIC_CLIENT_CERT,
            t -> isEmpty(t.keyFile()) || !isEmpty(t.certFile()), TlsConfig::certFile,
            "A private key is configured in " + TlsConfigs.TLS_KEY_FILE_CONFIG + " without its client certificate")
        .build();

    static final ConfigRules<SaslConfig> SASL_RULES = ConfigRules.<SaslConfig>builder()
        .require(SaslConfigs.SASL_MECHANISM_CONFIG, ConfigError.INCOMPLETE_CREDENTIALS,
            s -> !s.enabled() || !isEmpty(s.mechanism()), SaslConfig::mechanism)
        .require(SaslConfigs.SASL_USERNAME_CONFIG, ConfigError.INCOMPLETE_CREDENTIALS,
            s -> !s.enabled() || !isEmpty(s.username()), SaslConfig::username)
        .require(SaslConfigs.SASL_PASSWORD_CONFIG, ConfigError.INCOMPLETE_CREDENTIALS,
            s -> !s.enabled() || !s.password().isEmpty(), SaslConfig::password)
        .build();

    private ClientConfigValidator() {
    }

    /**
     * Validate the connection-level settings of a client configuration. Rules are checked in this order and the
     * first failure is thrown: brokers non-empty, connect timeout positive, request timeout positive, retry budget
     * not negative.
     *
     * @param config the configuration to validate; may not be null
     * @throws InvalidConfigurationException describing the first broken rule
     */
    public static void validate(ClientConfig config) {
        ensureValid(CLIENT_RULES, config, "client");
    }

    /**
     * Same rules as {@link #validate(ClientConfig)}, returning the first violation instead of throwing it.
     */
    public static Optional<InvalidConfigurationException> check(ClientConfig config) {
        return CLIENT_RULES.firstViolation(config);
    }

    /**
     * @return every broken rule of {@link #validate(ClientConfig)}, in rule order
     */
    public static List<InvalidConfigurationException> violations(ClientConfig config) {
        return CLIENT_RULES.violations(config);
    }

    public static boolean isValid(ClientConfig config) {
        return CLIENT_RULES.isValid(config);
    }

    /**
     * Check the TLS section before dialing. A disabled section is only checked for the client certificate pairing,
     * which applies whether or not TLS is enabled.
     *
     * @throws InvalidConfigurationException with {@link ConfigError#MISSING_TRUST_ROOT} or
     *         {@link ConfigError#ASYMMETRIC_CLIENT_CERT}
     */
    public static void checkTls(TlsConfig tls) {
        ensureValid(TLS_RULES, tls, "TLS");
        if (tls.enabled() && tls.insecureSkipVerify())
            log.warn("TLS certificate verification is disabled by {}; broker identities will not be checked",
                TlsConfigs.TLS_INSECURE_SKIP_VERIFY_CONFIG);
    }

    public static boolean isTlsValid(TlsConfig tls) {
        return TLS_RULES.isValid(tls);
    }

    /**
     * Check the SASL section before authenticating. Disabled SASL always passes; enabled SASL needs a mechanism, a
     * username and a password.
     *
     * @throws InvalidConfigurationException with {@link ConfigError#INCOMPLETE_CREDENTIALS} naming the first missing key
     */
    public static void checkSasl(SaslConfig sasl) {
        ensureValid(SASL_RULES, sasl, "SASL");
    }

    public static boolean isSaslValid(SaslConfig sasl) {
        return SASL_RULES.isValid(sasl);
    }

    /**
     * Everything the connection layer needs to hold before dialing: {@link #validate(ClientConfig)}, every broker
     * parses as {@code host:port}, then the TLS and SASL sections when they are present.
     */
    public static void validateForConnection(ClientConfig config) {
        validate(config);
        try {
            ClientUtils.parseAndValidateAddresses(config.brokers());
        } catch (InvalidConfigurationException e) {
            log.debug("Rejecting client configuration: {}", e.getMessage());
            throw e;
        }
        config.tls().ifPresent(ClientConfigValidator::checkTls);
        config.sasl().ifPresent(ClientConfigValidator::checkSasl);
    }

    private static <T> void ensureValid(ConfigRules<T> rules, T config, String section) {
        Optional<InvalidConfigurationException> violation = rules.firstViolation(config);
        if (violation.isPresent()) {
            log.debug("Rejecting {} configuration: {}", section, violation.get().getMessage());
            throw violation.get();
        }
    }

    private static boolean isPositive(Duration duration) {
        return !duration.isNegative() && !duration.isZero();
    }
}
