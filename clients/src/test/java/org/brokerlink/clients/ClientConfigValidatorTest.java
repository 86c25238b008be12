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

import org.apache.logging.log4j.Level;
import org.brokerlink.common.config.ConfigError;
import org.brokerlink.common.config.InvalidConfigurationException;
import org.brokerlink.common.config.SaslConfigs;
import org.brokerlink.common.config.TlsConfigs;
import org.brokerlink.common.config.types.Password;
import org.brokerlink.common.utils.LogCaptureAppender;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static java.util.Arrays.asList;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ClientConfigValidatorTest {

    @Test
    public void testDefaultsAreValid() {
        assertDoesNotThrow(() -> ClientConfigValidator.validate(ClientConfig.defaults()));
        assertTrue(ClientConfigValidator.isValid(ClientConfig.defaults()));
        assertFalse(ClientConfigValidator.check(ClientConfig.defaults()).isPresent());
    }

    @Test
    public void testExampleConfigIsValid() {
        ClientConfig config = ClientConfig.builder()
            .brokers(Collections.singletonList("localhost:9092"))
            .connectTimeout(Duration.ofSeconds(10))
            .requestTimeout(Duration.ofSeconds(30))
            .maxConnectionsPerBroker(5)
            .build();
        assertDoesNotThrow(() -> ClientConfigValidator.validate(config));
    }

    @Test
    public void testValidWhateverTheOtherFields() {
        ClientConfig config = ClientConfig.builder()
            .brokers(asList("b1:9092", "b2:9092", "not even an address"))
            .connectTimeout(Duration.ofNanos(1))
            .requestTimeout(Duration.ofDays(1))
            .maxConnectionsPerBroker(0)
            .maxRetries(0)
            .tls(TlsConfig.builder().enabled(true).build())
            .sasl(SaslConfig.builder().enabled(true).build())
            .build();
        assertDoesNotThrow(() -> ClientConfigValidator.validate(config));
    }

    @Test
    public void testNullAndEmptyBrokersAreTheSameError() {
        ClientConfig nullBrokers = ClientConfig.defaults().toBuilder().brokers(null).build();
        ClientConfig emptyBrokers = ClientConfig.defaults().toBuilder().brokers(Collections.emptyList()).build();
        assertError(ConfigError.EMPTY_BROKER_LIST, CommonClientConfigs.BROKERS_CONFIG, nullBrokers);
        assertError(ConfigError.EMPTY_BROKER_LIST, CommonClientConfigs.BROKERS_CONFIG, emptyBrokers);
    }

    @Test
    public void testZeroOrNegativeConnectTimeout() {
        assertError(ConfigError.INVALID_TIMEOUT, CommonClientConfigs.CONNECT_TIMEOUT_MS_CONFIG,
            ClientConfig.defaults().toBuilder().connectTimeout(Duration.ZERO).build());
        assertError(ConfigError.INVALID_TIMEOUT, CommonClientConfigs.CONNECT_TIMEOUT_MS_CONFIG,
            ClientConfig.defaults().toBuilder().connectTimeout(Duration.ofMillis(-1)).build());
        assertError(ConfigError.INVALID_TIMEOUT, CommonClientConfigs.CONNECT_TIMEOUT_MS_CONFIG,
            ClientConfig.defaults().toBuilder().connectTimeout(null).build());
    }

    @Test
    public void testZeroOrNegativeRequestTimeout() {
        assertError(ConfigError.INVALID_TIMEOUT, CommonClientConfigs.REQUEST_TIMEOUT_MS_CONFIG,
            ClientConfig.defaults().toBuilder().requestTimeout(Duration.ZERO).build());
        assertError(ConfigError.INVALID_TIMEOUT, CommonClientConfigs.REQUEST_TIMEOUT_MS_CONFIG,
            ClientConfig.defaults().toBuilder().requestTimeout(Duration.ofSeconds(-30)).build());
    }

    @Test
    public void testTimeoutsTooLargeForMillisAreReported() {
        Duration huge = Duration.ofSeconds(Long.MIN_VALUE / 10);

        ClientConfig connect = ClientConfig.defaults().toBuilder().connectTimeout(huge).build();
        assertError(ConfigError.INVALID_TIMEOUT, CommonClientConfigs.CONNECT_TIMEOUT_MS_CONFIG, connect);
        Optional<InvalidConfigurationException> violation = ClientConfigValidator.check(connect);
        assertTrue(violation.isPresent());
        assertTrue(violation.get().getMessage().contains(huge.toString()));
        assertEquals(1, ClientConfigValidator.violations(connect).size());

        ClientConfig request = ClientConfig.defaults().toBuilder().requestTimeout(huge).build();
        assertError(ConfigError.INVALID_TIMEOUT, CommonClientConfigs.REQUEST_TIMEOUT_MS_CONFIG, request);
        violation = ClientConfigValidator.check(request);
        assertTrue(violation.isPresent());
        assertEquals(CommonClientConfigs.REQUEST_TIMEOUT_MS_CONFIG, violation.get().configName());

        ClientConfig both = connect.toBuilder().requestTimeout(huge).build();
        List<InvalidConfigurationException> violations = ClientConfigValidator.violations(both);
        assertEquals(2, violations.size());
        assertEquals(CommonClientConfigs.CONNECT_TIMEOUT_MS_CONFIG, violations.get(0).configName());
        assertEquals(CommonClientConfigs.REQUEST_TIMEOUT_MS_CONFIG, violations.get(1).configName());
    }

    @ParameterizedTest
    @ValueSource(ints = {-1, -3, Integer.MIN_VALUE})
    public void testNegativeRetryBudget(int maxRetries) {
        assertError(ConfigError.INVALID_RETRY_BUDGET, CommonClientConfigs.MAX_RETRIES_CONFIG,
            ClientConfig.defaults().toBuilder().maxRetries(maxRetries).build());
    }

    @Test
    public void testZeroRetriesMeansOneAttempt() {
        ClientConfig config = ClientConfig.defaults().toBuilder().maxRetries(0).build();
        assertTrue(ClientConfigValidator.isValid(config));
        assertEquals(1, config.maxAttempts());
    }

    @Test
    public void testFirstFailureWins() {
        ClientConfig config = ClientConfig.builder().maxRetries(-1).build();
        assertError(ConfigError.EMPTY_BROKER_LIST, CommonClientConfigs.BROKERS_CONFIG, config);

        List<InvalidConfigurationException> violations = ClientConfigValidator.violations(config);
        assertEquals(4, violations.size());
        assertEquals(CommonClientConfigs.BROKERS_CONFIG, violations.get(0).configName());
        assertEquals(CommonClientConfigs.CONNECT_TIMEOUT_MS_CONFIG, violations.get(1).configName());
        assertEquals(CommonClientConfigs.REQUEST_TIMEOUT_MS_CONFIG, violations.get(2).configName());
        assertEquals(CommonClientConfigs.MAX_RETRIES_CONFIG, violations.get(3).configName());
    }

    @Test
    public void testCheckReturnsTheSameErrorAsValidate() {
        ClientConfig config = ClientConfig.defaults().toBuilder().requestTimeout(Duration.ZERO).build();
        Optional<InvalidConfigurationException> violation = ClientConfigValidator.check(config);
        assertTrue(violation.isPresent());
        assertEquals(ConfigError.INVALID_TIMEOUT, violation.get().error());
        assertEquals("Invalid value PT0S for configuration request.timeout.ms: " + ConfigError.INVALID_TIMEOUT.defaultMessage(),
            violation.get().getMessage());
    }

    @Test
    public void testValidateIgnoresTlsAndSasl() {
        ClientConfig config = ClientConfig.defaults().toBuilder()
            .tls(TlsConfig.builder().enabled(true).certFile("client.pem").build())
            .sasl(SaslConfig.builder().enabled(true).build())
            .build();
        assertDoesNotThrow(() -> ClientConfigValidator.validate(config));
    }

    @Test
    public void testNullConfig() {
        assertThrows(NullPointerException.class, () -> ClientConfigValidator.validate(null));
    }

    @Test
    public void testTlsRequiresTrustRootUnlessVerificationIsSkipped() {
        TlsConfig noCa = TlsConfig.builder().enabled(true).insecureSkipVerify(false).caFile("").build();
        InvalidConfigurationException e = assertThrows(InvalidConfigurationException.class,
            () -> ClientConfigValidator.checkTls(noCa));
        assertEquals(ConfigError.MISSING_TRUST_ROOT, e.error());
        assertEquals(TlsConfigs.TLS_CA_FILE_CONFIG, e.configName());

        TlsConfig skipVerify = noCa.toBuilder().insecureSkipVerify(true).build();
        assertDoesNotThrow(() -> ClientConfigValidator.checkTls(skipVerify));
        assertTrue(ClientConfigValidator.isTlsValid(skipVerify));

        TlsConfig withCa = noCa.toBuilder().caFile("/etc/ca.pem").build();
        assertTrue(ClientConfigValidator.isTlsValid(withCa));
    }

    @Test
    public void testSkippedVerificationIsLoggedAsWarning() {
        TlsConfig insecure = TlsConfig.builder().enabled(true).insecureSkipVerify(true).build();
        try (LogCaptureAppender appender = LogCaptureAppender.createAndRegister(ClientConfigValidator.class)) {
            ClientConfigValidator.checkTls(insecure);
            List<String> warnings = appender.getMessages(Level.WARN);
            assertEquals(1, warnings.size());
            assertTrue(warnings.get(0).contains(TlsConfigs.TLS_INSECURE_SKIP_VERIFY_CONFIG));
        }
    }

    @Test
    public void testVerifiedOrDisabledTlsLogsNoWarning() {
        TlsConfig verified = TlsConfig.builder().enabled(true).caFile("/etc/ca.pem").build();
        TlsConfig disabled = TlsConfig.builder().enabled(false).insecureSkipVerify(true).build();
        try (LogCaptureAppender appender = LogCaptureAppender.createAndRegister(ClientConfigValidator.class)) {
            ClientConfigValidator.checkTls(verified);
            ClientConfigValidator.checkTls(disabled);
            assertTrue(appender.getMessages(Level.WARN).isEmpty());
        }
    }

    @Test
    public void testDisabledTlsNeedsNoTrustRoot() {
        assertTrue(ClientConfigValidator.isTlsValid(TlsConfig.disabled()));
        assertTrue(ClientConfigValidator.isTlsValid(TlsConfig.builder().serverName("broker.internal").build()));
    }

    @Test
    public void testAsymmetricClientCertificateInEveryMode() {
        for (boolean enabled : new boolean[] {true, false}) {
            for (boolean skipVerify : new boolean[] {true, false}) {
                TlsConfig.Builder base = TlsConfig.builder()
                    .enabled(enabled)
                    .insecureSkipVerify(skipVerify)
                    .caFile("/etc/ca.pem");

                TlsConfig certOnly = base.certFile("client.pem").keyFile("").build();
                InvalidConfigurationException e = assertThrows(InvalidConfigurationException.class,
                    () -> ClientConfigValidator.checkTls(certOnly));
                assertEquals(ConfigError.ASYMMETRIC_CLIENT_CERT, e.error());
                assertEquals(TlsConfigs.TLS_KEY_FILE_CONFIG, e.configName());

                TlsConfig keyOnly = base.certFile("").keyFile("client.key").build();
                e = assertThrows(InvalidConfigurationException.class, () -> ClientConfigValidator.checkTls(keyOnly));
                assertEquals(ConfigError.ASYMMETRIC_CLIENT_CERT, e.error());
                assertEquals(TlsConfigs.TLS_CERT_FILE_CONFIG, e.configName());

                TlsConfig both = base.certFile("client.pem").keyFile("client.key").build();
                assertTrue(ClientConfigValidator.isTlsValid(both));
            }
        }
    }

    @Test
    public void testTrustRootIsCheckedBeforeCertificatePairing() {
        TlsConfig config = TlsConfig.builder().enabled(true).certFile("client.pem").build();
        InvalidConfigurationException e = assertThrows(InvalidConfigurationException.class,
            () -> ClientConfigValidator.checkTls(config));
        assertEquals(ConfigError.MISSING_TRUST_ROOT, e.error());
    }

    @Test
    public void testSaslMissingPassword() {
        SaslConfig config = SaslConfig.builder()
            .enabled(true)
            .mechanism(SaslConfigs.SCRAM_SHA_256_MECHANISM)
            .username("user")
            .password("")
            .build();
        InvalidConfigurationException e = assertThrows(InvalidConfigurationException.class,
            () -> ClientConfigValidator.checkSasl(config));
        assertEquals(ConfigError.INCOMPLETE_CREDENTIALS, e.error());
        assertEquals(SaslConfigs.SASL_PASSWORD_CONFIG, e.configName());
        assertTrue(e.getMessage().contains(Password.HIDDEN));
    }

    @Test
    public void testSaslNullPasswordIsMissing() {
        SaslConfig config = SaslConfig.builder()
            .enabled(true)
            .mechanism(SaslConfigs.PLAIN_MECHANISM)
            .username("user")
            .password(new Password(null))
            .build();
        assertSaslError(SaslConfigs.SASL_PASSWORD_CONFIG, config);
        assertTrue(ClientConfigValidator.isSaslValid(config.toBuilder().enabled(false).build()));
    }

    @Test
    public void testSaslEachFieldRequiredWhenEnabled() {
        SaslConfig complete = SaslConfig.builder()
            .enabled(true)
            .mechanism(SaslConfigs.PLAIN_MECHANISM)
            .username("user")
            .password("pass")
            .build();
        assertTrue(ClientConfigValidator.isSaslValid(complete));

        assertSaslError(SaslConfigs.SASL_MECHANISM_CONFIG, complete.toBuilder().mechanism("").build());
        assertSaslError(SaslConfigs.SASL_USERNAME_CONFIG, complete.toBuilder().username("").build());
        assertSaslError(SaslConfigs.SASL_PASSWORD_CONFIG, complete.toBuilder().password("").build());
        assertSaslError(SaslConfigs.SASL_MECHANISM_CONFIG, SaslConfig.builder().enabled(true).build());
    }

    @Test
    public void testDisabledSaslIsAlwaysValid() {
        assertTrue(ClientConfigValidator.isSaslValid(SaslConfig.disabled()));
        assertTrue(ClientConfigValidator.isSaslValid(SaslConfig.builder().username("user").build()));
        assertTrue(ClientConfigValidator.isSaslValid(SaslConfig.builder()
            .mechanism(SaslConfigs.PLAIN_MECHANISM)
            .username("user")
            .password("pass")
            .build()));
    }

    @Test
    public void testValidateForConnection() {
        assertDoesNotThrow(() -> ClientConfigValidator.validateForConnection(ClientConfig.defaults()));

        ClientConfig noPort = ClientConfig.defaults().toBuilder().brokers(Collections.singletonList("localhost")).build();
        InvalidConfigurationException e = assertThrows(InvalidConfigurationException.class,
            () -> ClientConfigValidator.validateForConnection(noPort));
        assertEquals(ConfigError.INVALID_BROKER_ADDRESS, e.error());
        assertEquals(CommonClientConfigs.BROKERS_CONFIG, e.configName());
    }

    @Test
    public void testValidateForConnectionRunsBaseRulesFirst() {
        ClientConfig config = ClientConfig.defaults().toBuilder()
            .brokers(Collections.singletonList("localhost"))
            .connectTimeout(Duration.ZERO)
            .build();
        assertError(ConfigError.INVALID_TIMEOUT, CommonClientConfigs.CONNECT_TIMEOUT_MS_CONFIG, config);
        InvalidConfigurationException e = assertThrows(InvalidConfigurationException.class,
            () -> ClientConfigValidator.validateForConnection(config));
        assertEquals(ConfigError.INVALID_TIMEOUT, e.error());
    }

    @Test
    public void testValidateForConnectionChecksPresentSections() {
        ClientConfig badTls = ClientConfig.defaults().toBuilder()
            .tls(TlsConfig.builder().enabled(true).build())
            .build();
        InvalidConfigurationException e = assertThrows(InvalidConfigurationException.class,
            () -> ClientConfigValidator.validateForConnection(badTls));
        assertEquals(ConfigError.MISSING_TRUST_ROOT, e.error());

        ClientConfig badSasl = ClientConfig.defaults().toBuilder()
            .tls(TlsConfig.builder().enabled(true).caFile("/etc/ca.pem").build())
            .sasl(SaslConfig.builder().enabled(true).mechanism(SaslConfigs.PLAIN_MECHANISM).build())
            .build();
        e = assertThrows(InvalidConfigurationException.class, () -> ClientConfigValidator.validateForConnection(badSasl));
        assertEquals(ConfigError.INCOMPLETE_CREDENTIALS, e.error());
        assertEquals(SaslConfigs.SASL_USERNAME_CONFIG, e.configName());

        ClientConfig insecure = ClientConfig.defaults().toBuilder()
            .tls(TlsConfig.builder().enabled(true).insecureSkipVerify(true).build())
            .build();
        assertDoesNotThrow(() -> ClientConfigValidator.validateForConnection(insecure));
    }

    @Test
    public void testValidationDoesNotModifyTheConfig() {
        ClientConfig config = ClientConfig.defaults().toBuilder()
            .tls(TlsConfig.builder().enabled(true).caFile("/etc/ca.pem").build())
            .build();
        ClientConfig copy = config.toBuilder().build();
        ClientConfigValidator.validateForConnection(config);
        assertEquals(copy, config);
    }

    private static void assertError(ConfigError expected, String configName, ClientConfig config) {
        InvalidConfigurationException e = assertThrows(InvalidConfigurationException.class,
            () -> ClientConfigValidator.validate(config));
        assertEquals(expected, e.error());
        assertEquals(configName, e.configName());
        assertFalse(ClientConfigValidator.isValid(config));
    }

    private static void assertSaslError(String configName, SaslConfig config) {
        InvalidConfigurationException e = assertThrows(InvalidConfigurationException.class,
            () -> ClientConfigValidator.checkSasl(config));
        assertEquals(ConfigError.INCOMPLETE_CREDENTIALS, e.error());
        assertEquals(configName, e.configName());
        assertFalse(ClientConfigValidator.isSaslValid(config));
    }
}
