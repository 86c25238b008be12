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

import org.brokerlink.common.config.ConfigDef.Importance;
import org.brokerlink.common.config.ConfigDef.Type;
import org.brokerlink.common.config.ConfigException;
import org.brokerlink.common.config.SaslConfigs;
import org.brokerlink.common.config.TlsConfigs;
import org.brokerlink.common.config.types.Password;
import org.brokerlink.common.security.auth.SecurityProtocol;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import static java.util.Arrays.asList;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ClientConfigTest {

    @Test
    public void testDefaults() {
        ClientConfig config = ClientConfig.defaults();
        assertEquals(Collections.singletonList("localhost:9092"), config.brokers());
        assertEquals(Duration.ofSeconds(10), config.connectTimeout());
        assertEquals(Duration.ofSeconds(30), config.requestTimeout());
        assertEquals(5, config.maxConnectionsPerBroker());
        assertEquals(3, config.maxRetries());
        assertEquals(4, config.maxAttempts());
        assertFalse(config.tls().isPresent());
        assertFalse(config.sasl().isPresent());
        assertEquals(SecurityProtocol.PLAINTEXT, config.securityProtocol());
    }

    @Test
    public void testDefaultsAreFreshInstances() {
        ClientConfig first = ClientConfig.defaults();
        ClientConfig second = ClientConfig.defaults();
        assertNotSame(first, second);
        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());

        ClientConfig changed = first.toBuilder().maxRetries(7).build();
        assertEquals(3, first.maxRetries());
        assertEquals(7, changed.maxRetries());
        assertEquals(second, ClientConfig.defaults());
    }

    @Test
    public void testEmptyBuilder() {
        ClientConfig config = ClientConfig.builder().build();
        assertTrue(config.brokers().isEmpty());
        assertEquals(Duration.ZERO, config.connectTimeout());
        assertEquals(Duration.ZERO, config.requestTimeout());
        assertEquals(0, config.maxRetries());
    }

    @Test
    public void testBrokersAreCopiedAndUnmodifiable() {
        List<String> brokers = new ArrayList<>(asList("b1:9092", "b2:9092"));
        ClientConfig config = ClientConfig.builder().brokers(brokers).build();
        brokers.add("b3:9092");
        assertEquals(asList("b1:9092", "b2:9092"), config.brokers());
        assertThrows(UnsupportedOperationException.class, () -> config.brokers().add("b4:9092"));
    }

    @Test
    public void testSecurityProtocol() {
        TlsConfig tls = TlsConfig.builder().enabled(true).caFile("/etc/ca.pem").build();
        SaslConfig sasl = SaslConfig.builder().enabled(true).build();
        ClientConfig config = ClientConfig.defaults();
        assertEquals(SecurityProtocol.SSL, config.toBuilder().tls(tls).build().securityProtocol());
        assertEquals(SecurityProtocol.SASL_PLAINTEXT, config.toBuilder().sasl(sasl).build().securityProtocol());
        assertEquals(SecurityProtocol.SASL_SSL, config.toBuilder().tls(tls).sasl(sasl).build().securityProtocol());
        assertEquals(SecurityProtocol.PLAINTEXT, config.toBuilder().tls(TlsConfig.disabled()).build().securityProtocol());
    }

    @Test
    public void testAbsentAndDisabledSectionsDiffer() {
        ClientConfig absent = ClientConfig.defaults();
        ClientConfig disabled = absent.toBuilder().tls(TlsConfig.disabled()).build();
        assertFalse(absent.equals(disabled));
        assertEquals(absent, disabled.toBuilder().tls(null).build());
    }

    @Test
    public void testFromEmptyPropertiesEqualsDefaults() {
        assertEquals(ClientConfig.defaults(), ClientConfig.fromProperties(new Properties()));
    }

    @Test
    public void testFromProperties() {
        Properties props = new Properties();
        props.put(CommonClientConfigs.BROKERS_CONFIG, "b1:9092, b2:9093");
        props.put(CommonClientConfigs.CONNECT_TIMEOUT_MS_CONFIG, "2500");
        props.put(CommonClientConfigs.REQUEST_TIMEOUT_MS_CONFIG, 60000);
        props.put(CommonClientConfigs.MAX_CONNECTIONS_PER_BROKER_CONFIG, "2");
        props.put(CommonClientConfigs.MAX_RETRIES_CONFIG, "0");
        props.put(TlsConfigs.TLS_ENABLED_CONFIG, "true");
        props.put(TlsConfigs.TLS_CA_FILE_CONFIG, "/etc/ca.pem");
        props.put(SaslConfigs.SASL_PASSWORD_CONFIG, "s3cret");

        ClientConfig config = ClientConfig.fromProperties(props);
        assertEquals(asList("b1:9092", "b2:9093"), config.brokers());
        assertEquals(Duration.ofMillis(2500), config.connectTimeout());
        assertEquals(Duration.ofMinutes(1), config.requestTimeout());
        assertEquals(2, config.maxConnectionsPerBroker());
        assertEquals(0, config.maxRetries());

        assertTrue(config.tls().isPresent());
        assertEquals(TlsConfig.builder().enabled(true).caFile("/etc/ca.pem").build(), config.tls().get());

        assertTrue(config.sasl().isPresent());
        assertFalse(config.sasl().get().enabled());
        assertEquals(new Password("s3cret"), config.sasl().get().password());
        assertEquals(SecurityProtocol.SSL, config.securityProtocol());
    }

    @Test
    public void testFromPropertiesIgnoresUnknownKeys() {
        Map<String, Object> props = new HashMap<>();
        props.put("linger.ms", "5");
        assertEquals(ClientConfig.defaults(), ClientConfig.fromProperties(props));
    }

    @Test
    public void testFromPropertiesOnlyChecksTypes() {
        Map<String, Object> props = new HashMap<>();
        props.put(CommonClientConfigs.BROKERS_CONFIG, "");
        props.put(CommonClientConfigs.MAX_RETRIES_CONFIG, "-1");
        ClientConfig config = ClientConfig.fromProperties(props);
        assertTrue(config.brokers().isEmpty());
        assertEquals(-1, config.maxRetries());
    }

    @Test
    public void testFromPropertiesRejectsMalformedValues() {
        assertThrows(ConfigException.class,
            () -> ClientConfig.fromProperties(Collections.singletonMap(CommonClientConfigs.CONNECT_TIMEOUT_MS_CONFIG, "ten")));
        assertThrows(ConfigException.class,
            () -> ClientConfig.fromProperties(Collections.singletonMap(TlsConfigs.TLS_ENABLED_CONFIG, "yes")));
        assertThrows(ConfigException.class,
            () -> ClientConfig.fromProperties(Collections.singletonMap(CommonClientConfigs.MAX_CONNECTIONS_PER_BROKER_CONFIG, "-1")));
    }

    @Test
    public void testConfigDefIsACopy() {
        ClientConfig.configDef().define("extra", Type.INT, 1, Importance.LOW, "");
        assertFalse(ClientConfig.configDef().names().contains("extra"));
        assertTrue(ClientConfig.configDef().names().contains(SaslConfigs.SASL_PASSWORD_CONFIG));
    }

    @Test
    public void testToStringHidesPassword() {
        ClientConfig config = ClientConfig.defaults().toBuilder()
            .sasl(SaslConfig.builder().enabled(true).username("user").password("s3cret").build())
            .build();
        assertFalse(config.toString().contains("s3cret"));
        assertTrue(config.toString().contains(Password.HIDDEN));
    }
}
