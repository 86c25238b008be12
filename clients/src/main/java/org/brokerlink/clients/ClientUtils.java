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
import org.brokerlink.common.config.InvalidConfigurationException;

import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.List;

import static org.brokerlink.common.utils.Utils.getHost;
import static org.brokerlink.common.utils.Utils.getPort;

public final class ClientUtils {

    private static final int MAX_PORT = 65535;

    private ClientUtils() {
    }

    /**
     * Turn the configured broker list into socket addresses, keeping the configured dial order. Host names are
     * left unresolved; resolving them is the dialer's job.
     *
     * @param brokers the broker addresses, each of the form {@code host:port} or {@code [ipv6]:port}
     * @return one unresolved address per non-empty broker entry; null and empty entries are skipped
     * @throws InvalidConfigurationException if no entry is left or an entry is not a valid address
     */
    public static List<InetSocketAddress> parseAndValidateAddresses(List<String> brokers) {
        if (brokers == null || brokers.isEmpty())
            throw new InvalidConfigurationException(ConfigError.EMPTY_BROKER_LIST, CommonClientConfigs.BROKERS_CONFIG, brokers);
        List<InetSocketAddress> addresses = new ArrayList<>(brokers.size());
        for (String broker : brokers) {
            if (broker == null || broker.isEmpty())
                continue;
            String host = getHost(broker);
            Integer port = getPort(broker);
            if (host == null || host.isEmpty() || port == null)
                throw new InvalidConfigurationException(ConfigError.INVALID_BROKER_ADDRESS, CommonClientConfigs.BROKERS_CONFIG,
                    broker, "Invalid url in " + CommonClientConfigs.BROKERS_CONFIG + ": " + broker);
            if (port > MAX_PORT)
                throw new InvalidConfigurationException(ConfigError.INVALID_BROKER_ADDRESS, CommonClientConfigs.BROKERS_CONFIG,
                    broker, "Invalid port in " + CommonClientConfigs.BROKERS_CONFIG + ": " + broker);
            addresses.add(InetSocketAddress.createUnresolved(host, port));
        }
        if (addresses.isEmpty())
            throw new InvalidConfigurationException(ConfigError.EMPTY_BROKER_LIST, CommonClientConfigs.BROKERS_CONFIG, brokers);
        return addresses;
    }
}
