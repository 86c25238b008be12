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

import java.util.Collections;
import java.util.List;

/**
 * Configurations shared by every client role
 */
public class CommonClientConfigs {

    /*
     * NOTE: DO NOT CHANGE EITHER CONFIG NAMES AS THESE ARE PART OF THE PUBLIC API AND CHANGE WILL BREAK USER CODE.
     */

    public static final String BROKERS_CONFIG = "brokers";
    public static final String BROKERS_DOC = "A list of host/port pairs of the brokers to connect to, in the form "
                                             + "<code>host1:port1,host2:port2,...</code>. The list order is the preferred dial order. "
                                             + "At least one broker is required.";
    public static final List<String> DEFAULT_BROKERS = Collections.singletonList("localhost:9092");

    public static final String CONNECT_TIMEOUT_MS_CONFIG = "connect.timeout.ms";
    public static final String CONNECT_TIMEOUT_MS_DOC = "The maximum amount of time the client waits for a connection to a broker "
                                                        + "to be established. Must be strictly positive.";
    public static final long DEFAULT_CONNECT_TIMEOUT_MS = 10 * 1000L;

    public static final String REQUEST_TIMEOUT_MS_CONFIG = "request.timeout.ms";
    public static final String REQUEST_TIMEOUT_MS_DOC = "The configuration controls the maximum amount of time the client will wait "
                                                        + "for the response of a request. Must be strictly positive.";
    public static final long DEFAULT_REQUEST_TIMEOUT_MS = 30 * 1000L;

    public static final String MAX_CONNECTIONS_PER_BROKER_CONFIG = "max.connections.per.broker";
    public static final String MAX_CONNECTIONS_PER_BROKER_DOC = "The maximum number of pooled connections the client keeps open to a single broker.";
    public static final int DEFAULT_MAX_CONNECTIONS_PER_BROKER = 5;

    public static final String MAX_RETRIES_CONFIG = "max.retries";
    public static final String MAX_RETRIES_DOC = "How many times a failed request is retried. A value of 0 disables retries, "
                                                 + "so each request gets exactly one attempt. Negative values are invalid.";
    public static final int DEFAULT_MAX_RETRIES = 3;

    public static final String GROUP_ID_CONFIG = "group.id";
    public static final String GROUP_ID_DOC = "A unique string that identifies the consumer group this consumer belongs to.";

    private CommonClientConfigs() {
    }
}
