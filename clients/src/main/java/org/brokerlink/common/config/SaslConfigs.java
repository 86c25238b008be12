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

public class SaslConfigs {

    /*
     * NOTE: DO NOT CHANGE EITHER CONFIG NAMES AS THESE ARE PART OF THE PUBLIC API AND CHANGE WILL BREAK USER CODE.
     */
    public static final String SASL_PREFIX = "sasl.";

    public static final String SASL_ENABLED_CONFIG = "sasl.enabled";
    public static final String SASL_ENABLED_DOC = "Whether the client authenticates to the brokers with SASL. "
        + "When false the other sasl.* settings are ignored.";

    /** SASL mechanism configuration - standard mechanism names are listed <a href="http://www.iana.org/assignments/sasl-mechanisms/sasl-mechanisms.xhtml">here</a>. */
    public static final String SASL_MECHANISM_CONFIG = "sasl.mechanism";
    public static final String SASL_MECHANISM_DOC = "SASL mechanism used for client connections, for example PLAIN or SCRAM-SHA-256. "
        + "This may be any mechanism the brokers offer.";
    public static final String PLAIN_MECHANISM = "PLAIN";
    public static final String SCRAM_SHA_256_MECHANISM = "SCRAM-SHA-256";
    public static final String SCRAM_SHA_512_MECHANISM = "SCRAM-SHA-512";

    public static final String SASL_USERNAME_CONFIG = "sasl.username";
    public static final String SASL_USERNAME_DOC = "The user name presented during SASL authentication.";

    public static final String SASL_PASSWORD_CONFIG = "sasl.password";
    public static final String SASL_PASSWORD_DOC = "The password presented during SASL authentication.";

    public static void addClientSaslSupport(ConfigDef config) {
        config.define(SaslConfigs.SASL_ENABLED_CONFIG, ConfigDef.Type.BOOLEAN, false, ConfigDef.Importance.HIGH, SaslConfigs.SASL_ENABLED_DOC)
                .define(SaslConfigs.SASL_MECHANISM_CONFIG, ConfigDef.Type.STRING, "", ConfigDef.Importance.HIGH, SaslConfigs.SASL_MECHANISM_DOC)
                .define(SaslConfigs.SASL_USERNAME_CONFIG, ConfigDef.Type.STRING, "", ConfigDef.Importance.HIGH, SaslConfigs.SASL_USERNAME_DOC)
                .define(SaslConfigs.SASL_PASSWORD_CONFIG, ConfigDef.Type.PASSWORD, "", ConfigDef.Importance.HIGH, SaslConfigs.SASL_PASSWORD_DOC);
    }
}
