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

import org.brokerlink.common.config.AbstractConfig;
import org.brokerlink.common.config.SaslConfigs;
import org.brokerlink.common.config.types.Password;

import java.util.Objects;

/**
 * Authentication intent for broker connections. The password is held as a {@link Password} so that it never
 * shows up in logs or {@link #toString()}.
 */
public final class SaslConfig {

    private static final Password EMPTY_PASSWORD = new Password("");
    private static final SaslConfig DISABLED = builder().build();

    private final boolean enabled;
    private final String mechanism;
    private final String username;
    private final Password password;

    private SaslConfig(Builder builder) {
        this.enabled = builder.enabled;
        this.mechanism = builder.mechanism;
        this.username = builder.username;
        this.password = builder.password;
    }

    public static SaslConfig disabled() {
        return DISABLED;
    }

    public static Builder builder() {
        return new Builder();
    }

    static SaslConfig fromConfig(AbstractConfig config) {
        return builder()
            .enabled(config.getBoolean(SaslConfigs.SASL_ENABLED_CONFIG))
            .mechanism(config.getString(SaslConfigs.SASL_MECHANISM_CONFIG))
            .username(config.getString(SaslConfigs.SASL_USERNAME_CONFIG))
            .password(config.getPassword(SaslConfigs.SASL_PASSWORD_CONFIG))
            .build();
    }

    public Builder toBuilder() {
        return builder()
            .enabled(enabled)
            .mechanism(mechanism)
            .username(username)
            .password(password);
    }

    public boolean enabled() {
        return enabled;
    }

    public String mechanism() {
        return mechanism;
    }

    public String username() {
        return username;
    }

    public Password password() {
        return password;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SaslConfig that = (SaslConfig) o;
        return enabled == that.enabled &&
               mechanism.equals(that.mechanism) &&
               username.equals(that.username) &&
               password.equals(that.password);
    }

    @Override
    public int hashCode() {
        return Objects.hash(enabled, mechanism, username, password);
    }

    @Override
    public String toString() {
        return "SaslConfig(" +
               "enabled=" + enabled +
               ", mechanism='" + mechanism + '\'' +
               ", username='" + username + '\'' +
               ", password=" + password +
               ')';
    }

    public static final class Builder {
        private boolean enabled = false;
        private String mechanism = "";
        private String username = "";
        private Password password = EMPTY_PASSWORD;

        private Builder() {
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder mechanism(String mechanism) {
            this.mechanism = mechanism == null ? "" : mechanism;
            return this;
        }

        public Builder username(String username) {
            this.username = username == null ? "" : username;
            return this;
        }

        public Builder password(String password) {
            this.password = password == null ? EMPTY_PASSWORD : new Password(password);
            return this;
        }

        public Builder password(Password password) {
            this.password = password == null || password.value() == null ? EMPTY_PASSWORD : password;
            return this;
        }

        public SaslConfig build() {
            return new SaslConfig(this);
        }
    }
}
