/*
 * Copyright 2025 devteam@scivicslab.com
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package com.scivicslab.nexusiac;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Connection parameters of one managed host.
 *
 * <p>Instances are created when the fleet file is loaded and are immutable,
 * with one exception: a host whose distribution was not declared may have
 * the detected distribution recorded exactly once through
 * {@link #recordDetectedDistribution(String)}.</p>
 *
 * <pre>{@code
 * HostIdentity web1 = new HostIdentity.Builder("web1")
 *     .address("10.0.0.11")
 *     .user("deploy")
 *     .keyPath("~/.ssh/id_ed25519")
 *     .escalationAllowed(true)
 *     .build();
 * }</pre>
 *
 * @author devteam@scivicslab.com
 */
public final class HostIdentity {

    /** Port used when none was declared. */
    public static final int DEFAULT_SSH_PORT = 22;

    private final String id;
    private final String address;
    private final String user;
    private final String keyPath;
    private final int port;
    private final boolean escalationAllowed;
    private final String declaredDistribution;
    private final String nexus;
    private final AtomicReference<String> detectedDistribution = new AtomicReference<>();

    /**
     * Builder for {@link HostIdentity}. Only the id is required here;
     * required connection fields are checked by the host factory.
     */
    public static class Builder {
        private final String id;
        private String address;
        private String user;
        private String keyPath;
        private int port;
        private boolean escalationAllowed;
        private String distribution;
        private String nexus;

        public Builder(String id) {
            this.id = Objects.requireNonNull(id, "id");
        }

        public Builder address(String address) {
            this.address = address;
            return this;
        }

        public Builder user(String user) {
            this.user = user;
            return this;
        }

        public Builder keyPath(String keyPath) {
            this.keyPath = keyPath;
            return this;
        }

        /**
         * Sets the SSH port. Zero means "use the default".
         *
         * @param port the port
         * @return this builder
         */
        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder escalationAllowed(boolean escalationAllowed) {
            this.escalationAllowed = escalationAllowed;
            return this;
        }

        public Builder distribution(String distribution) {
            this.distribution = distribution;
            return this;
        }

        public Builder nexus(String nexus) {
            this.nexus = nexus;
            return this;
        }

        public HostIdentity build() {
            return new HostIdentity(this);
        }
    }

    private HostIdentity(Builder builder) {
        this.id = builder.id;
        this.address = nullToEmpty(builder.address);
        this.user = nullToEmpty(builder.user);
        this.keyPath = nullToEmpty(builder.keyPath);
        this.port = builder.port;
        this.escalationAllowed = builder.escalationAllowed;
        this.declaredDistribution = nullToEmpty(builder.distribution).trim().toLowerCase();
        this.nexus = nullToEmpty(builder.nexus);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    public String getId() {
        return id;
    }

    public String getAddress() {
        return address;
    }

    public String getUser() {
        return user;
    }

    public String getKeyPath() {
        return keyPath;
    }

    /**
     * Gets the port as declared; zero when none was declared.
     *
     * @return the declared port
     */
    public int getPort() {
        return port;
    }

    /**
     * Gets the port to dial.
     *
     * @return the declared port, or {@value #DEFAULT_SSH_PORT} when none was declared
     */
    public int getEffectivePort() {
        return port == 0 ? DEFAULT_SSH_PORT : port;
    }

    public boolean isEscalationAllowed() {
        return escalationAllowed;
    }

    public String getNexus() {
        return nexus;
    }

    /**
     * Tells whether the fleet file declared a distribution for this host.
     *
     * @return true if a distribution was declared
     */
    public boolean hasDeclaredDistribution() {
        return !declaredDistribution.isEmpty();
    }

    /**
     * Gets the distribution identifier: the declared one if present,
     * otherwise the detected one, otherwise an empty string.
     *
     * @return the lower-case distribution identifier, or "" if unknown yet
     */
    public String getDistribution() {
        if (!declaredDistribution.isEmpty()) {
            return declaredDistribution;
        }
        String detected = detectedDistribution.get();
        return detected == null ? "" : detected;
    }

    /**
     * Records the result of distribution detection.
     *
     * @param distribution the detected identifier
     * @throws IllegalStateException if a distribution was declared or already recorded
     */
    public void recordDetectedDistribution(String distribution) {
        Objects.requireNonNull(distribution, "distribution");
        if (hasDeclaredDistribution()) {
            throw new IllegalStateException(
                "Host " + id + " declares distribution '" + declaredDistribution + "'; detection must not override it");
        }
        if (!detectedDistribution.compareAndSet(null, distribution.trim().toLowerCase())) {
            throw new IllegalStateException(
                "Distribution of host " + id + " was already detected as '" + detectedDistribution.get() + "'");
        }
    }

    @Override
    public String toString() {
        return String.format("HostIdentity{id='%s', address='%s', user='%s', port=%d, escalation=%s, distribution='%s'}",
            id, address, user, getEffectivePort(), escalationAllowed, getDistribution());
    }
}
