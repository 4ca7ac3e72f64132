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

package com.scivicslab.nexusiac.host;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.logging.Logger;

import com.scivicslab.nexusiac.ConfigurationException;
import com.scivicslab.nexusiac.HostIdentity;
import com.scivicslab.nexusiac.OperationContext;
import com.scivicslab.nexusiac.distro.DistroCapabilities;
import com.scivicslab.nexusiac.distro.Distribution;

/**
 * Validates host identities and turns them into {@link RemoteHost} handles.
 *
 * <p>Handles are created unconnected. By default they are {@link SshRemoteHost}s;
 * another constructor can be supplied, which is how tests substitute in-memory
 * hosts.</p>
 *
 * @author devteam@scivicslab.com
 */
public class HostFactory {

    private static final Logger LOG = Logger.getLogger(HostFactory.class.getName());

    private final Function<HostIdentity, RemoteHost> handleConstructor;

    public HostFactory() {
        this(SshRemoteHost::new);
    }

    /**
     * @param handleConstructor creates the handle for a validated identity
     */
    public HostFactory(Function<HostIdentity, RemoteHost> handleConstructor) {
        this.handleConstructor = handleConstructor;
    }

    /**
     * Creates an unconnected handle.
     *
     * @param identity the host
     * @return the handle
     * @throws ConfigurationException if the identity is incomplete or invalid
     */
    public RemoteHost createHandle(HostIdentity identity) throws ConfigurationException {
        validate(identity);
        return handleConstructor.apply(identity);
    }

    /**
     * Creates a handle, first detecting the distribution if none is known.
     *
     * <p>Detection connects, probes, records the result on the identity and
     * disconnects again. The returned handle is unconnected either way.</p>
     *
     * @param ctx the cancellation context
     * @param identity the host
     * @return the handle
     * @throws ConfigurationException if the identity is incomplete or invalid
     * @throws IOException if the host could not be probed
     */
    public RemoteHost createHandleWithDetection(OperationContext ctx, HostIdentity identity)
            throws ConfigurationException, IOException {
        RemoteHost host = createHandle(identity);
        if (!identity.getDistribution().isEmpty()) {
            return host;
        }

        try {
            host.connect(ctx);
            String detected = host.detectDistribution(ctx);
            try {
                identity.recordDetectedDistribution(detected);
                LOG.info(String.format("[%s] detected distribution: %s", identity.getId(), detected));
            } catch (IllegalStateException e) {
                // a concurrent task got there first
                LOG.fine(String.format("[%s] %s", identity.getId(), e.getMessage()));
            }
        } finally {
            host.disconnect();
        }
        return host;
    }

    /**
     * Checks an identity without touching the network.
     *
     * @param identity the host
     * @throws ConfigurationException naming the first problem found
     */
    public void validate(HostIdentity identity) throws ConfigurationException {
        String id = identity.getId();
        if (identity.getAddress().isBlank()) {
            throw new ConfigurationException(String.format("host %s: address is required", id));
        }
        if (identity.getUser().isBlank()) {
            throw new ConfigurationException(String.format("host %s: ssh user is required", id));
        }
        if (identity.getKeyPath().isBlank()) {
            throw new ConfigurationException(String.format("host %s: ssh key is required", id));
        }
        int port = identity.getPort();
        if (port < 0 || port > 65535) {
            throw new ConfigurationException(String.format("host %s: invalid port %d", id, port));
        }
        if (identity.hasDeclaredDistribution()) {
            try {
                Distribution.fromId(identity.getDistribution());
            } catch (ConfigurationException e) {
                throw new ConfigurationException(String.format("host %s: %s", id, e.getMessage()), e);
            }
        }
    }

    /**
     * Gets the identifiers of the distributions that can be provisioned.
     *
     * @return the identifiers, "unknown" excluded
     */
    public List<String> getSupportedDistributions() {
        List<String> ids = new ArrayList<>();
        for (Distribution distribution : Distribution.values()) {
            if (distribution.isProvisionable()) {
                ids.add(distribution.getId());
            }
        }
        return ids;
    }

    public Distribution getDistroInfo(String distributionId) throws ConfigurationException {
        return Distribution.fromId(distributionId);
    }

    /**
     * Selects the capability set matching a host's declared or detected distribution.
     *
     * @param host the host to bind the capability set to
     * @return the capability set
     * @throws ConfigurationException if the distribution is not known yet, or unsupported
     */
    public DistroCapabilities capabilitiesFor(RemoteHost host) throws ConfigurationException {
        String distribution = host.getIdentity().getDistribution();
        if (distribution.isEmpty()) {
            throw new ConfigurationException(String.format(
                "host %s: distribution neither declared nor detected", host.getId()));
        }
        return DistroCapabilities.forDistribution(distribution, host);
    }
}
