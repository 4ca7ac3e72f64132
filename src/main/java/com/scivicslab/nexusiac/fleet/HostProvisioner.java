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

package com.scivicslab.nexusiac.fleet;

import java.io.IOException;
import java.util.logging.Logger;

import com.scivicslab.nexusiac.ConfigurationException;
import com.scivicslab.nexusiac.HostIdentity;
import com.scivicslab.nexusiac.NotFoundException;
import com.scivicslab.nexusiac.OperationContext;
import com.scivicslab.nexusiac.ProvisioningException;
import com.scivicslab.nexusiac.distro.DistroCapabilities;
import com.scivicslab.nexusiac.host.HostFactory;
import com.scivicslab.nexusiac.host.RemoteHost;

/**
 * Brings a freshly installed host into a managed state.
 *
 * <p>Steps, in order:</p>
 * <ol>
 *   <li>detect the distribution if it was not declared</li>
 *   <li>connect and run the health check</li>
 *   <li>upgrade installed packages</li>
 *   <li>install the container runtime</li>
 *   <li>configure the firewall, if the fleet file has a firewall section</li>
 *   <li>harden the SSH daemon</li>
 *   <li>enable automatic updates</li>
 * </ol>
 * <p>The last two steps only produce a warning when they fail; any other failing
 * step aborts the sequence. The connection is closed in every case.</p>
 *
 * @author devteam@scivicslab.com
 */
public class HostProvisioner {

    private static final Logger LOG = Logger.getLogger(HostProvisioner.class.getName());

    private final FleetConfiguration configuration;
    private final HostFactory hostFactory;

    public HostProvisioner(FleetConfiguration configuration, HostFactory hostFactory) {
        this.configuration = configuration;
        this.hostFactory = hostFactory;
    }

    /**
     * Provisions one host.
     *
     * @param ctx the cancellation context
     * @param hostName the host as named in the fleet file
     * @return the steps performed
     * @throws NotFoundException if the host is not defined
     * @throws ConfigurationException if the host or its firewall rules are invalid,
     *         or its distribution is not supported
     * @throws ProvisioningException if a mandatory step fails
     */
    public ProvisioningReport initialize(OperationContext ctx, String hostName)
            throws NotFoundException, ConfigurationException, ProvisioningException {
        HostIdentity identity = configuration.findHost(hostName)
            .orElseThrow(() -> new NotFoundException("host '" + hostName + "' not found"));

        RemoteHost host;
        try {
            host = hostFactory.createHandleWithDetection(ctx, identity);
        } catch (IOException e) {
            throw new ProvisioningException(hostName, "detect distribution", e.getMessage(), e);
        }
        DistroCapabilities capabilities = hostFactory.capabilitiesFor(host);
        ProvisioningReport report = new ProvisioningReport(hostName, capabilities.getDistribution().getId());
        LOG.info(String.format("[%s] initializing %s host", hostName, capabilities.getDistribution().getDisplayName()));

        try {
            try {
                host.connect(ctx);
                report.ok("connect");
            } catch (IOException e) {
                throw new ProvisioningException(hostName, "connect", e.getMessage(), e);
            }
            try {
                host.healthCheck(ctx);
                report.ok("health check");
            } catch (IOException e) {
                throw new ProvisioningException(hostName, "health check", e.getMessage(), e);
            }

            capabilities.updateSystem(ctx);
            report.ok("update system");

            capabilities.installContainerRuntime(ctx);
            report.ok("install container runtime");

            if (configuration.hasFirewallConfig()) {
                capabilities.configureFirewall(ctx, configuration.getFirewallRules(hostName));
                report.ok("configure firewall");
            } else {
                report.skipped("configure firewall", "no firewall section in fleet file");
            }

            try {
                capabilities.hardenSSH(ctx);
                report.ok("harden ssh");
            } catch (ProvisioningException e) {
                warnOrRethrow(report, "harden ssh", e);
            }

            try {
                capabilities.configureAutomaticUpdates(ctx);
                report.ok("configure automatic updates");
            } catch (ProvisioningException e) {
                warnOrRethrow(report, "configure automatic updates", e);
            }
        } finally {
            host.disconnect();
        }

        LOG.info(String.format("[%s] initialization complete%s", hostName,
            report.hasWarnings() ? " with warnings" : ""));
        return report;
    }

    private static void warnOrRethrow(ProvisioningReport report, String step, ProvisioningException e)
            throws ProvisioningException {
        if (e.isCanceled()) {
            throw e;
        }
        LOG.warning(String.format("%s failed, continuing: %s", step, e.getMessage()));
        report.warning(step, e.getMessage());
    }
}
