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

package com.scivicslab.nexusiac.distro;

import java.util.List;

import com.scivicslab.nexusiac.ConfigurationException;
import com.scivicslab.nexusiac.OperationContext;
import com.scivicslab.nexusiac.ProvisioningException;
import com.scivicslab.nexusiac.exec.CommandExecutor;

/**
 * Provisioning operations for one distribution family, bound to one host.
 *
 * <p>Every operation is a sequence of commands run through the bound
 * {@link CommandExecutor}. The first command that fails to run or exits non-zero
 * aborts the sequence with a {@link ProvisioningException} naming the step.</p>
 *
 * <p>Implementations hold no state beyond the binding, so a capability set can be
 * created for each call:</p>
 * <pre>{@code
 * DistroCapabilities caps = DistroCapabilities.forDistribution("rocky", host);
 * caps.installContainerRuntime(ctx);
 * }</pre>
 *
 * @author devteam@scivicslab.com
 */
public interface DistroCapabilities {

    /**
     * Selects the capability set for a distribution identifier.
     *
     * @param distributionId the declared or detected identifier
     * @param executor the host to bind to
     * @return the capability set
     * @throws ConfigurationException if the identifier is unknown or not provisionable
     */
    static DistroCapabilities forDistribution(String distributionId, CommandExecutor executor)
            throws ConfigurationException {
        return forDistribution(Distribution.fromId(distributionId), executor);
    }

    /**
     * Selects the capability set for a distribution.
     *
     * @param distribution the distribution
     * @param executor the host to bind to
     * @return the capability set
     * @throws ConfigurationException if the distribution belongs to no family
     */
    static DistroCapabilities forDistribution(Distribution distribution, CommandExecutor executor)
            throws ConfigurationException {
        if (!distribution.isProvisionable()) {
            throw new ConfigurationException(String.format(
                "host %s: no capability set for distribution '%s'",
                executor.getIdentifier(), distribution.getId()));
        }
        return switch (distribution.getFamily()) {
            case DEBIAN -> new DebianCapabilities(distribution, executor);
            case RHEL -> new RhelCapabilities(distribution, executor);
            case ALPINE -> new AlpineCapabilities(distribution, executor);
        };
    }

    Distribution getDistribution();

    /**
     * Installs and starts the container runtime. Does nothing if a working
     * runtime is already present.
     *
     * @param ctx the cancellation context
     * @throws ProvisioningException if a step fails
     */
    void installContainerRuntime(OperationContext ctx) throws ProvisioningException;

    /**
     * Resets the firewall to deny incoming and allow outgoing traffic, applies the
     * rules and enables the firewall. When rules overlap, the later rule wins.
     *
     * @param ctx the cancellation context
     * @param rules the rules in priority order, lowest first; may be empty
     * @throws ConfigurationException if a rule is invalid; nothing is changed then
     * @throws ProvisioningException if a step fails
     */
    void configureFirewall(OperationContext ctx, List<FirewallRule> rules)
        throws ConfigurationException, ProvisioningException;

    /**
     * Gets the firewall tool's listing of the active rules.
     *
     * @param ctx the cancellation context
     * @return the listing as printed by the tool
     * @throws ProvisioningException if the listing fails
     */
    String listFirewallRules(OperationContext ctx) throws ProvisioningException;

    /**
     * Disables root login, password authentication and X11 forwarding, and enables
     * public key authentication in the SSH daemon. The edited configuration is checked
     * with {@code sshd -t}, and the values sshd would use are read back with
     * {@code sshd -T} before the daemon is restarted. If either check fails the previous
     * file is restored and the daemon keeps running unchanged.
     *
     * @param ctx the cancellation context
     * @throws ProvisioningException if a step fails
     */
    void hardenSSH(OperationContext ctx) throws ProvisioningException;

    void configureAutomaticUpdates(OperationContext ctx) throws ProvisioningException;

    void updateSystem(OperationContext ctx) throws ProvisioningException;

    /**
     * @param ctx the cancellation context
     * @param packageName the package
     * @throws ConfigurationException if the name is not a plain package name
     * @throws ProvisioningException if installation fails
     */
    void installPackage(OperationContext ctx, String packageName)
        throws ConfigurationException, ProvisioningException;

    /**
     * Gets the state of the container runtime service.
     *
     * @param ctx the cancellation context
     * @return "active", "inactive" or the service manager's own word
     * @throws ProvisioningException if the query could not be run
     */
    String getRuntimeStatus(OperationContext ctx) throws ProvisioningException;
}
