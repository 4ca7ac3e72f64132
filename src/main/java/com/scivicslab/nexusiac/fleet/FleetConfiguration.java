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

import java.util.List;
import java.util.Optional;

import com.scivicslab.nexusiac.HostIdentity;
import com.scivicslab.nexusiac.distro.FirewallRule;

/**
 * Read-only view of the fleet definition consumed by the coordinator.
 *
 * <p>Values are already resolved: variable substitution and defaulting happen
 * when the definition is loaded.</p>
 *
 * @author devteam@scivicslab.com
 */
public interface FleetConfiguration {

    /**
     * @return nexus names in definition order
     */
    List<String> getNexusNames();

    Optional<Nexus> findNexus(String name);

    /**
     * @return host names in definition order
     */
    List<String> getHostNames();

    /**
     * Looks up a host. Repeated calls return the same identity instance, so a
     * detected distribution is remembered for the life of the configuration.
     *
     * @param name the host name
     * @return the identity, or empty if no such host is defined
     */
    Optional<HostIdentity> findHost(String name);

    /**
     * Tells whether the definition has a firewall section at all.
     *
     * @return true if firewall rules are managed
     */
    boolean hasFirewallConfig();

    /**
     * Gets the rules that apply to a host: the global rules followed by the
     * host's own, so host rules take precedence.
     *
     * @param hostName the host
     * @return the rules, empty if none apply
     */
    List<FirewallRule> getFirewallRules(String hostName);
}
