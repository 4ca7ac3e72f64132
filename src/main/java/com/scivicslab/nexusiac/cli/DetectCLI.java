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

package com.scivicslab.nexusiac.cli;

import java.io.IOException;
import java.util.logging.Logger;

import org.json.JSONObject;

import com.scivicslab.nexusiac.ConfigurationException;
import com.scivicslab.nexusiac.HostIdentity;
import com.scivicslab.nexusiac.NexusException;
import com.scivicslab.nexusiac.NotFoundException;
import com.scivicslab.nexusiac.distro.Distribution;
import com.scivicslab.nexusiac.fleet.FleetConfiguration;
import com.scivicslab.nexusiac.host.HostFactory;

import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * Shows the distribution of a server, probing it if the fleet file does not
 * declare one.
 *
 * @author devteam@scivicslab.com
 */
@Command(
    name = "detect",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    description = "Detect the Linux distribution of a server."
)
public class DetectCLI extends FleetCommand {

    private static final Logger LOG = Logger.getLogger(DetectCLI.class.getName());

    @Parameters(index = "0", description = "Server to probe")
    String serverName;

    @Override
    protected int run() throws NexusException, IOException {
        FleetConfiguration configuration = parent.loadConfiguration();
        HostIdentity identity = configuration.findHost(serverName)
            .orElseThrow(() -> new NotFoundException("host '" + serverName + "' not found"));

        HostFactory factory = new HostFactory();
        factory.createHandleWithDetection(parent.createContext(), identity);
        String id = identity.getDistribution();
        Distribution distribution = null;
        try {
            distribution = factory.getDistroInfo(id);
        } catch (ConfigurationException e) {
            LOG.fine(e.getMessage());
        }
        boolean supported = distribution != null && distribution.isProvisionable();

        if (parent.isJson()) {
            JSONObject json = new JSONObject();
            json.put("server", serverName);
            json.put("distribution", id);
            json.put("supported", supported);
            if (distribution != null) {
                json.put("name", distribution.getDisplayName());
                json.put("package_manager", distribution.getPackageManager());
                json.put("firewall", distribution.getFirewallTool());
                json.put("init_system", distribution.getInitSystem());
            }
            out.println(json.toString(2));
        } else {
            out.printf("%s: %s%n", serverName, distribution != null ? distribution.getDisplayName() + " (" + id + ")" : id);
            if (!supported) {
                out.println("  not supported for provisioning; supported: "
                    + String.join(", ", factory.getSupportedDistributions()));
            }
        }
        return 0;
    }
}
