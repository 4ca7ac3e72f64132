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

import com.scivicslab.nexusiac.NexusException;
import com.scivicslab.nexusiac.fleet.FleetReports;
import com.scivicslab.nexusiac.fleet.HostProvisioner;
import com.scivicslab.nexusiac.fleet.ProvisioningReport;
import com.scivicslab.nexusiac.host.HostFactory;

import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * Provisions a fresh server: system update, container runtime, firewall,
 * SSH hardening and automatic updates.
 *
 * @author devteam@scivicslab.com
 */
@Command(
    name = "init",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    description = "Initialize a server with the baseline configuration."
)
public class InitCLI extends FleetCommand {

    @Parameters(index = "0", description = "Server to initialize")
    String serverName;

    @Override
    protected int run() throws NexusException, IOException {
        HostProvisioner provisioner = new HostProvisioner(parent.loadConfiguration(), new HostFactory());
        ProvisioningReport report = provisioner.initialize(parent.createContext(), serverName);

        if (parent.isJson()) {
            out.println(FleetReports.provisioning(report).toString(2));
            return 0;
        }
        out.printf("Server %s (%s)%n", report.getHostId(), report.getDistribution());
        for (ProvisioningReport.Step step : report.getSteps()) {
            out.printf("  [%-7s] %s%s%n", step.status(), step.name(),
                step.detail().isEmpty() ? "" : ": " + step.detail());
        }
        return 0;
    }
}
