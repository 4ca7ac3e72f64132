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
import com.scivicslab.nexusiac.fleet.FleetCoordinator;
import com.scivicslab.nexusiac.fleet.FleetReports;
import com.scivicslab.nexusiac.fleet.Nexus;

import picocli.CommandLine.Command;

/**
 * Shows the active nexus.
 *
 * @author devteam@scivicslab.com
 */
@Command(
    name = "current",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    description = "Show the active nexus."
)
public class CurrentCLI extends FleetCommand {

    @Override
    protected int run() throws NexusException, IOException {
        try (FleetCoordinator coordinator = parent.createCoordinator(parent.loadConfiguration())) {
            Nexus nexus = coordinator.currentNexus();
            if (parent.isJson()) {
                out.println(FleetReports.nexus(nexus).toString(2));
            } else {
                out.println("Active nexus: " + nexus.getName());
                out.println("Description:  " + nexus.getDescription());
                out.println("Environment:  " + nexus.getEnvironment());
                out.println("Servers:      " + String.join(", ", nexus.getMembers()));
            }
            return 0;
        }
    }
}
