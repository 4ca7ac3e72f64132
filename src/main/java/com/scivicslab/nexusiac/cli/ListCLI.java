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

import com.scivicslab.nexusiac.NexusException;
import com.scivicslab.nexusiac.NotFoundException;
import com.scivicslab.nexusiac.fleet.FleetCoordinator;
import com.scivicslab.nexusiac.fleet.FleetReports;
import com.scivicslab.nexusiac.fleet.Nexus;

import picocli.CommandLine.Command;

/**
 * Lists the nexuses of the fleet file; the active one is marked with {@code *}.
 *
 * @author devteam@scivicslab.com
 */
@Command(
    name = "list",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    description = "List all nexuses."
)
public class ListCLI extends FleetCommand {

    private static final Logger LOG = Logger.getLogger(ListCLI.class.getName());

    @Override
    protected int run() throws NexusException, IOException {
        try (FleetCoordinator coordinator = parent.createCoordinator(parent.loadConfiguration())) {
            String active = "";
            try {
                active = coordinator.currentNexus().getName();
            } catch (NotFoundException e) {
                LOG.fine(e.getMessage());
            }

            if (parent.isJson()) {
                out.println(FleetReports.nexuses(coordinator.listNexuses(), active).toString(2));
                return 0;
            }
            for (Nexus nexus : coordinator.listNexuses()) {
                out.printf("%s %-16s %-12s %s %s%n",
                    nexus.getName().equals(active) ? "*" : " ",
                    nexus.getName(), nexus.getEnvironment(), nexus.getMembers(), nexus.getDescription());
            }
            return 0;
        }
    }
}
