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

import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * Makes another nexus the active one.
 *
 * @author devteam@scivicslab.com
 */
@Command(
    name = "switch",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    description = "Switch the active nexus."
)
public class SwitchCLI extends FleetCommand {

    @Parameters(index = "0", description = "Name of the nexus to activate")
    String nexusName;

    @Override
    protected int run() throws NexusException, IOException {
        try (FleetCoordinator coordinator = parent.createCoordinator(parent.loadConfiguration())) {
            coordinator.switchActive(nexusName);
            out.println("Switched to nexus '" + nexusName + "'");
            return 0;
        }
    }
}
