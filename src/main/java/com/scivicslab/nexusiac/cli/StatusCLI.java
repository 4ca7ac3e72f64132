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
import java.util.Map;

import com.scivicslab.nexusiac.NexusException;
import com.scivicslab.nexusiac.OperationContext;
import com.scivicslab.nexusiac.fleet.FleetCoordinator;
import com.scivicslab.nexusiac.fleet.FleetReports;
import com.scivicslab.nexusiac.fleet.HostStatus;
import com.scivicslab.nexusiac.fleet.NexusStatus;
import com.scivicslab.nexusiac.telemetry.ResourceSnapshot;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Reports health and resource usage of a nexus or a single server.
 *
 * <p>Exit code is 0 when every server is online, 1 otherwise.</p>
 *
 * @author devteam@scivicslab.com
 */
@Command(
    name = "status",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    description = "Show health and resource usage of a nexus (default: the active one)."
)
public class StatusCLI extends FleetCommand {

    private static final double GIB = 1024.0 * 1024.0 * 1024.0;

    @Parameters(index = "0", arity = "0..1", description = "Nexus to check")
    String nexusName;

    @Option(
        names = {"-s", "--server"},
        description = "Check only this server"
    )
    String serverName;

    @Override
    protected int run() throws NexusException, IOException {
        OperationContext ctx = parent.createContext();
        try (FleetCoordinator coordinator = parent.createCoordinator(parent.loadConfiguration())) {
            if (serverName != null) {
                HostStatus status = coordinator.hostStatus(ctx, serverName);
                if (parent.isJson()) {
                    out.println(FleetReports.hostStatus(status).toString(2));
                } else {
                    printHost(status);
                }
                return status.isOnline() ? 0 : 1;
            }

            String target = nexusName != null ? nexusName : coordinator.currentNexus().getName();
            NexusStatus status = coordinator.status(ctx, target);
            if (parent.isJson()) {
                out.println(FleetReports.status(status).toString(2));
            } else {
                out.printf("Nexus: %s (%d/%d online)%n", target, status.getServersOnline(), status.getServersTotal());
                for (Map.Entry<String, HostStatus> entry : status.getHostStatuses().entrySet()) {
                    printHost(entry.getValue());
                }
            }
            return status.isHealthy() ? 0 : 1;
        }
    }

    private void printHost(HostStatus status) {
        if (!status.isOnline()) {
            out.printf("  %-16s OFFLINE  %s%n", status.getHostId(), status.getError());
            return;
        }
        ResourceSnapshot r = status.getResources();
        if (r == null) {
            out.printf("  %-16s ONLINE   telemetry unavailable: %s%n", status.getHostId(), status.getTelemetryError());
            return;
        }
        out.printf("  %-16s ONLINE   cpu %d x %.1f%%  mem %.1f/%.1f GiB  disk %.1f%%  load %.2f %.2f %.2f%n",
            status.getHostId(),
            r.cpu().cores(), r.cpu().usage(),
            r.memory().used() / GIB, r.memory().total() / GIB,
            r.disk().usage(),
            r.load().load1(), r.load().load5(), r.load().load15());
    }
}
