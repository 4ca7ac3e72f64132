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
import java.util.List;
import java.util.Map;

import com.scivicslab.nexusiac.CommandResult;
import com.scivicslab.nexusiac.NexusException;
import com.scivicslab.nexusiac.OperationContext;
import com.scivicslab.nexusiac.fleet.FleetCoordinator;
import com.scivicslab.nexusiac.fleet.FleetOutcome;
import com.scivicslab.nexusiac.fleet.FleetReports;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Runs a shell command on every server of a nexus.
 *
 * <p>Exit code is 0 only if the command ran on every server and exited 0
 * everywhere.</p>
 *
 * @author devteam@scivicslab.com
 */
@Command(
    name = "exec",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    description = "Execute a command on all servers of a nexus (default: the active one)."
)
public class ExecCLI extends FleetCommand {

    @Option(
        names = {"-n", "--nexus"},
        description = "Target nexus"
    )
    String nexusName;

    @Option(
        names = {"--sudo"},
        description = "Run with root privileges where the server allows it"
    )
    boolean sudo;

    @Parameters(arity = "1..*", description = "Command to execute; use -- before commands with options")
    List<String> commandWords;

    @Override
    protected int run() throws NexusException, IOException {
        String command = String.join(" ", commandWords);
        OperationContext ctx = parent.createContext();
        try (FleetCoordinator coordinator = parent.createCoordinator(parent.loadConfiguration())) {
            FleetOutcome outcome = nexusName != null
                ? coordinator.executeOnNexus(ctx, nexusName, command, sudo)
                : coordinator.executeOnAll(ctx, command, sudo);

            if (parent.isJson()) {
                out.println(FleetReports.outcome(outcome).toString(2));
            } else {
                print(outcome);
            }

            boolean allZero = outcome.getResults().values().stream().allMatch(CommandResult::isSuccess);
            return outcome.isSuccess() && allZero ? 0 : 1;
        }
    }

    private void print(FleetOutcome outcome) {
        for (Map.Entry<String, CommandResult> entry : outcome.getResults().entrySet()) {
            CommandResult result = entry.getValue();
            if (outcome.getFailedHosts().contains(entry.getKey())) {
                out.printf("=== %s: FAILED ===%n%s%n", entry.getKey(), result.getStderr());
                continue;
            }
            out.printf("=== %s: exit %d (%d ms) ===%n", entry.getKey(), result.getExitCode(), result.getDurationMillis());
            if (!result.getStdout().isEmpty()) {
                out.print(withNewline(result.getStdout()));
            }
            if (!result.getStderr().isEmpty()) {
                out.print(withNewline(result.getStderr()));
            }
        }
        outcome.failure().ifPresent(e -> out.println(e.getMessage()));
    }

    private static String withNewline(String text) {
        return text.endsWith("\n") ? text : text + "\n";
    }
}
