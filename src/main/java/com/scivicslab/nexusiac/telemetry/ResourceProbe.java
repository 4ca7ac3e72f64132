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

package com.scivicslab.nexusiac.telemetry;

import java.io.IOException;
import java.util.logging.Logger;

import com.scivicslab.nexusiac.CommandResult;
import com.scivicslab.nexusiac.OperationContext;
import com.scivicslab.nexusiac.TelemetryParseException;
import com.scivicslab.nexusiac.exec.CommandExecutor;

/**
 * Collects a {@link ResourceSnapshot} by running a fixed battery of read-only
 * commands on one host.
 *
 * <p>The probes run one after another. If any probe exits non-zero or its output
 * does not parse, the whole collection fails; a partially filled snapshot is never
 * returned.</p>
 *
 * @author devteam@scivicslab.com
 */
public class ResourceProbe {

    private static final Logger LOG = Logger.getLogger(ResourceProbe.class.getName());

    static final String CORES_COMMAND = "nproc";
    static final String CPU_USAGE_COMMAND = "head -n1 /proc/stat; sleep 1; head -n1 /proc/stat";
    static final String CPU_MODEL_COMMAND = "grep -m1 'model name' /proc/cpuinfo | cut -d: -f2";
    static final String ARCH_COMMAND = "uname -m";
    static final String MEMORY_COMMAND = "LC_ALL=C free -b";
    static final String DISK_COMMAND = "LC_ALL=C df -P -B1 /";
    static final String LOAD_COMMAND = "cat /proc/loadavg";

    private final CommandExecutor executor;
    private final TelemetryParser parser;

    public ResourceProbe(CommandExecutor executor) {
        this.executor = executor;
        this.parser = new TelemetryParser(executor.getIdentifier());
    }

    /**
     * Runs every probe and assembles the snapshot.
     *
     * @param ctx the cancellation context
     * @return the snapshot
     * @throws TelemetryParseException if a probe fails or its output is malformed
     * @throws IOException if a probe could not be run
     */
    public ResourceSnapshot collect(OperationContext ctx) throws IOException {
        int cores = parser.parseCores(probe(ctx, TelemetryParser.PROBE_CORES, CORES_COMMAND));
        double cpuUsage = parser.parseCpuUsage(probe(ctx, TelemetryParser.PROBE_CPU_USAGE, CPU_USAGE_COMMAND));
        // grep exits 1 when /proc/cpuinfo has no model line (e.g. some ARM boards)
        String model = parser.parseCpuModel(probeAllowingEmpty(ctx, CPU_MODEL_COMMAND));
        String arch = parser.parseArch(probe(ctx, TelemetryParser.PROBE_ARCH, ARCH_COMMAND));

        ResourceSnapshot.MemoryInfo memory = parser.parseMemory(probe(ctx, TelemetryParser.PROBE_MEMORY, MEMORY_COMMAND));
        ResourceSnapshot.DiskInfo disk = parser.parseDisk(probe(ctx, TelemetryParser.PROBE_DISK, DISK_COMMAND));
        ResourceSnapshot.LoadInfo load = parser.parseLoad(probe(ctx, TelemetryParser.PROBE_LOAD, LOAD_COMMAND));

        ResourceSnapshot snapshot = new ResourceSnapshot(
            new ResourceSnapshot.CpuInfo(cores, cpuUsage, model, arch), memory, disk, load);
        LOG.fine(String.format("[%s] %s", executor.getIdentifier(), snapshot));
        return snapshot;
    }

    private String probe(OperationContext ctx, String probe, String command) throws IOException {
        CommandResult result = executor.execute(ctx, command);
        if (!result.isSuccess()) {
            throw new TelemetryParseException(executor.getIdentifier(), probe,
                String.format("exit code %d: %s", result.getExitCode(), result.getStderr().trim()));
        }
        return result.getStdout();
    }

    private String probeAllowingEmpty(OperationContext ctx, String command) throws IOException {
        CommandResult result = executor.execute(ctx, command);
        return result.isSuccess() ? result.getStdout() : "";
    }
}
