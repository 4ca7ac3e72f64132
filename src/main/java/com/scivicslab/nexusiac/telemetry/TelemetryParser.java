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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.scivicslab.nexusiac.TelemetryParseException;

/**
 * Parses the text output of the telemetry probes.
 *
 * <p>Every probe runs under {@code LC_ALL=C} or reads a {@code /proc} file, so the
 * accepted formats are fixed:</p>
 * <ul>
 *   <li>{@code nproc}: a single positive integer</li>
 *   <li>cpu usage: two aggregate {@code cpu} lines of {@code /proc/stat}, taken one
 *       second apart; usage is the non-idle share of the jiffies elapsed between them</li>
 *   <li>{@code free -b}: a header row and a {@code Mem:} row; the available figure comes
 *       from the {@code available} column, or {@code free} on hosts too old to report it</li>
 *   <li>{@code df -P -B1 /}: POSIX output, the last row holds the root filesystem</li>
 *   <li>{@code /proc/loadavg}: three decimal load averages first</li>
 * </ul>
 * <p>Anything else is rejected with {@link TelemetryParseException}; there is no
 * best-effort fallback value.</p>
 *
 * @author devteam@scivicslab.com
 */
public class TelemetryParser {

    public static final String PROBE_CORES = "nproc";
    public static final String PROBE_CPU_USAGE = "cpu-usage";
    public static final String PROBE_CPU_MODEL = "cpu-model";
    public static final String PROBE_ARCH = "arch";
    public static final String PROBE_MEMORY = "memory";
    public static final String PROBE_DISK = "disk";
    public static final String PROBE_LOAD = "load";

    static final String UNKNOWN_MODEL = "Unknown";

    private final String hostId;

    /**
     * @param hostId the host whose output is parsed, used in error messages
     */
    public TelemetryParser(String hostId) {
        this.hostId = hostId;
    }

    public int parseCores(String output) throws TelemetryParseException {
        String text = output.trim();
        int cores;
        try {
            cores = Integer.parseInt(text);
        } catch (NumberFormatException e) {
            throw new TelemetryParseException(hostId, PROBE_CORES, "not an integer: '" + text + "'", e);
        }
        if (cores <= 0) {
            throw new TelemetryParseException(hostId, PROBE_CORES, "core count must be positive: " + cores);
        }
        return cores;
    }

    /**
     * Computes CPU utilization from two {@code /proc/stat} aggregate lines.
     *
     * @param output the probe output containing the two samples in order
     * @return utilization in percent, 0 if no time elapsed between the samples
     * @throws TelemetryParseException if two well-formed samples are not present
     */
    public double parseCpuUsage(String output) throws TelemetryParseException {
        List<long[]> samples = new ArrayList<>();
        for (String line : output.split("\n")) {
            String trimmed = line.trim();
            if (trimmed.startsWith("cpu ")) {
                samples.add(parseCpuLine(trimmed));
            }
        }
        if (samples.size() != 2) {
            throw new TelemetryParseException(hostId, PROBE_CPU_USAGE,
                "expected 2 aggregate cpu samples, found " + samples.size());
        }

        long[] first = samples.get(0);
        long[] second = samples.get(1);
        long totalDelta = total(second) - total(first);
        long idleDelta = idle(second) - idle(first);
        if (totalDelta < 0 || idleDelta < 0 || idleDelta > totalDelta) {
            throw new TelemetryParseException(hostId, PROBE_CPU_USAGE, "cpu counters went backwards");
        }
        if (totalDelta == 0) {
            return 0.0;
        }
        return (double) (totalDelta - idleDelta) / totalDelta * 100.0;
    }

    private long[] parseCpuLine(String line) throws TelemetryParseException {
        String[] fields = line.split("\\s+");
        // "cpu" user nice system idle [iowait irq softirq steal ...]
        if (fields.length < 5) {
            throw new TelemetryParseException(hostId, PROBE_CPU_USAGE, "too few fields: '" + line + "'");
        }
        int count = Math.min(fields.length - 1, 8);
        long[] values = new long[count];
        for (int i = 0; i < count; i++) {
            values[i] = parseLong(PROBE_CPU_USAGE, fields[i + 1]);
        }
        return values;
    }

    private static long total(long[] sample) {
        return Arrays.stream(sample).sum();
    }

    private static long idle(long[] sample) {
        long idle = sample[3];
        if (sample.length > 4) {
            idle += sample[4];
        }
        return idle;
    }

    public String parseCpuModel(String output) {
        String model = output.trim();
        return model.isEmpty() ? UNKNOWN_MODEL : model;
    }

    public String parseArch(String output) throws TelemetryParseException {
        String arch = output.trim();
        if (arch.isEmpty() || arch.contains("\n")) {
            throw new TelemetryParseException(hostId, PROBE_ARCH, "unexpected output: '" + arch + "'");
        }
        return arch;
    }

    /**
     * Parses {@code free -b} output.
     *
     * @param output the probe output
     * @return the memory figures
     * @throws TelemetryParseException if the header or {@code Mem:} row is missing or malformed
     */
    public ResourceSnapshot.MemoryInfo parseMemory(String output) throws TelemetryParseException {
        String[] header = null;
        String[] mem = null;
        for (String line : output.split("\n")) {
            String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            if (trimmed.startsWith("Mem:")) {
                mem = trimmed.split("\\s+");
            } else if (header == null && !trimmed.contains(":")) {
                header = trimmed.split("\\s+");
            }
        }
        if (header == null || mem == null) {
            throw new TelemetryParseException(hostId, PROBE_MEMORY, "missing header or Mem: row");
        }

        int totalColumn = columnOf(header, "total");
        int usedColumn = columnOf(header, "used");
        int availableColumn = columnOf(header, "available");
        if (availableColumn < 0) {
            availableColumn = columnOf(header, "free");
        }
        if (totalColumn < 0 || usedColumn < 0 || availableColumn < 0) {
            throw new TelemetryParseException(hostId, PROBE_MEMORY,
                "unrecognized header: " + String.join(" ", header));
        }

        // the Mem: row carries the label in front of the header columns
        long total = memField(mem, totalColumn + 1);
        long used = memField(mem, usedColumn + 1);
        long available = memField(mem, availableColumn + 1);
        return new ResourceSnapshot.MemoryInfo(total, used, available, percent(used, total));
    }

    private long memField(String[] row, int index) throws TelemetryParseException {
        if (index >= row.length) {
            throw new TelemetryParseException(hostId, PROBE_MEMORY,
                "Mem: row has " + (row.length - 1) + " values, column " + index + " requested");
        }
        return parseLong(PROBE_MEMORY, row[index]);
    }

    private static int columnOf(String[] header, String name) {
        for (int i = 0; i < header.length; i++) {
            if (header[i].equals(name)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Parses {@code df -P -B1 /} output.
     *
     * @param output the probe output
     * @return the root filesystem figures
     * @throws TelemetryParseException if no data row is present or it is malformed
     */
    public ResourceSnapshot.DiskInfo parseDisk(String output) throws TelemetryParseException {
        String[] lines = output.trim().split("\n");
        if (lines.length < 2) {
            throw new TelemetryParseException(hostId, PROBE_DISK, "no data row");
        }
        String[] fields = lines[lines.length - 1].trim().split("\\s+");
        if (fields.length < 6) {
            throw new TelemetryParseException(hostId, PROBE_DISK,
                "unexpected row: '" + lines[lines.length - 1].trim() + "'");
        }
        // counted from the end: the filesystem name may contain spaces
        int n = fields.length;
        long total = parseLong(PROBE_DISK, fields[n - 5]);
        long used = parseLong(PROBE_DISK, fields[n - 4]);
        long available = parseLong(PROBE_DISK, fields[n - 3]);
        return new ResourceSnapshot.DiskInfo(total, used, available, percent(used, total));
    }

    public ResourceSnapshot.LoadInfo parseLoad(String output) throws TelemetryParseException {
        String[] fields = output.trim().split("\\s+");
        if (fields.length < 3) {
            throw new TelemetryParseException(hostId, PROBE_LOAD, "unexpected output: '" + output.trim() + "'");
        }
        return new ResourceSnapshot.LoadInfo(
            parseDouble(PROBE_LOAD, fields[0]),
            parseDouble(PROBE_LOAD, fields[1]),
            parseDouble(PROBE_LOAD, fields[2]));
    }

    private long parseLong(String probe, String value) throws TelemetryParseException {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new TelemetryParseException(hostId, probe, "not an integer: '" + value + "'", e);
        }
    }

    private double parseDouble(String probe, String value) throws TelemetryParseException {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new TelemetryParseException(hostId, probe, "not a number: '" + value + "'", e);
        }
    }

    private static double percent(long part, long total) {
        return total > 0 ? (double) part / total * 100.0 : 0.0;
    }
}
