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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.scivicslab.nexusiac.TelemetryParseException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TelemetryParser with output captured from real hosts.
 *
 * @author devteam@scivicslab.com
 */
@DisplayName("TelemetryParser Tests")
class TelemetryParserTest {

    private final TelemetryParser parser = new TelemetryParser("web1");

    @Test
    @DisplayName("Should parse core count")
    void testParseCores() throws Exception {
        assertEquals(8, parser.parseCores("8\n"));

        assertThrows(TelemetryParseException.class, () -> parser.parseCores("eight"));
        assertThrows(TelemetryParseException.class, () -> parser.parseCores("0"));
    }

    @Test
    @DisplayName("Should compute CPU usage from two /proc/stat samples")
    void testParseCpuUsage() throws Exception {
        String output = "cpu  10132153 290696 3084719 46828483 16683 0 25195 0 0 0\n"
            + "cpu  10132253 290696 3084819 46829283 16683 0 25195 0 0 0\n";

        // 200 busy jiffies out of 1000
        assertEquals(20.0, parser.parseCpuUsage(output), 0.001);
    }

    @Test
    @DisplayName("iowait counts as idle time")
    void testIowaitIsIdle() throws Exception {
        String output = "cpu 100 0 100 800 0\ncpu 100 0 100 1300 500\n";

        assertEquals(0.0, parser.parseCpuUsage(output), 0.001);
    }

    @Test
    @DisplayName("No elapsed time yields zero usage")
    void testCpuUsageNoElapsedTime() throws Exception {
        String line = "cpu 100 0 100 800 0 0 0 0\n";

        assertEquals(0.0, parser.parseCpuUsage(line + line), 0.001);
    }

    @Test
    @DisplayName("Should reject malformed CPU samples")
    void testParseCpuUsageMalformed() {
        TelemetryParseException one = assertThrows(TelemetryParseException.class,
            () -> parser.parseCpuUsage("cpu 100 0 100 800 0\n"));
        assertEquals(TelemetryParser.PROBE_CPU_USAGE, one.getProbe());

        assertThrows(TelemetryParseException.class, () -> parser.parseCpuUsage("cpu 1 2\ncpu 1 2\n"));
        assertThrows(TelemetryParseException.class, () -> parser.parseCpuUsage("cpu a b c d\ncpu a b c d\n"));
        assertThrows(TelemetryParseException.class,
            () -> parser.parseCpuUsage("cpu 200 0 200 800\ncpu 100 0 100 800\n"));
    }

    @Test
    @DisplayName("Missing CPU model becomes Unknown")
    void testParseCpuModel() {
        assertEquals("AMD EPYC 7763 64-Core Processor", parser.parseCpuModel(" AMD EPYC 7763 64-Core Processor\n"));
        assertEquals("Unknown", parser.parseCpuModel(""));
    }

    @Test
    @DisplayName("Should parse free -b output with an available column")
    void testParseMemory() throws Exception {
        String output = "               total        used        free      shared  buff/cache   available\n"
            + "Mem:     16777216000  4194304000  2097152000   104857600 10485760000 12582912000\n"
            + "Swap:     2147483648           0  2147483648\n";

        ResourceSnapshot.MemoryInfo memory = parser.parseMemory(output);

        assertEquals(16777216000L, memory.total());
        assertEquals(4194304000L, memory.used());
        assertEquals(12582912000L, memory.available());
        assertEquals(25.0, memory.usage(), 0.001);
    }

    @Test
    @DisplayName("Should fall back to the free column on old procps")
    void testParseMemoryWithoutAvailable() throws Exception {
        String output = "             total       used       free     shared    buffers     cached\n"
            + "Mem:    1000000000  600000000  400000000          0   50000000  200000000\n"
            + "-/+ buffers/cache:  350000000  650000000\n";

        ResourceSnapshot.MemoryInfo memory = parser.parseMemory(output);

        assertEquals(400000000L, memory.available());
        assertEquals(60.0, memory.usage(), 0.001);
    }

    @Test
    @DisplayName("Should reject memory output without a Mem: row")
    void testParseMemoryMalformed() {
        TelemetryParseException e = assertThrows(TelemetryParseException.class,
            () -> parser.parseMemory("total used free\n"));
        assertEquals(TelemetryParser.PROBE_MEMORY, e.getProbe());
        assertEquals("web1", e.getHostId());
    }

    @Test
    @DisplayName("Should parse POSIX df output")
    void testParseDisk() throws Exception {
        String output = "Filesystem     1-blocks        Used   Available Capacity Mounted on\n"
            + "/dev/nvme0n1p2 250000000000 100000000000 137000000000      43% /\n";

        ResourceSnapshot.DiskInfo disk = parser.parseDisk(output);

        assertEquals(250000000000L, disk.total());
        assertEquals(100000000000L, disk.used());
        assertEquals(137000000000L, disk.available());
        assertEquals(40.0, disk.usage(), 0.001);
    }

    @Test
    @DisplayName("Should reject df output without a data row")
    void testParseDiskMalformed() {
        assertThrows(TelemetryParseException.class,
            () -> parser.parseDisk("Filesystem 1-blocks Used Available Capacity Mounted on\n"));
    }

    @Test
    @DisplayName("Should parse load averages")
    void testParseLoad() throws Exception {
        ResourceSnapshot.LoadInfo load = parser.parseLoad("1.25 0.75 0.50 2/345 6789\n");

        assertEquals(1.25, load.load1(), 0.001);
        assertEquals(0.75, load.load5(), 0.001);
        assertEquals(0.50, load.load15(), 0.001);

        assertThrows(TelemetryParseException.class, () -> parser.parseLoad("1.0 x 2.0"));
    }
}
