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

/**
 * Resource usage of one host sampled at one instant.
 *
 * <p>Snapshots are never persisted; every status request samples anew.</p>
 *
 * @param cpu processor count, utilization, model and architecture
 * @param memory physical memory in bytes
 * @param disk root filesystem in bytes
 * @param load load averages
 *
 * @author devteam@scivicslab.com
 */
public record ResourceSnapshot(CpuInfo cpu, MemoryInfo memory, DiskInfo disk, LoadInfo load) {

    /**
     * @param cores number of online processors
     * @param usage utilization over the sampling window, percent
     * @param model processor model name, "Unknown" if the host does not report one
     * @param arch machine architecture as reported by {@code uname -m}
     */
    public record CpuInfo(int cores, double usage, String model, String arch) {
    }

    /**
     * @param total total physical memory, bytes
     * @param used used memory, bytes
     * @param available memory available for new work, bytes
     * @param usage used / total, percent
     */
    public record MemoryInfo(long total, long used, long available, double usage) {
    }

    /**
     * @param total size of the root filesystem, bytes
     * @param used used space, bytes
     * @param available space available to unprivileged users, bytes
     * @param usage used / total, percent
     */
    public record DiskInfo(long total, long used, long available, double usage) {
    }

    public record LoadInfo(double load1, double load5, double load15) {
    }
}
