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

package com.scivicslab.nexusiac.fleet;

import com.scivicslab.nexusiac.telemetry.ResourceSnapshot;

/**
 * Health and telemetry of one host.
 *
 * <p>Online means the health check round trip succeeded. Telemetry is collected
 * only for online hosts, and a telemetry failure leaves the host online with
 * {@link #getTelemetryError()} set.</p>
 *
 * @author devteam@scivicslab.com
 */
public final class HostStatus {

    private final String hostId;
    private final boolean online;
    private final ResourceSnapshot resources;
    private final String error;
    private final String telemetryError;

    private HostStatus(String hostId, boolean online, ResourceSnapshot resources, String error, String telemetryError) {
        this.hostId = hostId;
        this.online = online;
        this.resources = resources;
        this.error = error;
        this.telemetryError = telemetryError;
    }

    public static HostStatus online(String hostId, ResourceSnapshot resources) {
        return new HostStatus(hostId, true, resources, "", "");
    }

    public static HostStatus onlineWithoutTelemetry(String hostId, String telemetryError) {
        return new HostStatus(hostId, true, null, "", telemetryError);
    }

    public static HostStatus offline(String hostId, String error) {
        return new HostStatus(hostId, false, null, error, "");
    }

    public String getHostId() {
        return hostId;
    }

    public boolean isOnline() {
        return online;
    }

    /**
     * @return the snapshot, or null if the host is offline or telemetry failed
     */
    public ResourceSnapshot getResources() {
        return resources;
    }

    /**
     * @return why the host is offline, or "" when online
     */
    public String getError() {
        return error;
    }

    public String getTelemetryError() {
        return telemetryError;
    }

    @Override
    public String toString() {
        return online
            ? String.format("HostStatus{%s online%s}", hostId, telemetryError.isEmpty() ? "" : ", telemetry: " + telemetryError)
            : String.format("HostStatus{%s offline: %s}", hostId, error);
    }
}
