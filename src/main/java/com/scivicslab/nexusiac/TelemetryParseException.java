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

package com.scivicslab.nexusiac;

/**
 * Thrown when a telemetry probe fails or its output cannot be parsed.
 *
 * <p>Telemetry is consumed as a whole, so a single bad probe fails the
 * entire snapshot.</p>
 *
 * @author devteam@scivicslab.com
 */
public class TelemetryParseException extends RemoteHostException {

    private static final long serialVersionUID = 1L;

    private final String probe;

    public TelemetryParseException(String hostId, String probe, String message) {
        super(hostId, String.format("probe '%s': %s", probe, message));
        this.probe = probe;
    }

    public TelemetryParseException(String hostId, String probe, String message, Throwable cause) {
        super(hostId, String.format("probe '%s': %s", probe, message), cause);
        this.probe = probe;
    }

    /**
     * Gets the name of the probe whose output was rejected.
     *
     * @return the probe name
     */
    public String getProbe() {
        return probe;
    }
}
