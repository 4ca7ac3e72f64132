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

package com.scivicslab.nexusiac.host;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Logger;

import com.scivicslab.nexusiac.CommandResult;
import com.scivicslab.nexusiac.OperationContext;
import com.scivicslab.nexusiac.exec.CommandExecutor;

/**
 * Works out which distribution a host runs.
 *
 * <p>The {@code ID=} line of {@code /etc/os-release} is used when present.
 * Otherwise marker files are tested in a fixed order and the first one that
 * exists decides. A host matching nothing is reported as {@value #UNKNOWN}.</p>
 *
 * @author devteam@scivicslab.com
 */
public class DistributionDetector {

    private static final Logger LOG = Logger.getLogger(DistributionDetector.class.getName());

    public static final String UNKNOWN = "unknown";

    static final String OS_RELEASE_COMMAND = "cat /etc/os-release";

    /** Marker file per distribution, in priority order. */
    static final Map<String, String> MARKER_FILES = new LinkedHashMap<>();
    static {
        MARKER_FILES.put("ubuntu", "/etc/lsb-release");
        MARKER_FILES.put("debian", "/etc/debian_version");
        MARKER_FILES.put("rocky", "/etc/rocky-release");
        MARKER_FILES.put("centos", "/etc/centos-release");
        MARKER_FILES.put("rhel", "/etc/redhat-release");
        MARKER_FILES.put("alpine", "/etc/alpine-release");
    }

    private final CommandExecutor executor;

    public DistributionDetector(CommandExecutor executor) {
        this.executor = executor;
    }

    /**
     * Probes the host.
     *
     * @param ctx the cancellation context
     * @return the lower-case distribution id, or {@value #UNKNOWN}
     * @throws IOException if a probe could not be run
     */
    public String detect(OperationContext ctx) throws IOException {
        CommandResult osRelease = executor.execute(ctx, OS_RELEASE_COMMAND);
        if (osRelease.isSuccess()) {
            String id = parseOsReleaseId(osRelease.getStdout());
            if (!id.isEmpty()) {
                LOG.fine(String.format("[%s] os-release ID=%s", executor.getIdentifier(), id));
                return id;
            }
        }

        for (Map.Entry<String, String> marker : MARKER_FILES.entrySet()) {
            CommandResult test = executor.execute(ctx, "test -f " + marker.getValue());
            if (test.isSuccess()) {
                LOG.fine(String.format("[%s] found %s", executor.getIdentifier(), marker.getValue()));
                return marker.getKey();
            }
        }

        LOG.warning(String.format("[%s] could not detect distribution", executor.getIdentifier()));
        return UNKNOWN;
    }

    /**
     * Extracts the {@code ID} value from os-release content.
     *
     * @param content the file content
     * @return the value with quotes removed and lower-cased, or "" if absent
     */
    static String parseOsReleaseId(String content) {
        for (String line : content.split("\n")) {
            String trimmed = line.trim();
            if (trimmed.startsWith("ID=")) {
                String value = trimmed.substring(3).trim();
                value = value.replace("\"", "").replace("'", "");
                return value.toLowerCase();
            }
        }
        return "";
    }
}
