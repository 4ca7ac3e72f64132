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

import java.util.Map;

/**
 * Aggregate status of a nexus. The nexus is healthy only if every member is online.
 *
 * @author devteam@scivicslab.com
 */
public final class NexusStatus {

    private final String nexusName;
    private final Map<String, HostStatus> hostStatuses;
    private final int serversOnline;

    /**
     * @param nexusName the nexus
     * @param hostStatuses one entry per member host, in member order
     */
    public NexusStatus(String nexusName, Map<String, HostStatus> hostStatuses) {
        this.nexusName = nexusName;
        this.hostStatuses = hostStatuses;
        int online = 0;
        for (HostStatus status : hostStatuses.values()) {
            if (status.isOnline()) {
                online++;
            }
        }
        this.serversOnline = online;
    }

    public String getNexusName() {
        return nexusName;
    }

    public boolean isHealthy() {
        return serversOnline == hostStatuses.size();
    }

    public int getServersOnline() {
        return serversOnline;
    }

    public int getServersTotal() {
        return hostStatuses.size();
    }

    public Map<String, HostStatus> getHostStatuses() {
        return hostStatuses;
    }
}
