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

import java.util.List;

/**
 * Summary of a fan-out call in which at least one host could not run the command.
 *
 * <p>The per-host detail lives in the outcome map returned next to this exception;
 * this type only names which hosts failed.</p>
 *
 * @author devteam@scivicslab.com
 */
public class PartialFailureException extends NexusException {

    private static final long serialVersionUID = 1L;

    private final List<String> failedHosts;
    private final int totalHosts;

    public PartialFailureException(String nexusName, List<String> failedHosts, int totalHosts) {
        super(String.format("command execution failed on %d of %d hosts in nexus '%s': %s",
            failedHosts.size(), totalHosts, nexusName, failedHosts));
        this.failedHosts = List.copyOf(failedHosts);
        this.totalHosts = totalHosts;
    }

    public List<String> getFailedHosts() {
        return failedHosts;
    }

    public int getTotalHosts() {
        return totalHosts;
    }
}
