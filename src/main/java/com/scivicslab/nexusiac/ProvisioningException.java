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
 * Thrown when one step of a provisioning sequence fails.
 *
 * <p>The step that failed is kept separately from the message so callers can
 * report it without parsing text. When the step failed because the command
 * could not be run at all, the transport exception is the cause.</p>
 *
 * @author devteam@scivicslab.com
 */
public class ProvisioningException extends NexusException {

    private static final long serialVersionUID = 1L;

    private final String hostId;
    private final String step;

    public ProvisioningException(String hostId, String step, String message) {
        super(String.format("[%s] %s: %s", hostId, step, message));
        this.hostId = hostId;
        this.step = step;
    }

    public ProvisioningException(String hostId, String step, String message, Throwable cause) {
        super(String.format("[%s] %s: %s", hostId, step, message), cause);
        this.hostId = hostId;
        this.step = step;
    }

    public String getHostId() {
        return hostId;
    }

    /**
     * Gets the description of the step that failed.
     *
     * @return the step description
     */
    public String getStep() {
        return step;
    }

    /**
     * Tells whether the step failed because the operation was canceled.
     *
     * @return true if the cause is a {@link CommandCanceledException}
     */
    public boolean isCanceled() {
        return getCause() instanceof CommandCanceledException;
    }
}
