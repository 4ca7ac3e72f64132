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

import java.io.IOException;

/**
 * Base class for failures raised while talking to a single remote host.
 *
 * <p>Transport problems are I/O problems, so this type extends {@link IOException}
 * and carries the id of the host that failed.</p>
 *
 * @author devteam@scivicslab.com
 */
public class RemoteHostException extends IOException {

    private static final long serialVersionUID = 1L;

    private final String hostId;

    public RemoteHostException(String hostId, String message) {
        super(String.format("[%s] %s", hostId, message));
        this.hostId = hostId;
    }

    public RemoteHostException(String hostId, String message, Throwable cause) {
        super(String.format("[%s] %s", hostId, message), cause);
        this.hostId = hostId;
    }

    /**
     * Gets the id of the host this failure belongs to.
     *
     * @return the host id
     */
    public String getHostId() {
        return hostId;
    }
}
