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
 * Thrown when the operation context was canceled or its deadline passed before a command completed.
 *
 * @author devteam@scivicslab.com
 */
public class CommandCanceledException extends RemoteHostException {

    private static final long serialVersionUID = 1L;

    public CommandCanceledException(String hostId, String message) {
        super(hostId, message);
    }

    public CommandCanceledException(String hostId, String message, Throwable cause) {
        super(hostId, message, cause);
    }
}
