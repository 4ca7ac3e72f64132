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

package com.scivicslab.nexusiac.exec;

import java.io.IOException;

import com.scivicslab.nexusiac.CommandResult;
import com.scivicslab.nexusiac.OperationContext;

/**
 * Runs shell commands against one host.
 *
 * <p>This is the only primitive the distro capability sets and telemetry probes
 * are built from, which keeps them independent of how the host is reached.</p>
 *
 * @author devteam@scivicslab.com
 */
public interface CommandExecutor {

    /**
     * Executes a command and returns its result.
     *
     * <p>When {@code escalate} is true and the host permits privilege escalation,
     * the command runs with administrative rights. When the host does not permit
     * it, the command runs unprivileged; this is not an error.</p>
     *
     * @param ctx the cancellation context
     * @param command the shell command line
     * @param escalate whether to request administrative rights
     * @return the result, including non-zero exits
     * @throws IOException if the command could not be run, was canceled,
     *         or the transport failed
     */
    CommandResult execute(OperationContext ctx, String command, boolean escalate) throws IOException;

    /**
     * Executes a command without escalation.
     *
     * @param ctx the cancellation context
     * @param command the shell command line
     * @return the result
     * @throws IOException if the command could not be run
     */
    default CommandResult execute(OperationContext ctx, String command) throws IOException {
        return execute(ctx, command, false);
    }

    /**
     * Executes a command with escalation requested.
     *
     * @param ctx the cancellation context
     * @param command the shell command line
     * @return the result
     * @throws IOException if the command could not be run
     */
    default CommandResult executeSudo(OperationContext ctx, String command) throws IOException {
        return execute(ctx, command, true);
    }

    /**
     * Gets a short identifier for log and error messages (the host id).
     *
     * @return the identifier
     */
    String getIdentifier();
}
