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
import java.nio.file.Path;

import com.scivicslab.nexusiac.HostIdentity;
import com.scivicslab.nexusiac.OperationContext;
import com.scivicslab.nexusiac.exec.CommandExecutor;
import com.scivicslab.nexusiac.telemetry.ResourceSnapshot;

/**
 * Handle on one managed host.
 *
 * <p>A handle owns at most one live connection. Commands and file transfers
 * require the {@link ConnectionState#CONNECTED} state and fail with
 * {@link com.scivicslab.nexusiac.NotConnectedException} otherwise. Each
 * {@link #execute} call runs in a fresh session on that connection.</p>
 *
 * <p>A handle is meant to be owned by one task at a time. {@link #connect} and
 * {@link #disconnect} must not be called concurrently.</p>
 *
 * @author devteam@scivicslab.com
 */
public interface RemoteHost extends CommandExecutor, AutoCloseable {

    String getId();

    String getAddress();

    HostIdentity getIdentity();

    ConnectionState getState();

    /**
     * Opens the connection. Does nothing if already connected.
     *
     * @param ctx the cancellation context
     * @throws com.scivicslab.nexusiac.AuthenticationException if the key is missing,
     *         unreadable, passphrase-protected or rejected
     * @throws com.scivicslab.nexusiac.NetworkException if the host cannot be reached
     *         or the handshake times out
     * @throws IOException on any other failure
     */
    void connect(OperationContext ctx) throws IOException;

    /**
     * Copies a local file to the host.
     *
     * <p>Missing parent directories are created and the local permission bits
     * are applied to the remote copy.</p>
     *
     * @param ctx the cancellation context
     * @param localPath the file to copy
     * @param remotePath the absolute destination path
     * @throws com.scivicslab.nexusiac.TransferException if the copy fails
     * @throws IOException if the host is not connected or the call was canceled
     */
    void transferFile(OperationContext ctx, Path localPath, String remotePath) throws IOException;

    /**
     * Runs an echo round trip and checks that the exact token comes back.
     *
     * @param ctx the cancellation context
     * @throws com.scivicslab.nexusiac.HealthCheckException if the token does not come back
     * @throws IOException if the command could not be run
     */
    void healthCheck(OperationContext ctx) throws IOException;

    /**
     * Samples CPU, memory, disk and load.
     *
     * @param ctx the cancellation context
     * @return the snapshot
     * @throws com.scivicslab.nexusiac.TelemetryParseException if any probe fails to parse
     * @throws IOException if a probe could not be run
     */
    ResourceSnapshot getResources(OperationContext ctx) throws IOException;

    /**
     * Probes the host's distribution.
     *
     * @param ctx the cancellation context
     * @return the lower-case distribution id, or "unknown"
     * @throws IOException if a probe could not be run
     */
    String detectDistribution(OperationContext ctx) throws IOException;

    /**
     * Releases the connection. Safe to call in any state; never fails.
     */
    void disconnect();

    @Override
    default String getIdentifier() {
        return getId();
    }

    @Override
    default void close() {
        disconnect();
    }
}
