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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import com.scivicslab.nexusiac.CommandResult;
import com.scivicslab.nexusiac.HostIdentity;
import com.scivicslab.nexusiac.NotConnectedException;
import com.scivicslab.nexusiac.OperationContext;
import com.scivicslab.nexusiac.exec.ScriptedExecutor;

/**
 * In-memory RemoteHost whose commands are answered by a script.
 *
 * @author devteam@scivicslab.com
 */
public class FakeRemoteHost extends AbstractRemoteHost {

    private final ScriptedExecutor.Responder responder;
    private final List<String> commands = Collections.synchronizedList(new ArrayList<>());
    private final List<String> transfers = Collections.synchronizedList(new ArrayList<>());
    private final AtomicInteger connects = new AtomicInteger();
    private final AtomicInteger disconnects = new AtomicInteger();

    private volatile ConnectionState state = ConnectionState.DISCONNECTED;
    private volatile IOException connectFailure;

    public FakeRemoteHost(HostIdentity identity, ScriptedExecutor.Responder responder) {
        super(identity);
        this.responder = responder;
    }

    public FakeRemoteHost failConnectWith(IOException failure) {
        this.connectFailure = failure;
        return this;
    }

    @Override
    public ConnectionState getState() {
        return state;
    }

    @Override
    public void connect(OperationContext ctx) throws IOException {
        ctx.throwIfCancelled(getId());
        connects.incrementAndGet();
        if (connectFailure != null) {
            throw connectFailure;
        }
        state = ConnectionState.CONNECTED;
    }

    @Override
    public CommandResult execute(OperationContext ctx, String command, boolean escalate) throws IOException {
        if (state != ConnectionState.CONNECTED) {
            throw new NotConnectedException(getId(), "host is disconnected");
        }
        ctx.throwIfCancelled(getId());
        commands.add(command);
        return responder.respond(command, escalate);
    }

    @Override
    public void transferFile(OperationContext ctx, Path localPath, String remotePath) throws IOException {
        if (state != ConnectionState.CONNECTED) {
            throw new NotConnectedException(getId(), "host is disconnected");
        }
        transfers.add(localPath + " -> " + remotePath);
    }

    @Override
    public void disconnect() {
        disconnects.incrementAndGet();
        state = ConnectionState.DISCONNECTED;
    }

    public List<String> getCommands() {
        synchronized (commands) {
            return new ArrayList<>(commands);
        }
    }

    public List<String> getTransfers() {
        synchronized (transfers) {
            return new ArrayList<>(transfers);
        }
    }

    public int getConnectCount() {
        return connects.get();
    }

    public int getDisconnectCount() {
        return disconnects.get();
    }
}
