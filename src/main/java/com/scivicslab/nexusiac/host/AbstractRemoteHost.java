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

import com.scivicslab.nexusiac.CommandResult;
import com.scivicslab.nexusiac.HealthCheckException;
import com.scivicslab.nexusiac.HostIdentity;
import com.scivicslab.nexusiac.OperationContext;
import com.scivicslab.nexusiac.telemetry.ResourceProbe;
import com.scivicslab.nexusiac.telemetry.ResourceSnapshot;

/**
 * Implements the probing operations of {@link RemoteHost} on top of
 * {@link #execute(OperationContext, String, boolean)}, so that transports only
 * provide connection handling, command execution and file transfer.
 *
 * @author devteam@scivicslab.com
 */
public abstract class AbstractRemoteHost implements RemoteHost {

    static final String HEALTH_TOKEN = "health_check";
    static final String HEALTH_COMMAND = "echo '" + HEALTH_TOKEN + "'";

    protected final HostIdentity identity;

    protected AbstractRemoteHost(HostIdentity identity) {
        this.identity = identity;
    }

    @Override
    public String getId() {
        return identity.getId();
    }

    @Override
    public String getAddress() {
        return identity.getAddress();
    }

    @Override
    public HostIdentity getIdentity() {
        return identity;
    }

    @Override
    public void healthCheck(OperationContext ctx) throws IOException {
        CommandResult result = execute(ctx, HEALTH_COMMAND);
        if (!result.isSuccess()) {
            throw new HealthCheckException(getId(),
                String.format("health check exited with %d: %s", result.getExitCode(), result.getStderr().trim()));
        }
        String echoed = result.getStdout().trim();
        if (!HEALTH_TOKEN.equals(echoed)) {
            throw new HealthCheckException(getId(),
                String.format("unexpected health check response: '%s'", echoed));
        }
    }

    @Override
    public ResourceSnapshot getResources(OperationContext ctx) throws IOException {
        return new ResourceProbe(this).collect(ctx);
    }

    @Override
    public String detectDistribution(OperationContext ctx) throws IOException {
        return new DistributionDetector(this).detect(ctx);
    }
}
