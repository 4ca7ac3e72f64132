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

import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.scivicslab.nexusiac.CommandResult;
import com.scivicslab.nexusiac.PartialFailureException;

/**
 * Per-host results of one fan-out command, with exactly one entry per member host.
 *
 * <p>A host on which the command could not be run (connection refused,
 * authentication failure, cancellation) has a result with exit code
 * {@link CommandResult#EXIT_CODE_NOT_EXECUTED} and the error text as stderr.
 * Such hosts make the outcome a partial failure. A command that ran and exited
 * non-zero is not a failure here.</p>
 *
 * <pre>{@code
 * FleetOutcome outcome = coordinator.executeOnNexus(ctx, "prod", "uptime", false);
 * outcome.getResults().forEach((host, result) -> System.out.println(host + ": " + result.getStdout()));
 * outcome.throwIfAnyFailed();
 * }</pre>
 *
 * @author devteam@scivicslab.com
 */
public final class FleetOutcome {

    private final String nexusName;
    private final Map<String, CommandResult> results;
    private final List<String> failedHosts;

    public FleetOutcome(String nexusName, Map<String, CommandResult> results, List<String> failedHosts) {
        this.nexusName = nexusName;
        this.results = results;
        this.failedHosts = List.copyOf(failedHosts);
    }

    public String getNexusName() {
        return nexusName;
    }

    /**
     * @return host id to result, in member order; unmodifiable
     */
    public Map<String, CommandResult> getResults() {
        return results;
    }

    public List<String> getFailedHosts() {
        return failedHosts;
    }

    public boolean isSuccess() {
        return failedHosts.isEmpty();
    }

    /**
     * Gets the summary error, present when at least one host could not run the command.
     *
     * @return the summary, or empty
     */
    public Optional<PartialFailureException> failure() {
        if (failedHosts.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new PartialFailureException(nexusName, failedHosts, results.size()));
    }

    public void throwIfAnyFailed() throws PartialFailureException {
        Optional<PartialFailureException> failure = failure();
        if (failure.isPresent()) {
            throw failure.get();
        }
    }
}
