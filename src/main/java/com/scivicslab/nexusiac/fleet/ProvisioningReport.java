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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Record of the steps {@link HostProvisioner} went through for one host.
 *
 * @author devteam@scivicslab.com
 */
public final class ProvisioningReport {

    public enum Status {
        OK,
        WARNING,
        SKIPPED
    }

    /**
     * @param name the step
     * @param status how it ended
     * @param detail why it was skipped or what went wrong; "" for OK
     */
    public record Step(String name, Status status, String detail) {
    }

    private final String hostId;
    private final String distribution;
    private final List<Step> steps = new ArrayList<>();

    public ProvisioningReport(String hostId, String distribution) {
        this.hostId = hostId;
        this.distribution = distribution;
    }

    void ok(String step) {
        steps.add(new Step(step, Status.OK, ""));
    }

    void warning(String step, String detail) {
        steps.add(new Step(step, Status.WARNING, detail));
    }

    void skipped(String step, String reason) {
        steps.add(new Step(step, Status.SKIPPED, reason));
    }

    public String getHostId() {
        return hostId;
    }

    public String getDistribution() {
        return distribution;
    }

    public List<Step> getSteps() {
        return Collections.unmodifiableList(steps);
    }

    public boolean hasWarnings() {
        return steps.stream().anyMatch(step -> step.status() == Status.WARNING);
    }
}
