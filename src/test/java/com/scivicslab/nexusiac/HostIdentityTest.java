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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for HostIdentity and CommandResult.
 *
 * @author devteam@scivicslab.com
 */
@DisplayName("HostIdentity Tests")
class HostIdentityTest {

    private static HostIdentity.Builder web1() {
        return new HostIdentity.Builder("web1")
            .address("10.0.0.11")
            .user("deploy")
            .keyPath("~/.ssh/id_ed25519");
    }

    @Test
    @DisplayName("Port defaults to 22 when not declared")
    void testDefaultPort() {
        HostIdentity identity = web1().build();

        assertEquals(0, identity.getPort());
        assertEquals(22, identity.getEffectivePort());
        assertEquals(2222, web1().port(2222).build().getEffectivePort());
    }

    @Test
    @DisplayName("Detected distribution is recorded once")
    void testRecordDetectedDistribution() {
        HostIdentity identity = web1().build();
        assertEquals("", identity.getDistribution());

        identity.recordDetectedDistribution("Ubuntu");
        assertEquals("ubuntu", identity.getDistribution());
        assertFalse(identity.hasDeclaredDistribution());

        assertThrows(IllegalStateException.class, () -> identity.recordDetectedDistribution("debian"));
        assertEquals("ubuntu", identity.getDistribution());
    }

    @Test
    @DisplayName("Declared distribution cannot be overridden by detection")
    void testDeclaredDistributionWins() {
        HostIdentity identity = web1().distribution("rocky").build();

        assertTrue(identity.hasDeclaredDistribution());
        assertThrows(IllegalStateException.class, () -> identity.recordDetectedDistribution("centos"));
        assertEquals("rocky", identity.getDistribution());
    }

    @Test
    @DisplayName("Placeholder result marks a command that never ran")
    void testFailedCommandResult() {
        CommandResult result = CommandResult.failed("[web1] connection refused");

        assertFalse(result.isSuccess());
        assertEquals(CommandResult.EXIT_CODE_NOT_EXECUTED, result.getExitCode());
        assertEquals("", result.getStdout());
        assertEquals("[web1] connection refused", result.getStderr());
    }

    @Test
    @DisplayName("Provisioning failure caused by cancellation is recognized")
    void testProvisioningExceptionCanceled() {
        ProvisioningException canceled = new ProvisioningException("web1", "install docker", "stopped",
            new CommandCanceledException("web1", "operation canceled"));
        ProvisioningException failed = new ProvisioningException("web1", "install docker", "exit code 100: E: broken");

        assertTrue(canceled.isCanceled());
        assertFalse(failed.isCanceled());
        assertEquals("install docker", failed.getStep());
        assertEquals("[web1] install docker: exit code 100: E: broken", failed.getMessage());
    }
}
