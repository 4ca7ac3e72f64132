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

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.scivicslab.nexusiac.CommandCanceledException;
import com.scivicslab.nexusiac.CommandResult;
import com.scivicslab.nexusiac.HostIdentity;
import com.scivicslab.nexusiac.NetworkException;
import com.scivicslab.nexusiac.NotFoundException;
import com.scivicslab.nexusiac.OperationContext;
import com.scivicslab.nexusiac.PartialFailureException;
import com.scivicslab.nexusiac.exec.ScriptedExecutor;
import com.scivicslab.nexusiac.host.FakeRemoteHost;
import com.scivicslab.nexusiac.host.HostFactory;
import com.scivicslab.nexusiac.host.TelemetryFixtures;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for FleetCoordinator with in-memory hosts.
 *
 * @author devteam@scivicslab.com
 */
@DisplayName("FleetCoordinator Tests")
class FleetCoordinatorTest {

    private static final String FLEET = "servers:\n"
        + "  a:\n    host: 10.0.0.1\n    ssh_user: deploy\n    ssh_key: k\n"
        + "  b:\n    host: 10.0.0.2\n    ssh_user: deploy\n    ssh_key: k\n"
        + "  c:\n    host: 10.0.0.3\n    ssh_user: deploy\n    ssh_key: k\n"
        + "  nouser:\n    host: 10.0.0.4\n    ssh_key: k\n"
        + "nexuses:\n"
        + "  prod:\n    description: Production\n    servers: [a, b]\n"
        + "  all:\n    servers: [a, b, c]\n"
        + "  dup:\n    servers: [a, a, b]\n"
        + "  broken:\n    servers: [a, ghost]\n"
        + "  misconfigured:\n    servers: [a, nouser]\n";

    /**
     * Behavior of one fake host, keyed by host id.
     */
    private final Map<String, ScriptedExecutor.Responder> responders = new ConcurrentHashMap<>();
    private final Map<String, NetworkException> connectFailures = new ConcurrentHashMap<>();
    private final Map<String, FakeRemoteHost> hosts = new ConcurrentHashMap<>();

    private InMemoryActiveNexusStore store;
    private FleetCoordinator coordinator;

    @BeforeEach
    void setUp() throws Exception {
        FleetConfiguration config = YamlFleetConfiguration.load(
            new ByteArrayInputStream(FLEET.getBytes(StandardCharsets.UTF_8)), Map.of());
        HostFactory factory = new HostFactory(this::createHost);
        store = new InMemoryActiveNexusStore();
        coordinator = new FleetCoordinator(config, store, factory);
    }

    @AfterEach
    void tearDown() {
        coordinator.close();
    }

    private FakeRemoteHost createHost(HostIdentity identity) {
        ScriptedExecutor.Responder responder = responders.getOrDefault(identity.getId(),
            (cmd, esc) -> TelemetryFixtures.healthy(cmd));
        FakeRemoteHost host = new FakeRemoteHost(identity, responder);
        NetworkException failure = connectFailures.get(identity.getId());
        if (failure != null) {
            host.failConnectWith(failure);
        }
        hosts.put(identity.getId(), host);
        return host;
    }

    @Test
    @DisplayName("Status has one entry per member and every handle is released")
    void testStatusAllHealthy() throws Exception {
        NexusStatus status = coordinator.status(OperationContext.background(), "all");

        assertEquals(3, status.getServersTotal());
        assertEquals(3, status.getServersOnline());
        assertTrue(status.isHealthy());
        assertEquals(List.of("a", "b", "c"), List.copyOf(status.getHostStatuses().keySet()));
        assertEquals(4, status.getHostStatuses().get("c").getResources().cpu().cores());
        for (FakeRemoteHost host : hosts.values()) {
            assertEquals(1, host.getDisconnectCount());
        }
    }

    @Test
    @DisplayName("Unreachable member is offline while the others report")
    void testStatusPartiallyOffline() throws Exception {
        connectFailures.put("b", new NetworkException("b", "connection refused"));

        NexusStatus status = coordinator.status(OperationContext.background(), "prod");

        assertEquals(1, status.getServersOnline());
        assertEquals(2, status.getServersTotal());
        assertFalse(status.isHealthy());
        assertTrue(status.getHostStatuses().get("a").isOnline());
        HostStatus b = status.getHostStatuses().get("b");
        assertFalse(b.isOnline());
        assertTrue(b.getError().contains("connection refused"));
        assertNull(b.getResources());
        assertEquals(1, hosts.get("b").getDisconnectCount());
    }

    @Test
    @DisplayName("Telemetry failure keeps the host online")
    void testTelemetryFailure() throws Exception {
        responders.put("a", (cmd, esc) -> cmd.equals("cat /proc/loadavg")
            ? ScriptedExecutor.fail(1, "cat: /proc/loadavg: No such file or directory")
            : TelemetryFixtures.healthy(cmd));

        NexusStatus status = coordinator.status(OperationContext.background(), "prod");

        assertTrue(status.isHealthy());
        HostStatus a = status.getHostStatuses().get("a");
        assertTrue(a.isOnline());
        assertNull(a.getResources());
        assertTrue(a.getTelemetryError().contains("load"));
    }

    @Test
    @DisplayName("Failed health check marks the host offline")
    void testHealthCheckFailure() throws Exception {
        responders.put("b", (cmd, esc) -> ScriptedExecutor.ok("Welcome!\n"));

        NexusStatus status = coordinator.status(OperationContext.background(), "prod");

        assertFalse(status.getHostStatuses().get("b").isOnline());
        assertTrue(status.getHostStatuses().get("b").getError().contains("unexpected health check response"));
    }

    @Test
    @DisplayName("Command runs on every member")
    void testExecuteOnNexus() throws Exception {
        FleetOutcome outcome = coordinator.executeOnNexus(OperationContext.background(), "prod", "true", false);

        assertTrue(outcome.isSuccess());
        assertTrue(outcome.failure().isEmpty());
        assertEquals(2, outcome.getResults().size());
        assertEquals(0, outcome.getResults().get("a").getExitCode());
        assertEquals(0, outcome.getResults().get("b").getExitCode());
        assertEquals(List.of("true"), hosts.get("a").getCommands());
        outcome.throwIfAnyFailed();
    }

    @Test
    @DisplayName("Non-zero exit is a result, not a failure")
    void testNonZeroExit() throws Exception {
        responders.put("b", (cmd, esc) -> new CommandResult(2, "", "grep: no match", 3));

        FleetOutcome outcome = coordinator.executeOnNexus(OperationContext.background(), "prod", "grep x f", false);

        assertTrue(outcome.isSuccess());
        assertEquals(2, outcome.getResults().get("b").getExitCode());
    }

    @Test
    @DisplayName("Hosts where the command could not run are collected as a partial failure")
    void testPartialFailure() throws Exception {
        connectFailures.put("c", new NetworkException("c", "no route to host"));

        FleetOutcome outcome = coordinator.executeOnNexus(OperationContext.background(), "all", "uptime", true);

        assertFalse(outcome.isSuccess());
        assertEquals(List.of("c"), outcome.getFailedHosts());
        assertEquals(3, outcome.getResults().size());
        CommandResult c = outcome.getResults().get("c");
        assertEquals(CommandResult.EXIT_CODE_NOT_EXECUTED, c.getExitCode());
        assertTrue(c.getStderr().contains("no route to host"));
        PartialFailureException e = assertThrows(PartialFailureException.class, outcome::throwIfAnyFailed);
        assertEquals(List.of("c"), e.getFailedHosts());
        assertEquals(3, e.getTotalHosts());
    }

    @Test
    @DisplayName("Invalid host definition fails only that host")
    void testMisconfiguredHost() throws Exception {
        FleetOutcome outcome = coordinator.executeOnNexus(OperationContext.background(), "misconfigured", "true", false);

        assertEquals(List.of("nouser"), outcome.getFailedHosts());
        assertTrue(outcome.getResults().get("nouser").getStderr().contains("ssh user is required"));
        assertEquals(0, outcome.getResults().get("a").getExitCode());
    }

    @Test
    @DisplayName("Members run concurrently")
    void testConcurrentFanOut() throws Exception {
        CountDownLatch allStarted = new CountDownLatch(3);
        ScriptedExecutor.Responder rendezvous = (cmd, esc) -> {
            allStarted.countDown();
            try {
                boolean together = allStarted.await(10, TimeUnit.SECONDS);
                return together ? ScriptedExecutor.ok("together") : ScriptedExecutor.fail(1, "alone");
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CommandCanceledException("x", "interrupted", e);
            }
        };
        responders.put("a", rendezvous);
        responders.put("b", rendezvous);
        responders.put("c", rendezvous);

        FleetOutcome outcome = coordinator.executeOnNexus(OperationContext.background(), "all", "sync", false);

        for (CommandResult result : outcome.getResults().values()) {
            assertEquals("together", result.getStdout());
        }
    }

    @Test
    @DisplayName("Cancellation stops pending hosts and keeps finished results")
    void testCancellation() throws Exception {
        OperationContext ctx = OperationContext.background();
        CountDownLatch aDone = new CountDownLatch(1);
        responders.put("a", (cmd, esc) -> {
            aDone.countDown();
            return ScriptedExecutor.ok("done");
        });
        responders.put("b", (cmd, esc) -> {
            while (!ctx.isCancelled()) {
                try {
                    Thread.sleep(10);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
            throw new CommandCanceledException("b", ctx.cancellationReason());
        });
        Thread canceller = new Thread(() -> {
            try {
                aDone.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            ctx.cancel();
        });
        canceller.start();

        FleetOutcome outcome = coordinator.executeOnNexus(ctx, "prod", "long-job", false);
        canceller.join();

        assertEquals("done", outcome.getResults().get("a").getStdout());
        assertEquals(List.of("b"), outcome.getFailedHosts());
        assertTrue(outcome.getResults().get("b").getStderr().contains("operation canceled"));
        assertEquals(1, hosts.get("b").getDisconnectCount());
    }

    @Test
    @DisplayName("Already canceled context yields an entry per member")
    void testCanceledBeforeStart() throws Exception {
        OperationContext ctx = OperationContext.background();
        ctx.cancel();

        FleetOutcome outcome = coordinator.executeOnNexus(ctx, "all", "true", false);

        assertEquals(List.of("a", "b", "c"), outcome.getFailedHosts());
        assertEquals(3, outcome.getResults().size());
    }

    @Test
    @DisplayName("Active nexus is stored only for existing nexuses")
    void testSwitchActive() throws Exception {
        NotFoundException none = assertThrows(NotFoundException.class, coordinator::currentNexus);
        assertTrue(none.getMessage().contains("no active nexus"));

        coordinator.switchActive("prod");
        assertEquals("prod", coordinator.currentNexus().getName());

        assertThrows(NotFoundException.class, () -> coordinator.switchActive("qa"));
        assertEquals("prod", coordinator.currentNexus().getName());
        assertEquals(1, store.getSaves());
    }

    @Test
    @DisplayName("Execute on all targets the active nexus")
    void testExecuteOnAll() throws Exception {
        assertThrows(NotFoundException.class,
            () -> coordinator.executeOnAll(OperationContext.background(), "true", false));
        assertTrue(hosts.isEmpty());

        coordinator.switchActive("prod");
        FleetOutcome outcome = coordinator.executeOnAll(OperationContext.background(), "true", false);

        assertEquals("prod", outcome.getNexusName());
        assertEquals(List.of("a", "b"), List.copyOf(outcome.getResults().keySet()));
    }

    @Test
    @DisplayName("Members are resolved in order without duplicates")
    void testListMembers() throws Exception {
        List<HostIdentity> members = coordinator.listMembers("dup");

        assertEquals(2, members.size());
        assertEquals("a", members.get(0).getId());
        assertEquals("b", members.get(1).getId());

        NotFoundException ghost = assertThrows(NotFoundException.class, () -> coordinator.listMembers("broken"));
        assertEquals("nexus 'broken' references undefined host 'ghost'", ghost.getMessage());
        assertThrows(NotFoundException.class, () -> coordinator.status(OperationContext.background(), "nope"));
        assertEquals(5, coordinator.listNexuses().size());
    }

    @Test
    @DisplayName("Single host status")
    void testHostStatus() throws Exception {
        HostStatus status = coordinator.hostStatus(OperationContext.background(), "c");

        assertTrue(status.isOnline());
        assertEquals(20.0, status.getResources().cpu().usage(), 0.001);
        assertThrows(NotFoundException.class, () -> coordinator.hostStatus(OperationContext.background(), "zz"));
    }
}
