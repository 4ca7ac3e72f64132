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
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.scivicslab.nexusiac.ConfigurationException;
import com.scivicslab.nexusiac.NotFoundException;
import com.scivicslab.nexusiac.OperationContext;
import com.scivicslab.nexusiac.ProvisioningException;
import com.scivicslab.nexusiac.exec.ScriptedExecutor;
import com.scivicslab.nexusiac.host.FakeRemoteHost;
import com.scivicslab.nexusiac.host.HostFactory;
import com.scivicslab.nexusiac.host.TelemetryFixtures;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for HostProvisioner.
 *
 * @author devteam@scivicslab.com
 */
@DisplayName("HostProvisioner Tests")
class HostProvisionerTest {

    private static final String SERVERS = "servers:\n"
        + "  web1:\n    host: 10.0.0.11\n    ssh_user: deploy\n    ssh_key: k\n    sudo: true\n    distro: ubuntu\n"
        + "  edge1:\n    host: 10.0.0.21\n    ssh_user: deploy\n    ssh_key: k\n    sudo: true\n"
        + "nexuses:\n  prod:\n    servers: [web1, edge1]\n";

    private static final String FIREWALL = "firewall:\n  global:\n    - port: 22\n    - port: 80\n";

    private final List<FakeRemoteHost> created = new ArrayList<>();

    private HostProvisioner provisioner(String yaml, ScriptedExecutor.Responder responder) throws Exception {
        FleetConfiguration config = YamlFleetConfiguration.load(
            new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)), Map.of());
        return new HostProvisioner(config, new HostFactory(identity -> {
            FakeRemoteHost host = new FakeRemoteHost(identity, responder);
            created.add(host);
            return host;
        }));
    }

    private static List<String> stepNames(ProvisioningReport report) {
        List<String> names = new ArrayList<>();
        for (ProvisioningReport.Step step : report.getSteps()) {
            names.add(step.name());
        }
        return names;
    }

    @Test
    @DisplayName("Runs every step in order")
    void testInitialize() throws Exception {
        ProvisioningReport report = provisioner(SERVERS + FIREWALL, (cmd, esc) -> TelemetryFixtures.healthy(cmd))
            .initialize(OperationContext.background(), "web1");

        assertEquals("web1", report.getHostId());
        assertEquals("ubuntu", report.getDistribution());
        assertEquals(List.of("connect", "health check", "update system", "install container runtime",
            "configure firewall", "harden ssh", "configure automatic updates"), stepNames(report));
        assertFalse(report.hasWarnings());
        assertTrue(report.getSteps().stream().allMatch(s -> s.status() == ProvisioningReport.Status.OK));

        FakeRemoteHost host = created.get(0);
        assertTrue(host.getCommands().contains("ufw allow 80/tcp"));
        assertEquals(1, host.getDisconnectCount());
    }

    @Test
    @DisplayName("Firewall is skipped without a firewall section")
    void testNoFirewallSection() throws Exception {
        ProvisioningReport report = provisioner(SERVERS, (cmd, esc) -> TelemetryFixtures.healthy(cmd))
            .initialize(OperationContext.background(), "web1");

        ProvisioningReport.Step firewall = report.getSteps().get(4);
        assertEquals("configure firewall", firewall.name());
        assertEquals(ProvisioningReport.Status.SKIPPED, firewall.status());
        assertTrue(created.get(0).getCommands().stream().noneMatch(c -> c.startsWith("ufw")));
    }

    @Test
    @DisplayName("Distribution is detected when not declared")
    void testDetectsDistribution() throws Exception {
        ProvisioningReport report = provisioner(SERVERS, (cmd, esc) -> cmd.equals("cat /etc/os-release")
                ? ScriptedExecutor.ok("NAME=\"Alpine Linux\"\nID=alpine\n")
                : TelemetryFixtures.healthy(cmd))
            .initialize(OperationContext.background(), "edge1");

        assertEquals("alpine", report.getDistribution());
        assertTrue(created.get(0).getCommands().contains("apk upgrade"));
    }

    @Test
    @DisplayName("SSH hardening failure is a warning")
    void testHardeningFailureIsWarning() throws Exception {
        ProvisioningReport report = provisioner(SERVERS, (cmd, esc) -> cmd.equals("sshd -t")
                ? ScriptedExecutor.fail(255, "/etc/ssh/sshd_config line 3: Bad configuration option")
                : TelemetryFixtures.healthy(cmd))
            .initialize(OperationContext.background(), "web1");

        assertTrue(report.hasWarnings());
        ProvisioningReport.Step ssh = report.getSteps().get(5);
        assertEquals(ProvisioningReport.Status.WARNING, ssh.status());
        assertTrue(ssh.detail().contains("Bad configuration option"));
        assertEquals(ProvisioningReport.Status.OK, report.getSteps().get(6).status());
    }

    @Test
    @DisplayName("SSH settings overridden on the host are a warning")
    void testOverriddenSshSettingsAreWarning() throws Exception {
        ProvisioningReport report = provisioner(SERVERS, (cmd, esc) -> cmd.equals("sshd -T")
                ? ScriptedExecutor.ok(TelemetryFixtures.SSHD_HARDENED.replace("passwordauthentication no", "passwordauthentication yes"))
                : TelemetryFixtures.healthy(cmd))
            .initialize(OperationContext.background(), "web1");

        ProvisioningReport.Step ssh = report.getSteps().get(5);
        assertEquals(ProvisioningReport.Status.WARNING, ssh.status());
        assertTrue(ssh.detail().contains("PasswordAuthentication is yes"));
        assertTrue(created.get(0).getCommands().contains("cp -p /etc/ssh/sshd_config.backup /etc/ssh/sshd_config"));
        assertFalse(created.get(0).getCommands().contains("systemctl restart ssh"));
    }

    @Test
    @DisplayName("Mandatory step failure aborts and disconnects")
    void testMandatoryStepFailure() throws Exception {
        HostProvisioner provisioner = provisioner(SERVERS, (cmd, esc) -> cmd.startsWith("DEBIAN_FRONTEND=noninteractive apt-get upgrade")
            ? ScriptedExecutor.fail(100, "dpkg was interrupted")
            : TelemetryFixtures.healthy(cmd));

        ProvisioningException e = assertThrows(ProvisioningException.class,
            () -> provisioner.initialize(OperationContext.background(), "web1"));

        assertEquals("upgrade packages", e.getStep());
        assertEquals(1, created.get(0).getDisconnectCount());
        assertTrue(created.get(0).getCommands().stream().noneMatch(c -> c.contains("docker")));
    }

    @Test
    @DisplayName("Failed health check stops provisioning")
    void testHealthCheckFailure() throws Exception {
        HostProvisioner provisioner = provisioner(SERVERS, (cmd, esc) -> ScriptedExecutor.ok(""));

        ProvisioningException e = assertThrows(ProvisioningException.class,
            () -> provisioner.initialize(OperationContext.background(), "web1"));

        assertEquals("health check", e.getStep());
    }

    @Test
    @DisplayName("Unknown host and unsupported distribution are rejected")
    void testRejected() throws Exception {
        HostProvisioner provisioner = provisioner(SERVERS, (cmd, esc) -> cmd.equals("cat /etc/os-release")
            ? ScriptedExecutor.ok("ID=arch\n")
            : TelemetryFixtures.healthy(cmd));

        assertThrows(NotFoundException.class, () -> provisioner.initialize(OperationContext.background(), "nope"));
        ConfigurationException e = assertThrows(ConfigurationException.class,
            () -> provisioner.initialize(OperationContext.background(), "edge1"));
        assertTrue(e.getMessage().contains("arch"));
    }
}
