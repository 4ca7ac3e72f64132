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

package com.scivicslab.nexusiac.distro;

import com.scivicslab.nexusiac.OperationContext;
import com.scivicslab.nexusiac.ProvisioningException;
import com.scivicslab.nexusiac.exec.CommandExecutor;
import com.scivicslab.nexusiac.exec.ShellQuote;

/**
 * Debian and Ubuntu: apt, ufw, systemd and unattended-upgrades.
 *
 * @author devteam@scivicslab.com
 */
public class DebianCapabilities extends AbstractDistroCapabilities {

    static final String APT_INSTALL = "DEBIAN_FRONTEND=noninteractive apt-get install -y ";
    static final String DOCKER_KEYRING = "/etc/apt/keyrings/docker.asc";
    static final String AUTO_UPGRADES_FILE = "/etc/apt/apt.conf.d/20auto-upgrades";

    public DebianCapabilities(Distribution distribution, CommandExecutor executor) {
        super(distribution, executor);
    }

    /**
     * Gets the path segment of the Docker repository; Ubuntu and Debian have their own.
     */
    private String dockerRepositoryUrl() {
        return "https://download.docker.com/linux/" + distribution.getId();
    }

    @Override
    protected void addRuntimeRepository(OperationContext ctx) throws ProvisioningException {
        run(ctx, "install repository prerequisites",
            "apt-get update && " + APT_INSTALL + "ca-certificates curl", true);
        run(ctx, "add docker signing key",
            "install -m 0755 -d /etc/apt/keyrings"
                + " && curl -fsSL " + dockerRepositoryUrl() + "/gpg -o " + DOCKER_KEYRING
                + " && chmod a+r " + DOCKER_KEYRING, true);
        run(ctx, "add docker repository",
            "echo \"deb [arch=$(dpkg --print-architecture) signed-by=" + DOCKER_KEYRING + "] "
                + dockerRepositoryUrl() + " $(. /etc/os-release && echo \"$VERSION_CODENAME\") stable\""
                + " > /etc/apt/sources.list.d/docker.list", true);
    }

    @Override
    protected void installRuntimePackages(OperationContext ctx) throws ProvisioningException {
        run(ctx, "refresh package index", "apt-get update", true);
        run(ctx, "install docker packages",
            APT_INSTALL + "docker-ce docker-ce-cli containerd.io docker-buildx-plugin docker-compose-plugin", true);
    }

    @Override
    protected void enableRuntimeService(OperationContext ctx) throws ProvisioningException {
        run(ctx, "enable docker service", "systemctl enable --now docker", true);
    }

    @Override
    protected void ensureFirewallTool(OperationContext ctx) throws ProvisioningException {
        if (!succeeds(ctx, "command -v ufw")) {
            run(ctx, "install ufw", "apt-get update && " + APT_INSTALL + "ufw", true);
        }
    }

    @Override
    protected void resetFirewall(OperationContext ctx) throws ProvisioningException {
        run(ctx, "reset ufw", "ufw --force reset", true);
        run(ctx, "deny incoming by default", "ufw default deny incoming", true);
        run(ctx, "allow outgoing by default", "ufw default allow outgoing", true);
    }

    @Override
    protected String firewallRuleCommand(FirewallRule rule, int position) {
        String action = rule.getAction() == FirewallRule.Action.DENY ? "deny" : "allow";
        StringBuilder cmd = new StringBuilder("ufw ").append(action).append(' ');
        if (rule.isAnySource()) {
            cmd.append(rule.getPort()).append('/').append(rule.getProtocol());
        } else {
            cmd.append("from ").append(rule.getSource())
               .append(" to any port ").append(rule.getPort())
               .append(" proto ").append(rule.getProtocol());
        }
        if (!rule.getComment().isEmpty()) {
            cmd.append(" comment ").append(ShellQuote.quote(rule.getComment()));
        }
        return cmd.toString();
    }

    @Override
    protected void enableFirewall(OperationContext ctx) throws ProvisioningException {
        run(ctx, "enable ufw", "ufw --force enable", true);
    }

    @Override
    protected String listFirewallCommand() {
        return "ufw status verbose";
    }

    @Override
    protected String sshRestartCommand() {
        return "systemctl restart ssh";
    }

    @Override
    public void configureAutomaticUpdates(OperationContext ctx) throws ProvisioningException {
        run(ctx, "install unattended-upgrades", APT_INSTALL + "unattended-upgrades", true);
        run(ctx, "write " + AUTO_UPGRADES_FILE,
            "printf '%s\\n' 'APT::Periodic::Update-Package-Lists \"1\";' 'APT::Periodic::Unattended-Upgrade \"1\";'"
                + " > " + AUTO_UPGRADES_FILE, true);
        run(ctx, "enable unattended-upgrades", "systemctl enable --now unattended-upgrades", true);
    }

    @Override
    public void updateSystem(OperationContext ctx) throws ProvisioningException {
        run(ctx, "refresh package index", "apt-get update", true);
        run(ctx, "upgrade packages",
            "DEBIAN_FRONTEND=noninteractive apt-get upgrade -y"
                + " -o Dpkg::Options::=--force-confdef -o Dpkg::Options::=--force-confold", true);
    }

    @Override
    protected String installPackageCommand(OperationContext ctx, String packageName) {
        return APT_INSTALL + packageName;
    }
}
