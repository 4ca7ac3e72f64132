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

/**
 * CentOS, RHEL, Rocky Linux and Fedora: dnf or yum, firewalld and systemd.
 *
 * <p>Hosts catalogued with yum are checked for dnf first, since yum is an alias
 * of dnf from release 8 on. Firewall rules go into the {@code drop} zone as rich
 * rules whose priority follows list order, so later rules take precedence.</p>
 *
 * @author devteam@scivicslab.com
 */
public class RhelCapabilities extends AbstractDistroCapabilities {

    static final String FIREWALL_ZONE = "drop";

    public RhelCapabilities(Distribution distribution, CommandExecutor executor) {
        super(distribution, executor);
    }

    private String packageManager(OperationContext ctx) throws ProvisioningException {
        if ("dnf".equals(distribution.getPackageManager()) || succeeds(ctx, "command -v dnf")) {
            return "dnf";
        }
        return "yum";
    }

    private String dockerRepositoryUrl() {
        String path = switch (distribution) {
            case RHEL -> "rhel";
            case FEDORA -> "fedora";
            default -> "centos";
        };
        return "https://download.docker.com/linux/" + path;
    }

    @Override
    protected void addRuntimeRepository(OperationContext ctx) throws ProvisioningException {
        String pm = packageManager(ctx);
        String repoFile = dockerRepositoryUrl() + "/docker-ce.repo";
        run(ctx, "import docker signing key", "rpm --import " + dockerRepositoryUrl() + "/gpg", true);
        if (pm.equals("dnf")) {
            run(ctx, "install repository prerequisites", "dnf install -y dnf-plugins-core", true);
            // dnf5 replaced --add-repo with the addrepo subcommand
            run(ctx, "add docker repository",
                "dnf config-manager --add-repo " + repoFile
                    + " || dnf config-manager addrepo --from-repofile=" + repoFile, true);
        } else {
            run(ctx, "install repository prerequisites", "yum install -y yum-utils", true);
            run(ctx, "add docker repository", "yum-config-manager --add-repo " + repoFile, true);
        }
    }

    @Override
    protected void installRuntimePackages(OperationContext ctx) throws ProvisioningException {
        run(ctx, "install docker packages", packageManager(ctx)
            + " install -y docker-ce docker-ce-cli containerd.io docker-buildx-plugin docker-compose-plugin", true);
    }

    @Override
    protected void enableRuntimeService(OperationContext ctx) throws ProvisioningException {
        run(ctx, "enable docker service", "systemctl enable --now docker", true);
    }

    @Override
    protected void ensureFirewallTool(OperationContext ctx) throws ProvisioningException {
        if (!succeeds(ctx, "command -v firewall-cmd")) {
            run(ctx, "install firewalld", packageManager(ctx) + " install -y firewalld", true);
        }
        run(ctx, "start firewalld", "systemctl enable --now firewalld", true);
    }

    @Override
    protected void resetFirewall(OperationContext ctx) throws ProvisioningException {
        run(ctx, "reset " + FIREWALL_ZONE + " zone",
            "firewall-cmd --permanent --load-zone-defaults=" + FIREWALL_ZONE, true);
        run(ctx, "make " + FIREWALL_ZONE + " the default zone",
            "firewall-cmd --set-default-zone=" + FIREWALL_ZONE, true);
    }

    @Override
    protected boolean firstMatchWins() {
        return false;
    }

    /*
     * Lower priority values are evaluated first, so rule n gets -(n+1).
     */
    @Override
    protected String firewallRuleCommand(FirewallRule rule, int position) {
        StringBuilder richRule = new StringBuilder("rule priority=\"").append(-(position + 1)).append('"');
        if (!rule.isAnySource()) {
            richRule.append(" family=\"ipv4\" source address=\"").append(rule.getSource()).append('"');
        }
        richRule.append(" port port=\"").append(rule.getPort())
                .append("\" protocol=\"").append(rule.getProtocol()).append('"')
                .append(rule.getAction() == FirewallRule.Action.DENY ? " reject" : " accept");
        return "firewall-cmd --permanent --zone=" + FIREWALL_ZONE + " --add-rich-rule='" + richRule + "'";
    }

    @Override
    protected void enableFirewall(OperationContext ctx) throws ProvisioningException {
        run(ctx, "reload firewalld", "firewall-cmd --reload", true);
    }

    @Override
    protected String listFirewallCommand() {
        return "firewall-cmd --zone=" + FIREWALL_ZONE + " --list-all";
    }

    @Override
    protected String sshRestartCommand() {
        return "systemctl restart sshd";
    }

    @Override
    public void configureAutomaticUpdates(OperationContext ctx) throws ProvisioningException {
        if (packageManager(ctx).equals("dnf")) {
            run(ctx, "install dnf-automatic", "dnf install -y dnf-automatic", true);
            run(ctx, "configure dnf-automatic",
                "sed -i -E 's/^apply_updates.*/apply_updates = yes/; s/^upgrade_type.*/upgrade_type = security/'"
                    + " /etc/dnf/automatic.conf", true);
            run(ctx, "enable dnf-automatic timer", "systemctl enable --now dnf-automatic.timer", true);
        } else {
            run(ctx, "install yum-cron", "yum install -y yum-cron", true);
            run(ctx, "configure yum-cron",
                "sed -i -E 's/^apply_updates.*/apply_updates = yes/; s/^update_cmd.*/update_cmd = security/'"
                    + " /etc/yum/yum-cron.conf", true);
            run(ctx, "enable yum-cron", "systemctl enable --now yum-cron", true);
        }
    }

    @Override
    public void updateSystem(OperationContext ctx) throws ProvisioningException {
        run(ctx, "upgrade packages", packageManager(ctx) + " upgrade -y", true);
    }

    @Override
    protected String installPackageCommand(OperationContext ctx, String packageName)
            throws ProvisioningException {
        return packageManager(ctx) + " install -y " + packageName;
    }
}
