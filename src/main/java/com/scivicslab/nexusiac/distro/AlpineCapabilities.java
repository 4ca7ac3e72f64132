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

import com.scivicslab.nexusiac.CommandResult;
import com.scivicslab.nexusiac.OperationContext;
import com.scivicslab.nexusiac.ProvisioningException;
import com.scivicslab.nexusiac.exec.CommandExecutor;

/**
 * Alpine Linux: apk, iptables and OpenRC.
 *
 * <p>IPv4 and IPv6 get the same baseline. The rules of both are saved with the
 * OpenRC iptables and ip6tables services so they survive a reboot. Automatic
 * updates are a daily periodic script run by crond.</p>
 *
 * @author devteam@scivicslab.com
 */
public class AlpineCapabilities extends AbstractDistroCapabilities {

    static final String AUTO_UPGRADE_SCRIPT = "/etc/periodic/daily/apk-autoupgrade";

    public AlpineCapabilities(Distribution distribution, CommandExecutor executor) {
        super(distribution, executor);
    }

    @Override
    protected void addRuntimeRepository(OperationContext ctx) throws ProvisioningException {
        // docker lives in the community repository, commented out on minimal installs
        run(ctx, "enable community repository",
            "grep -qE '^[^#].*/community$' /etc/apk/repositories"
                + " || sed -i -E 's|^#[[:space:]]*(.*/community)$|\\1|' /etc/apk/repositories", true);
        run(ctx, "refresh package index", "apk update", true);
    }

    @Override
    protected void installRuntimePackages(OperationContext ctx) throws ProvisioningException {
        run(ctx, "install docker packages", "apk add alpine-keys docker docker-cli-compose", true);
    }

    @Override
    protected void enableRuntimeService(OperationContext ctx) throws ProvisioningException {
        run(ctx, "enable docker service",
            "rc-update add docker default && rc-service --ifstopped docker start", true);
    }

    @Override
    protected String groupAddCommand(String quotedUser) {
        return "addgroup " + quotedUser + " docker";
    }

    @Override
    protected String runtimeStatusCommand() {
        return "rc-service docker status";
    }

    @Override
    protected String parseRuntimeStatus(CommandResult result) {
        String output = result.getStdout().trim();
        if (output.contains("started")) {
            return "active";
        }
        if (output.contains("stopped") || output.contains("does not exist")) {
            return "inactive";
        }
        return output.isEmpty() ? super.parseRuntimeStatus(result) : output;
    }

    @Override
    protected void ensureFirewallTool(OperationContext ctx) throws ProvisioningException {
        if (!succeeds(ctx, "command -v iptables && command -v ip6tables")) {
            run(ctx, "install iptables", "apk add iptables ip6tables", true);
        }
    }

    /*
     * One command per address family, so that the session carrying it is never
     * cut off between the flush and the ESTABLISHED rule.
     */
    @Override
    protected void resetFirewall(OperationContext ctx) throws ProvisioningException {
        run(ctx, "reset iptables", resetCommand("iptables"), true);
        run(ctx, "reset ip6tables", resetCommand("ip6tables"), true);
    }

    private static String resetCommand(String tool) {
        StringBuilder cmd = new StringBuilder()
            .append(tool).append(" -P INPUT ACCEPT")
            .append(" && ").append(tool).append(" -F INPUT")
            .append(" && ").append(tool).append(" -A INPUT -i lo -j ACCEPT")
            .append(" && ").append(tool).append(" -A INPUT -m conntrack --ctstate ESTABLISHED,RELATED -j ACCEPT");
        if (tool.equals("ip6tables")) {
            // neighbor discovery runs over ICMPv6
            cmd.append(" && ").append(tool).append(" -A INPUT -p ipv6-icmp -j ACCEPT");
        }
        cmd.append(" && ").append(tool).append(" -P INPUT DROP")
           .append(" && ").append(tool).append(" -P OUTPUT ACCEPT");
        return cmd.toString();
    }

    /*
     * Sources are IPv4 ranges; a rule open to any source applies to IPv6 too.
     */
    @Override
    protected String firewallRuleCommand(FirewallRule rule, int position) {
        String v4 = ruleCommand("iptables", rule);
        return rule.isAnySource() ? v4 + " && " + ruleCommand("ip6tables", rule) : v4;
    }

    private static String ruleCommand(String tool, FirewallRule rule) {
        StringBuilder cmd = new StringBuilder(tool).append(" -A INPUT -p ").append(rule.getProtocol());
        if (!rule.isAnySource()) {
            cmd.append(" -s ").append(rule.getSource());
        }
        cmd.append(" --dport ").append(rule.getPort())
           .append(" -j ").append(rule.getAction() == FirewallRule.Action.DENY ? "DROP" : "ACCEPT");
        return cmd.toString();
    }

    @Override
    protected void enableFirewall(OperationContext ctx) throws ProvisioningException {
        run(ctx, "persist iptables rules",
            "rc-update add iptables default && /etc/init.d/iptables save"
                + " && rc-update add ip6tables default && /etc/init.d/ip6tables save", true);
        run(ctx, "start iptables service",
            "rc-service --ifstopped iptables start && rc-service --ifstopped ip6tables start", true);
    }

    @Override
    protected String listFirewallCommand() {
        return "iptables -S INPUT && ip6tables -S INPUT";
    }

    @Override
    protected String sshRestartCommand() {
        return "rc-service sshd restart";
    }

    @Override
    public void configureAutomaticUpdates(OperationContext ctx) throws ProvisioningException {
        run(ctx, "write " + AUTO_UPGRADE_SCRIPT,
            "printf '%s\\n' '#!/bin/sh' 'apk update && apk upgrade' > " + AUTO_UPGRADE_SCRIPT
                + " && chmod 755 " + AUTO_UPGRADE_SCRIPT, true);
        run(ctx, "enable crond", "rc-update add crond default && rc-service --ifstopped crond start", true);
    }

    @Override
    public void updateSystem(OperationContext ctx) throws ProvisioningException {
        run(ctx, "refresh package index", "apk update", true);
        run(ctx, "upgrade packages", "apk upgrade", true);
    }

    @Override
    protected String installPackageCommand(OperationContext ctx, String packageName) {
        return "apk add " + packageName;
    }
}
