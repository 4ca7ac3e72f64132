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

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

import com.scivicslab.nexusiac.CommandCanceledException;
import com.scivicslab.nexusiac.CommandResult;
import com.scivicslab.nexusiac.ConfigurationException;
import com.scivicslab.nexusiac.OperationContext;
import com.scivicslab.nexusiac.ProvisioningException;
import com.scivicslab.nexusiac.exec.CommandExecutor;
import com.scivicslab.nexusiac.exec.ShellQuote;

/**
 * Step sequencing shared by all distribution families.
 *
 * <p>Subclasses supply the family's commands; this class fixes the order in which
 * they run, turns failures into {@link ProvisioningException}s and owns the parts
 * that are the same everywhere (rule validation and expansion, the SSH daemon
 * edits, the runtime presence check).</p>
 *
 * @author devteam@scivicslab.com
 */
public abstract class AbstractDistroCapabilities implements DistroCapabilities {

    private static final Logger LOG = Logger.getLogger(AbstractDistroCapabilities.class.getName());

    static final String SSHD_CONFIG = "/etc/ssh/sshd_config";
    static final String SSHD_CONFIG_BACKUP = SSHD_CONFIG + ".backup";
    static final String SSHD_CONFIG_STAGING = SSHD_CONFIG + ".nexus-iac";

    static final String HARDENING_BEGIN = "# BEGIN nexus-iac hardening";
    static final String HARDENING_END = "# END nexus-iac hardening";

    private static final String VERIFY_STEP = "verify sshd settings";

    /** sshd_config keywords and the values enforced by {@link #hardenSSH}. */
    static final String[][] SSHD_SETTINGS = {
        {"PermitRootLogin", "no"},
        {"PasswordAuthentication", "no"},
        {"PubkeyAuthentication", "yes"},
        {"X11Forwarding", "no"},
    };

    private static final Pattern PACKAGE_NAME = Pattern.compile("[A-Za-z0-9][A-Za-z0-9.+_:@=~-]*");

    protected final Distribution distribution;
    protected final CommandExecutor executor;

    protected AbstractDistroCapabilities(Distribution distribution, CommandExecutor executor) {
        this.distribution = distribution;
        this.executor = executor;
    }

    @Override
    public Distribution getDistribution() {
        return distribution;
    }

    // ---- container runtime ----

    @Override
    public void installContainerRuntime(OperationContext ctx) throws ProvisioningException {
        if (succeeds(ctx, "command -v docker") && succeeds(ctx, "docker --version")) {
            LOG.info(String.format("[%s] container runtime already installed", hostId()));
            return;
        }

        LOG.info(String.format("[%s] installing container runtime on %s", hostId(), distribution.getDisplayName()));
        addRuntimeRepository(ctx);
        installRuntimePackages(ctx);
        enableRuntimeService(ctx);
        addUserToRuntimeGroup(ctx);
        run(ctx, "verify container runtime", "docker --version", true);
    }

    /**
     * Trusts the runtime vendor's signing key and adds its package repository.
     */
    protected abstract void addRuntimeRepository(OperationContext ctx) throws ProvisioningException;

    protected abstract void installRuntimePackages(OperationContext ctx) throws ProvisioningException;

    protected abstract void enableRuntimeService(OperationContext ctx) throws ProvisioningException;

    /**
     * Gets the command adding a user to the {@code docker} group.
     *
     * @param quotedUser the user name, already shell-quoted
     * @return the command
     */
    protected String groupAddCommand(String quotedUser) {
        return "usermod -aG docker " + quotedUser;
    }

    private void addUserToRuntimeGroup(OperationContext ctx) throws ProvisioningException {
        CommandResult whoami;
        try {
            whoami = executor.execute(ctx, "id -un");
        } catch (CommandCanceledException e) {
            throw new ProvisioningException(hostId(), "add user to docker group", e.getMessage(), e);
        } catch (IOException e) {
            LOG.log(Level.WARNING, String.format("[%s] could not determine login user", hostId()), e);
            return;
        }
        String user = whoami.getStdout().trim();
        if (!whoami.isSuccess() || user.isEmpty() || user.equals("root")) {
            return;
        }
        bestEffort(ctx, "add " + user + " to docker group", groupAddCommand(ShellQuote.quote(user)), true);
    }

    @Override
    public String getRuntimeStatus(OperationContext ctx) throws ProvisioningException {
        CommandResult result;
        try {
            result = executor.execute(ctx, runtimeStatusCommand());
        } catch (IOException e) {
            throw new ProvisioningException(hostId(), "query container runtime status", e.getMessage(), e);
        }
        return parseRuntimeStatus(result);
    }

    protected String runtimeStatusCommand() {
        return "systemctl is-active docker";
    }

    /**
     * Interprets the status query. The default reads {@code systemctl is-active}.
     *
     * @param result the query result
     * @return the status word
     */
    protected String parseRuntimeStatus(CommandResult result) {
        String status = result.getStdout().trim();
        if (status.isEmpty()) {
            return result.isSuccess() ? "unknown" : "inactive";
        }
        return status;
    }

    // ---- firewall ----

    @Override
    public void configureFirewall(OperationContext ctx, List<FirewallRule> rules)
            throws ConfigurationException, ProvisioningException {
        List<FirewallRule> expanded = new ArrayList<>();
        for (FirewallRule rule : rules) {
            rule.validate();
            expanded.addAll(rule.expand());
        }

        LOG.info(String.format("[%s] configuring %s with %d rules",
            hostId(), distribution.getFirewallTool(), expanded.size()));
        ensureFirewallTool(ctx);
        resetFirewall(ctx);

        int count = expanded.size();
        for (int i = 0; i < count; i++) {
            // first-match tools get the list backwards so that later entries win
            int index = firstMatchWins() ? count - 1 - i : i;
            FirewallRule rule = expanded.get(index);
            run(ctx, "add firewall rule " + rule, firewallRuleCommand(rule, index), true);
        }

        enableFirewall(ctx);
    }

    @Override
    public String listFirewallRules(OperationContext ctx) throws ProvisioningException {
        return run(ctx, "list firewall rules", listFirewallCommand(), true).getStdout();
    }

    protected abstract void ensureFirewallTool(OperationContext ctx) throws ProvisioningException;

    /**
     * Removes all rules and sets the deny-incoming, allow-outgoing baseline.
     */
    protected abstract void resetFirewall(OperationContext ctx) throws ProvisioningException;

    /**
     * Builds the command adding one rule.
     *
     * @param rule a single-protocol rule
     * @param position the rule's index in the expanded list
     * @return the command
     */
    protected abstract String firewallRuleCommand(FirewallRule rule, int position);

    protected abstract void enableFirewall(OperationContext ctx) throws ProvisioningException;

    protected abstract String listFirewallCommand();

    /**
     * Tells whether the first matching rule decides, as with ufw and iptables.
     *
     * @return true unless the tool orders rules by explicit priority
     */
    protected boolean firstMatchWins() {
        return true;
    }

    // ---- ssh daemon ----

    @Override
    public void hardenSSH(OperationContext ctx) throws ProvisioningException {
        run(ctx, "back up sshd configuration", "cp -p " + SSHD_CONFIG + " " + SSHD_CONFIG_BACKUP, true);

        try {
            run(ctx, "write sshd hardening block", sshdHardeningCommand(), true);
            run(ctx, "validate sshd configuration", "sshd -t", true);
            verifySshdSettings(ctx);
        } catch (ProvisioningException e) {
            if (!e.isCanceled()) {
                restoreSshdConfig(ctx);
            }
            throw e;
        }

        run(ctx, "restart ssh daemon", sshRestartCommand(), true);
        LOG.info(String.format("[%s] ssh daemon hardened", hostId()));
    }

    /**
     * Builds a command that puts the hardening settings at the very top of
     * sshd_config, replacing the block of an earlier run. sshd keeps the first
     * value it reads for a keyword, so the block wins over later lines, over
     * files pulled in by Include and over the defaults, and it is never inside
     * a Match section.
     *
     * @return the command
     */
    static String sshdHardeningCommand() {
        StringBuilder block = new StringBuilder("printf '%s\\n' ").append(ShellQuote.quote(HARDENING_BEGIN));
        for (String[] setting : SSHD_SETTINGS) {
            block.append(' ').append(ShellQuote.quote(setting[0] + " " + setting[1]));
        }
        block.append(' ').append(ShellQuote.quote(HARDENING_END));

        return "sed -i '/^" + HARDENING_BEGIN + "$/,/^" + HARDENING_END + "$/d' " + SSHD_CONFIG
            + " && " + block + " > " + SSHD_CONFIG_STAGING
            + " && cat " + SSHD_CONFIG + " >> " + SSHD_CONFIG_STAGING
            // cat keeps the inode, owner and mode of the original file
            + " && cat " + SSHD_CONFIG_STAGING + " > " + SSHD_CONFIG
            + " && rm -f " + SSHD_CONFIG_STAGING;
    }

    /**
     * Compares the settings sshd would actually use with the enforced ones.
     */
    private void verifySshdSettings(OperationContext ctx) throws ProvisioningException {
        Map<String, String> effective = parseSshdSettings(run(ctx, VERIFY_STEP, "sshd -T", true).getStdout());

        List<String> mismatches = new ArrayList<>();
        for (String[] setting : SSHD_SETTINGS) {
            String actual = effective.get(setting[0].toLowerCase(Locale.ROOT));
            if (!setting[1].equals(actual)) {
                mismatches.add(String.format("%s is %s, expected %s",
                    setting[0], actual == null ? "unset" : actual, setting[1]));
            }
        }
        if (!mismatches.isEmpty()) {
            throw new ProvisioningException(hostId(), VERIFY_STEP, String.join("; ", mismatches));
        }
    }

    /**
     * Reads the output of {@code sshd -T}: one lowercase keyword and its value per line.
     *
     * @param output the dump
     * @return values by lowercase keyword
     */
    static Map<String, String> parseSshdSettings(String output) {
        Map<String, String> settings = new HashMap<>();
        for (String line : output.split("\n")) {
            String[] parts = line.trim().split("\\s+", 2);
            if (parts.length == 2) {
                settings.putIfAbsent(parts[0].toLowerCase(Locale.ROOT), parts[1].trim());
            }
        }
        return settings;
    }

    private void restoreSshdConfig(OperationContext ctx) {
        try {
            CommandResult result = executor.execute(ctx, "cp -p " + SSHD_CONFIG_BACKUP + " " + SSHD_CONFIG, true);
            if (result.isSuccess()) {
                LOG.warning(String.format("[%s] sshd configuration restored from backup", hostId()));
            } else {
                LOG.severe(String.format("[%s] could not restore %s: %s",
                    hostId(), SSHD_CONFIG, result.getStderr().trim()));
            }
        } catch (IOException e) {
            LOG.log(Level.SEVERE, String.format("[%s] could not restore %s", hostId(), SSHD_CONFIG), e);
        }
    }

    protected abstract String sshRestartCommand();

    // ---- packages ----

    @Override
    public void installPackage(OperationContext ctx, String packageName)
            throws ConfigurationException, ProvisioningException {
        if (packageName == null || !PACKAGE_NAME.matcher(packageName).matches()) {
            throw new ConfigurationException("invalid package name '" + packageName + "'");
        }
        run(ctx, "install " + packageName, installPackageCommand(ctx, packageName), true);
    }

    /**
     * Builds the command installing one package.
     *
     * @param ctx the cancellation context, for families that inspect the host first
     * @param packageName a validated package name
     * @return the command
     */
    protected abstract String installPackageCommand(OperationContext ctx, String packageName)
        throws ProvisioningException;

    // ---- helpers ----

    /**
     * Runs one step and fails unless it exits zero.
     *
     * @param ctx the cancellation context
     * @param step description of the step, used in errors
     * @param command the command
     * @param escalate whether to request escalation
     * @return the successful result
     * @throws ProvisioningException if the command cannot be run or exits non-zero
     */
    protected CommandResult run(OperationContext ctx, String step, String command, boolean escalate)
            throws ProvisioningException {
        CommandResult result;
        try {
            result = executor.execute(ctx, command, escalate);
        } catch (IOException e) {
            throw new ProvisioningException(hostId(), step, e.getMessage(), e);
        }
        if (!result.isSuccess()) {
            String detail = result.getStderr().trim();
            if (detail.isEmpty()) {
                detail = result.getStdout().trim();
            }
            throw new ProvisioningException(hostId(), step,
                String.format("exit code %d: %s", result.getExitCode(), detail));
        }
        LOG.fine(String.format("[%s] %s: ok", hostId(), step));
        return result;
    }

    /**
     * Runs a step whose failure is logged and otherwise ignored. Cancellation
     * still aborts.
     */
    protected void bestEffort(OperationContext ctx, String step, String command, boolean escalate)
            throws ProvisioningException {
        try {
            run(ctx, step, command, escalate);
        } catch (ProvisioningException e) {
            if (e.isCanceled()) {
                throw e;
            }
            LOG.warning(String.format("[%s] %s failed (ignored): %s", hostId(), step, e.getMessage()));
        }
    }

    /**
     * Runs a read-only check without escalation.
     *
     * @return true if the command exited zero
     * @throws ProvisioningException if the command could not be run
     */
    protected boolean succeeds(OperationContext ctx, String command) throws ProvisioningException {
        try {
            return executor.execute(ctx, command).isSuccess();
        } catch (IOException e) {
            throw new ProvisioningException(hostId(), "check '" + command + "'", e.getMessage(), e);
        }
    }

    protected String hostId() {
        return executor.getIdentifier();
    }
}
