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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.scivicslab.nexusiac.CommandResult;
import com.scivicslab.nexusiac.OperationContext;
import com.scivicslab.nexusiac.ProvisioningException;
import com.scivicslab.nexusiac.exec.ScriptedExecutor;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for hardenSSH against a simulated sshd_config.
 *
 * @author devteam@scivicslab.com
 */
@DisplayName("SSH Hardening Tests")
class SshHardeningTest {

    private static final String ORIGINAL =
        "Include /etc/ssh/sshd_config.d/*.conf\n"
        + "#PermitRootLogin prohibit-password\n"
        + "PasswordAuthentication yes\n"
        + "X11Forwarding yes\n"
        + "\n"
        + "Match User backup\n"
        + "    PasswordAuthentication yes\n";

    /** A cloud-init style drop-in that turns password logins back on. */
    private static final String DROP_IN = "PasswordAuthentication yes\n";

    private static final String STAGING_REDIRECT = "' > /etc/ssh/sshd_config.nexus-iac";

    /**
     * Holds sshd_config, one drop-in file and the backup. {@code sshd -T} is
     * answered the way sshd reads the files: Include expanded in place, the first
     * value of a keyword kept, global settings ending at the first Match.
     */
    static class FakeSshd {
        String config = ORIGINAL;
        String backup;
        boolean configValid = true;
        boolean ignoreWrites;
        int restarts;

        CommandResult respond(String command, boolean escalate) {
            if (command.equals("cp -p /etc/ssh/sshd_config /etc/ssh/sshd_config.backup")) {
                backup = config;
            } else if (command.equals("cp -p /etc/ssh/sshd_config.backup /etc/ssh/sshd_config")) {
                config = backup;
            } else if (command.startsWith("sed -i '/^# BEGIN nexus-iac hardening$/")) {
                if (!ignoreWrites) {
                    writeBlock(command);
                }
            } else if (command.equals("sshd -t")) {
                return configValid ? ScriptedExecutor.ok("") : ScriptedExecutor.fail(255, "Bad configuration option");
            } else if (command.equals("sshd -T")) {
                return ScriptedExecutor.ok(effectiveSettings());
            } else if (command.contains("restart")) {
                restarts++;
            }
            return ScriptedExecutor.ok("");
        }

        private void writeBlock(String command) {
            String marker = "printf '%s\\n' '";
            String args = command.substring(command.indexOf(marker) + marker.length(), command.indexOf(STAGING_REDIRECT));

            StringBuilder kept = new StringBuilder();
            boolean inBlock = false;
            for (String line : config.split("\n", -1)) {
                if (line.equals(AbstractDistroCapabilities.HARDENING_BEGIN)) {
                    inBlock = true;
                } else if (line.equals(AbstractDistroCapabilities.HARDENING_END)) {
                    inBlock = false;
                } else if (!inBlock) {
                    kept.append(line).append('\n');
                }
            }
            kept.setLength(kept.length() - 1);
            config = String.join("\n", args.split("' '")) + "\n" + kept;
        }

        private String effectiveSettings() {
            List<String> lines = new ArrayList<>();
            for (String line : config.split("\n")) {
                if (line.startsWith("Include ")) {
                    lines.addAll(List.of(DROP_IN.split("\n")));
                } else {
                    lines.add(line);
                }
            }

            Map<String, String> values = new LinkedHashMap<>();
            for (String line : lines) {
                String trimmed = line.trim();
                if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                    continue;
                }
                String[] parts = trimmed.split("\\s+", 2);
                if (parts[0].equals("Match")) {
                    break;
                }
                values.putIfAbsent(parts[0].toLowerCase(Locale.ROOT), parts[1]);
            }
            values.putIfAbsent("permitrootlogin", "prohibit-password");
            values.putIfAbsent("passwordauthentication", "yes");
            values.putIfAbsent("pubkeyauthentication", "yes");
            values.putIfAbsent("x11forwarding", "no");

            StringBuilder out = new StringBuilder("port 22\n");
            for (Map.Entry<String, String> entry : values.entrySet()) {
                out.append(entry.getKey()).append(' ').append(entry.getValue()).append('\n');
            }
            return out.toString();
        }
    }

    @Test
    @DisplayName("Settings take effect over an Include drop-in and the daemon is restarted")
    void testHardenSsh() throws Exception {
        FakeSshd sshd = new FakeSshd();
        ScriptedExecutor executor = new ScriptedExecutor("web1", sshd::respond);

        new DebianCapabilities(Distribution.UBUNTU, executor).hardenSSH(OperationContext.background());

        Map<String, String> effective = AbstractDistroCapabilities.parseSshdSettings(sshd.effectiveSettings());
        assertEquals("no", effective.get("permitrootlogin"));
        assertEquals("no", effective.get("passwordauthentication"));
        assertEquals("yes", effective.get("pubkeyauthentication"));
        assertEquals("no", effective.get("x11forwarding"));

        assertTrue(sshd.config.startsWith("# BEGIN nexus-iac hardening\nPermitRootLogin no\n"));
        assertTrue(sshd.config.endsWith(ORIGINAL));
        assertEquals(1, sshd.restarts);
        List<String> commands = executor.getCommands();
        assertTrue(commands.indexOf("sshd -t") < commands.indexOf("sshd -T"));
        assertEquals("systemctl restart ssh", commands.get(commands.size() - 1));
        assertTrue(executor.getCalls().stream().allMatch(ScriptedExecutor.Call::escalate));
    }

    @Test
    @DisplayName("Hardening twice leaves a single block")
    void testHardenTwice() throws Exception {
        FakeSshd sshd = new FakeSshd();
        ScriptedExecutor executor = new ScriptedExecutor("web1", sshd::respond);
        DebianCapabilities capabilities = new DebianCapabilities(Distribution.UBUNTU, executor);

        capabilities.hardenSSH(OperationContext.background());
        String once = sshd.config;
        capabilities.hardenSSH(OperationContext.background());

        assertEquals(once, sshd.config);
        assertEquals(2, sshd.restarts);
    }

    @Test
    @DisplayName("Invalid configuration is rolled back and the daemon is not restarted")
    void testRollbackOnValidationFailure() {
        FakeSshd sshd = new FakeSshd();
        sshd.configValid = false;
        ScriptedExecutor executor = new ScriptedExecutor("db1", sshd::respond);

        ProvisioningException e = assertThrows(ProvisioningException.class,
            () -> new RhelCapabilities(Distribution.ROCKY, executor).hardenSSH(OperationContext.background()));

        assertEquals("validate sshd configuration", e.getStep());
        assertEquals(ORIGINAL, sshd.config);
        assertEquals(0, sshd.restarts);
        assertFalse(executor.getCommands().contains("systemctl restart sshd"));
    }

    @Test
    @DisplayName("Settings overridden elsewhere fail the step, roll back and skip the restart")
    void testRollbackWhenSettingsDoNotTakeEffect() {
        FakeSshd sshd = new FakeSshd();
        sshd.ignoreWrites = true;
        ScriptedExecutor executor = new ScriptedExecutor("web1", sshd::respond);

        ProvisioningException e = assertThrows(ProvisioningException.class,
            () -> new DebianCapabilities(Distribution.DEBIAN, executor).hardenSSH(OperationContext.background()));

        assertEquals("verify sshd settings", e.getStep());
        assertTrue(e.getMessage().contains("PasswordAuthentication is yes, expected no"));
        assertTrue(e.getMessage().contains("PermitRootLogin is prohibit-password, expected no"));
        assertTrue(executor.getCommands().contains("cp -p /etc/ssh/sshd_config.backup /etc/ssh/sshd_config"));
        assertEquals(ORIGINAL, sshd.config);
        assertEquals(0, sshd.restarts);
    }

    @Test
    @DisplayName("Hardening command replaces the block at the top of the file")
    void testHardeningCommand() {
        String command = AbstractDistroCapabilities.sshdHardeningCommand();

        assertEquals("sed -i '/^# BEGIN nexus-iac hardening$/,/^# END nexus-iac hardening$/d' /etc/ssh/sshd_config"
            + " && printf '%s\\n' '# BEGIN nexus-iac hardening' 'PermitRootLogin no' 'PasswordAuthentication no'"
            + " 'PubkeyAuthentication yes' 'X11Forwarding no' '# END nexus-iac hardening' > /etc/ssh/sshd_config.nexus-iac"
            + " && cat /etc/ssh/sshd_config >> /etc/ssh/sshd_config.nexus-iac"
            + " && cat /etc/ssh/sshd_config.nexus-iac > /etc/ssh/sshd_config"
            + " && rm -f /etc/ssh/sshd_config.nexus-iac", command);
    }

    @Test
    @DisplayName("sshd -T output is read by lowercase keyword")
    void testParseSshdSettings() {
        Map<String, String> settings = AbstractDistroCapabilities.parseSshdSettings(
            "port 22\nPermitRootLogin no\nsubsystem sftp /usr/lib/openssh/sftp-server\n\n");

        assertEquals("22", settings.get("port"));
        assertEquals("no", settings.get("permitrootlogin"));
        assertEquals("sftp /usr/lib/openssh/sftp-server", settings.get("subsystem"));
    }
}
