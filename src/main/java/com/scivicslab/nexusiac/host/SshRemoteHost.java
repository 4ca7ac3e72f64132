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

package com.scivicslab.nexusiac.host;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;

import com.scivicslab.nexusiac.AuthenticationException;
import com.scivicslab.nexusiac.CommandCanceledException;
import com.scivicslab.nexusiac.CommandResult;
import com.scivicslab.nexusiac.HostIdentity;
import com.scivicslab.nexusiac.NetworkException;
import com.scivicslab.nexusiac.NotConnectedException;
import com.scivicslab.nexusiac.OperationContext;
import com.scivicslab.nexusiac.TransferException;
import com.scivicslab.nexusiac.exec.ProcessRunner;
import com.scivicslab.nexusiac.exec.ShellQuote;

/**
 * {@link RemoteHost} reached through the system OpenSSH client.
 *
 * <p>{@link #connect} starts a multiplexing master process that holds the one
 * physical connection of this handle. Every {@link #execute} then opens a new
 * session over the master's control socket, so commands do not pay the
 * handshake again. The socket lives in a private temporary directory that
 * {@link #disconnect} removes. A master left behind by a process that never
 * called {@link #disconnect} exits on its own after {@link #MASTER_IDLE_TIMEOUT}
 * without sessions; the same happens to a handle left idle that long, whose
 * next command then fails with a {@link NetworkException}.</p>
 *
 * <p>Each command runs on the remote side under a small shell watchdog in its
 * own process group. The local client keeps the session's stdin open while it
 * waits; when the client is killed on cancellation, or this JVM exits, the
 * remote end of stdin closes and the watchdog sends SIGTERM to the group. The
 * command itself reads from {@code /dev/null}.</p>
 *
 * <p>Escalated commands are run as {@code sudo -n sh -c '<command>'}. Sudo must
 * be configured without a password for the SSH user; {@code -n} makes it fail
 * instead of prompting. When the identity does not allow escalation, the
 * command runs unprivileged.</p>
 *
 * @author devteam@scivicslab.com
 */
public class SshRemoteHost extends AbstractRemoteHost {

    private static final Logger LOG = Logger.getLogger(SshRemoteHost.class.getName());

    static final int CONNECT_TIMEOUT_SECONDS = 30;
    static final String ESCALATION_PREFIX = "sudo -n sh -c ";
    static final Duration MASTER_IDLE_TIMEOUT = Duration.ofMinutes(5);

    /*
     * $1 is the command. fd 3 keeps the session's stdin for the watcher, since
     * background jobs of a non-interactive shell get /dev/null as stdin.
     */
    private static final String WATCHDOG = String.join("\n",
        "exec 3<&0",
        "if command -v setsid >/dev/null 2>&1; then setsid sh -c \"$1\" </dev/null 3<&- &"
            + " else sh -c \"$1\" </dev/null 3<&- & fi",
        "p=$!",
        "{ cat <&3 >/dev/null; kill -TERM -$p 2>/dev/null || kill -TERM $p 2>/dev/null; } >/dev/null 2>&1 &",
        "w=$!",
        "exec 3<&-",
        "wait $p",
        "s=$?",
        "kill $w 2>/dev/null",
        "exit $s");

    /** Exit code of the ssh client itself when the connection fails. */
    private static final int SSH_CONNECTION_ERROR = 255;

    private static final Duration CONTROL_TIMEOUT = Duration.ofSeconds(10);
    private static final String DEFAULT_FILE_MODE = "644";

    private final ProcessRunner runner;

    private volatile ConnectionState state = ConnectionState.DISCONNECTED;
    private Path controlDir;
    private Path controlPath;

    public SshRemoteHost(HostIdentity identity) {
        this(identity, new ProcessRunner());
    }

    public SshRemoteHost(HostIdentity identity, ProcessRunner runner) {
        super(identity);
        this.runner = runner;
    }

    @Override
    public ConnectionState getState() {
        return state;
    }

    @Override
    public synchronized void connect(OperationContext ctx) throws IOException {
        if (state == ConnectionState.CONNECTED) {
            return;
        }
        ctx.throwIfCancelled(getId());
        state = ConnectionState.CONNECTING;

        try {
            Path keyFile = PrivateKeyInspector.resolve(identity.getKeyPath());
            PrivateKeyInspector.check(getId(), keyFile);

            controlDir = Files.createTempDirectory("nexus-iac-");
            controlPath = controlDir.resolve("cm");
            Path errorLog = controlDir.resolve("master.log");

            LOG.info(String.format("[%s] connecting to %s@%s:%d",
                getId(), identity.getUser(), identity.getAddress(), identity.getEffectivePort()));
            CommandResult result = runner.runDetached(ctx, getId(), buildMasterCommand(keyFile), errorLog);
            if (!result.isSuccess()) {
                throw classifyMasterFailure(result);
            }
        } catch (IOException e) {
            cleanupControlDir();
            state = ConnectionState.DISCONNECTED;
            throw e;
        }

        state = ConnectionState.CONNECTED;
        LOG.info(String.format("[%s] connected", getId()));
    }

    private IOException classifyMasterFailure(CommandResult result) {
        String stderr = result.getStderr().trim();
        if (stderr.contains("Permission denied")
                || stderr.contains("Host key verification failed")
                || stderr.contains("no mutual signature")) {
            return new AuthenticationException(getId(), "authentication failed: " + stderr);
        }
        return new NetworkException(getId(),
            String.format("ssh exited with %d: %s", result.getExitCode(), stderr));
    }

    @Override
    public CommandResult execute(OperationContext ctx, String command, boolean escalate) throws IOException {
        requireConnected();
        String effective = effectiveCommand(command, escalate);
        LOG.fine(String.format("[%s] $ %s", getId(), effective));

        CommandResult result = runner.runHoldingStdin(ctx, getId(), buildExecCommand(supervise(effective)));
        if (result.getExitCode() == SSH_CONNECTION_ERROR && !isMasterAlive(ctx)) {
            throw new NetworkException(getId(), "connection lost: " + result.getStderr().trim());
        }
        LOG.fine(String.format("[%s] exit %d in %d ms", getId(), result.getExitCode(), result.getDurationMillis()));
        return result;
    }

    /**
     * Applies the escalation policy of this host to a command.
     *
     * @param command the command line
     * @param escalate whether escalation was requested
     * @return the command to send
     */
    String effectiveCommand(String command, boolean escalate) {
        if (!escalate) {
            return command;
        }
        if (!identity.isEscalationAllowed()) {
            LOG.fine(String.format("[%s] escalation not allowed, running unprivileged", getId()));
            return command;
        }
        return ESCALATION_PREFIX + ShellQuote.quote(command);
    }

    /**
     * Wraps a command in the remote watchdog. The exit status is the command's;
     * a command stopped by the watchdog exits with 143.
     *
     * @param command the command line
     * @return a command line for the remote login shell
     */
    static String supervise(String command) {
        return "sh -c " + ShellQuote.quote(WATCHDOG) + " nexus-iac " + ShellQuote.quote(command);
    }

    private boolean isMasterAlive(OperationContext ctx) throws CommandCanceledException {
        try {
            return runner.run(ctx, getId(), buildControlCommand("check")).isSuccess();
        } catch (CommandCanceledException e) {
            throw e;
        } catch (IOException e) {
            LOG.log(Level.FINE, String.format("[%s] control check failed", getId()), e);
            return false;
        }
    }

    @Override
    public void transferFile(OperationContext ctx, Path localPath, String remotePath) throws IOException {
        requireConnected();
        if (!Files.isRegularFile(localPath)) {
            throw new TransferException(getId(), "local file not found: " + localPath);
        }

        if (remotePath.startsWith("~") && !remotePath.startsWith("~/")) {
            throw new TransferException(getId(), "only ~/ is expanded in remote paths: " + remotePath);
        }

        String mode = fileMode(localPath);
        String quotedRemote = remoteShellPath(remotePath);
        StringBuilder script = new StringBuilder();
        int slash = remotePath.lastIndexOf('/');
        if (slash > 0) {
            script.append("mkdir -p ").append(remoteShellPath(remotePath.substring(0, slash))).append(" && ");
        }
        script.append("cat > ").append(quotedRemote)
              .append(" && chmod ").append(mode).append(' ').append(quotedRemote);

        LOG.fine(String.format("[%s] transfer %s -> %s (mode %s)", getId(), localPath, remotePath, mode));
        CommandResult result;
        try {
            result = runner.run(ctx, getId(), buildExecCommand(script.toString()), localPath);
        } catch (CommandCanceledException e) {
            throw e;
        } catch (IOException e) {
            throw new TransferException(getId(), "transfer to " + remotePath + " failed", e);
        }
        if (!result.isSuccess()) {
            throw new TransferException(getId(),
                String.format("transfer to %s failed with exit %d: %s",
                    remotePath, result.getExitCode(), result.getStderr().trim()));
        }
    }

    /**
     * Quotes a remote path for the shell, leaving a leading {@code ~/} to be
     * expanded to the SSH user's home directory.
     *
     * @param path the remote path
     * @return the path as a shell word
     */
    static String remoteShellPath(String path) {
        if (path.equals("~")) {
            return "\"$HOME\"";
        }
        if (path.startsWith("~/")) {
            return "\"$HOME\"/" + ShellQuote.quote(path.substring(2));
        }
        return ShellQuote.quote(path);
    }

    /**
     * Gets the POSIX permission bits of a file as an octal string.
     *
     * @param file the file
     * @return e.g. "755", or "644" on file systems without POSIX attributes
     */
    static String fileMode(Path file) {
        Set<PosixFilePermission> permissions;
        try {
            permissions = Files.getPosixFilePermissions(file);
        } catch (UnsupportedOperationException | IOException e) {
            return DEFAULT_FILE_MODE;
        }
        int bits = 0;
        for (PosixFilePermission permission : permissions) {
            // enum order is OWNER_READ .. OTHERS_EXECUTE, most significant first
            bits |= 1 << (8 - permission.ordinal());
        }
        return Integer.toOctalString(bits);
    }

    @Override
    public synchronized void disconnect() {
        if (controlPath != null) {
            try {
                runner.run(OperationContext.withTimeout(CONTROL_TIMEOUT), getId(), buildControlCommand("exit"));
            } catch (IOException e) {
                LOG.log(Level.FINE, String.format("[%s] failed to stop ssh master", getId()), e);
            }
            cleanupControlDir();
            LOG.info(String.format("[%s] disconnected", getId()));
        }
        state = ConnectionState.DISCONNECTED;
    }

    private void cleanupControlDir() {
        if (controlDir != null) {
            try (Stream<Path> paths = Files.walk(controlDir)) {
                paths.sorted(Comparator.reverseOrder()).forEach(path -> {
                    try {
                        Files.deleteIfExists(path);
                    } catch (IOException e) {
                        LOG.log(Level.FINE, "Could not delete " + path, e);
                    }
                });
            } catch (IOException e) {
                LOG.log(Level.FINE, "Could not clean up " + controlDir, e);
            }
        }
        controlDir = null;
        controlPath = null;
    }

    private void requireConnected() throws NotConnectedException {
        if (state != ConnectionState.CONNECTED) {
            throw new NotConnectedException(getId(), "host is " + state.name().toLowerCase());
        }
    }

    private String destination() {
        return identity.getUser() + "@" + identity.getAddress();
    }

    private List<String> commonOptions() {
        List<String> cmd = new ArrayList<>();
        cmd.add("-o");
        cmd.add("BatchMode=yes");
        cmd.add("-o");
        cmd.add("LogLevel=ERROR");
        cmd.add("-o");
        cmd.add("StrictHostKeyChecking=no");
        cmd.add("-o");
        cmd.add("UserKnownHostsFile=/dev/null");
        cmd.add("-p");
        cmd.add(String.valueOf(identity.getEffectivePort()));
        return cmd;
    }

    List<String> buildMasterCommand(Path keyFile) {
        List<String> cmd = new ArrayList<>();
        cmd.add("ssh");
        cmd.add("-M");
        cmd.add("-N");
        cmd.add("-f");
        cmd.add("-S");
        cmd.add(controlPath.toString());
        cmd.add("-o");
        cmd.add("ControlPersist=" + MASTER_IDLE_TIMEOUT.getSeconds() + "s");
        cmd.add("-o");
        cmd.add("ConnectTimeout=" + CONNECT_TIMEOUT_SECONDS);
        cmd.add("-o");
        cmd.add("ServerAliveInterval=15");
        cmd.add("-o");
        cmd.add("IdentitiesOnly=yes");
        cmd.add("-i");
        cmd.add(keyFile.toString());
        cmd.addAll(commonOptions());
        cmd.add("--");
        cmd.add(destination());
        return cmd;
    }

    List<String> buildExecCommand(String remoteCommand) {
        List<String> cmd = new ArrayList<>();
        cmd.add("ssh");
        cmd.add("-S");
        cmd.add(controlPath.toString());
        cmd.add("-o");
        cmd.add("ControlMaster=no");
        cmd.addAll(commonOptions());
        cmd.add("--");
        cmd.add(destination());
        cmd.add(remoteCommand);
        return cmd;
    }

    List<String> buildControlCommand(String operation) {
        List<String> cmd = new ArrayList<>();
        cmd.add("ssh");
        cmd.add("-S");
        cmd.add(controlPath.toString());
        cmd.add("-O");
        cmd.add(operation);
        cmd.addAll(commonOptions());
        cmd.add("--");
        cmd.add(destination());
        return cmd;
    }
}
