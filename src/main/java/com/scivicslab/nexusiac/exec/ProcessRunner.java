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

package com.scivicslab.nexusiac.exec;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.scivicslab.nexusiac.CommandCanceledException;
import com.scivicslab.nexusiac.CommandResult;
import com.scivicslab.nexusiac.OperationContext;

/**
 * Runs one local process under an {@link OperationContext}.
 *
 * <p>Stdout and stderr are drained on their own threads so neither pipe can fill up
 * and block the child. While waiting for the process, the context is polled; when it
 * is canceled or its deadline passes, the process and its descendants are killed and
 * {@link CommandCanceledException} is thrown. A partially collected output is never
 * returned.</p>
 *
 * @author devteam@scivicslab.com
 */
public class ProcessRunner {

    private static final Logger LOG = Logger.getLogger(ProcessRunner.class.getName());

    private static final long POLL_INTERVAL_MILLIS = 50;
    private static final long DRAIN_TIMEOUT_MILLIS = 5000;
    private static final long KILL_GRACE_MILLIS = 2000;

    /**
     * Runs a process with an empty stdin and captures its output.
     *
     * @param ctx the cancellation context
     * @param hostId the host the process works on, used in error messages
     * @param command the program and its arguments
     * @return the result
     * @throws CommandCanceledException if the context was canceled before the process exited
     * @throws IOException if the process could not be started
     */
    public CommandResult run(OperationContext ctx, String hostId, List<String> command) throws IOException {
        return run(ctx, hostId, command, null);
    }

    /**
     * Runs a process, feeding a file to its stdin, and captures its output.
     *
     * @param ctx the cancellation context
     * @param hostId the host the process works on, used in error messages
     * @param command the program and its arguments
     * @param stdinSource file to redirect to stdin, or null for an empty stdin
     * @return the result
     * @throws CommandCanceledException if the context was canceled before the process exited
     * @throws IOException if the process could not be started
     */
    public CommandResult run(OperationContext ctx, String hostId, List<String> command, Path stdinSource)
            throws IOException {
        return capture(ctx, hostId, command, stdinSource, false);
    }

    /**
     * Runs a process whose stdin stays open, without data, until the process exits,
     * and captures its output.
     *
     * <p>The pipe closes when the process exits, is killed, or this JVM goes away,
     * so the other end can treat end of input as the signal that nobody waits for
     * it anymore.</p>
     *
     * @param ctx the cancellation context
     * @param hostId the host the process works on, used in error messages
     * @param command the program and its arguments
     * @return the result
     * @throws CommandCanceledException if the context was canceled before the process exited
     * @throws IOException if the process could not be started
     */
    public CommandResult runHoldingStdin(OperationContext ctx, String hostId, List<String> command)
            throws IOException {
        return capture(ctx, hostId, command, null, true);
    }

    private CommandResult capture(OperationContext ctx, String hostId, List<String> command,
                                  Path stdinSource, boolean holdStdin) throws IOException {
        ctx.throwIfCancelled(hostId);

        ProcessBuilder pb = new ProcessBuilder(command);
        if (stdinSource != null) {
            pb.redirectInput(stdinSource.toFile());
        }

        long start = System.nanoTime();
        Process process = pb.start();
        if (stdinSource == null && !holdStdin) {
            process.getOutputStream().close();
        }

        StreamCollector stdout = new StreamCollector(process.getInputStream());
        StreamCollector stderr = new StreamCollector(process.getErrorStream());
        Thread stdoutThread = startDrain(stdout, hostId, "stdout");
        Thread stderrThread = startDrain(stderr, hostId, "stderr");

        int exitCode;
        try {
            exitCode = awaitExit(ctx, hostId, process);
        } finally {
            if (holdStdin) {
                closeStdin(process, hostId);
            }
        }

        try {
            stdoutThread.join(DRAIN_TIMEOUT_MILLIS);
            stderrThread.join(DRAIN_TIMEOUT_MILLIS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CommandCanceledException(hostId, "interrupted while collecting output", e);
        }

        long durationMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        return new CommandResult(exitCode, stdout.text(), stderr.text(), durationMillis);
    }

    private void closeStdin(Process process, String hostId) {
        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            LOG.log(Level.FINE, String.format("[%s] stdin of process %d already closed", hostId, process.pid()), e);
        }
    }

    /**
     * Runs a process whose children may outlive it, such as an SSH master that
     * forks into the background.
     *
     * <p>Stdout is discarded and stderr goes to {@code errorLog}, so no pipe is held
     * open by a surviving child.</p>
     *
     * @param ctx the cancellation context
     * @param hostId the host the process works on
     * @param command the program and its arguments
     * @param errorLog file receiving stderr
     * @return the result with the content of {@code errorLog} as stderr
     * @throws CommandCanceledException if the context was canceled before the process exited
     * @throws IOException if the process could not be started
     */
    public CommandResult runDetached(OperationContext ctx, String hostId, List<String> command, Path errorLog)
            throws IOException {
        ctx.throwIfCancelled(hostId);

        ProcessBuilder pb = new ProcessBuilder(command);
        pb.redirectOutput(ProcessBuilder.Redirect.DISCARD);
        pb.redirectError(errorLog.toFile());

        long start = System.nanoTime();
        Process process = pb.start();
        process.getOutputStream().close();

        int exitCode = awaitExit(ctx, hostId, process);
        long durationMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        String stderr = Files.exists(errorLog) ? Files.readString(errorLog, StandardCharsets.UTF_8) : "";
        return new CommandResult(exitCode, "", stderr, durationMillis);
    }

    private int awaitExit(OperationContext ctx, String hostId, Process process) throws CommandCanceledException {
        try {
            while (!process.waitFor(POLL_INTERVAL_MILLIS, TimeUnit.MILLISECONDS)) {
                if (ctx.isCancelled()) {
                    terminate(process);
                    throw new CommandCanceledException(hostId, ctx.cancellationReason());
                }
            }
            return process.exitValue();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            terminate(process);
            throw new CommandCanceledException(hostId, "interrupted", e);
        }
    }

    private void terminate(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        try {
            if (!process.waitFor(KILL_GRACE_MILLIS, TimeUnit.MILLISECONDS)) {
                LOG.warning(String.format("Process %d did not exit within %d ms after kill",
                    process.pid(), KILL_GRACE_MILLIS));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private Thread startDrain(StreamCollector collector, String hostId, String streamName) {
        Thread thread = new Thread(collector, "nexus-iac-" + hostId + "-" + streamName);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    /**
     * Reads a stream to the end into memory.
     */
    private static class StreamCollector implements Runnable {
        private final InputStream input;
        private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

        StreamCollector(InputStream input) {
            this.input = input;
        }

        @Override
        public void run() {
            byte[] chunk = new byte[8192];
            try (InputStream in = input) {
                int n;
                while ((n = in.read(chunk)) != -1) {
                    synchronized (buffer) {
                        buffer.write(chunk, 0, n);
                    }
                }
            } catch (IOException e) {
                // the stream closes under us when the process is killed
                LOG.log(Level.FINE, "Output stream closed early", e);
            }
        }

        String text() {
            synchronized (buffer) {
                return buffer.toString(StandardCharsets.UTF_8);
            }
        }
    }
}
