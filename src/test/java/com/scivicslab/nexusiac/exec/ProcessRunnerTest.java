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

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import com.scivicslab.nexusiac.CommandCanceledException;
import com.scivicslab.nexusiac.CommandResult;
import com.scivicslab.nexusiac.OperationContext;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ProcessRunner against local processes.
 *
 * @author devteam@scivicslab.com
 */
@DisplayName("ProcessRunner Tests")
@EnabledOnOs({OS.LINUX, OS.MAC})
class ProcessRunnerTest {

    private final ProcessRunner runner = new ProcessRunner();

    private static List<String> sh(String script) {
        return List.of("sh", "-c", script);
    }

    @Test
    @DisplayName("Should capture stdout, stderr and exit code separately")
    void testCaptureOutput() throws Exception {
        CommandResult result = runner.run(OperationContext.background(), "local",
            sh("echo out; echo err >&2; exit 3"));

        assertEquals(3, result.getExitCode());
        assertEquals("out\n", result.getStdout());
        assertEquals("err\n", result.getStderr());
        assertTrue(result.getDurationMillis() >= 0);
    }

    @Test
    @DisplayName("Should feed a file to stdin")
    void testStdinSource(@TempDir Path dir) throws Exception {
        Path input = dir.resolve("input.txt");
        Files.writeString(input, "line1\nline2\n", StandardCharsets.UTF_8);

        CommandResult result = runner.run(OperationContext.background(), "local", sh("wc -l"), input);

        assertTrue(result.isSuccess());
        assertEquals("2", result.getStdout().trim());
    }

    @Test
    @DisplayName("Should kill the process when the deadline passes")
    void testDeadlineKillsProcess() {
        OperationContext ctx = OperationContext.withTimeout(Duration.ofMillis(300));
        long start = System.nanoTime();

        assertThrows(CommandCanceledException.class, () -> runner.run(ctx, "local", sh("sleep 30")));
        assertTrue(Duration.ofNanos(System.nanoTime() - start).toSeconds() < 10);
    }

    @Test
    @DisplayName("Held stdin reaches end of input only after the process exits")
    void testRunHoldingStdin(@TempDir Path dir) throws Exception {
        Path marker = dir.resolve("eof");
        String script = "exec 3<&0; { cat <&3 >/dev/null; touch '" + marker + "'; } >/dev/null 2>&1 &"
            + " sleep 1; test -e '" + marker + "' && echo early; exit 0";

        CommandResult held = runner.runHoldingStdin(OperationContext.background(), "local", sh(script));
        assertEquals("", held.getStdout());
        long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
        while (!Files.exists(marker) && System.nanoTime() < deadline) {
            Thread.sleep(50);
        }
        assertTrue(Files.exists(marker));

        Files.delete(marker);
        CommandResult closed = runner.run(OperationContext.background(), "local", sh(script));
        assertEquals("early\n", closed.getStdout());
    }

    @Test
    @DisplayName("Held stdin is closed when the deadline kills the process")
    void testRunHoldingStdinDeadline() {
        OperationContext ctx = OperationContext.withTimeout(Duration.ofMillis(300));

        assertThrows(CommandCanceledException.class,
            () -> runner.runHoldingStdin(ctx, "local", sh("cat >/dev/null")));
    }

    @Test
    @DisplayName("Should not start a process under a canceled context")
    void testAlreadyCanceled(@TempDir Path dir) {
        OperationContext ctx = OperationContext.background();
        ctx.cancel();
        Path marker = dir.resolve("marker");

        assertThrows(CommandCanceledException.class,
            () -> runner.run(ctx, "local", sh("touch '" + marker + "'")));
        assertFalse(Files.exists(marker));
    }

    @Test
    @DisplayName("Detached run should report stderr from the log file")
    void testRunDetached(@TempDir Path dir) throws Exception {
        CommandResult result = runner.runDetached(OperationContext.background(), "local",
            sh("echo ignored; echo 'Permission denied (publickey)' >&2; exit 255"), dir.resolve("err.log"));

        assertEquals(255, result.getExitCode());
        assertEquals("", result.getStdout());
        assertTrue(result.getStderr().contains("Permission denied"));
    }

    @Test
    @DisplayName("Quoting should survive a round trip through the shell")
    void testShellQuote() throws Exception {
        String tricky = "it's a \"test\" $HOME `id`";
        CommandResult result = runner.run(OperationContext.background(), "local",
            sh("printf %s " + ShellQuote.quote(tricky)));

        assertEquals(tricky, result.getStdout());
    }
}
