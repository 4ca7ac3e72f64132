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

package com.scivicslab.nexusiac;

/**
 * Result of one command execution on a host.
 *
 * <p>A non-zero exit code is a valid result, not an error. Failures to run the
 * command at all are reported as exceptions by the executor; the fleet
 * coordinator turns those into a synthetic result via {@link #failed(String)}.</p>
 *
 * @author devteam@scivicslab.com
 */
public class CommandResult {

    /** Exit code recorded for hosts on which the command could not be run. */
    public static final int EXIT_CODE_NOT_EXECUTED = -1;

    private final int exitCode;
    private final String stdout;
    private final String stderr;
    private final long durationMillis;

    public CommandResult(int exitCode, String stdout, String stderr, long durationMillis) {
        this.exitCode = exitCode;
        this.stdout = stdout == null ? "" : stdout;
        this.stderr = stderr == null ? "" : stderr;
        this.durationMillis = durationMillis;
    }

    /**
     * Creates the placeholder result for a host on which the command never ran.
     *
     * @param error the error text, stored as stderr
     * @return a result with exit code {@value #EXIT_CODE_NOT_EXECUTED}
     */
    public static CommandResult failed(String error) {
        return new CommandResult(EXIT_CODE_NOT_EXECUTED, "", error, 0);
    }

    public int getExitCode() {
        return exitCode;
    }

    public String getStdout() {
        return stdout;
    }

    public String getStderr() {
        return stderr;
    }

    public long getDurationMillis() {
        return durationMillis;
    }

    public boolean isSuccess() {
        return exitCode == 0;
    }

    @Override
    public String toString() {
        return String.format("CommandResult{exitCode=%d, stdout='%s', stderr='%s', durationMillis=%d}",
            exitCode, stdout.trim(), stderr.trim(), durationMillis);
    }
}
