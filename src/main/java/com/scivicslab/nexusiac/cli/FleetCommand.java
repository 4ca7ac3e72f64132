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

package com.scivicslab.nexusiac.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.util.concurrent.Callable;
import java.util.logging.Logger;

import com.scivicslab.nexusiac.NexusException;

import picocli.CommandLine.ParentCommand;

/**
 * Base of the subcommands: sets up logging from the global options and turns
 * exceptions into an error message and exit code 1.
 *
 * @author devteam@scivicslab.com
 */
abstract class FleetCommand implements Callable<Integer> {

    private static final Logger LOG = Logger.getLogger(FleetCommand.class.getName());

    @ParentCommand
    NexusCLI parent;

    PrintStream out = System.out;

    @Override
    public Integer call() {
        try {
            parent.setupLogging();
            return run();
        } catch (NexusException | IOException e) {
            LOG.severe(e.getMessage());
            return 1;
        } finally {
            parent.closeLogging();
        }
    }

    /**
     * Runs the subcommand.
     *
     * @return the process exit code
     */
    protected abstract int run() throws NexusException, IOException;
}
