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

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.logging.FileHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

import com.scivicslab.nexusiac.ConfigurationException;
import com.scivicslab.nexusiac.OperationContext;
import com.scivicslab.nexusiac.fleet.ActiveNexusStore;
import com.scivicslab.nexusiac.fleet.FileActiveNexusStore;
import com.scivicslab.nexusiac.fleet.FleetConfiguration;
import com.scivicslab.nexusiac.fleet.FleetCoordinator;
import com.scivicslab.nexusiac.fleet.YamlFleetConfiguration;
import com.scivicslab.nexusiac.host.HostFactory;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Command-line entry point of nexus-IaC.
 *
 * <h2>Usage</h2>
 * <pre>
 * nexus-iac list
 * nexus-iac switch prod
 * nexus-iac status
 * nexus-iac exec --sudo -- apt-get update
 * nexus-iac -c staging.yaml --json status staging
 * nexus-iac init web1
 * </pre>
 *
 * <p>Global options go before the subcommand.</p>
 *
 * @author devteam@scivicslab.com
 */
@Command(
    name = "nexus-iac",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    description = "Coordinate command execution and provisioning across nexuses of Linux hosts.",
    subcommands = {
        ListCLI.class,
        CurrentCLI.class,
        SwitchCLI.class,
        StatusCLI.class,
        ExecCLI.class,
        InitCLI.class,
        DetectCLI.class
    }
)
public class NexusCLI implements Callable<Integer> {

    private static final Logger LOG = Logger.getLogger(NexusCLI.class.getName());

    @Option(
        names = {"-c", "--config"},
        description = "Fleet definition file (default: ${DEFAULT-VALUE})",
        defaultValue = "nexus.yaml"
    )
    Path configFile;

    @Option(
        names = {"--state-dir"},
        description = "Directory holding the active nexus (default: ~/.nexus-iac)"
    )
    Path stateDir;

    @Option(
        names = {"-t", "--timeout"},
        description = "Overall time limit in seconds (default: ${DEFAULT-VALUE})",
        defaultValue = "600"
    )
    long timeoutSeconds;

    @Option(
        names = {"--json"},
        description = "Print results as JSON"
    )
    boolean json;

    @Option(
        names = {"-v", "--verbose"},
        description = "Enable verbose output"
    )
    boolean verbose;

    @Option(
        names = {"-l", "--log"},
        description = "Also write the log to this file"
    )
    File logFile;

    private FileHandler fileHandler;

    /**
     * Main entry point.
     *
     * @param args command line arguments
     */
    public static void main(String[] args) {
        loadLoggingDefaults();
        int exitCode = new CommandLine(new NexusCLI()).execute(args);
        System.exit(exitCode);
    }

    private static void loadLoggingDefaults() {
        try (InputStream is = NexusCLI.class.getResourceAsStream("/logging.properties")) {
            if (is != null) {
                LogManager.getLogManager().readConfiguration(is);
            }
        } catch (IOException e) {
            System.err.println("Could not load logging.properties: " + e.getMessage());
        }
    }

    @Override
    public Integer call() {
        CommandLine.usage(this, System.err);
        return 2;
    }

    /**
     * Applies the verbose and log file options.
     *
     * @throws IOException if the log file cannot be opened
     */
    void setupLogging() throws IOException {
        Level targetLevel = verbose ? Level.FINE : Level.INFO;
        Logger rootLogger = Logger.getLogger("");
        rootLogger.setLevel(targetLevel);
        for (Handler handler : rootLogger.getHandlers()) {
            handler.setLevel(targetLevel);
        }

        if (logFile != null) {
            fileHandler = new FileHandler(logFile.getAbsolutePath(), true);
            fileHandler.setFormatter(new SimpleFormatter());
            fileHandler.setLevel(targetLevel);
            rootLogger.addHandler(fileHandler);
        }
        if (verbose) {
            LOG.fine("Verbose mode enabled - log level set to FINE");
        }
    }

    void closeLogging() {
        if (fileHandler != null) {
            Logger.getLogger("").removeHandler(fileHandler);
            fileHandler.close();
            fileHandler = null;
        }
    }

    FleetConfiguration loadConfiguration() throws ConfigurationException {
        return YamlFleetConfiguration.load(configFile);
    }

    ActiveNexusStore activeNexusStore() {
        return stateDir != null ? new FileActiveNexusStore(stateDir) : new FileActiveNexusStore();
    }

    FleetCoordinator createCoordinator(FleetConfiguration configuration) {
        return new FleetCoordinator(configuration, activeNexusStore(), new HostFactory());
    }

    OperationContext createContext() {
        return OperationContext.withTimeout(Duration.ofSeconds(timeoutSeconds));
    }

    boolean isJson() {
        return json;
    }
}
