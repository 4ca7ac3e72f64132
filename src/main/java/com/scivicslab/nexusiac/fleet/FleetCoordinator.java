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

package com.scivicslab.nexusiac.fleet;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

import com.scivicslab.nexusiac.CommandResult;
import com.scivicslab.nexusiac.HostIdentity;
import com.scivicslab.nexusiac.NotFoundException;
import com.scivicslab.nexusiac.OperationContext;
import com.scivicslab.nexusiac.host.HostFactory;
import com.scivicslab.nexusiac.host.RemoteHost;
import com.scivicslab.nexusiac.telemetry.ResourceSnapshot;

/**
 * Dispatches work to every member of a nexus concurrently and merges the
 * per-host outcomes.
 *
 * <p>Each member gets its own task with its own handle: the task creates the
 * handle, connects, does its work and always disconnects. All tasks are started
 * together and the call returns once every one of them has finished, so the
 * result always has exactly one entry per member. A failure on one host is
 * recorded in that host's entry and never stops the others. There are no
 * retries.</p>
 *
 * <p>The {@link OperationContext} passed in reaches every task; canceling it
 * kills the commands in flight and aborts pending connections, while hosts that
 * already finished keep their results.</p>
 *
 * <pre>{@code
 * try (FleetCoordinator coordinator = new FleetCoordinator(config, new FileActiveNexusStore(), new HostFactory())) {
 *     NexusStatus status = coordinator.status(OperationContext.withTimeout(Duration.ofMinutes(1)), "prod");
 * }
 * }</pre>
 *
 * @author devteam@scivicslab.com
 */
public class FleetCoordinator implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(FleetCoordinator.class.getName());

    private final FleetConfiguration configuration;
    private final ActiveNexusStore activeNexusStore;
    private final HostFactory hostFactory;
    private final ExecutorService executor;
    private final boolean ownsExecutor;

    /**
     * Work done on one connected host.
     */
    @FunctionalInterface
    interface HostTask<T> {
        T run(RemoteHost host) throws Exception;
    }

    /**
     * What one host task produced: a value or the exception that stopped it.
     */
    private record Attempt<T>(T value, Exception error) {
        boolean failed() {
            return error != null;
        }
    }

    public FleetCoordinator(FleetConfiguration configuration, ActiveNexusStore activeNexusStore,
                            HostFactory hostFactory) {
        this(configuration, activeNexusStore, hostFactory, Executors.newCachedThreadPool(new FanOutThreadFactory()), true);
    }

    /**
     * Creates a coordinator that runs host tasks on the given executor. The executor
     * must be able to run one task per member at the same time and is not shut down
     * by {@link #close()}.
     */
    public FleetCoordinator(FleetConfiguration configuration, ActiveNexusStore activeNexusStore,
                            HostFactory hostFactory, ExecutorService executor) {
        this(configuration, activeNexusStore, hostFactory, executor, false);
    }

    private FleetCoordinator(FleetConfiguration configuration, ActiveNexusStore activeNexusStore,
                             HostFactory hostFactory, ExecutorService executor, boolean ownsExecutor) {
        this.configuration = configuration;
        this.activeNexusStore = activeNexusStore;
        this.hostFactory = hostFactory;
        this.executor = executor;
        this.ownsExecutor = ownsExecutor;
    }

    // ---- nexus lookup ----

    /**
     * @return every nexus in definition order
     */
    public List<Nexus> listNexuses() {
        List<Nexus> result = new ArrayList<>();
        for (String name : configuration.getNexusNames()) {
            configuration.findNexus(name).ifPresent(result::add);
        }
        return result;
    }

    public Nexus getNexus(String nexusName) throws NotFoundException {
        return configuration.findNexus(nexusName)
            .orElseThrow(() -> new NotFoundException("nexus '" + nexusName + "' not found"));
    }

    /**
     * Resolves the members of a nexus. Duplicate entries are dropped.
     *
     * @param nexusName the nexus
     * @return the member identities in declaration order
     * @throws NotFoundException if the nexus or one of its hosts is not defined
     */
    public List<HostIdentity> listMembers(String nexusName) throws NotFoundException {
        Nexus nexus = getNexus(nexusName);
        List<HostIdentity> members = new ArrayList<>();
        for (String hostName : new LinkedHashSet<>(nexus.getMembers())) {
            HostIdentity identity = configuration.findHost(hostName)
                .orElseThrow(() -> new NotFoundException(
                    String.format("nexus '%s' references undefined host '%s'", nexusName, hostName)));
            members.add(identity);
        }
        return members;
    }

    // ---- active nexus ----

    /**
     * Gets the nexus that commands without an explicit target apply to.
     *
     * @return the active nexus
     * @throws NotFoundException if none is set or the stored one no longer exists
     * @throws IOException if the store cannot be read
     */
    public Nexus currentNexus() throws NotFoundException, IOException {
        Optional<String> name = activeNexusStore.load();
        if (name.isEmpty()) {
            throw new NotFoundException("no active nexus set; use 'switch' to select one");
        }
        return getNexus(name.get());
    }

    /**
     * Makes a nexus the active one. Nothing is written if the nexus does not exist.
     *
     * @param nexusName the nexus
     * @throws NotFoundException if the nexus is not defined
     * @throws IOException if the store cannot be written
     */
    public void switchActive(String nexusName) throws NotFoundException, IOException {
        getNexus(nexusName);
        activeNexusStore.save(nexusName);
        LOG.info(String.format("Active nexus is now '%s'", nexusName));
    }

    // ---- fan-out operations ----

    /**
     * Checks health, and telemetry of healthy hosts, on every member.
     *
     * @param ctx the cancellation context
     * @param nexusName the nexus
     * @return the status, with one entry per member
     * @throws NotFoundException if the nexus or one of its hosts is not defined
     */
    public NexusStatus status(OperationContext ctx, String nexusName) throws NotFoundException {
        List<HostIdentity> members = listMembers(nexusName);
        LOG.info(String.format("Checking status of %d hosts in nexus '%s'", members.size(), nexusName));

        Map<String, Attempt<HostStatus>> attempts = fanOut(ctx, members, host -> probeHost(ctx, host));
        Map<String, HostStatus> statuses = new LinkedHashMap<>();
        attempts.forEach((hostId, attempt) -> statuses.put(hostId,
            attempt.failed() ? HostStatus.offline(hostId, describe(attempt.error())) : attempt.value()));

        NexusStatus status = new NexusStatus(nexusName, Collections.unmodifiableMap(statuses));
        LOG.info(String.format("Nexus '%s': %d/%d online", nexusName, status.getServersOnline(), status.getServersTotal()));
        return status;
    }

    /**
     * Checks health and telemetry of one host.
     *
     * @param ctx the cancellation context
     * @param hostName the host
     * @return the status
     * @throws NotFoundException if the host is not defined
     */
    public HostStatus hostStatus(OperationContext ctx, String hostName) throws NotFoundException {
        HostIdentity identity = configuration.findHost(hostName)
            .orElseThrow(() -> new NotFoundException("host '" + hostName + "' not found"));
        Attempt<HostStatus> attempt = runOnHost(ctx, identity, host -> probeHost(ctx, host));
        return attempt.failed() ? HostStatus.offline(hostName, describe(attempt.error())) : attempt.value();
    }

    private HostStatus probeHost(OperationContext ctx, RemoteHost host) throws IOException {
        host.healthCheck(ctx);
        try {
            ResourceSnapshot resources = host.getResources(ctx);
            return HostStatus.online(host.getId(), resources);
        } catch (IOException e) {
            LOG.warning(String.format("[%s] telemetry failed: %s", host.getId(), e.getMessage()));
            return HostStatus.onlineWithoutTelemetry(host.getId(), describe(e));
        }
    }

    /**
     * Runs a command on every member of a nexus.
     *
     * @param ctx the cancellation context
     * @param nexusName the nexus
     * @param command the shell command line
     * @param escalate whether to request escalation on hosts that allow it
     * @return the outcome, with one entry per member
     * @throws NotFoundException if the nexus or one of its hosts is not defined
     */
    public FleetOutcome executeOnNexus(OperationContext ctx, String nexusName, String command, boolean escalate)
            throws NotFoundException {
        List<HostIdentity> members = listMembers(nexusName);
        LOG.info(String.format("Executing on %d hosts in nexus '%s': %s", members.size(), nexusName, command));

        Map<String, Attempt<CommandResult>> attempts =
            fanOut(ctx, members, host -> host.execute(ctx, command, escalate));

        Map<String, CommandResult> results = new LinkedHashMap<>();
        List<String> failedHosts = new ArrayList<>();
        attempts.forEach((hostId, attempt) -> {
            if (attempt.failed()) {
                failedHosts.add(hostId);
                results.put(hostId, CommandResult.failed(describe(attempt.error())));
            } else {
                results.put(hostId, attempt.value());
            }
        });

        if (!failedHosts.isEmpty()) {
            LOG.warning(String.format("Nexus '%s': command could not be run on %s", nexusName, failedHosts));
        }
        return new FleetOutcome(nexusName, Collections.unmodifiableMap(results), failedHosts);
    }

    /**
     * Runs a command on every member of the active nexus.
     *
     * @see #executeOnNexus(OperationContext, String, String, boolean)
     */
    public FleetOutcome executeOnAll(OperationContext ctx, String command, boolean escalate)
            throws NotFoundException, IOException {
        return executeOnNexus(ctx, currentNexus().getName(), command, escalate);
    }

    private <T> Map<String, Attempt<T>> fanOut(OperationContext ctx, List<HostIdentity> members, HostTask<T> task) {
        Map<String, CompletableFuture<Attempt<T>>> futures = new LinkedHashMap<>();
        for (HostIdentity member : members) {
            futures.put(member.getId(), CompletableFuture.supplyAsync(() -> runOnHost(ctx, member, task), executor));
        }

        CompletableFuture.allOf(futures.values().toArray(new CompletableFuture[0])).join();

        Map<String, Attempt<T>> results = new LinkedHashMap<>();
        futures.forEach((hostId, future) -> results.put(hostId, future.join()));
        return results;
    }

    /*
     * Never throws: every failure ends up in the returned attempt.
     */
    private <T> Attempt<T> runOnHost(OperationContext ctx, HostIdentity identity, HostTask<T> task) {
        RemoteHost host = null;
        try {
            host = hostFactory.createHandle(identity);
            host.connect(ctx);
            return new Attempt<>(task.run(host), null);
        } catch (Exception e) {
            LOG.warning(String.format("[%s] %s", identity.getId(), describe(e)));
            return new Attempt<>(null, e);
        } finally {
            if (host != null) {
                host.disconnect();
            }
        }
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    @Override
    public void close() {
        if (ownsExecutor) {
            executor.shutdownNow();
        }
    }

    private static class FanOutThreadFactory implements ThreadFactory {
        private final AtomicInteger count = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "nexus-iac-host-" + count.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
