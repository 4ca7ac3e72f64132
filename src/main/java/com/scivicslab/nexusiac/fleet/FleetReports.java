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

import java.util.List;
import java.util.Map;

import org.json.JSONArray;
import org.json.JSONObject;

import com.scivicslab.nexusiac.CommandResult;
import com.scivicslab.nexusiac.telemetry.ResourceSnapshot;

/**
 * JSON renderings of coordinator results for machine consumers.
 *
 * @author devteam@scivicslab.com
 */
public final class FleetReports {

    private FleetReports() {
    }

    public static JSONArray nexuses(List<Nexus> nexuses, String activeNexus) {
        JSONArray array = new JSONArray();
        for (Nexus nexus : nexuses) {
            JSONObject json = nexus(nexus);
            json.put("active", nexus.getName().equals(activeNexus));
            array.put(json);
        }
        return array;
    }

    public static JSONObject nexus(Nexus nexus) {
        JSONObject json = new JSONObject();
        json.put("name", nexus.getName());
        json.put("description", nexus.getDescription());
        json.put("environment", nexus.getEnvironment());
        json.put("servers", new JSONArray(nexus.getMembers()));
        return json;
    }

    public static JSONObject outcome(FleetOutcome outcome) {
        JSONObject results = new JSONObject();
        for (Map.Entry<String, CommandResult> entry : outcome.getResults().entrySet()) {
            results.put(entry.getKey(), commandResult(entry.getValue()));
        }
        JSONObject json = new JSONObject();
        json.put("nexus", outcome.getNexusName());
        json.put("success", outcome.isSuccess());
        json.put("failed_hosts", new JSONArray(outcome.getFailedHosts()));
        json.put("results", results);
        return json;
    }

    public static JSONObject commandResult(CommandResult result) {
        JSONObject json = new JSONObject();
        json.put("exit_code", result.getExitCode());
        json.put("stdout", result.getStdout());
        json.put("stderr", result.getStderr());
        json.put("duration_ms", result.getDurationMillis());
        return json;
    }

    public static JSONObject status(NexusStatus status) {
        JSONObject hosts = new JSONObject();
        for (Map.Entry<String, HostStatus> entry : status.getHostStatuses().entrySet()) {
            hosts.put(entry.getKey(), hostStatus(entry.getValue()));
        }
        JSONObject json = new JSONObject();
        json.put("nexus", status.getNexusName());
        json.put("healthy", status.isHealthy());
        json.put("servers_online", status.getServersOnline());
        json.put("servers_total", status.getServersTotal());
        json.put("server_statuses", hosts);
        return json;
    }

    public static JSONObject hostStatus(HostStatus status) {
        JSONObject json = new JSONObject();
        json.put("online", status.isOnline());
        if (status.getResources() != null) {
            json.put("resources", resources(status.getResources()));
        }
        if (!status.getError().isEmpty()) {
            json.put("error", status.getError());
        }
        if (!status.getTelemetryError().isEmpty()) {
            json.put("telemetry_error", status.getTelemetryError());
        }
        return json;
    }

    public static JSONObject resources(ResourceSnapshot snapshot) {
        JSONObject cpu = new JSONObject();
        cpu.put("cores", snapshot.cpu().cores());
        cpu.put("usage", snapshot.cpu().usage());
        cpu.put("model", snapshot.cpu().model());
        cpu.put("arch", snapshot.cpu().arch());

        JSONObject memory = new JSONObject();
        memory.put("total", snapshot.memory().total());
        memory.put("used", snapshot.memory().used());
        memory.put("available", snapshot.memory().available());
        memory.put("usage", snapshot.memory().usage());

        JSONObject disk = new JSONObject();
        disk.put("total", snapshot.disk().total());
        disk.put("used", snapshot.disk().used());
        disk.put("available", snapshot.disk().available());
        disk.put("usage", snapshot.disk().usage());

        JSONObject load = new JSONObject();
        load.put("load1", snapshot.load().load1());
        load.put("load5", snapshot.load().load5());
        load.put("load15", snapshot.load().load15());

        JSONObject json = new JSONObject();
        json.put("cpu", cpu);
        json.put("memory", memory);
        json.put("disk", disk);
        json.put("load", load);
        return json;
    }

    public static JSONObject provisioning(ProvisioningReport report) {
        JSONArray steps = new JSONArray();
        for (ProvisioningReport.Step step : report.getSteps()) {
            JSONObject json = new JSONObject();
            json.put("step", step.name());
            json.put("status", step.status().name().toLowerCase());
            if (!step.detail().isEmpty()) {
                json.put("detail", step.detail());
            }
            steps.put(json);
        }
        JSONObject json = new JSONObject();
        json.put("host", report.getHostId());
        json.put("distribution", report.getDistribution());
        json.put("steps", steps);
        return json;
    }
}
