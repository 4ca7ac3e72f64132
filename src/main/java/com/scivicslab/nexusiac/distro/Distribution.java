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
import java.util.Collections;
import java.util.List;

import com.scivicslab.nexusiac.ConfigurationException;

/**
 * Catalogue of supported distributions.
 *
 * <p>{@link #UNKNOWN} is a valid declaration and a possible detection result, but
 * it belongs to no family and cannot be provisioned.</p>
 *
 * @author devteam@scivicslab.com
 */
public enum Distribution {

    UBUNTU("ubuntu", "Ubuntu", DistroFamily.DEBIAN, "apt", "ufw", "systemctl", "systemd"),
    DEBIAN("debian", "Debian", DistroFamily.DEBIAN, "apt", "ufw", "systemctl", "systemd"),
    CENTOS("centos", "CentOS", DistroFamily.RHEL, "yum", "firewalld", "systemctl", "systemd"),
    RHEL("rhel", "Red Hat Enterprise Linux", DistroFamily.RHEL, "yum", "firewalld", "systemctl", "systemd"),
    ROCKY("rocky", "Rocky Linux", DistroFamily.RHEL, "dnf", "firewalld", "systemctl", "systemd"),
    FEDORA("fedora", "Fedora", DistroFamily.RHEL, "dnf", "firewalld", "systemctl", "systemd"),
    ALPINE("alpine", "Alpine Linux", DistroFamily.ALPINE, "apk", "iptables", "rc-service", "openrc"),
    UNKNOWN("unknown", "Unknown", null, "", "", "", "");

    private final String id;
    private final String displayName;
    private final DistroFamily family;
    private final String packageManager;
    private final String firewallTool;
    private final String serviceManager;
    private final String initSystem;

    Distribution(String id, String displayName, DistroFamily family, String packageManager,
                 String firewallTool, String serviceManager, String initSystem) {
        this.id = id;
        this.displayName = displayName;
        this.family = family;
        this.packageManager = packageManager;
        this.firewallTool = firewallTool;
        this.serviceManager = serviceManager;
        this.initSystem = initSystem;
    }

    /**
     * Looks up a distribution by its identifier.
     *
     * @param id the identifier, case-insensitive
     * @return the distribution
     * @throws ConfigurationException if the identifier is not in the catalogue
     */
    public static Distribution fromId(String id) throws ConfigurationException {
        String key = id == null ? "" : id.trim().toLowerCase();
        for (Distribution distribution : values()) {
            if (distribution.id.equals(key)) {
                return distribution;
            }
        }
        throw new ConfigurationException(String.format(
            "unsupported distribution '%s' (supported: %s)", id, String.join(", ", supportedIds())));
    }

    /**
     * Gets every identifier accepted in a host declaration, including "unknown".
     *
     * @return the identifiers in catalogue order
     */
    public static List<String> supportedIds() {
        List<String> ids = new ArrayList<>();
        for (Distribution distribution : values()) {
            ids.add(distribution.id);
        }
        return Collections.unmodifiableList(ids);
    }

    public String getId() {
        return id;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * @return the family, or null for {@link #UNKNOWN}
     */
    public DistroFamily getFamily() {
        return family;
    }

    public String getPackageManager() {
        return packageManager;
    }

    public String getFirewallTool() {
        return firewallTool;
    }

    public String getServiceManager() {
        return serviceManager;
    }

    public String getInitSystem() {
        return initSystem;
    }

    public boolean isProvisionable() {
        return family != null;
    }
}
