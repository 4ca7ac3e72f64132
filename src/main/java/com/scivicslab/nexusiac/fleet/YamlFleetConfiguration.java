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
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import com.scivicslab.nexusiac.ConfigurationException;
import com.scivicslab.nexusiac.HostIdentity;
import com.scivicslab.nexusiac.distro.FirewallRule;

/**
 * Fleet definition read from a YAML file.
 *
 * <pre>
 * servers:
 *   web1:
 *     host: 10.0.0.11
 *     ssh_user: deploy
 *     ssh_key: ~/.ssh/id_ed25519
 *     ssh_port: 22          # optional, 22 when omitted
 *     sudo: true
 *     distro: ubuntu        # optional, detected when omitted
 *     nexus: prod
 * nexuses:
 *   prod:
 *     description: Production
 *     environment: production
 *     servers: [web1, web2]
 * firewall:                 # optional
 *   global:
 *     - {port: 22, protocol: tcp, from: any, comment: SSH}
 *   server_specific:
 *     web1:
 *       - {port: 5432, from: 10.0.0.0/24, action: allow}
 * </pre>
 *
 * <p>{@code ${NAME}} in any string value is replaced with the named environment
 * variable; unresolved references are left as written. Missing connection fields
 * are not rejected here: the host factory reports them when a handle is created,
 * and nexus members that name undefined hosts are reported by the coordinator.</p>
 *
 * @author devteam@scivicslab.com
 */
public class YamlFleetConfiguration implements FleetConfiguration {

    private static final Logger LOG = Logger.getLogger(YamlFleetConfiguration.class.getName());

    private static final Pattern VARIABLE = Pattern.compile("\\$\\{([^}]+)\\}");

    private final Map<String, HostIdentity> hosts;
    private final Map<String, Nexus> nexuses;
    private final List<FirewallRule> globalRules;
    private final Map<String, List<FirewallRule>> hostRules;
    private final boolean firewallConfigured;

    private YamlFleetConfiguration(Map<String, HostIdentity> hosts, Map<String, Nexus> nexuses,
                                   List<FirewallRule> globalRules, Map<String, List<FirewallRule>> hostRules,
                                   boolean firewallConfigured) {
        this.hosts = hosts;
        this.nexuses = nexuses;
        this.globalRules = globalRules;
        this.hostRules = hostRules;
        this.firewallConfigured = firewallConfigured;
    }

    /**
     * Loads a fleet file, substituting variables from the process environment.
     *
     * @param file the fleet file
     * @return the configuration
     * @throws ConfigurationException if the file cannot be read or is malformed
     */
    public static YamlFleetConfiguration load(Path file) throws ConfigurationException {
        return load(file, System.getenv());
    }

    public static YamlFleetConfiguration load(Path file, Map<String, String> env) throws ConfigurationException {
        if (!Files.isRegularFile(file)) {
            throw new ConfigurationException("fleet file not found: " + file);
        }
        try (InputStream is = Files.newInputStream(file)) {
            YamlFleetConfiguration config = load(is, env);
            LOG.fine(String.format("Loaded %d hosts and %d nexuses from %s",
                config.hosts.size(), config.nexuses.size(), file));
            return config;
        } catch (IOException e) {
            throw new ConfigurationException("cannot read fleet file " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * Loads a fleet definition from a stream.
     *
     * @param input the YAML document
     * @param env variables available for substitution
     * @return the configuration
     * @throws ConfigurationException if the document is malformed
     */
    public static YamlFleetConfiguration load(InputStream input, Map<String, String> env)
            throws ConfigurationException {
        Object document;
        try {
            Yaml yaml = new Yaml();
            document = yaml.load(input);
        } catch (YAMLException e) {
            throw new ConfigurationException("invalid YAML: " + e.getMessage(), e);
        }
        if (document == null) {
            throw new ConfigurationException("fleet file is empty");
        }
        Map<String, Object> root = asMap(substitute(document, env), "document root");

        Map<String, HostIdentity> hosts = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : asMap(root.get("servers"), "servers").entrySet()) {
            hosts.put(entry.getKey(), parseHost(entry.getKey(), asMap(entry.getValue(), "servers." + entry.getKey())));
        }

        Map<String, Nexus> nexuses = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : asMap(root.get("nexuses"), "nexuses").entrySet()) {
            nexuses.put(entry.getKey(),
                parseNexus(entry.getKey(), asMap(entry.getValue(), "nexuses." + entry.getKey())));
        }

        List<FirewallRule> globalRules = new ArrayList<>();
        Map<String, List<FirewallRule>> hostRules = new LinkedHashMap<>();
        boolean firewallConfigured = root.get("firewall") != null;
        if (firewallConfigured) {
            Map<String, Object> firewall = asMap(root.get("firewall"), "firewall");
            globalRules.addAll(parseRules(firewall.get("global"), "firewall.global"));
            Map<String, Object> specific = asMap(firewall.get("server_specific"), "firewall.server_specific");
            for (Map.Entry<String, Object> entry : specific.entrySet()) {
                if (!hosts.containsKey(entry.getKey())) {
                    throw new ConfigurationException(
                        "firewall.server_specific references undefined server '" + entry.getKey() + "'");
                }
                hostRules.put(entry.getKey(),
                    parseRules(entry.getValue(), "firewall.server_specific." + entry.getKey()));
            }
        }

        return new YamlFleetConfiguration(hosts, nexuses, globalRules, hostRules, firewallConfigured);
    }

    private static HostIdentity parseHost(String name, Map<String, Object> server) throws ConfigurationException {
        String where = "servers." + name;
        return new HostIdentity.Builder(name)
            .address(asString(server.get("host")))
            .user(asString(server.get("ssh_user")))
            .keyPath(asString(server.get("ssh_key")))
            .port(asInt(server.get("ssh_port"), where + ".ssh_port", 0))
            .escalationAllowed(asBoolean(server.get("sudo"), where + ".sudo"))
            .distribution(asString(server.get("distro")))
            .nexus(asString(server.get("nexus")))
            .build();
    }

    private static Nexus parseNexus(String name, Map<String, Object> nexus) throws ConfigurationException {
        String where = "nexuses." + name;
        List<String> members = new ArrayList<>();
        for (Object member : asList(nexus.get("servers"), where + ".servers")) {
            members.add(asString(member));
        }
        if (members.isEmpty()) {
            throw new ConfigurationException(where + ": at least one server must be listed");
        }
        return new Nexus(name, asString(nexus.get("description")), asString(nexus.get("environment")), members);
    }

    private static List<FirewallRule> parseRules(Object value, String where) throws ConfigurationException {
        List<FirewallRule> rules = new ArrayList<>();
        List<Object> entries = asList(value, where);
        for (int i = 0; i < entries.size(); i++) {
            String ruleWhere = where + "[" + i + "]";
            Map<String, Object> entry = asMap(entries.get(i), ruleWhere);
            FirewallRule rule = new FirewallRule(
                asInt(entry.get("port"), ruleWhere + ".port", 0),
                asString(entry.get("protocol")),
                asString(entry.get("from")),
                FirewallRule.Action.parse(asString(entry.get("action"))),
                asString(entry.get("comment")));
            try {
                rule.validate();
            } catch (ConfigurationException e) {
                throw new ConfigurationException(ruleWhere + ": " + e.getMessage(), e);
            }
            rules.add(rule);
        }
        return rules;
    }

    /*
     * Replaces ${NAME} in every string scalar of the parsed document.
     */
    static Object substitute(Object node, Map<String, String> env) {
        if (node instanceof String) {
            Matcher matcher = VARIABLE.matcher((String) node);
            StringBuilder sb = new StringBuilder();
            while (matcher.find()) {
                String value = env.get(matcher.group(1));
                matcher.appendReplacement(sb, Matcher.quoteReplacement(value != null ? value : matcher.group()));
            }
            matcher.appendTail(sb);
            return sb.toString();
        }
        if (node instanceof Map) {
            Map<Object, Object> result = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) node).entrySet()) {
                result.put(entry.getKey(), substitute(entry.getValue(), env));
            }
            return result;
        }
        if (node instanceof List) {
            List<Object> result = new ArrayList<>();
            for (Object item : (List<?>) node) {
                result.add(substitute(item, env));
            }
            return result;
        }
        return node;
    }

    private static Map<String, Object> asMap(Object value, String where) throws ConfigurationException {
        if (value == null) {
            return Collections.emptyMap();
        }
        if (!(value instanceof Map)) {
            throw new ConfigurationException(where + ": expected a mapping");
        }
        Map<String, Object> result = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
            result.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        return result;
    }

    @SuppressWarnings("unchecked")
    private static List<Object> asList(Object value, String where) throws ConfigurationException {
        if (value == null) {
            return Collections.emptyList();
        }
        if (!(value instanceof List)) {
            throw new ConfigurationException(where + ": expected a list");
        }
        return (List<Object>) value;
    }

    private static String asString(Object value) {
        return value == null ? "" : value.toString().trim();
    }

    private static int asInt(Object value, String where, int defaultValue) throws ConfigurationException {
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Integer) {
            return (Integer) value;
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(where + ": expected an integer, got '" + value + "'", e);
        }
    }

    private static boolean asBoolean(Object value, String where) throws ConfigurationException {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        String text = value.toString().trim().toLowerCase();
        if (text.equals("true") || text.equals("yes")) {
            return true;
        }
        if (text.equals("false") || text.equals("no")) {
            return false;
        }
        throw new ConfigurationException(where + ": expected true or false, got '" + value + "'");
    }

    @Override
    public List<String> getNexusNames() {
        return List.copyOf(nexuses.keySet());
    }

    @Override
    public Optional<Nexus> findNexus(String name) {
        return Optional.ofNullable(nexuses.get(name));
    }

    @Override
    public List<String> getHostNames() {
        return List.copyOf(hosts.keySet());
    }

    @Override
    public Optional<HostIdentity> findHost(String name) {
        return Optional.ofNullable(hosts.get(name));
    }

    @Override
    public boolean hasFirewallConfig() {
        return firewallConfigured;
    }

    @Override
    public List<FirewallRule> getFirewallRules(String hostName) {
        List<FirewallRule> rules = new ArrayList<>(globalRules);
        rules.addAll(hostRules.getOrDefault(hostName, Collections.emptyList()));
        return rules;
    }
}
