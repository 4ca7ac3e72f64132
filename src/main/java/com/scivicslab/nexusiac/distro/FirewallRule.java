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
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.scivicslab.nexusiac.ConfigurationException;

/**
 * One inbound firewall rule.
 *
 * <p>Protocol is {@code tcp}, {@code udp} or {@code tcp/udp}; the last one is
 * applied as two rules (see {@link #expand()}). Source is {@code any} or an
 * IPv4 address with an optional prefix length.</p>
 *
 * @author devteam@scivicslab.com
 */
public final class FirewallRule {

    public static final String ANY_SOURCE = "any";
    public static final String DEFAULT_PROTOCOL = "tcp";
    static final String BOTH_PROTOCOLS = "tcp/udp";

    private static final Pattern IPV4_SOURCE =
        Pattern.compile("(\\d{1,3})\\.(\\d{1,3})\\.(\\d{1,3})\\.(\\d{1,3})(/(\\d{1,2}))?");

    /**
     * What the firewall does with matching packets.
     */
    public enum Action {
        ALLOW,
        DENY;

        public static Action parse(String value) throws ConfigurationException {
            if (value == null || value.isBlank()) {
                return ALLOW;
            }
            return switch (value.trim().toLowerCase()) {
                case "allow" -> ALLOW;
                case "deny" -> DENY;
                default -> throw new ConfigurationException("unknown firewall action '" + value + "'");
            };
        }
    }

    private final int port;
    private final String protocol;
    private final String source;
    private final Action action;
    private final String comment;

    public FirewallRule(int port, String protocol, String source, Action action, String comment) {
        this.port = port;
        this.protocol = protocol == null || protocol.isBlank() ? DEFAULT_PROTOCOL : protocol.trim().toLowerCase();
        this.source = source == null || source.isBlank() ? ANY_SOURCE : source.trim();
        this.action = action == null ? Action.ALLOW : action;
        this.comment = comment == null ? "" : comment;
    }

    /**
     * Creates an allow rule for a TCP port from anywhere.
     *
     * @param port the port
     * @return the rule
     */
    public static FirewallRule allowTcp(int port) {
        return new FirewallRule(port, DEFAULT_PROTOCOL, ANY_SOURCE, Action.ALLOW, "");
    }

    public int getPort() {
        return port;
    }

    public String getProtocol() {
        return protocol;
    }

    public String getSource() {
        return source;
    }

    public Action getAction() {
        return action;
    }

    public String getComment() {
        return comment;
    }

    public boolean isAnySource() {
        return ANY_SOURCE.equalsIgnoreCase(source);
    }

    /**
     * Checks the rule before any command is built from it.
     *
     * @throws ConfigurationException if port, protocol or source is invalid
     */
    public void validate() throws ConfigurationException {
        if (port < 1 || port > 65535) {
            throw new ConfigurationException("firewall rule port out of range: " + port);
        }
        if (!protocol.equals("tcp") && !protocol.equals("udp") && !protocol.equals(BOTH_PROTOCOLS)) {
            throw new ConfigurationException(String.format(
                "firewall rule for port %d: unsupported protocol '%s'", port, protocol));
        }
        if (!isAnySource() && !isValidIpv4Source(source)) {
            throw new ConfigurationException(String.format(
                "firewall rule for port %d: invalid source '%s'", port, source));
        }
    }

    private static boolean isValidIpv4Source(String value) {
        Matcher matcher = IPV4_SOURCE.matcher(value);
        if (!matcher.matches()) {
            return false;
        }
        for (int i = 1; i <= 4; i++) {
            if (Integer.parseInt(matcher.group(i)) > 255) {
                return false;
            }
        }
        return matcher.group(6) == null || Integer.parseInt(matcher.group(6)) <= 32;
    }

    /**
     * Splits a {@code tcp/udp} rule into a TCP and a UDP rule.
     *
     * @return one rule, or two for {@code tcp/udp}
     */
    public List<FirewallRule> expand() {
        List<FirewallRule> rules = new ArrayList<>();
        if (protocol.equals(BOTH_PROTOCOLS)) {
            rules.add(new FirewallRule(port, "tcp", source, action, comment));
            rules.add(new FirewallRule(port, "udp", source, action, comment));
        } else {
            rules.add(this);
        }
        return rules;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FirewallRule)) {
            return false;
        }
        FirewallRule other = (FirewallRule) o;
        return port == other.port
            && protocol.equals(other.protocol)
            && source.equals(other.source)
            && action == other.action;
    }

    @Override
    public int hashCode() {
        return Objects.hash(port, protocol, source, action);
    }

    @Override
    public String toString() {
        return String.format("%s %d/%s from %s", action.name().toLowerCase(), port, protocol, source);
    }
}
