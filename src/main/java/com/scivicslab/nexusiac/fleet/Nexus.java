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

/**
 * A named group of hosts operated on as a unit.
 *
 * @author devteam@scivicslab.com
 */
public final class Nexus {

    private final String name;
    private final String description;
    private final String environment;
    private final List<String> members;

    public Nexus(String name, String description, String environment, List<String> members) {
        this.name = name;
        this.description = description == null ? "" : description;
        this.environment = environment == null ? "" : environment;
        this.members = List.copyOf(members);
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public String getEnvironment() {
        return environment;
    }

    /**
     * Gets the member host names as declared, duplicates included.
     *
     * @return the host names
     */
    public List<String> getMembers() {
        return members;
    }

    @Override
    public String toString() {
        return String.format("Nexus{name='%s', environment='%s', members=%s}", name, environment, members);
    }
}
