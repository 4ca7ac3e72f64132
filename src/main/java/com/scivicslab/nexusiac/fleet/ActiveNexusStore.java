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
import java.util.Optional;

/**
 * Persists the name of the currently active nexus between invocations.
 *
 * @author devteam@scivicslab.com
 */
public interface ActiveNexusStore {

    /**
     * @return the stored nexus name, or empty if none was stored
     * @throws IOException if the store cannot be read
     */
    Optional<String> load() throws IOException;

    /**
     * @param nexusName the name to store
     * @throws IOException if the store cannot be written
     */
    void save(String nexusName) throws IOException;
}
