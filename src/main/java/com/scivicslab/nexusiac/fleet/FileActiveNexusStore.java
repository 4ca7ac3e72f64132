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
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * {@link ActiveNexusStore} backed by {@code state.yaml} in a state directory,
 * {@code ~/.nexus-iac} by default.
 *
 * <p>Other keys found in the file are kept when the file is rewritten.</p>
 *
 * @author devteam@scivicslab.com
 */
public class FileActiveNexusStore implements ActiveNexusStore {

    private static final Logger LOG = Logger.getLogger(FileActiveNexusStore.class.getName());

    static final String STATE_FILE = "state.yaml";
    static final String CURRENT_NEXUS_KEY = "current_nexus";

    private final Path stateFile;

    public FileActiveNexusStore() {
        this(defaultStateDir());
    }

    public FileActiveNexusStore(Path stateDir) {
        this.stateFile = stateDir.resolve(STATE_FILE);
    }

    public static Path defaultStateDir() {
        return Paths.get(System.getProperty("user.home"), ".nexus-iac");
    }

    public Path getStateFile() {
        return stateFile;
    }

    @Override
    public Optional<String> load() throws IOException {
        Object value = readState().get(CURRENT_NEXUS_KEY);
        if (value == null || value.toString().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(value.toString().trim());
    }

    @Override
    public void save(String nexusName) throws IOException {
        Map<String, Object> state = readState();
        state.put(CURRENT_NEXUS_KEY, nexusName);

        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        Yaml yaml = new Yaml(options);

        Files.createDirectories(stateFile.getParent());
        Path temp = Files.createTempFile(stateFile.getParent(), STATE_FILE, ".tmp");
        try (Writer writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
            yaml.dump(state, writer);
        }
        Files.move(temp, stateFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        LOG.fine(String.format("Active nexus '%s' written to %s", nexusName, stateFile));
    }

    private Map<String, Object> readState() throws IOException {
        Map<String, Object> state = new LinkedHashMap<>();
        if (!Files.exists(stateFile)) {
            return state;
        }
        try (InputStream is = Files.newInputStream(stateFile)) {
            Yaml yaml = new Yaml();
            Object data = yaml.load(is);
            if (data instanceof Map) {
                for (Map.Entry<?, ?> entry : ((Map<?, ?>) data).entrySet()) {
                    state.put(String.valueOf(entry.getKey()), entry.getValue());
                }
            }
        } catch (YAMLException e) {
            throw new IOException("Malformed state file " + stateFile + ": " + e.getMessage(), e);
        }
        return state;
    }
}
