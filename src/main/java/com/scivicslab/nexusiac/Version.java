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

package com.scivicslab.nexusiac;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Provides version information for nexus-IaC.
 *
 * <p>The version is read from version.properties which is populated
 * by Maven resource filtering at build time.</p>
 *
 * @author devteam@scivicslab.com
 */
public final class Version {

    private static final String VERSION;

    static {
        String version = "unknown";
        try (InputStream is = Version.class.getResourceAsStream("/version.properties")) {
            if (is != null) {
                Properties props = new Properties();
                props.load(is);
                version = props.getProperty("version", "unknown");
            }
        } catch (IOException e) {
            Logger.getLogger(Version.class.getName()).log(Level.FINE, "version.properties unreadable", e);
        }
        VERSION = version;
    }

    private Version() {
    }

    public static String get() {
        return VERSION;
    }

    /**
     * Returns the version string for CLI display.
     *
     * @return e.g. "nexus-IaC 1.0.0"
     */
    public static String full() {
        return "nexus-IaC " + VERSION;
    }
}
