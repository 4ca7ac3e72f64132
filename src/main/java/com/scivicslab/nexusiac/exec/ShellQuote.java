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

package com.scivicslab.nexusiac.exec;

/**
 * POSIX shell quoting.
 *
 * @author devteam@scivicslab.com
 */
public final class ShellQuote {

    private ShellQuote() {
    }

    /**
     * Wraps a string in single quotes so a POSIX shell reads it as one literal word.
     *
     * @param value the raw string
     * @return the quoted string
     */
    public static String quote(String value) {
        return "'" + value.replace("'", "'\\''") + "'";
    }
}
