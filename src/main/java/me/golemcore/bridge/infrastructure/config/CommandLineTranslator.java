/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.bridge.infrastructure.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Translates the bridge's command-line flags into Spring property arguments.
 *
 * <ul>
 * <li>{@code --config <path>} - {@code bridge.config-path}</li>
 * <li>{@code --log-level <level>} - {@code logging.level.root}</li>
 * <li>{@code --log-file <path>} - {@code logging.file.name}</li>
 * </ul>
 * Both {@code --flag value} and {@code --flag=value} are accepted; any other
 * argument is passed through unchanged.
 */
public final class CommandLineTranslator {

    private static final Map<String, String> FLAGS = Map.of(
            "--config", "bridge.config-path",
            "--log-level", "logging.level.root",
            "--log-file", "logging.file.name");

    private CommandLineTranslator() {
    }

    /**
     * @throws ConfigurationException
     *             if a flag has no value
     */
    public static String[] translate(String... args) {
        List<String> result = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            int eq = arg.indexOf('=');
            String flag = eq > 0 ? arg.substring(0, eq) : arg;
            String property = FLAGS.get(flag);
            if (property == null) {
                result.add(arg);
                continue;
            }
            String value;
            if (eq > 0) {
                value = arg.substring(eq + 1);
            } else if (i + 1 < args.length && !args[i + 1].startsWith("--")) {
                value = args[++i];
            } else {
                value = null;
            }
            if (value == null || value.isBlank()) {
                throw new ConfigurationException("Missing value for " + flag);
            }
            result.add("--" + property + "=" + value);
        }
        return result.toArray(new String[0]);
    }
}
