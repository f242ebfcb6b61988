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

package me.golemcore.bridge.domain.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Terminates the process when the bridge cannot start.
 */
@Service
@Slf4j
public class ProcessExitService {

    public static final int STARTUP_FAILURE = 1;

    public void exitAfterStartupFailure(Throwable cause) {
        log.error("[Bridge] Startup failed, exiting with status {}: {}", STARTUP_FAILURE, cause.getMessage(), cause);
        exit(STARTUP_FAILURE);
    }

    @SuppressWarnings({ "PMD.DoNotTerminateVM", "java:S1147" })
    void exit(int statusCode) {
        System.exit(statusCode); // NOSONAR
    }
}
