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

package me.golemcore.bridge.port.outbound;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Temporary storage for images materialized from the messaging surface.
 */
public interface ImageStorePort {

    /**
     * Decodes a {@code data:image/...;base64,} URL (or bare base64) and writes it
     * to a new temp file.
     *
     * @return path of the written file
     */
    Path saveDataUrl(String dataUrl, String prefix);

    /**
     * Deletes temp images older than {@code maxAge}.
     *
     * @return number of deleted files
     */
    int cleanup(Duration maxAge);
}
