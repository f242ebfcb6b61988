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
 * The single browser shared by the messaging surface and all UI providers. Each
 * page is addressed by a surface id (the provider id, or the messaging
 * surface's id) instead of an ambient "current tab".
 *
 * <p>
 * Implementations are confined to the thread that first uses them; the
 * orchestrator loop thread owns the browser.
 */
public interface BrowserSurfacePort {

    /**
     * Opens a page for the surface and navigates it to the url. Reopening an
     * existing surface navigates its page again.
     */
    void open(String surfaceId, String url);

    boolean isOpen(String surfaceId);

    boolean isPresent(String surfaceId, String selector);

    int count(String surfaceId, String selector);

    /**
     * Returns the inner text of the last element matching the selector, or an
     * empty string when nothing matches. The read waits at most
     * {@code maxWait} for the element to become readable.
     */
    String lastText(String surfaceId, String selector, Duration maxWait);

    /**
     * Focuses the element, clears it and inserts the text in one input event,
     * the way a clipboard paste does, instead of typing key by key.
     */
    void insertText(String surfaceId, String selector, String text);

    void press(String surfaceId, String selector, String key);

    void click(String surfaceId, String selector);

    void upload(String surfaceId, String selector, Path file);

    void reload(String surfaceId);

    /**
     * Evaluates a script in the page; the script receives {@code arg} as its
     * single argument. Returns JSON-like Java values (maps, lists, strings).
     */
    Object evaluate(String surfaceId, String script, Object arg);

    /**
     * Closes every page and the browser.
     */
    void close();
}
