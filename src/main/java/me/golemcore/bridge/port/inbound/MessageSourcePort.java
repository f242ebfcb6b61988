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

package me.golemcore.bridge.port.inbound;

import me.golemcore.bridge.domain.model.Message;

import java.util.List;

/**
 * The messaging surface the bridge monitors and replies into.
 */
public interface MessageSourcePort {

    /**
     * Opens the messaging surface. Called once, from the loop thread, before the
     * first poll.
     */
    void start();

    /**
     * Returns the inbound items of the conversation that are newer than the
     * previous successful poll, in arrival order. A failed read returns an empty
     * list instead of throwing.
     */
    List<Message> pollNew(String conversation);

    /**
     * Posts a reply into the conversation.
     *
     * @return {@code true} when the reply was submitted
     */
    boolean reply(String conversation, String text);

    /**
     * Checks whether the messaging surface is logged in and readable.
     */
    default boolean isReady() {
        return true;
    }
}
