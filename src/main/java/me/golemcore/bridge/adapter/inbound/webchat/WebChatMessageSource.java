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

package me.golemcore.bridge.adapter.inbound.webchat;

import me.golemcore.bridge.domain.model.BridgeConfig;
import me.golemcore.bridge.domain.model.Message;
import me.golemcore.bridge.domain.model.MessageKind;
import me.golemcore.bridge.domain.service.Sleeper;
import me.golemcore.bridge.infrastructure.config.BridgeProperties;
import me.golemcore.bridge.port.inbound.MessageSourcePort;
import me.golemcore.bridge.port.outbound.BrowserSurfacePort;
import me.golemcore.bridge.port.outbound.ImageStorePort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Message source backed by a web messaging client opened in the shared
 * browser.
 *
 * <p>
 * A poll selects the chat by its title, reads every incoming row and returns
 * the rows after the last one returned for that chat. The first poll of a chat
 * only returns its latest row, so a restart does not replay the visible
 * history. Arrival time and sender come from the row's metadata attribute
 * ({@code [10:32, 18/10/2026] Alice: }); when it cannot be parsed the poll
 * time is used.
 *
 * <p>
 * Image rows are fetched from the page as data URLs and saved to the temp
 * image store. An image that cannot be materialized yields no message.
 */
@Component
@Slf4j
public class WebChatMessageSource implements MessageSourcePort {

    static final String SURFACE_ID = "messaging";

    private static final Pattern META_PATTERN = Pattern.compile("^\\s*\\[(.+?)]\\s*(.*?):\\s*$");

    private static final String READ_ROWS_SCRIPT = """
            (sel) => Array.from(document.querySelectorAll(sel.row)).map(row => {
                const holder = row.closest('[data-id]');
                const metaEl = row.querySelector(sel.meta);
                const textEl = row.querySelector(sel.text);
                const img = row.querySelector(sel.image);
                const meta = metaEl ? metaEl.getAttribute(sel.metaAttribute) : null;
                const text = textEl ? textEl.innerText : '';
                const image = img ? img.getAttribute('src') : null;
                const id = holder ? holder.getAttribute('data-id') : [meta, text, image].join('|');
                return { id: id, meta: meta, text: text, image: image };
            })
            """;

    private static final String FETCH_IMAGE_SCRIPT = """
            async (url) => {
                const response = await fetch(url);
                const blob = await response.blob();
                return await new Promise(resolve => {
                    const reader = new FileReader();
                    reader.onloadend = () => resolve(reader.result);
                    reader.readAsDataURL(blob);
                });
            }
            """;

    private static final String ENTER = "Enter";

    private final BrowserSurfacePort browser;
    private final ImageStorePort imageStore;
    private final BridgeConfig config;
    private final BridgeProperties.MessagingProperties selectors;
    private final BridgeProperties.TimingProperties timing;
    private final Clock clock;
    private final Sleeper sleeper;
    private final DateTimeFormatter timestampFormat;

    private final Map<String, String> watermarks = new HashMap<>();
    private String currentChat;

    public WebChatMessageSource(BrowserSurfacePort browser, ImageStorePort imageStore, BridgeConfig config,
            BridgeProperties properties, Clock clock, Sleeper sleeper) {
        this.browser = browser;
        this.imageStore = imageStore;
        this.config = config;
        this.selectors = properties.getMessaging();
        this.timing = properties.getTiming();
        this.clock = clock;
        this.sleeper = sleeper;
        this.timestampFormat = DateTimeFormatter.ofPattern(selectors.getTimestampPattern());
    }

    @Override
    public void start() {
        browser.open(SURFACE_ID, config.getMessagingUrl());
        log.info("[WebChat] Messaging surface opened at {}", config.getMessagingUrl());
    }

    @Override
    public boolean isReady() {
        try {
            return browser.isOpen(SURFACE_ID) && browser.isPresent(SURFACE_ID, selectors.getReadySelector());
        } catch (RuntimeException e) {
            log.debug("[WebChat] Readiness check failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public List<Message> pollNew(String conversation) {
        if (config.isIgnored(conversation)) {
            return Collections.emptyList();
        }
        try {
            selectChat(conversation);
            List<Row> rows = readRows();
            if (rows.isEmpty()) {
                return Collections.emptyList();
            }

            List<Row> fresh = newerThanWatermark(conversation, rows);
            watermarks.put(conversation, rows.get(rows.size() - 1).id());

            List<Message> messages = new ArrayList<>();
            for (Row row : fresh) {
                Message message = toMessage(conversation, row);
                if (message != null) {
                    messages.add(message);
                }
            }
            if (!messages.isEmpty()) {
                log.debug("[WebChat] {} new message(s) in {}", messages.size(), conversation);
            }
            return messages;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Collections.emptyList();
        } catch (RuntimeException e) { // NOSONAR - a stale page must not stop the loop
            log.warn("[WebChat] Failed to read {}: {}", conversation, e.getMessage());
            currentChat = null;
            return Collections.emptyList();
        }
    }

    @Override
    public boolean reply(String conversation, String text) {
        try {
            selectChat(conversation);
            browser.insertText(SURFACE_ID, selectors.getComposeSelector(), text);
            browser.press(SURFACE_ID, selectors.getComposeSelector(), ENTER);
            log.debug("[WebChat] Replied in {} ({} chars)", conversation, text.length());
            return true;
        } catch (RuntimeException e) {
            log.warn("[WebChat] Failed to reply in {}: {}", conversation, e.getMessage());
            currentChat = null;
            return false;
        }
    }

    private void selectChat(String conversation) {
        if (conversation.equals(currentChat)) {
            return;
        }
        browser.click(SURFACE_ID, String.format(selectors.getChatSelector(), cssString(conversation)));
        currentChat = conversation;
        log.debug("[WebChat] Selected chat: {}", conversation);
    }

    @SuppressWarnings("unchecked")
    private List<Row> readRows() {
        Map<String, Object> arg = Map.of(
                "row", selectors.getIncomingRowSelector(),
                "meta", selectors.getMetaAttributeSelector(),
                "metaAttribute", selectors.getMetaAttribute(),
                "text", selectors.getTextSelector(),
                "image", selectors.getImageSelector());
        Object result = browser.evaluate(SURFACE_ID, READ_ROWS_SCRIPT, arg);
        if (!(result instanceof List<?> list)) {
            return Collections.emptyList();
        }
        List<Row> rows = new ArrayList<>(list.size());
        for (Object item : list) {
            if (item instanceof Map<?, ?> map) {
                Map<String, Object> fields = (Map<String, Object>) map;
                rows.add(new Row(asString(fields.get("id")), asString(fields.get("meta")),
                        asString(fields.get("text")), asString(fields.get("image"))));
            }
        }
        return rows;
    }

    private List<Row> newerThanWatermark(String conversation, List<Row> rows) {
        String watermark = watermarks.get(conversation);
        if (watermark == null) {
            return List.of(rows.get(rows.size() - 1));
        }
        for (int i = rows.size() - 1; i >= 0; i--) {
            if (watermark.equals(rows.get(i).id())) {
                return rows.subList(i + 1, rows.size());
            }
        }
        // Watermark scrolled out of the rendered window
        return List.of(rows.get(rows.size() - 1));
    }

    private Message toMessage(String conversation, Row row) throws InterruptedException {
        Matcher meta = row.meta() != null ? META_PATTERN.matcher(row.meta()) : null;
        boolean parsed = meta != null && meta.matches();
        String sender = parsed ? meta.group(2).strip() : null;
        if (sender != null && config.isIgnored(sender)) {
            log.debug("[WebChat] Ignoring message from {} in {}", sender, conversation);
            return null;
        }
        Instant arrivedAt = parsed ? parseTimestamp(meta.group(1)) : clock.instant();

        Message.MessageBuilder builder = Message.builder()
                .conversation(conversation)
                .sender(sender)
                .arrivedAt(arrivedAt);

        if (row.image() == null) {
            if (row.text() == null || row.text().isBlank()) {
                return null;
            }
            return builder.kind(MessageKind.TEXT).content(row.text()).build();
        }

        Path imageRef = materialize(conversation, row.image());
        if (imageRef == null) {
            return null;
        }
        String caption = row.text() != null && !row.text().isBlank() ? row.text() : null;
        return builder.kind(MessageKind.IMAGE)
                .content("image:" + row.id())
                .caption(caption)
                .imageRef(imageRef)
                .build();
    }

    private Path materialize(String conversation, String source) throws InterruptedException {
        sleeper.sleep(timing.getImageDownloadDelay());
        try {
            Object dataUrl = browser.evaluate(SURFACE_ID, FETCH_IMAGE_SCRIPT, source);
            if (!(dataUrl instanceof String url) || !url.startsWith("data:image")) {
                log.warn("[WebChat] Image in {} could not be fetched", conversation);
                return null;
            }
            return imageStore.saveDataUrl(url, conversation);
        } catch (RuntimeException e) {
            log.warn("[WebChat] Failed to materialize image in {}: {}", conversation, e.getMessage());
            return null;
        }
    }

    private Instant parseTimestamp(String value) {
        try {
            return LocalDateTime.parse(value.strip(), timestampFormat).atZone(clock.getZone()).toInstant();
        } catch (DateTimeParseException e) {
            log.debug("[WebChat] Unparseable message timestamp '{}', using poll time", value);
            return clock.instant();
        }
    }

    private static String cssString(String value) {
        return value.replace("\\", "\\\\").replace("'", "\\'");
    }

    private static String asString(Object value) {
        return value != null ? value.toString() : null;
    }

    private record Row(String id, String meta, String text, String image) {
    }
}
