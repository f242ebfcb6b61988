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

package me.golemcore.bridge.adapter.outbound.browser;

import me.golemcore.bridge.infrastructure.config.BridgeProperties;
import me.golemcore.bridge.port.outbound.BrowserSurfacePort;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.options.LoadState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Playwright implementation of BrowserSurfacePort.
 *
 * <p>
 * One persistent Chromium context backs every surface, so logins made by hand
 * in the opened window survive restarts through the profile directory. Each
 * surface id owns one page of that context.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code bridge.browser.headless} - Run in headless mode
 * <li>{@code bridge.browser.profile-dir} - Persistent profile location
 * <li>{@code bridge.browser.user-agent} - Custom user agent
 * <li>{@code bridge.browser.action-timeout} - Bound of a single page action
 * </ul>
 *
 * <p>
 * Lazy initialization: the browser is launched by the first {@link #open}.
 * Playwright objects are not thread-safe; all calls must come from the loop
 * thread.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PlaywrightBrowserSurface implements BrowserSurfacePort {

    private final BridgeProperties properties;

    private final Map<String, Page> pages = new LinkedHashMap<>();

    private Playwright playwright;
    private BrowserContext context;

    @SuppressWarnings("PMD.CloseResource")
    private void ensureInitialized() {
        if (context != null) {
            return;
        }

        BridgeProperties.BrowserProperties browser = properties.getBrowser();
        Path profileDir = Paths.get(browser.getProfileDir().replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath().normalize();

        Playwright pw = null;
        try {
            pw = Playwright.create();
            BrowserType.LaunchPersistentContextOptions options = new BrowserType.LaunchPersistentContextOptions()
                    .setHeadless(browser.isHeadless());
            String userAgent = browser.getUserAgent();
            if (userAgent != null && !userAgent.isBlank()) {
                options.setUserAgent(userAgent);
            }

            this.context = pw.chromium().launchPersistentContext(profileDir, options);
            this.context.setDefaultTimeout(browser.getActionTimeout().toMillis());
            this.context.setDefaultNavigationTimeout(browser.getNavigationTimeout().toMillis());
            this.playwright = pw;

            log.info("Playwright browser initialized (headless: {}, profile: {})", browser.isHeadless(), profileDir);
        } catch (RuntimeException e) {
            if (pw != null) {
                try {
                    pw.close();
                } catch (RuntimeException ex) {
                    log.trace("Error closing browser resource: {}", ex.getMessage());
                }
            }
            throw new IllegalStateException("Failed to launch browser: " + e.getMessage(), e);
        }
    }

    @Override
    public void open(String surfaceId, String url) {
        ensureInitialized();
        Page page = pages.get(surfaceId);
        if (page == null || page.isClosed()) {
            page = pages.isEmpty() && !context.pages().isEmpty() ? context.pages().get(0) : context.newPage();
            pages.put(surfaceId, page);
        }
        page.navigate(url);
        page.waitForLoadState(LoadState.DOMCONTENTLOADED);
        log.debug("[Browser] Surface {} opened at {}", surfaceId, url);
    }

    @Override
    public boolean isOpen(String surfaceId) {
        Page page = pages.get(surfaceId);
        return page != null && !page.isClosed();
    }

    @Override
    public boolean isPresent(String surfaceId, String selector) {
        return page(surfaceId).locator(selector).count() > 0;
    }

    @Override
    public int count(String surfaceId, String selector) {
        return page(surfaceId).locator(selector).count();
    }

    @Override
    public String lastText(String surfaceId, String selector, Duration maxWait) {
        Locator matches = page(surfaceId).locator(selector);
        int count = matches.count();
        if (count == 0) {
            return "";
        }
        String text = matches.nth(count - 1)
                .innerText(new Locator.InnerTextOptions().setTimeout(Math.max(1, maxWait.toMillis())));
        return text != null ? text : "";
    }

    @Override
    public void insertText(String surfaceId, String selector, String text) {
        Page page = page(surfaceId);
        Locator field = page.locator(selector).first();
        field.click();
        field.fill("");
        page.keyboard().insertText(text);
    }

    @Override
    public void press(String surfaceId, String selector, String key) {
        page(surfaceId).locator(selector).first().press(key);
    }

    @Override
    public void click(String surfaceId, String selector) {
        page(surfaceId).locator(selector).first().click();
    }

    @Override
    public void upload(String surfaceId, String selector, Path file) {
        page(surfaceId).locator(selector).first().setInputFiles(file);
    }

    @Override
    public void reload(String surfaceId) {
        Page page = page(surfaceId);
        page.reload();
        page.waitForLoadState(LoadState.DOMCONTENTLOADED);
    }

    @Override
    public Object evaluate(String surfaceId, String script, Object arg) {
        return page(surfaceId).evaluate(script, arg);
    }

    @Override
    public void close() {
        try {
            pages.clear();
            if (context != null) {
                context.close();
            }
            if (playwright != null) {
                playwright.close();
            }
            log.info("Playwright browser closed");
        } catch (RuntimeException e) {
            log.error("Error closing Playwright browser", e);
        } finally {
            context = null;
            playwright = null;
        }
    }

    private Page page(String surfaceId) {
        Page page = pages.get(surfaceId);
        if (page == null || page.isClosed()) {
            throw new IllegalStateException("Browser surface not open: " + surfaceId);
        }
        return page;
    }
}
