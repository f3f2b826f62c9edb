package com.meetbridge.browser;

import com.meetbridge.config.BridgeSettings;
import com.meetbridge.service.BridgeEventLoop;
import com.meetbridge.transport.TransportObserver;
import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.Response;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;

/**
 * Attaches to an already running browser over CDP and hooks the Meet page.
 * Playwright is not thread-safe, so the instance is created, used and closed on the event loop only.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PlaywrightAttachService {

    private final BridgeEventLoop eventLoop;
    private final TransportObserver transportObserver;
    private final PlaywrightMeetingUiInspector uiInspector;
    private final BridgeSettings settings;

    private Playwright playwright;
    private Browser browser;
    private Page page;
    private ScheduledFuture<?> eventPoll;
    private volatile String attachedUrl;

    /**
     * Attach to the browser at cdpUrl and hook the first page whose URL contains the fragment
     *
     * @return completes with the URL of the hooked page
     */
    public CompletableFuture<String> attach(String cdpUrl, String meetingUrlFragment) {
        String fragment = meetingUrlFragment == null || meetingUrlFragment.isBlank()
                ? settings.getMeetingHost()
                : meetingUrlFragment;
        return eventLoop.call("browser-attach", () -> attachOnLoop(cdpUrl, fragment));
    }

    public CompletableFuture<Void> detach() {
        return eventLoop.call("browser-detach", () -> {
            detachOnLoop();
            return null;
        });
    }

    public Optional<String> getAttachedUrl() {
        return Optional.ofNullable(attachedUrl);
    }

    @PreDestroy
    public void cleanup() {
        detach();
    }

    private String attachOnLoop(String cdpUrl, String fragment) {
        if (browser != null) {
            throw new IllegalStateException("Already attached to " + attachedUrl);
        }

        log.info("Attaching to browser at {} on thread: {}", cdpUrl, Thread.currentThread().getName());
        playwright = Playwright.create();
        try {
            browser = playwright.chromium().connectOverCDP(cdpUrl);
            page = findMeetingPage(browser, fragment)
                    .orElseThrow(() -> new IllegalStateException("No open page matches '" + fragment + "'"));

            page.onResponse(this::onResponse);
            uiInspector.attach(page);

            Page hooked = page;
            eventPoll = eventLoop.scheduleAtFixedRate("browser-events", () -> pollEvents(hooked),
                    Duration.ofMillis(settings.getBrowserPollMillis()));

            attachedUrl = page.url();
            log.info("Attached to meeting page {}", attachedUrl);
            return attachedUrl;
        } catch (RuntimeException e) {
            log.error("Failed to attach to browser at {}: {}", cdpUrl, e.getMessage());
            detachOnLoop();
            throw e;
        }
    }

    private void detachOnLoop() {
        if (eventPoll != null) {
            eventPoll.cancel(false);
            eventPoll = null;
        }
        uiInspector.detach();
        page = null;
        attachedUrl = null;

        if (browser != null) {
            try {
                browser.close();
            } catch (PlaywrightException e) {
                log.warn("Error disconnecting from browser: {}", e.getMessage());
            }
            browser = null;
        }
        if (playwright != null) {
            try {
                playwright.close();
            } catch (PlaywrightException e) {
                log.warn("Error closing Playwright: {}", e.getMessage());
            }
            playwright = null;
            log.info("Playwright resources cleaned up");
        }
    }

    private Optional<Page> findMeetingPage(Browser connected, String fragment) {
        for (BrowserContext context : connected.contexts()) {
            for (Page candidate : context.pages()) {
                if (candidate.url() != null && candidate.url().contains(fragment)) {
                    return Optional.of(candidate);
                }
            }
        }
        return Optional.empty();
    }

    private void onResponse(Response response) {
        if (!settings.getRosterSyncUrl().equals(response.url())) {
            return;
        }
        try {
            transportObserver.onNetworkResponse(response.url(), response.text());
        } catch (PlaywrightException e) {
            log.warn("Could not read roster sync response body: {}", e.getMessage());
        }
    }

    /**
     * Playwright only dispatches page events while its owning thread is inside an API call
     */
    private void pollEvents(Page hooked) {
        try {
            hooked.waitForTimeout(1);
        } catch (PlaywrightException e) {
            log.warn("Meeting page is no longer reachable: {}", e.getMessage());
            detachOnLoop();
        }
    }
}
