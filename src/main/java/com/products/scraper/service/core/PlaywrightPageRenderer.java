package com.products.scraper.service.core;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.options.WaitUntilState;
import com.products.scraper.config.BrowserProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.Set;

/**
 * <h2>PlaywrightPageRenderer</h2>
 *
 * <p>Headless Chromium via Playwright. Every call starts its own Playwright
 * driver and browser, so calls never share cookies or state.</p>
 *
 * <ul>
 *   <li>images, fonts, media and stylesheets are aborted (see {@code browser.blocked-resource-types}),</li>
 *   <li>{@code navigator.webdriver} is hidden before any page script runs,</li>
 *   <li>navigation returns as soon as the DOM is parsed.</li>
 * </ul>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PlaywrightPageRenderer implements PageRenderer {

    private static final String HIDE_WEBDRIVER =
            "Object.defineProperty(navigator, 'webdriver', { get: () => undefined });";

    private final BrowserProperties props;

    @Override
    public String render(final String url,
                         final Fingerprint fingerprint,
                         final Map<String, String> headers,
                         final Duration navigationTimeout) {
        Set<String> blocked = Set.copyOf(props.getBlockedResourceTypes());

        try (Playwright playwright = Playwright.create()) {
            Browser browser = playwright.chromium().launch(new BrowserType.LaunchOptions()
                    .setHeadless(props.isHeadless())
                    .setArgs(props.getLaunchArgs()));

            BrowserContext context = browser.newContext(new Browser.NewContextOptions()
                    .setUserAgent(fingerprint.userAgent())
                    .setLocale(fingerprint.locale())
                    .setViewportSize(fingerprint.viewportWidth(), fingerprint.viewportHeight())
                    .setExtraHTTPHeaders(headers));
            context.addInitScript(HIDE_WEBDRIVER);

            Page page = context.newPage();
            page.route("**/*", route -> {
                if (blocked.contains(route.request().resourceType())) {
                    route.abort();
                } else {
                    route.resume();
                }
            });

            page.navigate(url, new Page.NavigateOptions()
                    .setWaitUntil(WaitUntilState.DOMCONTENTLOADED)
                    .setTimeout(navigationTimeout.toMillis()));
            String html = page.content();
            log.debug("Rendered {} ({} chars)", url, html.length());

            context.close();
            browser.close();
            return html;
        }
    }
}
