package fun.fengwk.lds.core.service.scrape.challenge;

import com.microsoft.playwright.FrameLocator;
import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.options.LoadState;
import fun.fengwk.lds.core.service.scrape.ChallengeProperties;
import fun.fengwk.lds.core.service.scrape.model.ChallengeState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Detects the anti-bot interstitial on a rendered page and drives a bounded remediation loop.
 *
 * <p>State transitions:
 * <ul>
 *     <li>FRESH -> BYPASSED when no marker is found, otherwise DETECTED.</li>
 *     <li>DETECTED -> SOLVING while attempts remain, otherwise FAILED.</li>
 *     <li>SOLVING -> BYPASSED when markers are gone after remediation, otherwise DETECTED.</li>
 * </ul>
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChallengeSolver {

    static final List<String> TITLE_MARKERS = List.of("Just a moment", "Cloudflare");
    static final List<String> BODY_MARKERS = List.of("unusual traffic", "Checking your browser", "verifying you are human");

    static final String WIDGET_FRAME_SELECTOR = "iframe[src*=\"challenges.cloudflare.com\"]";
    static final String WIDGET_CHECKBOX_SELECTOR = "input[type=\"checkbox\"], .cf-turnstile-wrapper";

    private static final String BODY_TEXT_SCRIPT =
        "() => document.body && document.body.innerText ? document.body.innerText.substring(0, 500) : ''";

    private final ChallengeProperties challengeProperties;

    public ChallengeState evaluate(Page page) {
        int maxAttempts = Math.max(1, challengeProperties.getMaxAttempts());
        int attempts = 0;
        boolean detectedOnce = false;
        ChallengeState state = ChallengeState.FRESH;
        while (!state.isTerminal()) {
            switch (state) {
                case FRESH -> state = detect(page) ? ChallengeState.DETECTED : ChallengeState.BYPASSED;
                case DETECTED -> {
                    detectedOnce = true;
                    if (attempts >= maxAttempts) {
                        state = ChallengeState.FAILED;
                    } else {
                        log.warn("challenge detected, attempt={}/{}, url={}", attempts + 1, maxAttempts, safeUrl(page));
                        state = ChallengeState.SOLVING;
                    }
                }
                case SOLVING -> {
                    remediate(page);
                    attempts++;
                    state = detect(page) ? ChallengeState.DETECTED : ChallengeState.BYPASSED;
                }
                default -> throw new IllegalStateException("unexpected challenge state: " + state);
            }
        }
        if (state == ChallengeState.FAILED) {
            log.error("failed to bypass challenge after max attempts, attempts={}, url={}", attempts, safeUrl(page));
        } else if (detectedOnce) {
            log.info("challenge bypassed, attempts={}, url={}", attempts, safeUrl(page));
        }
        return state;
    }

    boolean detect(Page page) {
        return hasTitleMarker(safeTitle(page)) || hasBodyMarker(safeBodyText(page));
    }

    /**
     * Whether a page title carries an interstitial marker.
     */
    public static boolean hasTitleMarker(String title) {
        return containsAny(title, TITLE_MARKERS);
    }

    static boolean hasBodyMarker(String bodyText) {
        return containsAny(bodyText, BODY_MARKERS);
    }

    private void remediate(Page page) {
        page.waitForTimeout(challengeProperties.getSettleDelayMs());
        clickWidgetIfPresent(page);
        page.waitForTimeout(challengeProperties.getPostAttemptDelayMs());
        try {
            page.waitForLoadState(
                LoadState.NETWORKIDLE,
                new Page.WaitForLoadStateOptions().setTimeout((double) challengeProperties.getNetworkIdleTimeoutMs())
            );
        } catch (PlaywrightException ex) {
            log.debug("network idle wait after challenge attempt ended, url={}, error={}", safeUrl(page), ex.getMessage());
        }
    }

    private void clickWidgetIfPresent(Page page) {
        try {
            FrameLocator frame = page.frameLocator(WIDGET_FRAME_SELECTOR);
            Locator checkbox = frame.locator(WIDGET_CHECKBOX_SELECTOR);
            if (checkbox.count() > 0) {
                log.info("found challenge checkbox, attempting click, url={}", safeUrl(page));
                checkbox.first().click(new Locator.ClickOptions().setTimeout(challengeProperties.getClickTimeoutMs()));
                page.waitForTimeout(challengeProperties.getPostClickDelayMs());
            }
        } catch (PlaywrightException ex) {
            log.debug("no clickable challenge element, url={}, error={}", safeUrl(page), ex.getMessage());
        }
    }

    private String safeTitle(Page page) {
        try {
            String title = page.title();
            return title == null ? "" : title;
        } catch (PlaywrightException ex) {
            log.debug("get page title failed, error={}", ex.getMessage());
            return "";
        }
    }

    private String safeBodyText(Page page) {
        try {
            Object value = page.evaluate(BODY_TEXT_SCRIPT);
            return value == null ? "" : value.toString();
        } catch (PlaywrightException ex) {
            log.debug("get body text failed, error={}", ex.getMessage());
            return "";
        }
    }

    private String safeUrl(Page page) {
        try {
            return page.url();
        } catch (PlaywrightException ex) {
            return "";
        }
    }

    private static boolean containsAny(String text, List<String> markers) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        for (String marker : markers) {
            if (text.contains(marker)) {
                return true;
            }
        }
        return false;
    }

}
