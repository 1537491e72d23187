package fun.fengwk.lds.core.service.browser;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Map;

/**
 * Browser runtime shared configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "lds.browser")
public class BrowserProperties {

    /**
     * Min browser worker count per process.
     */
    private int workerPoolMinSizePerProcess = 1;

    /**
     * Max browser worker count per process.
     */
    private int workerPoolMaxSizePerProcess = 3;

    /**
     * Capacity of the pending task queue.
     */
    private int requestQueueCapacity = 16;

    /**
     * Timeout when offering a task to the queue.
     */
    private int queueOfferTimeoutMs = 15000;

    /**
     * Idle time after which a worker above the minimum retires, 0 disables retirement.
     */
    private long workerIdleTtlMs = 60000;

    /**
     * Worker queue polling interval.
     */
    private long workerRefreshIntervalMs = 1000;

    /**
     * Browser engine: chromium, firefox or webkit.
     */
    private String browserType = "firefox";

    /**
     * Whether workers run in headless mode.
     */
    private boolean headless = true;

    /**
     * Optional fixed user agent for browser context.
     */
    private String userAgent = "";

    /**
     * User agent pool for random rotation, should match the browser engine.
     */
    private List<String> userAgents = List.of(
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64; rv:128.0) Gecko/20100101 Firefox/128.0",
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64; rv:127.0) Gecko/20100101 Firefox/127.0",
        "Mozilla/5.0 (Macintosh; Intel Mac OS X 10.15; rv:128.0) Gecko/20100101 Firefox/128.0",
        "Mozilla/5.0 (X11; Linux x86_64; rv:128.0) Gecko/20100101 Firefox/128.0"
    );

    /**
     * Accept-Language header value.
     */
    private String acceptLanguage = "en-US,en;q=0.9";

    /**
     * Locale for browser context.
     */
    private String locale = "en-US";

    /**
     * Optional timezone id for browser context.
     */
    private String timezoneId = "";

    /**
     * Viewport width, 0 keeps the engine default.
     */
    private int viewportWidth = 1920;

    /**
     * Viewport height, 0 keeps the engine default.
     */
    private int viewportHeight = 1080;

    /**
     * Extra headers for browser context.
     */
    private Map<String, String> extraHeaders = Map.of(
        "Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,image/webp,image/apng,*/*;q=0.8",
        "Accept-Encoding", "gzip, deflate, br",
        "Sec-Fetch-Dest", "document",
        "Sec-Fetch-Mode", "navigate",
        "Sec-Fetch-Site", "none",
        "Sec-Fetch-User", "?1",
        "Upgrade-Insecure-Requests", "1"
    );

    /**
     * Proxy server, for example http://proxy:8080.
     */
    private String proxyServer = "";

    /**
     * Proxy username.
     */
    private String proxyUsername = "";

    /**
     * Proxy password.
     */
    private String proxyPassword = "";

    /**
     * Browser channel, e.g. chrome, msedge.
     */
    private String browserChannel = "";

    /**
     * Browser executable path.
     */
    private String executablePath = "";

    /**
     * Extra launch args for browser.
     */
    private List<String> launchArgs = List.of();

    /**
     * Ignore default args for browser launch.
     */
    private List<String> ignoreDefaultArgs = List.of("--enable-automation");

    /**
     * Whether to enable stealth script.
     */
    private boolean stealthEnabled = true;

    /**
     * Optional stealth script, empty builds one from the engine and accept language.
     */
    private String stealthScript = "";

    public String resolveStealthScript() {
        if (!stealthEnabled) {
            return "";
        }
        if (StringUtils.hasText(stealthScript)) {
            return stealthScript;
        }
        return BrowserStealthSupport.defaultScript(this);
    }

}
