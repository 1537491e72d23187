package fun.fengwk.lds.core.service.browser.runtime;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.options.Proxy;
import fun.fengwk.lds.core.service.browser.BrowserProperties;
import fun.fengwk.lds.core.service.browser.BrowserStealthSupport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

import java.nio.file.Paths;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Worker-owned Playwright browser. Each task gets a fresh context and page.
 *
 * @author fengwk
 */
@Slf4j
class PlaywrightBrowserSession implements BrowserWorkerManager.BrowserSession {

    private final BrowserProperties browserProperties;
    private final Playwright playwright;
    private final Browser browser;

    PlaywrightBrowserSession(BrowserProperties browserProperties) {
        this.browserProperties = browserProperties;
        this.playwright = Playwright.create();
        try {
            this.browser = selectBrowserType().launch(buildLaunchOptions());
        } catch (RuntimeException ex) {
            playwright.close();
            throw ex;
        }
    }

    @Override
    public <T> T run(int workerId, BrowserTask<T> task) throws Exception {
        String userAgent = resolveUserAgent();
        try (BrowserContext context = browser.newContext(buildContextOptions(userAgent))) {
            BrowserStealthSupport.apply(context, browserProperties);
            Page page = context.newPage();
            BrowserRuntimeContext runtimeContext = BrowserRuntimeContext.builder()
                .workerId(workerId)
                .userAgent(userAgent)
                .browserContext(context)
                .page(page)
                .build();
            return task.execute(runtimeContext);
        }
    }

    @Override
    public void close() {
        try {
            browser.close();
        } finally {
            playwright.close();
        }
    }

    private BrowserType selectBrowserType() {
        String type = browserProperties.getBrowserType();
        if ("firefox".equalsIgnoreCase(type)) {
            return playwright.firefox();
        }
        if ("webkit".equalsIgnoreCase(type)) {
            return playwright.webkit();
        }
        return playwright.chromium();
    }

    private BrowserType.LaunchOptions buildLaunchOptions() {
        BrowserType.LaunchOptions options = new BrowserType.LaunchOptions()
            .setHeadless(browserProperties.isHeadless());

        if (browserProperties.getIgnoreDefaultArgs() != null
            && !browserProperties.getIgnoreDefaultArgs().isEmpty()) {
            options.setIgnoreDefaultArgs(browserProperties.getIgnoreDefaultArgs());
        }
        if (browserProperties.getLaunchArgs() != null && !browserProperties.getLaunchArgs().isEmpty()) {
            options.setArgs(browserProperties.getLaunchArgs());
        }
        if (StringUtils.hasText(browserProperties.getBrowserChannel())) {
            options.setChannel(browserProperties.getBrowserChannel());
        }
        if (StringUtils.hasText(browserProperties.getExecutablePath())) {
            options.setExecutablePath(Paths.get(browserProperties.getExecutablePath()));
        }
        if (StringUtils.hasText(browserProperties.getProxyServer())) {
            Proxy proxy = new Proxy(browserProperties.getProxyServer());
            if (StringUtils.hasText(browserProperties.getProxyUsername())) {
                proxy.setUsername(browserProperties.getProxyUsername());
            }
            if (StringUtils.hasText(browserProperties.getProxyPassword())) {
                proxy.setPassword(browserProperties.getProxyPassword());
            }
            options.setProxy(proxy);
        }
        return options;
    }

    private Browser.NewContextOptions buildContextOptions(String userAgent) {
        Browser.NewContextOptions options = new Browser.NewContextOptions();
        if (StringUtils.hasText(userAgent)) {
            options.setUserAgent(userAgent);
        }
        if (StringUtils.hasText(browserProperties.getLocale())) {
            options.setLocale(browserProperties.getLocale());
        }
        if (StringUtils.hasText(browserProperties.getTimezoneId())) {
            options.setTimezoneId(browserProperties.getTimezoneId());
        }
        if (browserProperties.getViewportWidth() > 0 && browserProperties.getViewportHeight() > 0) {
            options.setViewportSize(browserProperties.getViewportWidth(), browserProperties.getViewportHeight());
        }

        Map<String, String> headers = new HashMap<>();
        if (browserProperties.getExtraHeaders() != null) {
            browserProperties.getExtraHeaders().forEach((key, value) -> {
                if (StringUtils.hasText(key) && StringUtils.hasText(value)) {
                    headers.put(key, value);
                }
            });
        }
        if (StringUtils.hasText(browserProperties.getAcceptLanguage())) {
            headers.putIfAbsent("Accept-Language", browserProperties.getAcceptLanguage());
        }
        if (!headers.isEmpty()) {
            options.setExtraHTTPHeaders(headers);
        }
        return options;
    }

    private String resolveUserAgent() {
        if (StringUtils.hasText(browserProperties.getUserAgent())) {
            return browserProperties.getUserAgent();
        }
        List<String> userAgents = browserProperties.getUserAgents();
        if (userAgents == null || userAgents.isEmpty()) {
            return "";
        }
        return userAgents.get(ThreadLocalRandom.current().nextInt(userAgents.size()));
    }

}
