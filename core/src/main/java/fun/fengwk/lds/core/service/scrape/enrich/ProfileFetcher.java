package fun.fengwk.lds.core.service.scrape.enrich;

import fun.fengwk.lds.core.service.browser.BrowserProperties;
import fun.fengwk.lds.core.service.scrape.EnrichmentProperties;
import fun.fengwk.lds.core.service.scrape.challenge.ChallengeSolver;
import fun.fengwk.lds.core.service.scrape.model.EnrichmentOverlay;
import fun.fengwk.lds.core.service.scrape.model.SessionContext;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.net.Authenticator;
import java.net.InetSocketAddress;
import java.net.PasswordAuthentication;
import java.net.ProxySelector;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Fetches a lawyer detail page over plain HTTP, reusing the listing browser session.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class ProfileFetcher {

    private final EnrichmentProperties enrichmentProperties;
    private final ProfilePageParser profilePageParser;
    private final HttpClient httpClient;

    @Autowired
    public ProfileFetcher(EnrichmentProperties enrichmentProperties,
                          ProfilePageParser profilePageParser,
                          BrowserProperties browserProperties) {
        this(enrichmentProperties, profilePageParser, buildHttpClient(enrichmentProperties, browserProperties));
    }

    ProfileFetcher(EnrichmentProperties enrichmentProperties, ProfilePageParser profilePageParser, HttpClient httpClient) {
        this.enrichmentProperties = enrichmentProperties;
        this.profilePageParser = profilePageParser;
        this.httpClient = httpClient;
    }

    /**
     * Fetch and parse one detail page.
     *
     * @return parsed overlay, {@link EnrichmentOverlay#blockedOverlay()} when the site blocked the request,
     *     or null when the page could not be fetched
     */
    public EnrichmentOverlay fetch(String profileUrl, SessionContext session) {
        HttpRequest request;
        try {
            request = buildRequest(profileUrl, session);
        } catch (Exception ex) {
            log.debug("build profile request failed, url={}, error={}", profileUrl, ex.getMessage());
            return null;
        }

        HttpResponse<String> response = sendWithRetry(request);
        if (response == null) {
            return null;
        }

        int statusCode = response.statusCode();
        if (statusCode == 403 || statusCode == 503) {
            log.debug("profile page blocked, status={}, url={}", statusCode, profileUrl);
            return EnrichmentOverlay.blockedOverlay();
        }
        if (statusCode != 200) {
            log.debug("profile page returned unexpected status, status={}, url={}", statusCode, profileUrl);
            return null;
        }

        Document document = Jsoup.parse(response.body() == null ? "" : response.body(), profileUrl);
        if (ChallengeSolver.hasTitleMarker(document.title())) {
            log.debug("profile page is a challenge interstitial, url={}", profileUrl);
            return EnrichmentOverlay.blockedOverlay();
        }
        return profilePageParser.parse(document);
    }

    private HttpResponse<String> sendWithRetry(HttpRequest request) {
        HttpResponse<String> response = trySend(request);
        if (response != null || Thread.currentThread().isInterrupted()) {
            return response;
        }
        log.debug("retry profile request, url={}", request.uri());
        return trySend(request);
    }

    private HttpResponse<String> trySend(HttpRequest request) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException ex) {
            log.debug("fetch profile page failed, url={}, error={}", request.uri(), ex.getMessage());
            return null;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.debug("fetch profile page interrupted, url={}", request.uri());
            return null;
        }
    }

    private HttpRequest buildRequest(String profileUrl, SessionContext session) {
        if (!StringUtils.hasText(profileUrl)) {
            throw new IllegalArgumentException("profileUrl is blank");
        }
        String userAgent = session != null && StringUtils.hasText(session.userAgent())
            ? session.userAgent()
            : enrichmentProperties.getFallbackUserAgent();

        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(profileUrl))
            .GET()
            .timeout(Duration.ofMillis(Math.max(1, enrichmentProperties.getTimeoutMs())))
            .header("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,image/webp,*/*;q=0.8")
            .header("Accept-Language", "en-US,en;q=0.9")
            .header("User-Agent", userAgent)
            .header("Sec-Fetch-Dest", "document")
            .header("Sec-Fetch-Mode", "navigate")
            .header("Sec-Fetch-Site", "same-origin");
        if (session != null && StringUtils.hasText(session.cookieHeader())) {
            builder.header("Cookie", session.cookieHeader());
        }
        return builder.build();
    }

    private static HttpClient buildHttpClient(EnrichmentProperties enrichmentProperties, BrowserProperties browserProperties) {
        HttpClient.Builder builder = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofMillis(Math.max(1, enrichmentProperties.getTimeoutMs())));
        if (StringUtils.hasText(browserProperties.getProxyServer())) {
            URI proxy = URI.create(browserProperties.getProxyServer());
            int port = proxy.getPort() > 0 ? proxy.getPort() : 80;
            builder.proxy(ProxySelector.of(new InetSocketAddress(proxy.getHost(), port)));
            if (StringUtils.hasText(browserProperties.getProxyUsername())) {
                String username = browserProperties.getProxyUsername();
                char[] password = browserProperties.getProxyPassword() == null
                    ? new char[0]
                    : browserProperties.getProxyPassword().toCharArray();
                builder.authenticator(new Authenticator() {
                    @Override
                    protected PasswordAuthentication getPasswordAuthentication() {
                        if (getRequestorType() != RequestorType.PROXY) {
                            return null;
                        }
                        return new PasswordAuthentication(username, password);
                    }
                });
            }
        }
        return builder.build();
    }

}
