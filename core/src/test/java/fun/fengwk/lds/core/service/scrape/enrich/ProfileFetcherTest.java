package fun.fengwk.lds.core.service.scrape.enrich;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import fun.fengwk.lds.core.service.browser.BrowserProperties;
import fun.fengwk.lds.core.service.scrape.EnrichmentProperties;
import fun.fengwk.lds.core.service.scrape.model.EnrichmentOverlay;
import fun.fengwk.lds.core.service.scrape.model.SessionContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * ProfileFetcher tests.
 *
 * @author fengwk
 */
class ProfileFetcherTest {

    private HttpServer server;

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    @Test
    void shouldParseProfileAndForwardSessionHeaders() throws Exception {
        AtomicReference<String> cookieRef = new AtomicReference<>();
        AtomicReference<String> userAgentRef = new AtomicReference<>();
        server = startServer(exchange -> {
            cookieRef.set(exchange.getRequestHeaders().getFirst("Cookie"));
            userAgentRef.set(exchange.getRequestHeaders().getFirst("User-Agent"));
            writeHtml(exchange, 200, """
                <html><head><title>Jane Roe - Lawyer</title></head><body>
                <div class="lawyer-bio">Jane focuses on injury cases.</div>
                <ul data-testid="education"><li>Stanford Law School</li><li>UCLA</li></ul>
                <ul><li class="award-item">Client's Choice 2024</li></ul>
                </body></html>
                """);
        });

        EnrichmentOverlay overlay = newFetcher().fetch(
            baseUrl(server) + "/attorneys/jane.html",
            new SessionContext("cf_clearance=abc; session=xyz", "TestAgent/1.0")
        );

        assertThat(overlay).isNotNull();
        assertThat(overlay.isBlocked()).isFalse();
        assertThat(overlay.getBio()).isEqualTo("Jane focuses on injury cases.");
        assertThat(overlay.getEducation()).containsExactly("Stanford Law School", "UCLA");
        assertThat(overlay.getAwards()).containsExactly("Client's Choice 2024");
        assertThat(cookieRef.get()).isEqualTo("cf_clearance=abc; session=xyz");
        assertThat(userAgentRef.get()).isEqualTo("TestAgent/1.0");
    }

    @Test
    void shouldFallBackToConfiguredUserAgent() throws Exception {
        AtomicReference<String> userAgentRef = new AtomicReference<>();
        AtomicReference<String> cookieRef = new AtomicReference<>();
        server = startServer(exchange -> {
            userAgentRef.set(exchange.getRequestHeaders().getFirst("User-Agent"));
            cookieRef.set(exchange.getRequestHeaders().getFirst("Cookie"));
            writeHtml(exchange, 200, "<html><head><title>ok</title></head></html>");
        });

        newFetcher().fetch(baseUrl(server) + "/p", SessionContext.empty());

        assertThat(userAgentRef.get()).isEqualTo(new EnrichmentProperties().getFallbackUserAgent());
        assertThat(cookieRef.get()).isNull();
    }

    @Test
    void shouldReportBlockedOnForbiddenAndUnavailable() throws Exception {
        AtomicInteger status = new AtomicInteger(403);
        server = startServer(exchange -> writeHtml(exchange, status.get(), "blocked"));
        ProfileFetcher fetcher = newFetcher();

        EnrichmentOverlay forbidden = fetcher.fetch(baseUrl(server) + "/p", SessionContext.empty());
        status.set(503);
        EnrichmentOverlay unavailable = fetcher.fetch(baseUrl(server) + "/p", SessionContext.empty());

        assertThat(forbidden.isBlocked()).isTrue();
        assertThat(unavailable.isBlocked()).isTrue();
    }

    @Test
    void shouldReportBlockedOnChallengeTitle() throws Exception {
        server = startServer(exchange -> writeHtml(exchange, 200,
            "<html><head><title>Just a moment...</title></head><body>cf</body></html>"));

        EnrichmentOverlay overlay = newFetcher().fetch(baseUrl(server) + "/p", SessionContext.empty());

        assertThat(overlay.isBlocked()).isTrue();
    }

    @Test
    void shouldReturnNullOnOtherStatus() throws Exception {
        AtomicInteger hits = new AtomicInteger();
        server = startServer(exchange -> {
            hits.incrementAndGet();
            writeHtml(exchange, 404, "missing");
        });

        EnrichmentOverlay overlay = newFetcher().fetch(baseUrl(server) + "/p", SessionContext.empty());

        assertThat(overlay).isNull();
        assertThat(hits.get()).isEqualTo(1);
    }

    @Test
    void shouldRetryOnceAfterFetchFailure() throws Exception {
        AtomicInteger hits = new AtomicInteger();
        server = startServer(exchange -> {
            if (hits.incrementAndGet() == 1) {
                exchange.close();
                return;
            }
            writeHtml(exchange, 200, "<html><body><div class=\"profile-bio\">Retried bio</div></body></html>");
        });

        EnrichmentOverlay overlay = newFetcher().fetch(baseUrl(server) + "/p", SessionContext.empty());

        assertThat(hits.get()).isGreaterThanOrEqualTo(2);
        assertThat(overlay).isNotNull();
        assertThat(overlay.getBio()).isEqualTo("Retried bio");
    }

    @Test
    void shouldReturnNullForBlankUrl() {
        assertThat(newFetcher().fetch(" ", SessionContext.empty())).isNull();
    }

    private ProfileFetcher newFetcher() {
        EnrichmentProperties properties = new EnrichmentProperties();
        properties.setTimeoutMs(2000);
        return new ProfileFetcher(properties, new ProfilePageParser(), new BrowserProperties());
    }

    private HttpServer startServer(HttpHandler handler) throws IOException {
        HttpServer httpServer = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        httpServer.createContext("/", handler);
        httpServer.start();
        return httpServer;
    }

    private String baseUrl(HttpServer httpServer) {
        return "http://127.0.0.1:" + httpServer.getAddress().getPort();
    }

    private void writeHtml(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "text/html; charset=utf-8");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

}
