package fun.fengwk.lds.core.service.scrape.runtime;

import fun.fengwk.lds.core.service.scrape.model.DiagnosticSnapshot;
import fun.fengwk.lds.core.storage.RunStorage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Persists a debug snapshot of a page that yielded no records.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DiagnosticRecorder {

    public static final String DEBUG_PAGE_KEY = "DEBUG_PAGE";

    private final RunStorage runStorage;

    public void record(String url, String reason, String html) {
        try {
            String content = html == null ? "" : html;
            DiagnosticSnapshot snapshot = analyze(url, reason, content);
            log.warn("debug page structure, url={}, reason={}, title={}, articleCount={}, lawyerClassCount={}, "
                    + "dataTestIdCount={}, hasChallengeMarkers={}",
                url, reason, snapshot.getTitle(), snapshot.getArticleCount(), snapshot.getLawyerClassCount(),
                snapshot.getDataTestIdCount(), snapshot.isHasChallengeMarkers());
            runStorage.setValue(DEBUG_PAGE_KEY, snapshot);
            log.info("saved debug page snapshot, key={}, url={}", DEBUG_PAGE_KEY, url);
        } catch (Exception ex) {
            log.warn("failed to save debug info, url={}, error={}", url, ex.getMessage());
        }
    }

    DiagnosticSnapshot analyze(String url, String reason, String html) {
        Document document = Jsoup.parse(html, url == null ? "" : url);
        return DiagnosticSnapshot.builder()
            .url(url)
            .reason(reason)
            .title(document.title())
            .articleCount(document.select("article").size())
            .lawyerClassCount(document.select("[class*=\"lawyer\"]").size())
            .dataTestIdCount(document.select("[data-testid]").size())
            .hasChallengeMarkers(html.contains("Just a moment") || html.contains("cf-browser"))
            .timestamp(Instant.now().toString())
            .html(html)
            .build();
    }

}
