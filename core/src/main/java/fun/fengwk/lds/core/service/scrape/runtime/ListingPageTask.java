package fun.fengwk.lds.core.service.scrape.runtime;

import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.options.Cookie;
import com.microsoft.playwright.options.LoadState;
import com.microsoft.playwright.options.WaitUntilState;
import fun.fengwk.lds.core.service.browser.runtime.BrowserRuntimeContext;
import fun.fengwk.lds.core.service.browser.runtime.BrowserTask;
import fun.fengwk.lds.core.service.scrape.EnrichmentProperties;
import fun.fengwk.lds.core.service.scrape.ScraperProperties;
import fun.fengwk.lds.core.service.scrape.challenge.ChallengeSolver;
import fun.fengwk.lds.core.service.scrape.enrich.ProfileEnricher;
import fun.fengwk.lds.core.service.scrape.extract.ExtractionPipeline;
import fun.fengwk.lds.core.service.scrape.extract.RecordNormalizer;
import fun.fengwk.lds.core.service.scrape.model.ChallengeState;
import fun.fengwk.lds.core.service.scrape.model.EnrichmentResult;
import fun.fengwk.lds.core.service.scrape.model.ExtractionResult;
import fun.fengwk.lds.core.service.scrape.model.LawyerRecord;
import fun.fengwk.lds.core.service.scrape.model.PageOutcome;
import fun.fengwk.lds.core.service.scrape.model.RunBudget;
import fun.fengwk.lds.core.service.scrape.model.SessionContext;
import fun.fengwk.lds.core.storage.RunStorage;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;

/**
 * Processes one listing page inside a browser worker.
 *
 * <p>Order: navigate, challenge gate, extract, normalize, dedup, budget claim, enrich, store, paginate.
 * Failures are contained to the page and reported through {@link PageOutcome#getFailedStage()}.
 *
 * @author fengwk
 */
@Slf4j
@Builder
public class ListingPageTask implements BrowserTask<PageOutcome> {

    static final String STAGE_NAVIGATE = "navigate";
    static final String STAGE_CHALLENGE = "challenge";
    static final String STAGE_EXTRACT = "extract";
    static final String STAGE_ENRICH = "enrich";
    static final String STAGE_STORE = "store";
    static final String STAGE_PAGINATE = "paginate";

    private static final String USER_AGENT_SCRIPT = "() => navigator.userAgent";

    private final String url;
    private final ScraperProperties scraperProperties;
    private final EnrichmentProperties enrichmentProperties;
    private final ChallengeSolver challengeSolver;
    private final ExtractionPipeline extractionPipeline;
    private final RecordNormalizer recordNormalizer;
    private final Deduplicator deduplicator;
    private final RunBudget runBudget;
    private final ProfileEnricher profileEnricher;
    private final PaginationController paginationController;
    private final DiagnosticRecorder diagnosticRecorder;
    private final RunStorage runStorage;

    @Override
    public PageOutcome execute(BrowserRuntimeContext context) {
        Page page = context.getPage();
        int pageNo = runBudget.startPage();
        log.info("processing page, page={}, url={}", pageNo, url);

        PageOutcome.PageOutcomeBuilder outcome = PageOutcome.builder().url(url).methodLabel(ExtractionResult.NONE);
        String stage = STAGE_NAVIGATE;
        int unsaved = 0;
        try {
            page.navigate(url, new Page.NavigateOptions()
                .setWaitUntil(WaitUntilState.DOMCONTENTLOADED)
                .setTimeout(scraperProperties.getNavigateTimeoutMs()));
            waitForNetworkIdleBestEffort(page);

            stage = STAGE_CHALLENGE;
            ChallengeState challengeState = challengeSolver.evaluate(page);
            outcome.challengeState(challengeState);
            if (challengeState == ChallengeState.FAILED) {
                diagnosticRecorder.record(url, "challenge-unresolved", safeContent(page));
                return outcome.build();
            }
            page.waitForTimeout(scraperProperties.getPostChallengeSettleMs());

            stage = STAGE_EXTRACT;
            String html = page.content();
            Document document = Jsoup.parse(html, resolveBaseUri(page));
            ExtractionResult extraction = extractionPipeline.extract(document);
            outcome.methodLabel(extraction.methodLabel()).extractedCount(extraction.records().size());
            if (extraction.isEmpty()) {
                log.warn("no lawyers found with any extraction method, saving debug info, url={}", url);
                diagnosticRecorder.record(url, "no-records", html);
                return outcome.build();
            }

            List<LawyerRecord> unique = deduplicator.filter(recordNormalizer.normalizeAll(extraction.records()));
            int granted = runBudget.claim(unique.size());
            unsaved = granted;
            List<LawyerRecord> toSave = new ArrayList<>(unique.subList(0, granted));

            if (!toSave.isEmpty() && scraperProperties.isIncludeContactInfo()) {
                stage = STAGE_ENRICH;
                log.info("enriching lawyers with full profiles, count={}, url={}", toSave.size(), url);
                EnrichmentResult enrichment = profileEnricher.enrich(
                    toSave, captureSession(context), enrichmentProperties.getConcurrency());
                toSave = enrichment.records();
                runBudget.addBlocked(enrichment.blockedCount());
                outcome.blockedCount(enrichment.blockedCount());
            }

            if (!toSave.isEmpty()) {
                stage = STAGE_STORE;
                runStorage.pushData(toSave);
                unsaved = 0;
                runBudget.recordMethod(extraction.methodLabel());
                log.info("saved lawyers, count={}, total={}, url={}", toSave.size(), runBudget.getEmitted(), url);
            }
            outcome.emittedCount(toSave.size());

            if (runBudget.isRecordBudgetExhausted()) {
                log.info("reached maximum lawyers limit, maxLawyers={}", runBudget.getMaxRecords());
                return outcome.build();
            }

            stage = STAGE_PAGINATE;
            paginationController.nextPage(document).ifPresent(next -> {
                log.info("found next page, next={}, url={}", next, url);
                outcome.nextPageUrl(next);
            });
            return outcome.build();
        } catch (Exception ex) {
            log.error("error processing page, stage={}, url={}, error={}", stage, url, ex.getMessage());
            if (unsaved > 0) {
                runBudget.release(unsaved);
            }
            return outcome.failedStage(stage).build();
        }
    }

    private void waitForNetworkIdleBestEffort(Page page) {
        try {
            page.waitForLoadState(
                LoadState.NETWORKIDLE,
                new Page.WaitForLoadStateOptions().setTimeout((double) scraperProperties.getNetworkIdleTimeoutMs())
            );
        } catch (PlaywrightException ex) {
            log.debug("network idle timeout, url={}", url);
        }
    }

    private SessionContext captureSession(BrowserRuntimeContext context) {
        String cookieHeader = "";
        String userAgent = context.getUserAgent();
        try {
            BrowserContext browserContext = context.getBrowserContext();
            if (browserContext != null) {
                StringJoiner joiner = new StringJoiner("; ");
                for (Cookie cookie : browserContext.cookies()) {
                    joiner.add(cookie.name + "=" + cookie.value);
                }
                cookieHeader = joiner.toString();
            }
            Object evaluated = context.getPage().evaluate(USER_AGENT_SCRIPT);
            if (evaluated != null && StringUtils.hasText(evaluated.toString())) {
                userAgent = evaluated.toString();
            }
        } catch (PlaywrightException ex) {
            log.debug("capture session failed, url={}, error={}", url, ex.getMessage());
        }
        return new SessionContext(cookieHeader, userAgent == null ? "" : userAgent);
    }

    private String resolveBaseUri(Page page) {
        try {
            String current = page.url();
            return StringUtils.hasText(current) ? current : url;
        } catch (PlaywrightException ex) {
            return url;
        }
    }

    private String safeContent(Page page) {
        try {
            return page.content();
        } catch (PlaywrightException ex) {
            log.debug("get page content failed, url={}, error={}", url, ex.getMessage());
            return "";
        }
    }

}
