package fun.fengwk.lds.core.service.scrape.impl;

import fun.fengwk.lds.core.service.browser.runtime.BrowserWorkerManager;
import fun.fengwk.lds.core.service.scrape.DirectoryScrapeService;
import fun.fengwk.lds.core.service.scrape.EnrichmentProperties;
import fun.fengwk.lds.core.service.scrape.ScraperProperties;
import fun.fengwk.lds.core.service.scrape.challenge.ChallengeSolver;
import fun.fengwk.lds.core.service.scrape.enrich.ProfileEnricher;
import fun.fengwk.lds.core.service.scrape.extract.ExtractionPipeline;
import fun.fengwk.lds.core.service.scrape.extract.RecordNormalizer;
import fun.fengwk.lds.core.service.scrape.model.PageOutcome;
import fun.fengwk.lds.core.service.scrape.model.RunBudget;
import fun.fengwk.lds.core.service.scrape.model.RunSummary;
import fun.fengwk.lds.core.service.scrape.runtime.Deduplicator;
import fun.fengwk.lds.core.service.scrape.runtime.DiagnosticRecorder;
import fun.fengwk.lds.core.service.scrape.runtime.ListingPageTask;
import fun.fengwk.lds.core.service.scrape.runtime.ListingRequestQueue;
import fun.fengwk.lds.core.service.scrape.runtime.PaginationController;
import fun.fengwk.lds.core.service.scrape.support.RunStartUrlResolver;
import fun.fengwk.lds.core.storage.RunStorage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives listing pages through the browser worker pool until the queue drains or the budget is spent.
 *
 * @author fengwk
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RunOrchestrator implements DirectoryScrapeService {

    public static final String STATISTICS_KEY = "statistics";

    static final String STAGE_DISPATCH = "dispatch";

    private final ScraperProperties scraperProperties;
    private final EnrichmentProperties enrichmentProperties;
    private final RunStartUrlResolver runStartUrlResolver;
    private final BrowserWorkerManager browserWorkerManager;
    private final ChallengeSolver challengeSolver;
    private final ExtractionPipeline extractionPipeline;
    private final RecordNormalizer recordNormalizer;
    private final ProfileEnricher profileEnricher;
    private final PaginationController paginationController;
    private final DiagnosticRecorder diagnosticRecorder;
    private final RunStorage runStorage;

    @Override
    public RunSummary scrape() {
        String startUrl = runStartUrlResolver.resolve(scraperProperties);
        log.info("starting lawyer directory scrape, startUrl={}, practiceArea={}, state={}, city={}, maxLawyers={}, "
                + "includeContactInfo={}",
            startUrl, scraperProperties.getPracticeArea(), scraperProperties.getState(), scraperProperties.getCity(),
            scraperProperties.getMaxLawyers(), scraperProperties.isIncludeContactInfo());

        RunBudget runBudget = new RunBudget(scraperProperties.getMaxLawyers(), scraperProperties.getMaxRequestsPerCrawl());
        Deduplicator deduplicator = new Deduplicator();
        ListingRequestQueue requestQueue = new ListingRequestQueue(scraperProperties.getMaxRequestsPerCrawl());
        requestQueue.enqueue(startUrl);

        int parallelism = Math.max(1, scraperProperties.getMaxConcurrency());
        ExecutorService dispatcher = newDispatcher(parallelism);
        try {
            crawl(requestQueue, runBudget, deduplicator, dispatcher, parallelism);
        } catch (RuntimeException ex) {
            log.error("lawyer directory scrape failed, startUrl={}", startUrl, ex);
            throw ex;
        } finally {
            dispatcher.shutdownNow();
        }

        RunSummary summary = runBudget.toSummary(Instant.now());
        runStorage.setValue(STATISTICS_KEY, summary);
        log.info("scraping completed, totalLawyersScraped={}, pagesProcessed={}, extractionMethod={}, "
                + "blockedProfiles={}, duration={}",
            summary.getTotalLawyersScraped(), summary.getPagesProcessed(), summary.getExtractionMethod(),
            summary.getBlockedProfiles(), summary.getDuration());
        if (summary.getTotalLawyersScraped() == 0) {
            log.warn("no lawyers were scraped, please check your search parameters, startUrl={}", startUrl);
        }
        if (summary.getBlockedProfiles() > 0) {
            log.warn("profile pages were blocked during the run, blocked={}", summary.getBlockedProfiles());
        }
        return summary;
    }

    private void crawl(ListingRequestQueue requestQueue, RunBudget runBudget, Deduplicator deduplicator,
                       ExecutorService dispatcher, int parallelism) {
        CompletionService<PageOutcome> completionService = new ExecutorCompletionService<>(dispatcher);
        int inFlight = 0;
        try {
            while (true) {
                while (inFlight < parallelism && !requestQueue.isEmpty() && paginationController.shouldContinue(runBudget)) {
                    String url = requestQueue.poll();
                    ListingPageTask task = newPageTask(url, runBudget, deduplicator);
                    completionService.submit(() -> executePage(task, url));
                    inFlight++;
                }
                if (inFlight == 0) {
                    return;
                }
                PageOutcome outcome = completionService.take().get();
                inFlight--;
                if (outcome.getNextPageUrl() != null && paginationController.shouldContinue(runBudget)) {
                    requestQueue.enqueue(outcome.getNextPageUrl());
                }
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("lawyer directory scrape interrupted", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            throw new IllegalStateException("page dispatch failed: " + cause.getMessage(), cause);
        }
    }

    private PageOutcome executePage(ListingPageTask task, String url) {
        try {
            return browserWorkerManager.execute(task);
        } catch (IllegalStateException ex) {
            log.error("page task failed, stage={}, url={}, error={}", STAGE_DISPATCH, url, ex.getMessage());
            return PageOutcome.builder().url(url).failedStage(STAGE_DISPATCH).build();
        }
    }

    private ListingPageTask newPageTask(String url, RunBudget runBudget, Deduplicator deduplicator) {
        return ListingPageTask.builder()
            .url(url)
            .scraperProperties(scraperProperties)
            .enrichmentProperties(enrichmentProperties)
            .challengeSolver(challengeSolver)
            .extractionPipeline(extractionPipeline)
            .recordNormalizer(recordNormalizer)
            .deduplicator(deduplicator)
            .runBudget(runBudget)
            .profileEnricher(profileEnricher)
            .paginationController(paginationController)
            .diagnosticRecorder(diagnosticRecorder)
            .runStorage(runStorage)
            .build();
    }

    private ExecutorService newDispatcher(int parallelism) {
        AtomicInteger threadIdGen = new AtomicInteger(1);
        return Executors.newFixedThreadPool(parallelism, runnable -> {
            Thread thread = new Thread(runnable, "lds-page-dispatch-" + threadIdGen.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        });
    }

}
