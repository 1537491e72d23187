package fun.fengwk.lds.core.service.scrape.enrich;

import fun.fengwk.lds.core.service.scrape.EnrichmentProperties;
import fun.fengwk.lds.core.service.scrape.model.EnrichmentOverlay;
import fun.fengwk.lds.core.service.scrape.model.EnrichmentResult;
import fun.fengwk.lds.core.service.scrape.model.LawyerRecord;
import fun.fengwk.lds.core.service.scrape.model.SessionContext;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Enriches records from their detail pages in fixed-size concurrent batches.
 *
 * <p>Batches run one after another with a fixed pause in between; output keeps input order.
 * Blocked or failed fetches leave the record untouched and never fail the caller.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class ProfileEnricher {

    private final ProfileFetcher profileFetcher;
    private final EnrichmentProperties enrichmentProperties;
    private final ExecutorService executor;

    public ProfileEnricher(ProfileFetcher profileFetcher, EnrichmentProperties enrichmentProperties) {
        this.profileFetcher = profileFetcher;
        this.enrichmentProperties = enrichmentProperties;
        AtomicInteger threadIdGen = new AtomicInteger(1);
        this.executor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "lds-profile-fetch-" + threadIdGen.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        });
    }

    public EnrichmentResult enrich(List<LawyerRecord> records, SessionContext session, int concurrencyLimit) {
        if (records == null || records.isEmpty()) {
            return new EnrichmentResult(List.of(), 0);
        }
        int batchSize = Math.max(1, concurrencyLimit);
        log.info("fetching full profiles, count={}, batchSize={}", records.size(), batchSize);

        List<LawyerRecord> enriched = new ArrayList<>(records.size());
        int blocked = 0;
        for (int start = 0; start < records.size(); start += batchSize) {
            int end = Math.min(start + batchSize, records.size());
            List<CompletableFuture<EnrichedRecord>> futures = new ArrayList<>(end - start);
            for (LawyerRecord record : records.subList(start, end)) {
                futures.add(CompletableFuture.supplyAsync(() -> enrichOne(record, session), executor));
            }
            for (int i = 0; i < futures.size(); i++) {
                EnrichedRecord result = joinOrKeep(futures.get(i), records.get(start + i));
                enriched.add(result.record());
                if (result.blocked()) {
                    blocked++;
                }
            }
            log.info("enriched profiles, progress={}/{}", end, records.size());
            if (end < records.size()) {
                pauseBetweenBatches();
            }
        }

        if (blocked > 0) {
            log.warn("profile pages were blocked, using basic info instead, blocked={}", blocked);
        }
        return new EnrichmentResult(enriched, blocked);
    }

    private EnrichedRecord enrichOne(LawyerRecord record, SessionContext session) {
        if (!StringUtils.hasText(record.getProfileUrl())) {
            return new EnrichedRecord(record, false);
        }
        EnrichmentOverlay overlay = profileFetcher.fetch(record.getProfileUrl(), session);
        if (overlay == null) {
            return new EnrichedRecord(record, false);
        }
        if (overlay.isBlocked()) {
            log.warn("profile page blocked, url={}", record.getProfileUrl());
            return new EnrichedRecord(record, true);
        }
        return new EnrichedRecord(merge(record, overlay), false);
    }

    static LawyerRecord merge(LawyerRecord record, EnrichmentOverlay overlay) {
        String bio = StringUtils.hasText(record.getBio()) ? record.getBio() : nullToEmpty(overlay.getBio());
        return record.toBuilder()
            .bio(bio)
            .education(overlay.getEducation() == null ? List.of() : List.copyOf(overlay.getEducation()))
            .awards(overlay.getAwards() == null ? List.of() : List.copyOf(overlay.getAwards()))
            .build();
    }

    private EnrichedRecord joinOrKeep(CompletableFuture<EnrichedRecord> future, LawyerRecord original) {
        try {
            return future.join();
        } catch (Exception ex) {
            log.warn("profile enrichment failed, url={}, error={}", original.getProfileUrl(), ex.getMessage());
            return new EnrichedRecord(original, false);
        }
    }

    private void pauseBetweenBatches() {
        long pauseMs = enrichmentProperties.getBatchPauseMs();
        if (pauseMs <= 0) {
            return;
        }
        try {
            Thread.sleep(pauseMs);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.debug("batch pause interrupted");
        }
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }

    private record EnrichedRecord(LawyerRecord record, boolean blocked) {
    }

}
