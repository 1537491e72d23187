package fun.fengwk.lds.core.service.scrape.model;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Run-scoped counters shared by all listing pages.
 *
 * @author fengwk
 */
public class RunBudget {

    private final ReentrantLock lock = new ReentrantLock();
    private final int maxRecords;
    private final int maxPages;
    private final Instant startedAt;

    private int emitted;
    private int pagesProcessed;
    private int blockedProfiles;
    private String methodLabel = ExtractionResult.NONE;

    public RunBudget(int maxRecords, int maxPages) {
        this(maxRecords, maxPages, Instant.now());
    }

    public RunBudget(int maxRecords, int maxPages, Instant startedAt) {
        this.maxRecords = Math.max(0, maxRecords);
        this.maxPages = Math.max(1, maxPages);
        this.startedAt = startedAt;
    }

    /**
     * Reserve up to {@code requested} record slots.
     *
     * @param requested record count the caller wants to emit
     * @return granted count, never more than the remaining record budget
     */
    public int claim(int requested) {
        if (requested <= 0) {
            return 0;
        }
        lock.lock();
        try {
            int granted = maxRecords == 0 ? requested : Math.min(requested, Math.max(0, maxRecords - emitted));
            emitted += granted;
            return granted;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Return slots granted by {@link #claim(int)} whose records were never written.
     */
    public void release(int count) {
        if (count <= 0) {
            return;
        }
        lock.lock();
        try {
            emitted = Math.max(0, emitted - count);
        } finally {
            lock.unlock();
        }
    }

    public int startPage() {
        lock.lock();
        try {
            return ++pagesProcessed;
        } finally {
            lock.unlock();
        }
    }

    public void addBlocked(int count) {
        if (count <= 0) {
            return;
        }
        lock.lock();
        try {
            blockedProfiles += count;
        } finally {
            lock.unlock();
        }
    }

    public void recordMethod(String label) {
        if (label == null || ExtractionResult.NONE.equals(label)) {
            return;
        }
        lock.lock();
        try {
            methodLabel = label;
        } finally {
            lock.unlock();
        }
    }

    public boolean isRecordBudgetExhausted() {
        lock.lock();
        try {
            return maxRecords > 0 && emitted >= maxRecords;
        } finally {
            lock.unlock();
        }
    }

    public boolean isPageBudgetExhausted() {
        lock.lock();
        try {
            return pagesProcessed >= maxPages;
        } finally {
            lock.unlock();
        }
    }

    public int getEmitted() {
        lock.lock();
        try {
            return emitted;
        } finally {
            lock.unlock();
        }
    }

    public int getPagesProcessed() {
        lock.lock();
        try {
            return pagesProcessed;
        } finally {
            lock.unlock();
        }
    }

    public int getBlockedProfiles() {
        lock.lock();
        try {
            return blockedProfiles;
        } finally {
            lock.unlock();
        }
    }

    public String getMethodLabel() {
        lock.lock();
        try {
            return methodLabel;
        } finally {
            lock.unlock();
        }
    }

    public int getMaxRecords() {
        return maxRecords;
    }

    public int getMaxPages() {
        return maxPages;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public RunSummary toSummary(Instant finishedAt) {
        lock.lock();
        try {
            long durationMs = Math.max(0L, Duration.between(startedAt, finishedAt).toMillis());
            return RunSummary.builder()
                .totalLawyersScraped(emitted)
                .pagesProcessed(pagesProcessed)
                .extractionMethod(methodLabel)
                .blockedProfiles(blockedProfiles)
                .duration(Math.round(durationMs / 1000.0) + " seconds")
                .durationMs(durationMs)
                .timestamp(finishedAt.toString())
                .build();
        } finally {
            lock.unlock();
        }
    }

}
