package fun.fengwk.lds.core.service.scrape.model;

import lombok.Builder;
import lombok.Data;

/**
 * Run statistics persisted under the statistics key.
 *
 * @author fengwk
 */
@Data
@Builder
public class RunSummary {

    private int totalLawyersScraped;
    private int pagesProcessed;
    private String extractionMethod;
    private int blockedProfiles;

    /**
     * Human readable duration, e.g. {@code 42 seconds}.
     */
    private String duration;

    private long durationMs;
    private String timestamp;

}
