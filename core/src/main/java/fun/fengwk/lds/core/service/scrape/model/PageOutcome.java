package fun.fengwk.lds.core.service.scrape.model;

import lombok.Builder;
import lombok.Data;

/**
 * Result of processing one listing page.
 *
 * @author fengwk
 */
@Data
@Builder
public class PageOutcome {

    private String url;
    private ChallengeState challengeState;
    private String methodLabel;
    private int extractedCount;
    private int emittedCount;
    private int blockedCount;

    /**
     * Next listing url, null when pagination stops at this page.
     */
    private String nextPageUrl;

    /**
     * Stage at which processing failed, null when the page completed.
     */
    private String failedStage;

}
