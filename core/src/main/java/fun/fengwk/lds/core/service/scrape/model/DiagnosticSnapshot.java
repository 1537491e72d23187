package fun.fengwk.lds.core.service.scrape.model;

import lombok.Builder;
import lombok.Data;

/**
 * Debug snapshot of a page that produced no records.
 *
 * @author fengwk
 */
@Data
@Builder
public class DiagnosticSnapshot {

    private String url;
    private String reason;
    private String title;
    private int articleCount;
    private int lawyerClassCount;
    private int dataTestIdCount;
    private boolean hasChallengeMarkers;
    private String timestamp;
    private String html;

}
