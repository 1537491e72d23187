package fun.fengwk.lds.core.service.scrape.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Fields parsed from a detail page, or a blocked marker.
 *
 * @author fengwk
 */
@Data
@Builder
public class EnrichmentOverlay {

    private String bio;
    private List<String> education;
    private List<String> awards;
    private boolean blocked;

    public static EnrichmentOverlay blockedOverlay() {
        return EnrichmentOverlay.builder().blocked(true).build();
    }

}
