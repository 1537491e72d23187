package fun.fengwk.lds.core.service.scrape.model;

import java.util.List;

/**
 * Enriched records in input order and the number of blocked detail pages.
 *
 * @author fengwk
 */
public record EnrichmentResult(List<LawyerRecord> records, int blockedCount) {
}
