package fun.fengwk.lds.core.service.scrape.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One extraction strategy output.
 *
 * @author fengwk
 */
public record RawRecord(SourceShape shape, JsonNode payload) {
}
