package fun.fengwk.lds.core.service.scrape.model;

import java.util.List;

/**
 * Raw records produced by the winning strategy with its label.
 *
 * @author fengwk
 */
public record ExtractionResult(List<RawRecord> records, String methodLabel) {

    public static final String NONE = "None";

    public static ExtractionResult empty() {
        return new ExtractionResult(List.of(), NONE);
    }

    public boolean isEmpty() {
        return records == null || records.isEmpty();
    }

}
