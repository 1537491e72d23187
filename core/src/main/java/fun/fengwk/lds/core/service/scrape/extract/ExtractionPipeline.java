package fun.fengwk.lds.core.service.scrape.extract;

import fun.fengwk.lds.core.service.scrape.model.ExtractionResult;
import fun.fengwk.lds.core.service.scrape.model.RawRecord;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Runs extraction strategies in order and stops at the first one that yields records.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class ExtractionPipeline {

    private final List<ExtractionStrategy> strategies;

    @Autowired
    public ExtractionPipeline(StructuredMetadataStrategy structuredMetadataStrategy,
                              EmbeddedScriptStrategy embeddedScriptStrategy,
                              DomCardStrategy domCardStrategy) {
        this(List.of(structuredMetadataStrategy, embeddedScriptStrategy, domCardStrategy));
    }

    ExtractionPipeline(List<ExtractionStrategy> strategies) {
        this.strategies = List.copyOf(strategies);
    }

    public ExtractionResult extract(Document document) {
        for (ExtractionStrategy strategy : strategies) {
            List<RawRecord> records;
            try {
                records = strategy.extract(document);
            } catch (Exception ex) {
                log.warn("extraction strategy failed, strategy={}, url={}, error={}",
                    strategy.label(), document.location(), ex.getMessage());
                continue;
            }
            if (records != null && !records.isEmpty()) {
                log.info("extraction strategy succeeded, strategy={}, count={}, url={}",
                    strategy.label(), records.size(), document.location());
                return new ExtractionResult(records, strategy.label());
            }
            log.debug("extraction strategy yielded nothing, strategy={}, url={}", strategy.label(), document.location());
        }
        return ExtractionResult.empty();
    }

}
