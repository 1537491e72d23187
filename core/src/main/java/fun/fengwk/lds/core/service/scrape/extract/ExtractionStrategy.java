package fun.fengwk.lds.core.service.scrape.extract;

import fun.fengwk.lds.core.service.scrape.model.RawRecord;
import org.jsoup.nodes.Document;

import java.util.List;

/**
 * One way of pulling listing entries out of a rendered page.
 *
 * <p>Implementations never throw, any internal failure yields an empty list.
 *
 * @author fengwk
 */
public interface ExtractionStrategy {

    /**
     * Label recorded as the run extraction method when this strategy wins.
     */
    String label();

    List<RawRecord> extract(Document document);

}
