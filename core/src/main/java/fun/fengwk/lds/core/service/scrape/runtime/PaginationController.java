package fun.fengwk.lds.core.service.scrape.runtime;

import fun.fengwk.lds.core.service.scrape.model.RunBudget;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Finds the next listing page and decides whether the run keeps going.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class PaginationController {

    static final String NEXT_SELECTOR = "a[rel=\"next\"], .next-page, [class*=\"next\"]";

    public Optional<String> nextPage(Document document) {
        Element next = document.selectFirst(NEXT_SELECTOR);
        if (next == null) {
            log.info("no more pages found, url={}", document.location());
            return Optional.empty();
        }
        // Only the class list marks a control as disabled.
        if (next.hasClass("disabled")) {
            log.info("next page control is disabled, url={}", document.location());
            return Optional.empty();
        }
        String href = next.absUrl("href");
        if (!href.startsWith("http")) {
            log.debug("next page control has no usable link, url={}", document.location());
            return Optional.empty();
        }
        return Optional.of(href);
    }

    public boolean shouldContinue(RunBudget budget) {
        return !budget.isRecordBudgetExhausted() && !budget.isPageBudgetExhausted();
    }

}
