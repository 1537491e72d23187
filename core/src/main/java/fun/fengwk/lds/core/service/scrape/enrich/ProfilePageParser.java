package fun.fengwk.lds.core.service.scrape.enrich;

import fun.fengwk.lds.core.service.scrape.model.EnrichmentOverlay;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses extra fields out of a lawyer detail page.
 *
 * @author fengwk
 */
@Component
public class ProfilePageParser {

    static final List<String> BIO_SELECTORS = List.of(
        "[data-testid=\"bio\"]", ".lawyer-bio", ".bio-text", ".profile-bio"
    );

    static final List<String> EDUCATION_SELECTORS = List.of(
        "[data-testid=\"education\"] li", ".education-item", ".school-item", "[class*=\"education\"] li"
    );

    static final List<String> AWARD_SELECTORS = List.of(
        "[data-testid=\"awards\"] li", ".award-item", "[class*=\"award\"] li"
    );

    public EnrichmentOverlay parse(Document document) {
        return EnrichmentOverlay.builder()
            .bio(firstText(document, BIO_SELECTORS))
            .education(firstList(document, EDUCATION_SELECTORS))
            .awards(firstList(document, AWARD_SELECTORS))
            .build();
    }

    private String firstText(Document document, List<String> selectors) {
        for (String selector : selectors) {
            Element element = document.selectFirst(selector);
            if (element != null) {
                String text = element.text().trim();
                if (!text.isEmpty()) {
                    return text;
                }
            }
        }
        return "";
    }

    private List<String> firstList(Document document, List<String> selectors) {
        for (String selector : selectors) {
            List<String> values = new ArrayList<>();
            for (Element element : document.select(selector)) {
                String text = element.text().trim();
                if (!text.isEmpty()) {
                    values.add(text);
                }
            }
            if (!values.isEmpty()) {
                return values;
            }
        }
        return List.of();
    }

}
