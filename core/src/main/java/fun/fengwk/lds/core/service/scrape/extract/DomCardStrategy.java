package fun.fengwk.lds.core.service.scrape.extract;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import fun.fengwk.lds.core.service.scrape.ScraperProperties;
import fun.fengwk.lds.core.service.scrape.model.RawRecord;
import fun.fengwk.lds.core.service.scrape.model.SourceShape;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Heuristic listing card parser, the last resort when no structured data is present.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class DomCardStrategy implements ExtractionStrategy {

    public static final String LABEL = "HTML Parsing";

    static final List<String> CARD_SELECTORS = List.of(
        "div[data-testid=\"lawyer-card\"]",
        ".lawyer-card",
        "[class*=\"lawyer\"][class*=\"card\"]",
        "article[data-lawyer-id]",
        ".search-result-lawyer",
        ".profile-card",
        "[data-lawyer-name]"
    );

    private final ObjectMapper objectMapper;
    private final List<CardFieldTable.FieldRule> rules;

    public DomCardStrategy(ObjectMapper objectMapper, ScraperProperties scraperProperties) {
        this.objectMapper = objectMapper;
        this.rules = CardFieldTable.rules(scraperProperties.getBaseUrl());
    }

    @Override
    public String label() {
        return LABEL;
    }

    @Override
    public List<RawRecord> extract(Document document) {
        try {
            Elements cards = findCards(document);
            if (cards.isEmpty()) {
                log.warn("no lawyer cards found with standard selectors, url={}", document.location());
                return List.of();
            }
            List<RawRecord> records = new ArrayList<>();
            for (Element card : cards) {
                RawRecord record = parseCard(card);
                if (record != null) {
                    records.add(record);
                }
            }
            log.info("extracted lawyers via html parsing, count={}, url={}", records.size(), document.location());
            return records;
        } catch (Exception ex) {
            log.warn("html parsing failed, url={}, error={}", document.location(), ex.getMessage());
            return List.of();
        }
    }

    private Elements findCards(Document document) {
        for (String selector : CARD_SELECTORS) {
            Elements cards = document.select(selector);
            if (!cards.isEmpty()) {
                log.info("found lawyer cards, selector={}, count={}", selector, cards.size());
                return cards;
            }
        }
        return new Elements();
    }

    private RawRecord parseCard(Element card) {
        try {
            ObjectNode fields = objectMapper.createObjectNode();
            CardFieldTable.apply(rules, card, fields);
            if (!fields.hasNonNull("name") && fields.path("profileUrl").asText("").isEmpty()) {
                return null;
            }
            return new RawRecord(SourceShape.DOM_CARD, fields);
        } catch (Exception ex) {
            log.debug("error extracting individual lawyer card, error={}", ex.getMessage());
            return null;
        }
    }

}
