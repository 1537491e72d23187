package fun.fengwk.lds.core.service.scrape.extract;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fun.fengwk.lds.core.service.scrape.model.RawRecord;
import fun.fengwk.lds.core.service.scrape.model.SourceShape;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Reads schema.org attorney entities from JSON-LD blocks.
 *
 * <p>Supported containers: top-level array, single entity, {@code @graph} wrapper and
 * {@code ItemList} whose elements either wrap the entity in {@code item} or are the entity.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StructuredMetadataStrategy implements ExtractionStrategy {

    public static final String LABEL = "JSON-LD";

    private static final Set<String> CANDIDATE_TYPES = Set.of("Attorney", "Person", "LegalService");

    private final ObjectMapper objectMapper;

    @Override
    public String label() {
        return LABEL;
    }

    @Override
    public List<RawRecord> extract(Document document) {
        List<RawRecord> records = new ArrayList<>();
        try {
            for (Element script : document.select("script[type=\"application/ld+json\"]")) {
                collectBlock(script.data(), records);
            }
        } catch (Exception ex) {
            log.warn("json-ld extraction failed, url={}, error={}", document.location(), ex.getMessage());
            return List.of();
        }
        if (!records.isEmpty()) {
            log.info("extracted lawyers via json-ld, count={}, url={}", records.size(), document.location());
        }
        return records;
    }

    private void collectBlock(String content, List<RawRecord> records) {
        if (!StringUtils.hasText(content)) {
            return;
        }
        JsonNode data;
        try {
            data = objectMapper.readTree(content);
        } catch (Exception ex) {
            log.debug("failed to parse json-ld block, error={}", ex.getMessage());
            return;
        }
        if (data == null) {
            return;
        }
        if (data.isArray()) {
            collectCandidates(data, records);
        } else if (isCandidate(data)) {
            records.add(toRaw(data));
        } else if (data.has("@graph")) {
            collectCandidates(data.get("@graph"), records);
        } else if (hasType(data, "ItemList") && data.has("itemListElement")) {
            for (JsonNode listItem : data.get("itemListElement")) {
                JsonNode item = listItem.has("item") ? listItem.get("item") : listItem;
                if (isCandidate(item)) {
                    records.add(toRaw(item));
                }
            }
        }
    }

    private void collectCandidates(JsonNode items, List<RawRecord> records) {
        if (items == null || !items.isArray()) {
            return;
        }
        for (JsonNode item : items) {
            if (isCandidate(item)) {
                records.add(toRaw(item));
            }
        }
    }

    private boolean isCandidate(JsonNode node) {
        if (node == null || !node.isObject()) {
            return false;
        }
        for (String type : CANDIDATE_TYPES) {
            if (hasType(node, type)) {
                return true;
            }
        }
        return false;
    }

    private boolean hasType(JsonNode node, String type) {
        JsonNode value = node.get("@type");
        if (value == null) {
            return false;
        }
        if (value.isTextual()) {
            return type.equals(value.asText());
        }
        if (value.isArray()) {
            for (JsonNode element : value) {
                if (element.isTextual() && type.equals(element.asText())) {
                    return true;
                }
            }
        }
        return false;
    }

    private RawRecord toRaw(JsonNode entity) {
        return new RawRecord(SourceShape.STRUCTURED_METADATA, entity);
    }

}
