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

import java.util.ArrayList;
import java.util.List;

/**
 * Mines listing arrays out of inline script payloads.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EmbeddedScriptStrategy implements ExtractionStrategy {

    public static final String LABEL = "Internal API";

    private static final List<String> MARKERS = List.of("\"lawyers\"", "\"attorneys\"", "\"profiles\"", "lawyerData");

    private static final List<String> LISTING_PATHS = List.of(
        "/lawyers", "/attorneys", "/profiles", "/data/lawyers", "/data/attorneys"
    );

    private final ObjectMapper objectMapper;

    @Override
    public String label() {
        return LABEL;
    }

    @Override
    public List<RawRecord> extract(Document document) {
        List<RawRecord> records = new ArrayList<>();
        try {
            for (Element script : document.select("script:not([src])")) {
                String content = script.data();
                if (containsMarker(content)) {
                    collectListing(content, records);
                }
            }
        } catch (Exception ex) {
            log.warn("embedded script extraction failed, url={}, error={}", document.location(), ex.getMessage());
            return List.of();
        }
        return records;
    }

    private boolean containsMarker(String content) {
        if (content == null) {
            return false;
        }
        for (String marker : MARKERS) {
            if (content.contains(marker)) {
                return true;
            }
        }
        return false;
    }

    private void collectListing(String content, List<RawRecord> records) {
        int start = content.indexOf('{');
        int end = content.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return;
        }
        JsonNode data;
        try {
            data = objectMapper.readTree(content.substring(start, end + 1));
        } catch (Exception ex) {
            log.debug("skip unparseable script payload, error={}", ex.getMessage());
            return;
        }
        JsonNode listing = findListing(data);
        if (listing == null) {
            return;
        }
        log.info("found lawyers in embedded script data, count={}", listing.size());
        for (JsonNode candidate : listing) {
            if (candidate.isObject()) {
                records.add(new RawRecord(SourceShape.EMBEDDED_SCRIPT, candidate));
            }
        }
    }

    private JsonNode findListing(JsonNode data) {
        for (String path : LISTING_PATHS) {
            JsonNode value = data.at(path);
            if (value.isArray() && !value.isEmpty()) {
                return value;
            }
        }
        return null;
    }

}
