package fun.fengwk.lds.core.service.scrape.extract;

import com.fasterxml.jackson.databind.JsonNode;
import fun.fengwk.lds.core.service.scrape.model.LawyerRecord;
import fun.fengwk.lds.core.service.scrape.model.RawRecord;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Maps raw strategy outputs of any source shape into {@link LawyerRecord}.
 *
 * <p>Multi-name fields resolve left to right, the first present non-empty value wins.
 *
 * @author fengwk
 */
@Component
public class RecordNormalizer {

    public LawyerRecord normalize(RawRecord raw) {
        if (raw == null || raw.payload() == null) {
            throw new IllegalArgumentException("raw record must not be null");
        }
        JsonNode payload = raw.payload();
        return switch (raw.shape()) {
            case STRUCTURED_METADATA -> fromStructuredMetadata(payload);
            case EMBEDDED_SCRIPT, DOM_CARD -> fromListingEntry(payload);
        };
    }

    public List<LawyerRecord> normalizeAll(List<RawRecord> raws) {
        List<LawyerRecord> records = new ArrayList<>(raws.size());
        for (RawRecord raw : raws) {
            records.add(normalize(raw));
        }
        return records;
    }

    private LawyerRecord fromStructuredMetadata(JsonNode entity) {
        JsonNode aggregateRating = entity.path("aggregateRating");
        String url = text(entity, "url");
        return LawyerRecord.builder()
            .name(nameOrUnknown(text(entity, "name")))
            .rating(number(aggregateRating.get("ratingValue")))
            .reviewCount(integerOrZero(aggregateRating.get("reviewCount")))
            .practiceAreas(structuredPracticeAreas(entity))
            .location(location(entity.get("address")))
            .phone(text(entity, "telephone"))
            .email(text(entity, "email"))
            .website(url)
            .profileUrl(url)
            .bio(text(entity, "description"))
            .scrapedAt(Instant.now())
            .build();
    }

    private LawyerRecord fromListingEntry(JsonNode entry) {
        Double rating = number(first(entry, "rating", "avvoRating"));
        Integer reviewCount = integer(entry.get("reviewCount"));
        if (reviewCount == null || reviewCount == 0) {
            JsonNode reviews = entry.get("reviews");
            reviewCount = reviews != null && reviews.isArray() ? reviews.size() : 0;
        }
        List<String> practiceAreas = stringList(entry.get("practiceAreas"));
        if (practiceAreas.isEmpty()) {
            practiceAreas = stringList(entry.get("specialties"));
        }
        return LawyerRecord.builder()
            .name(nameOrUnknown(text(entry, "name", "fullName")))
            .rating(rating)
            .reviewCount(reviewCount)
            .practiceAreas(practiceAreas)
            .location(text(entry, "location", "city"))
            .phone(text(entry, "phone", "phoneNumber"))
            .email(text(entry, "email"))
            .website(text(entry, "website", "websiteUrl"))
            .yearsLicensed(integer(first(entry, "yearsLicensed", "yearAdmitted")))
            .barAdmissions(stringList(entry.get("barAdmissions")))
            .languages(stringList(entry.get("languages")))
            .profileUrl(text(entry, "profileUrl", "url"))
            .bio(text(entry, "bio", "description"))
            .scrapedAt(Instant.now())
            .build();
    }

    private List<String> structuredPracticeAreas(JsonNode entity) {
        JsonNode knowsAbout = entity.get("knowsAbout");
        if (knowsAbout != null && knowsAbout.isArray()) {
            return stringList(knowsAbout);
        }
        // areaServed contributes a single entry, the first one when it is a list.
        List<String> areas = stringList(entity.get("areaServed"));
        return areas.isEmpty() ? List.of() : List.of(areas.get(0));
    }

    private String location(JsonNode address) {
        if (address == null || address.isNull() || address.isMissingNode()) {
            return "";
        }
        if (address.isTextual()) {
            return address.asText();
        }
        List<String> parts = new ArrayList<>();
        for (String field : List.of("addressLocality", "addressRegion", "postalCode")) {
            String part = scalarText(address.get(field));
            if (StringUtils.hasText(part)) {
                parts.add(part);
            }
        }
        return String.join(", ", parts);
    }

    private String nameOrUnknown(String name) {
        return StringUtils.hasText(name) ? name.trim() : LawyerRecord.UNKNOWN_NAME;
    }

    private JsonNode first(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (isPresent(value)) {
                return value;
            }
        }
        return null;
    }

    private String text(JsonNode node, String... fields) {
        for (String field : fields) {
            String value = scalarText(node.get(field));
            if (StringUtils.hasText(value)) {
                return value;
            }
        }
        return "";
    }

    private boolean isPresent(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return false;
        }
        if (value.isTextual()) {
            return StringUtils.hasText(value.asText());
        }
        if (value.isNumber()) {
            return value.asDouble() != 0;
        }
        return !value.isContainerNode() || value.size() > 0;
    }

    private String scalarText(JsonNode value) {
        if (value == null || !value.isValueNode() || value.isNull()) {
            return null;
        }
        return value.asText();
    }

    private String nameOrText(JsonNode value) {
        if (value == null) {
            return null;
        }
        if (value.isObject()) {
            return scalarText(value.get("name"));
        }
        return scalarText(value);
    }

    private List<String> stringList(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return List.of();
        }
        List<String> values = new ArrayList<>();
        if (value.isArray()) {
            for (JsonNode element : value) {
                String text = nameOrText(element);
                if (StringUtils.hasText(text)) {
                    values.add(text.trim());
                }
            }
        } else {
            String text = nameOrText(value);
            if (StringUtils.hasText(text)) {
                values.add(text.trim());
            }
        }
        return values;
    }

    private Double number(JsonNode value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return value.asDouble();
        }
        if (value.isTextual()) {
            try {
                return Double.parseDouble(value.asText().trim());
            } catch (NumberFormatException ex) {
                return null;
            }
        }
        return null;
    }

    private Integer integer(JsonNode value) {
        Double number = number(value);
        return number == null ? null : number.intValue();
    }

    private int integerOrZero(JsonNode value) {
        Integer number = integer(value);
        return number == null ? 0 : number;
    }

}
