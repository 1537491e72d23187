package fun.fengwk.lds.core.service.scrape.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

/**
 * Canonical directory record.
 *
 * <p>{@code profileUrl} is the identity key of a record when non-empty.
 * {@code education} and {@code awards} are only serialized after a successful enrichment.
 *
 * @author fengwk
 */
@Data
@Builder(toBuilder = true)
@JsonPropertyOrder({
    "name", "rating", "reviewCount", "practiceAreas", "location", "phone", "email", "website",
    "yearsLicensed", "barAdmissions", "languages", "profileUrl", "bio", "scrapedAt", "education", "awards"
})
public class LawyerRecord {

    public static final String UNKNOWN_NAME = "Unknown";

    @Builder.Default
    private String name = UNKNOWN_NAME;

    private Double rating;

    @Builder.Default
    private int reviewCount = 0;

    @Builder.Default
    private List<String> practiceAreas = List.of();

    @Builder.Default
    private String location = "";

    @Builder.Default
    private String phone = "";

    @Builder.Default
    private String email = "";

    @Builder.Default
    private String website = "";

    private Integer yearsLicensed;

    @Builder.Default
    private List<String> barAdmissions = List.of();

    @Builder.Default
    private List<String> languages = List.of();

    @Builder.Default
    private String profileUrl = "";

    @Builder.Default
    private String bio = "";

    private Instant scrapedAt;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private List<String> education;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private List<String> awards;

}
