package fun.fengwk.lds.core.service.scrape.extract;

import com.fasterxml.jackson.databind.ObjectMapper;
import fun.fengwk.lds.core.service.scrape.model.LawyerRecord;
import fun.fengwk.lds.core.service.scrape.model.RawRecord;
import fun.fengwk.lds.core.service.scrape.model.SourceShape;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * @author fengwk
 */
public class RecordNormalizerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final RecordNormalizer normalizer = new RecordNormalizer();

    @Test
    public void shouldKeepPlainStringAddressVerbatim() throws Exception {
        LawyerRecord record = normalizer.normalize(structured("""
            {"@type":"Attorney","name":"Jane Roe","address":"100 Main St, Springfield, IL 62701"}
            """));

        assertThat(record.getLocation()).isEqualTo("100 Main St, Springfield, IL 62701");
    }

    @Test
    public void shouldJoinNonEmptyAddressParts() throws Exception {
        LawyerRecord record = normalizer.normalize(structured("""
            {"@type":"Attorney","name":"Jane Roe",
             "address":{"addressLocality":"Springfield","addressRegion":"IL","postalCode":""}}
            """));

        assertThat(record.getLocation()).isEqualTo("Springfield, IL");
    }

    @Test
    public void shouldMapStructuredMetadataFields() throws Exception {
        LawyerRecord record = normalizer.normalize(structured("""
            {"@type":"Attorney","name":"Jane Roe","telephone":"(555) 010-2000","email":"jane@example.com",
             "url":"https://www.avvo.com/attorneys/jane-roe.html","description":"Trial lawyer.",
             "aggregateRating":{"ratingValue":"4.5","reviewCount":12},
             "knowsAbout":["Personal Injury","Car Accident"]}
            """));

        assertThat(record.getName()).isEqualTo("Jane Roe");
        assertThat(record.getRating()).isEqualTo(4.5);
        assertThat(record.getReviewCount()).isEqualTo(12);
        assertThat(record.getPracticeAreas()).containsExactly("Personal Injury", "Car Accident");
        assertThat(record.getPhone()).isEqualTo("(555) 010-2000");
        assertThat(record.getEmail()).isEqualTo("jane@example.com");
        assertThat(record.getWebsite()).isEqualTo("https://www.avvo.com/attorneys/jane-roe.html");
        assertThat(record.getProfileUrl()).isEqualTo("https://www.avvo.com/attorneys/jane-roe.html");
        assertThat(record.getBio()).isEqualTo("Trial lawyer.");
        assertThat(record.getYearsLicensed()).isNull();
        assertThat(record.getBarAdmissions()).isEmpty();
        assertThat(record.getScrapedAt()).isNotNull();
        assertThat(record.getEducation()).isNull();
    }

    @Test
    public void shouldWrapAreaServedWhenKnowsAboutMissing() throws Exception {
        LawyerRecord plain = normalizer.normalize(structured("""
            {"@type":"LegalService","name":"Roe Law","areaServed":"Illinois"}
            """));
        LawyerRecord named = normalizer.normalize(structured("""
            {"@type":"LegalService","name":"Roe Law","areaServed":{"@type":"State","name":"Illinois"}}
            """));

        assertThat(plain.getPracticeAreas()).containsExactly("Illinois");
        assertThat(named.getPracticeAreas()).containsExactly("Illinois");
    }

    @Test
    public void shouldTakeFirstAreaServedFromList() throws Exception {
        LawyerRecord names = normalizer.normalize(structured("""
            {"@type":"LegalService","name":"Roe Law","areaServed":[{"@type":"City","name":"Chicago"},{"name":"Evanston"}]}
            """));
        LawyerRecord texts = normalizer.normalize(structured("""
            {"@type":"LegalService","name":"Roe Law","areaServed":["", "Cook County", "Lake County"]}
            """));

        assertThat(names.getPracticeAreas()).containsExactly("Chicago");
        assertThat(texts.getPracticeAreas()).containsExactly("Cook County");
    }

    @Test
    public void shouldDefaultMissingRatingAndName() throws Exception {
        LawyerRecord record = normalizer.normalize(structured("""
            {"@type":"Person","name":"  "}
            """));

        assertThat(record.getName()).isEqualTo("Unknown");
        assertThat(record.getRating()).isNull();
        assertThat(record.getReviewCount()).isZero();
        assertThat(record.getPracticeAreas()).isEmpty();
        assertThat(record.getLocation()).isEmpty();
        assertThat(record.getProfileUrl()).isEmpty();
    }

    @Test
    public void shouldResolveEmbeddedAliasesLeftToRight() throws Exception {
        LawyerRecord record = normalizer.normalize(new RawRecord(SourceShape.EMBEDDED_SCRIPT, objectMapper.readTree("""
            {"fullName":"John Doe","avvoRating":9.1,"reviews":[{},{},{}],"specialties":["Bankruptcy"],
             "city":"Austin","phoneNumber":"555-0100","websiteUrl":"https://doe.example.com",
             "yearAdmitted":2005,"barAdmissions":["Texas"],"languages":["English","Spanish"],
             "url":"https://www.avvo.com/attorneys/john-doe.html","description":"Helps families."}
            """)));

        assertThat(record.getName()).isEqualTo("John Doe");
        assertThat(record.getRating()).isEqualTo(9.1);
        assertThat(record.getReviewCount()).isEqualTo(3);
        assertThat(record.getPracticeAreas()).containsExactly("Bankruptcy");
        assertThat(record.getLocation()).isEqualTo("Austin");
        assertThat(record.getPhone()).isEqualTo("555-0100");
        assertThat(record.getWebsite()).isEqualTo("https://doe.example.com");
        assertThat(record.getYearsLicensed()).isEqualTo(2005);
        assertThat(record.getBarAdmissions()).containsExactly("Texas");
        assertThat(record.getLanguages()).containsExactly("English", "Spanish");
        assertThat(record.getProfileUrl()).isEqualTo("https://www.avvo.com/attorneys/john-doe.html");
        assertThat(record.getBio()).isEqualTo("Helps families.");
    }

    @Test
    public void shouldPreferPrimaryEmbeddedNames() throws Exception {
        LawyerRecord record = normalizer.normalize(new RawRecord(SourceShape.EMBEDDED_SCRIPT, objectMapper.readTree("""
            {"name":"Primary","fullName":"Alias","rating":4,"avvoRating":9,"reviewCount":7,"reviews":[{}],
             "profileUrl":"https://a.example/p","url":"https://a.example/u"}
            """)));

        assertThat(record.getName()).isEqualTo("Primary");
        assertThat(record.getRating()).isEqualTo(4.0);
        assertThat(record.getReviewCount()).isEqualTo(7);
        assertThat(record.getProfileUrl()).isEqualTo("https://a.example/p");
    }

    @Test
    public void shouldFillDefaultsForDomCards() throws Exception {
        LawyerRecord record = normalizer.normalize(new RawRecord(SourceShape.DOM_CARD, objectMapper.readTree("""
            {"profileUrl":"https://www.avvo.com/attorneys/x.html","rating":4.8}
            """)));

        assertThat(record.getName()).isEqualTo("Unknown");
        assertThat(record.getRating()).isEqualTo(4.8);
        assertThat(record.getEmail()).isEmpty();
        assertThat(record.getLanguages()).isEmpty();
    }

    @Test
    public void shouldRejectNullRawRecord() {
        assertThatThrownBy(() -> normalizer.normalize(null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private RawRecord structured(String json) throws Exception {
        return new RawRecord(SourceShape.STRUCTURED_METADATA, objectMapper.readTree(json));
    }

}
