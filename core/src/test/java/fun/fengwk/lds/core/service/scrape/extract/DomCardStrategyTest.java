package fun.fengwk.lds.core.service.scrape.extract;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fun.fengwk.lds.core.service.scrape.ScraperProperties;
import fun.fengwk.lds.core.service.scrape.model.RawRecord;
import fun.fengwk.lds.core.service.scrape.model.SourceShape;
import org.jsoup.Jsoup;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
public class DomCardStrategyTest {

    private final DomCardStrategy strategy = new DomCardStrategy(new ObjectMapper(), new ScraperProperties());

    @Test
    public void shouldDropOnlyTheOverflowingNumberField() {
        String html = """
            <div class="lawyer-card">
              <h3><a href="/attorneys/jane-roe.html">Jane Roe</a></h3>
              <span class="review-count">98765432109 reviews</span>
              <div class="years-licensed">Licensed for 12 years</div>
            </div>
            """;

        List<RawRecord> raws = strategy.extract(Jsoup.parse(html));

        assertThat(raws).hasSize(1);
        JsonNode card = raws.get(0).payload();
        assertThat(card.get("name").asText()).isEqualTo("Jane Roe");
        assertThat(card.get("profileUrl").asText()).isEqualTo("https://www.avvo.com/attorneys/jane-roe.html");
        assertThat(card.has("reviewCount")).isFalse();
        assertThat(card.get("yearsLicensed").asInt()).isEqualTo(12);
    }

    @Test
    public void shouldParseCardFields() {
        String html = """
            <div data-testid="lawyer-card">
              <h2><a href="/attorneys/90210-ca-jane-roe-1.html">Jane Roe</a></h2>
              <span class="rating-value">Rating: 9.5 / 10</span>
              <span class="review-count">(24 reviews)</span>
              <ul class="practice-areas"><li>Personal Injury</li><li>Car Accidents</li><li>PI</li></ul>
              <div class="location">Los Angeles, CA</div>
              <a class="call" href="tel:+15550102000"><span class="phone"></span></a>
              <a data-testid="website" href="https://roe.example.com">Website</a>
              <div class="years-licensed">Licensed for 18 years</div>
              <ul class="bar-admissions"><li>California</li><li>Nevada</li></ul>
              <div class="languages"><span>English</span><span>Spanish</span></div>
              <p>Short label</p>
              <div class="bio">Jane has represented injured clients across Southern California for nearly two decades.</div>
            </div>
            """;

        List<RawRecord> raws = strategy.extract(Jsoup.parse(html));

        assertThat(raws).hasSize(1);
        assertThat(raws.get(0).shape()).isEqualTo(SourceShape.DOM_CARD);
        JsonNode card = raws.get(0).payload();
        assertThat(card.get("name").asText()).isEqualTo("Jane Roe");
        assertThat(card.get("profileUrl").asText()).isEqualTo("https://www.avvo.com/attorneys/90210-ca-jane-roe-1.html");
        assertThat(card.get("rating").asDouble()).isEqualTo(9.5);
        assertThat(card.get("reviewCount").asInt()).isEqualTo(24);
        assertThat(card.get("practiceAreas")).extracting(JsonNode::asText)
            .containsExactly("Personal Injury", "Car Accidents");
        assertThat(card.get("location").asText()).isEqualTo("Los Angeles, CA");
        assertThat(card.get("website").asText()).isEqualTo("https://roe.example.com");
        assertThat(card.get("yearsLicensed").asInt()).isEqualTo(18);
        assertThat(card.get("barAdmissions")).extracting(JsonNode::asText).containsExactly("California", "Nevada");
        assertThat(card.get("languages")).extracting(JsonNode::asText).containsExactly("English", "Spanish");
        assertThat(card.get("bio").asText()).startsWith("Jane has represented");
    }

    @Test
    public void shouldFallBackToTelLinkAndCommaSeparatedAreas() {
        String html = """
            <div class="lawyer-card">
              <div class="lawyer-name">John Doe</div>
              <div class="specialties">Tax, IP, Estate Planning</div>
              <a href="tel:555-0100"></a>
            </div>
            """;

        JsonNode card = strategy.extract(Jsoup.parse(html)).get(0).payload();

        assertThat(card.get("phone").asText()).isEqualTo("555-0100");
        assertThat(card.get("practiceAreas")).extracting(JsonNode::asText).containsExactly("Tax", "Estate Planning");
        assertThat(card.path("profileUrl").asText()).isEmpty();
    }

    @Test
    public void shouldUseFirstMatchingCardSelectorOnly() {
        String html = """
            <div class="lawyer-card"><h3><a href="https://www.avvo.com/attorneys/a.html">A</a></h3></div>
            <div class="profile-card"><h3><a href="https://www.avvo.com/attorneys/b.html">B</a></h3></div>
            """;

        List<RawRecord> raws = strategy.extract(Jsoup.parse(html));

        assertThat(raws).extracting(raw -> raw.payload().get("name").asText()).containsExactly("A");
    }

    @Test
    public void shouldDropCardsWithoutNameOrLink() {
        String html = """
            <div class="lawyer-card"><span class="rating-value">4.0</span></div>
            <div class="lawyer-card"><a class="profile-name" href="/attorneys/c.html">C</a></div>
            """;

        List<RawRecord> raws = strategy.extract(Jsoup.parse(html));

        assertThat(raws).hasSize(1);
        assertThat(strategy.extract(Jsoup.parse("<div>nothing</div>"))).isEmpty();
        assertThat(strategy.label()).isEqualTo("HTML Parsing");
    }

    @Test
    public void shouldAbsolutizeRelativeLinks() {
        assertThat(CardFieldTable.absolutize("https://www.avvo.com/", "/attorneys/x.html"))
            .isEqualTo("https://www.avvo.com/attorneys/x.html");
        assertThat(CardFieldTable.absolutize("https://www.avvo.com", "attorneys/x.html"))
            .isEqualTo("https://www.avvo.com/attorneys/x.html");
        assertThat(CardFieldTable.absolutize("https://www.avvo.com", "https://other.example/x"))
            .isEqualTo("https://other.example/x");
        assertThat(CardFieldTable.absolutize("https://www.avvo.com", "")).isEmpty();
    }

}
