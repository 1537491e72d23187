package fun.fengwk.lds.core.service.scrape.support;

import fun.fengwk.lds.core.service.scrape.ScraperProperties;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * @author fengwk
 */
class RunStartUrlResolverTest {

    private final RunStartUrlResolver resolver = new RunStartUrlResolver();

    @Test
    void shouldPreferStartUrl() {
        ScraperProperties input = new ScraperProperties();
        input.setStartUrl("  https://www.avvo.com/personal-injury-lawyer/ca.html ");
        input.setPracticeArea("bankruptcy");
        input.setState("ny");

        assertThat(resolver.resolve(input)).isEqualTo("https://www.avvo.com/personal-injury-lawyer/ca.html");
    }

    @Test
    void shouldBuildSearchUrlWithCity() {
        ScraperProperties input = new ScraperProperties();
        input.setPracticeArea("personal-injury");
        input.setState("ca");
        input.setCity("Los Angeles");

        assertThat(resolver.resolve(input)).isEqualTo("https://www.avvo.com/personal-injury-lawyer/los-angeles-ca.html");
    }

    @Test
    void shouldBuildSearchUrlWithoutCity() {
        ScraperProperties input = new ScraperProperties();
        input.setBaseUrl("https://example.test/");
        input.setPracticeArea("bankruptcy");
        input.setState("ny");

        assertThat(resolver.resolve(input)).isEqualTo("https://example.test/bankruptcy-lawyer/ny.html");
    }

    @Test
    void shouldRejectMissingLocation() {
        ScraperProperties input = new ScraperProperties();
        input.setPracticeArea("bankruptcy");

        assertThatThrownBy(() -> resolver.resolve(input))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Either provide a \"startUrl\" OR both \"practiceArea\" and \"state\"");
    }

    @Test
    void shouldRejectOutOfRangeMaxLawyers() {
        ScraperProperties input = new ScraperProperties();
        input.setStartUrl("https://www.avvo.com/x.html");
        input.setMaxLawyers(10001);

        assertThatThrownBy(() -> resolver.validate(input))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxLawyers");

        input.setMaxLawyers(-1);
        assertThatThrownBy(() -> resolver.validate(input)).isInstanceOf(IllegalArgumentException.class);

        input.setMaxLawyers(0);
        resolver.validate(input);
    }

}
