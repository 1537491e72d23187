package fun.fengwk.lds.core.service.scrape.extract;

import com.fasterxml.jackson.databind.ObjectMapper;
import fun.fengwk.lds.core.service.scrape.model.RawRecord;
import fun.fengwk.lds.core.service.scrape.model.SourceShape;
import org.jsoup.Jsoup;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
public class EmbeddedScriptStrategyTest {

    private final EmbeddedScriptStrategy strategy = new EmbeddedScriptStrategy(new ObjectMapper());

    @Test
    public void shouldMineListingFromAssignmentScript() {
        String html = """
            <html><body>
            <script>window.__STATE__ = {"lawyers":[{"name":"A"},{"fullName":"B"},"skip-me"]};</script>
            </body></html>
            """;

        List<RawRecord> raws = strategy.extract(Jsoup.parse(html));

        assertThat(raws).hasSize(2).allMatch(raw -> raw.shape() == SourceShape.EMBEDDED_SCRIPT);
        assertThat(raws.get(1).payload().get("fullName").asText()).isEqualTo("B");
    }

    @Test
    public void shouldLookUpNestedDataPaths() {
        String html = """
            <script>var lawyerData = {"data":{"attorneys":[{"name":"Nested"}]},"profiles":[]};</script>
            """;

        List<RawRecord> raws = strategy.extract(Jsoup.parse(html));

        assertThat(raws).extracting(raw -> raw.payload().get("name").asText()).containsExactly("Nested");
    }

    @Test
    public void shouldIgnoreExternalAndUnmarkedScripts() {
        String html = """
            <script src="/app.js">{"lawyers":[{"name":"External"}]}</script>
            <script>var config = {"theme":"dark"};</script>
            <script>{"lawyers": broken</script>
            """;

        assertThat(strategy.extract(Jsoup.parse(html))).isEmpty();
        assertThat(strategy.label()).isEqualTo("Internal API");
    }

}
