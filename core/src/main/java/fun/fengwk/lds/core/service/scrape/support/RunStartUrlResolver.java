package fun.fengwk.lds.core.service.scrape.support;

import fun.fengwk.lds.core.service.scrape.ScraperProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Locale;

/**
 * Validates run input and resolves the first listing url.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class RunStartUrlResolver {

    static final int MAX_LAWYERS_LIMIT = 10000;

    public void validate(ScraperProperties input) {
        if (input == null) {
            throw new IllegalArgumentException("scraper input must not be null");
        }
        boolean hasStartUrl = StringUtils.hasText(input.getStartUrl());
        boolean hasSearch = StringUtils.hasText(input.getPracticeArea()) && StringUtils.hasText(input.getState());
        if (!hasStartUrl && !hasSearch) {
            throw new IllegalArgumentException(
                "Invalid input: Either provide a \"startUrl\" OR both \"practiceArea\" and \"state\"");
        }
        if (input.getMaxLawyers() < 0 || input.getMaxLawyers() > MAX_LAWYERS_LIMIT) {
            throw new IllegalArgumentException("maxLawyers must be between 0 and " + MAX_LAWYERS_LIMIT);
        }
    }

    /**
     * Validate the input and build the start url.
     *
     * @throws IllegalArgumentException when the input is invalid
     */
    public String resolve(ScraperProperties input) {
        validate(input);
        if (StringUtils.hasText(input.getStartUrl())) {
            log.info("using provided start url directly");
            return input.getStartUrl().trim();
        }

        String baseUrl = input.getBaseUrl().endsWith("/")
            ? input.getBaseUrl().substring(0, input.getBaseUrl().length() - 1)
            : input.getBaseUrl();
        String city = StringUtils.hasText(input.getCity()) ? slug(input.getCity()) + "-" : "";
        String url = baseUrl + "/" + input.getPracticeArea().trim() + "-lawyer/" + city + input.getState().trim() + ".html";
        log.info("built search url, url={}", url);
        return url;
    }

    private String slug(String value) {
        return value.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", "-");
    }

}
