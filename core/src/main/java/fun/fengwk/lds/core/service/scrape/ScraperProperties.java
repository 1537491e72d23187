package fun.fengwk.lds.core.service.scrape;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Run input and listing-page configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "lds.scraper")
public class ScraperProperties {

    /**
     * Direct listing url, wins over the practice area and location fields.
     */
    private String startUrl = "";

    /**
     * Practice area slug, e.g. personal-injury.
     */
    private String practiceArea = "";

    /**
     * State code, e.g. ca.
     */
    private String state = "";

    /**
     * Optional city name.
     */
    private String city = "";

    /**
     * Max records to emit, 0 means unbounded.
     */
    private int maxLawyers = 50;

    /**
     * Whether to enrich records from their detail pages.
     */
    private boolean includeContactInfo = false;

    /**
     * Max listing pages processed in parallel.
     */
    private int maxConcurrency = 3;

    /**
     * Max listing pages requested per run.
     */
    private int maxRequestsPerCrawl = 20;

    /**
     * Directory origin used for start urls and relative profile links.
     */
    private String baseUrl = "https://www.avvo.com";

    /**
     * Listing navigation timeout.
     */
    private int navigateTimeoutMs = 30000;

    /**
     * Best-effort network idle wait after navigation.
     */
    private int networkIdleTimeoutMs = 10000;

    /**
     * Settle wait after the challenge gate passes.
     */
    private int postChallengeSettleMs = 2000;

}
