package fun.fengwk.lds.core.service.scrape;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Detail-page enrichment tuning.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "lds.enrichment")
public class EnrichmentProperties {

    /**
     * Batch size, all fetches of a batch run concurrently.
     */
    private int concurrency = 10;

    /**
     * Pause between batches.
     */
    private long batchPauseMs = 200;

    /**
     * Per-request timeout.
     */
    private int timeoutMs = 15000;

    /**
     * User agent used when the listing session did not expose one.
     */
    private String fallbackUserAgent =
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64; rv:128.0) Gecko/20100101 Firefox/128.0";

}
