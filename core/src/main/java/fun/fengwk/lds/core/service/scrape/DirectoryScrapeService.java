package fun.fengwk.lds.core.service.scrape;

import fun.fengwk.lds.core.service.scrape.model.RunSummary;

/**
 * Lawyer directory scrape entry.
 *
 * @author fengwk
 */
public interface DirectoryScrapeService {

    /**
     * Run one scrape with the configured {@link ScraperProperties}.
     *
     * @throws IllegalArgumentException when the run input is invalid, before any network activity
     */
    RunSummary scrape();

}
