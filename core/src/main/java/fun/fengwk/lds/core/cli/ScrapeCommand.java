package fun.fengwk.lds.core.cli;

import fun.fengwk.lds.core.service.scrape.DirectoryScrapeService;
import fun.fengwk.lds.core.service.scrape.model.RunSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Runs one directory scrape at startup.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "lds.command", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ScrapeCommand implements ApplicationRunner {

    private final DirectoryScrapeService directoryScrapeService;

    @Override
    public void run(ApplicationArguments args) {
        RunSummary summary = directoryScrapeService.scrape();
        log.info("scrape command finished, totalLawyersScraped={}, pagesProcessed={}, duration={}",
            summary.getTotalLawyersScraped(), summary.getPagesProcessed(), summary.getDuration());
    }

}
