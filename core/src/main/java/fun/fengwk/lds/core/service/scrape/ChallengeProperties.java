package fun.fengwk.lds.core.service.scrape;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Anti-bot challenge remediation tuning.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "lds.challenge")
public class ChallengeProperties {

    /**
     * Max remediation attempts before a page is abandoned.
     */
    private int maxAttempts = 3;

    /**
     * Wait before looking for the challenge widget.
     */
    private int settleDelayMs = 3000;

    /**
     * Wait after clicking the challenge widget.
     */
    private int postClickDelayMs = 3000;

    /**
     * Wait after each remediation attempt.
     */
    private int postAttemptDelayMs = 5000;

    /**
     * Network idle wait after each remediation attempt.
     */
    private int networkIdleTimeoutMs = 15000;

    /**
     * Widget click timeout.
     */
    private int clickTimeoutMs = 5000;

}
