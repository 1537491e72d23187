package fun.fengwk.lds.core.service.scrape.model;

/**
 * Anti-bot challenge state of a listing page.
 *
 * @author fengwk
 */
public enum ChallengeState {

    FRESH,
    DETECTED,
    SOLVING,
    BYPASSED,
    FAILED;

    public boolean isTerminal() {
        return this == BYPASSED || this == FAILED;
    }

}
