package fun.fengwk.lds.core.service.scrape.model;

/**
 * Listing session credentials reused for out-of-browser detail fetches.
 *
 * @param cookieHeader cookie header value, {@code name=value; name2=value2}
 * @param userAgent user agent of the listing browser context
 * @author fengwk
 */
public record SessionContext(String cookieHeader, String userAgent) {

    public static SessionContext empty() {
        return new SessionContext("", "");
    }

}
