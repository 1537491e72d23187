package fun.fengwk.lds.core.service.scrape.runtime;

import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/**
 * Pending listing urls of a run with unique-key dedup and a request ceiling.
 *
 * @author fengwk
 */
@Slf4j
public class ListingRequestQueue {

    private final int maxRequests;
    private final Deque<String> pending = new ArrayDeque<>();
    private final Set<String> uniqueKeys = new HashSet<>();
    private int handedOut;

    public ListingRequestQueue(int maxRequests) {
        this.maxRequests = Math.max(1, maxRequests);
    }

    /**
     * @return true when the url was queued, false when it was seen before or the ceiling is reached
     */
    public synchronized boolean enqueue(String url) {
        if (!StringUtils.hasText(url)) {
            return false;
        }
        String key = uniqueKey(url);
        if (uniqueKeys.size() >= maxRequests) {
            log.info("request ceiling reached, skip url={}, maxRequests={}", url, maxRequests);
            return false;
        }
        if (!uniqueKeys.add(key)) {
            log.debug("skip already queued url={}", url);
            return false;
        }
        pending.addLast(url.trim());
        return true;
    }

    /**
     * @return next url or null when nothing is pending
     */
    public synchronized String poll() {
        String url = pending.pollFirst();
        if (url != null) {
            handedOut++;
        }
        return url;
    }

    public synchronized boolean isEmpty() {
        return pending.isEmpty();
    }

    public synchronized int handedOut() {
        return handedOut;
    }

    static String uniqueKey(String url) {
        String key = url.trim();
        int fragment = key.indexOf('#');
        if (fragment >= 0) {
            key = key.substring(0, fragment);
        }
        while (key.endsWith("/") && key.length() > 1) {
            key = key.substring(0, key.length() - 1);
        }
        return key;
    }

}
