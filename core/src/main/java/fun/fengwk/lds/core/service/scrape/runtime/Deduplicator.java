package fun.fengwk.lds.core.service.scrape.runtime;

import fun.fengwk.lds.core.service.scrape.model.LawyerRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Run-scoped profile url registry. Records without a profile url always pass.
 *
 * @author fengwk
 */
@Slf4j
public class Deduplicator {

    private final Set<String> seenKeys = ConcurrentHashMap.newKeySet();

    public boolean admit(LawyerRecord record) {
        String key = record.getProfileUrl();
        if (!StringUtils.hasText(key)) {
            return true;
        }
        if (!seenKeys.add(key)) {
            log.debug("skip duplicate lawyer, url={}", key);
            return false;
        }
        return true;
    }

    public List<LawyerRecord> filter(List<LawyerRecord> records) {
        List<LawyerRecord> admitted = new ArrayList<>(records.size());
        for (LawyerRecord record : records) {
            if (admit(record)) {
                admitted.add(record);
            }
        }
        int removed = records.size() - admitted.size();
        if (removed > 0) {
            log.info("removed duplicate lawyers, removed={}, kept={}", removed, admitted.size());
        }
        return admitted;
    }

    public int size() {
        return seenKeys.size();
    }

}
