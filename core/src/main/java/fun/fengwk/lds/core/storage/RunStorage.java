package fun.fengwk.lds.core.storage;

import java.util.List;

/**
 * Run output: an append-only dataset and a key-value store.
 *
 * @author fengwk
 */
public interface RunStorage {

    /**
     * Append items to the default dataset.
     */
    void pushData(List<?> items);

    /**
     * Store a value under the given key in the default key-value store, replacing any previous one.
     */
    void setValue(String key, Object value);

}
