package fun.fengwk.lds.core.storage;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Run storage kept in memory for tests.
 *
 * @author fengwk
 */
public class InMemoryRunStorage implements RunStorage {

    private final List<Object> items = new ArrayList<>();
    private final Map<String, Object> values = new ConcurrentHashMap<>();

    @Override
    public synchronized void pushData(List<?> items) {
        this.items.addAll(items);
    }

    @Override
    public void setValue(String key, Object value) {
        values.put(key, value);
    }

    public synchronized List<Object> getItems() {
        return new ArrayList<>(items);
    }

    public Object getValue(String key) {
        return values.get(key);
    }

    public Map<String, Object> getValues() {
        return Map.copyOf(values);
    }

}
