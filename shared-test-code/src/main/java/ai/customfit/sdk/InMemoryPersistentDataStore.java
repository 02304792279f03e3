package ai.customfit.sdk;

import ai.customfit.sdk.subsystems.PersistentDataStore;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

public class InMemoryPersistentDataStore implements PersistentDataStore {
    private final Map<String, Map<String, String>> data = new HashMap<>();

    @Override
    public synchronized String getValue(String storeNamespace, String key) {
        Map<String, String> ns = data.get(storeNamespace);
        return ns == null ? null : ns.get(key);
    }

    @Override
    public synchronized void setValue(String storeNamespace, String key, String value) {
        Map<String, String> ns = data.computeIfAbsent(storeNamespace, k -> new HashMap<>());
        if (value == null) {
            ns.remove(key);
        } else {
            ns.put(key, value);
        }
    }

    @Override
    public synchronized void setValues(String storeNamespace, Map<String, String> keysAndValues) {
        for (Map.Entry<String, String> kv: keysAndValues.entrySet()) {
            setValue(storeNamespace, kv.getKey(), kv.getValue());
        }
    }

    @Override
    public synchronized Collection<String> getKeys(String storeNamespace) {
        Map<String, String> ns = data.get(storeNamespace);
        return ns == null ? new ArrayList<>() : new ArrayList<>(ns.keySet());
    }

    @Override
    public synchronized void clear(String storeNamespace) {
        data.remove(storeNamespace);
    }

    public synchronized int size(String storeNamespace) {
        Map<String, String> ns = data.get(storeNamespace);
        return ns == null ? 0 : ns.size();
    }
}
