package br.com.analytics.pipeline.retail_warehouse_batch.dimension;

import br.com.analytics.pipeline.retail_warehouse_batch.exception.DimensionLookupException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Hands out surrogate keys for the natural keys of one dimension, starting at 1 in
 * registration order. Registering the same natural key twice returns the same key.
 */
public class SurrogateKeyRegistry<K> {

    private final String dimension;
    private final Map<K, Long> keys = new LinkedHashMap<>();

    public SurrogateKeyRegistry(String dimension) {
        this.dimension = dimension;
    }

    public long register(K naturalKey) {
        Long existing = keys.get(naturalKey);
        if (existing != null) {
            return existing;
        }
        long key = keys.size() + 1L;
        keys.put(naturalKey, key);
        return key;
    }

    public long resolve(K naturalKey) {
        Long key = keys.get(naturalKey);
        if (key == null) {
            throw new DimensionLookupException(dimension, naturalKey);
        }
        return key;
    }

    public boolean contains(K naturalKey) {
        return keys.containsKey(naturalKey);
    }

    public int size() {
        return keys.size();
    }

    public String getDimension() {
        return dimension;
    }
}
