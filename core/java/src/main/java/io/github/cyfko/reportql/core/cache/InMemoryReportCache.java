package io.github.cyfko.reportql.core.cache;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.cyfko.reportql.core.config.CachePolicy;
import io.github.cyfko.reportql.core.query.Query;
import io.github.cyfko.reportql.core.spi.ReportCache;

import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Bounded LRU {@link ReportCache} keeping raw responses in memory, keyed by
 * {@linkplain Query#signature() query signature}.
 *
 * <h2>Implementation Strategy</h2>
 * <ul>
 *   <li><strong>Deque for ordering</strong>: tracks access order, most recent first</li>
 *   <li><strong>Map for storage</strong>: signature → response</li>
 *   <li><strong>ReadWriteLock</strong>: concurrent lookups, exclusive writes</li>
 *   <li><strong>Automatic eviction</strong>: least recently used responses go first</li>
 * </ul>
 *
 * <p>
 * Responses are deep-copied on the way in and out so that callers cannot alter what the
 * cache holds.
 * </p>
 *
 * <pre>{@code
 * ReportCache cache = new InMemoryReportCache(CachePolicy.custom(200));
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class InMemoryReportCache implements ReportCache {

    private final int maxSize;
    private final Map<String, JsonNode> responses;
    private final Deque<String> accessOrder;
    private final ReadWriteLock lock;

    public InMemoryReportCache(CachePolicy policy) {
        this(policy.cacheSize());
    }

    /**
     * @param maxSize maximum number of responses kept
     * @throws IllegalArgumentException if maxSize is not positive
     */
    public InMemoryReportCache(int maxSize) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive, got: " + maxSize);
        }

        this.maxSize = maxSize;
        this.responses = new HashMap<>(maxSize);
        this.accessOrder = new ConcurrentLinkedDeque<>();
        this.lock = new ReentrantReadWriteLock();
    }

    @Override
    public boolean exists(String signature) {
        lock.readLock().lock();
        try {
            return responses.containsKey(signature);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public JsonNode get(Query<?> query) {
        String signature = query.signature();
        lock.writeLock().lock();
        try {
            JsonNode response = responses.get(signature);
            if (response == null) {
                return null;
            }
            accessOrder.remove(signature);
            accessOrder.addFirst(signature);
            return response.deepCopy();
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void set(Query<?> query, JsonNode response) {
        String signature = query.signature();
        lock.writeLock().lock();
        try {
            if (responses.containsKey(signature)) {
                accessOrder.remove(signature);
            }

            responses.put(signature, response.deepCopy());
            accessOrder.addFirst(signature);

            while (accessOrder.size() > maxSize) {
                responses.remove(accessOrder.removeLast());
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return responses.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            responses.clear();
            accessOrder.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int getMaxSize() {
        return maxSize;
    }

    /**
     * @return e.g. {@code InMemoryReportCache[size=3, maxSize=1000, utilization=0.3%]}
     */
    public String getStats() {
        lock.readLock().lock();
        try {
            return String.format("InMemoryReportCache[size=%d, maxSize=%d, utilization=%.1f%%]",
                    responses.size(),
                    maxSize,
                    (responses.size() * 100.0) / maxSize
            );
        } finally {
            lock.readLock().unlock();
        }
    }
}
