package com.civicintel.servicerequest.service;

import com.civicintel.servicerequest.config.IngestProperties;
import com.civicintel.servicerequest.model.Dimension;
import com.civicintel.servicerequest.model.ServiceRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Turns free-text dimension labels into surrogate ids, creating rows on first sight.
 *
 * Each dimension has its own bounded cache. Caches live for one ingestion run:
 * {@link #reset()} is called when a run starts, and again after a failed page
 * because its rollback may have discarded rows the cache still points at.
 */
@Component
@Slf4j
public class DimensionResolver {

    private final JdbcTemplate jdbcTemplate;
    private final Map<Dimension, DimensionCache> caches = new EnumMap<>(Dimension.class);
    private long rowsCreated;

    public DimensionResolver(JdbcTemplate jdbcTemplate, IngestProperties properties) {
        this.jdbcTemplate = jdbcTemplate;
        int maxEntries = properties.dimensionCache().maxEntries();
        for (Dimension dimension : Dimension.values()) {
            caches.put(dimension, new DimensionCache(maxEntries));
        }
    }

    /**
     * @return the id for {@code label}, or null for a null/empty label or when the
     *         row cannot be read back after the insert
     */
    public Long resolve(String label, Dimension dimension) {
        if (label == null || label.isEmpty()) {
            return null;
        }

        DimensionCache cache = caches.get(dimension);
        Long cached = cache.get(label);
        if (cached != null) {
            return cached;
        }

        int inserted = jdbcTemplate.update(
                "INSERT OR IGNORE INTO " + dimension.tableName() + "(name) VALUES (?)", label);
        rowsCreated += inserted;

        List<Long> ids = jdbcTemplate.queryForList(
                "SELECT id FROM " + dimension.tableName() + " WHERE name = ?", Long.class, label);
        if (ids.isEmpty()) {
            log.warn("No {} row found for '{}' after insert, leaving reference null", dimension.tableName(), label);
            return null;
        }

        Long id = ids.get(0);
        cache.put(label, id);
        return id;
    }

    /** Resolves all four labels of a record; values are null where the label is absent. */
    public Map<Dimension, Long> resolveAll(ServiceRequest request) {
        Map<Dimension, Long> ids = new EnumMap<>(Dimension.class);
        for (Dimension dimension : Dimension.values()) {
            ids.put(dimension, resolve(dimension.labelOf(request), dimension));
        }
        return ids;
    }

    public void reset() {
        caches.values().forEach(DimensionCache::clear);
        rowsCreated = 0;
    }

    /** Dimension rows inserted since the last reset. */
    public long rowsCreated() {
        return rowsCreated;
    }

    int cachedEntries(Dimension dimension) {
        return caches.get(dimension).size();
    }
}
